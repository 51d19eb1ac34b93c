package org.mides.pooling.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class Problem {

    @NotEmpty
    @Valid
    @JsonProperty("trips")
    private List<TripRecord> trips = new ArrayList<>();

    /* Falls back to the application defaults when absent. */
    @JsonProperty("parameters")
    private PoolingParameters parameters;
}
