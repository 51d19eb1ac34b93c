package org.mides.pooling.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.pooling.converter.DurationDeserializer;
import org.mides.pooling.converter.DurationSerializer;

import java.time.Duration;

/**
 * A raw historical trip: when the rider asked to leave, from where and to
 * where. Time windows and direct figures are derived by the request factory.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TripRecord {

    @NotNull
    @JsonProperty("pickup_time")
    @JsonSerialize(using = DurationSerializer.class)
    @JsonDeserialize(using = DurationDeserializer.class)
    private Duration pickupTime;

    @NotNull
    @Valid
    @JsonProperty("pickup")
    private Coordinate pickup;

    @NotNull
    @Valid
    @JsonProperty("dropoff")
    private Coordinate dropoff;

    /* Recorded fare, when the source has one. */
    @JsonProperty("fare")
    private Double fare;
}
