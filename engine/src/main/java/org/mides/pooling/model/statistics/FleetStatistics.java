package org.mides.pooling.model.statistics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class FleetStatistics {

    @JsonProperty("routes")
    int routes;

    @JsonProperty("mean_requests_per_route")
    double meanRequestsPerRoute;

    @JsonProperty("max_requests_per_route")
    int maxRequestsPerRoute;
}
