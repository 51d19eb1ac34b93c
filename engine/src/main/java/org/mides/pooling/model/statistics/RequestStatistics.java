package org.mides.pooling.model.statistics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/** Service figures of one pooled request, times in seconds. */
@Value
@Builder
public class RequestStatistics {

    @JsonProperty("ride_id")
    int rideId;

    /* Dropoff arrival minus the arrival of the direct trip. */
    @JsonProperty("delay")
    long delay;

    @JsonProperty("delay_percentage")
    double delayPercentage;

    @JsonProperty("price_saving_percentage")
    double priceSavingPercentage;

    /* Requested pickup time minus the realized pickup. */
    @JsonProperty("pickup_advance")
    long pickupAdvance;

    @JsonProperty("pickup_advance_percentage")
    double pickupAdvancePercentage;
}
