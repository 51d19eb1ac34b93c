package org.mides.pooling.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A trip request of the static instance. Requests are built once when the
 * instance is loaded and shared read-only by every solution of a run, so they
 * carry no mutable state. Identity is the id, which also orders requests by
 * their original pickup time.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class RideRequest implements Comparable<RideRequest> {

    @EqualsAndHashCode.Include
    @JsonProperty("id")
    private final int id;

    @JsonProperty("pickup_window")
    private final TimeWindow pickupWindow;

    @JsonProperty("dropoff_window")
    private final TimeWindow dropoffWindow;

    @JsonProperty("pickup")
    private final Coordinate pickup;

    @JsonProperty("dropoff")
    private final Coordinate dropoff;

    /* Seconds of a solo trip from pickup to dropoff. */
    @JsonProperty("direct_travel_time")
    private final long directTravelTime;

    @JsonProperty("direct_fare")
    private final double directFare;

    @Builder(toBuilder = true)
    @JsonCreator
    public RideRequest(
        @JsonProperty("id") int id,
        @JsonProperty("pickup_window") TimeWindow pickupWindow,
        @JsonProperty("dropoff_window") TimeWindow dropoffWindow,
        @JsonProperty("pickup") Coordinate pickup,
        @JsonProperty("dropoff") Coordinate dropoff,
        @JsonProperty("direct_travel_time") long directTravelTime,
        @JsonProperty("direct_fare") double directFare)
    {
        this.id = id;
        this.pickupWindow = pickupWindow;
        this.dropoffWindow = dropoffWindow;
        this.pickup = pickup;
        this.dropoff = dropoff;
        this.directTravelTime = directTravelTime;
        this.directFare = directFare;
    }

    public TimeWindow windowOf(StopType type) {
        return type == StopType.PICKUP ? pickupWindow : dropoffWindow;
    }

    public Coordinate locationOf(StopType type) {
        return type == StopType.PICKUP ? pickup : dropoff;
    }

    @Override
    public int compareTo(RideRequest other) {
        return Integer.compare(id, other.id);
    }

    @Override
    public String toString() {
        return "R" + id;
    }
}
