package org.mides.pooling.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.pooling.converter.SecondsSerializer;
import org.mides.pooling.converter.StopTypeSerializer;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Stop {

    @JsonIgnore
    private RideRequest request;

    @JsonProperty("type")
    @JsonSerialize(using = StopTypeSerializer.class)
    private StopType type;

    @JsonProperty("arrival_time")
    @JsonSerialize(using = SecondsSerializer.class)
    private long arrivalTime;

    /* Occupied seats once this stop is served. */
    @JsonProperty("load")
    private int load;

    public Stop(RideRequest request, StopType type) {
        this(request, type, 0, 0);
    }

    @JsonProperty("ride_id")
    public int getRideId() {
        return request.getId();
    }

    @JsonProperty("coordinates")
    public Coordinate getCoordinates() {
        return request.locationOf(type);
    }

    @JsonIgnore
    public TimeWindow getWindow() {
        return request.windowOf(type);
    }

    @JsonIgnore
    public boolean isPickup() {
        return type == StopType.PICKUP;
    }

    public Stop copy() {
        return new Stop(request, type, arrivalTime, load);
    }
}
