package org.mides.pooling.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.pooling.converter.SecondsSerializer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One shared vehicle trip: an ordered stop sequence in which the vehicle is
 * never empty between its first and last stop. Arrival times and loads of the
 * stops are only meaningful after {@link #applySchedule(Schedule)}.
 */
@Data
@NoArgsConstructor
public class Route {

    @JsonProperty("stops")
    private List<Stop> stops = new ArrayList<>();

    public Route(List<Stop> stops) {
        this.stops = stops;
    }

    @JsonProperty("requests")
    public int requestCount() {
        return stops.size() / 2;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return stops.isEmpty();
    }

    @JsonIgnore
    public boolean isPooled() {
        return requestCount() >= 2;
    }

    @JsonProperty("duration")
    @JsonSerialize(using = SecondsSerializer.class)
    public long duration() {
        if (stops.isEmpty())
            return 0;
        return stops.get(stops.size() - 1).getArrivalTime() - stops.get(0).getArrivalTime();
    }

    @JsonIgnore
    public Set<RideRequest> getRequests() {
        var requests = new LinkedHashSet<RideRequest>();
        for (Stop stop : stops)
            requests.add(stop.getRequest());
        return requests;
    }

    public boolean contains(RideRequest request) {
        return indexOf(request, StopType.PICKUP) >= 0;
    }

    public int indexOf(RideRequest request, StopType type) {
        for (int i = 0; i < stops.size(); i++) {
            var stop = stops.get(i);
            if (stop.getType() == type && stop.getRequest().getId() == request.getId())
                return i;
        }
        return -1;
    }

    /**
     * Inserts the request's stops so that the pickup lands before the stop
     * currently at {@code pickupPos} and the dropoff before the stop currently
     * at {@code dropoffPos}. The caller refreshes the schedule afterwards.
     */
    public void insert(RideRequest request, int pickupPos, int dropoffPos) {
        if (pickupPos < 0 || pickupPos > dropoffPos || dropoffPos > stops.size())
            throw new IndexOutOfBoundsException(
                String.format("Invalid insertion positions (%d, %d) for a route of %d stops",
                    pickupPos, dropoffPos, stops.size()));

        stops.add(dropoffPos, new Stop(request, StopType.DROPOFF));
        stops.add(pickupPos, new Stop(request, StopType.PICKUP));
    }

    public boolean remove(RideRequest request) {
        return stops.removeIf(stop -> stop.getRequest().getId() == request.getId());
    }

    public void applySchedule(Schedule schedule) {
        if (schedule.getArrivals().length != stops.size())
            throw new IllegalArgumentException("Schedule does not match the route stops");

        for (int i = 0; i < stops.size(); i++) {
            stops.get(i).setArrivalTime(schedule.getArrivals()[i]);
            stops.get(i).setLoad(schedule.getLoads()[i]);
        }
    }

    public Route copy() {
        var copied = new ArrayList<Stop>(stops.size());
        for (Stop stop : stops)
            copied.add(stop.copy());
        return new Route(copied);
    }
}
