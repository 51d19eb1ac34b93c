package org.mides.pooling.data;

import org.mides.pooling.grasp.TravelTimeCalculator;
import org.mides.pooling.model.PoolingParameters;
import org.mides.pooling.model.RideRequest;
import org.mides.pooling.model.TimeWindow;
import org.mides.pooling.model.TripRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns trip records into ride requests. The pickup window closes at the
 * requested time and the dropoff window opens at the arrival of the direct
 * trip; both last {@code timeWindow}.
 */
public class RequestFactory {

    private static final Logger logger = LoggerFactory.getLogger(RequestFactory.class);

    private final PoolingParameters parameters;
    private final TravelTimeCalculator travelTimes;

    public RequestFactory(PoolingParameters parameters) {
        this.parameters = parameters;
        this.travelTimes = new TravelTimeCalculator(parameters.getSpeed());
    }

    public List<RideRequest> create(List<TripRecord> trips) {
        return create(trips, null);
    }

    /**
     * Ids are 1..n in pickup-time order. With a {@code timeframe}, only the
     * requests whose pickup window opens before the first one's start plus
     * the timeframe are kept.
     */
    public List<RideRequest> create(List<TripRecord> trips, Duration timeframe) {
        var sorted = new ArrayList<>(trips);
        sorted.sort(Comparator.comparing(TripRecord::getPickupTime));

        long margin = parameters.getTimeWindow().getSeconds();
        var requests = new ArrayList<RideRequest>(sorted.size());
        Long origin = null;

        for (var trip : sorted) {
            long requested = trip.getPickupTime().getSeconds();
            long direct = travelTimes.travelTime(trip.getPickup(), trip.getDropoff());
            var pickupWindow = TimeWindow.ofSeconds(requested - margin, requested);

            if (origin == null)
                origin = pickupWindow.startSeconds();
            if (timeframe != null && pickupWindow.startSeconds() >= origin + timeframe.getSeconds())
                break;

            requests.add(RideRequest.builder()
                .id(requests.size() + 1)
                .pickupWindow(pickupWindow)
                .dropoffWindow(TimeWindow.ofSeconds(requested + direct, requested + direct + margin))
                .pickup(trip.getPickup())
                .dropoff(trip.getDropoff())
                .directTravelTime(direct)
                .directFare(directFare(trip))
                .build());
        }

        logger.info("Created {} ride requests from {} trips{}", requests.size(), trips.size(),
            timeframe == null ? "" : " within a timeframe of " + timeframe);
        return requests;
    }

    /* The recorded fare when there is one, the tariff over the direct distance otherwise. */
    private double directFare(TripRecord trip) {
        if (trip.getFare() != null && trip.getFare() > 0)
            return trip.getFare();
        return parameters.getFareBase()
            + parameters.getFarePerKm() * travelTimes.distanceKm(trip.getPickup(), trip.getDropoff());
    }
}
