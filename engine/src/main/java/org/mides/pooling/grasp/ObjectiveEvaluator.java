package org.mides.pooling.grasp;

import org.mides.pooling.model.ObjectiveMode;
import org.mides.pooling.model.PoolingParameters;
import org.mides.pooling.model.Route;
import org.mides.pooling.model.Solution;
import org.mides.pooling.model.StopType;
import org.mides.pooling.model.statistics.FleetStatistics;
import org.mides.pooling.model.statistics.RequestStatistics;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores solutions and derives the per-request figures reported for a pooled
 * solution.
 */
public class ObjectiveEvaluator {

    private final PoolingParameters parameters;
    private final TravelTimeCalculator travelTimes;

    public ObjectiveEvaluator(PoolingParameters parameters, TravelTimeCalculator travelTimes) {
        this.parameters = parameters;
        this.travelTimes = travelTimes;
    }

    /**
     * Number of requests served in a shared route, or of all routed requests
     * when the objective is {@link ObjectiveMode#SERVED}.
     */
    public int score(Solution solution) {
        int score = 0;
        for (var route : solution.getRoutes()) {
            if (parameters.getObjective() == ObjectiveMode.SERVED || route.isPooled())
                score += route.requestCount();
        }
        return score;
    }

    public int upperBound(Solution solution) {
        return solution.getRequestCount();
    }

    /** Figures for every request riding in a shared route, in route order. */
    public List<RequestStatistics> requestStatistics(Solution solution) {
        var statistics = new ArrayList<RequestStatistics>();
        for (var route : solution.getRoutes()) {
            if (route.isPooled())
                statistics.addAll(requestStatistics(route));
        }
        return statistics;
    }

    private List<RequestStatistics> requestStatistics(Route route) {
        var requests = route.getRequests();
        double routeFare = parameters.getFareBase() + parameters.getFarePerKm() * distanceKm(route);
        long totalDirect = requests.stream().mapToLong(r -> r.getDirectTravelTime()).sum();

        var statistics = new ArrayList<RequestStatistics>(requests.size());
        for (var request : requests) {
            double share = totalDirect > 0
                ? routeFare * request.getDirectTravelTime() / totalDirect
                : routeFare / requests.size();
            double pooledPrice = Math.min(share, request.getDirectFare() / parameters.getAlpha());
            double saving = request.getDirectFare() > 0
                ? (1.0 - pooledPrice / request.getDirectFare()) * 100.0
                : 0.0;

            long pickupArrival = route.getStops().get(route.indexOf(request, StopType.PICKUP)).getArrivalTime();
            long dropoffArrival = route.getStops().get(route.indexOf(request, StopType.DROPOFF)).getArrivalTime();

            long delay = dropoffArrival - request.getDropoffWindow().startSeconds();
            long advance = request.getPickupWindow().endSeconds() - pickupArrival;
            long windowLength = request.getPickupWindow().lengthSeconds();

            statistics.add(RequestStatistics.builder()
                .rideId(request.getId())
                .delay(delay)
                .delayPercentage(request.getDirectTravelTime() > 0
                    ? delay * 100.0 / request.getDirectTravelTime()
                    : 0.0)
                .priceSavingPercentage(saving)
                .pickupAdvance(advance)
                .pickupAdvancePercentage(windowLength > 0 ? advance * 100.0 / windowLength : 0.0)
                .build());
        }
        return statistics;
    }

    public FleetStatistics fleetStatistics(Solution solution) {
        int routes = solution.getRoutes().size();
        int max = solution.getRoutes().stream().mapToInt(Route::requestCount).max().orElse(0);
        double mean = routes == 0 ? 0.0 : (double) solution.getAssignedCount() / routes;
        return new FleetStatistics(routes, mean, max);
    }

    private double distanceKm(Route route) {
        var stops = route.getStops();
        double km = 0.0;
        for (int k = 1; k < stops.size(); k++)
            km += travelTimes.distanceKm(stops.get(k - 1).getCoordinates(), stops.get(k).getCoordinates());
        return km;
    }
}
