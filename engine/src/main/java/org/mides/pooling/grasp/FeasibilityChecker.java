package org.mides.pooling.grasp;

import org.mides.pooling.model.PoolingParameters;
import org.mides.pooling.model.RideRequest;
import org.mides.pooling.model.Route;
import org.mides.pooling.model.Schedule;
import org.mides.pooling.model.Solution;
import org.mides.pooling.model.Stop;
import org.mides.pooling.model.StopType;
import org.mides.pooling.model.ValidationResult;
import org.mides.pooling.model.ViolationKind;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Route and solution invariants: pickup before dropoff, load within
 * [0, capacity], a non-empty vehicle between the first and the last stop,
 * arrivals inside the time windows and ride times within alpha times the
 * direct travel time.
 *
 * <p>Arrivals are computed forward from the earliest window bound of the first
 * stop, waiting when a vehicle is early. The route start is then delayed by
 * the smaller of its forward time slack and its total waiting, which serves a
 * solo trip exactly at the requested time.
 *
 * <p>The checker never mutates what it is given.
 */
public class FeasibilityChecker {

    private static final double EPSILON = 1e-9;

    private final PoolingParameters parameters;
    private final TravelTimeCalculator travelTimes;

    public FeasibilityChecker(PoolingParameters parameters, TravelTimeCalculator travelTimes) {
        this.parameters = parameters;
        this.travelTimes = travelTimes;
    }

    /**
     * Whether the request's own windows admit a trip at its direct travel
     * time. Requests failing this are never inserted anywhere.
     */
    public boolean isServable(RideRequest request) {
        var pickup = request.getPickupWindow();
        var dropoff = request.getDropoffWindow();
        long direct = request.getDirectTravelTime();

        return pickup.startSeconds() <= pickup.endSeconds()
            && dropoff.startSeconds() <= dropoff.endSeconds()
            && pickup.endSeconds() + direct >= dropoff.startSeconds()
            && pickup.startSeconds() + direct <= dropoff.endSeconds();
    }

    /**
     * Marginal route duration of inserting {@code request} with its pickup
     * before the stop at {@code pickupPos} and its dropoff before the stop at
     * {@code dropoffPos} (positions in the current stop list), or empty when
     * the resulting route would break an invariant.
     */
    public OptionalDouble feasibleInsertion(Route route, RideRequest request, int pickupPos, int dropoffPos) {
        var stops = route.getStops();
        int size = stops.size();
        if (pickupPos < 0 || pickupPos > dropoffPos || dropoffPos > size)
            return OptionalDouble.empty();
        if (!isServable(request))
            return OptionalDouble.empty();
        if (!continuityAllows(size, pickupPos, dropoffPos) || !capacityAllows(stops, pickupPos, dropoffPos))
            return OptionalDouble.empty();

        var requests = new RideRequest[size + 2];
        var types = new StopType[size + 2];
        int k = 0;
        for (int i = 0; i <= size; i++) {
            if (i == pickupPos) {
                requests[k] = request;
                types[k++] = StopType.PICKUP;
            }
            if (i == dropoffPos) {
                requests[k] = request;
                types[k++] = StopType.DROPOFF;
            }
            if (i < size) {
                requests[k] = stops.get(i).getRequest();
                types[k++] = stops.get(i).getType();
            }
        }

        var schedule = evaluate(requests, types);
        if (schedule == null)
            return OptionalDouble.empty();
        return OptionalDouble.of(schedule.duration() - route.duration());
    }

    public Optional<Schedule> schedule(Route route) {
        var stops = route.getStops();
        var requests = new RideRequest[stops.size()];
        var types = new StopType[stops.size()];
        for (int i = 0; i < stops.size(); i++) {
            requests[i] = stops.get(i).getRequest();
            types[i] = stops.get(i).getType();
        }
        return Optional.ofNullable(evaluate(requests, types));
    }

    /** Schedule of the route once {@code removed} has left it, aligned with the remaining stops. */
    public Optional<Schedule> scheduleWithout(Route route, RideRequest removed) {
        var remaining = route.getStops().stream()
            .filter(stop -> stop.getRequest().getId() != removed.getId())
            .toList();
        var requests = new RideRequest[remaining.size()];
        var types = new StopType[remaining.size()];
        for (int i = 0; i < remaining.size(); i++) {
            requests[i] = remaining.get(i).getRequest();
            types[i] = remaining.get(i).getType();
        }
        return Optional.ofNullable(evaluate(requests, types));
    }

    /* Appending after the last stop, or a pickup-dropoff pair in front, would leave the vehicle empty mid-trip. */
    private static boolean continuityAllows(int size, int pickupPos, int dropoffPos) {
        if (size == 0)
            return true;
        return pickupPos < size && !(pickupPos == 0 && dropoffPos == 0);
    }

    private boolean capacityAllows(List<Stop> stops, int pickupPos, int dropoffPos) {
        int capacity = parameters.getCapacity();
        int loadBefore = pickupPos == 0 ? 0 : stops.get(pickupPos - 1).getLoad();
        if (loadBefore + 1 > capacity)
            return false;
        for (int i = pickupPos; i < dropoffPos; i++) {
            if (stops.get(i).getLoad() + 1 > capacity)
                return false;
        }
        return true;
    }

    private Schedule evaluate(RideRequest[] requests, StopType[] types) {
        int size = requests.length;
        if (size == 0)
            return new Schedule(new long[0], new int[0]);

        int capacity = parameters.getCapacity();
        var loads = new int[size];
        int load = 0;
        for (int k = 0; k < size; k++) {
            load += types[k] == StopType.PICKUP ? 1 : -1;
            if (load < 0 || load > capacity)
                return null;
            if (load == 0 && k < size - 1)
                return null;
            loads[k] = load;
        }
        if (load != 0)
            return null;

        var travel = new long[size];
        for (int k = 1; k < size; k++) {
            travel[k] = travelTimes.travelTime(
                requests[k - 1].locationOf(types[k - 1]),
                requests[k].locationOf(types[k]));
        }

        long start = requests[0].windowOf(types[0]).startSeconds();
        var arrivals = forwardPass(requests, types, travel, start);
        if (arrivals == null)
            return null;

        long slack = Long.MAX_VALUE;
        long waiting = 0;
        for (int k = 0; k < size; k++) {
            if (k > 0)
                waiting += arrivals[k] - (arrivals[k - 1] + travel[k]);
            slack = Math.min(slack, waiting + requests[k].windowOf(types[k]).endSeconds() - arrivals[k]);
        }
        long shift = Math.min(slack, waiting);
        if (shift > 0) {
            arrivals = forwardPass(requests, types, travel, start + shift);
            if (arrivals == null)
                return null;
        }

        for (int k = 0; k < size; k++) {
            if (types[k] != StopType.DROPOFF)
                continue;
            int pickup = pickupIndex(requests, types, k);
            if (pickup < 0)
                return null;
            if (exceedsDetour(requests[k], arrivals[k] - arrivals[pickup]))
                return null;
        }

        return new Schedule(arrivals, loads);
    }

    private static long[] forwardPass(RideRequest[] requests, StopType[] types, long[] travel, long start) {
        var arrivals = new long[requests.length];
        for (int k = 0; k < requests.length; k++) {
            var window = requests[k].windowOf(types[k]);
            long arrival = k == 0 ? start : Math.max(window.startSeconds(), arrivals[k - 1] + travel[k]);
            if (arrival > window.endSeconds())
                return null;
            arrivals[k] = arrival;
        }
        return arrivals;
    }

    private static int pickupIndex(RideRequest[] requests, StopType[] types, int dropoffIndex) {
        int id = requests[dropoffIndex].getId();
        for (int j = dropoffIndex - 1; j >= 0; j--) {
            if (types[j] == StopType.PICKUP && requests[j].getId() == id)
                return j;
        }
        return -1;
    }

    private boolean exceedsDetour(RideRequest request, long rideTime) {
        return rideTime > parameters.getAlpha() * request.getDirectTravelTime() + EPSILON;
    }

    /**
     * Full re-check of a solution from the stored arrival times and loads.
     * Returns the first violation found.
     */
    public ValidationResult validateSolution(Solution solution) {
        var known = new HashMap<Integer, RideRequest>();
        for (var request : solution.getRequests()) {
            if (known.put(request.getId(), request) != null)
                return ValidationResult.violation(ViolationKind.COVERAGE,
                    "request id " + request.getId() + " is used twice in the instance");
        }

        var placed = new HashSet<Integer>();
        for (int r = 0; r < solution.getRoutes().size(); r++) {
            var route = solution.getRoutes().get(r);
            var result = validateCoverage(solution, route, r, known, placed);
            if (!result.isValid())
                return result;
            result = validateRoute(route, r);
            if (!result.isValid())
                return result;
        }

        for (var request : solution.getUnassigned()) {
            if (!known.containsKey(request.getId()))
                return ValidationResult.violation(ViolationKind.COVERAGE,
                    "unassigned request " + request.getId() + " is not part of the instance");
            if (!placed.add(request.getId()))
                return ValidationResult.violation(ViolationKind.COVERAGE,
                    "request " + request.getId() + " is both routed and unassigned");
        }

        if (placed.size() != known.size())
            return ValidationResult.violation(ViolationKind.COVERAGE,
                String.format("%d of %d requests are neither routed nor unassigned",
                    known.size() - placed.size(), known.size()));

        return ValidationResult.ok();
    }

    private ValidationResult validateCoverage(
        Solution solution,
        Route route,
        int routeIndex,
        Map<Integer, RideRequest> known,
        Set<Integer> placed)
    {
        if (route.isEmpty())
            return ValidationResult.violation(ViolationKind.COVERAGE, "route " + routeIndex + " is empty");

        var pickups = new HashMap<Integer, Integer>();
        var dropoffs = new HashMap<Integer, Integer>();
        for (var stop : route.getStops()) {
            var counts = stop.isPickup() ? pickups : dropoffs;
            counts.merge(stop.getRequest().getId(), 1, Integer::sum);
        }

        for (var id : pickups.keySet()) {
            if (!known.containsKey(id))
                return ValidationResult.violation(ViolationKind.COVERAGE,
                    "route " + routeIndex + " serves unknown request " + id);
            if (pickups.get(id) != 1 || dropoffs.getOrDefault(id, 0) != 1)
                return ValidationResult.violation(ViolationKind.COVERAGE,
                    "request " + id + " does not have exactly one pickup and one dropoff in route " + routeIndex);
            if (!placed.add(id))
                return ValidationResult.violation(ViolationKind.COVERAGE,
                    "request " + id + " is served by more than one route");
            if (solution.routeOf(known.get(id)) != route)
                return ValidationResult.violation(ViolationKind.COVERAGE,
                    "request " + id + " is indexed to another route than route " + routeIndex);
        }
        for (var id : dropoffs.keySet()) {
            if (!pickups.containsKey(id))
                return ValidationResult.violation(ViolationKind.ORDERING,
                    "request " + id + " is dropped off without a pickup in route " + routeIndex);
        }
        return ValidationResult.ok();
    }

    private ValidationResult validateRoute(Route route, int routeIndex) {
        var stops = route.getStops();
        var pickupTimes = new HashMap<Integer, Long>();
        int load = 0;

        for (int k = 0; k < stops.size(); k++) {
            var stop = stops.get(k);
            var request = stop.getRequest();

            if (!stop.isPickup() && !pickupTimes.containsKey(request.getId()))
                return ValidationResult.violation(ViolationKind.ORDERING,
                    "request " + request.getId() + " is dropped off before its pickup in route " + routeIndex);

            load += stop.isPickup() ? 1 : -1;
            if (load < 0 || load > parameters.getCapacity() || stop.getLoad() != load)
                return ValidationResult.violation(ViolationKind.CAPACITY,
                    String.format("load %d (stored %d) after stop %d of route %d, capacity %d",
                        load, stop.getLoad(), k, routeIndex, parameters.getCapacity()));
            if (load == 0 && k < stops.size() - 1)
                return ValidationResult.violation(ViolationKind.CONTINUITY,
                    "vehicle of route " + routeIndex + " runs empty after stop " + k);

            if (!stop.getWindow().contains(stop.getArrivalTime()))
                return ValidationResult.violation(ViolationKind.TIME_WINDOW,
                    String.format("stop %d of route %d arrives at %d outside [%d, %d]",
                        k, routeIndex, stop.getArrivalTime(),
                        stop.getWindow().startSeconds(), stop.getWindow().endSeconds()));
            if (k > 0) {
                var previous = stops.get(k - 1);
                long travel = travelTimes.travelTime(previous.getCoordinates(), stop.getCoordinates());
                if (stop.getArrivalTime() < previous.getArrivalTime() + travel)
                    return ValidationResult.violation(ViolationKind.TIME_WINDOW,
                        String.format("stop %d of route %d is reached faster than its %d s travel time",
                            k, routeIndex, travel));
            }

            if (stop.isPickup()) {
                pickupTimes.put(request.getId(), stop.getArrivalTime());
            } else {
                long pickupTime = pickupTimes.get(request.getId());
                if (exceedsDetour(request, stop.getArrivalTime() - pickupTime))
                    return ValidationResult.violation(ViolationKind.DETOUR,
                        String.format("request %d rides %d s for a %d s direct trip (alpha %.2f)",
                            request.getId(), stop.getArrivalTime() - pickupTime,
                            request.getDirectTravelTime(), parameters.getAlpha()));
            }
        }
        return ValidationResult.ok();
    }
}
