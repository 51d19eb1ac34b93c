package org.mides.pooling.grasp;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mides.pooling.RequestFixtures;
import org.mides.pooling.model.Coordinate;
import org.mides.pooling.model.PoolingParameters;
import org.mides.pooling.model.RideRequest;
import org.mides.pooling.model.Route;
import org.mides.pooling.model.Solution;
import org.mides.pooling.model.ViolationKind;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mides.pooling.RequestFixtures.REQUESTED_TIME;

class FeasibilityCheckerTest {

    private PoolingParameters parameters;
    private FeasibilityChecker checker;
    private List<RideRequest> trio;

    @BeforeEach
    void setUp() {
        parameters = RequestFixtures.parameters().build();
        checker = checker(parameters);
        trio = RequestFixtures.compatibleTrio();
    }

    private static FeasibilityChecker checker(PoolingParameters parameters) {
        return new FeasibilityChecker(parameters, new TravelTimeCalculator(parameters.getSpeed()));
    }

    private Route scheduled(FeasibilityChecker checker, Route route) {
        route.applySchedule(checker.schedule(route).orElseThrow());
        return route;
    }

    private Route solo(RideRequest request) {
        var route = new Route();
        route.insert(request, 0, 0);
        return scheduled(checker, route);
    }

    @Test
    void schedule_soloTrip_shouldPickUpAtRequestedTimeAndRideDirect() {
        var request = trio.get(0);

        var route = solo(request);

        assertEquals(REQUESTED_TIME, route.getStops().get(0).getArrivalTime());
        assertEquals(REQUESTED_TIME + request.getDirectTravelTime(), route.getStops().get(1).getArrivalTime());
        assertEquals(request.getDirectTravelTime(), route.duration());
        assertEquals(1, route.getStops().get(0).getLoad());
        assertEquals(0, route.getStops().get(1).getLoad());
    }

    @Test
    void feasibleInsertion_nearbyRider_shouldCostLessThanASoloTrip() {
        var route = solo(trio.get(0));

        var cost = checker.feasibleInsertion(route, trio.get(1), 1, 1);

        assertTrue(cost.isPresent());
        assertTrue(cost.getAsDouble() < trio.get(1).getDirectTravelTime());
    }

    @Test
    void feasibleInsertion_afterLastStop_shouldBreakContinuity() {
        var route = solo(trio.get(0));

        assertTrue(checker.feasibleInsertion(route, trio.get(1), 2, 2).isEmpty());
        assertTrue(checker.feasibleInsertion(route, trio.get(1), 0, 0).isEmpty());
    }

    @Test
    void feasibleInsertion_overlappingRiders_shouldRespectCapacity() {
        var single = checker(parameters.toBuilder().capacity(1).build());
        var route = new Route();
        route.insert(trio.get(0), 0, 0);
        scheduled(single, route);

        for (int p = 0; p <= 2; p++) {
            for (int d = p; d <= 2; d++)
                assertTrue(single.feasibleInsertion(route, trio.get(1), p, d).isEmpty());
        }
    }

    @Test
    void feasibleInsertion_detourAboveAlpha_shouldBeRejected() {
        var far = RequestFixtures.request(1, Coordinate.of(40.7500, -73.9900), RequestFixtures.COMMON_DROPOFF, REQUESTED_TIME);
        var onTheWay = RequestFixtures.request(2, Coordinate.of(40.7600, -73.9900), RequestFixtures.COMMON_DROPOFF, REQUESTED_TIME);

        var strict = checker(parameters.toBuilder().alpha(1.01).build());
        var route = new Route();
        route.insert(far, 0, 0);
        scheduled(strict, route);
        assertTrue(strict.feasibleInsertion(route, onTheWay, 1, 1).isEmpty());

        var lenient = checker(parameters.toBuilder().alpha(3.0).build());
        var lenientRoute = new Route();
        lenientRoute.insert(far, 0, 0);
        scheduled(lenient, lenientRoute);
        assertTrue(lenient.feasibleInsertion(lenientRoute, onTheWay, 1, 1).isPresent());
    }

    @Test
    void feasibleInsertion_shouldNotMutateRoute() {
        var route = solo(trio.get(0));
        var before = route.copy();

        checker.feasibleInsertion(route, trio.get(1), 1, 2);

        assertEquals(before, route);
    }

    @Test
    void isServable_inconsistentWindows_shouldBeFalse() {
        assertTrue(checker.isServable(trio.get(0)));
        assertFalse(checker.isServable(RequestFixtures.inconsistent(4)));
        assertTrue(checker.feasibleInsertion(new Route(), RequestFixtures.inconsistent(4), 0, 0).isEmpty());
    }

    @Test
    void scheduleWithout_shouldScheduleRemainingStops() {
        var route = solo(trio.get(0));
        route.insert(trio.get(1), 1, 1);
        scheduled(checker, route);

        var schedule = checker.scheduleWithout(route, trio.get(1));

        assertTrue(schedule.isPresent());
        assertEquals(2, schedule.get().getArrivals().length);
        assertEquals(trio.get(0).getDirectTravelTime(), schedule.get().duration());
    }

    @Test
    void validateSolution_consistentSolution_shouldBeValid() {
        var solution = Solution.unassigned(trio);
        var pooled = solo(trio.get(0));
        pooled.insert(trio.get(1), 1, 1);
        solution.commitRoute(null, scheduled(checker, pooled));

        var result = checker.validateSolution(solution);

        assertTrue(result.isValid(), result.toString());
    }

    @Test
    void validateSolution_arrivalOutsideWindow_shouldReportTimeWindow() {
        var solution = Solution.unassigned(trio);
        var route = solo(trio.get(0));
        route.getStops().get(0).setArrivalTime(REQUESTED_TIME + 60);
        route.getStops().get(1).setArrivalTime(REQUESTED_TIME + 60 + trio.get(0).getDirectTravelTime());
        solution.commitRoute(null, route);

        assertEquals(ViolationKind.TIME_WINDOW, checker.validateSolution(solution).getKind());
    }

    @Test
    void validateSolution_longRide_shouldReportDetour() {
        var solution = Solution.unassigned(trio);
        var request = trio.get(0);
        var route = solo(request);
        route.getStops().get(1).setArrivalTime(request.getDropoffWindow().endSeconds());
        solution.commitRoute(null, route);

        assertEquals(ViolationKind.DETOUR, checker.validateSolution(solution).getKind());
    }

    @Test
    void validateSolution_wrongStoredLoad_shouldReportCapacity() {
        var solution = Solution.unassigned(trio);
        var route = solo(trio.get(0));
        route.getStops().get(0).setLoad(5);
        solution.commitRoute(null, route);

        assertEquals(ViolationKind.CAPACITY, checker.validateSolution(solution).getKind());
    }

    @Test
    void validateSolution_routedAndPooledRequest_shouldReportCoverage() {
        var solution = Solution.unassigned(trio);
        solution.commitRoute(null, solo(trio.get(0)));
        solution.getUnassigned().add(trio.get(0));

        assertEquals(ViolationKind.COVERAGE, checker.validateSolution(solution).getKind());
    }

    @Test
    void validateSolution_dropoffBeforePickup_shouldReportOrdering() {
        var solution = Solution.unassigned(trio);
        var route = solo(trio.get(0));
        Collections.reverse(route.getStops());
        solution.commitRoute(null, route);

        var result = checker.validateSolution(solution);

        assertEquals(ViolationKind.ORDERING, result.getKind(), result.toString());
    }

    @Test
    void validateSolution_tripsChainedBackToBack_shouldReportContinuity() {
        var solution = Solution.unassigned(trio);
        var route = solo(trio.get(0));
        route.insert(trio.get(1), 2, 2);
        route.getStops().get(2).setLoad(1);
        route.getStops().get(3).setLoad(0);
        solution.commitRoute(null, route);

        var result = checker.validateSolution(solution);

        assertEquals(ViolationKind.CONTINUITY, result.getKind(), result.toString());
    }
}
