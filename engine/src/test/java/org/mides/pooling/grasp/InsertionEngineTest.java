package org.mides.pooling.grasp;

import org.junit.jupiter.api.Test;
import org.mides.pooling.RequestFixtures;
import org.mides.pooling.model.InsertionMethod;
import org.mides.pooling.model.ObjectiveMode;
import org.mides.pooling.model.PoolingParameters;
import org.mides.pooling.model.Route;
import org.mides.pooling.model.Solution;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class InsertionEngineTest {

    private static InsertionEngine engine(PoolingParameters parameters) {
        var checker = new FeasibilityChecker(parameters, new TravelTimeCalculator(parameters.getSpeed()));
        return InsertionEngine.create(parameters, checker, new Random(parameters.getSeed()));
    }

    private static FeasibilityChecker checker(PoolingParameters parameters) {
        return new FeasibilityChecker(parameters, new TravelTimeCalculator(parameters.getSpeed()));
    }

    @Test
    void create_shouldFollowInsertionMethod() {
        var exhaustive = RequestFixtures.parameters().build();
        var randomized = RequestFixtures.parameters().insertionMethod(InsertionMethod.RANDOMIZED_RESTRICTED).build();

        assertInstanceOf(ExhaustiveInsertion.class, engine(exhaustive));
        assertInstanceOf(RandomizedRestrictedInsertion.class, engine(randomized));
    }

    @Test
    void exhaustive_compatibleTrio_shouldPoolTwoRequests() {
        var parameters = RequestFixtures.parameters().build();
        var solution = Solution.unassigned(RequestFixtures.compatibleTrio());

        int inserted = engine(parameters).insertUnassigned(solution, Deadline.none());

        assertEquals(3, inserted);
        assertTrue(solution.getUnassigned().isEmpty());
        assertEquals(2, solution.getRoutes().size());
        assertEquals(2, solution.getRoutes().get(0).requestCount());
        assertEquals(1, solution.getRoutes().get(1).requestCount());
        assertTrue(checker(parameters).validateSolution(solution).isValid());
    }

    @Test
    void exhaustive_capacityOne_shouldServeEveryRequestAlone() {
        var parameters = RequestFixtures.parameters().capacity(1).objective(ObjectiveMode.SERVED).build();
        var solution = Solution.unassigned(RequestFixtures.compatibleTrio());

        engine(parameters).insertUnassigned(solution, Deadline.none());

        assertEquals(3, solution.getRoutes().size());
        solution.getRoutes().forEach(route -> assertEquals(1, route.requestCount()));
        assertTrue(checker(parameters).validateSolution(solution).isValid());
    }

    @Test
    void insertUnassigned_nothingInsertable_shouldTerminate() {
        var parameters = RequestFixtures.parameters().build();
        var solution = Solution.unassigned(List.of(RequestFixtures.inconsistent(1), RequestFixtures.inconsistent(2)));

        int inserted = engine(parameters).insertUnassigned(solution, Deadline.none());

        assertEquals(0, inserted);
        assertEquals(2, solution.getUnassigned().size());
        assertTrue(solution.getRoutes().isEmpty());
    }

    @Test
    void randomized_shouldPlaceEveryServableRequest() {
        var parameters = RequestFixtures.parameters()
            .insertionMethod(InsertionMethod.RANDOMIZED_RESTRICTED)
            .beta(1.0)
            .build();
        var requests = new ArrayList<>(RequestFixtures.compatibleTrio());
        requests.add(RequestFixtures.inconsistent(4));
        var solution = Solution.unassigned(requests);

        int inserted = engine(parameters).insertUnassigned(solution, Deadline.none());

        assertEquals(3, inserted);
        assertEquals(List.of(4), solution.getUnassignedIds());
        assertTrue(checker(parameters).validateSolution(solution).isValid());
    }

    @Test
    void restrictedListSize_shouldKeepAtLeastOneCandidate() {
        var parameters = RequestFixtures.parameters().insertionMethod(InsertionMethod.RANDOMIZED_RESTRICTED).beta(0.1).build();
        var engine = (RandomizedRestrictedInsertion) engine(parameters);

        assertEquals(1, engine.restrictedListSize(1));
        assertEquals(1, engine.restrictedListSize(10));
        assertEquals(3, engine.restrictedListSize(25));
    }

    @Test
    void insertUnassigned_expiredDeadline_shouldInsertNothing() {
        var parameters = RequestFixtures.parameters().build();
        var solution = Solution.unassigned(RequestFixtures.compatibleTrio());
        var deadline = Deadline.none();
        deadline.cancel();

        assertEquals(0, engine(parameters).insertUnassigned(solution, deadline));
        assertEquals(3, solution.getUnassigned().size());
    }

    @Test
    void bestInsertionInto_newRoute_shouldCostTheDirectTrip() {
        var parameters = RequestFixtures.parameters().build();
        var request = RequestFixtures.compatibleTrio().get(0);

        var candidate = engine(parameters).bestInsertionInto(null, request);

        assertTrue(candidate.isPresent());
        assertTrue(candidate.get().opensRoute());
        assertEquals(request.getDirectTravelTime(), candidate.get().getCost(), 1e-9);

        Route route = engine(parameters).apply(request, candidate.get());
        assertEquals(request.getDirectTravelTime(), route.duration());
    }
}
