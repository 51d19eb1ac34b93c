package org.mides.pooling.grasp;

import org.mides.pooling.model.PoolingParameters;
import org.mides.pooling.model.RideRequest;
import org.mides.pooling.model.Route;
import org.mides.pooling.model.Solution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Alternates re-insertion of the pool with diversification moves. The best
 * solution seen during the search is what the caller gets back.
 */
public class LocalSearchEngine {

    private static final Logger logger = LoggerFactory.getLogger(LocalSearchEngine.class);

    private final PoolingParameters parameters;
    private final InsertionEngine insertion;
    private final MoveOperator moves;
    private final ObjectiveEvaluator evaluator;
    private final Random random;

    public LocalSearchEngine(
        PoolingParameters parameters,
        InsertionEngine insertion,
        MoveOperator moves,
        ObjectiveEvaluator evaluator,
        Random random)
    {
        this.parameters = parameters;
        this.insertion = insertion;
        this.moves = moves;
        this.evaluator = evaluator;
        this.random = random;
    }

    /**
     * Improves {@code solution} in place.
     *
     * @return the objective of the solution on return, never below the input's
     */
    public int improve(Solution solution, Deadline deadline) {
        int upperBound = evaluator.upperBound(solution);
        var best = solution.copy();
        int bestScore = evaluator.score(solution);

        for (int round = 0; round < parameters.getMaxLocalSearchRounds(); round++) {
            if (bestScore >= upperBound || deadline.isExpired())
                break;

            int before = evaluator.score(solution);
            insertion.insertUnassigned(solution, deadline);
            int after = evaluator.score(solution);

            if (after <= before && !deadline.isExpired()) {
                int moved = diversify(solution, deadline);
                after = evaluator.score(solution);
                logger.debug("Round {}: no gain from insertion, {} diversification moves, objective {}",
                    round, moved, after);
            }

            if (after > bestScore) {
                best = solution.copy();
                bestScore = after;
            }
        }

        if (evaluator.score(solution) < bestScore)
            solution.restore(best);
        return evaluator.score(solution);
    }

    /** Relocates or swaps a few assigned requests; returns the number of committed moves. */
    int diversify(Solution solution, Deadline deadline) {
        if (solution.getRoutes().size() < 2)
            return 0;

        int quota = (int) Math.round(parameters.getSwapFraction() * solution.getAssignedCount());
        if (parameters.getSwapFraction() > 0.0)
            quota = Math.max(1, quota);

        int committed = 0;
        for (var request : targets(solution, quota)) {
            if (deadline.isExpired())
                break;
            for (int attempt = 0; attempt < parameters.getSwapAttemptBudget(); attempt++) {
                var source = solution.routeOf(request);
                var target = randomOtherRoute(solution, source);
                if (source == null || target == null)
                    break;

                if (move(solution, request, source, target)) {
                    committed++;
                    break;
                }
            }
        }
        return committed;
    }

    private boolean move(Solution solution, RideRequest request, Route source, Route target) {
        if (source.requestCount() != 2)
            return moves.relocate(solution, request, target);

        var members = new ArrayList<>(target.getRequests());
        var partner = members.get(random.nextInt(members.size()));
        return moves.swap(solution, request, partner);
    }

    /* Requests riding alone come first, each group in random order. */
    private List<RideRequest> targets(Solution solution, int quota) {
        var alone = new ArrayList<RideRequest>();
        var shared = new ArrayList<RideRequest>();
        for (var route : solution.getRoutes()) {
            (route.isPooled() ? shared : alone).addAll(route.getRequests());
        }
        Collections.shuffle(alone, random);
        Collections.shuffle(shared, random);

        var targets = new ArrayList<RideRequest>(alone);
        targets.addAll(shared);
        return targets.subList(0, Math.min(quota, targets.size()));
    }

    private Route randomOtherRoute(Solution solution, Route source) {
        var routes = solution.getRoutes();
        if (source == null || routes.size() < 2)
            return null;

        int pick = random.nextInt(routes.size() - 1);
        for (int i = 0, seen = 0; i < routes.size(); i++) {
            if (routes.get(i) == source)
                continue;
            if (seen++ == pick)
                return routes.get(i);
        }
        return null;
    }
}
