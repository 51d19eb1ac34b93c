package org.mides.pooling.grasp;

import org.mides.pooling.model.PoolingParameters;
import org.mides.pooling.model.RideRequest;
import org.mides.pooling.model.Route;
import org.mides.pooling.model.Solution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Walks from a working solution toward the route structure of the elite one
 * request at a time and keeps the best intermediate solution.
 */
public class PathRelinkingEngine {

    private static final Logger logger = LoggerFactory.getLogger(PathRelinkingEngine.class);

    private final PoolingParameters parameters;
    private final MoveOperator moves;
    private final ObjectiveEvaluator evaluator;
    private final Random random;

    public PathRelinkingEngine(
        PoolingParameters parameters,
        MoveOperator moves,
        ObjectiveEvaluator evaluator,
        Random random)
    {
        this.parameters = parameters;
        this.moves = moves;
        this.evaluator = evaluator;
        this.random = random;
    }

    /** Neither argument is modified. */
    public Solution relink(Solution working, Solution elite, Deadline deadline) {
        var current = working.copy();
        var best = working.copy();
        int bestScore = evaluator.score(best);
        int steps = 0;

        var ordered = new ArrayList<>(current.getRequests());
        Collections.sort(ordered);

        for (var request : ordered) {
            if (deadline.isExpired())
                break;
            if (sameMates(current, elite, request))
                continue;

            if (step(current, elite, request)) {
                steps++;
                int score = evaluator.score(current);
                if (score > bestScore) {
                    best = current.copy();
                    bestScore = score;
                }
            }
        }

        logger.debug("Path relinking made {} steps, best objective {}", steps, bestScore);
        return best;
    }

    private boolean step(Solution current, Solution elite, RideRequest request) {
        var eliteRoute = elite.routeOf(request);
        if (eliteRoute == null)
            return moves.unassign(current, request);

        var eliteMates = mates(eliteRoute, request);
        if (eliteMates.isEmpty())
            return moves.relocate(current, request, null);

        var target = routeHoldingMostMates(current, eliteMates);
        if (target == null || target == current.routeOf(request))
            return false;
        if (moves.relocate(current, request, target))
            return true;

        var outsiders = target.getRequests().stream()
            .filter(member -> !eliteMates.contains(member.getId()))
            .collect(Collectors.toCollection(ArrayList::new));
        Collections.shuffle(outsiders, random);

        int attempts = Math.min(parameters.getSwapAttemptBudget(), outsiders.size());
        for (int i = 0; i < attempts; i++) {
            if (moves.swap(current, request, outsiders.get(i)))
                return true;
        }
        return false;
    }

    private static boolean sameMates(Solution current, Solution elite, RideRequest request) {
        var currentRoute = current.routeOf(request);
        var eliteRoute = elite.routeOf(request);
        if (currentRoute == null || eliteRoute == null)
            return currentRoute == eliteRoute;
        return mates(currentRoute, request).equals(mates(eliteRoute, request));
    }

    private static Set<Integer> mates(Route route, RideRequest request) {
        return route.getRequests().stream()
            .map(RideRequest::getId)
            .filter(id -> id != request.getId())
            .collect(Collectors.toSet());
    }

    private static Route routeHoldingMostMates(Solution current, Set<Integer> mateIds) {
        var counts = new IdentityHashMap<Route, Integer>();
        Route best = null;
        int bestCount = 0;
        for (var mate : current.getRequests()) {
            if (!mateIds.contains(mate.getId()))
                continue;
            var route = current.routeOf(mate);
            if (route == null)
                continue;
            int count = counts.merge(route, 1, Integer::sum);
            if (count > bestCount) {
                best = route;
                bestCount = count;
            }
        }
        return best;
    }
}
