package org.mides.pooling.grasp;

import org.mides.pooling.model.PoolingParameters;
import org.mides.pooling.model.RideRequest;
import org.mides.pooling.model.Solution;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Optional;
import java.util.Random;

/**
 * Ranks the feasible candidates by cost and commits one drawn uniformly from
 * the best {@code ceil(beta * candidates)} of them.
 */
public class RandomizedRestrictedInsertion extends InsertionEngine {

    private final Random random;

    public RandomizedRestrictedInsertion(PoolingParameters parameters, FeasibilityChecker checker, Random random) {
        super(parameters, checker);
        this.random = random;
    }

    @Override
    protected Optional<InsertionCandidate> select(Solution solution, RideRequest request) {
        var candidates = new ArrayList<InsertionCandidate>();
        forEachCandidate(solution, request, candidates::add);
        if (candidates.isEmpty())
            return Optional.empty();

        candidates.sort(Comparator.comparingDouble(InsertionCandidate::getCost));
        int restricted = restrictedListSize(candidates.size());
        return Optional.of(candidates.get(random.nextInt(restricted)));
    }

    int restrictedListSize(int candidates) {
        return Math.max(1, (int) Math.ceil(parameters.getBeta() * candidates));
    }
}
