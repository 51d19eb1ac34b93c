package org.mides.pooling.grasp;

import org.mides.pooling.model.PoolingParameters;
import org.mides.pooling.model.RideRequest;
import org.mides.pooling.model.Solution;

import java.util.Optional;

/** Commits the cheapest feasible candidate; ties keep the first one found. */
public class ExhaustiveInsertion extends InsertionEngine {

    public ExhaustiveInsertion(PoolingParameters parameters, FeasibilityChecker checker) {
        super(parameters, checker);
    }

    @Override
    protected Optional<InsertionCandidate> select(Solution solution, RideRequest request) {
        var best = new InsertionCandidate[1];
        forEachCandidate(solution, request, candidate -> {
            if (best[0] == null || candidate.getCost() < best[0].getCost())
                best[0] = candidate;
        });
        return Optional.ofNullable(best[0]);
    }
}
