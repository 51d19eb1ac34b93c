package org.mides.pooling.grasp;

import org.mides.pooling.model.PoolingParameters;
import org.mides.pooling.model.RideRequest;
import org.mides.pooling.model.Route;
import org.mides.pooling.model.Solution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Optional;
import java.util.Random;
import java.util.function.Consumer;

/**
 * Places unassigned requests into routes. Subclasses decide which of the
 * feasible candidates of a request gets committed.
 */
public abstract class InsertionEngine {

    private static final Logger logger = LoggerFactory.getLogger(InsertionEngine.class);

    protected final PoolingParameters parameters;
    protected final FeasibilityChecker checker;

    protected InsertionEngine(PoolingParameters parameters, FeasibilityChecker checker) {
        this.parameters = parameters;
        this.checker = checker;
    }

    public static InsertionEngine create(PoolingParameters parameters, FeasibilityChecker checker, Random random) {
        switch (parameters.getInsertionMethod()) {
            case EXHAUSTIVE:
                return new ExhaustiveInsertion(parameters, checker);
            case RANDOMIZED_RESTRICTED:
                return new RandomizedRestrictedInsertion(parameters, checker, random);
            default:
                throw new IllegalArgumentException("Unknown insertion method " + parameters.getInsertionMethod());
        }
    }

    /**
     * Sweeps the pool in id order until a sweep places nothing. A request is
     * given up for this call once it failed {@code insertAttemptBudget} times.
     *
     * @return the number of requests placed
     */
    public int insertUnassigned(Solution solution, Deadline deadline) {
        var failures = new HashMap<Integer, Integer>();
        int budget = parameters.getInsertAttemptBudget();
        int inserted = 0;
        boolean progress = !solution.getUnassigned().isEmpty();

        while (progress && !deadline.isExpired()) {
            progress = false;
            for (var request : new ArrayList<>(solution.getUnassigned())) {
                if (deadline.isExpired())
                    break;
                int failed = failures.getOrDefault(request.getId(), 0);
                if (failed >= budget)
                    continue;

                if (insert(solution, request)) {
                    inserted++;
                    progress = true;
                } else {
                    failures.put(request.getId(), failed + 1);
                }
            }
        }

        logger.debug("Inserted {} requests, {} left unassigned", inserted, solution.getUnassigned().size());
        return inserted;
    }

    /** Commits one candidate for {@code request}; false when none is feasible. */
    public boolean insert(Solution solution, RideRequest request) {
        if (!checker.isServable(request))
            return false;

        var chosen = select(solution, request);
        if (chosen.isEmpty())
            return false;

        commit(solution, request, chosen.get());
        return true;
    }

    protected abstract Optional<InsertionCandidate> select(Solution solution, RideRequest request);

    /** Reports every feasible placement of {@code request}, the new route last. */
    protected void forEachCandidate(Solution solution, RideRequest request, Consumer<InsertionCandidate> consumer) {
        for (var route : solution.getRoutes()) {
            if (mayHost(route, request))
                forEachPlacement(route, request, consumer);
        }
        forEachPlacement(null, request, consumer);
    }

    private void forEachPlacement(Route route, RideRequest request, Consumer<InsertionCandidate> consumer) {
        var target = route == null ? new Route() : route;
        int size = target.getStops().size();
        for (int p = 0; p <= size; p++) {
            for (int d = p; d <= size; d++) {
                var cost = checker.feasibleInsertion(target, request, p, d);
                if (cost.isPresent())
                    consumer.accept(new InsertionCandidate(route, p, d, cost.getAsDouble()));
            }
        }
    }

    /** Cheapest placement of {@code request} into {@code route}, or into a new route when null. */
    public Optional<InsertionCandidate> bestInsertionInto(Route route, RideRequest request) {
        if (!checker.isServable(request))
            return Optional.empty();

        var best = new InsertionCandidate[1];
        forEachPlacement(route, request, candidate -> {
            if (best[0] == null || candidate.getCost() < best[0].getCost())
                best[0] = candidate;
        });
        return Optional.ofNullable(best[0]);
    }

    /**
     * The route copy that results from applying {@code candidate}, with its
     * schedule refreshed.
     */
    public Route apply(RideRequest request, InsertionCandidate candidate) {
        var target = candidate.opensRoute() ? new Route() : candidate.getRoute().copy();
        target.insert(request, candidate.getPickupPos(), candidate.getDropoffPos());
        var schedule = checker.schedule(target).orElseThrow(() -> new IllegalStateException(
            "Insertion of request " + request.getId() + " accepted by the checker has no feasible schedule"));
        target.applySchedule(schedule);
        return target;
    }

    protected void commit(Solution solution, RideRequest request, InsertionCandidate candidate) {
        solution.commitRoute(candidate.getRoute(), apply(request, candidate));
    }

    /* A route whose windows never overlap the request's trip cannot host it. */
    private static boolean mayHost(Route route, RideRequest request) {
        long earliest = Long.MAX_VALUE;
        long latest = Long.MIN_VALUE;
        for (var stop : route.getStops()) {
            earliest = Math.min(earliest, stop.getWindow().startSeconds());
            latest = Math.max(latest, stop.getWindow().endSeconds());
        }
        return request.getPickupWindow().startSeconds() <= latest
            && request.getDropoffWindow().endSeconds() >= earliest;
    }
}
