package org.mides.pooling.grasp;

import org.mides.pooling.model.RideRequest;
import org.mides.pooling.model.Route;
import org.mides.pooling.model.Solution;

import java.util.Optional;

/**
 * Relocation, swap and removal of requests between routes. Every move is
 * evaluated on route copies and only committed to the solution when all the
 * routes it touches stay feasible; a rejected move leaves the solution as it
 * was.
 */
public class MoveOperator {

    private final FeasibilityChecker checker;
    private final InsertionEngine insertion;

    public MoveOperator(FeasibilityChecker checker, InsertionEngine insertion) {
        this.checker = checker;
        this.insertion = insertion;
    }

    /**
     * Moves {@code request} from its current route, or from the pool, to its
     * cheapest position in {@code target}. A null target opens a new route.
     */
    public boolean relocate(Solution solution, RideRequest request, Route target) {
        var source = solution.routeOf(request);
        if (source != null && source == target)
            return false;

        Route reducedSource = null;
        if (source != null) {
            var reduced = without(source, request);
            if (reduced.isEmpty())
                return false;
            reducedSource = reduced.get();
        }

        var placement = insertion.bestInsertionInto(target, request);
        if (placement.isEmpty())
            return false;
        var extendedTarget = insertion.apply(request, placement.get());

        if (source != null)
            solution.commitRoute(source, reducedSource);
        solution.commitRoute(target, extendedTarget);
        return true;
    }

    /** Exchanges {@code request} with {@code partner}, each taking its cheapest position in the other's route. */
    public boolean swap(Solution solution, RideRequest request, RideRequest partner) {
        var source = solution.routeOf(request);
        var target = solution.routeOf(partner);
        if (source == null || target == null || source == target)
            return false;

        var newSource = exchange(source, request, partner);
        if (newSource.isEmpty())
            return false;
        var newTarget = exchange(target, partner, request);
        if (newTarget.isEmpty())
            return false;

        solution.commitRoute(source, newSource.get());
        solution.commitRoute(target, newTarget.get());
        return true;
    }

    /** Sends {@code request} back to the pool when the rest of its route stays feasible. */
    public boolean unassign(Solution solution, RideRequest request) {
        var source = solution.routeOf(request);
        if (source == null)
            return false;

        var reduced = without(source, request);
        if (reduced.isEmpty())
            return false;
        solution.commitRoute(source, reduced.get());
        return true;
    }

    /* Route copy without the request; an emptied route is a valid, empty result. */
    private Optional<Route> without(Route route, RideRequest request) {
        var reduced = route.copy();
        reduced.remove(request);
        if (reduced.isEmpty())
            return Optional.of(reduced);

        var schedule = checker.schedule(reduced);
        if (schedule.isEmpty())
            return Optional.empty();
        reduced.applySchedule(schedule.get());
        return Optional.of(reduced);
    }

    private Optional<Route> exchange(Route route, RideRequest leaving, RideRequest entering) {
        var reduced = without(route, leaving);
        if (reduced.isEmpty())
            return Optional.empty();

        var base = reduced.get();
        var placement = insertion.bestInsertionInto(base, entering);
        if (placement.isEmpty())
            return Optional.empty();
        return Optional.of(insertion.apply(entering, placement.get()));
    }
}
