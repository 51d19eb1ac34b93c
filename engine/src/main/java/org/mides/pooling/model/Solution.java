package org.mides.pooling.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Routes plus the pool of unassigned requests. Every request of the instance
 * is either in exactly one route or in the pool; the structural operations
 * below keep the request-to-route index and the pool in step with the routes.
 * Feasibility of the routes is the responsibility of the engines mutating them.
 */
@Getter
public class Solution {

    @JsonIgnore
    private final List<RideRequest> requests;

    @JsonProperty("routes")
    private final List<Route> routes = new ArrayList<>();

    @JsonIgnore
    private final TreeSet<RideRequest> unassigned = new TreeSet<>();

    @JsonIgnore
    private final Map<Integer, Route> assignment = new HashMap<>();

    private Solution(List<RideRequest> requests) {
        this.requests = requests;
    }

    /** A solution in which every request waits in the unassigned pool. */
    public static Solution unassigned(List<RideRequest> requests) {
        var solution = new Solution(Collections.unmodifiableList(new ArrayList<>(requests)));
        solution.unassigned.addAll(requests);
        return solution;
    }

    @JsonProperty("unassigned_ids")
    public List<Integer> getUnassignedIds() {
        return unassigned.stream().map(RideRequest::getId).toList();
    }

    @JsonIgnore
    public int getRequestCount() {
        return requests.size();
    }

    @JsonIgnore
    public int getAssignedCount() {
        return assignment.size();
    }

    public Route routeOf(RideRequest request) {
        return assignment.get(request.getId());
    }

    public boolean isAssigned(RideRequest request) {
        return assignment.containsKey(request.getId());
    }

    /**
     * Replaces {@code current} by {@code replacement}. A null {@code current}
     * opens a new route; an empty replacement destroys the route. Requests of
     * {@code current} that the replacement no longer holds and that no other
     * route claimed in the meantime return to the pool.
     */
    public void commitRoute(Route current, Route replacement) {
        int index = current == null ? -1 : indexOfRoute(current);
        if (current != null && index < 0)
            throw new IllegalArgumentException("Route does not belong to this solution");

        if (current != null) {
            for (var request : current.getRequests()) {
                if (assignment.get(request.getId()) == current) {
                    assignment.remove(request.getId());
                    unassigned.add(request);
                }
            }
        }

        if (replacement.isEmpty()) {
            if (index >= 0)
                routes.remove(index);
            return;
        }

        if (index >= 0)
            routes.set(index, replacement);
        else
            routes.add(replacement);

        for (var request : replacement.getRequests()) {
            assignment.put(request.getId(), replacement);
            unassigned.remove(request);
        }
    }

    /** Independent structural copy; requests stay shared. */
    public Solution copy() {
        var copy = new Solution(requests);
        copy.copyFrom(this);
        return copy;
    }

    /** Makes this solution a structural copy of {@code other}. */
    public void restore(Solution other) {
        if (other.requests.size() != requests.size())
            throw new IllegalArgumentException("Solutions belong to different instances");
        copyFrom(other);
    }

    private void copyFrom(Solution other) {
        routes.clear();
        assignment.clear();
        unassigned.clear();
        for (var route : other.routes) {
            var copied = route.copy();
            routes.add(copied);
            for (var request : copied.getRequests())
                assignment.put(request.getId(), copied);
        }
        unassigned.addAll(other.unassigned);
    }

    private int indexOfRoute(Route route) {
        for (int i = 0; i < routes.size(); i++) {
            if (routes.get(i) == route)
                return i;
        }
        return -1;
    }
}
