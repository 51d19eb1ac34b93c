package org.mides.pooling.grasp;

import lombok.Value;
import org.mides.pooling.model.Route;

/**
 * A feasible placement of one request. A null {@code route} opens a new
 * route; positions index the stops of the route before the insertion.
 */
@Value
public class InsertionCandidate {
    Route route;
    int pickupPos;
    int dropoffPos;
    double cost;

    public boolean opensRoute() {
        return route == null;
    }
}
