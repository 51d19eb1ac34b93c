package org.mides.pooling.model;

public enum ObjectiveMode {
    /* Requests riding in a route shared with at least one other request. */
    POOLED,
    /* Every request assigned to a route. */
    SERVED
}
