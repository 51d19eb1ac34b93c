package org.mides.pooling.model;

public enum StopType {
    PICKUP,
    DROPOFF
}
