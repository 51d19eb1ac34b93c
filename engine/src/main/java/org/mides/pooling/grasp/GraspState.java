package org.mides.pooling.grasp;

public enum GraspState {
    INIT,
    CONSTRUCT,
    VALIDATE,
    LOCAL_SEARCH,
    PATH_RELINK,
    EVALUATE,
    PROMOTE_ELITE,
    TERMINATE
}
