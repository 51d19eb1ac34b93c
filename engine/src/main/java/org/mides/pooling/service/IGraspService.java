package org.mides.pooling.service;

import org.mides.pooling.grasp.Deadline;
import org.mides.pooling.model.GraspResult;
import org.mides.pooling.model.PoolingParameters;
import org.mides.pooling.model.RideRequest;

import java.util.List;

public interface IGraspService {

    /** Solves with a deadline of {@code parameters.timeBudget} from now. */
    GraspResult solve(List<RideRequest> requests, PoolingParameters parameters);

    GraspResult solve(List<RideRequest> requests, PoolingParameters parameters, Deadline deadline);

    /** Parameters from the application configuration. */
    PoolingParameters defaultParameters();
}
