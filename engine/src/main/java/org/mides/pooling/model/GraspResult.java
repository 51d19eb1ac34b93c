package org.mides.pooling.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import org.mides.pooling.model.statistics.PoolingStatistics;

/**
 * Outcome of a GRASP run. {@code solution} is null when the time budget ran
 * out before a first iteration completed.
 */
@Value
public class GraspResult {

    @JsonProperty("solution")
    Solution solution;

    @JsonProperty("objective")
    int objective;

    @JsonProperty("request_count")
    int requestCount;

    @JsonProperty("statistics")
    PoolingStatistics statistics;

    public static GraspResult empty(int requestCount, PoolingStatistics statistics) {
        return new GraspResult(null, 0, requestCount, statistics);
    }

    @JsonProperty("has_solution")
    public boolean hasSolution() {
        return solution != null;
    }

    @JsonProperty("all_served")
    public boolean allServed() {
        return solution != null && solution.getUnassigned().isEmpty();
    }
}
