package org.mides.pooling.model.statistics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

@Value
@Builder
public class PoolingStatistics {

    @JsonProperty("iterations")
    int iterations;

    @JsonProperty("aborted_iterations")
    int abortedIterations;

    /* Objective of each constructed solution before local search. */
    @JsonProperty("initial_objectives")
    List<Integer> initialObjectives;

    /* Elite objective after each completed iteration. */
    @JsonProperty("elite_history")
    List<Integer> eliteHistory;

    @JsonProperty("elapsed_millis")
    long elapsedMillis;

    /* Elapsed time when the last completed iteration ended. */
    @JsonProperty("last_iteration_millis")
    long lastIterationMillis;

    @JsonProperty("requests")
    List<RequestStatistics> requests;

    @JsonProperty("fleet")
    FleetStatistics fleet;

    public Duration elapsed() {
        return Duration.ofMillis(elapsedMillis);
    }
}
