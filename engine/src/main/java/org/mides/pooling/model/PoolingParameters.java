package org.mides.pooling.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.mides.pooling.exception.InvalidProblemException;

import java.time.Duration;
import java.util.ArrayList;

/**
 * Immutable run configuration. One instance drives a whole GRASP run so that
 * every engine of the run sees the same values.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PoolingParameters {

    public static final double DEFAULT_ALPHA = 1.5;
    public static final double DEFAULT_BETA = 0.1;
    public static final int DEFAULT_CAPACITY = 2;
    public static final double DEFAULT_SPEED = 40.0;
    public static final int DEFAULT_MAX_LOCAL_SEARCH_ROUNDS = 10;
    public static final int DEFAULT_INSERT_ATTEMPT_BUDGET = 5;
    public static final int DEFAULT_SWAP_ATTEMPT_BUDGET = 5;
    public static final double DEFAULT_SWAP_FRACTION = 0.1;
    public static final Duration DEFAULT_TIME_BUDGET = Duration.ofSeconds(30);
    public static final Duration DEFAULT_TIME_WINDOW = Duration.ofMinutes(15);
    public static final long DEFAULT_SEED = 42L;
    public static final double DEFAULT_FARE_BASE = 2.5;
    public static final double DEFAULT_FARE_PER_KM = 1.56;

    /* Maximum ratio of realized ride time to direct travel time. */
    @JsonProperty("alpha")
    @Builder.Default
    double alpha = DEFAULT_ALPHA;

    /* Share of ranked candidates kept in the restricted candidate list. */
    @JsonProperty("beta")
    @Builder.Default
    double beta = DEFAULT_BETA;

    @JsonProperty("capacity")
    @Builder.Default
    int capacity = DEFAULT_CAPACITY;

    /* Constant vehicle speed in km/h. */
    @JsonProperty("speed")
    @Builder.Default
    double speed = DEFAULT_SPEED;

    @JsonProperty("insertion_method")
    @Builder.Default
    InsertionMethod insertionMethod = InsertionMethod.EXHAUSTIVE;

    @JsonProperty("objective")
    @Builder.Default
    ObjectiveMode objective = ObjectiveMode.POOLED;

    @JsonProperty("max_local_search_rounds")
    @Builder.Default
    int maxLocalSearchRounds = DEFAULT_MAX_LOCAL_SEARCH_ROUNDS;

    @JsonProperty("insert_attempt_budget")
    @Builder.Default
    int insertAttemptBudget = DEFAULT_INSERT_ATTEMPT_BUDGET;

    @JsonProperty("swap_attempt_budget")
    @Builder.Default
    int swapAttemptBudget = DEFAULT_SWAP_ATTEMPT_BUDGET;

    @JsonProperty("swap_fraction")
    @Builder.Default
    double swapFraction = DEFAULT_SWAP_FRACTION;

    @JsonProperty("time_budget")
    @Builder.Default
    Duration timeBudget = DEFAULT_TIME_BUDGET;

    /* 0 means no cap besides the time budget. */
    @JsonProperty("max_iterations")
    @Builder.Default
    int maxIterations = 0;

    @JsonProperty("seed")
    @Builder.Default
    long seed = DEFAULT_SEED;

    /* Length of both the pickup and the dropoff window. */
    @JsonProperty("time_window")
    @Builder.Default
    Duration timeWindow = DEFAULT_TIME_WINDOW;

    @JsonProperty("fare_base")
    @Builder.Default
    double fareBase = DEFAULT_FARE_BASE;

    @JsonProperty("fare_per_km")
    @Builder.Default
    double farePerKm = DEFAULT_FARE_PER_KM;

    public static PoolingParameters defaults() {
        return PoolingParameters.builder().build();
    }

    public void validate() {
        var errors = new ArrayList<String>();
        if (!(alpha > 1.0))
            errors.add("alpha must be greater than 1");
        if (!(beta > 0.0 && beta <= 1.0))
            errors.add("beta must lie in (0, 1]");
        if (capacity <= 0)
            errors.add("capacity must be positive");
        if (!(speed > 0.0))
            errors.add("speed must be positive");
        if (insertionMethod == null)
            errors.add("insertion_method is required");
        if (objective == null)
            errors.add("objective is required");
        if (maxLocalSearchRounds < 0 || insertAttemptBudget < 0 || swapAttemptBudget < 0 || maxIterations < 0)
            errors.add("rounds, budgets and iteration caps must not be negative");
        if (!(swapFraction >= 0.0 && swapFraction <= 1.0))
            errors.add("swap_fraction must lie in [0, 1]");
        if (timeBudget == null || timeBudget.isNegative())
            errors.add("time_budget must not be negative");
        if (timeWindow == null || timeWindow.isNegative())
            errors.add("time_window must not be negative");

        if (!errors.isEmpty())
            throw new InvalidProblemException("Invalid pooling parameters: " + String.join("; ", errors));
    }
}
