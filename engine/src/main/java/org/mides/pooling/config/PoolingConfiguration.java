package org.mides.pooling.config;

import lombok.Data;
import org.mides.pooling.model.InsertionMethod;
import org.mides.pooling.model.ObjectiveMode;
import org.mides.pooling.model.PoolingParameters;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "pooling")
public class PoolingConfiguration {
    private double alpha = PoolingParameters.DEFAULT_ALPHA;
    private double beta = PoolingParameters.DEFAULT_BETA;
    private int capacity = PoolingParameters.DEFAULT_CAPACITY;
    private double speed = PoolingParameters.DEFAULT_SPEED;
    private InsertionMethod insertionMethod = InsertionMethod.EXHAUSTIVE;
    private ObjectiveMode objective = ObjectiveMode.POOLED;
    private int maxLocalSearchRounds = PoolingParameters.DEFAULT_MAX_LOCAL_SEARCH_ROUNDS;
    private int insertAttemptBudget = PoolingParameters.DEFAULT_INSERT_ATTEMPT_BUDGET;
    private int swapAttemptBudget = PoolingParameters.DEFAULT_SWAP_ATTEMPT_BUDGET;
    private double swapFraction = PoolingParameters.DEFAULT_SWAP_FRACTION;
    private Duration timeBudget = PoolingParameters.DEFAULT_TIME_BUDGET;
    private int maxIterations = 0;
    private long seed = PoolingParameters.DEFAULT_SEED;
    private Duration timeWindow = PoolingParameters.DEFAULT_TIME_WINDOW;
    private double fareBase = PoolingParameters.DEFAULT_FARE_BASE;
    private double farePerKm = PoolingParameters.DEFAULT_FARE_PER_KM;
    private Batch batch = new Batch();

    /* Offline experiment over a trip-record file or a saved request checkpoint. */
    @Data
    public static class Batch {
        private String input;
        private String checkpoint;
        /* Rows read from the input, all when unset. */
        private Integer limit;
        /* Keeps requests whose pickup window opens within this span of the first one. */
        private Duration timeframe;
        private int nbTests = 1;
        private int testSize = 100;
    }

    public PoolingParameters toParameters() {
        return PoolingParameters.builder()
            .alpha(alpha)
            .beta(beta)
            .capacity(capacity)
            .speed(speed)
            .insertionMethod(insertionMethod)
            .objective(objective)
            .maxLocalSearchRounds(maxLocalSearchRounds)
            .insertAttemptBudget(insertAttemptBudget)
            .swapAttemptBudget(swapAttemptBudget)
            .swapFraction(swapFraction)
            .timeBudget(timeBudget)
            .maxIterations(maxIterations)
            .seed(seed)
            .timeWindow(timeWindow)
            .fareBase(fareBase)
            .farePerKm(farePerKm)
            .build();
    }
}
