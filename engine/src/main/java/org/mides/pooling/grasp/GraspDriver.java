package org.mides.pooling.grasp;

import org.apache.commons.lang3.time.StopWatch;
import org.mides.pooling.exception.InvalidSolutionException;
import org.mides.pooling.model.GraspResult;
import org.mides.pooling.model.PoolingParameters;
import org.mides.pooling.model.RideRequest;
import org.mides.pooling.model.Solution;
import org.mides.pooling.model.statistics.PoolingStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * One GRASP run: construction, local search and path relinking against the
 * elite, repeated until the deadline, the iteration cap or a perfect score.
 * Not thread-safe; create one per run.
 */
public class GraspDriver {

    private static final Logger logger = LoggerFactory.getLogger(GraspDriver.class);

    private final PoolingParameters parameters;
    private final FeasibilityChecker checker;
    private final InsertionEngine insertion;
    private final LocalSearchEngine localSearch;
    private final PathRelinkingEngine relinking;
    private final ObjectiveEvaluator evaluator;

    private final List<Integer> initialObjectives = new ArrayList<>();
    private final List<Integer> eliteHistory = new ArrayList<>();

    private Solution working;
    private Solution elite;
    private int workingScore;
    private int eliteScore;
    private boolean relinked;
    private int iterations;
    private int abortedIterations;
    private long lastIterationMillis;

    public GraspDriver(
        PoolingParameters parameters,
        FeasibilityChecker checker,
        InsertionEngine insertion,
        LocalSearchEngine localSearch,
        PathRelinkingEngine relinking,
        ObjectiveEvaluator evaluator)
    {
        this.parameters = parameters;
        this.checker = checker;
        this.insertion = insertion;
        this.localSearch = localSearch;
        this.relinking = relinking;
        this.evaluator = evaluator;
    }

    public GraspResult run(List<RideRequest> requests, Deadline deadline) {
        var stopWatch = StopWatch.createStarted();
        var state = GraspState.INIT;

        while (state != GraspState.TERMINATE) {
            logger.debug("GRASP state {}", state);
            try {
                state = next(state, requests, deadline, stopWatch);
            } catch (InvalidSolutionException e) {
                logger.error("Aborting iteration {}: {}", iterations + abortedIterations + 1, e.getMessage());
                abortedIterations++;
                working = null;
                state = GraspState.INIT;
            }
        }

        stopWatch.stop();
        var statistics = PoolingStatistics.builder()
            .iterations(iterations)
            .abortedIterations(abortedIterations)
            .initialObjectives(List.copyOf(initialObjectives))
            .eliteHistory(List.copyOf(eliteHistory))
            .elapsedMillis(stopWatch.getTime())
            .lastIterationMillis(lastIterationMillis);

        if (elite == null) {
            logger.warn("No GRASP iteration completed within the time budget of {}", parameters.getTimeBudget());
            return GraspResult.empty(requests.size(), statistics.requests(List.of()).build());
        }

        statistics.requests(evaluator.requestStatistics(elite)).fleet(evaluator.fleetStatistics(elite));
        return new GraspResult(elite, eliteScore, requests.size(), statistics.build());
    }

    private GraspState next(GraspState state, List<RideRequest> requests, Deadline deadline, StopWatch stopWatch) {
        switch (state) {
            case INIT:
                return shouldTerminate(requests, deadline) ? GraspState.TERMINATE : GraspState.CONSTRUCT;
            case CONSTRUCT:
                working = Solution.unassigned(requests);
                relinked = false;
                insertion.insertUnassigned(working, deadline);
                initialObjectives.add(evaluator.score(working));
                return GraspState.VALIDATE;
            case VALIDATE:
                requireValid("construction");
                return GraspState.LOCAL_SEARCH;
            case LOCAL_SEARCH:
                localSearch.improve(working, deadline);
                requireValid("local search");
                return elite != null && !relinked ? GraspState.PATH_RELINK : GraspState.EVALUATE;
            case PATH_RELINK:
                working = relinking.relink(working, elite, deadline);
                relinked = true;
                requireValid("path relinking");
                return GraspState.LOCAL_SEARCH;
            case EVALUATE:
                workingScore = evaluator.score(working);
                iterations++;
                lastIterationMillis = stopWatch.getTime();
                if (elite == null || workingScore > eliteScore)
                    return GraspState.PROMOTE_ELITE;
                eliteHistory.add(eliteScore);
                logIteration(false);
                return GraspState.INIT;
            case PROMOTE_ELITE:
                elite = working.copy();
                eliteScore = workingScore;
                eliteHistory.add(eliteScore);
                logIteration(true);
                return GraspState.INIT;
            default:
                throw new IllegalStateException("No transition out of " + state);
        }
    }

    private boolean shouldTerminate(List<RideRequest> requests, Deadline deadline) {
        if (deadline.isExpired())
            return true;
        if (elite != null && eliteScore >= requests.size())
            return true;
        return parameters.getMaxIterations() > 0 && iterations >= parameters.getMaxIterations();
    }

    private void requireValid(String stage) {
        var result = checker.validateSolution(working);
        if (!result.isValid())
            throw new InvalidSolutionException(stage, result);
    }

    private void logIteration(boolean promoted) {
        logger.info("Iteration {}: objective {} (constructed {}), elite {}{}, {} unassigned, {} ms",
            iterations,
            workingScore,
            initialObjectives.get(initialObjectives.size() - 1),
            eliteScore,
            promoted ? " (promoted)" : "",
            working.getUnassigned().size(),
            lastIterationMillis);
    }
}
