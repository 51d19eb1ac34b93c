package org.mides.pooling.service;

import org.mides.pooling.config.PoolingConfiguration;
import org.mides.pooling.exception.InvalidProblemException;
import org.mides.pooling.grasp.Deadline;
import org.mides.pooling.grasp.FeasibilityChecker;
import org.mides.pooling.grasp.GraspDriver;
import org.mides.pooling.grasp.InsertionEngine;
import org.mides.pooling.grasp.LocalSearchEngine;
import org.mides.pooling.grasp.MoveOperator;
import org.mides.pooling.grasp.ObjectiveEvaluator;
import org.mides.pooling.grasp.PathRelinkingEngine;
import org.mides.pooling.grasp.TravelTimeCalculator;
import org.mides.pooling.model.GraspResult;
import org.mides.pooling.model.PoolingParameters;
import org.mides.pooling.model.RideRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Random;

@Service
public class GraspService implements IGraspService {

    private static final Logger logger = LoggerFactory.getLogger(GraspService.class);

    private final PoolingConfiguration configuration;
    private final Clock clock;

    @Autowired
    public GraspService(PoolingConfiguration configuration, Clock clock) {
        this.configuration = configuration;
        this.clock = clock;
    }

    @Override
    public GraspResult solve(List<RideRequest> requests, PoolingParameters parameters) {
        parameters.validate();
        return solve(requests, parameters, Deadline.after(parameters.getTimeBudget(), clock));
    }

    @Override
    public GraspResult solve(List<RideRequest> requests, PoolingParameters parameters, Deadline deadline) {
        parameters.validate();
        var instance = prepareInstance(requests);

        /* Every engine of the run shares the one seeded generator. */
        var random = new Random(parameters.getSeed());
        var travelTimes = new TravelTimeCalculator(parameters.getSpeed());
        var checker = new FeasibilityChecker(parameters, travelTimes);
        var evaluator = new ObjectiveEvaluator(parameters, travelTimes);
        var insertion = InsertionEngine.create(parameters, checker, random);
        var moves = new MoveOperator(checker, insertion);
        var localSearch = new LocalSearchEngine(parameters, insertion, moves, evaluator, random);
        var relinking = new PathRelinkingEngine(parameters, moves, evaluator, random);

        logger.info("Solving {} requests: alpha {}, capacity {}, {} insertion, {} objective, budget {}",
            instance.size(),
            parameters.getAlpha(),
            parameters.getCapacity(),
            parameters.getInsertionMethod(),
            parameters.getObjective(),
            parameters.getTimeBudget());

        var result = new GraspDriver(parameters, checker, insertion, localSearch, relinking, evaluator)
            .run(instance, deadline);

        logger.info("Finished after {} iterations in {} ms: objective {} of {}{}",
            result.getStatistics().getIterations(),
            result.getStatistics().getElapsedMillis(),
            result.getObjective(),
            result.getRequestCount(),
            result.hasSolution() ? "" : " (no solution)");
        return result;
    }

    @Override
    public PoolingParameters defaultParameters() {
        return configuration.toParameters();
    }

    private static List<RideRequest> prepareInstance(List<RideRequest> requests) {
        var ids = new HashSet<Integer>();
        for (var request : requests) {
            if (!ids.add(request.getId()))
                throw new InvalidProblemException("Duplicate request id " + request.getId());
        }

        var sorted = new ArrayList<>(requests);
        sorted.sort(Comparator.comparingInt(RideRequest::getId));

        /* The id is the sweep order of the unassigned pool, so it has to follow pickup time. */
        for (int i = 1; i < sorted.size(); i++) {
            var previous = sorted.get(i - 1);
            var request = sorted.get(i);
            if (request.getPickupWindow().startSeconds() < previous.getPickupWindow().startSeconds())
                throw new InvalidProblemException(String.format(
                    "Request ids must follow pickup time: request %d picks up before request %d",
                    request.getId(), previous.getId()));
        }
        return sorted;
    }
}
