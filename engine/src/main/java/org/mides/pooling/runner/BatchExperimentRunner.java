package org.mides.pooling.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.mides.pooling.config.PoolingConfiguration;
import org.mides.pooling.data.RequestCheckpointStore;
import org.mides.pooling.data.RequestFactory;
import org.mides.pooling.data.TripRecordReader;
import org.mides.pooling.grasp.TravelTimeCalculator;
import org.mides.pooling.model.GraspResult;
import org.mides.pooling.model.PoolingParameters;
import org.mides.pooling.model.RideRequest;
import org.mides.pooling.report.StatisticsReportFormatter;
import org.mides.pooling.service.IGraspService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Offline experiment: solves {@code nbTests} random samples of the instance
 * and logs a report per run and an averaged one. Starts only when a trip
 * file or a checkpoint is configured under {@code pooling.batch}.
 */
@Component
@ConditionalOnExpression("'${pooling.batch.input:}' != '' or '${pooling.batch.checkpoint:}' != ''")
public class BatchExperimentRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(BatchExperimentRunner.class);

    private final PoolingConfiguration configuration;
    private final IGraspService graspService;
    private final RequestCheckpointStore checkpointStore;
    private final StatisticsReportFormatter reportFormatter = new StatisticsReportFormatter();

    @Autowired
    public BatchExperimentRunner(
        PoolingConfiguration configuration,
        IGraspService graspService,
        ObjectMapper objectMapper)
    {
        this.configuration = configuration;
        this.graspService = graspService;
        this.checkpointStore = new RequestCheckpointStore(objectMapper);
    }

    @Override
    public void run(ApplicationArguments args) {
        var parameters = graspService.defaultParameters();
        parameters.validate();

        var instance = loadInstance(parameters);
        if (instance.isEmpty()) {
            logger.warn("No ride requests to solve");
            return;
        }

        var batch = configuration.getBatch();
        var random = new Random(parameters.getSeed());
        var results = new ArrayList<GraspResult>();

        for (int test = 1; test <= batch.getNbTests(); test++) {
            var sample = sample(instance, batch.getTestSize(), random);
            logger.info("Run {} of {} on {} requests", test, batch.getNbTests(), sample.size());

            var result = graspService.solve(sample, parameters);
            results.add(result);
            logger.info("Report of run {}{}{}", test, System.lineSeparator(), reportFormatter.format(result, parameters));
        }

        logger.info("Report over {} runs{}{}", results.size(), System.lineSeparator(),
            reportFormatter.formatAggregate(results, parameters));
    }

    /* A readable checkpoint wins over the trip file; a fresh read is saved to the checkpoint when one is set. */
    List<RideRequest> loadInstance(PoolingParameters parameters) {
        var batch = configuration.getBatch();
        var checkpoint = batch.getCheckpoint() == null || batch.getCheckpoint().isBlank()
            ? null
            : Path.of(batch.getCheckpoint());

        if (checkpoint != null && checkpointStore.exists(checkpoint))
            return checkpointStore.load(checkpoint);

        if (batch.getInput() == null || batch.getInput().isBlank()) {
            logger.warn("Checkpoint {} does not exist and no trip file is configured", checkpoint);
            return List.of();
        }

        var reader = new TripRecordReader(new TravelTimeCalculator(parameters.getSpeed()));
        var trips = reader.read(Path.of(batch.getInput()), batch.getLimit());
        var requests = new RequestFactory(parameters).create(trips, batch.getTimeframe());

        if (checkpoint != null)
            checkpointStore.save(checkpoint, requests);
        return requests;
    }

    /* Sampled requests keep their ids, so a sample is solved in its original pickup order. */
    private static List<RideRequest> sample(List<RideRequest> instance, int size, Random random) {
        if (size <= 0 || size >= instance.size())
            return instance;

        var shuffled = new ArrayList<>(instance);
        Collections.shuffle(shuffled, random);
        var sample = new ArrayList<>(shuffled.subList(0, size));
        Collections.sort(sample);
        return sample;
    }
}
