package org.mides.pooling.report;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.mides.pooling.model.GraspResult;
import org.mides.pooling.model.PoolingParameters;
import org.mides.pooling.model.statistics.RequestStatistics;

import java.util.List;
import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * Human-readable reports of GRASP runs: one per run and one averaged over a
 * series of runs.
 */
public class StatisticsReportFormatter {

    private static final String RULE = "---------------------------------------------------------";

    public String format(GraspResult result, PoolingParameters parameters) {
        var report = new Report();
        report.title("Final stats");

        var statistics = result.getStatistics();
        report.line("Number of requests : %d", result.getRequestCount());
        report.line("Number of GRASP iterations : %d (%d aborted)",
            statistics.getIterations(), statistics.getAbortedIterations());

        if (!result.hasSolution()) {
            report.line("No solution: the time budget of %s ran out before the first iteration completed",
                parameters.getTimeBudget());
            return report.toString();
        }

        report.line("Best objective : %d (%s)", result.getObjective(), parameters.getObjective());
        report.line("Percentage of pooling : %.1f %%", percentage(result.getObjective(), result.getRequestCount()));
        report.line(result.allServed()
            ? "All requests served"
            : String.format(Locale.ROOT, "Not all requests served: %d unassigned",
                result.getSolution().getUnassigned().size()));

        var fleet = statistics.getFleet();
        var initial = describe(statistics.getInitialObjectives().stream().mapToDouble(Integer::doubleValue).toArray());
        report.blank();
        report.line("Capacity of the vehicles : %d", parameters.getCapacity());
        report.line("Speed of the vehicles : %.0f km/h", parameters.getSpeed());
        report.line("Number of routes : %d", fleet.getRoutes());
        report.line("Average number of requests per route : %.2f", fleet.getMeanRequestsPerRoute());
        report.line("Maximum number of requests in one route : %d", fleet.getMaxRequestsPerRoute());
        report.line("Average objective of the constructed solutions : %.1f %%",
            percentage(mean(initial), result.getRequestCount()));

        var requests = statistics.getRequests();
        var delays = describe(requests, RequestStatistics::getDelay);
        var delaysPercentage = describe(requests, RequestStatistics::getDelayPercentage);
        var savings = describe(requests, RequestStatistics::getPriceSavingPercentage);
        var advances = describe(requests, RequestStatistics::getPickupAdvance);
        var advancesPercentage = describe(requests, RequestStatistics::getPickupAdvancePercentage);

        report.blank();
        if (requests.isEmpty()) {
            report.line("No pooled requests");
        } else {
            report.line("Average delay of the pooled requests : %.1f sec (+%.1f %%)",
                mean(delays), mean(delaysPercentage));
            report.line("Standard deviation of the delay : %.1f sec", deviation(delays));
            report.line("Maximum delay : %.1f sec (+%.1f %%)", delays.getMax(), delaysPercentage.getMax());
            report.line("Minimum delay : %.1f sec (+%.1f %%)", delays.getMin(), delaysPercentage.getMin());

            report.blank();
            report.line("Value of alpha : %.2f", parameters.getAlpha());
            report.line("Average price saving of the pooled requests : -%.1f %%", mean(savings));
            report.line("Maximum price saving : -%.1f %%", savings.getMax());
            report.line("Minimum price saving : -%.1f %%", savings.getMin());

            report.blank();
            report.line("Average pickup advance : %.1f sec (+%.1f %%)", mean(advances), mean(advancesPercentage));
            report.line("Standard deviation of the pickup advance : %.1f sec", deviation(advances));
            report.line("Maximum pickup advance : %.1f sec (+%.1f %%)", advances.getMax(), advancesPercentage.getMax());
            report.line("Minimum pickup advance : %.1f sec (+%.1f %%)", advances.getMin(), advancesPercentage.getMin());
        }

        report.blank();
        report.line("Computation time : %.1f sec", statistics.getElapsedMillis() / 1000.0);
        if (statistics.getIterations() > 0)
            report.line("Average computation time by iteration : %.2f sec",
                statistics.getLastIterationMillis() / 1000.0 / statistics.getIterations());
        return report.toString();
    }

    /** Averages of the per-run figures; runs without a solution only count in the first line. */
    public String formatAggregate(List<GraspResult> results, PoolingParameters parameters) {
        var report = new Report();
        report.title("Global final stats");

        var solved = results.stream().filter(GraspResult::hasSolution).toList();
        report.line("Number of runs : %d (%d without solution)", results.size(), results.size() - solved.size());
        if (solved.isEmpty())
            return report.toString();

        var pooling = describeRuns(solved, r -> percentage(r.getObjective(), r.getRequestCount()));
        var iterations = describeRuns(solved, r -> r.getStatistics().getIterations());
        var routeMeans = describeRuns(solved, r -> r.getStatistics().getFleet().getMeanRequestsPerRoute());
        var routeMax = describeRuns(solved, r -> r.getStatistics().getFleet().getMaxRequestsPerRoute());
        var delays = describeRuns(solved, r -> mean(describe(r.getStatistics().getRequests(), RequestStatistics::getDelay)));
        var savings = describeRuns(solved, r -> mean(describe(r.getStatistics().getRequests(), RequestStatistics::getPriceSavingPercentage)));
        var advances = describeRuns(solved, r -> mean(describe(r.getStatistics().getRequests(), RequestStatistics::getPickupAdvance)));
        long allServed = solved.stream().filter(GraspResult::allServed).count();

        report.line("Number of GRASP iterations : %.1f", mean(iterations));
        report.line("Percentage of pooling : %.1f %% (std %.1f)", mean(pooling), deviation(pooling));
        report.line("Runs serving all requests : %d of %d", allServed, solved.size());

        report.blank();
        report.line("Capacity of the vehicles : %d", parameters.getCapacity());
        report.line("Speed of the vehicles : %.0f km/h", parameters.getSpeed());
        report.line("Average number of requests per route : %.2f", mean(routeMeans));
        report.line("Maximum number of requests in one route : %.1f", mean(routeMax));

        report.blank();
        report.line("Average delay of the pooled requests : %.1f sec", mean(delays));
        report.line("Value of alpha : %.2f", parameters.getAlpha());
        report.line("Average price saving of the pooled requests : -%.1f %%", mean(savings));
        report.line("Average pickup advance : %.1f sec", mean(advances));
        return report.toString();
    }

    private static DescriptiveStatistics describe(double[] values) {
        return new DescriptiveStatistics(values);
    }

    private static DescriptiveStatistics describe(List<RequestStatistics> requests, ToDoubleFunction<RequestStatistics> field) {
        return describe(requests.stream().mapToDouble(field).toArray());
    }

    /* Runs without any pooled request do not contribute NaN means. */
    private static DescriptiveStatistics describeRuns(List<GraspResult> results, ToDoubleFunction<GraspResult> field) {
        return describe(results.stream().mapToDouble(field).filter(value -> !Double.isNaN(value)).toArray());
    }

    private static double mean(DescriptiveStatistics statistics) {
        return statistics.getN() == 0 ? Double.NaN : statistics.getMean();
    }

    private static double deviation(DescriptiveStatistics statistics) {
        return statistics.getN() < 2 ? 0.0 : statistics.getStandardDeviation();
    }

    private static double percentage(double value, int total) {
        return total == 0 ? 0.0 : value * 100.0 / total;
    }

    private static class Report {
        private final StringBuilder builder = new StringBuilder();

        void title(String title) {
            builder.append(RULE).append(System.lineSeparator());
            builder.append(String.format("%" + (RULE.length() + title.length()) / 2 + "s", title)).append(System.lineSeparator());
            builder.append(RULE).append(System.lineSeparator());
        }

        void line(String format, Object... args) {
            builder.append(String.format(Locale.ROOT, format, args)).append(System.lineSeparator());
        }

        void blank() {
            builder.append(System.lineSeparator());
        }

        @Override
        public String toString() {
            return builder.toString();
        }
    }
}
