package org.carball.probe.profile;

import org.carball.probe.model.profile.MetricStats;
import org.carball.probe.model.profile.RunRecord;
import org.carball.probe.model.profile.TimingSummary;

import java.util.List;

/**
 * Aggregates run records into a {@link TimingSummary}.
 */
public final class TimingStatistics {

    private TimingStatistics() {
    }

    /**
     * Summarises successful runs, or every run when none succeeded, so wall time is always reported.
     */
    public static TimingSummary summarize(List<RunRecord> runs) {
        List<RunRecord> successful = runs.stream().filter(RunRecord::success).toList();
        List<RunRecord> basis = successful.isEmpty() ? runs : successful;

        MetricStats wall = MetricStats.of(basis.stream().map(run -> (Double) run.wallMs()).toList());
        MetricStats se = MetricStats.of(basis.stream().map(RunRecord::seMs).toList());
        MetricStats fe = MetricStats.of(basis.stream().map(RunRecord::feMs).toList());

        Double sePercent = null;
        Double fePercent = null;
        if (se != null && fe != null && se.mean() + fe.mean() > 0) {
            double engineTotal = se.mean() + fe.mean();
            sePercent = roundOne(se.mean() / engineTotal * 100);
            fePercent = roundOne(fe.mean() / engineTotal * 100);
        }

        return TimingSummary.builder()
                .wall(wall)
                .storageEngine(se)
                .formulaEngine(fe)
                .metricsAvailable(runs.stream().anyMatch(RunRecord::hasEngineBreakdown))
                .runCount(runs.size())
                .successfulRuns(successful.size())
                .storageEnginePercent(sePercent)
                .formulaEnginePercent(fePercent)
                .totalSeQueries(runs.stream().mapToInt(RunRecord::seQueryCount).sum())
                .totalSeCacheHits(runs.stream().mapToInt(RunRecord::seCacheHits).sum())
                .totalSeCacheMisses(runs.stream().mapToInt(RunRecord::seCacheMisses).sum())
                .build();
    }

    /**
     * Mean improvement from {@code before} to {@code after}; positive when {@code after} is faster.
     */
    static Double improvement(MetricStats before, MetricStats after) {
        if (before == null || after == null) {
            return null;
        }
        return Math.round((before.mean() - after.mean()) * 100.0) / 100.0;
    }

    private static double roundOne(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
