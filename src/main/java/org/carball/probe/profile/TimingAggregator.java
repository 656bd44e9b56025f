package org.carball.probe.profile;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.engine.Outcome;
import org.carball.probe.execution.QueryExecutor;
import org.carball.probe.model.QueryRequest;
import org.carball.probe.model.QueryResult;
import org.carball.probe.model.profile.*;
import org.carball.probe.trace.EngineBreakdown;
import org.carball.probe.trace.EventCorrelator;
import org.carball.probe.trace.TraceHandle;
import org.carball.probe.trace.TraceSessionManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs a query several times under one trace session and aggregates the timings.
 *
 * <p>The connection's operation lock is held for the whole profile so no other query can
 * interleave its trace events. Every run bypasses the result cache. When the trace yields
 * nothing in time a run still records its wall-clock duration.
 */
@Slf4j
public class TimingAggregator {

    private final QueryExecutor executor;
    private final TraceSessionManager traceManager;
    private final EventCorrelator correlator;
    private final Clock clock;

    public TimingAggregator(QueryExecutor executor, TraceSessionManager traceManager, EventCorrelator correlator) {
        this(executor, traceManager, correlator, Clock.systemUTC());
    }

    public TimingAggregator(QueryExecutor executor, TraceSessionManager traceManager, EventCorrelator correlator,
                            Clock clock) {
        this.executor = executor;
        this.traceManager = traceManager;
        this.correlator = correlator;
        this.clock = clock;
    }

    public ProfileReport profile(QueryRequest request, int runs, boolean clearCacheFirst) {
        return profile(request, ProfileOptions.builder().runs(runs).clearCacheFirst(clearCacheFirst).build());
    }

    /**
     * Profiles one query.
     *
     * @throws ProfilingCancelledException if the thread is interrupted
     */
    public ProfileReport profile(QueryRequest request, ProfileOptions options) {
        if (options.getRuns() < 1) {
            throw new IllegalArgumentException("Runs must be at least 1, got " + options.getRuns());
        }

        ReentrantLock lock = executor.getConnection().operationLock();
        lock.lock();
        try (TraceHandle handle = traceManager.open()) {
            log.info("Profiling query with {} runs (clear cache first: {}, trace: {})",
                    options.getRuns(), options.isClearCacheFirst(),
                    handle.isAvailable() ? handle.getSourceName() : "unavailable");

            // Step 1: start cold if asked
            boolean engineCacheCleared = false;
            int clearMark = handle.mark();
            if (options.isClearCacheFirst()) {
                executor.invalidate(request);
                Outcome<Boolean> cleared = executor.clearEngineCache();
                engineCacheCleared = cleared.isSuccess();
                if (!engineCacheCleared) {
                    log.debug("Engine cache not cleared: {}", cleared.message());
                }
            }

            // Step 2: sequential runs
            List<RunRecord> records = new ArrayList<>();
            boolean deadlineReached = false;
            for (int run = 1; run <= options.getRuns(); run++) {
                if (deadlinePassed(options.getDeadline())) {
                    deadlineReached = true;
                    log.info("Profiling deadline reached after {} of {} runs", records.size(), options.getRuns());
                    break;
                }
                if (Thread.currentThread().isInterrupted()) {
                    throw new ProfilingCancelledException("Profiling cancelled before run " + run);
                }

                CacheState cacheState = run == 1 && options.isClearCacheFirst() ? CacheState.COLD : CacheState.WARM;
                int clearStart = run == 1 && engineCacheCleared ? clearMark : -1;
                records.add(executeRun(request, run, cacheState, handle, options, clearStart));
            }

            // Step 3: aggregate
            TimingSummary summary = TimingStatistics.summarize(records);
            log.info("Profiling finished: {} runs, metrics available: {}", records.size(), summary.isMetricsAvailable());

            return ProfileReport.builder()
                    .query(request.text())
                    .runs(records)
                    .summary(summary)
                    .traceSource(handle.getSourceName())
                    .traceAvailable(handle.isAvailable())
                    .clearCacheFirst(options.isClearCacheFirst())
                    .engineCacheCleared(engineCacheCleared)
                    .deadlineReached(deadlineReached)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Profiles two variants of a query one after the other and reports the improvement.
     */
    public QueryComparison compare(QueryRequest before, QueryRequest after, ProfileOptions options) {
        ProfileReport beforeReport = profile(before, options);
        ProfileReport afterReport = profile(after, options);

        TimingSummary b = beforeReport.getSummary();
        TimingSummary a = afterReport.getSummary();
        Double wallImprovement = TimingStatistics.improvement(b.getWall(), a.getWall());
        Double wallPercent = null;
        if (wallImprovement != null && b.getWall().mean() > 0) {
            wallPercent = Math.round(wallImprovement / b.getWall().mean() * 1000.0) / 10.0;
        }

        return new QueryComparison(beforeReport, afterReport, wallImprovement, wallPercent,
                TimingStatistics.improvement(b.getStorageEngine(), a.getStorageEngine()),
                TimingStatistics.improvement(b.getFormulaEngine(), a.getFormulaEngine()));
    }

    /**
     * Profiles several named queries in order. Queries not started before the deadline are skipped.
     */
    public Map<String, ProfileReport> profileBatch(Map<String, QueryRequest> queries, ProfileOptions options) {
        Map<String, ProfileReport> reports = new LinkedHashMap<>();
        for (Map.Entry<String, QueryRequest> entry : queries.entrySet()) {
            if (deadlinePassed(options.getDeadline())) {
                log.info("Profiling deadline reached, skipping {} remaining queries", queries.size() - reports.size());
                break;
            }
            reports.put(entry.getKey(), profile(entry.getValue(), options));
        }
        return reports;
    }

    private RunRecord executeRun(QueryRequest request, int run, CacheState cacheState, TraceHandle handle,
                                 ProfileOptions options, int clearStart) {
        int mark = handle.mark();
        int skipCommandEnds = clearStart >= 0 && !endedBefore(handle, clearStart, mark) ? 1 : 0;
        long start = System.nanoTime();
        QueryResult result = executor.execute(request.withBypassCache(true));
        double wallMs = Math.round((System.nanoTime() - start) / 10_000.0) / 100.0;

        EngineBreakdown breakdown = EngineBreakdown.empty();
        if (result.isSuccess() && handle.isAvailable()) {
            try {
                breakdown = correlator.summarize(
                        correlator.waitForRunEnd(handle, mark, eventTimeout(options), skipCommandEnds));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProfilingCancelledException("Profiling cancelled during run " + run, e);
            }
        }

        log.info("Run {} ({}): wall {} ms, SE {} ms, FE {} ms, {} events", run, cacheState.getLabel(), wallMs,
                breakdown.seMs(), breakdown.feMs(), breakdown.eventCount());

        return new RunRecord(run, wallMs, breakdown.seMs(), breakdown.feMs(), breakdown.totalMs(), breakdown.cpuMs(),
                breakdown.seQueryCount(), breakdown.seCacheHits(), breakdown.seCacheMisses(),
                result.getRowCount(), cacheState, result.isSuccess(), result.getError(), breakdown.eventCount(),
                breakdown.eventCounts(), breakdown.terminated());
    }

    // The cache clear's own end event may still be in flight; if so the first run must not take it as its end
    private static boolean endedBefore(TraceHandle handle, int from, int to) {
        return handle.eventsFrom(from).stream()
                .limit(Math.max(0, to - from))
                .anyMatch(event -> event.eventClass().isTerminator());
    }

    // The event wait never runs past the overall deadline
    private Duration eventTimeout(ProfileOptions options) {
        Duration timeout = options.getEventTimeout();
        if (options.getDeadline() == null) {
            return timeout;
        }
        Duration untilDeadline = Duration.between(clock.instant(), options.getDeadline());
        if (untilDeadline.isNegative()) {
            return Duration.ZERO;
        }
        return untilDeadline.compareTo(timeout) < 0 ? untilDeadline : timeout;
    }

    private boolean deadlinePassed(Instant deadline) {
        return deadline != null && !clock.instant().isBefore(deadline);
    }
}
