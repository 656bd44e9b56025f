package org.carball.probe.trace;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.model.trace.TraceEvent;
import org.carball.probe.model.trace.TraceEventClass;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attributes buffered trace events to a run by position and reduces them to timings.
 *
 * <p>The trace session is not the session that issued the query, so events cannot be matched
 * by session id. A run owns the events from its start mark up to the first terminating event.
 */
@Slf4j
public class EventCorrelator {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(200);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final Duration pollInterval;

    public EventCorrelator() {
        this(DEFAULT_POLL_INTERVAL);
    }

    public EventCorrelator(Duration pollInterval) {
        this.pollInterval = pollInterval.isNegative() || pollInterval.isZero()
                ? DEFAULT_POLL_INTERVAL
                : pollInterval;
    }

    /**
     * Polls the handle until a terminating event appears at or after {@code startIndex}, or the
     * timeout elapses. On timeout returns whatever arrived so far; that is not an error.
     */
    public List<TraceEvent> waitForRunEnd(TraceHandle handle, int startIndex, Duration timeout)
            throws InterruptedException {
        return waitForRunEnd(handle, startIndex, timeout, 0);
    }

    /**
     * As {@link #waitForRunEnd(TraceHandle, int, Duration)}, first passing over
     * {@code skipCommandEnds} command end events that belong to a command issued before the run,
     * such as a cache clear whose end event is delivered late. Skipped events are left out of the
     * returned window.
     */
    public List<TraceEvent> waitForRunEnd(TraceHandle handle, int startIndex, Duration timeout, int skipCommandEnds)
            throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();

        while (true) {
            List<TraceEvent> window = new ArrayList<>();
            int skipped = 0;
            for (TraceEvent event : handle.eventsFrom(startIndex)) {
                TraceEventClass eventClass = event.eventClass();
                if (eventClass == TraceEventClass.COMMAND_END && skipped < skipCommandEnds) {
                    skipped++;
                    log.debug("Skipping end event of an earlier command at position {}", event.sequence());
                    continue;
                }
                window.add(event);
                if (eventClass.isTerminator()) {
                    return window;
                }
            }

            if (!handle.isAvailable() || handle.isClosed()) {
                return window;
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.debug("No terminating trace event within {}ms, using {} partial events",
                        timeout.toMillis(), window.size());
                return window;
            }
            Thread.sleep(Math.max(1, Math.min(pollInterval.toMillis(), remaining / 1_000_000)));
        }
    }

    /**
     * Reduces one run's events to an engine breakdown.
     */
    public EngineBreakdown summarize(List<TraceEvent> events) {
        Double total = null;
        Double cpu = null;
        double seSum = 0;
        boolean seSeen = false;
        int seQueries = 0;
        int cacheHits = 0;
        int cacheMisses = 0;
        boolean terminated = false;
        Map<String, Integer> counts = new LinkedHashMap<>();

        for (TraceEvent event : events) {
            TraceEventClass eventClass = event.eventClass();
            String countKey = event.rawClassName() != null ? event.rawClassName() : eventClass.getEngineName();
            counts.merge(countKey, 1, Integer::sum);

            if (eventClass.isTerminator()) {
                terminated = true;
                // QueryEnd carries the query duration; CommandEnd only stands in when no QueryEnd has one
                if (event.hasDuration() && (eventClass == TraceEventClass.QUERY_END || total == null)) {
                    total = event.durationMs();
                    cpu = event.cpuTimeMs();
                }
            } else if (eventClass.isStorageEngine()) {
                seQueries++;
                if (event.hasDuration()) {
                    seSum += event.durationMs();
                    seSeen = true;
                }
            } else if (eventClass == TraceEventClass.SE_CACHE_MATCH) {
                cacheHits++;
            } else if (eventClass == TraceEventClass.SE_CACHE_MISS) {
                cacheMisses++;
            }
        }

        Double se = seSeen ? round(seSum) : null;
        Double fe = total != null && se != null ? round(Math.max(total - se, 0)) : null;
        return new EngineBreakdown(total, se, fe, cpu, seQueries, cacheHits, cacheMisses, events.size(),
                Collections.unmodifiableMap(counts), terminated);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
