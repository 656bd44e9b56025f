package org.carball.probe.trace;

import java.util.Map;

/**
 * Engine-side timing of one run derived from its trace events. A metric is null when the
 * events needed to compute it did not arrive or carried no usable duration.
 *
 * @param totalMs     engine duration of the query end event
 * @param seMs        summed storage-engine query durations
 * @param feMs        total minus storage engine, never negative
 * @param cpuMs       engine CPU time reported on the end event
 * @param eventCounts events per raw class name, in arrival order
 * @param terminated  whether the run's end event arrived before the wait gave up
 */
public record EngineBreakdown(
        Double totalMs,
        Double seMs,
        Double feMs,
        Double cpuMs,
        int seQueryCount,
        int seCacheHits,
        int seCacheMisses,
        int eventCount,
        Map<String, Integer> eventCounts,
        boolean terminated) {

    public EngineBreakdown {
        eventCounts = eventCounts == null ? Map.of() : eventCounts;
    }

    public static EngineBreakdown empty() {
        return new EngineBreakdown(null, null, null, null, 0, 0, 0, 0, Map.of(), false);
    }

    public boolean hasBreakdown() {
        return seMs != null || feMs != null;
    }
}
