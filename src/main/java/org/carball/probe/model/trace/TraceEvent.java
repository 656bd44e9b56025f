package org.carball.probe.model.trace;

import java.time.Instant;
import java.util.Map;

/**
 * One buffered trace observation. Durations are null when the engine did not send a usable value.
 *
 * @param sequence position in the trace buffer, used for run correlation
 */
public record TraceEvent(
        int sequence,
        TraceEventClass eventClass,
        String rawClassName,
        Double durationMs,
        Double cpuTimeMs,
        Map<String, Object> fields,
        Instant receivedAt) {

    public boolean hasDuration() {
        return durationMs != null;
    }
}
