package org.carball.probe.trace;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.model.trace.TraceEvent;
import org.carball.probe.model.trace.TraceEventClass;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw trace field maps into {@link TraceEvent}s. Never throws: absent or malformed
 * values become nulls and unknown classes become {@link TraceEventClass#UNKNOWN}.
 */
@Slf4j
public class TraceEventParser {

    private static final List<String> CLASS_KEYS = List.of("EventClass", "event_class", "eventClass", "name", "event");
    private static final List<String> DURATION_KEYS = List.of("Duration", "duration", "duration_ms", "DurationMs");
    private static final List<String> CPU_KEYS = List.of("CpuTime", "cpu_time", "cpu_time_ms", "CpuTimeMs");

    public TraceEvent parse(int sequence, Map<String, Object> raw, Instant receivedAt) {
        Map<String, Object> fields = raw == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(raw));

        Object className = first(fields, CLASS_KEYS);
        String rawClassName = className == null ? null : String.valueOf(className);

        return new TraceEvent(
                sequence,
                TraceEventClass.fromName(rawClassName),
                rawClassName,
                parseMillis(first(fields, DURATION_KEYS)),
                parseMillis(first(fields, CPU_KEYS)),
                fields,
                receivedAt);
    }

    /**
     * Parses a non-negative duration, returning null for anything unusable.
     */
    static Double parseMillis(Object value) {
        if (value == null) {
            return null;
        }
        double parsed;
        if (value instanceof Number number) {
            parsed = number.doubleValue();
        } else {
            try {
                parsed = Double.parseDouble(String.valueOf(value).trim());
            } catch (NumberFormatException e) {
                log.debug("Ignoring unparseable duration value: {}", value);
                return null;
            }
        }
        if (Double.isNaN(parsed) || Double.isInfinite(parsed) || parsed < 0) {
            return null;
        }
        return parsed;
    }

    private static Object first(Map<String, Object> fields, List<String> keys) {
        for (String key : keys) {
            Object value = fields.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
