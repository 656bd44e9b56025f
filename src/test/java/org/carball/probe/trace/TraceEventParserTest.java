package org.carball.probe.trace;

import org.carball.probe.model.trace.TraceEvent;
import org.carball.probe.model.trace.TraceEventClass;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class TraceEventParserTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private final TraceEventParser parser = new TraceEventParser();

    @Test
    void shouldParseEngineStyleFields() {
        TraceEvent event = parser.parse(0, Map.of("EventClass", "VertiPaqSEQueryEnd", "Duration", 12, "CpuTime", 30),
                NOW);

        assertThat(event.eventClass()).isEqualTo(TraceEventClass.SE_QUERY_END);
        assertThat(event.rawClassName()).isEqualTo("VertiPaqSEQueryEnd");
        assertThat(event.durationMs()).isEqualTo(12.0);
        assertThat(event.cpuTimeMs()).isEqualTo(30.0);
        assertThat(event.receivedAt()).isEqualTo(NOW);
    }

    @Test
    void shouldParseCollectorStyleFields() {
        TraceEvent event = parser.parse(3, Map.of("event_class", "query_end", "duration_ms", "45.5"), NOW);

        assertThat(event.sequence()).isEqualTo(3);
        assertThat(event.eventClass()).isEqualTo(TraceEventClass.QUERY_END);
        assertThat(event.durationMs()).isEqualTo(45.5);
        assertThat(event.cpuTimeMs()).isNull();
    }

    @Test
    void shouldMapUnknownOrMissingClassToUnknown() {
        assertThat(parser.parse(0, Map.of("EventClass", "ProgressReportEnd"), NOW).eventClass())
                .isEqualTo(TraceEventClass.UNKNOWN);
        assertThat(parser.parse(0, Map.of("Duration", 5), NOW).eventClass())
                .isEqualTo(TraceEventClass.UNKNOWN);
        assertThat(parser.parse(0, null, NOW).fields()).isEmpty();
    }

    @Test
    void shouldDropUnusableDurations() {
        assertThat(TraceEventParser.parseMillis("abc")).isNull();
        assertThat(TraceEventParser.parseMillis(-1)).isNull();
        assertThat(TraceEventParser.parseMillis(Double.NaN)).isNull();
        assertThat(TraceEventParser.parseMillis(null)).isNull();
        assertThat(TraceEventParser.parseMillis(" 7 ")).isEqualTo(7.0);
        assertThat(TraceEventParser.parseMillis(0L)).isEqualTo(0.0);
    }

    @Test
    void shouldCopyRawFields() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("EventClass", "QueryEnd");
        raw.put("TextData", "EVALUATE Sales");

        TraceEvent event = parser.parse(0, raw, NOW);
        raw.put("TextData", "changed");

        assertThat(event.fields()).containsEntry("TextData", "EVALUATE Sales");
    }

    @Test
    void shouldRecogniseClassNameSpellings() {
        assertThat(TraceEventClass.fromName("SE_QUERY_END")).isEqualTo(TraceEventClass.SE_QUERY_END);
        assertThat(TraceEventClass.fromName("Command End")).isEqualTo(TraceEventClass.COMMAND_END);
        assertThat(TraceEventClass.fromName("vertipaq-se-query-cache-match")).isEqualTo(TraceEventClass.SE_CACHE_MATCH);
        assertThat(TraceEventClass.fromName(null)).isEqualTo(TraceEventClass.UNKNOWN);
    }
}
