package org.carball.probe.trace;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class JsonLinesTraceSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldDeliverOnlyLinesAppendedAfterSubscription() throws Exception {
        // Given
        Path file = tempDir.resolve("trace.jsonl");
        Files.writeString(file, "{\"EventClass\":\"QueryEnd\",\"Duration\":1}\n");
        JsonLinesTraceSource source = new JsonLinesTraceSource(file, Duration.ofMillis(10));
        List<Map<String, Object>> received = new CopyOnWriteArrayList<>();

        // When
        try (TraceSubscription ignored = source.subscribe(received::add)) {
            append(file, "{\"EventClass\":\"VertiPaqSEQueryEnd\",\"Duration\":12}\n"
                    + "not json\n"
                    + "{\"EventClass\":\"QueryEnd\",\"Duration\":40}\n");
            waitForSize(received, 2);
        }

        // Then
        assertThat(received).extracting(event -> event.get("EventClass"))
                .containsExactly("VertiPaqSEQueryEnd", "QueryEnd");
        assertThat(received.get(1).get("Duration")).isEqualTo(40);
    }

    @Test
    void shouldHoldPartialLineUntilComplete() throws Exception {
        Path file = tempDir.resolve("partial.jsonl");
        Files.writeString(file, "");
        JsonLinesTraceSource source = new JsonLinesTraceSource(file, Duration.ofMillis(10));
        List<Map<String, Object>> received = new CopyOnWriteArrayList<>();

        try (TraceSubscription ignored = source.subscribe(received::add)) {
            append(file, "{\"EventClass\":\"Query");
            Thread.sleep(100);
            assertThat(received).isEmpty();

            append(file, "End\",\"Duration\":5}\n");
            waitForSize(received, 1);
        }

        assertThat(received.get(0).get("EventClass")).isEqualTo("QueryEnd");
    }

    @Test
    void shouldDecodeCharacterSplitAcrossAppends() throws Exception {
        // Given - the two bytes of the umlaut land in different appends
        Path file = tempDir.resolve("utf8.jsonl");
        Files.writeString(file, "");
        JsonLinesTraceSource source = new JsonLinesTraceSource(file, Duration.ofMillis(10));
        List<Map<String, Object>> received = new CopyOnWriteArrayList<>();
        byte[] line = "{\"EventClass\":\"QueryEnd\",\"TextData\":\"Umsätze\"}\n".getBytes(StandardCharsets.UTF_8);
        int split = indexOf(line, (byte) 0xC3) + 1;

        // When
        try (TraceSubscription ignored = source.subscribe(received::add)) {
            appendBytes(file, Arrays.copyOfRange(line, 0, split));
            Thread.sleep(100);
            appendBytes(file, Arrays.copyOfRange(line, split, line.length));
            waitForSize(received, 1);
        }

        // Then
        assertThat(received).hasSize(1);
        assertThat(received.get(0).get("TextData")).isEqualTo("Umsätze");
    }

    @Test
    void shouldKeepDeliveringAfterListenerFailure() throws Exception {
        Path file = tempDir.resolve("failing.jsonl");
        Files.writeString(file, "");
        JsonLinesTraceSource source = new JsonLinesTraceSource(file, Duration.ofMillis(10));
        List<Map<String, Object>> received = new CopyOnWriteArrayList<>();

        try (TraceSubscription ignored = source.subscribe(event -> {
            if ("Boom".equals(event.get("EventClass"))) {
                throw new IllegalStateException("listener failed");
            }
            received.add(event);
        })) {
            append(file, "{\"EventClass\":\"Boom\"}\n{\"EventClass\":\"QueryEnd\"}\n");
            waitForSize(received, 1);
        }

        assertThat(received).extracting(event -> event.get("EventClass")).containsExactly("QueryEnd");
    }

    @Test
    void shouldRefuseMissingFile() {
        JsonLinesTraceSource source = new JsonLinesTraceSource(tempDir.resolve("missing.jsonl"), Duration.ofMillis(10));

        assertThatThrownBy(() -> source.subscribe(event -> {
        }))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Trace file not found");
        assertThat(source.name()).isEqualTo("jsonl:missing.jsonl");
    }

    private static void append(Path file, String text) throws IOException {
        Files.write(file, text.getBytes(StandardCharsets.UTF_8), StandardOpenOption.APPEND);
    }

    private static void appendBytes(Path file, byte[] bytes) throws IOException {
        Files.write(file, bytes, StandardOpenOption.APPEND);
    }

    private static int indexOf(byte[] bytes, byte value) {
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == value) {
                return i;
            }
        }
        throw new IllegalArgumentException("byte not found");
    }

    private static void waitForSize(List<?> list, int size) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (list.size() < size && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }
}
