package org.carball.probe.trace;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Tails a JSON-lines file written by an external trace collector, one event object per line.
 * Only lines appended after subscription are delivered.
 */
@Slf4j
public class JsonLinesTraceSource implements TraceSource {

    private static final TypeReference<Map<String, Object>> EVENT_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final Duration pollInterval;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public JsonLinesTraceSource(Path file, Duration pollInterval) {
        this.file = file;
        this.pollInterval = pollInterval;
    }

    @Override
    public TraceSubscription subscribe(Consumer<Map<String, Object>> listener) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Trace file not found: " + file);
        }

        Tailer tailer = new Tailer(listener, Files.size(file));
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "trace-tail-" + file.getFileName());
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(tailer::poll, 0, Math.max(1, pollInterval.toMillis()), TimeUnit.MILLISECONDS);
        log.debug("Tailing trace file {} from offset {}", file, tailer.position);

        return () -> {
            executor.shutdownNow();
            try {
                executor.awaitTermination(pollInterval.toMillis() + 1000, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
    }

    @Override
    public String name() {
        return "jsonl:" + file.getFileName();
    }

    private final class Tailer {

        private final Consumer<Map<String, Object>> listener;
        // Raw bytes of the unfinished last line; a multi-byte character may span two polls
        private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
        private long position;

        private Tailer(Consumer<Map<String, Object>> listener, long position) {
            this.listener = listener;
            this.position = position;
        }

        void poll() {
            try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "r")) {
                long length = raf.length();
                if (length < position) {
                    log.debug("Trace file {} was truncated, restarting from the beginning", file);
                    position = 0;
                    pending.reset();
                }
                if (length == position) {
                    return;
                }

                byte[] chunk = new byte[(int) Math.min(length - position, Integer.MAX_VALUE)];
                raf.seek(position);
                raf.readFully(chunk);
                position += chunk.length;
                deliverCompleteLines(chunk);
            } catch (IOException e) {
                log.debug("Could not read trace file {}: {}", file, e.getMessage());
            }
        }

        private void deliverCompleteLines(byte[] chunk) {
            int lineStart = 0;
            for (int i = 0; i < chunk.length; i++) {
                if (chunk[i] != '\n') {
                    continue;
                }
                pending.write(chunk, lineStart, i - lineStart);
                String line = new String(pending.toByteArray(), StandardCharsets.UTF_8).trim();
                pending.reset();
                lineStart = i + 1;
                deliver(line);
            }
            pending.write(chunk, lineStart, chunk.length - lineStart);
        }

        private void deliver(String line) {
            if (line.isEmpty()) {
                return;
            }
            try {
                listener.accept(objectMapper.readValue(line, EVENT_TYPE));
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed trace line: {}", line);
            } catch (RuntimeException e) {
                // A failing listener must not cancel the scheduled poll
                log.debug("Trace delivery failed: {}", e.getMessage());
            }
        }
    }
}
