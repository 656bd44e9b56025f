package org.carball.probe.trace;

import java.io.IOException;
import java.util.Map;
import java.util.function.Consumer;

/**
 * An engine execution-trace stream. Subscribers receive every event of every class as a raw
 * field map; the stream cannot be filtered at the source.
 */
public interface TraceSource {

    /**
     * Starts delivering events to {@code listener}, possibly from another thread.
     *
     * @throws IOException if the stream cannot be subscribed to
     */
    TraceSubscription subscribe(Consumer<Map<String, Object>> listener) throws IOException;

    String name();

    /**
     * A source for deployments without a trace collector. Subscribing always fails, so
     * profiling falls back to wall-clock timing.
     */
    static TraceSource none() {
        return new TraceSource() {
            @Override
            public TraceSubscription subscribe(Consumer<Map<String, Object>> listener) throws IOException {
                throw new IOException("No trace collector configured");
            }

            @Override
            public String name() {
                return "none";
            }
        };
    }
}
