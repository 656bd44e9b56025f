package org.carball.probe.trace;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;

/**
 * Opens and closes trace sessions on a {@link TraceSource}.
 */
@Slf4j
public class TraceSessionManager {

    private final TraceSource source;
    private final TraceEventParser parser;
    private final Clock clock;

    public TraceSessionManager(TraceSource source) {
        this(source, Clock.systemUTC());
    }

    public TraceSessionManager(TraceSource source, Clock clock) {
        this.source = source;
        this.parser = new TraceEventParser();
        this.clock = clock;
    }

    /**
     * Subscribes to the source. When subscription fails the returned handle is flagged
     * unavailable instead of throwing, and profiling degrades to wall-clock timing.
     */
    public TraceHandle open() {
        TraceHandle handle = new TraceHandle(source.name(), parser, clock);
        try {
            handle.attach(source.subscribe(handle::accept));
            log.debug("Trace session opened on {}", source.name());
            return handle;
        } catch (IOException | RuntimeException e) {
            log.info("Trace unavailable on {} ({}), timings will be wall-clock only", source.name(), e.getMessage());
            return TraceHandle.unavailable(source.name(), e.getMessage());
        }
    }

    public void close(TraceHandle handle) {
        if (handle != null) {
            handle.close();
        }
    }

    public TraceSource getSource() {
        return source;
    }
}
