package org.carball.probe.trace;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.model.trace.TraceEvent;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * An open trace session: buffers every delivered event in arrival order.
 *
 * <p>Runs are isolated by position. Take {@link #mark()} before a run and read
 * {@link #eventsFrom(int)} afterwards; events buffered before the mark belong to earlier runs.
 */
@Slf4j
public class TraceHandle implements AutoCloseable {

    private final String sourceName;
    private final TraceEventParser parser;
    private final Clock clock;
    private final boolean available;
    private final String unavailableReason;
    private final List<TraceEvent> events = new ArrayList<>();
    private TraceSubscription subscription;
    private boolean closed;

    TraceHandle(String sourceName, TraceEventParser parser, Clock clock) {
        this(sourceName, parser, clock, true, null);
    }

    private TraceHandle(String sourceName, TraceEventParser parser, Clock clock, boolean available,
                        String unavailableReason) {
        this.sourceName = sourceName;
        this.parser = parser;
        this.clock = clock;
        this.available = available;
        this.unavailableReason = unavailableReason;
    }

    /**
     * A handle for a source that could not be subscribed to. It buffers nothing.
     */
    public static TraceHandle unavailable(String sourceName, String reason) {
        return new TraceHandle(sourceName, new TraceEventParser(), Clock.systemUTC(), false, reason);
    }

    synchronized void attach(TraceSubscription subscription) {
        if (closed) {
            subscription.close();
            return;
        }
        this.subscription = subscription;
    }

    /**
     * Buffers one raw event. Called by the trace source, possibly from its own thread.
     */
    public synchronized void accept(Map<String, Object> raw) {
        if (closed || !available) {
            return;
        }
        events.add(parser.parse(events.size(), raw, clock.instant()));
    }

    /**
     * Current buffer position; events at or after it arrived after this call.
     */
    public synchronized int mark() {
        return events.size();
    }

    public synchronized List<TraceEvent> eventsFrom(int startIndex) {
        if (startIndex >= events.size()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(events.subList(Math.max(0, startIndex), events.size()));
    }

    public synchronized int size() {
        return events.size();
    }

    public boolean isAvailable() {
        return available;
    }

    public String getUnavailableReason() {
        return unavailableReason;
    }

    public String getSourceName() {
        return sourceName;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        TraceSubscription toClose;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toClose = subscription;
            subscription = null;
        }
        if (toClose != null) {
            toClose.close();
        }
        log.debug("Trace session on {} closed", sourceName);
    }
}
