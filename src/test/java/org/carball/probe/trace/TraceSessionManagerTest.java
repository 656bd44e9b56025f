package org.carball.probe.trace;

import org.carball.probe.support.FakeTraceSource;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TraceSessionManagerTest {

    @Test
    void shouldBufferEventsAfterOpening() {
        FakeTraceSource source = new FakeTraceSource();
        source.emit("QueryEnd", 1);

        TraceHandle handle = new TraceSessionManager(source).open();
        source.emit("QueryBegin", null);
        source.emit("QueryEnd", 10);

        assertThat(handle.isAvailable()).isTrue();
        assertThat(handle.getSourceName()).isEqualTo("fake");
        assertThat(handle.size()).isEqualTo(2);
        assertThat(handle.eventsFrom(1)).hasSize(1);
        assertThat(handle.eventsFrom(5)).isEmpty();
    }

    @Test
    void shouldDegradeToUnavailableHandleWhenSubscriptionFails() {
        FakeTraceSource source = new FakeTraceSource().failingOnSubscribe();

        TraceHandle handle = new TraceSessionManager(source).open();

        assertThat(handle.isAvailable()).isFalse();
        assertThat(handle.getUnavailableReason()).isEqualTo("Trace subscription refused");
        handle.accept(Map.of("EventClass", "QueryEnd"));
        assertThat(handle.size()).isZero();
    }

    @Test
    void shouldDegradeWhenNoCollectorConfigured() {
        TraceHandle handle = new TraceSessionManager(TraceSource.none()).open();

        assertThat(handle.isAvailable()).isFalse();
        assertThat(handle.getSourceName()).isEqualTo("none");
    }

    @Test
    void shouldUnsubscribeOnceAndStopBufferingWhenClosed() {
        // Given
        FakeTraceSource source = new FakeTraceSource();
        TraceSessionManager manager = new TraceSessionManager(source);
        TraceHandle handle = manager.open();

        // When
        manager.close(handle);
        handle.close();
        handle.accept(Map.of("EventClass", "QueryEnd"));

        // Then
        assertThat(handle.isClosed()).isTrue();
        assertThat(source.isSubscribed()).isFalse();
        assertThat(source.closedSubscriptions()).isEqualTo(1);
        assertThat(handle.size()).isZero();
    }

    @Test
    void shouldOpenIndependentSessions() {
        FakeTraceSource source = new FakeTraceSource();
        TraceSessionManager manager = new TraceSessionManager(source);

        try (TraceHandle first = manager.open()) {
            assertThat(first.isAvailable()).isTrue();
        }
        try (TraceHandle second = manager.open()) {
            source.emit("QueryEnd", 3);
            assertThat(second.size()).isEqualTo(1);
        }

        assertThat(source.subscriptions()).isEqualTo(2);
        assertThat(source.closedSubscriptions()).isEqualTo(2);
    }

    @Test
    void noneSourceShouldRefuseSubscription() {
        TraceSource none = TraceSource.none();

        assertThatThrownBy(() -> none.subscribe(event -> {
        }))
                .isInstanceOf(IOException.class)
                .hasMessage("No trace collector configured");
    }
}
