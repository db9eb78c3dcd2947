package io.github.drompincen.clarity.gateway.websocket;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionStateTest {

    private static final Instant T0 = Instant.parse("2025-06-01T10:00:00Z");

    @Test
    void followsLifecycle() {
        ConnectionState state = new ConnectionState("c1", "sess_1", T0);
        state.moveTo(ConnectionPhase.INITIALIZING);
        state.moveTo(ConnectionPhase.ACTIVE);
        state.moveTo(ConnectionPhase.STREAMING);
        state.moveTo(ConnectionPhase.ACTIVE);
        state.moveTo(ConnectionPhase.CLOSING);
        assertThat(state.isClosingOrClosed()).isTrue();
        state.moveTo(ConnectionPhase.CLOSED);
        assertThat(state.getPhase()).isEqualTo(ConnectionPhase.CLOSED);
    }

    @Test
    void rejectsSkippedPhases() {
        ConnectionState state = new ConnectionState("c1", "sess_1", T0);

        assertThatThrownBy(() -> state.moveTo(ConnectionPhase.STREAMING))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("CONNECTING");
    }

    @Test
    void closedIsReachableFromAnyOpenPhase() {
        ConnectionState state = new ConnectionState("c1", "sess_1", T0);
        state.moveTo(ConnectionPhase.CLOSED);

        assertThatThrownBy(() -> state.moveTo(ConnectionPhase.CLOSED)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void countsConsecutiveErrorsUntilReset() {
        ConnectionState state = new ConnectionState("c1", "sess_1", T0);

        state.recordError();
        assertThat(state.recordError()).isEqualTo(2);
        state.resetErrors();
        assertThat(state.recordError()).isEqualTo(1);
    }

    @Test
    void idleCheckUsesLastInboundFrame() {
        ConnectionState state = new ConnectionState("c1", "sess_1", T0);
        state.touch(T0.plusSeconds(60));

        assertThat(state.isIdleSince(T0.plusSeconds(30))).isFalse();
        assertThat(state.isIdleSince(T0.plusSeconds(61))).isTrue();
    }
}
