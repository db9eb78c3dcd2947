package io.github.drompincen.clarity.protocol.ws;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CloseCodeTest {

    @Test
    void codesMatchClientContract() {
        assertThat(CloseCode.NORMAL.code()).isEqualTo(1000);
        assertThat(CloseCode.SESSION_ENDED.code()).isEqualTo(4000);
        assertThat(CloseCode.SESSION_ABANDONED.code()).isEqualTo(4001);
        assertThat(CloseCode.INVALID_SESSION.code()).isEqualTo(4002);
        assertThat(CloseCode.TOO_MANY_ERRORS.code()).isEqualTo(4003);
        assertThat(CloseCode.SERVER_SHUTDOWN.code()).isEqualTo(4004);
        assertThat(CloseCode.IDLE_TIMEOUT.code()).isEqualTo(4005);
    }

    @Test
    void codesAreDistinct() {
        assertThat(Arrays.stream(CloseCode.values()).map(CloseCode::code).distinct().count())
                .isEqualTo(CloseCode.values().length);
    }

    @Test
    void fromCodeRejectsUnknown() {
        assertThat(CloseCode.fromCode(4003)).isEqualTo(CloseCode.TOO_MANY_ERRORS);
        assertThatThrownBy(() -> CloseCode.fromCode(1011)).isInstanceOf(IllegalArgumentException.class);
    }
}
