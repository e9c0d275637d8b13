package com.morket.replication.dlq.entity;

import com.morket.replication.dlq.exception.InvalidDeadLetterStatusException;
import com.morket.replication.dlq.fixture.DeadLetterEventFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeadLetterStatusTest {

    @Test
    @DisplayName("대소문자 무시 변환")
    void from_IgnoresCase() {
        assertThat(DeadLetterStatus.from("pending")).isEqualTo(DeadLetterStatus.PENDING);
        assertThat(DeadLetterStatus.from("Exhausted")).isEqualTo(DeadLetterStatus.EXHAUSTED);
        assertThat(DeadLetterStatus.from("REPLAYED")).isEqualTo(DeadLetterStatus.REPLAYED);
    }

    @Test
    @DisplayName("지원하지 않는 상태 : 예외")
    void from_Unknown() {
        assertThatThrownBy(() -> DeadLetterStatus.from("failed"))
                .isInstanceOf(InvalidDeadLetterStatusException.class)
                .hasMessageContaining("failed");
    }

    @Test
    @DisplayName("isLastAttempt : retryCount + 1 이 maxRetries 에 도달")
    void isLastAttempt() {
        assertThat(DeadLetterEventFixture.builder().retryCount(3).maxRetries(5).build().isLastAttempt()).isFalse();
        assertThat(DeadLetterEventFixture.builder().retryCount(4).maxRetries(5).build().isLastAttempt()).isTrue();
    }
}
