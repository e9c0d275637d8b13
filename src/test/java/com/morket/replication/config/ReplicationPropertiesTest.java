package com.morket.replication.config;

import com.morket.replication.support.fixture.ReplicationPropertiesFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReplicationPropertiesTest {

    @Test
    @DisplayName("batchSize 0 이하는 기동 시 거부")
    void rejectsInvalidBatchSize() {
        assertThatThrownBy(() -> ReplicationPropertiesFixture.withBatchSize(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("batch-size");
    }

    @Test
    @DisplayName("DLQ backoffBase 는 양수")
    void rejectsZeroBackoffBase() {
        assertThatThrownBy(() -> new ReplicationProperties.Dlq(5, Duration.ZERO, Duration.ofSeconds(60), 50, 1, Duration.ofMinutes(4)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("실시간 / 재처리 재시도 예산 분리")
    void retryBudgets() {
        // given
        ReplicationProperties properties = new ReplicationProperties(
                true, 100, Duration.ofSeconds(5), 3,
                List.of(1000L, 2000L, 4000L), 4000L,
                ReplicationPropertiesFixture.dlq(),
                new ReplicationProperties.Listener(Duration.ofMillis(500), null, null, null)
        );

        // then
        assertThat(properties.liveRetryBudget().maxAttempts()).isEqualTo(3);
        assertThat(properties.liveRetryBudget().backoffAfter(1)).isEqualTo(1000L);
        assertThat(properties.liveRetryBudget().backoffAfter(4)).isEqualTo(4000L);
        assertThat(properties.dlq().replayRetryBudget().maxAttempts()).isEqualTo(1);
    }
}
