package com.morket.replication.service;

import com.morket.replication.stats.ReplicationStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class ReplicationHealthIndicatorTest {

    @Mock
    private ReplicationService replicationService;

    @InjectMocks
    private ReplicationHealthIndicator healthIndicator;

    @Test
    @DisplayName("실행 중 : UP, 상세에 카운터 포함")
    void health_Running() {
        // given
        Instant lastFlushAt = Instant.parse("2026-01-01T00:00:00Z");
        given(replicationService.isRunning()).willReturn(true);
        given(replicationService.getStats()).willReturn(new ReplicationStats(3, 100, 2, lastFlushAt, 1));

        // when
        Health health = healthIndicator.health();

        // then
        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("bufferedEvents", 3)
                .containsEntry("totalFlushed", 100L)
                .containsEntry("totalFailed", 2L)
                .containsEntry("dlqPending", 1L)
                .containsEntry("lastFlushAt", "2026-01-01T00:00:00Z");
    }

    @Test
    @DisplayName("정지 : OUT_OF_SERVICE, flush 이력 없으면 lastFlushAt 생략")
    void health_Stopped() {
        // given
        given(replicationService.isRunning()).willReturn(false);
        given(replicationService.getStats()).willReturn(new ReplicationStats(0, 0, 0, null, 0));

        // when
        Health health = healthIndicator.health();

        // then
        assertThat(health.getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
        assertThat(health.getDetails()).doesNotContainKey("lastFlushAt");
    }
}
