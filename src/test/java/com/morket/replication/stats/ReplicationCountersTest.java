package com.morket.replication.stats;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ReplicationCountersTest {

    private SimpleMeterRegistry meterRegistry;
    private ReplicationCounters counters;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        counters = new ReplicationCounters(meterRegistry);
    }

    @Test
    @DisplayName("적재 행 수와 마지막 적재 시각, 실패 이벤트 수 누적")
    void flushedAndFailed() {
        // given
        Instant first = Instant.parse("2026-01-01T00:00:00Z");
        Instant second = first.plusSeconds(5);

        // when
        counters.recordFlushed(3, first);
        counters.recordFlushed(2, second);
        counters.recordFailed(4);

        // then
        assertThat(counters.getTotalFlushed()).isEqualTo(5);
        assertThat(counters.getLastFlushAt()).isEqualTo(second);
        assertThat(counters.getTotalFailed()).isEqualTo(4);
        assertThat(meterRegistry.get("replication_events_flushed_total").counter().count()).isEqualTo(5.0);
        assertThat(meterRegistry.get("replication_events_failed_total").counter().count()).isEqualTo(4.0);
    }

    @Test
    @DisplayName("DLQ 대기 : 적재 +1, 재처리/소진 -1, 0 아래로 내려가지 않음")
    void dlqPending() {
        // when
        counters.recordDlqInserted();
        counters.recordDlqInserted();
        counters.recordDlqReplayed();
        counters.recordDlqRetryScheduled();
        counters.recordDlqExhausted();
        counters.recordDlqExhausted();

        // then
        assertThat(counters.getDlqPending()).isZero();
        assertThat(meterRegistry.get("replication_dlq_pending_events").gauge().value()).isZero();
        assertThat(meterRegistry.get("dlq_events_total").tag("result", "inserted").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("dlq_events_total").tag("result", "exhausted").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("dlq_events_total").tag("result", "retried").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("관리자 리셋 건수만큼 DLQ 대기 증가")
    void dlqReset() {
        // when
        counters.recordDlqReset(3);

        // then
        assertThat(counters.getDlqPending()).isEqualTo(3);
        assertThat(meterRegistry.get("dlq_events_total").tag("result", "reset").counter().count()).isEqualTo(3.0);
    }
}
