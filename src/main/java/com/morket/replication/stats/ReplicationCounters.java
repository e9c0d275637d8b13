package com.morket.replication.stats;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 복제 카운터 (기동 이후 누적, 영속화하지 않음)
 * 메모리 값은 getStats 용, 같은 값을 Micrometer 로도 노출
 */
@Component
public class ReplicationCounters {

    private final AtomicLong totalFlushed = new AtomicLong();
    private final AtomicLong totalFailed = new AtomicLong();
    private final AtomicLong dlqPending = new AtomicLong();
    private final AtomicReference<Instant> lastFlushAt = new AtomicReference<>();

    private final MeterRegistry meterRegistry;

    public ReplicationCounters(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        Gauge.builder("replication_dlq_pending_events", dlqPending, AtomicLong::get)
                .description("기동 이후 DLQ 에 적재되어 아직 종료되지 않은 이벤트 수")
                .register(meterRegistry);
    }

    // 적재 성공 (행 단위)
    public void recordFlushed(int rows, Instant flushedAt) {
        totalFlushed.addAndGet(rows);
        lastFlushAt.set(flushedAt);

        Counter.builder("replication_events_flushed_total")
                .register(meterRegistry).increment(rows);
    }

    // 재시도 소진 (원본 이벤트 단위)
    public void recordFailed(int events) {
        totalFailed.addAndGet(events);

        Counter.builder("replication_events_failed_total")
                .register(meterRegistry).increment(events);
    }

    public void recordDlqInserted() {
        dlqPending.incrementAndGet();
        dlqEvent("inserted");
    }

    public void recordDlqReplayed() {
        decrementPending();
        dlqEvent("replayed");
    }

    public void recordDlqRetryScheduled() {
        dlqEvent("retried");
    }

    public void recordDlqExhausted() {
        decrementPending();
        dlqEvent("exhausted");
    }

    public void recordDlqReset(int count) {
        dlqPending.addAndGet(count);
        Counter.builder("dlq_events_total")
                .tag("result", "reset")
                .register(meterRegistry).increment(count);
    }

    public long getTotalFlushed() {
        return totalFlushed.get();
    }

    public long getTotalFailed() {
        return totalFailed.get();
    }

    public long getDlqPending() {
        return dlqPending.get();
    }

    public Instant getLastFlushAt() {
        return lastFlushAt.get();
    }

    // 다른 인스턴스가 적재한 행을 처리하면 음수가 될 수 있어 0 에서 멈춤
    private void decrementPending() {
        dlqPending.updateAndGet(current -> Math.max(0, current - 1));
    }

    private void dlqEvent(String result) {
        Counter.builder("dlq_events_total")
                .tag("result", result)
                .register(meterRegistry).increment();
    }
}
