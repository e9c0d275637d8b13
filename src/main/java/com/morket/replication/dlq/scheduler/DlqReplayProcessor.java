package com.morket.replication.dlq.scheduler;

import com.morket.replication.cache.WorkspaceCacheInvalidator;
import com.morket.replication.channel.ReplicationChannel;
import com.morket.replication.config.ReplicationProperties;
import com.morket.replication.config.RetryConfig;
import com.morket.replication.dlq.entity.DeadLetterEvent;
import com.morket.replication.dlq.service.DeadLetterPayloadCodec;
import com.morket.replication.dlq.service.DeadLetterStore;
import com.morket.replication.flush.BatchFlusher;
import com.morket.replication.retry.RetryController;
import com.morket.replication.sink.AnalyticalSink;
import com.morket.replication.source.SourceStoreAdapter;
import com.morket.replication.stats.ReplicationCounters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * DLQ 이벤트 한 건 재처리
 * <p>
 * 이벤트의 식별자 하나로 원본을 다시 조회해 단독 적재 (다른 DLQ 행과 묶지 않음)
 * 성공 : REPLAYED
 * 실패 : retryCount + 1 이 maxRetries 에 도달하면 EXHAUSTED,
 * 아니면 now + base * 2^retryCount 에 다시 시도
 */
@Slf4j
@Component
public class DlqReplayProcessor {

    // 지수 상한
    private static final int MAX_BACKOFF_EXPONENT = 30;

    private final DeadLetterStore deadLetterStore;
    private final DeadLetterPayloadCodec payloadCodec;
    private final SourceStoreAdapter sourceStoreAdapter;
    private final AnalyticalSink analyticalSink;
    private final RetryController retryController;
    private final WorkspaceCacheInvalidator cacheInvalidator;
    private final ReplicationCounters counters;
    private final Duration backoffBase;
    private final Clock clock;

    public DlqReplayProcessor(
            DeadLetterStore deadLetterStore,
            DeadLetterPayloadCodec payloadCodec,
            SourceStoreAdapter sourceStoreAdapter,
            AnalyticalSink analyticalSink,
            @Qualifier(RetryConfig.REPLAY_RETRY_CONTROLLER) RetryController retryController,
            WorkspaceCacheInvalidator cacheInvalidator,
            ReplicationCounters counters,
            ReplicationProperties properties,
            Clock clock
    ) {
        this.deadLetterStore = deadLetterStore;
        this.payloadCodec = payloadCodec;
        this.sourceStoreAdapter = sourceStoreAdapter;
        this.analyticalSink = analyticalSink;
        this.retryController = retryController;
        this.cacheInvalidator = cacheInvalidator;
        this.counters = counters;
        this.backoffBase = properties.dlq().backoffBase();
        this.clock = clock;
    }

    public ReplayOutcome replay(DeadLetterEvent event) {
        AtomicReference<List<Map<String, Object>>> inserted = new AtomicReference<>(List.of());

        try {
            ReplicationChannel channel = ReplicationChannel.from(event.getChannel());
            String id = channel.extractId(payloadCodec.decode(event.getEventPayload()));

            retryController.execute(channel.getTableName(), () -> {
                List<Map<String, Object>> rows = sourceStoreAdapter.fetchDenormalizedRows(channel, List.of(id));
                if (!rows.isEmpty()) {
                    analyticalSink.insert(channel.getTableName(), rows);
                }
                inserted.set(rows);
            });

            if (inserted.get().isEmpty()) {
                log.warn("[DLQ Replay] 원본 행이 더 이상 존재하지 않음. 재처리 완료로 기록. dlqId: {}, channel: {}, id: {}",
                        event.getId(), event.getChannel(), id);
            }

        } catch (Exception e) {
            return recordFailure(event, e);
        }

        if (!deadLetterStore.markReplayed(event.getId())) {
            return ReplayOutcome.SKIPPED;
        }

        counters.recordDlqReplayed();
        log.info("[DLQ Replay] 재처리 성공. dlqId: {}, channel: {}, retryCount: {}",
                event.getId(), event.getChannel(), event.getRetryCount());

        cacheInvalidator.invalidate(inserted.get());
        return ReplayOutcome.REPLAYED;
    }

    private ReplayOutcome recordFailure(DeadLetterEvent event, Exception cause) {
        String errorReason = BatchFlusher.errorReason(cause);

        if (event.isLastAttempt()) {
            if (!deadLetterStore.markExhausted(event.getId(), errorReason)) {
                return ReplayOutcome.SKIPPED;
            }
            counters.recordDlqExhausted();
            log.error("[DLQ Replay] 재시도 소진. EXHAUSTED 처리. dlqId: {}, channel: {}, attempts: {}, error: {}",
                    event.getId(), event.getChannel(), event.getRetryCount() + 1, errorReason);
            return ReplayOutcome.EXHAUSTED;
        }

        LocalDateTime nextRetryAt = nextRetryAt(event.getRetryCount());
        if (!deadLetterStore.incrementRetry(event.getId(), nextRetryAt, errorReason)) {
            return ReplayOutcome.SKIPPED;
        }
        counters.recordDlqRetryScheduled();
        log.warn("[DLQ Replay] 재처리 실패. 재시도 예약. dlqId: {}, channel: {}, retryCount: {}, nextRetryAt: {}, error: {}",
                event.getId(), event.getChannel(), event.getRetryCount() + 1, nextRetryAt, errorReason);
        return ReplayOutcome.RETRY_SCHEDULED;
    }

    // retryCount 는 증가 전 값
    LocalDateTime nextRetryAt(int retryCount) {
        long multiplier = 1L << Math.min(Math.max(retryCount, 0), MAX_BACKOFF_EXPONENT);
        return LocalDateTime.now(clock).plus(backoffBase.multipliedBy(multiplier));
    }
}
