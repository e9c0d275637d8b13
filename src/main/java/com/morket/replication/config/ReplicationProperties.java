package com.morket.replication.config;

import com.morket.replication.retry.RetryBudget;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * 복제 엔진 설정 (서비스 수명 동안 불변)
 * <p>
 * 실시간 경로: batchSize 도달 또는 flushInterval 주기로 flush, maxRetries 회 인메모리 재시도
 * DLQ 경로: backoffBase * 2^retryCount 간격의 영속 재시도, dlq.maxRetries 회 실패 시 소진
 */
@ConfigurationProperties(prefix = "replication")
public record ReplicationProperties(
        @DefaultValue("true") boolean autoStartup,
        @DefaultValue("100") int batchSize,
        @DefaultValue("5s") Duration flushInterval,
        @DefaultValue("3") int maxRetries,
        @DefaultValue({"1000", "2000", "4000"}) List<Long> retryBackoffMs,
        @DefaultValue("4000") long retryFallbackBackoffMs,
        @DefaultValue Dlq dlq,
        @DefaultValue Listener listener
) {
    public ReplicationProperties {
        if (batchSize < 1) {
            throw new IllegalArgumentException("replication.batch-size 는 1 이상이어야 합니다: " + batchSize);
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("replication.max-retries 는 1 이상이어야 합니다: " + maxRetries);
        }
        retryBackoffMs = List.copyOf(retryBackoffMs);
    }

    // 실시간 flush 경로 재시도 예산
    public RetryBudget liveRetryBudget() {
        return RetryBudget.of(maxRetries, retryBackoffMs, retryFallbackBackoffMs);
    }

    public record Dlq(
            @DefaultValue("5") int maxRetries,
            @DefaultValue("60s") Duration backoffBase,
            @DefaultValue("60s") Duration replayInterval,
            @DefaultValue("50") int replayBatchSize,
            @DefaultValue("1") int attemptsPerPass,
            @DefaultValue("PT4M") Duration lockAtMostFor
    ) {
        public Dlq {
            if (maxRetries < 1) {
                throw new IllegalArgumentException("replication.dlq.max-retries 는 1 이상이어야 합니다: " + maxRetries);
            }
            if (backoffBase.isNegative() || backoffBase.isZero()) {
                throw new IllegalArgumentException("replication.dlq.backoff-base 는 양수여야 합니다: " + backoffBase);
            }
        }

        // 재처리 1회 시도 예산 (행 단위, 재배치 없음)
        public RetryBudget replayRetryBudget() {
            return RetryBudget.of(attemptsPerPass, List.of(), 0L);
        }
    }

    /**
     * LISTEN 전용 커넥션 설정
     * url 이 비어 있으면 spring.datasource 설정을 그대로 사용
     */
    public record Listener(
            @DefaultValue("500ms") Duration pollTimeout,
            String url,
            String username,
            String password
    ) {
    }
}
