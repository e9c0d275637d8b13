package com.morket.replication.dlq.entity;

import com.morket.replication.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 실시간 flush 에서 재시도를 모두 소진한 복제 이벤트
 * 상태 전이는 DeadLetterEventRepository 의 조건부 업데이트로만 수행
 */
@Entity
@Table(
        name = "dead_letter_queue",
        indexes = {
                // 재처리 대상 조회 전용 (PostgreSQL 에서는 PENDING 부분 인덱스)
                @Index(name = "idx_dlq_status_next_retry",
                        columnList = "status, next_retry_at")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DeadLetterEvent extends BaseTimeEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String channel;

    @Column(name = "event_payload", columnDefinition = "TEXT", nullable = false)
    private String eventPayload;

    @Column(name = "error_reason", columnDefinition = "TEXT")
    private String errorReason;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DeadLetterStatus status;

    @Column(name = "next_retry_at", nullable = false)
    private LocalDateTime nextRetryAt;

    @Builder
    private DeadLetterEvent(String channel, String eventPayload, String errorReason, int retryCount,
                            int maxRetries, DeadLetterStatus status, LocalDateTime nextRetryAt
    ) {
        this.channel = channel;
        this.eventPayload = eventPayload;
        this.errorReason = errorReason;
        this.retryCount = retryCount;
        this.maxRetries = maxRetries;
        this.status = status;
        this.nextRetryAt = nextRetryAt;
    }

    // 팩토리 메서드 : 즉시 재처리 대상
    public static DeadLetterEvent create(
            String channel,
            String eventPayload,
            String errorReason,
            int maxRetries,
            LocalDateTime now
    ) {
        return DeadLetterEvent.builder()
                .channel(channel)
                .eventPayload(eventPayload)
                .errorReason(errorReason)
                .retryCount(0)
                .maxRetries(maxRetries)
                .status(DeadLetterStatus.PENDING)
                .nextRetryAt(now)
                .build();
    }

    // 이번 실패로 재시도 한도에 도달하는지
    public boolean isLastAttempt() {
        return retryCount + 1 >= maxRetries;
    }
}
