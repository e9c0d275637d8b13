package com.morket.replication.dlq.entity;

import com.morket.replication.dlq.exception.InvalidDeadLetterStatusException;

/**
 * DLQ 이벤트 상태
 * <p>
 * PENDING : 재처리 대기 (retryCount < maxRetries)
 * REPLAYED : 재처리 성공 (종료)
 * EXHAUSTED : 재시도 소진 (종료, 운영자 리셋으로만 PENDING 복귀)
 */
public enum DeadLetterStatus {
    PENDING,
    REPLAYED,
    EXHAUSTED;

    /**
     * 요청 파라미터 변환 (대소문자 무시)
     *
     * @throws InvalidDeadLetterStatusException 지원하지 않는 상태
     */
    public static DeadLetterStatus from(String value) {
        for (DeadLetterStatus status : values()) {
            if (status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new InvalidDeadLetterStatusException(value);
    }
}
