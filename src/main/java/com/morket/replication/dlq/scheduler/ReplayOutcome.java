package com.morket.replication.dlq.scheduler;

/**
 * DLQ 이벤트 한 건 재처리 결과
 */
public enum ReplayOutcome {
    REPLAYED,
    RETRY_SCHEDULED,
    EXHAUSTED,
    // 다른 인스턴스가 먼저 상태를 바꿔 조건부 업데이트가 0건
    SKIPPED
}
