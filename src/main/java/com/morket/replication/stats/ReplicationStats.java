package com.morket.replication.stats;

import java.time.Instant;

/**
 * 복제 상태 스냅샷
 *
 * @param bufferedEvents 현재 버퍼에 쌓인 이벤트 수 (조회 시점 계산)
 * @param totalFlushed   기동 이후 적재된 행 수
 * @param totalFailed    기동 이후 재시도 소진된 이벤트 수
 * @param lastFlushAt    마지막 적재 성공 시각 (없으면 null)
 * @param dlqPending     기동 이후 DLQ 에 남아 있는 이벤트 수
 */
public record ReplicationStats(
        int bufferedEvents,
        long totalFlushed,
        long totalFailed,
        Instant lastFlushAt,
        long dlqPending
) {
}
