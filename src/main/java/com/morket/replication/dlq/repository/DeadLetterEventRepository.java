package com.morket.replication.dlq.repository;

import com.morket.replication.dlq.entity.DeadLetterEvent;
import com.morket.replication.dlq.entity.DeadLetterStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface DeadLetterEventRepository extends JpaRepository<DeadLetterEvent, Long> {

    /**
     * 재처리 대상 조회
     * PENDING 이면서 next_retry_at 이 지난 이벤트, 오래된 순 (id 로 동순위 정렬)
     *
     * @param now      기준 시각
     * @param pageable 건수 제한
     */
    @Query("SELECT d FROM DeadLetterEvent d " +
            "WHERE d.status = com.morket.replication.dlq.entity.DeadLetterStatus.PENDING " +
            "AND d.nextRetryAt <= :now " +
            "ORDER BY d.createdAt ASC, d.id ASC")
    List<DeadLetterEvent> findPending(@Param("now") LocalDateTime now, Pageable pageable);

    Page<DeadLetterEvent> findByStatus(DeadLetterStatus status, Pageable pageable);

    long countByStatus(DeadLetterStatus status);

    /**
     * PENDING 에서 REPLAYED 로 원자적 업데이트
     *
     * @return 업데이트된 행 수 (0 또는 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DeadLetterEvent d " +
            "SET d.status = com.morket.replication.dlq.entity.DeadLetterStatus.REPLAYED, d.updatedAt = :now " +
            "WHERE d.id = :id " +
            "AND d.status = com.morket.replication.dlq.entity.DeadLetterStatus.PENDING")
    int markReplayed(@Param("id") Long id, @Param("now") LocalDateTime now);

    /**
     * PENDING 에서 EXHAUSTED 로 원자적 업데이트
     * 마지막 실패도 시도 횟수에 포함 (retryCount >= maxRetries 유지), 오류 사유는 마지막 실패로 갱신
     *
     * @return 업데이트된 행 수 (0 또는 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DeadLetterEvent d " +
            "SET d.status = com.morket.replication.dlq.entity.DeadLetterStatus.EXHAUSTED, " +
            "d.retryCount = d.retryCount + 1, d.errorReason = :errorReason, d.updatedAt = :now " +
            "WHERE d.id = :id " +
            "AND d.status = com.morket.replication.dlq.entity.DeadLetterStatus.PENDING")
    int markExhausted(
            @Param("id") Long id,
            @Param("errorReason") String errorReason,
            @Param("now") LocalDateTime now
    );

    /**
     * 재시도 횟수 증가, 다음 재처리 시각과 오류 사유 갱신 (PENDING 유지)
     *
     * @return 업데이트된 행 수 (0 또는 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DeadLetterEvent d " +
            "SET d.retryCount = d.retryCount + 1, d.nextRetryAt = :nextRetryAt, " +
            "d.errorReason = :errorReason, d.updatedAt = :now " +
            "WHERE d.id = :id " +
            "AND d.status = com.morket.replication.dlq.entity.DeadLetterStatus.PENDING")
    int incrementRetry(
            @Param("id") Long id,
            @Param("nextRetryAt") LocalDateTime nextRetryAt,
            @Param("errorReason") String errorReason,
            @Param("now") LocalDateTime now
    );

    /**
     * 소진된 이벤트 전체를 즉시 재처리 대기로 되돌림 (운영자 조치)
     *
     * @return 업데이트된 행 수
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DeadLetterEvent d " +
            "SET d.status = com.morket.replication.dlq.entity.DeadLetterStatus.PENDING, " +
            "d.retryCount = 0, d.nextRetryAt = :now, d.updatedAt = :now " +
            "WHERE d.status = com.morket.replication.dlq.entity.DeadLetterStatus.EXHAUSTED")
    int resetExhausted(@Param("now") LocalDateTime now);
}
