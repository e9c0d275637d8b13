package com.morket.replication.dlq.service;

import com.morket.replication.buffer.BufferedEvent;
import com.morket.replication.dlq.entity.DeadLetterEvent;
import com.morket.replication.dlq.entity.DeadLetterStatus;
import org.springframework.data.domain.Page;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 내구성 있는 DLQ 저장소
 * 실시간 경로는 insert 만, 재처리 경로는 자신이 조회한 행의 상태 전이만 수행
 */
public interface DeadLetterStore {

    /**
     * 재시도 소진 이벤트 적재 (PENDING, retryCount 0, 즉시 재처리 대상)
     *
     * @return 생성된 DLQ ID
     */
    Long insert(BufferedEvent event, String errorReason);

    /**
     * 재처리 시각이 지난 PENDING 이벤트, 오래된 순
     */
    List<DeadLetterEvent> getPending(int limit);

    boolean markReplayed(Long id);

    /**
     * PENDING 에서 EXHAUSTED 로, 오류 사유는 마지막 실패 메시지
     */
    boolean markExhausted(Long id, String errorReason);

    boolean incrementRetry(Long id, LocalDateTime nextRetryAt, String errorReason);

    /**
     * EXHAUSTED 전체를 PENDING 으로 되돌림
     *
     * @return 되돌린 행 수
     */
    int resetExhausted();

    /**
     * 운영자 조회용 최신순 페이지
     *
     * @param status 상태 필터 (null 이면 전체)
     * @param page   1부터 시작
     * @param size   페이지 크기
     */
    Page<DeadLetterEvent> list(DeadLetterStatus status, int page, int size);

    long countByStatus(DeadLetterStatus status);
}
