package com.morket.replication.dlq.service;

import com.morket.replication.dlq.dto.DeadLetterPageResponse;
import com.morket.replication.dlq.dto.ResetExhaustedResponse;
import com.morket.replication.dlq.entity.DeadLetterEvent;
import com.morket.replication.dlq.entity.DeadLetterStatus;
import com.morket.replication.stats.ReplicationCounters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;

/**
 * 운영자용 DLQ 조회 및 소진 이벤트 리셋
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeadLetterAdminService {

    private final DeadLetterStore deadLetterStore;
    private final ReplicationCounters counters;

    /**
     * @param status 상태 문자열 (대소문자 무시, null 또는 공백이면 전체)
     */
    public DeadLetterPageResponse list(String status, int page, int size) {
        DeadLetterStatus filter = (status == null || status.isBlank()) ? null : DeadLetterStatus.from(status);

        Page<DeadLetterEvent> result = deadLetterStore.list(filter, page, size);
        return DeadLetterPageResponse.of(result, page, size);
    }

    public ResetExhaustedResponse resetExhausted() {
        int resetCount = deadLetterStore.resetExhausted();
        counters.recordDlqReset(resetCount);

        log.info("[DLQ 관리] 소진 이벤트 재처리 대기 전환. resetCount: {}", resetCount);
        return new ResetExhaustedResponse(resetCount);
    }
}
