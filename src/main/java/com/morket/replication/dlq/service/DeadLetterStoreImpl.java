package com.morket.replication.dlq.service;

import com.morket.replication.buffer.BufferedEvent;
import com.morket.replication.config.ReplicationProperties;
import com.morket.replication.dlq.entity.DeadLetterEvent;
import com.morket.replication.dlq.entity.DeadLetterStatus;
import com.morket.replication.dlq.repository.DeadLetterEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * DLQ 저장소 JPA 구현
 * REQUIRES_NEW 로 호출마다 독립 커밋 (한 건 실패가 다른 건에 영향 없음)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeadLetterStoreImpl implements DeadLetterStore {

    private static final Sort NEWEST_FIRST = Sort.by(
            Sort.Order.desc("createdAt"),
            Sort.Order.desc("id")
    );

    private final DeadLetterEventRepository deadLetterEventRepository;
    private final DeadLetterPayloadCodec payloadCodec;
    private final ReplicationProperties properties;
    private final Clock clock;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Long insert(BufferedEvent event, String errorReason) {
        DeadLetterEvent deadLetter = DeadLetterEvent.create(
                event.channel().getChannelName(),
                payloadCodec.encode(event.payload()),
                errorReason,
                properties.dlq().maxRetries(),
                LocalDateTime.now(clock)
        );

        DeadLetterEvent saved = deadLetterEventRepository.save(deadLetter);

        log.warn("[DLQ] 이벤트 적재. dlqId: {}, channel: {}, id: {}, error: {}",
                saved.getId(), saved.getChannel(), event.id(), errorReason);
        return saved.getId();
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public List<DeadLetterEvent> getPending(int limit) {
        return deadLetterEventRepository.findPending(LocalDateTime.now(clock), PageRequest.of(0, limit));
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markReplayed(Long id) {
        int updated = deadLetterEventRepository.markReplayed(id, LocalDateTime.now(clock));

        if (updated == 0) {
            log.debug("[DLQ] 재처리 완료 기록 생략. dlqId: {} (PENDING 아님 또는 존재하지 않음)", id);
        }
        return updated == 1;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markExhausted(Long id, String errorReason) {
        int updated = deadLetterEventRepository.markExhausted(id, errorReason, LocalDateTime.now(clock));

        if (updated == 0) {
            log.debug("[DLQ] 소진 기록 생략. dlqId: {} (PENDING 아님 또는 존재하지 않음)", id);
        }
        return updated == 1;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean incrementRetry(Long id, LocalDateTime nextRetryAt, String errorReason) {
        int updated = deadLetterEventRepository.incrementRetry(id, nextRetryAt, errorReason, LocalDateTime.now(clock));

        if (updated == 0) {
            log.debug("[DLQ] 재시도 기록 생략. dlqId: {} (PENDING 아님 또는 존재하지 않음)", id);
        }
        return updated == 1;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int resetExhausted() {
        int reset = deadLetterEventRepository.resetExhausted(LocalDateTime.now(clock));

        log.info("[DLQ] 소진 이벤트 리셋. resetCount: {}", reset);
        return reset;
    }

    @Override
    @Transactional(readOnly = true)
    public Page<DeadLetterEvent> list(DeadLetterStatus status, int page, int size) {
        PageRequest pageRequest = PageRequest.of(page - 1, size, NEWEST_FIRST);

        if (status == null) {
            return deadLetterEventRepository.findAll(pageRequest);
        }
        return deadLetterEventRepository.findByStatus(status, pageRequest);
    }

    @Override
    @Transactional(readOnly = true)
    public long countByStatus(DeadLetterStatus status) {
        return deadLetterEventRepository.countByStatus(status);
    }
}
