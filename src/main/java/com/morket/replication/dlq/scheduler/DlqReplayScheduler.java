package com.morket.replication.dlq.scheduler;

import com.morket.replication.config.ReplicationProperties;
import com.morket.replication.dlq.entity.DeadLetterEvent;
import com.morket.replication.dlq.service.DeadLetterStore;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockingTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * DLQ 재처리 루프 (1회 패스)
 * <p>
 * 기동 직후 1회, 이후 replication.dlq.replay-interval 주기로 ReplicationService 가 호출
 * ShedLock 으로 여러 인스턴스 중 하나만 실행
 * 한 행의 예외가 나머지 행 처리를 막지 않음
 */
@Slf4j
@Component
public class DlqReplayScheduler {

    static final String LOCK_NAME = "dlqReplay";

    private final DeadLetterStore deadLetterStore;
    private final DlqReplayProcessor processor;
    private final LockingTaskExecutor lockingTaskExecutor;
    private final Clock clock;
    private final int replayBatchSize;
    private final Duration lockAtMostFor;

    public DlqReplayScheduler(
            DeadLetterStore deadLetterStore,
            DlqReplayProcessor processor,
            LockingTaskExecutor lockingTaskExecutor,
            ReplicationProperties properties,
            Clock clock
    ) {
        this.deadLetterStore = deadLetterStore;
        this.processor = processor;
        this.lockingTaskExecutor = lockingTaskExecutor;
        this.clock = clock;
        this.replayBatchSize = properties.dlq().replayBatchSize();
        this.lockAtMostFor = properties.dlq().lockAtMostFor();
    }

    // 타이머 진입점
    public void replayPending() {
        try {
            lockingTaskExecutor.executeWithLock(
                    (Runnable) this::replayOnce,
                    new LockConfiguration(clock.instant(), LOCK_NAME, lockAtMostFor, Duration.ZERO)
            );
        } catch (Exception e) {
            log.error("[DLQ Replay] 재처리 패스 실패", e);
        }
    }

    /**
     * 재처리 대상 조회 후 한 건씩 독립 처리
     *
     * @return 결과별 건수
     */
    public Map<ReplayOutcome, Integer> replayOnce() {
        Map<ReplayOutcome, Integer> summary = new EnumMap<>(ReplayOutcome.class);

        List<DeadLetterEvent> pending = deadLetterStore.getPending(replayBatchSize);
        if (pending.isEmpty()) {
            return summary;
        }

        log.info("[DLQ Replay] 재처리 시작. 대상: {}", pending.size());

        int errors = 0;
        for (DeadLetterEvent event : pending) {
            try {
                ReplayOutcome outcome = processor.replay(event);
                summary.merge(outcome, 1, Integer::sum);

            } catch (Exception e) {
                errors++;
                log.error("[DLQ Replay] 개별 처리 중 예외. dlqId: {}, error: {}", event.getId(), e.getMessage(), e);
            }
        }

        log.info("[DLQ Replay] 재처리 완료. 결과: {}, 예외: {}", summary, errors);
        return summary;
    }
}
