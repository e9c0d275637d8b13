package com.morket.replication.dlq.scheduler;

import com.morket.replication.common.notification.SlackNotifier;
import com.morket.replication.common.notification.dto.SlackAttachment;
import com.morket.replication.common.notification.dto.SlackField;
import com.morket.replication.common.notification.dto.SlackMessage;
import com.morket.replication.dlq.entity.DeadLetterStatus;
import com.morket.replication.dlq.service.DeadLetterStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * DLQ 모니터링
 * <p>
 * 주기적으로 PENDING / EXHAUSTED 건수를 Gauge 로 노출
 * EXHAUSTED 건수가 바뀌었을 때만 Slack 알림 (중복 방지)
 */
@Slf4j
@Component
public class DlqMonitor {

    private static final List<DeadLetterStatus> MONITORED =
            List.of(DeadLetterStatus.PENDING, DeadLetterStatus.EXHAUSTED);

    private final DeadLetterStore deadLetterStore;
    private final SlackNotifier slackNotifier;
    private final Clock clock;

    private final Map<DeadLetterStatus, AtomicLong> gaugeValues = new EnumMap<>(DeadLetterStatus.class);

    // 마지막 알림 시점의 EXHAUSTED 건수 (null 이면 알림 이력 없음)
    private Long lastAlertedExhausted;

    public DlqMonitor(
            DeadLetterStore deadLetterStore,
            SlackNotifier slackNotifier,
            MeterRegistry meterRegistry,
            Clock clock
    ) {
        this.deadLetterStore = deadLetterStore;
        this.slackNotifier = slackNotifier;
        this.clock = clock;

        for (DeadLetterStatus status : MONITORED) {
            AtomicLong value = new AtomicLong();
            Gauge.builder("dlq_events", value, AtomicLong::get)
                    .tag("status", status.name())
                    .register(meterRegistry);
            gaugeValues.put(status, value);
        }
    }

    @Scheduled(fixedDelayString = "${replication.dlq.monitor-interval:60000}")
    @SchedulerLock(name = "dlqMonitor")
    public void monitorDlq() {
        try {
            long pending = deadLetterStore.countByStatus(DeadLetterStatus.PENDING);
            long exhausted = deadLetterStore.countByStatus(DeadLetterStatus.EXHAUSTED);

            gaugeValues.get(DeadLetterStatus.PENDING).set(pending);
            gaugeValues.get(DeadLetterStatus.EXHAUSTED).set(exhausted);

            checkAndAlert(pending, exhausted);

        } catch (Exception e) {
            log.error("[DLQ 모니터링] 실패", e);
        }
    }

    private synchronized void checkAndAlert(long pending, long exhausted) {
        if (exhausted == 0) {
            lastAlertedExhausted = null;
            return;
        }

        if (lastAlertedExhausted != null && lastAlertedExhausted == exhausted) {
            log.debug("[DLQ 알림 생략] exhausted: {} (변화 없음)", exhausted);
            return;
        }

        log.warn("[DLQ 감지] 재시도 소진 이벤트. exhausted: {}, pending: {}", exhausted, pending);
        slackNotifier.sendAsync(buildSlackMessage(pending, exhausted));
        lastAlertedExhausted = exhausted;
    }

    /**
     * Slack 메시지 생성 (Attachment 형식)
     * 운영자 조치 가이드 포함
     */
    private SlackMessage buildSlackMessage(long pending, long exhausted) {
        String timestamp = LocalDateTime.now(clock)
                .format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));

        List<SlackField> fields = List.of(
                SlackField.longField("테이블", "dead_letter_queue"),
                SlackField.of("재시도 소진", exhausted + "건"),
                SlackField.of("재처리 대기", pending + "건"),
                SlackField.of("감지 시각", timestamp),
                SlackField.longField("조치",
                        """
                                1. GET /api/admin/dead-letter-queue?status=exhausted 로 원인 확인
                                2. 원본 또는 ClickHouse 장애 복구
                                3. POST /api/admin/dead-letter-queue/replay 로 재처리 대기 전환
                                """
                )
        );

        SlackAttachment attachment = SlackAttachment.danger(fields);

        return SlackMessage.of("경고 복제 DLQ 재시도 소진 감지", attachment);
    }
}
