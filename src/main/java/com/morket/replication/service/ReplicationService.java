package com.morket.replication.service;

import com.morket.replication.buffer.ChannelBuffers;
import com.morket.replication.config.AsyncConfig;
import com.morket.replication.config.ReplicationProperties;
import com.morket.replication.dlq.scheduler.DlqReplayScheduler;
import com.morket.replication.flush.BatchFlusher;
import com.morket.replication.listener.ReplicationNotificationListener;
import com.morket.replication.stats.ReplicationCounters;
import com.morket.replication.stats.ReplicationStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * 복제 엔진 수명주기
 * <p>
 * start : LISTEN 시작, flush 타이머, DLQ 재처리 타이머 (기동 직후 1회 포함)
 * stop : 타이머 취소, 진행 중 flush 완료 대기 후 남은 버퍼 최종 flush (실패분은 DLQ),
 * LISTEN 종료, 그 사이 도착한 이벤트가 있으면 한 번 더 flush
 * start, stop 모두 여러 번 호출해도 안전
 */
@Slf4j
@Service
public class ReplicationService implements SmartLifecycle {

    private final ReplicationNotificationListener notificationListener;
    private final BatchFlusher batchFlusher;
    private final DlqReplayScheduler dlqReplayScheduler;
    private final ChannelBuffers channelBuffers;
    private final ReplicationCounters counters;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final boolean autoStartup;
    private final Duration flushInterval;
    private final Duration replayInterval;

    private ScheduledFuture<?> flushTask;
    private ScheduledFuture<?> replayTask;
    private volatile boolean running = false;

    public ReplicationService(
            ReplicationNotificationListener notificationListener,
            BatchFlusher batchFlusher,
            DlqReplayScheduler dlqReplayScheduler,
            ChannelBuffers channelBuffers,
            ReplicationCounters counters,
            @Qualifier(AsyncConfig.TASK_SCHEDULER_NAME) TaskScheduler taskScheduler,
            ReplicationProperties properties,
            Clock clock
    ) {
        this.notificationListener = notificationListener;
        this.batchFlusher = batchFlusher;
        this.dlqReplayScheduler = dlqReplayScheduler;
        this.channelBuffers = channelBuffers;
        this.counters = counters;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.autoStartup = properties.autoStartup();
        this.flushInterval = properties.flushInterval();
        this.replayInterval = properties.dlq().replayInterval();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }

        notificationListener.start();

        flushTask = taskScheduler.scheduleWithFixedDelay(
                this::flushIfBuffered,
                clock.instant().plus(flushInterval),
                flushInterval
        );
        replayTask = taskScheduler.scheduleWithFixedDelay(
                dlqReplayScheduler::replayPending,
                clock.instant(),
                replayInterval
        );

        running = true;
        log.info("[Replication] 시작. flushInterval: {}, replayInterval: {}", flushInterval, replayInterval);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;

        cancel(flushTask);
        cancel(replayTask);
        flushTask = null;
        replayTask = null;

        finalFlush("종료 전 최종 flush");

        notificationListener.stop();

        // LISTEN 종료 직전에 도착한 이벤트
        if (!channelBuffers.isEmpty()) {
            finalFlush("LISTEN 종료 후 잔여 flush");
        }

        ReplicationStats stats = getStats();
        log.info("[Replication] 종료. totalFlushed: {}, totalFailed: {}, dlqPending: {}, buffered: {}",
                stats.totalFlushed(), stats.totalFailed(), stats.dlqPending(), stats.bufferedEvents());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    public ReplicationStats getStats() {
        return new ReplicationStats(
                channelBuffers.totalSize(),
                counters.getTotalFlushed(),
                counters.getTotalFailed(),
                counters.getLastFlushAt(),
                counters.getDlqPending()
        );
    }

    void flushIfBuffered() {
        if (channelBuffers.isEmpty()) {
            return;
        }
        try {
            batchFlusher.flushAll();
        } catch (Exception e) {
            log.error("[Replication] 주기 flush 실패", e);
        }
    }

    private void finalFlush(String phase) {
        try {
            int remaining = channelBuffers.totalSize();
            if (remaining == 0) {
                batchFlusher.awaitIdle();
                return;
            }
            log.info("[Replication] {}. buffered: {}", phase, remaining);
            batchFlusher.flushAllWhenIdle();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[Replication] {} 대기 중 인터럽트. buffered: {}", phase, channelBuffers.totalSize());
        }
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }
}
