package com.morket.replication.flush;

import com.morket.replication.buffer.BufferedEvent;
import com.morket.replication.buffer.ChannelBuffers;
import com.morket.replication.cache.WorkspaceCacheInvalidator;
import com.morket.replication.channel.ReplicationChannel;
import com.morket.replication.config.AsyncConfig;
import com.morket.replication.config.RetryConfig;
import com.morket.replication.dlq.service.DeadLetterStore;
import com.morket.replication.retry.RetryController;
import com.morket.replication.sink.AnalyticalSink;
import com.morket.replication.source.SourceStoreAdapter;
import com.morket.replication.stats.ReplicationCounters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 버퍼를 비워 분석 저장소에 적재
 * <p>
 * 채널마다 drain, 식별자 중복 제거, 원본 1회 조회, 재시도 감싼 적재 1회
 * 재시도 소진 시 원본 이벤트 한 건당 DLQ 한 행
 * 한 채널 실패가 다른 채널 flush 를 막지 않음
 * 동시에 하나의 flush 만 진행 (진행 중 호출은 즉시 반환)
 * 종료 시에는 {@link #flushAllWhenIdle()} 로 진행 중 flush 완료를 기다린 뒤 flush
 */
@Slf4j
@Component
public class BatchFlusher {

    private final ChannelBuffers channelBuffers;
    private final SourceStoreAdapter sourceStoreAdapter;
    private final AnalyticalSink analyticalSink;
    private final RetryController retryController;
    private final DeadLetterStore deadLetterStore;
    private final WorkspaceCacheInvalidator cacheInvalidator;
    private final ReplicationCounters counters;
    private final TaskExecutor flushExecutor;
    private final Clock clock;

    private final AtomicBoolean flushing = new AtomicBoolean(false);
    private final Object idleMonitor = new Object();

    public BatchFlusher(
            ChannelBuffers channelBuffers,
            SourceStoreAdapter sourceStoreAdapter,
            AnalyticalSink analyticalSink,
            @Qualifier(RetryConfig.LIVE_RETRY_CONTROLLER) RetryController retryController,
            DeadLetterStore deadLetterStore,
            WorkspaceCacheInvalidator cacheInvalidator,
            ReplicationCounters counters,
            @Qualifier(AsyncConfig.FLUSH_EXECUTOR_NAME) TaskExecutor flushExecutor,
            Clock clock
    ) {
        this.channelBuffers = channelBuffers;
        this.sourceStoreAdapter = sourceStoreAdapter;
        this.analyticalSink = analyticalSink;
        this.retryController = retryController;
        this.deadLetterStore = deadLetterStore;
        this.cacheInvalidator = cacheInvalidator;
        this.counters = counters;
        this.flushExecutor = flushExecutor;
        this.clock = clock;
    }

    /**
     * 비동기 flush 요청 (결과를 기다리지 않음)
     */
    public void requestFlush() {
        flushExecutor.execute(() -> {
            try {
                flushAll();
            } catch (Exception e) {
                log.error("[Flush] 비동기 flush 실패", e);
            }
        });
    }

    /**
     * 모든 채널 flush
     *
     * @return 이번 호출이 flush 를 수행했으면 true, 이미 진행 중이라 건너뛰었으면 false
     */
    public boolean flushAll() {
        if (!flushing.compareAndSet(false, true)) {
            log.debug("[Flush] 진행 중인 flush 있음. 건너뜀.");
            return false;
        }

        try {
            for (ReplicationChannel channel : ReplicationChannel.values()) {
                List<BufferedEvent> events = channelBuffers.drain(channel);
                if (events.isEmpty()) {
                    continue;
                }
                flushChannel(channel, events);
            }
            return true;

        } finally {
            synchronized (idleMonitor) {
                flushing.set(false);
                idleMonitor.notifyAll();
            }
        }
    }

    /**
     * 진행 중인 flush 가 끝날 때까지 대기
     */
    public void awaitIdle() throws InterruptedException {
        synchronized (idleMonitor) {
            while (flushing.get()) {
                idleMonitor.wait();
            }
        }
    }

    /**
     * 진행 중인 flush 가 있으면 끝나기를 기다린 뒤 모든 채널 flush
     * <p>
     * flush 스레드 안에서 호출하면 끝나지 않음
     */
    public void flushAllWhenIdle() throws InterruptedException {
        while (true) {
            awaitIdle();
            if (flushAll()) {
                return;
            }
        }
    }

    public boolean isFlushing() {
        return flushing.get();
    }

    private void flushChannel(ReplicationChannel channel, List<BufferedEvent> events) {
        List<String> ids = distinctIds(events);
        String table = channel.getTableName();

        try {
            List<Map<String, Object>> rows = sourceStoreAdapter.fetchDenormalizedRows(channel, ids);

            if (rows.size() < ids.size()) {
                log.warn("[Flush] 원본 행 일부 누락. channel: {}, 요청: {}, 조회: {}",
                        channel.getChannelName(), ids.size(), rows.size());
            }
            if (rows.isEmpty()) {
                log.warn("[Flush] 조회된 원본 행 없음. 적재 생략. channel: {}, events: {}",
                        channel.getChannelName(), events.size());
                return;
            }

            retryController.execute(table, () -> analyticalSink.insert(table, rows));

            counters.recordFlushed(rows.size(), clock.instant());
            log.info("[Flush] 적재 완료. table: {}, events: {}, rows: {}", table, events.size(), rows.size());

            cacheInvalidator.invalidate(rows);

        } catch (Exception e) {
            handleFailure(channel, events, e);
        }
    }

    private void handleFailure(ReplicationChannel channel, List<BufferedEvent> events, Exception cause) {
        String errorReason = errorReason(cause);
        counters.recordFailed(events.size());

        log.error("[Flush] 적재 재시도 소진. DLQ 이동. channel: {}, events: {}, error: {}",
                channel.getChannelName(), events.size(), errorReason);

        for (BufferedEvent event : events) {
            try {
                deadLetterStore.insert(event, errorReason);
                counters.recordDlqInserted();
            } catch (Exception e) {
                log.error("[Flush] DLQ 적재 실패. 이벤트 유실. channel: {}, id: {}, error: {}",
                        channel.getChannelName(), event.id(), e.getMessage());
            }
        }
    }

    static List<String> distinctIds(List<BufferedEvent> events) {
        Set<String> ids = new LinkedHashSet<>();
        for (BufferedEvent event : events) {
            ids.add(event.id());
        }
        return new ArrayList<>(ids);
    }

    public static String errorReason(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    }
}
