package com.morket.replication.listener;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.morket.replication.buffer.BufferedEvent;
import com.morket.replication.buffer.ChannelBuffers;
import com.morket.replication.channel.ReplicationChannel;
import com.morket.replication.config.ReplicationProperties;
import com.morket.replication.flush.BatchFlusher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * NOTIFY 수신 후 디코딩, 채널 버퍼 적재
 * <p>
 * 알 수 없는 채널 : WARN 후 폐기
 * JSON 오류, 식별자 누락 : ERROR 후 폐기
 * 전체 버퍼가 batchSize 에 도달하면 비동기 flush 요청
 */
@Slf4j
@Component
public class ReplicationNotificationListener implements NotificationHandler {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final NotificationSource notificationSource;
    private final ChannelBuffers channelBuffers;
    private final BatchFlusher batchFlusher;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int batchSize;

    private final AtomicReference<NotificationSubscription> subscription = new AtomicReference<>();

    public ReplicationNotificationListener(
            NotificationSource notificationSource,
            ChannelBuffers channelBuffers,
            BatchFlusher batchFlusher,
            ObjectMapper objectMapper,
            ReplicationProperties properties,
            Clock clock
    ) {
        this.notificationSource = notificationSource;
        this.channelBuffers = channelBuffers;
        this.batchFlusher = batchFlusher;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.batchSize = properties.batchSize();
    }

    /**
     * 모든 복제 채널 구독 (이미 구독 중이면 무시)
     */
    public synchronized void start() {
        if (isListening()) {
            return;
        }
        subscription.set(notificationSource.subscribe(channelNames(), this));
    }

    public synchronized void stop() {
        NotificationSubscription current = subscription.getAndSet(null);
        if (current != null) {
            current.close();
        }
    }

    public boolean isListening() {
        NotificationSubscription current = subscription.get();
        return current != null && current.isActive();
    }

    @Override
    public void onNotification(String channelName, String payload) {
        if (payload == null || payload.isBlank()) {
            return;
        }

        Optional<ReplicationChannel> channel = ReplicationChannel.find(channelName);
        if (channel.isEmpty()) {
            log.warn("[Listener] 알 수 없는 채널 알림 폐기. channel: {}", channelName);
            return;
        }

        Map<String, Object> decoded;
        try {
            decoded = objectMapper.readValue(payload, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            log.error("[Listener] 페이로드 파싱 실패. 폐기. channel: {}, error: {}", channelName, e.getOriginalMessage());
            return;
        }

        if (decoded == null) {
            log.error("[Listener] 빈 페이로드. 폐기. channel: {}", channelName);
            return;
        }

        String id = channel.get().extractId(decoded);
        if (id.isBlank()) {
            log.error("[Listener] 식별자 누락. 폐기. channel: {}, idField: {}",
                    channelName, channel.get().getIdField());
            return;
        }

        int total = channelBuffers.append(new BufferedEvent(channel.get(), id, decoded, clock.instant()));

        if (total >= batchSize) {
            log.debug("[Listener] 배치 크기 도달. flush 요청. buffered: {}", total);
            batchFlusher.requestFlush();
        }
    }

    @Override
    public void onError(Exception e) {
        log.error("[Listener] 알림 수신 오류. 재연결하지 않음. error: {}", e.getMessage());
    }

    private static Set<String> channelNames() {
        Set<String> names = new LinkedHashSet<>();
        Arrays.stream(ReplicationChannel.values())
                .map(ReplicationChannel::getChannelName)
                .forEach(names::add);
        return names;
    }
}
