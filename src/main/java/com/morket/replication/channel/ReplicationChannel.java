package com.morket.replication.channel;

import com.morket.replication.channel.exception.UnknownChannelException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * NOTIFY 채널별 복제 설정
 * 채널 하나가 ClickHouse 테이블 하나에 1:1 대응
 * 새 채널 추가 시 Enum 과 원본 조회 쿼리만 추가
 */
@Getter
@RequiredArgsConstructor
public enum ReplicationChannel {
    ENRICHMENT_EVENTS("enrichment_events", "enrichment_events", "record_id"),
    SCRAPE_EVENTS("scrape_events", "scrape_events", "task_id"),
    CREDIT_EVENTS("credit_events", "credit_events", "transaction_id");

    private final String channelName;   // LISTEN 대상 채널
    private final String tableName;     // ClickHouse 테이블
    private final String idField;       // NOTIFY 페이로드의 식별자 필드

    private static final Map<String, ReplicationChannel> CHANNEL_MAP;

    static {
        CHANNEL_MAP = new HashMap<>();
        for (ReplicationChannel channel : values()) {
            CHANNEL_MAP.put(channel.channelName, channel);
        }
    }

    /**
     * 채널 이름으로 조회 (설정 밖 채널은 empty)
     *
     * @param channelName NOTIFY 채널 이름 (예: "enrichment_events")
     */
    public static Optional<ReplicationChannel> find(String channelName) {
        return Optional.ofNullable(CHANNEL_MAP.get(channelName));
    }

    /**
     * 채널 이름으로 조회
     *
     * @throws UnknownChannelException 알 수 없는 채널
     */
    public static ReplicationChannel from(String channelName) {
        return find(channelName)
                .orElseThrow(() -> new UnknownChannelException(channelName));
    }

    /**
     * 페이로드에서 원본 행 식별자 추출
     *
     * @return 식별자, 없으면 빈 문자열
     */
    public String extractId(Map<String, Object> payload) {
        Object value = payload.get(idField);
        return value == null ? "" : String.valueOf(value);
    }
}
