package com.morket.replication.buffer;

import com.morket.replication.channel.ReplicationChannel;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 디코딩에 성공한 NOTIFY 한 건
 * 버퍼 drain 으로만 제거되고, 생성 후 변경되지 않음
 */
public record BufferedEvent(
        ReplicationChannel channel,
        String id,                   // 원본 행 식별자
        Map<String, Object> payload, // NOTIFY 페이로드 원문
        Instant receivedAt
) {
    public BufferedEvent {
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
