package com.morket.replication.dlq.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.morket.replication.dlq.exception.DeadLetterPayloadException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * DLQ event_payload 컬럼 JSON 변환
 */
@Component
@RequiredArgsConstructor
public class DeadLetterPayloadCodec {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public String encode(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new DeadLetterPayloadException("DLQ 페이로드 직렬화 실패: " + e.getOriginalMessage(), e);
        }
    }

    public Map<String, Object> decode(String eventPayload) {
        try {
            return objectMapper.readValue(eventPayload, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new DeadLetterPayloadException("DLQ 페이로드 역직렬화 실패: " + e.getOriginalMessage(), e);
        }
    }
}
