package com.morket.replication.dlq.dto;

import com.morket.replication.dlq.entity.DeadLetterEvent;
import com.morket.replication.dlq.entity.DeadLetterStatus;

import java.time.LocalDateTime;

public record DeadLetterEventResponse(
        Long id,
        String channel,
        String eventPayload,
        String errorReason,
        int retryCount,
        int maxRetries,
        DeadLetterStatus status,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        LocalDateTime nextRetryAt
) {
    public static DeadLetterEventResponse from(DeadLetterEvent event) {
        return new DeadLetterEventResponse(
                event.getId(),
                event.getChannel(),
                event.getEventPayload(),
                event.getErrorReason(),
                event.getRetryCount(),
                event.getMaxRetries(),
                event.getStatus(),
                event.getCreatedAt(),
                event.getUpdatedAt(),
                event.getNextRetryAt()
        );
    }
}
