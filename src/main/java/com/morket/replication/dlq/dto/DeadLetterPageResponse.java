package com.morket.replication.dlq.dto;

import com.morket.replication.dlq.entity.DeadLetterEvent;
import org.springframework.data.domain.Page;

import java.util.List;

/**
 * DLQ 목록 페이지 (page 는 1부터)
 */
public record DeadLetterPageResponse(
        List<DeadLetterEventResponse> items,
        int page,
        int size,
        long total
) {
    public static DeadLetterPageResponse of(Page<DeadLetterEvent> result, int page, int size) {
        return new DeadLetterPageResponse(
                result.getContent().stream().map(DeadLetterEventResponse::from).toList(),
                page,
                size,
                result.getTotalElements()
        );
    }
}
