package com.morket.replication.dlq.controller;

import com.morket.replication.common.ApiResponse;
import com.morket.replication.dlq.dto.DeadLetterPageResponse;
import com.morket.replication.dlq.dto.ResetExhaustedResponse;
import com.morket.replication.dlq.service.DeadLetterAdminService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import static com.morket.replication.common.BaseCode.DLQ_LIST_SUCCESS;
import static com.morket.replication.common.BaseCode.DLQ_RESET_SUCCESS;

@Slf4j
@RestController
@RequiredArgsConstructor
public class DeadLetterAdminController implements DeadLetterAdminSwagger {

    private final DeadLetterAdminService deadLetterAdminService;

    @Override
    public ResponseEntity<ApiResponse<DeadLetterPageResponse>> list(
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int size) {

        DeadLetterPageResponse response = deadLetterAdminService.list(status, page, size);

        return ResponseEntity.ok(ApiResponse.of(DLQ_LIST_SUCCESS, response));
    }

    @Override
    public ResponseEntity<ApiResponse<ResetExhaustedResponse>> replayExhausted() {
        log.info("[DLQ 관리] 소진 이벤트 재처리 요청");

        ResetExhaustedResponse response = deadLetterAdminService.resetExhausted();

        return ResponseEntity.ok(ApiResponse.of(DLQ_RESET_SUCCESS, response));
    }
}
