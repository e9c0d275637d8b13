package com.morket.replication.dlq.controller;

import com.morket.replication.common.ApiResponse;
import com.morket.replication.dlq.dto.DeadLetterPageResponse;
import com.morket.replication.dlq.dto.ResetExhaustedResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;

@Tag(name = "복제 DLQ 관리", description = "재시도 소진된 복제 이벤트 조회 및 재처리 API")
@RequestMapping("/api/admin/dead-letter-queue")
public interface DeadLetterAdminSwagger {

    @Operation(summary = "DLQ 목록 조회", description = "최신순으로 DLQ 이벤트를 조회합니다. status 로 필터링할 수 있습니다.")
    @GetMapping
    ResponseEntity<ApiResponse<DeadLetterPageResponse>> list(
            @Parameter(description = "pending, replayed, exhausted")
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "50") @Min(1) @Max(100) int size
    );

    @Operation(summary = "소진 이벤트 재처리", description = "EXHAUSTED 이벤트를 재시도 횟수 0 으로 되돌려 즉시 재처리 대기로 전환합니다.")
    @PostMapping("/replay")
    ResponseEntity<ApiResponse<ResetExhaustedResponse>> replayExhausted();
}
