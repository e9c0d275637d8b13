package com.morket.replication.controller;

import com.morket.replication.common.ApiResponse;
import com.morket.replication.stats.ReplicationStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

@Tag(name = "복제 상태", description = "PostgreSQL to ClickHouse 복제 상태 조회 API")
@RequestMapping("/api/admin/replication")
public interface ReplicationAdminSwagger {

    @Operation(summary = "복제 상태 조회", description = "버퍼 적재 수, 누적 적재/실패 수, 마지막 적재 시각, DLQ 대기 수를 조회합니다.")
    @GetMapping("/stats")
    ResponseEntity<ApiResponse<ReplicationStats>> getStats();
}
