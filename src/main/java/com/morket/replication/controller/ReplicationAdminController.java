package com.morket.replication.controller;

import com.morket.replication.common.ApiResponse;
import com.morket.replication.service.ReplicationService;
import com.morket.replication.stats.ReplicationStats;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import static com.morket.replication.common.BaseCode.REPLICATION_STATS_SUCCESS;

@RestController
@RequiredArgsConstructor
public class ReplicationAdminController implements ReplicationAdminSwagger {

    private final ReplicationService replicationService;

    @Override
    public ResponseEntity<ApiResponse<ReplicationStats>> getStats() {
        return ResponseEntity.ok(ApiResponse.of(REPLICATION_STATS_SUCCESS, replicationService.getStats()));
    }
}
