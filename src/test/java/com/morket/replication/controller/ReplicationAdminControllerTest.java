package com.morket.replication.controller;

import com.morket.replication.service.ReplicationService;
import com.morket.replication.stats.ReplicationStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReplicationAdminController.class)
class ReplicationAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ReplicationService replicationService;

    @Test
    @DisplayName("GET /stats : 복제 상태 envelope 응답")
    void getStats_Success() throws Exception {
        // given
        given(replicationService.getStats()).willReturn(
                new ReplicationStats(4, 250, 3, Instant.parse("2026-01-01T00:00:00Z"), 2));

        // when, then
        mockMvc.perform(get("/api/admin/replication/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("REPLICATION_STATS_SUCCESS_200"))
                .andExpect(jsonPath("$.data.bufferedEvents").value(4))
                .andExpect(jsonPath("$.data.totalFlushed").value(250))
                .andExpect(jsonPath("$.data.totalFailed").value(3))
                .andExpect(jsonPath("$.data.lastFlushAt").value("2026-01-01T00:00:00Z"))
                .andExpect(jsonPath("$.data.dlqPending").value(2));
    }

    @Test
    @DisplayName("GET /stats : flush 이력이 없으면 lastFlushAt 은 null")
    void getStats_NoFlushYet() throws Exception {
        // given
        given(replicationService.getStats()).willReturn(new ReplicationStats(0, 0, 0, null, 0));

        // when, then
        mockMvc.perform(get("/api/admin/replication/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.lastFlushAt").isEmpty());
    }
}
