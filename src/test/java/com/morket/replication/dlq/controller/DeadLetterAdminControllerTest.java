package com.morket.replication.dlq.controller;

import com.morket.replication.dlq.dto.DeadLetterEventResponse;
import com.morket.replication.dlq.dto.DeadLetterPageResponse;
import com.morket.replication.dlq.dto.ResetExhaustedResponse;
import com.morket.replication.dlq.entity.DeadLetterStatus;
import com.morket.replication.dlq.exception.InvalidDeadLetterStatusException;
import com.morket.replication.dlq.fixture.DeadLetterEventFixture;
import com.morket.replication.dlq.service.DeadLetterAdminService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * DLQ 관리 API
 * - 목록 조회 (status 필터, page/size 범위 검증)
 * - 소진 이벤트 재처리 요청
 */
@WebMvcTest(DeadLetterAdminController.class)
class DeadLetterAdminControllerTest {

    private static final String BASE_URL = "/api/admin/dead-letter-queue";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DeadLetterAdminService deadLetterAdminService;

    @Nested
    @DisplayName("GET 목록 조회")
    class ListTest {

        @Test
        @DisplayName("성공 : 기본 page 1, size 50")
        void list_Defaults() throws Exception {
            // given
            DeadLetterEventResponse item = DeadLetterEventResponse.from(
                    DeadLetterEventFixture.pendingWithId(7L, "rec-7", 2));
            given(deadLetterAdminService.list(null, 1, 50))
                    .willReturn(new DeadLetterPageResponse(List.of(item), 1, 50, 1));

            // when, then
            mockMvc.perform(get(BASE_URL))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.code").value("DLQ_LIST_SUCCESS_200"))
                    .andExpect(jsonPath("$.data.page").value(1))
                    .andExpect(jsonPath("$.data.size").value(50))
                    .andExpect(jsonPath("$.data.total").value(1))
                    .andExpect(jsonPath("$.data.items[0].id").value(7))
                    .andExpect(jsonPath("$.data.items[0].retryCount").value(2))
                    .andExpect(jsonPath("$.data.items[0].status").value("PENDING"));
        }

        @Test
        @DisplayName("성공 : status 필터 전달")
        void list_WithStatus() throws Exception {
            // given
            given(deadLetterAdminService.list("exhausted", 2, 10))
                    .willReturn(new DeadLetterPageResponse(List.of(), 2, 10, 0));

            // when, then
            mockMvc.perform(get(BASE_URL)
                            .param("status", "exhausted")
                            .param("page", "2")
                            .param("size", "10"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.items").isEmpty())
                    .andExpect(jsonPath("$.data.page").value(2));
        }

        @Test
        @DisplayName("실패 : size 가 100 초과면 400")
        void list_SizeTooLarge() throws Exception {
            // when, then
            mockMvc.perform(get(BASE_URL).param("size", "101"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("INVALID_INPUT_400"));

            then(deadLetterAdminService).should(never()).list(any(), anyInt(), anyInt());
        }

        @Test
        @DisplayName("실패 : page 가 1 미만이면 400")
        void list_PageZero() throws Exception {
            // when, then
            mockMvc.perform(get(BASE_URL).param("page", "0"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("INVALID_INPUT_400"));
        }

        @Test
        @DisplayName("실패 : 숫자가 아닌 size 는 400")
        void list_SizeNotNumber() throws Exception {
            // when, then
            mockMvc.perform(get(BASE_URL).param("size", "abc"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("INVALID_INPUT_400"));
        }

        @Test
        @DisplayName("실패 : 지원하지 않는 status 는 400")
        void list_InvalidStatus() throws Exception {
            // given
            given(deadLetterAdminService.list("unknown", 1, 50))
                    .willThrow(new InvalidDeadLetterStatusException("unknown"));

            // when, then
            mockMvc.perform(get(BASE_URL).param("status", "unknown"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("INVALID_DLQ_STATUS_400"));
        }
    }

    @Test
    @DisplayName("POST 재처리 : 리셋 건수 반환")
    void replayExhausted_ReturnsResetCount() throws Exception {
        // given
        given(deadLetterAdminService.resetExhausted()).willReturn(new ResetExhaustedResponse(3));

        // when, then
        mockMvc.perform(post(BASE_URL + "/replay"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("DLQ_RESET_SUCCESS_200"))
                .andExpect(jsonPath("$.data.resetCount").value(3));
    }

    @Test
    @DisplayName("응답 status 는 대문자 enum 이름")
    void statusSerializedAsName() throws Exception {
        // given
        DeadLetterEventResponse item = DeadLetterEventResponse.from(DeadLetterEventFixture.builder()
                .withId(1L)
                .status(DeadLetterStatus.EXHAUSTED)
                .build());
        given(deadLetterAdminService.list("EXHAUSTED", 1, 50))
                .willReturn(new DeadLetterPageResponse(List.of(item), 1, 50, 1));

        // when, then
        mockMvc.perform(get(BASE_URL).param("status", "EXHAUSTED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.items[0].status").value("EXHAUSTED"));
    }
}
