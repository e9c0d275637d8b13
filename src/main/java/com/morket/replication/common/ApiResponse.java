package com.morket.replication.common;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 응답 envelope
 * 모든 REST 응답은 code, message, data 형태로 내려간다
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        String code,
        String message,
        T data
) {
    public static <T> ApiResponse<T> of(BaseCode baseCode, T data) {
        return new ApiResponse<>(baseCode.getCode(), baseCode.getMessage(), data);
    }

    public static ApiResponse<Void> error(BaseCode baseCode, String message) {
        return new ApiResponse<>(baseCode.getCode(), message, null);
    }
}
