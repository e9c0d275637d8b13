package com.morket.replication.common.exception;

import com.morket.replication.common.ApiResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import static com.morket.replication.common.BaseCode.INTERNAL_SERVER_ERROR;
import static com.morket.replication.common.BaseCode.INVALID_INPUT;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BaseCustomException.class)
    public ResponseEntity<ApiResponse<Void>> handleCustomException(BaseCustomException e) {
        log.warn("[예외 처리] code: {}, message: {}", e.getBaseCode().getCode(), e.getMessage());

        return ResponseEntity.status(e.getBaseCode().getStatus())
                .body(ApiResponse.error(e.getBaseCode(), e.getMessage()));
    }

    @ExceptionHandler({
            ConstraintViolationException.class,
            HandlerMethodValidationException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleInvalidInput(Exception e) {
        log.warn("[예외 처리] 잘못된 요청. message: {}", e.getMessage());

        return ResponseEntity.status(INVALID_INPUT.getStatus())
                .body(ApiResponse.error(INVALID_INPUT, INVALID_INPUT.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception e) {
        log.error("[예외 처리] 처리되지 않은 예외", e);

        return ResponseEntity.status(INTERNAL_SERVER_ERROR.getStatus())
                .body(ApiResponse.error(INTERNAL_SERVER_ERROR, INTERNAL_SERVER_ERROR.getMessage()));
    }
}
