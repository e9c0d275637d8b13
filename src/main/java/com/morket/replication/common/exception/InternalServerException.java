package com.morket.replication.common.exception;

import com.morket.replication.common.BaseCode;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * 비즈니스 예외가 아닌 복구 불가능한 서버 내부 예외
 * 500 상태코드 반환
 */
@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class InternalServerException extends BaseCustomException {

    public InternalServerException(BaseCode baseCode) {
        super(baseCode);
    }

    public InternalServerException(BaseCode baseCode, String message) {
        super(baseCode, message);
    }

    public InternalServerException(BaseCode baseCode, String message, Throwable cause) {
        super(baseCode, message, cause);
    }
}
