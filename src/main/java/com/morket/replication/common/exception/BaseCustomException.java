package com.morket.replication.common.exception;

import com.morket.replication.common.BaseCode;
import lombok.Getter;

@Getter
public abstract class BaseCustomException extends RuntimeException {
    private final BaseCode baseCode;

    public BaseCustomException(BaseCode baseCode) {
        super(baseCode.getMessage());
        this.baseCode = baseCode;
    }

    public BaseCustomException(BaseCode baseCode, String customMessage) {
        super(customMessage);
        this.baseCode = baseCode;
    }

    // 원인 같이 받음
    public BaseCustomException(BaseCode baseCode, String customMessage, Throwable cause) {
        super(customMessage, cause); // 스택트레이스 유지
        this.baseCode = baseCode;
    }
}
