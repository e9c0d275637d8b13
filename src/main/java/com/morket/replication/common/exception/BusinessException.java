package com.morket.replication.common.exception;

import com.morket.replication.common.BaseCode;

/**
 * 요청 값에 의해 발생하는 예외
 * 상태코드는 BaseCode 가 결정
 */
public abstract class BusinessException extends BaseCustomException {

    protected BusinessException(BaseCode baseCode) {
        super(baseCode);
    }

    protected BusinessException(BaseCode baseCode, String message) {
        super(baseCode, message);
    }
}
