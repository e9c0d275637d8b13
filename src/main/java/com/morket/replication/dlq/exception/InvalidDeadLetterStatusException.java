package com.morket.replication.dlq.exception;

import com.morket.replication.common.exception.BusinessException;

import static com.morket.replication.common.BaseCode.INVALID_DLQ_STATUS;

public class InvalidDeadLetterStatusException extends BusinessException {

    public InvalidDeadLetterStatusException(String value) {
        super(INVALID_DLQ_STATUS, "지원하지 않는 DLQ 상태: " + value);
    }
}
