package com.morket.replication.dlq.exception;

import com.morket.replication.common.exception.InternalServerException;

import static com.morket.replication.common.BaseCode.DLQ_PAYLOAD_SERIALIZATION_FAILED;

/**
 * DLQ 페이로드 JSON 직렬화/역직렬화 실패
 */
public class DeadLetterPayloadException extends InternalServerException {

    public DeadLetterPayloadException(String message, Throwable cause) {
        super(DLQ_PAYLOAD_SERIALIZATION_FAILED, message, cause);
    }
}
