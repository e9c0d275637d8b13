package com.morket.replication.sink.exception;

import com.morket.replication.common.exception.InternalServerException;

import static com.morket.replication.common.BaseCode.ANALYTICAL_SINK_WRITE_FAILED;

public class AnalyticalSinkException extends InternalServerException {

    public AnalyticalSinkException(String table, int rowCount, Throwable cause) {
        super(ANALYTICAL_SINK_WRITE_FAILED,
                "분석 저장소 적재 실패. table: " + table + ", rows: " + rowCount + ", cause: " + cause.getMessage(),
                cause);
    }
}
