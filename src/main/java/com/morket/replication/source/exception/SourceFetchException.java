package com.morket.replication.source.exception;

import com.morket.replication.channel.ReplicationChannel;
import com.morket.replication.common.exception.InternalServerException;

import static com.morket.replication.common.BaseCode.SOURCE_FETCH_FAILED;

public class SourceFetchException extends InternalServerException {

    public SourceFetchException(ReplicationChannel channel, Throwable cause) {
        super(SOURCE_FETCH_FAILED,
                "원본 조회 실패. channel: " + channel.getChannelName() + ", cause: " + cause.getMessage(),
                cause);
    }
}
