package com.morket.replication.channel.exception;

import com.morket.replication.common.exception.InternalServerException;

import static com.morket.replication.common.BaseCode.UNKNOWN_CHANNEL;

/**
 * 설정되지 않은 채널 이름이 사용될 때 발생
 */
public class UnknownChannelException extends InternalServerException {

    public UnknownChannelException(String channelName) {
        super(UNKNOWN_CHANNEL, "알 수 없는 복제 채널: " + channelName);
    }
}
