package com.morket.replication.listener.exception;

import com.morket.replication.common.exception.InternalServerException;

import static com.morket.replication.common.BaseCode.NOTIFICATION_LISTEN_FAILED;

public class NotificationListenException extends InternalServerException {

    public NotificationListenException(String message, Throwable cause) {
        super(NOTIFICATION_LISTEN_FAILED, message, cause);
    }
}
