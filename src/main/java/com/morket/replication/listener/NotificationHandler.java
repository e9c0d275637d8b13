package com.morket.replication.listener;

/**
 * 변경 알림 수신 콜백
 * 알림 전송 스레드에서 호출되므로 오래 막지 않아야 함
 */
public interface NotificationHandler {

    void onNotification(String channel, String payload);

    // 전송 계층 오류 (커넥션 끊김 등)
    void onError(Exception e);
}
