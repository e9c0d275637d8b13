package com.morket.replication.listener;

import com.morket.replication.listener.exception.NotificationListenException;

import java.util.Set;

/**
 * 변경 알림 전송 계층
 */
public interface NotificationSource {

    /**
     * 채널 구독 시작
     *
     * @throws NotificationListenException 구독 실패
     */
    NotificationSubscription subscribe(Set<String> channels, NotificationHandler handler);
}
