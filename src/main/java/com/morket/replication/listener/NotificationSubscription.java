package com.morket.replication.listener;

/**
 * 구독 핸들
 * close 는 여러 번 호출해도 안전
 */
public interface NotificationSubscription extends AutoCloseable {

    boolean isActive();

    @Override
    void close();
}
