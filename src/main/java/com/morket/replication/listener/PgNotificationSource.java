package com.morket.replication.listener;

import com.morket.replication.config.ReplicationProperties;
import com.morket.replication.listener.exception.NotificationListenException;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * PostgreSQL LISTEN/NOTIFY 구독
 * <p>
 * 커넥션 풀이 아닌 DriverManager 로 전용 커넥션을 열어 채널마다 LISTEN
 * 데몬 스레드가 getNotifications 로 폴링하며 핸들러 호출
 * 커넥션이 끊기면 onError 후 폴링 종료 (프로세스 내 재연결 없음)
 */
@Slf4j
@Component
public class PgNotificationSource implements NotificationSource {

    private static final Pattern CHANNEL_NAME = Pattern.compile("[a-z_][a-z0-9_]*");
    private static final AtomicInteger THREAD_SEQUENCE = new AtomicInteger();

    private final ConnectionFactory connectionFactory;
    private final int pollTimeoutMs;

    @Autowired
    public PgNotificationSource(ReplicationProperties properties, DataSourceProperties dataSourceProperties) {
        this(listenConnectionFactory(properties.listener(), dataSourceProperties),
                (int) properties.listener().pollTimeout().toMillis());
    }

    PgNotificationSource(ConnectionFactory connectionFactory, int pollTimeoutMs) {
        this.connectionFactory = connectionFactory;
        this.pollTimeoutMs = pollTimeoutMs;
    }

    @Override
    public NotificationSubscription subscribe(Set<String> channels, NotificationHandler handler) {
        channels.forEach(PgNotificationSource::requireChannelName);

        Connection connection = null;
        try {
            connection = connectionFactory.open();
            PGConnection pgConnection = connection.unwrap(PGConnection.class);

            try (Statement statement = connection.createStatement()) {
                for (String channel : channels) {
                    statement.execute("LISTEN " + channel);
                }
            }

            PgSubscription subscription = new PgSubscription(connection, pgConnection, handler);
            subscription.start();

            log.info("[Listener] LISTEN 시작. channels: {}", channels);
            return subscription;

        } catch (SQLException e) {
            closeQuietly(connection);
            throw new NotificationListenException("LISTEN 실패. channels: " + channels, e);
        }
    }

    private static String requireChannelName(String channel) {
        if (!CHANNEL_NAME.matcher(channel).matches()) {
            throw new IllegalArgumentException("허용되지 않는 채널 이름: " + channel);
        }
        return channel;
    }

    private static void closeQuietly(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("[Listener] 커넥션 종료 실패. error: {}", e.getMessage());
        }
    }

    static ConnectionFactory listenConnectionFactory(
            ReplicationProperties.Listener listener,
            DataSourceProperties dataSourceProperties
    ) {
        if (StringUtils.hasText(listener.url())) {
            return () -> DriverManager.getConnection(listener.url(), listener.username(), listener.password());
        }
        return () -> DriverManager.getConnection(
                dataSourceProperties.determineUrl(),
                dataSourceProperties.determineUsername(),
                dataSourceProperties.determinePassword()
        );
    }

    @FunctionalInterface
    interface ConnectionFactory {
        Connection open() throws SQLException;
    }

    private class PgSubscription implements NotificationSubscription {

        private final Connection connection;
        private final PGConnection pgConnection;
        private final NotificationHandler handler;
        private final AtomicBoolean active = new AtomicBoolean(true);
        private final Thread pollThread;

        PgSubscription(Connection connection, PGConnection pgConnection, NotificationHandler handler) {
            this.connection = connection;
            this.pgConnection = pgConnection;
            this.handler = handler;
            this.pollThread = new Thread(this::poll, "pg-listen-" + THREAD_SEQUENCE.incrementAndGet());
            this.pollThread.setDaemon(true);
        }

        void start() {
            pollThread.start();
        }

        private void poll() {
            while (active.get()) {
                PGNotification[] notifications;
                try {
                    notifications = pgConnection.getNotifications(pollTimeoutMs);
                } catch (SQLException e) {
                    if (active.compareAndSet(true, false)) {
                        log.error("[Listener] LISTEN 커넥션 오류. 폴링 종료. error: {}", e.getMessage());
                        handler.onError(e);
                        closeQuietly(connection);
                    }
                    return;
                }

                if (notifications == null) {
                    continue;
                }
                for (PGNotification notification : notifications) {
                    dispatch(notification);
                }
            }
        }

        private void dispatch(PGNotification notification) {
            try {
                handler.onNotification(notification.getName(), notification.getParameter());
            } catch (Exception e) {
                log.error("[Listener] 알림 처리 중 예외. channel: {}, error: {}",
                        notification.getName(), e.getMessage(), e);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (!active.compareAndSet(true, false)) {
                return;
            }
            closeQuietly(connection);
            try {
                pollThread.join(pollTimeoutMs * 2L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            log.info("[Listener] LISTEN 종료");
        }
    }
}
