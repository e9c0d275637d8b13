package com.morket.replication.service;

import com.morket.replication.stats.ReplicationStats;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.stereotype.Component;

/**
 * actuator health 의 replication 항목
 * 실행 중이 아니면 OUT_OF_SERVICE
 */
@Component("replication")
@RequiredArgsConstructor
public class ReplicationHealthIndicator extends AbstractHealthIndicator {

    private final ReplicationService replicationService;

    @Override
    protected void doHealthCheck(Health.Builder builder) {
        ReplicationStats stats = replicationService.getStats();

        if (replicationService.isRunning()) {
            builder.up();
        } else {
            builder.outOfService();
        }

        builder.withDetail("bufferedEvents", stats.bufferedEvents())
                .withDetail("totalFlushed", stats.totalFlushed())
                .withDetail("totalFailed", stats.totalFailed())
                .withDetail("dlqPending", stats.dlqPending());

        if (stats.lastFlushAt() != null) {
            builder.withDetail("lastFlushAt", stats.lastFlushAt().toString());
        }
    }
}
