package com.morket.replication.config;

import com.morket.replication.retry.RetryController;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 재시도 예산 2종
 * <p>
 * live : 인메모리, 짧은 고정 스케줄 (기본 3회, 1s/2s/4s)
 * replay : DLQ 행 하나당 재처리 1회 시도, 영속 백오프는 DlqReplayProcessor 가 담당
 */
@Configuration
public class RetryConfig {
    public static final String LIVE_RETRY_CONTROLLER = "liveRetryController";
    public static final String REPLAY_RETRY_CONTROLLER = "replayRetryController";

    @Bean(name = LIVE_RETRY_CONTROLLER)
    public RetryController liveRetryController(ReplicationProperties properties) {
        return new RetryController("live", properties.liveRetryBudget());
    }

    @Bean(name = REPLAY_RETRY_CONTROLLER)
    public RetryController replayRetryController(ReplicationProperties properties) {
        return new RetryController("replay", properties.dlq().replayRetryBudget());
    }
}
