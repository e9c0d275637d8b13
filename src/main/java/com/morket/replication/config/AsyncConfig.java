package com.morket.replication.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 복제 엔진 비동기 실행 설정
 * <p>
 * Executor 분리 전략
 * flush 전용 Executor : 임계치 도달 시 알림 콜백에서 flush 를 넘겨받음
 * 타이머 전용 Scheduler : flush 주기, DLQ 재처리 주기
 * Slack 알림 전용 Executor
 */
@Slf4j
@Configuration
@EnableAsync
@EnableRetry
@EnableScheduling
@EnableConfigurationProperties(ReplicationProperties.class)
public class AsyncConfig {
    public static final String FLUSH_EXECUTOR_NAME = "replicationFlushExecutor";
    public static final String TASK_SCHEDULER_NAME = "replicationTaskScheduler";
    public static final String NOTIFICATION_EXECUTOR_NAME = "notificationAsyncExecutor";

    /**
     * flush 전용 Executor
     * <p>
     * 진행 중 flush 는 BatchFlusher 의 플래그가 막으므로 스레드 1개면 충분
     * 큐가 가득차면 호출 스레드에서 직접 실행 (flush 요청 유실 방지)
     * 우아한 종료 : 진행 중 flush 최대 30초 대기
     */
    @Bean(name = FLUSH_EXECUTOR_NAME)
    public ThreadPoolTaskExecutor replicationFlushExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(10);
        executor.setThreadNamePrefix("Replication-Flush-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("[비동기] Replication Flush Executor 초기화 완료");
        return executor;
    }

    // flush 주기 + DLQ 재처리 주기 + DLQ 모니터링
    @Bean(name = TASK_SCHEDULER_NAME)
    public ThreadPoolTaskScheduler replicationTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();

        scheduler.setPoolSize(3);
        scheduler.setThreadNamePrefix("Replication-Timer-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);

        scheduler.initialize();

        log.info("[비동기] Replication Task Scheduler 초기화 완료");
        return scheduler;
    }

    /**
     * Slack 알림 전용 Executor
     * <p>
     * 낮은 우선순위 부가 기능, 실패해도 복제에 영향 없음
     */
    @Bean(name = NOTIFICATION_EXECUTOR_NAME)
    public Executor notificationAsyncExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("Notification-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);

        executor.initialize();

        log.info("[비동기] Slack Executor 초기화 완료");
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
