package com.morket.replication.retry;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * 범용 제한 재시도
 * <p>
 * 예산 안에서 작업을 반복 시도하고 첫 성공 시 반환
 * 모두 실패하면 마지막 예외를 그대로 던짐
 * DLQ 처리는 하지 않음 (호출자 책임)
 * <p>
 * 실시간 flush 용(짧고 빠른 예산)과 DLQ 재처리 용 두 인스턴스로 사용
 */
@Slf4j
public class RetryController {

    private static final String TARGET_ATTRIBUTE = "replication.retry.target";

    @Getter
    private final String name;
    @Getter
    private final RetryBudget budget;
    private final RetryTemplate retryTemplate;

    public RetryController(String name, RetryBudget budget) {
        this(name, budget, new ThreadWaitSleeper());
    }

    public RetryController(String name, RetryBudget budget, Sleeper sleeper) {
        this.name = name;
        this.budget = budget;
        this.retryTemplate = new RetryTemplate();
        this.retryTemplate.setRetryPolicy(new SimpleRetryPolicy(budget.maxAttempts()));
        this.retryTemplate.setBackOffPolicy(new ScheduledBackOffPolicy(budget).withSleeper(sleeper));
        this.retryTemplate.registerListener(new AttemptLoggingListener());
    }

    /**
     * 작업을 예산 안에서 실행
     *
     * @param target 로그용 대상 이름 (예: 테이블명)
     * @param action 실패 시 예외를 던지는 작업
     * @throws RuntimeException 모든 시도 실패 시 마지막 예외
     */
    public void execute(String target, Runnable action) {
        retryTemplate.execute((RetryCallback<Void, RuntimeException>) context -> {
            context.setAttribute(TARGET_ATTRIBUTE, target);
            action.run();
            return null;
        });
    }

    private class AttemptLoggingListener implements RetryListener {

        @Override
        public <T, E extends Throwable> void onError(
                RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
            int attempt = context.getRetryCount();

            if (attempt < budget.maxAttempts()) {
                log.warn("[Retry:{}] 시도 실패, 재시도 예정. target: {}, attempt: {}/{}, backoffMs: {}, error: {}",
                        name, context.getAttribute(TARGET_ATTRIBUTE), attempt, budget.maxAttempts(),
                        budget.backoffAfter(attempt), throwable.getMessage());
            } else {
                log.error("[Retry:{}] 재시도 예산 소진. target: {}, attempts: {}, error: {}",
                        name, context.getAttribute(TARGET_ATTRIBUTE), attempt, throwable.getMessage());
            }
        }
    }
}
