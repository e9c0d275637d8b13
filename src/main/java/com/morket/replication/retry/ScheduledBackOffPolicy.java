package com.morket.replication.retry;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.SleepingBackOffPolicy;
import org.springframework.retry.backoff.ThreadWaitSleeper;

/**
 * 고정 스케줄 백오프
 * i 번째 실패 후 RetryBudget.backoffMs[i] 만큼 대기, 목록이 짧으면 fallback 사용
 */
public class ScheduledBackOffPolicy implements SleepingBackOffPolicy<ScheduledBackOffPolicy> {

    private final RetryBudget budget;
    private final Sleeper sleeper;

    public ScheduledBackOffPolicy(RetryBudget budget) {
        this(budget, new ThreadWaitSleeper());
    }

    private ScheduledBackOffPolicy(RetryBudget budget, Sleeper sleeper) {
        this.budget = budget;
        this.sleeper = sleeper;
    }

    @Override
    public ScheduledBackOffPolicy withSleeper(Sleeper sleeper) {
        return new ScheduledBackOffPolicy(budget, sleeper);
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new ScheduleContext(context);
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        RetryContext retryContext = ((ScheduleContext) backOffContext).retryContext();
        long delay = budget.backoffAfter(retryContext.getRetryCount());

        if (delay <= 0) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("재시도 대기 중 인터럽트", e);
        }
    }

    private record ScheduleContext(RetryContext retryContext) implements BackOffContext {
    }
}
