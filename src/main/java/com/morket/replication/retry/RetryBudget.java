package com.morket.replication.retry;

import java.util.List;

/**
 * 재시도 예산
 *
 * @param maxAttempts       최대 시도 횟수 (첫 시도 포함)
 * @param backoffMs         i 번째 실패 후 대기 시간 목록
 * @param fallbackBackoffMs 목록이 짧을 때 사용할 대기 시간
 */
public record RetryBudget(
        int maxAttempts,
        List<Long> backoffMs,
        long fallbackBackoffMs
) {
    public RetryBudget {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts 는 1 이상이어야 합니다: " + maxAttempts);
        }
        if (fallbackBackoffMs < 0) {
            throw new IllegalArgumentException("fallbackBackoffMs 는 음수일 수 없습니다: " + fallbackBackoffMs);
        }
        backoffMs = List.copyOf(backoffMs);
    }

    public static RetryBudget of(int maxAttempts, List<Long> backoffMs, long fallbackBackoffMs) {
        return new RetryBudget(maxAttempts, backoffMs, fallbackBackoffMs);
    }

    /**
     * failedAttempts 번째 실패 직후 대기 시간
     *
     * @param failedAttempts 지금까지 실패한 횟수 (1부터)
     */
    public long backoffAfter(int failedAttempts) {
        int index = failedAttempts - 1;
        if (index >= 0 && index < backoffMs.size()) {
            return backoffMs.get(index);
        }
        return fallbackBackoffMs;
    }
}
