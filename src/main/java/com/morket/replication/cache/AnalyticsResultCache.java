package com.morket.replication.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 인메모리 분석 결과 캐시 (Caffeine)
 * <p>
 * 키 형식 analytics:{workspaceId}:{query}
 * 항목별 TTL, 최대 항목 수 초과 시 Caffeine 정책으로 제거
 * 복제 적재 성공 시 해당 워크스페이스 접두어로 일괄 무효화
 * <p>
 * get, put 은 분석 조회 계층이 사용하는 읽기 측 API
 */
@Slf4j
@Component
public class AnalyticsResultCache implements ResultCache {

    static final String KEY_PREFIX = "analytics:";

    private final Duration defaultTtl;
    private final Cache<String, CachedResult> cache;

    public AnalyticsResultCache(
            Clock clock,
            @Value("${analytics.cache.default-ttl:5m}") Duration defaultTtl,
            @Value("${analytics.cache.max-entries:1000}") int maxEntries
    ) {
        this.defaultTtl = defaultTtl;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new Expiry<String, CachedResult>() {
                    @Override
                    public long expireAfterCreate(String key, CachedResult value, long currentTime) {
                        return value.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, CachedResult value, long currentTime, long currentDuration) {
                        return value.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, CachedResult value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .ticker(clockTicker(clock))
                .executor(Runnable::run)
                .build();
    }

    public static String key(String workspaceId, String query) {
        return KEY_PREFIX + workspaceId + ":" + query;
    }

    public Optional<Object> get(String key) {
        CachedResult cached = cache.getIfPresent(key);
        return cached == null ? Optional.empty() : Optional.of(cached.value());
    }

    public void put(String key, Object value) {
        put(key, value, defaultTtl);
    }

    public void put(String key, Object value, Duration ttl) {
        cache.put(key, new CachedResult(value, ttl));
    }

    @Override
    public int invalidateWorkspace(String workspaceId) {
        String prefix = KEY_PREFIX + workspaceId + ":";
        List<String> keys = cache.asMap().keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .toList();

        int removed = 0;
        for (String key : keys) {
            if (cache.asMap().remove(key) != null) {
                removed++;
            }
        }

        if (removed > 0) {
            log.debug("[Cache] 워크스페이스 캐시 무효화. workspaceId: {}, removed: {}", workspaceId, removed);
        }
        return removed;
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static Ticker clockTicker(Clock clock) {
        return () -> {
            Instant now = clock.instant();
            return now.getEpochSecond() * 1_000_000_000L + now.getNano();
        };
    }

    private record CachedResult(Object value, Duration ttl) {
    }
}
