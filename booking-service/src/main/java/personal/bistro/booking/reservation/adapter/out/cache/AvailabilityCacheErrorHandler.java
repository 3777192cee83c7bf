package personal.bistro.booking.reservation.adapter.out.cache;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.stereotype.Component;

/**
 * Availability Cache Error Handler
 *
 * 조회/저장 실패: 캐시를 건너뛰고 DB 계산 결과로 응답 (WARN)
 * 무효화 실패: 예약 직후에도 TTL 동안 이전 잔여 좌석이 보일 수 있으므로 ERROR
 * 실패 횟수는 bistro.cache.errors{cache, operation}으로 집계
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilityCacheErrorHandler implements CacheErrorHandler {

    static final String ERROR_METRIC = "bistro.cache.errors";

    private final MeterRegistry meterRegistry;

    @Override
    public void handleCacheGetError(RuntimeException exception, Cache cache, Object key) {
        count(cache, "get");
        log.warn("Cache read failed, computing from database: cache={}, key={}, error={}",
                cache.getName(), key, exception.getMessage());
    }

    @Override
    public void handleCachePutError(RuntimeException exception, Cache cache, Object key, Object value) {
        count(cache, "put");
        log.warn("Cache write failed: cache={}, key={}, error={}",
                cache.getName(), key, exception.getMessage());
    }

    @Override
    public void handleCacheEvictError(RuntimeException exception, Cache cache, Object key) {
        count(cache, "evict");
        log.error("Cache evict failed, stale entry served until TTL: cache={}, key={}",
                cache.getName(), key, exception);
    }

    @Override
    public void handleCacheClearError(RuntimeException exception, Cache cache) {
        count(cache, "clear");
        log.error("Cache clear failed, stale entries served until TTL: cache={}", cache.getName(), exception);
    }

    private void count(Cache cache, String operation) {
        meterRegistry.counter(ERROR_METRIC, "cache", cache.getName(), "operation", operation).increment();
    }
}
