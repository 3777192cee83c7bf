package personal.bistro.booking.reservation.adapter.out.cache;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * @Cacheable 조회 시간 측정 (bistro.cache.lookup{cache})
 * 캐시 키는 날짜/설정 식별자뿐이라 인자 값을 그대로 로깅
 */
@Slf4j
@Aspect
@Component
@RequiredArgsConstructor
public class CacheOperationLoggingAspect {

    static final String LOOKUP_METRIC = "bistro.cache.lookup";

    private final MeterRegistry meterRegistry;

    @Around("@annotation(cacheable) && within(personal.bistro.booking..*)")
    public Object timeLookup(ProceedingJoinPoint joinPoint, Cacheable cacheable) throws Throwable {
        String cacheName = cacheName(cacheable);
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Object result = joinPoint.proceed();
            long elapsedNanos = sample.stop(meterRegistry.timer(LOOKUP_METRIC, "cache", cacheName, "outcome", "success"));
            log.debug("Cache lookup: cache={}, args={}, elapsedMs={}",
                    cacheName, Arrays.toString(joinPoint.getArgs()), elapsedNanos / 1_000_000);
            return result;
        } catch (Throwable e) {
            sample.stop(meterRegistry.timer(LOOKUP_METRIC, "cache", cacheName, "outcome", "error"));
            log.warn("Cache lookup failed: cache={}, args={}, error={}",
                    cacheName, Arrays.toString(joinPoint.getArgs()), e.getMessage());
            throw e;
        }
    }

    private String cacheName(Cacheable cacheable) {
        if (cacheable.cacheNames().length > 0) {
            return cacheable.cacheNames()[0];
        }
        return cacheable.value().length > 0 ? cacheable.value()[0] : "unknown";
    }
}
