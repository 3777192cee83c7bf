package personal.bistro.booking.reservation.adapter.out.cache;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.annotation.CachingConfigurer;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;
import personal.bistro.booking.config.BookingProperties;

import java.time.Duration;

/**
 * Redis Cache Configuration
 *
 * - dailyAvailability: 짧은 TTL (spring.cache.redis.time-to-live, 기본 1초)
 * - settings: 변경 시 명시적으로 무효화되므로 긴 TTL (booking.cache.settings-ttl-seconds)
 * - transactionAware: 트랜잭션 안의 @CacheEvict는 커밋 이후 적용
 * - AvailabilityCacheErrorHandler: Redis 장애 시 DB 계산으로 진행하고 실패를 집계
 *
 * spring.cache.type이 redis가 아니면 (테스트의 simple 등) 비활성
 */
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(name = "spring.cache.type", havingValue = "redis", matchIfMissing = true)
public class RedisCacheConfig implements CachingConfigurer {

    public static final String DAILY_AVAILABILITY_CACHE = "dailyAvailability";
    public static final String SETTINGS_CACHE = "settings";

    private final AvailabilityCacheErrorHandler availabilityCacheErrorHandler;

    @Value("${spring.cache.redis.time-to-live:1000}")
    private long ttlMillis;

    @Bean
    public RedisCacheManager cacheManager(RedisConnectionFactory connectionFactory,
                                          BookingProperties bookingProperties) {
        GenericJackson2JsonRedisSerializer serializer = new GenericJackson2JsonRedisSerializer(cacheObjectMapper());

        RedisCacheConfiguration defaults = RedisCacheConfiguration.defaultCacheConfig()
                .entryTtl(Duration.ofMillis(ttlMillis))
                .prefixCacheNameWith("bistro:")
                .serializeKeysWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
                .serializeValuesWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(serializer))
                .disableCachingNullValues();

        RedisCacheConfiguration settingsConfig = defaults
                .entryTtl(Duration.ofSeconds(bookingProperties.cache().settingsTtlSeconds()));

        return RedisCacheManager.builder(connectionFactory)
                .cacheDefaults(defaults)
                .withCacheConfiguration(DAILY_AVAILABILITY_CACHE, defaults)
                .withCacheConfiguration(SETTINGS_CACHE, settingsConfig)
                .transactionAware()
                .build();
    }

    /**
     * record 필드 기준 직렬화 + 타입 정보 포함
     * isAvailable() 같은 메서드가 별도 속성으로 직렬화되지 않도록 getter 감지는 끔
     */
    private ObjectMapper cacheObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        objectMapper.setVisibility(
                objectMapper.getSerializationConfig()
                        .getDefaultVisibilityChecker()
                        .withFieldVisibility(JsonAutoDetect.Visibility.ANY)
                        .withGetterVisibility(JsonAutoDetect.Visibility.NONE)
                        .withIsGetterVisibility(JsonAutoDetect.Visibility.NONE));

        // 역직렬화 허용 타입: 도메인 모델, 컬렉션, java.time
        BasicPolymorphicTypeValidator ptv = BasicPolymorphicTypeValidator.builder()
                .allowIfSubType("personal.bistro")
                .allowIfSubType("java.util")
                .allowIfSubType("java.time")
                .build();

        objectMapper.setDefaultTyping(new CacheValueTypeResolver(ptv));
        return objectMapper;
    }

    @Override
    public CacheErrorHandler errorHandler() {
        return availabilityCacheErrorHandler;
    }
}
