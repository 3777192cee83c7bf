package personal.bistro.booking.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Booking 공통 빈 설정
 * 서비스 시간대 Clock과 잔여 좌석 병렬 조회용 Executor
 */
@Configuration
@EnableConfigurationProperties(BookingProperties.class)
public class BookingConfig {

    @Bean
    public Clock clock(BookingProperties properties) {
        return Clock.system(properties.zone());
    }

    @Bean(name = "availabilityExecutor")
    public ThreadPoolTaskExecutor availabilityExecutor(BookingProperties properties) {
        int poolSize = properties.availability().executorPoolSize();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(poolSize * 50);
        executor.setThreadNamePrefix("availability-");
        executor.initialize();
        return executor;
    }
}
