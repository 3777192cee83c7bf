package personal.bistro.common.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClient;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.stereotype.Service;
import personal.bistro.common.dto.HealthCheckResponse;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.TimeUnit;

/**
 * Health Check 공통 서비스
 * 데이터베이스, Redis, Kafka의 연결 상태를 "UP"/"DOWN"으로 보고
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthCheckService {

    private static final String UP = "UP";
    private static final String DOWN = "DOWN";
    private static final long KAFKA_DESCRIBE_TIMEOUT_SECONDS = 3;

    private final RedisTemplate<String, String> redisTemplate;
    private final KafkaAdmin kafkaAdmin;

    public HealthCheckResponse check(DataSource dataSource) {
        return new HealthCheckResponse(checkDatabase(dataSource), checkRedis(), checkKafka());
    }

    public String checkRedis() {
        try {
            String response = redisTemplate.execute((RedisConnection connection) -> connection.ping());
            return "PONG".equals(response) ? UP : DOWN;
        } catch (Exception e) {
            log.error("Redis health check failed", e);
            return DOWN;
        }
    }

    public String checkKafka() {
        try (AdminClient adminClient = AdminClient.create(kafkaAdmin.getConfigurationProperties())) {
            var nodes = adminClient.describeCluster().nodes()
                    .get(KAFKA_DESCRIBE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            return (nodes != null && !nodes.isEmpty()) ? UP : DOWN;
        } catch (Exception e) {
            log.error("Kafka health check failed", e);
            return DOWN;
        }
    }

    /**
     * DataSource를 사용하는 서비스에서만 호출
     */
    public String checkDatabase(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(1) ? UP : DOWN;
        } catch (Exception e) {
            log.error("Database health check failed", e);
            return DOWN;
        }
    }
}
