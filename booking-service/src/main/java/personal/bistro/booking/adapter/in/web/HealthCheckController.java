package personal.bistro.booking.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.bistro.common.dto.ApiResponse;
import personal.bistro.common.dto.HealthCheckResponse;
import personal.bistro.common.health.HealthCheckService;

import javax.sql.DataSource;

/**
 * Health Check API Controller
 * 데이터베이스, Redis, Kafka 연결 상태를 확인
 * 일부 구성 요소가 DOWN이어도 HTTP 200에 result=error로 응답
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthCheckController {

    private final DataSource dataSource;
    private final HealthCheckService healthCheckService;

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        log.debug("Health check requested");

        HealthCheckResponse data = healthCheckService.check(dataSource);

        if (data.allUp()) {
            return ResponseEntity.ok(ApiResponse.success("Application is healthy", data));
        }
        log.warn("Unhealthy components: database={}, redis={}, kafka={}", data.database(), data.redis(), data.kafka());
        return ResponseEntity.ok(ApiResponse.error("Some components are unhealthy", data));
    }
}
