package personal.bistro.booking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Booking Service Application
 * 레스토랑 좌석 예약, 잔여 좌석 조회, 운영 설정, 대기 목록을 담당
 */
@EnableCaching     // 운영 설정, 일별 잔여 좌석 캐시
@EnableScheduling  // Outbox Scheduler 활성화
@SpringBootApplication(
    scanBasePackages = {
        "personal.bistro.booking",
        "personal.bistro.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class BookingServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(BookingServiceApplication.class, args);
    }
}
