package personal.bistro.booking.reservation.adapter.in.scheduler;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.bistro.booking.reservation.application.port.in.PublishPendingEventsUseCase;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox Event Scheduler (Driving Adapter)
 * 예약 생성/상태 변경/삭제 이벤트를 booking.outbox.publish-interval-ms 간격으로 Kafka에 전달
 * 포기(FAILED)된 예약 이벤트 수는 bistro.outbox.abandoned 게이지로 노출하고 주기적으로 WARN 보고
 * 테스트 프로필에서는 booking.outbox.scheduler-enabled=false로 끔
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "booking.outbox.scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class OutboxEventScheduler {

    private final PublishPendingEventsUseCase publishPendingEventsUseCase;
    private final AtomicLong abandonedEvents = new AtomicLong();

    public OutboxEventScheduler(PublishPendingEventsUseCase publishPendingEventsUseCase,
                                MeterRegistry meterRegistry) {
        this.publishPendingEventsUseCase = publishPendingEventsUseCase;
        Gauge.builder("bistro.outbox.abandoned", abandonedEvents, AtomicLong::get)
                .description("Reservation events abandoned after max publish attempts")
                .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${booking.outbox.publish-interval-ms:500}")
    public void publishReservationEvents() {
        int publishedCount = publishPendingEventsUseCase.publishPendingEvents();
        if (publishedCount > 0) {
            log.debug("Reservation events published: count={}", publishedCount);
        }
    }

    @Scheduled(fixedDelayString = "${booking.outbox.abandoned-report-interval-ms:60000}")
    public void reportAbandonedEvents() {
        long count = publishPendingEventsUseCase.countAbandonedEvents();
        long previous = abandonedEvents.getAndSet(count);
        if (count > 0) {
            log.warn("Abandoned reservation events need manual replay: count={}, previous={}", count, previous);
        }
    }

    long abandonedEventCount() {
        return abandonedEvents.get();
    }
}
