package personal.bistro.booking.reservation.domain.model;

import java.time.LocalDateTime;

/**
 * Outbox Event Domain Model
 * 예약 변경과 같은 트랜잭션에 기록되고 스케줄러가 Kafka로 발행하는 이벤트 (불변)
 */
public record OutboxEvent(
        Long id,
        String aggregateType,
        Long aggregateId,
        String eventType,
        String payload,
        OutboxEventStatus status,
        LocalDateTime createdAt,
        LocalDateTime publishedAt,
        int retryCount) {

    public static final int MAX_RETRY_COUNT = 3;

    public OutboxEvent markAsPublished(LocalDateTime now) {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                OutboxEventStatus.PUBLISHED, createdAt, now, retryCount);
    }

    /**
     * 발행 실패 기록
     * 재시도 한도에 도달하면 FAILED로 전환되어 더 이상 조회되지 않음
     */
    public OutboxEvent recordFailure() {
        int nextRetryCount = retryCount + 1;
        OutboxEventStatus nextStatus = nextRetryCount >= MAX_RETRY_COUNT
                ? OutboxEventStatus.FAILED
                : OutboxEventStatus.PENDING;
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                nextStatus, createdAt, publishedAt, nextRetryCount);
    }

    public enum OutboxEventStatus {
        PENDING,
        PUBLISHED,
        FAILED
    }
}
