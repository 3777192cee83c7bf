package personal.bistro.booking.reservation.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.bistro.booking.reservation.domain.model.OutboxEvent;
import personal.bistro.booking.reservation.domain.model.OutboxEvent.OutboxEventStatus;

import java.time.LocalDateTime;

/**
 * 예약 이벤트 Outbox 행
 * 예약 쓰기와 같은 트랜잭션에서 PENDING으로 저장되고 스케줄러가 PUBLISHED/FAILED로 갱신
 */
@Entity
@Table(name = "reservation_outbox",
        indexes = {
                @Index(name = "idx_outbox_status_id", columnList = "status, id"),
                @Index(name = "idx_outbox_aggregate", columnList = "aggregate_type, aggregate_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "aggregate_type", nullable = false, length = 50)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false)
    private Long aggregateId;

    @Column(name = "event_type", nullable = false, length = 50)
    private String eventType;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OutboxEventStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    private OutboxEventEntity(Long id, String aggregateType, Long aggregateId, String eventType, String payload,
                              OutboxEventStatus status, LocalDateTime createdAt, LocalDateTime publishedAt,
                              int retryCount) {
        this.id = id;
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.eventType = eventType;
        this.payload = payload;
        this.status = status;
        this.createdAt = createdAt;
        this.publishedAt = publishedAt;
        this.retryCount = retryCount;
    }

    public static OutboxEventEntity pending(String aggregateType, Long aggregateId,
                                            String eventType, String payload, LocalDateTime createdAt) {
        return new OutboxEventEntity(null, aggregateType, aggregateId, eventType, payload,
                OutboxEventStatus.PENDING, createdAt, null, 0);
    }

    public static OutboxEventEntity fromDomain(OutboxEvent event) {
        return new OutboxEventEntity(event.id(), event.aggregateType(), event.aggregateId(), event.eventType(),
                event.payload(), event.status(), event.createdAt(), event.publishedAt(), event.retryCount());
    }

    public OutboxEvent toDomain() {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                status, createdAt, publishedAt, retryCount);
    }
}
