package personal.bistro.booking.reservation.domain.model;

/**
 * 예약 이벤트 종류와 발행 토픽
 */
public enum ReservationEventType {
    RESERVATION_CREATED("reservation.created"),
    RESERVATION_STATUS_CHANGED("reservation.status-changed"),
    RESERVATION_CANCELLED("reservation.cancelled"),
    RESERVATION_DELETED("reservation.deleted");

    private final String topic;

    ReservationEventType(String topic) {
        this.topic = topic;
    }

    public String topic() {
        return topic;
    }
}
