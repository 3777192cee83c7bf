package personal.bistro.booking.reservation.application.port.out;

/**
 * Reservation Event Publisher (Output Port)
 * Outbox에 저장된 이벤트를 메시지 브로커로 전송
 */
public interface ReservationEventPublisher {

    /**
     * 직렬화된 payload를 그대로 전송
     * 브로커가 수신을 확인하지 못하면 예외를 던져 Outbox 재시도 대상이 되도록 함
     *
     * @param topic   토픽
     * @param key     파티션 키 (예약 ID)
     * @param payload JSON 문자열
     */
    void publishRaw(String topic, String key, String payload);
}
