package personal.bistro.booking.reservation.adapter.out.kafka;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import personal.bistro.booking.reservation.application.port.out.ReservationEventPublisher;
import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reservation Kafka Publisher (Adapter Layer)
 * Kafka를 통한 예약 이벤트 발행 구현체
 * Outbox Service에 의해 호출되며, 전송 결과를 기다려 실패를 호출자에게 전달
 */
@Slf4j
@Component
public class ReservationKafkaPublisher implements ReservationEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final long sendTimeoutMs;

    public ReservationKafkaPublisher(KafkaTemplate<String, String> kafkaTemplate,
                                     @Value("${booking.outbox.send-timeout-ms:5000}") long sendTimeoutMs) {
        this.kafkaTemplate = kafkaTemplate;
        this.sendTimeoutMs = sendTimeoutMs;
    }

    @Override
    public void publishRaw(String topic, String key, String payload) {
        log.debug("Publishing raw event: topic={}, key={}", topic, key);
        try {
            kafkaTemplate.send(topic, key, payload).get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            log.debug("Raw event published: topic={}, key={}", topic, key);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR,
                    String.format("Kafka publish interrupted: topic=%s, key=%s", topic, key));
        } catch (ExecutionException | TimeoutException e) {
            log.error("Failed to publish raw event: topic={}, key={}", topic, key, e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR,
                    String.format("Kafka publish failed: topic=%s, key=%s", topic, key));
        }
    }
}
