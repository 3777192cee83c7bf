package personal.bistro.booking.reservation.adapter.in.web.dto;

import jakarta.validation.constraints.Size;

/**
 * 예약 취소 요청 DTO (본문 생략 가능)
 */
public record CancelReservationRequest(
        @Size(max = 500, message = "사유는 500자 이하여야 합니다.")
        String reason
) {
}
