package personal.bistro.booking.reservation.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.bistro.booking.reservation.domain.model.ReservationStatus;

/**
 * 예약 상태 변경 요청 DTO
 */
public record StatusUpdateRequest(
        @NotNull(message = "변경할 상태는 필수입니다.")
        ReservationStatus status,

        @Size(max = 500, message = "사유는 500자 이하여야 합니다.")
        String reason
) {
}
