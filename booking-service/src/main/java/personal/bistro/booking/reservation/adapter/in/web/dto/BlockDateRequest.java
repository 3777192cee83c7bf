package personal.bistro.booking.reservation.adapter.in.web.dto;

import jakarta.validation.constraints.Size;

/**
 * 날짜 차단 요청 DTO
 */
public record BlockDateRequest(
        @Size(max = 500, message = "사유는 500자 이하여야 합니다.")
        String reason
) {
}
