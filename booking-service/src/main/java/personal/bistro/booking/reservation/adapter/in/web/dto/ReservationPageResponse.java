package personal.bistro.booking.reservation.adapter.in.web.dto;

import personal.bistro.booking.reservation.domain.model.ReservationPage;

import java.util.List;

/**
 * 관리자 예약 목록 응답 DTO
 */
public record ReservationPageResponse(
        List<ReservationResponse> reservations,
        long total,
        int page,
        int size
) {
    public static ReservationPageResponse of(ReservationPage page, int pageNumber, int size) {
        return new ReservationPageResponse(
                page.reservations().stream().map(ReservationResponse::from).toList(),
                page.total(),
                pageNumber,
                size);
    }
}
