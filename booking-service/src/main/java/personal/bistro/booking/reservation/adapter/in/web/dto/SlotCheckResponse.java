package personal.bistro.booking.reservation.adapter.in.web.dto;

/**
 * 인원 수용 가능 여부 응답 DTO
 */
public record SlotCheckResponse(int partySize, boolean canAccommodate) {
}
