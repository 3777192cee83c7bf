package personal.bistro.booking.reservation.adapter.in.web.dto;

import personal.bistro.booking.reservation.domain.model.PartySlotOptions;

import java.time.LocalDate;
import java.util.List;

/**
 * 인원 기준 예약 가능 시간대 응답 DTO
 */
public record PartySlotsResponse(
        LocalDate date,
        int partySize,
        List<String> indoor,
        List<String> balcony
) {
    public static PartySlotsResponse of(LocalDate date, int partySize, PartySlotOptions options) {
        return new PartySlotsResponse(date, partySize, options.indoor(), options.balcony());
    }
}
