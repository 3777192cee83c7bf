package personal.bistro.booking.reservation.adapter.in.web.dto;

import personal.bistro.booking.reservation.domain.model.BlockedDate;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record BlockedDateResponse(LocalDate date, String reason, LocalDateTime createdAt) {

    public static BlockedDateResponse from(BlockedDate blockedDate) {
        return new BlockedDateResponse(blockedDate.date(), blockedDate.reason(), blockedDate.createdAt());
    }
}
