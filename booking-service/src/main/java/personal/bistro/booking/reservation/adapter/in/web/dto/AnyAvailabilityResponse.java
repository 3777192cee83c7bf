package personal.bistro.booking.reservation.adapter.in.web.dto;

import java.time.LocalDate;

public record AnyAvailabilityResponse(LocalDate date, boolean hasAvailability) {
}
