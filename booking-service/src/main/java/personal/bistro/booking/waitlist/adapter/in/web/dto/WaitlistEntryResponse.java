package personal.bistro.booking.waitlist.adapter.in.web.dto;

import personal.bistro.booking.reservation.domain.model.SeatingType;
import personal.bistro.booking.waitlist.domain.model.NotificationPreference;
import personal.bistro.booking.waitlist.domain.model.WaitlistEntry;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record WaitlistEntryResponse(
        Long id,
        String guestName,
        String email,
        String phone,
        int partySize,
        LocalDate requestedDate,
        String requestedTime,
        SeatingType seatingType,
        NotificationPreference notificationPreference,
        LocalDateTime createdAt
) {
    public static WaitlistEntryResponse from(WaitlistEntry entry) {
        return new WaitlistEntryResponse(
                entry.id(),
                entry.guestName(),
                entry.email(),
                entry.phone(),
                entry.partySize(),
                entry.requestedDate(),
                entry.requestedTime(),
                entry.seatingType(),
                entry.notificationPreference(),
                entry.createdAt());
    }
}
