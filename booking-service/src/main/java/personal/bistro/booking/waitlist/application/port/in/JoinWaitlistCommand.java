package personal.bistro.booking.waitlist.application.port.in;

import personal.bistro.booking.reservation.domain.model.SeatingType;
import personal.bistro.booking.waitlist.domain.model.NotificationPreference;

import java.time.LocalDate;

/**
 * Join Waitlist Command
 */
public record JoinWaitlistCommand(
        String guestName,
        String email,
        String phone,
        int partySize,
        LocalDate requestedDate,
        String requestedTime,
        SeatingType seatingType,
        NotificationPreference notificationPreference
) {
}
