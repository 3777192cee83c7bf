package personal.bistro.booking.waitlist.adapter.in.web.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import personal.bistro.booking.reservation.domain.model.SeatingType;
import personal.bistro.booking.waitlist.application.port.in.JoinWaitlistCommand;
import personal.bistro.booking.waitlist.domain.model.NotificationPreference;

import java.time.LocalDate;

/**
 * 대기 등록 요청 DTO
 */
public record JoinWaitlistRequest(
        @NotBlank(message = "이름은 필수입니다.")
        @Size(max = 100, message = "이름은 100자 이하여야 합니다.")
        String guestName,

        @NotBlank(message = "이메일은 필수입니다.")
        @Email(message = "이메일 형식이 올바르지 않습니다.")
        @Size(max = 255, message = "이메일은 255자 이하여야 합니다.")
        String email,

        @Size(max = 30, message = "전화번호는 30자 이하여야 합니다.")
        String phone,

        @NotNull(message = "인원은 필수입니다.")
        @Min(value = 1, message = "인원은 1명 이상이어야 합니다.")
        Integer partySize,

        @NotNull(message = "희망 날짜는 필수입니다.")
        LocalDate requestedDate,

        @NotBlank(message = "희망 시간은 필수입니다.")
        @Pattern(regexp = "^([01]\\d|2[0-3]):[0-5]\\d$", message = "시간은 HH:mm 형식이어야 합니다.")
        String requestedTime,

        @NotNull(message = "좌석 구역은 필수입니다.")
        SeatingType seatingType,

        NotificationPreference notificationPreference
) {
    public JoinWaitlistCommand toCommand() {
        return new JoinWaitlistCommand(guestName, email, phone, partySize, requestedDate, requestedTime,
                seatingType, notificationPreference);
    }
}
