package personal.bistro.booking.reservation.adapter.in.web.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import personal.bistro.booking.reservation.application.port.in.CreateReservationCommand;
import personal.bistro.booking.reservation.domain.model.SeatingType;

import java.time.LocalDate;

/**
 * 예약 생성 요청 DTO
 */
public record CreateReservationRequest(
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

        @NotNull(message = "예약 날짜는 필수입니다.")
        LocalDate date,

        @NotBlank(message = "예약 시간은 필수입니다.")
        @Pattern(regexp = "^([01]\\d|2[0-3]):[0-5]\\d$", message = "시간은 HH:mm 형식이어야 합니다.")
        String time,

        @NotNull(message = "좌석 구역은 필수입니다.")
        SeatingType seatingType,

        @Size(max = 1000, message = "요청 사항은 1000자 이하여야 합니다.")
        String specialRequests
) {
    public CreateReservationCommand toCommand() {
        return new CreateReservationCommand(guestName, email, phone, partySize, date, time,
                seatingType, specialRequests);
    }
}
