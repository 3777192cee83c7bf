package personal.bistro.booking.reservation.application.port.in;

import personal.bistro.booking.reservation.domain.model.BlockedDate;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Manage Blocked Dates UseCase (Input Port)
 * 예약 차단 날짜 관리 (기존 예약은 변경하지 않음)
 */
public interface ManageBlockedDatesUseCase {

    BlockedDate block(LocalDate date, String reason);

    /**
     * @throws personal.bistro.booking.reservation.domain.exception.BlockedDateNotFoundException 차단되지 않은 날짜
     */
    void unblock(LocalDate date);

    Optional<BlockedDate> find(LocalDate date);

    /**
     * @param from null이면 전체
     */
    List<BlockedDate> list(LocalDate from);
}
