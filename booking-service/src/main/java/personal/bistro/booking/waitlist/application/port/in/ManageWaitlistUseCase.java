package personal.bistro.booking.waitlist.application.port.in;

import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.waitlist.domain.model.WaitlistEntry;

import java.util.List;

/**
 * Manage Waitlist UseCase (Input Port)
 * 관리자용 대기 목록 조회, 삭제, 예약 전환
 */
public interface ManageWaitlistUseCase {

    /**
     * 생성 순 (오래된 신청이 먼저)
     */
    List<WaitlistEntry> list();

    /**
     * @throws personal.bistro.booking.waitlist.domain.exception.WaitlistEntryNotFoundException 대기 항목이 없을 때
     */
    void remove(Long entryId);

    /**
     * 대기 항목을 일반 예약 생성 경로로 전환
     * 예약 생성에 실패하면 대기 항목은 그대로 남고 예외가 전파됨
     *
     * @return 생성된 예약
     */
    Reservation convertToReservation(Long entryId);
}
