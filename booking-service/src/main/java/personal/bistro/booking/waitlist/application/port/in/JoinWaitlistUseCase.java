package personal.bistro.booking.waitlist.application.port.in;

import personal.bistro.booking.waitlist.domain.model.WaitlistEntry;

/**
 * Join Waitlist UseCase (Input Port)
 */
public interface JoinWaitlistUseCase {

    /**
     * 대기 등록 (인원 1명 이상, 좌석 구역 필수)
     */
    WaitlistEntry join(JoinWaitlistCommand command);
}
