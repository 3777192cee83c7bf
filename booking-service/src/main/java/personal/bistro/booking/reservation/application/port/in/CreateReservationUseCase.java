package personal.bistro.booking.reservation.application.port.in;

import personal.bistro.booking.reservation.domain.model.Reservation;

/**
 * Create Reservation UseCase (Input Port)
 */
public interface CreateReservationUseCase {

    /**
     * 예약 생성
     * 인원, 시간대, 예약 가능 기간, 차단 날짜를 검증한 뒤 슬롯 단위 트랜잭션으로 좌석을 확보
     *
     * @param command 예약 커맨드
     * @return CONFIRMED 상태의 예약 (ID 포함)
     * @throws personal.bistro.booking.reservation.domain.exception.OutsideBookingWindowException 예약 가능 기간 밖
     * @throws personal.bistro.booking.reservation.domain.exception.DateBlockedException 차단된 날짜
     * @throws personal.bistro.booking.reservation.domain.exception.CapacityExhaustedException 잔여 좌석 부족 (409)
     * @throws personal.bistro.booking.reservation.domain.exception.SlotContentionException 동시 충돌 재시도 초과 (503)
     */
    Reservation create(CreateReservationCommand command);
}
