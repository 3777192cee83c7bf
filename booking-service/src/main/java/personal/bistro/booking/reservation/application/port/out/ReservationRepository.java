package personal.bistro.booking.reservation.application.port.out;

import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.reservation.domain.model.ReservationPage;
import personal.bistro.booking.reservation.domain.model.ReservationSearchCondition;
import personal.bistro.booking.reservation.domain.model.ReservationStatus;
import personal.bistro.booking.reservation.domain.model.SeatingType;
import personal.bistro.booking.reservation.domain.model.SlotKey;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reservation Repository (Output Port)
 * 예약 저장소 인터페이스
 */
public interface ReservationRepository {

    /**
     * 예약 저장 (신규는 ID 발급)
     * 기존 예약은 읽은 시점의 version과 다르면 ReservationUpdateConflictException
     */
    Reservation save(Reservation reservation);

    Optional<Reservation> findById(Long reservationId);

    /**
     * 상태 변경용 조회. 트랜잭션이 끝날 때까지 행 쓰기 잠금 유지
     */
    Optional<Reservation> findByIdForUpdate(Long reservationId);

    void deleteById(Long reservationId);

    /**
     * 슬롯의 좌석 점유 인원 합계
     * PENDING, CONFIRMED, SEATED 상태만 합산
     *
     * @param slotKey (날짜, 시간, 구역)
     * @return 점유 인원 합계 (예약이 없으면 0)
     */
    int sumOccupyingPartySize(SlotKey slotKey);

    /**
     * 하루 동안 특정 구역의 시간대별 점유 인원 합계
     *
     * @return 시간대 → 점유 인원 (예약이 없는 시간대는 포함하지 않음)
     */
    Map<String, Integer> sumOccupyingPartySizeByTime(LocalDate date, SeatingType seatingType);

    /**
     * 조건 검색 (날짜 내림차순, 같은 날짜는 시간 내림차순)
     */
    ReservationPage search(ReservationSearchCondition condition);

    /**
     * 특정 날짜의 지정 상태 예약 (시간 오름차순)
     */
    List<Reservation> findByDateAndStatusIn(LocalDate date, Collection<ReservationStatus> statuses);

    List<Reservation> findByDate(LocalDate date);

    long countByDateAfterAndStatusIn(LocalDate date, Collection<ReservationStatus> statuses);
}
