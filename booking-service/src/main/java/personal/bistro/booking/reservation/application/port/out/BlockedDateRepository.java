package personal.bistro.booking.reservation.application.port.out;

import personal.bistro.booking.reservation.domain.model.BlockedDate;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Blocked Date Repository (Output Port)
 */
public interface BlockedDateRepository {

    Optional<BlockedDate> findByDate(LocalDate date);

    /**
     * 같은 날짜가 이미 있으면 사유를 덮어씀
     */
    BlockedDate save(BlockedDate blockedDate);

    void deleteByDate(LocalDate date);

    /**
     * from 이후(포함) 차단 날짜, 날짜 오름차순
     * from이 null이면 전체
     */
    List<BlockedDate> findAllFrom(LocalDate from);
}
