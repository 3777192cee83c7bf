package personal.bistro.booking.waitlist.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.bistro.booking.reservation.application.port.in.CreateReservationUseCase;
import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.waitlist.application.port.in.JoinWaitlistCommand;
import personal.bistro.booking.waitlist.application.port.in.JoinWaitlistUseCase;
import personal.bistro.booking.waitlist.application.port.in.ManageWaitlistUseCase;
import personal.bistro.booking.waitlist.application.port.out.WaitlistRepository;
import personal.bistro.booking.waitlist.domain.exception.WaitlistEntryNotFoundException;
import personal.bistro.booking.waitlist.domain.model.WaitlistEntry;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Waitlist Service
 * 대기 등록, 조회, 삭제, 예약 전환
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WaitlistService implements JoinWaitlistUseCase, ManageWaitlistUseCase {

    private final WaitlistRepository waitlistRepository;
    private final CreateReservationUseCase createReservationUseCase;
    private final Clock clock;

    @Override
    @Transactional
    public WaitlistEntry join(JoinWaitlistCommand command) {
        WaitlistEntry entry = WaitlistEntry.create(
                command.guestName(),
                command.email(),
                command.phone(),
                command.partySize(),
                command.requestedDate(),
                command.requestedTime(),
                command.seatingType(),
                command.notificationPreference(),
                LocalDateTime.now(clock));

        WaitlistEntry saved = waitlistRepository.save(entry);
        log.info("Waitlist joined: entryId={}, date={}, time={}, seatingType={}, partySize={}",
                saved.id(), saved.requestedDate(), saved.requestedTime(),
                saved.seatingType().value(), saved.partySize());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public List<WaitlistEntry> list() {
        return waitlistRepository.findAllOrderByCreatedAt();
    }

    @Override
    @Transactional
    public void remove(Long entryId) {
        findOrThrow(entryId);
        waitlistRepository.deleteById(entryId);
        log.info("Waitlist entry removed: entryId={}", entryId);
    }

    /**
     * 트랜잭션 밖에서 실행
     * 예약 생성은 슬롯 트랜잭션과 재시도를 스스로 관리하므로 바깥 트랜잭션에 묶지 않음
     */
    @Override
    public Reservation convertToReservation(Long entryId) {
        WaitlistEntry entry = findOrThrow(entryId);

        Reservation reservation = createReservationUseCase.create(entry.toReservationCommand());
        waitlistRepository.deleteById(entryId);

        log.info("Waitlist entry converted: entryId={}, reservationId={}", entryId, reservation.id());
        return reservation;
    }

    private WaitlistEntry findOrThrow(Long entryId) {
        return waitlistRepository.findById(entryId)
                .orElseThrow(() -> {
                    log.warn("Waitlist entry not found: entryId={}", entryId);
                    return new WaitlistEntryNotFoundException(entryId);
                });
    }
}
