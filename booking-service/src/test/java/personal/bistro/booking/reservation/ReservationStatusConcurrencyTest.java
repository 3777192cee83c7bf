package personal.bistro.booking.reservation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import personal.bistro.booking.acceptance.support.BookingTestAdapter;
import personal.bistro.booking.reservation.adapter.out.persistence.JpaOutboxEventRepository;
import personal.bistro.booking.reservation.adapter.out.persistence.OutboxEventEntity;
import personal.bistro.booking.reservation.application.port.in.ChangeReservationStatusUseCase;
import personal.bistro.booking.reservation.application.port.in.CreateReservationCommand;
import personal.bistro.booking.reservation.application.port.in.CreateReservationUseCase;
import personal.bistro.booking.reservation.application.port.out.ReservationRepository;
import personal.bistro.booking.reservation.domain.exception.InvalidStatusTransitionException;
import personal.bistro.booking.reservation.domain.exception.ReservationUpdateConflictException;
import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.reservation.domain.model.ReservationStatus;
import personal.bistro.booking.reservation.domain.model.SeatingType;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 같은 예약에 대한 동시 상태 변경 테스트
 * 먼저 커밋된 변경을 뒤의 요청이 덮어쓰지 못하고, 슬롯 점유 인원이 수용 인원을 넘지 않는지 검증
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("예약 상태 변경 동시성 통합 테스트")
class ReservationStatusConcurrencyTest {

    @Autowired
    private CreateReservationUseCase createReservationUseCase;

    @Autowired
    private ChangeReservationStatusUseCase changeReservationStatusUseCase;

    @Autowired
    private ReservationRepository reservationRepository;

    @Autowired
    private JpaOutboxEventRepository jpaOutboxEventRepository;

    @Autowired
    private BookingTestAdapter bookingTestAdapter;

    private LocalDate date;

    @BeforeEach
    void setUp() {
        bookingTestAdapter.clearAllData();
        date = bookingTestAdapter.daysFromToday(7);
    }

    private Reservation book(String guest, int partySize) {
        return createReservationUseCase.create(new CreateReservationCommand(guest, guest.toLowerCase() + "@example.com",
                null, partySize, date, "19:00", SeatingType.BALCONY, null));
    }

    @Test
    @DisplayName("취소와 착석 처리가 동시에 들어오면 한쪽만 반영되고 나머지는 전이 오류")
    void cancelRacesSeat() throws Exception {
        // given
        Long reservationId = book("Kim", 6).id();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);

        Callable<Reservation> cancel = () -> {
            start.await();
            return changeReservationStatusUseCase.cancel(reservationId, "schedule changed");
        };
        Callable<Reservation> seat = () -> {
            start.await();
            return changeReservationStatusUseCase.updateStatus(reservationId, ReservationStatus.SEATED, null);
        };

        // when
        List<Future<Reservation>> futures = List.of(executor.submit(cancel), executor.submit(seat));
        start.countDown();

        List<Reservation> succeeded = new ArrayList<>();
        List<Throwable> rejected = new ArrayList<>();
        for (Future<Reservation> future : futures) {
            try {
                succeeded.add(future.get(30, TimeUnit.SECONDS));
            } catch (ExecutionException e) {
                rejected.add(e.getCause());
            }
        }
        executor.shutdownNow();

        // then
        assertThat(succeeded).hasSize(1);
        assertThat(rejected).singleElement()
                .isInstanceOfAny(InvalidStatusTransitionException.class, ReservationUpdateConflictException.class);

        Reservation stored = reservationRepository.findById(reservationId).orElseThrow();
        assertThat(stored.status()).isEqualTo(succeeded.get(0).status());

        List<OutboxEventEntity> events = jpaOutboxEventRepository
                .findByAggregateTypeAndAggregateIdOrderByIdAsc("RESERVATION", reservationId);
        assertThat(events).hasSize(2);
        assertThat(events.get(0).getEventType()).isEqualTo("RESERVATION_CREATED");
    }

    @Test
    @DisplayName("취소 이전에 읽은 예약으로 착석 처리를 저장하면 충돌로 거절되고 좌석은 다시 점유되지 않음")
    void staleWriteAfterCancelIsRejected() {
        // given
        Reservation first = book("Kim", 6);
        Reservation readBeforeCancel = reservationRepository.findById(first.id()).orElseThrow();

        changeReservationStatusUseCase.cancel(first.id(), "schedule changed");
        book("Lee", 6);

        Reservation staleSeat = readBeforeCancel.transitionTo(ReservationStatus.SEATED, null, LocalDateTime.now());

        // when & then
        assertThatThrownBy(() -> reservationRepository.save(staleSeat))
                .isInstanceOf(ReservationUpdateConflictException.class);

        assertThat(reservationRepository.findById(first.id()).orElseThrow().status())
                .isEqualTo(ReservationStatus.CANCELLED);
        assertThat(reservationRepository.sumOccupyingPartySize(first.slotKey())).isEqualTo(6);
    }

    @Test
    @DisplayName("상태를 바꿀 때마다 version이 증가")
    void versionAdvancesOnEachChange() {
        // given
        Reservation created = book("Kim", 2);

        // when
        Reservation seated = changeReservationStatusUseCase.updateStatus(created.id(), ReservationStatus.SEATED, null);
        Reservation completed = changeReservationStatusUseCase.updateStatus(created.id(), ReservationStatus.COMPLETED, null);

        // then
        assertThat(seated.version()).isGreaterThan(created.version());
        assertThat(completed.version()).isGreaterThan(seated.version());
    }
}
