package personal.bistro.booking.reservation.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.bistro.booking.reservation.application.port.in.CreateReservationCommand;
import personal.bistro.booking.reservation.application.port.in.CreateReservationUseCase;
import personal.bistro.booking.reservation.application.port.out.BlockedDateRepository;
import personal.bistro.booking.reservation.domain.exception.CapacityExhaustedException;
import personal.bistro.booking.reservation.domain.exception.DateBlockedException;
import personal.bistro.booking.reservation.domain.exception.InvalidPartySizeException;
import personal.bistro.booking.reservation.domain.exception.InvalidTimeSlotException;
import personal.bistro.booking.reservation.domain.exception.OutsideBookingWindowException;
import personal.bistro.booking.reservation.domain.exception.SlotContentionException;
import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.booking.settings.application.port.in.SettingsProvider;
import personal.bistro.booking.settings.domain.model.RestaurantSettings;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Reservation Command Service
 * 예약 생성: 입력 검증 후 슬롯 트랜잭션에 위임
 * 트랜잭션 범위는 SlotReservationManager가 가짐 (재시도 시 매번 새 트랜잭션)
 */
@Slf4j
@Service
public class ReservationCommandService implements CreateReservationUseCase {

    private final SettingsProvider settingsProvider;
    private final BlockedDateRepository blockedDateRepository;
    private final SlotReservationService slotReservationService;
    private final DailyAvailabilityCacheService dailyAvailabilityCacheService;
    private final Clock clock;

    private final Counter confirmedCounter;
    private final Counter capacityExhaustedCounter;
    private final Counter contentionCounter;

    public ReservationCommandService(SettingsProvider settingsProvider,
                                     BlockedDateRepository blockedDateRepository,
                                     SlotReservationService slotReservationService,
                                     DailyAvailabilityCacheService dailyAvailabilityCacheService,
                                     Clock clock,
                                     MeterRegistry meterRegistry) {
        this.settingsProvider = settingsProvider;
        this.blockedDateRepository = blockedDateRepository;
        this.slotReservationService = slotReservationService;
        this.dailyAvailabilityCacheService = dailyAvailabilityCacheService;
        this.clock = clock;

        this.confirmedCounter = attemptCounter(meterRegistry, "confirmed");
        this.capacityExhaustedCounter = attemptCounter(meterRegistry, "capacity_exhausted");
        this.contentionCounter = attemptCounter(meterRegistry, "contention");
    }

    @Override
    public Reservation create(CreateReservationCommand command) {
        log.info("Creating reservation: date={}, time={}, seatingType={}, partySize={}",
                command.date(), command.time(), command.seatingType().value(), command.partySize());

        RestaurantSettings settings = settingsProvider.current();
        LocalDate today = LocalDate.now(clock);

        validate(command, settings, today);

        Reservation draft = Reservation.create(
                command.guestName(),
                command.email(),
                command.phone(),
                command.partySize(),
                command.date(),
                command.time(),
                command.seatingType(),
                command.specialRequests(),
                LocalDateTime.now(clock));

        Reservation saved;
        try {
            saved = slotReservationService.reserve(draft, settings.capacityOf(command.seatingType()));
        } catch (CapacityExhaustedException e) {
            capacityExhaustedCounter.increment();
            throw e;
        } catch (SlotContentionException e) {
            contentionCounter.increment();
            throw e;
        }

        confirmedCounter.increment();
        dailyAvailabilityCacheService.evict(saved.date());

        log.info("Reservation created: reservationId={}, slotKey={}", saved.id(), saved.slotKey().asString());
        return saved;
    }

    private void validate(CreateReservationCommand command, RestaurantSettings settings, LocalDate today) {
        if (!settings.acceptsPartySize(command.partySize())) {
            throw new InvalidPartySizeException(command.partySize(), settings.maxPartySize());
        }
        if (!settings.offersTimeSlot(command.time())) {
            throw new InvalidTimeSlotException(command.time());
        }
        if (!settings.isWithinBookingWindow(command.date(), today)) {
            throw new OutsideBookingWindowException(command.date(), settings.maxAdvanceBookingDays());
        }
        blockedDateRepository.findByDate(command.date())
                .ifPresent(blocked -> {
                    throw new DateBlockedException(blocked.date(), blocked.reason());
                });
    }

    private static Counter attemptCounter(MeterRegistry meterRegistry, String outcome) {
        return Counter.builder("bistro.reservation.attempts")
                .description("Reservation create attempts by outcome")
                .tag("outcome", outcome)
                .register(meterRegistry);
    }
}
