package personal.bistro.booking.reservation.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.bistro.booking.reservation.application.port.in.CheckSlotAvailabilityUseCase;
import personal.bistro.booking.reservation.application.port.in.GetDailyAvailabilityUseCase;
import personal.bistro.booking.reservation.application.port.out.ReservationRepository;
import personal.bistro.booking.reservation.domain.exception.InvalidTimeSlotException;
import personal.bistro.booking.reservation.domain.model.AvailabilityResult;
import personal.bistro.booking.reservation.domain.model.DailyAvailability;
import personal.bistro.booking.reservation.domain.model.PartySlotOptions;
import personal.bistro.booking.reservation.domain.model.SeatingType;
import personal.bistro.booking.reservation.domain.model.SlotKey;
import personal.bistro.booking.settings.application.port.in.SettingsProvider;
import personal.bistro.booking.settings.domain.model.RestaurantSettings;

import java.time.LocalDate;

/**
 * Availability Query Service
 * 슬롯/일 단위 잔여 좌석 조회 (읽기 전용)
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AvailabilityQueryService implements CheckSlotAvailabilityUseCase, GetDailyAvailabilityUseCase {

    private final ReservationRepository reservationRepository;
    private final SettingsProvider settingsProvider;
    private final DailyAvailabilityCacheService dailyAvailabilityCacheService;

    @Override
    public AvailabilityResult computeSlotAvailability(LocalDate date, String time, SeatingType seatingType) {
        RestaurantSettings settings = settingsProvider.current();
        if (!settings.offersTimeSlot(time)) {
            throw new InvalidTimeSlotException(time);
        }

        SlotKey slotKey = SlotKey.of(date, time, seatingType);
        int bookedCount = reservationRepository.sumOccupyingPartySize(slotKey);
        AvailabilityResult result = AvailabilityResult.of(settings.capacityOf(seatingType), bookedCount);

        log.debug("Slot availability computed: slotKey={}, booked={}, remaining={}",
                slotKey.asString(), result.bookedCount(), result.remainingCapacity());
        return result;
    }

    @Override
    public boolean canAccommodate(LocalDate date, String time, SeatingType seatingType, int partySize) {
        return computeSlotAvailability(date, time, seatingType).canAccommodate(partySize);
    }

    @Override
    public DailyAvailability getDailyAvailability(LocalDate date) {
        return dailyAvailabilityCacheService.load(date);
    }

    @Override
    public PartySlotOptions listAvailableSlotsForParty(LocalDate date, int partySize) {
        return PartySlotOptions.from(dailyAvailabilityCacheService.load(date), partySize);
    }

    @Override
    public boolean hasAnyAvailability(LocalDate date) {
        return dailyAvailabilityCacheService.load(date).hasAnyAvailability();
    }
}
