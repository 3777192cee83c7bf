package personal.bistro.booking.reservation.adapter.in.web;

import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.bistro.booking.reservation.adapter.in.web.dto.AnyAvailabilityResponse;
import personal.bistro.booking.reservation.adapter.in.web.dto.DailyAvailabilityResponse;
import personal.bistro.booking.reservation.adapter.in.web.dto.PartySlotsResponse;
import personal.bistro.booking.reservation.adapter.in.web.dto.SlotAvailabilityResponse;
import personal.bistro.booking.reservation.adapter.in.web.dto.SlotCheckResponse;
import personal.bistro.booking.reservation.application.port.in.CheckSlotAvailabilityUseCase;
import personal.bistro.booking.reservation.application.port.in.GetDailyAvailabilityUseCase;
import personal.bistro.booking.reservation.domain.model.SeatingType;
import personal.bistro.common.dto.ApiResponse;

import java.time.LocalDate;

/**
 * Availability API Controller
 * 슬롯/일 단위 잔여 좌석 조회
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/availability")
@RequiredArgsConstructor
public class AvailabilityController {

    private final CheckSlotAvailabilityUseCase checkSlotAvailabilityUseCase;
    private final GetDailyAvailabilityUseCase getDailyAvailabilityUseCase;

    /**
     * GET /api/v1/availability/slot?date=2026-10-20&time=19:00&seatingType=balcony
     */
    @GetMapping("/slot")
    public ResponseEntity<ApiResponse<SlotAvailabilityResponse>> getSlotAvailability(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam String time,
            @RequestParam SeatingType seatingType
    ) {
        log.debug("Get slot availability: date={}, time={}, seatingType={}", date, time, seatingType.value());

        var result = checkSlotAvailabilityUseCase.computeSlotAvailability(date, time, seatingType);
        return ResponseEntity.ok(ApiResponse.success("Slot availability retrieved",
                SlotAvailabilityResponse.of(date, time, seatingType, result)));
    }

    @GetMapping("/slot/check")
    public ResponseEntity<ApiResponse<SlotCheckResponse>> checkSlot(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam String time,
            @RequestParam SeatingType seatingType,
            @RequestParam @Min(1) int partySize
    ) {
        boolean canAccommodate = checkSlotAvailabilityUseCase.canAccommodate(date, time, seatingType, partySize);
        return ResponseEntity.ok(ApiResponse.success("Slot checked", new SlotCheckResponse(partySize, canAccommodate)));
    }

    @GetMapping("/daily")
    public ResponseEntity<ApiResponse<DailyAvailabilityResponse>> getDailyAvailability(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        log.debug("Get daily availability: date={}", date);

        var daily = getDailyAvailabilityUseCase.getDailyAvailability(date);
        return ResponseEntity.ok(ApiResponse.success("Daily availability retrieved",
                DailyAvailabilityResponse.from(daily)));
    }

    /**
     * preferredSeating은 받되 결과에 반영하지 않음 (두 구역 모두 반환)
     */
    @GetMapping("/party")
    public ResponseEntity<ApiResponse<PartySlotsResponse>> getSlotsForParty(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam @Min(1) int partySize,
            @RequestParam(required = false) SeatingType preferredSeating
    ) {
        var options = getDailyAvailabilityUseCase.listAvailableSlotsForParty(date, partySize);
        return ResponseEntity.ok(ApiResponse.success("Available slots retrieved",
                PartySlotsResponse.of(date, partySize, options)));
    }

    @GetMapping("/any")
    public ResponseEntity<ApiResponse<AnyAvailabilityResponse>> hasAnyAvailability(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        boolean hasAvailability = getDailyAvailabilityUseCase.hasAnyAvailability(date);
        return ResponseEntity.ok(ApiResponse.success("Availability checked",
                new AnyAvailabilityResponse(date, hasAvailability)));
    }
}
