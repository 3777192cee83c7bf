package personal.bistro.booking.reservation.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.bistro.booking.reservation.adapter.in.web.dto.BlockDateRequest;
import personal.bistro.booking.reservation.adapter.in.web.dto.BlockedDateResponse;
import personal.bistro.booking.reservation.application.port.in.ManageBlockedDatesUseCase;
import personal.bistro.booking.reservation.domain.exception.BlockedDateNotFoundException;
import personal.bistro.common.dto.ApiResponse;

import java.time.LocalDate;
import java.util.List;

/**
 * Blocked Date Admin API Controller
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/blocked-dates")
@RequiredArgsConstructor
public class BlockedDateController {

    private final ManageBlockedDatesUseCase manageBlockedDatesUseCase;

    @GetMapping
    public ResponseEntity<ApiResponse<List<BlockedDateResponse>>> listBlockedDates(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from
    ) {
        var blockedDates = manageBlockedDatesUseCase.list(from).stream()
                .map(BlockedDateResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("Blocked dates retrieved", blockedDates));
    }

    @GetMapping("/{date}")
    public ResponseEntity<ApiResponse<BlockedDateResponse>> getBlockedDate(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        var blockedDate = manageBlockedDatesUseCase.find(date)
                .orElseThrow(() -> new BlockedDateNotFoundException(date));
        return ResponseEntity.ok(ApiResponse.success("Blocked date retrieved", BlockedDateResponse.from(blockedDate)));
    }

    /**
     * PUT /api/v1/admin/blocked-dates/{date} (이미 차단된 날짜면 사유만 갱신)
     */
    @PutMapping("/{date}")
    public ResponseEntity<ApiResponse<BlockedDateResponse>> blockDate(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @Valid @RequestBody(required = false) BlockDateRequest request
    ) {
        log.info("Block date requested: date={}", date);

        String reason = request != null ? request.reason() : null;
        var blocked = manageBlockedDatesUseCase.block(date, reason);
        return ResponseEntity.ok(ApiResponse.success("Date blocked", BlockedDateResponse.from(blocked)));
    }

    @DeleteMapping("/{date}")
    public ResponseEntity<ApiResponse<Void>> unblockDate(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        log.info("Unblock date requested: date={}", date);

        manageBlockedDatesUseCase.unblock(date);
        return ResponseEntity.ok(ApiResponse.success("Date unblocked"));
    }
}
