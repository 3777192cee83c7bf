package personal.bistro.booking.waitlist.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.bistro.booking.reservation.adapter.in.web.dto.ReservationResponse;
import personal.bistro.booking.waitlist.adapter.in.web.dto.JoinWaitlistRequest;
import personal.bistro.booking.waitlist.adapter.in.web.dto.WaitlistEntryResponse;
import personal.bistro.booking.waitlist.application.port.in.JoinWaitlistUseCase;
import personal.bistro.booking.waitlist.application.port.in.ManageWaitlistUseCase;
import personal.bistro.common.dto.ApiResponse;

import java.util.List;

/**
 * Waitlist API Controller
 * 고객 대기 등록 + 관리자 대기 목록 관리
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class WaitlistController {

    private final JoinWaitlistUseCase joinWaitlistUseCase;
    private final ManageWaitlistUseCase manageWaitlistUseCase;

    @PostMapping("/waitlist")
    public ResponseEntity<ApiResponse<WaitlistEntryResponse>> joinWaitlist(
            @Valid @RequestBody JoinWaitlistRequest request
    ) {
        log.info("Join waitlist: date={}, time={}, partySize={}",
                request.requestedDate(), request.requestedTime(), request.partySize());

        var entry = joinWaitlistUseCase.join(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Added to waitlist", WaitlistEntryResponse.from(entry)));
    }

    @GetMapping("/admin/waitlist")
    public ResponseEntity<ApiResponse<List<WaitlistEntryResponse>>> listWaitlist() {
        var entries = manageWaitlistUseCase.list().stream()
                .map(WaitlistEntryResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("Waitlist retrieved", entries));
    }

    @DeleteMapping("/admin/waitlist/{entryId}")
    public ResponseEntity<ApiResponse<Void>> removeEntry(@PathVariable Long entryId) {
        log.info("Remove waitlist entry: entryId={}", entryId);

        manageWaitlistUseCase.remove(entryId);
        return ResponseEntity.ok(ApiResponse.success("Removed from waitlist"));
    }

    /**
     * POST /api/v1/admin/waitlist/{entryId}/convert
     */
    @PostMapping("/admin/waitlist/{entryId}/convert")
    public ResponseEntity<ApiResponse<ReservationResponse>> convertToReservation(@PathVariable Long entryId) {
        log.info("Convert waitlist entry: entryId={}", entryId);

        var reservation = manageWaitlistUseCase.convertToReservation(entryId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Converted to reservation", ReservationResponse.from(reservation)));
    }
}
