package personal.bistro.booking.reservation.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.bistro.booking.reservation.adapter.in.web.dto.DashboardStatsResponse;
import personal.bistro.booking.reservation.adapter.in.web.dto.ReservationPageResponse;
import personal.bistro.booking.reservation.adapter.in.web.dto.ReservationResponse;
import personal.bistro.booking.reservation.adapter.in.web.dto.StatusUpdateRequest;
import personal.bistro.booking.reservation.application.port.in.ChangeReservationStatusUseCase;
import personal.bistro.booking.reservation.application.port.in.DeleteReservationUseCase;
import personal.bistro.booking.reservation.application.port.in.GetDashboardStatsUseCase;
import personal.bistro.booking.reservation.application.port.in.GetReservationUseCase;
import personal.bistro.booking.reservation.domain.model.ReservationSearchCondition;
import personal.bistro.booking.reservation.domain.model.ReservationStatus;
import personal.bistro.booking.reservation.domain.model.SeatingType;
import personal.bistro.common.dto.ApiResponse;

import java.time.LocalDate;
import java.util.List;

/**
 * Admin Reservation API Controller
 * 관리자용 예약 목록, 상태 변경, 삭제, 대시보드
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminReservationController {

    private final GetReservationUseCase getReservationUseCase;
    private final ChangeReservationStatusUseCase changeReservationStatusUseCase;
    private final DeleteReservationUseCase deleteReservationUseCase;
    private final GetDashboardStatsUseCase getDashboardStatsUseCase;

    /**
     * GET /api/v1/admin/reservations?status=confirmed&date=2026-10-20&email=&seatingType=balcony&page=0&size=50
     */
    @GetMapping("/reservations")
    public ResponseEntity<ApiResponse<ReservationPageResponse>> listReservations(
            @RequestParam(required = false) ReservationStatus status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) String email,
            @RequestParam(required = false) SeatingType seatingType,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "50") @Min(1) @Max(200) int size
    ) {
        var condition = new ReservationSearchCondition(status, date, email, seatingType, page, size);
        var result = getReservationUseCase.list(condition);
        return ResponseEntity.ok(ApiResponse.success("Reservations retrieved",
                ReservationPageResponse.of(result, page, size)));
    }

    @GetMapping("/reservations/today")
    public ResponseEntity<ApiResponse<List<ReservationResponse>>> getTodayReservations() {
        var reservations = getReservationUseCase.getTodayReservations().stream()
                .map(ReservationResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("Today's reservations retrieved", reservations));
    }

    /**
     * PATCH /api/v1/admin/reservations/{reservationId}/status
     */
    @PatchMapping("/reservations/{reservationId}/status")
    public ResponseEntity<ApiResponse<ReservationResponse>> updateStatus(
            @PathVariable Long reservationId,
            @Valid @RequestBody StatusUpdateRequest request
    ) {
        log.info("Update reservation status: reservationId={}, status={}", reservationId, request.status());

        var updated = changeReservationStatusUseCase.updateStatus(reservationId, request.status(), request.reason());
        return ResponseEntity.ok(ApiResponse.success("Reservation status updated", ReservationResponse.from(updated)));
    }

    @DeleteMapping("/reservations/{reservationId}")
    public ResponseEntity<ApiResponse<Void>> deleteReservation(@PathVariable Long reservationId) {
        log.info("Delete reservation: reservationId={}", reservationId);

        deleteReservationUseCase.delete(reservationId);
        return ResponseEntity.ok(ApiResponse.success("Reservation deleted"));
    }

    @GetMapping("/dashboard/stats")
    public ResponseEntity<ApiResponse<DashboardStatsResponse>> getDashboardStats() {
        return ResponseEntity.ok(ApiResponse.success("Dashboard stats retrieved",
                DashboardStatsResponse.from(getDashboardStatsUseCase.getStats())));
    }
}
