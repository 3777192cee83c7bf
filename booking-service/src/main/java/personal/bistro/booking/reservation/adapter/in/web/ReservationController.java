package personal.bistro.booking.reservation.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.bistro.booking.reservation.adapter.in.web.dto.CancelReservationRequest;
import personal.bistro.booking.reservation.adapter.in.web.dto.CreateReservationRequest;
import personal.bistro.booking.reservation.adapter.in.web.dto.ReservationResponse;
import personal.bistro.booking.reservation.application.port.in.ChangeReservationStatusUseCase;
import personal.bistro.booking.reservation.application.port.in.CreateReservationUseCase;
import personal.bistro.booking.reservation.application.port.in.GetReservationUseCase;
import personal.bistro.booking.reservation.domain.model.Reservation;
import personal.bistro.common.dto.ApiResponse;

/**
 * Reservation API Controller
 * 고객용 예약 생성, 조회, 취소
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/reservations")
@RequiredArgsConstructor
public class ReservationController {

    private final CreateReservationUseCase createReservationUseCase;
    private final GetReservationUseCase getReservationUseCase;
    private final ChangeReservationStatusUseCase changeReservationStatusUseCase;

    /**
     * 예약 생성
     * POST /api/v1/reservations
     */
    @PostMapping
    public ResponseEntity<ApiResponse<ReservationResponse>> createReservation(
            @Valid @RequestBody CreateReservationRequest request
    ) {
        log.info("Create reservation: date={}, time={}, seatingType={}, partySize={}",
                request.date(), request.time(), request.seatingType(), request.partySize());

        Reservation reservation = createReservationUseCase.create(request.toCommand());

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Reservation created", ReservationResponse.from(reservation)));
    }

    /**
     * 예약 조회
     * GET /api/v1/reservations/{reservationId}
     */
    @GetMapping("/{reservationId}")
    public ResponseEntity<ApiResponse<ReservationResponse>> getReservation(@PathVariable Long reservationId) {
        log.debug("Get reservation: reservationId={}", reservationId);

        Reservation reservation = getReservationUseCase.get(reservationId);
        return ResponseEntity.ok(ApiResponse.success("Reservation retrieved", ReservationResponse.from(reservation)));
    }

    /**
     * 예약 취소 (취소 가능 시간 정책 적용)
     * POST /api/v1/reservations/{reservationId}/cancel
     */
    @PostMapping("/{reservationId}/cancel")
    public ResponseEntity<ApiResponse<ReservationResponse>> cancelReservation(
            @PathVariable Long reservationId,
            @Valid @RequestBody(required = false) CancelReservationRequest request
    ) {
        log.info("Cancel reservation: reservationId={}", reservationId);

        String reason = request != null ? request.reason() : null;
        Reservation cancelled = changeReservationStatusUseCase.cancel(reservationId, reason);
        return ResponseEntity.ok(ApiResponse.success("Reservation cancelled", ReservationResponse.from(cancelled)));
    }
}
