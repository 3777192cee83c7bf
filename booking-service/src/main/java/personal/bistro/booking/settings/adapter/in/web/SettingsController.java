package personal.bistro.booking.settings.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.bistro.booking.settings.adapter.in.web.dto.SettingsRequest;
import personal.bistro.booking.settings.adapter.in.web.dto.SettingsResponse;
import personal.bistro.booking.settings.application.port.in.SettingsProvider;
import personal.bistro.booking.settings.application.port.in.UpdateSettingsUseCase;
import personal.bistro.common.dto.ApiResponse;

/**
 * Settings Admin API Controller
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final SettingsProvider settingsProvider;
    private final UpdateSettingsUseCase updateSettingsUseCase;

    @GetMapping
    public ResponseEntity<ApiResponse<SettingsResponse>> getSettings() {
        return ResponseEntity.ok(ApiResponse.success("Settings retrieved",
                SettingsResponse.from(settingsProvider.current())));
    }

    @PutMapping
    public ResponseEntity<ApiResponse<SettingsResponse>> updateSettings(@Valid @RequestBody SettingsRequest request) {
        log.info("Update settings requested");
        var updated = updateSettingsUseCase.update(request.toDomain());
        return ResponseEntity.ok(ApiResponse.success("Settings updated", SettingsResponse.from(updated)));
    }
}
