package com.pulseboard.api.controller;

import com.pulseboard.api.dto.request.InactiveBaseLimitRequest;
import com.pulseboard.api.dto.response.InactiveBaseLimitResponse;
import com.pulseboard.subscription.DefaultInactiveBaseLimitStore;
import com.pulseboard.subscription.DefaultInactiveBaseLimitStore.LimitUpdate;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for runtime subscription settings.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/settings/inactive-base-limit -- returns the default inactive base limit</li>
 *   <li>POST /api/settings/inactive-base-limit -- changes it; listeners of the store are notified</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/settings")
public class SettingsController {

    private static final Logger log = LoggerFactory.getLogger(SettingsController.class);

    private final DefaultInactiveBaseLimitStore defaultInactiveBaseLimitStore;

    public SettingsController(DefaultInactiveBaseLimitStore defaultInactiveBaseLimitStore) {
        this.defaultInactiveBaseLimitStore = defaultInactiveBaseLimitStore;
    }

    @GetMapping("/inactive-base-limit")
    public ResponseEntity<InactiveBaseLimitResponse> getInactiveBaseLimit() {
        return ResponseEntity.ok(InactiveBaseLimitResponse.builder()
                .limit(defaultInactiveBaseLimitStore.get())
                .changed(false)
                .build());
    }

    @PostMapping("/inactive-base-limit")
    public ResponseEntity<InactiveBaseLimitResponse> setInactiveBaseLimit(
            @Valid @RequestBody InactiveBaseLimitRequest request) {
        LimitUpdate update = defaultInactiveBaseLimitStore.set(request.getLimit());
        log.info("Inactive base limit set to {} via API (was {})", update.stored(), update.previous());
        return ResponseEntity.ok(InactiveBaseLimitResponse.builder()
                .limit(update.stored())
                .changed(update.changed())
                .build());
    }
}
