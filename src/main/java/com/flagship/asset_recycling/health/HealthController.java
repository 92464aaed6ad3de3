package com.flagship.asset_recycling.health;

import com.flagship.asset_recycling.admin.PauseSwitch;
import com.flagship.asset_recycling.ledger.RecyclingLedger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness probes.
 * Unlike the Actuator health endpoint, this does not require authorization.
 * A paused service still answers 200; the pause flag is reported as a field.
 */
@RestController
public class HealthController {

    private final PauseSwitch pauseSwitch;
    private final RecyclingLedger ledger;
    private final Clock clock;

    public HealthController(PauseSwitch pauseSwitch, RecyclingLedger ledger, Clock clock) {
        this.pauseSwitch = pauseSwitch;
        this.ledger = ledger;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now(clock).toString());
        response.put("paused", pauseSwitch.isPaused());
        response.put("ledgerSize", ledger.getTotalRecyclings());
        return ResponseEntity.ok(response);
    }
}
