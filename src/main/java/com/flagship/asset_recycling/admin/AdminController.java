package com.flagship.asset_recycling.admin;

import com.flagship.asset_recycling.admin.dto.AssetClassResponse;
import com.flagship.asset_recycling.admin.dto.RegisterClassRequest;
import com.flagship.asset_recycling.admin.dto.RescueRequest;
import com.flagship.asset_recycling.admin.dto.SetStatusRequest;
import com.flagship.asset_recycling.admin.dto.UpdateRateRequest;
import com.flagship.asset_recycling.observability.CorrelationContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Administrative REST surface. Authorization is enforced by {@link AdminService}.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final AdminService adminService;

    @PostMapping("/asset-classes")
    public ResponseEntity<AssetClassResponse> register(
            @Valid @RequestBody RegisterClassRequest request,
            @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {

        log.info("Register asset class request: classId={}, pointsPerUnit={}",
                request.getClassId(), request.getPointsPerUnit());

        var config = adminService.register(actor, request.getClassId(), request.getPointsPerUnit());
        return ResponseEntity.status(HttpStatus.CREATED).body(AssetClassResponse.from(config));
    }

    @PutMapping("/asset-classes/{classId}/rate")
    public ResponseEntity<AssetClassResponse> updateRate(
            @PathVariable("classId") String classId,
            @Valid @RequestBody UpdateRateRequest request,
            @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {

        var config = adminService.updateRate(actor, classId, request.getPointsPerUnit());
        return ResponseEntity.ok(AssetClassResponse.from(config));
    }

    @PutMapping("/asset-classes/{classId}/status")
    public ResponseEntity<AssetClassResponse> setStatus(
            @PathVariable("classId") String classId,
            @Valid @RequestBody SetStatusRequest request,
            @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {

        var config = adminService.setActive(actor, classId, request.getActive());
        return ResponseEntity.ok(AssetClassResponse.from(config));
    }

    @DeleteMapping("/asset-classes/{classId}")
    public ResponseEntity<AssetClassResponse> deactivate(
            @PathVariable("classId") String classId,
            @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {

        var config = adminService.deactivate(actor, classId);
        return ResponseEntity.ok(AssetClassResponse.from(config));
    }

    @PostMapping("/pause")
    public ResponseEntity<Map<String, Object>> pause(
            @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {

        boolean changed = adminService.pause(actor);
        return ResponseEntity.ok(Map.of("paused", true, "changed", changed));
    }

    @PostMapping("/unpause")
    public ResponseEntity<Map<String, Object>> unpause(
            @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {

        boolean changed = adminService.unpause(actor);
        return ResponseEntity.ok(Map.of("paused", false, "changed", changed));
    }

    @PostMapping("/rescue")
    public ResponseEntity<Void> emergencyRescue(
            @Valid @RequestBody RescueRequest request,
            @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {

        adminService.emergencyRescue(actor, request.getClassId(), request.getUnitId(), request.getTo());
        return ResponseEntity.noContent().build();
    }
}
