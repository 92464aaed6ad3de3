package com.flagship.asset_recycling.admin;

import com.flagship.asset_recycling.collaborator.AssetClassCollaborator;
import com.flagship.asset_recycling.config.RecyclingSettings;
import com.flagship.asset_recycling.event.EmergencyRescueEvent;
import com.flagship.asset_recycling.event.PauseStateChangedEvent;
import com.flagship.asset_recycling.exception.AuthorizationException;
import com.flagship.asset_recycling.exception.NotOwnerException;
import com.flagship.asset_recycling.exception.OperationFailedException;
import com.flagship.asset_recycling.exception.RecyclingException;
import com.flagship.asset_recycling.exception.UnitNotFoundException;
import com.flagship.asset_recycling.exception.ValidationException;
import com.flagship.asset_recycling.observability.RecyclingMetrics;
import com.flagship.asset_recycling.outbox.OutboxService;
import com.flagship.asset_recycling.registry.AssetClassConfig;
import com.flagship.asset_recycling.registry.AssetClassRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.function.Supplier;

/**
 * Administrative surface: registry mutation, pause control and emergency rescue.
 *
 * Every operation asks the {@link AdminAuthorizer} first and fails with
 * {@link AuthorizationException} before touching any state. Errors are never
 * retried here; they go straight back to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminService {

    private final AdminAuthorizer authorizer;
    private final AssetClassRegistry registry;
    private final PauseSwitch pauseSwitch;
    private final OutboxService outboxService;
    private final RecyclingSettings settings;
    private final RecyclingMetrics metrics;
    private final Clock clock;

    public AssetClassConfig register(String actor, String classId, long pointsPerUnit) {
        return run(actor, AdminOperation.REGISTER_CLASS, () -> registry.register(classId, pointsPerUnit));
    }

    public AssetClassConfig updateRate(String actor, String classId, long newPointsPerUnit) {
        return run(actor, AdminOperation.UPDATE_RATE, () -> registry.updateRate(classId, newPointsPerUnit));
    }

    public AssetClassConfig setActive(String actor, String classId, boolean active) {
        return run(actor, AdminOperation.SET_ACTIVE, () -> registry.setActive(classId, active));
    }

    public AssetClassConfig deactivate(String actor, String classId) {
        return run(actor, AdminOperation.DEACTIVATE_CLASS, () -> registry.deactivate(classId));
    }

    /**
     * @return true if recycling was running and is now paused
     */
    public boolean pause(String actor) {
        return run(actor, AdminOperation.PAUSE, () -> {
            boolean changed = pauseSwitch.pause();
            if (changed) {
                outboxService.saveEvent(PauseStateChangedEvent.of(true, actor, clock.instant()));
                log.warn("Recycling paused by {}", actor);
            }
            return changed;
        });
    }

    /**
     * @return true if recycling was paused and is now running
     */
    public boolean unpause(String actor) {
        return run(actor, AdminOperation.UNPAUSE, () -> {
            boolean changed = pauseSwitch.unpause();
            if (changed) {
                outboxService.saveEvent(PauseStateChangedEvent.of(false, actor, clock.instant()));
                log.info("Recycling resumed by {}", actor);
            }
            return changed;
        });
    }

    /**
     * Moves a unit stuck in custody to a recovery identity. Works while paused.
     *
     * @throws NotOwnerException if the custody address does not hold the unit
     */
    public void emergencyRescue(String actor, String classId, BigInteger unitId, String recipient) {
        run(actor, AdminOperation.EMERGENCY_RESCUE, () -> {
            if (unitId == null) {
                throw new ValidationException("Unit id is required");
            }
            if (recipient == null || recipient.isBlank()) {
                throw new ValidationException("Recipient is required");
            }

            AssetClassCollaborator collaborator = registry.collaboratorFor(classId);
            String custody = settings.getCustodyAddress();

            String owner;
            try {
                owner = collaborator.ownerOf(unitId);
            } catch (RuntimeException e) {
                throw new UnitNotFoundException("Unit " + unitId + " of " + classId + " not found", e);
            }
            if (!custody.equals(owner)) {
                throw new NotOwnerException("Unit " + unitId + " of " + classId + " is not held in custody");
            }

            try {
                collaborator.transfer(custody, recipient, unitId);
            } catch (RuntimeException e) {
                throw new OperationFailedException("Rescue transfer failed: " + e.getMessage(), e);
            }

            outboxService.saveEvent(EmergencyRescueEvent.of(classId, unitId, recipient, actor, clock.instant()));
            log.warn("Emergency rescue: classId={}, unitId={}, to={}, by={}", classId, unitId, recipient, actor);
            return null;
        });
    }

    public boolean isPaused() {
        return pauseSwitch.isPaused();
    }

    private <T> T run(String actor, AdminOperation operation, Supplier<T> action) {
        String opName = operation.name().toLowerCase();
        if (actor == null || !authorizer.authorize(actor, operation)) {
            metrics.recordAdminOperation(opName, "unauthorized");
            log.warn("Rejected {} by unauthorized actor {}", operation, actor);
            throw new AuthorizationException("Actor " + actor + " is not allowed to perform " + operation);
        }
        try {
            T result = action.get();
            metrics.recordAdminOperation(opName, "success");
            return result;
        } catch (RecyclingException e) {
            metrics.recordAdminOperation(opName, e.getKind().name().toLowerCase());
            log.warn("Admin operation {} failed: {}", operation, e.getMessage());
            throw e;
        }
    }
}
