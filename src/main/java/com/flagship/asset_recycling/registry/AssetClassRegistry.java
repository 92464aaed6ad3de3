package com.flagship.asset_recycling.registry;

import com.flagship.asset_recycling.collaborator.AssetClassCollaborator;
import com.flagship.asset_recycling.collaborator.AssetClassDirectory;
import com.flagship.asset_recycling.collaborator.Capability;
import com.flagship.asset_recycling.common.StateLock;
import com.flagship.asset_recycling.config.RecyclingSettings;
import com.flagship.asset_recycling.event.AssetClassRateUpdatedEvent;
import com.flagship.asset_recycling.event.AssetClassRegisteredEvent;
import com.flagship.asset_recycling.event.AssetClassRemovedEvent;
import com.flagship.asset_recycling.event.AssetClassStatusChangedEvent;
import com.flagship.asset_recycling.exception.AlreadyRegisteredException;
import com.flagship.asset_recycling.exception.CapabilityMissingException;
import com.flagship.asset_recycling.exception.NotRegisteredException;
import com.flagship.asset_recycling.exception.ValidationException;
import com.flagship.asset_recycling.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Source of truth for which asset classes are accepted and at what rate.
 *
 * Authorization is not checked here; administrative callers go through
 * {@code AdminService}. Every mutation runs under the {@link StateLock}
 * write lock and writes its observation to the outbox in the same step.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssetClassRegistry {

    private final AssetClassDirectory directory;
    private final OutboxService outboxService;
    private final StateLock stateLock;
    private final RecyclingSettings settings;
    private final Clock clock;

    private final Map<String, AssetClassConfig> configs = new LinkedHashMap<>();

    /**
     * Registers a class, or re-activates a deactivated one with a new rate.
     *
     * @throws ValidationException if the id is blank, unresolvable, or the rate is out of range
     * @throws CapabilityMissingException if the collaborator fails the ownership-query probe
     * @throws AlreadyRegisteredException if the class is currently active
     */
    public AssetClassConfig register(String classId, long pointsPerUnit) {
        requireClassId(classId);
        AssetClassCollaborator collaborator = directory.resolve(classId)
            .orElseThrow(() -> new ValidationException(
                "Asset class " + classId + " does not resolve to an asset-class collaborator"));
        validateRate(pointsPerUnit);
        probeOwnershipQuery(classId, collaborator);

        return stateLock.write(() -> {
            AssetClassConfig existing = configs.get(classId);
            Instant now = clock.instant();

            if (existing != null && existing.isActive()) {
                throw new AlreadyRegisteredException("Asset class already registered: " + classId);
            }

            AssetClassConfig registered;
            boolean reactivated = existing != null;
            if (reactivated) {
                registered = existing.withRate(pointsPerUnit).withStatus(AssetClassStatus.ACTIVE);
            } else {
                registered = AssetClassConfig.register(classId, pointsPerUnit, now);
            }
            configs.put(classId, registered);
            outboxService.saveEvent(AssetClassRegisteredEvent.from(registered, reactivated, now));

            log.info("Asset class registered: classId={}, pointsPerUnit={}, reactivated={}",
                    classId, pointsPerUnit, reactivated);
            return registered;
        });
    }

    /**
     * Changes the rate used by future exchanges. Recorded history is untouched.
     */
    public AssetClassConfig updateRate(String classId, long newPointsPerUnit) {
        requireClassId(classId);
        validateRate(newPointsPerUnit);

        return stateLock.write(() -> {
            AssetClassConfig existing = requireRegistered(classId);
            AssetClassConfig updated = existing.withRate(newPointsPerUnit);
            configs.put(classId, updated);
            outboxService.saveEvent(AssetClassRateUpdatedEvent.of(
                    classId, existing.getPointsPerUnit(), newPointsPerUnit, clock.instant()));

            log.info("Asset class rate updated: classId={}, from={}, to={}",
                    classId, existing.getPointsPerUnit(), newPointsPerUnit);
            return updated;
        });
    }

    public AssetClassConfig setActive(String classId, boolean active) {
        requireClassId(classId);
        return stateLock.write(() -> applyStatus(classId, active));
    }

    /**
     * Soft removal: the class stops accepting exchanges, everything else stays.
     */
    public AssetClassConfig deactivate(String classId) {
        requireClassId(classId);
        return stateLock.write(() -> {
            boolean wasActive = requireRegistered(classId).isActive();
            AssetClassConfig deactivated = applyStatus(classId, false);
            if (wasActive) {
                outboxService.saveEvent(AssetClassRemovedEvent.of(
                        classId, deactivated.getTotalRecycled(), clock.instant()));
                log.info("Asset class removed (deactivated): classId={}", classId);
            }
            return deactivated;
        });
    }

    public Optional<AssetClassConfig> find(String classId) {
        if (classId == null) {
            return Optional.empty();
        }
        return stateLock.read(() -> Optional.ofNullable(configs.get(classId)));
    }

    public AssetClassStatus statusOf(String classId) {
        return find(classId).map(AssetClassConfig::getStatus).orElse(AssetClassStatus.UNREGISTERED);
    }

    public List<AssetClassConfig> findAll() {
        return stateLock.read(() -> List.copyOf(configs.values()));
    }

    public long countActive() {
        return stateLock.read(() -> configs.values().stream().filter(AssetClassConfig::isActive).count());
    }

    /**
     * Resolves the collaborator of a registered class.
     *
     * @throws NotRegisteredException if the class was never registered or is no longer bound
     */
    public AssetClassCollaborator collaboratorFor(String classId) {
        requireRegistered(classId);
        return directory.resolve(classId)
            .orElseThrow(() -> new NotRegisteredException("No collaborator bound for asset class " + classId));
    }

    /**
     * Bumps the per-class exchange counter. Must be called inside the ledger
     * commit's write-lock section.
     */
    public AssetClassConfig incrementRecycled(String classId) {
        return stateLock.write(() -> {
            AssetClassConfig updated = requireRegistered(classId).withRecycledIncrement();
            configs.put(classId, updated);
            return updated;
        });
    }

    private AssetClassConfig applyStatus(String classId, boolean active) {
        AssetClassConfig existing = requireRegistered(classId);
        AssetClassStatus target = active ? AssetClassStatus.ACTIVE : AssetClassStatus.INACTIVE;
        if (existing.getStatus() == target) {
            log.debug("Asset class {} already {}", classId, target);
            return existing;
        }
        AssetClassConfig updated = existing.withStatus(target);
        configs.put(classId, updated);
        outboxService.saveEvent(AssetClassStatusChangedEvent.of(classId, active, clock.instant()));
        log.info("Asset class status changed: classId={}, status={}", classId, target);
        return updated;
    }

    private AssetClassConfig requireRegistered(String classId) {
        AssetClassConfig config = stateLock.read(() -> configs.get(classId));
        if (config == null || !config.isRegistered()) {
            throw new NotRegisteredException("Asset class not registered: " + classId);
        }
        return config;
    }

    private void requireClassId(String classId) {
        if (classId == null || classId.isBlank()) {
            throw new ValidationException("Asset class id is required");
        }
    }

    private void validateRate(long pointsPerUnit) {
        if (pointsPerUnit <= 0) {
            throw new ValidationException("Points per unit must be positive");
        }
        if (pointsPerUnit > settings.getMaxPointsPerUnit()) {
            throw new ValidationException(String.format(
                "Points per unit %d exceeds maximum %d", pointsPerUnit, settings.getMaxPointsPerUnit()));
        }
    }

    private void probeOwnershipQuery(String classId, AssetClassCollaborator collaborator) {
        boolean supported;
        try {
            supported = collaborator.supportsCapability(Capability.OWNERSHIP_QUERY);
        } catch (RuntimeException e) {
            log.warn("Capability probe failed for asset class {}: {}", classId, e.getMessage());
            throw new CapabilityMissingException(
                "Asset class " + classId + " failed the ownership-query capability probe", e);
        }
        if (!supported) {
            throw new CapabilityMissingException(
                "Asset class " + classId + " does not support ownership queries");
        }
    }
}
