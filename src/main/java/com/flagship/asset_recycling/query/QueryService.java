package com.flagship.asset_recycling.query;

import com.flagship.asset_recycling.admin.PauseSwitch;
import com.flagship.asset_recycling.collaborator.AssetClassCollaborator;
import com.flagship.asset_recycling.collaborator.AssetClassDirectory;
import com.flagship.asset_recycling.common.StateLock;
import com.flagship.asset_recycling.exception.ErrorKind;
import com.flagship.asset_recycling.exception.NotRegisteredException;
import com.flagship.asset_recycling.exception.ValidationException;
import com.flagship.asset_recycling.ledger.RecyclingLedger;
import com.flagship.asset_recycling.ledger.RecyclingRecord;
import com.flagship.asset_recycling.registry.AssetClassConfig;
import com.flagship.asset_recycling.registry.AssetClassRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Read-only projections over the registry and the ledger. Nothing here mutates state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryService {

    private final AssetClassRegistry registry;
    private final RecyclingLedger ledger;
    private final AssetClassDirectory directory;
    private final PauseSwitch pauseSwitch;
    private final StateLock stateLock;

    public Optional<AssetClassConfig> getClassConfig(String classId) {
        return registry.find(classId);
    }

    public List<AssetClassConfig> listClasses() {
        return registry.findAll();
    }

    /**
     * True if the class is registered and currently active.
     */
    public boolean isAccepted(String classId) {
        return registry.find(classId).map(AssetClassConfig::isActive).orElse(false);
    }

    /**
     * Points {@code quantity} units of the class would earn at the current rate.
     *
     * @throws NotRegisteredException if the class was never registered
     * @throws ValidationException if quantity is negative or the product overflows
     */
    public long calculatePoints(String classId, long quantity) {
        if (quantity < 0) {
            throw new ValidationException("Quantity must not be negative");
        }
        AssetClassConfig config = registry.find(classId)
            .orElseThrow(() -> new NotRegisteredException("Asset class not registered: " + classId));
        try {
            return Math.multiplyExact(config.getPointsPerUnit(), quantity);
        } catch (ArithmeticException e) {
            throw new ValidationException("Points for " + quantity + " units of " + classId + " overflow");
        }
    }

    public List<RecyclingRecord> getHistoryForActor(String actor) {
        return ledger.historyForActor(actor);
    }

    public List<RecyclingRecord> getHistoryForActor(String actor, int offset, int limit) {
        return ledger.historyForActor(actor, offset, limit);
    }

    public List<RecyclingRecord> getHistoryForClass(String classId) {
        return ledger.historyForClass(classId);
    }

    public List<RecyclingRecord> getHistoryForClass(String classId, int offset, int limit) {
        return ledger.historyForClass(classId, offset, limit);
    }

    public Optional<RecyclingRecord> getRecord(long sequenceNumber) {
        return ledger.getRecord(sequenceNumber);
    }

    public long getHistorySize() {
        return ledger.getTotalRecyclings();
    }

    /**
     * Ledger totals and active class count, read as one consistent snapshot.
     */
    public RecyclingStats getStats() {
        return stateLock.read(() -> new RecyclingStats(
            ledger.getTotalRecyclings(),
            ledger.getTotalPointsGenerated(),
            registry.countActive()
        ));
    }

    /**
     * Dry run of the exchange preconditions: pause, class status, unit ownership.
     * Rejections are returned as values; this method does not throw for them.
     */
    public Eligibility canRecycle(String actor, String classId, BigInteger unitId) {
        if (actor == null || classId == null || unitId == null) {
            return Eligibility.rejected(ErrorKind.VALIDATION.getLabel());
        }
        if (pauseSwitch.isPaused()) {
            return Eligibility.rejected(ErrorKind.PAUSED.getLabel());
        }

        Optional<AssetClassConfig> config = registry.find(classId);
        if (config.isEmpty()) {
            return Eligibility.rejected(ErrorKind.NOT_REGISTERED.getLabel());
        }
        if (!config.get().isActive()) {
            return Eligibility.rejected(ErrorKind.NOT_ACTIVE.getLabel());
        }

        Optional<AssetClassCollaborator> collaborator = directory.resolve(classId);
        if (collaborator.isEmpty()) {
            return Eligibility.rejected(ErrorKind.NOT_REGISTERED.getLabel());
        }

        String owner;
        try {
            owner = collaborator.get().ownerOf(unitId);
        } catch (RuntimeException e) {
            log.debug("Ownership lookup failed for {} of {}: {}", unitId, classId, e.getMessage());
            return Eligibility.rejected(ErrorKind.UNIT_NOT_FOUND.getLabel());
        }
        if (owner == null) {
            return Eligibility.rejected(ErrorKind.UNIT_NOT_FOUND.getLabel());
        }
        if (!owner.equals(actor)) {
            return Eligibility.rejected(ErrorKind.NOT_OWNER.getLabel());
        }
        return Eligibility.eligible();
    }
}
