package com.flagship.asset_recycling.recycle;

import com.flagship.asset_recycling.admin.PauseSwitch;
import com.flagship.asset_recycling.collaborator.AssetClassCollaborator;
import com.flagship.asset_recycling.common.StateLock;
import com.flagship.asset_recycling.config.RecyclingSettings;
import com.flagship.asset_recycling.event.AssetRecycledEvent;
import com.flagship.asset_recycling.exception.NotActiveException;
import com.flagship.asset_recycling.exception.NotOwnerException;
import com.flagship.asset_recycling.exception.OperationFailedException;
import com.flagship.asset_recycling.exception.PostconditionException;
import com.flagship.asset_recycling.exception.RecyclingException;
import com.flagship.asset_recycling.exception.UnitNotFoundException;
import com.flagship.asset_recycling.exception.ValidationException;
import com.flagship.asset_recycling.ledger.DisposalMode;
import com.flagship.asset_recycling.ledger.RecyclingLedger;
import com.flagship.asset_recycling.ledger.RecyclingRecord;
import com.flagship.asset_recycling.observability.CorrelationContext;
import com.flagship.asset_recycling.observability.RecyclingMetrics;
import com.flagship.asset_recycling.outbox.OutboxEvent;
import com.flagship.asset_recycling.outbox.OutboxService;
import com.flagship.asset_recycling.registry.AssetClassConfig;
import com.flagship.asset_recycling.registry.AssetClassRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.function.Supplier;

/**
 * Executes a single exchange: one unit surrendered for points.
 *
 * Every exchange follows read → one external call → write:
 * 1. Class must be registered and active
 * 2. The caller must own the unit (ownership lookup failure = unit not found)
 * 3. The reward is captured from the current rate
 * 4. Exactly one disposal call into the collaborator (destroy or custody transfer)
 * 5. Destruction only: the unit must no longer resolve
 * 6. Ledger append, counters and the AssetRecycled event in one write-lock step,
 *    with the event serialized before anything is mutated
 *
 * Nothing is written before step 6, so a collaborator that calls back during
 * step 4 sees pre-exchange state. Callbacks are rejected anyway: a
 * transaction guard wraps every top-level call and an item guard wraps every
 * individual exchange.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecycleProcessor {

    private final AssetClassRegistry registry;
    private final RecyclingLedger ledger;
    private final OutboxService outboxService;
    private final PauseSwitch pauseSwitch;
    private final StateLock stateLock;
    private final RecyclingSettings settings;
    private final RecyclingMetrics metrics;
    private final Clock clock;

    private final ExchangeGuard transactionGuard = new ExchangeGuard("recycle transaction");
    private final ExchangeGuard itemGuard = new ExchangeGuard("recycle item");

    /**
     * Destroys the unit and awards the class rate.
     *
     * @throws OperationFailedException if the class cannot destroy units; use the custody variant instead
     * @throws PostconditionException if the unit still resolves after destruction
     */
    public RecyclingRecord recycleByDestruction(String actor, String classId, BigInteger unitId) {
        return recycle(actor, classId, unitId, DisposalMode.DESTRUCTION);
    }

    /**
     * Moves the unit to the custody address and awards the class rate.
     */
    public RecyclingRecord recycleByTransfer(String actor, String classId, BigInteger unitId) {
        return recycle(actor, classId, unitId, DisposalMode.CUSTODY);
    }

    public RecyclingRecord recycle(String actor, String classId, BigInteger unitId, DisposalMode mode) {
        long startTime = System.currentTimeMillis();
        String modeTag = mode.name().toLowerCase();
        putContext(actor, classId, unitId);

        try {
            RecyclingRecord record = inTransaction(() -> {
                pauseSwitch.ensureNotPaused();
                return exchange(actor, classId, unitId, mode);
            });

            metrics.recordExchange(modeTag, "success");
            metrics.recordPointsAwarded(record.getPointsGenerated());
            log.info("Exchange completed: seq={}, mode={}, points={}, duration={}ms",
                    record.getSequenceNumber(), mode, record.getPointsGenerated(),
                    System.currentTimeMillis() - startTime);
            return record;

        } catch (RecyclingException e) {
            metrics.recordExchange(modeTag, e.getKind().name().toLowerCase());
            log.warn("Exchange rejected: mode={}, reason={}, error={}", mode, e.getReason(), e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency(modeTag, System.currentTimeMillis() - startTime);
            clearContext();
        }
    }

    /**
     * Runs a top-level recycle operation under the transaction guard.
     */
    <T> T inTransaction(Supplier<T> body) {
        return transactionGuard.call(body);
    }

    /**
     * One isolated exchange. Batch items call this directly, inside the
     * batch's transaction guard.
     */
    RecyclingRecord exchange(String actor, String classId, BigInteger unitId, DisposalMode mode) {
        return itemGuard.call(() -> {
            validateInput(actor, classId, unitId, mode);

            // Reads
            AssetClassConfig config = registry.find(classId)
                .filter(AssetClassConfig::isActive)
                .orElseThrow(() -> new NotActiveException("Asset class not active: " + classId));
            AssetClassCollaborator collaborator = registry.collaboratorFor(classId);
            requireOwnership(collaborator, actor, classId, unitId);
            long points = config.getPointsPerUnit();
            ledger.checkCanAppend(points);

            // The one external call
            if (mode == DisposalMode.DESTRUCTION) {
                destroy(collaborator, classId, unitId);
                verifyDestroyed(collaborator, classId, unitId);
            } else {
                transferToCustody(collaborator, actor, classId, unitId);
            }

            // Writes
            return commit(actor, classId, unitId, points, mode);
        });
    }

    private RecyclingRecord commit(String actor, String classId, BigInteger unitId,
                                   long points, DisposalMode mode) {
        return stateLock.write(() -> {
            // Everything that can fail runs before the first mutation
            RecyclingRecord record = ledger.nextRecord(actor, classId, unitId, points, mode, clock.instant());
            OutboxEvent recycled = outboxService.prepare(AssetRecycledEvent.fromRecord(record));
            registry.incrementRecycled(classId);
            ledger.append(record);
            outboxService.save(recycled);
            return record;
        });
    }

    private void requireOwnership(AssetClassCollaborator collaborator, String actor,
                                  String classId, BigInteger unitId) {
        String owner;
        try {
            owner = collaborator.ownerOf(unitId);
        } catch (RuntimeException e) {
            throw new UnitNotFoundException("Unit " + unitId + " of " + classId + " not found", e);
        }
        if (owner == null) {
            throw new UnitNotFoundException("Unit " + unitId + " of " + classId + " has no owner");
        }
        if (!owner.equals(actor)) {
            throw new NotOwnerException("Actor " + actor + " does not own unit " + unitId + " of " + classId);
        }
    }

    private void destroy(AssetClassCollaborator collaborator, String classId, BigInteger unitId) {
        try {
            collaborator.destroy(unitId);
        } catch (UnsupportedOperationException e) {
            throw new OperationFailedException(
                "Asset class " + classId + " does not support destruction; use the custody exchange instead", e);
        } catch (RuntimeException e) {
            throw new OperationFailedException(
                "Destruction of unit " + unitId + " failed: " + e.getMessage()
                    + "; use the custody exchange instead", e);
        }
    }

    private void verifyDestroyed(AssetClassCollaborator collaborator, String classId, BigInteger unitId) {
        String owner;
        try {
            owner = collaborator.ownerOf(unitId);
        } catch (RuntimeException expected) {
            // Lookup failure is the expected outcome: the unit is gone
            return;
        }
        if (owner != null) {
            log.error("Destruction postcondition violated: classId={}, unitId={} still owned by {}",
                    classId, unitId, owner);
            throw new PostconditionException(
                "Unit " + unitId + " of " + classId + " still exists after reported destruction");
        }
    }

    private void transferToCustody(AssetClassCollaborator collaborator, String actor,
                                   String classId, BigInteger unitId) {
        try {
            collaborator.transfer(actor, settings.getCustodyAddress(), unitId);
        } catch (RuntimeException e) {
            throw new OperationFailedException(
                "Custody transfer of unit " + unitId + " of " + classId + " failed: " + e.getMessage(), e);
        }
    }

    private void validateInput(String actor, String classId, BigInteger unitId, DisposalMode mode) {
        if (actor == null || actor.isBlank()) {
            throw new ValidationException("Actor is required");
        }
        if (classId == null || classId.isBlank()) {
            throw new ValidationException("Asset class id is required");
        }
        if (unitId == null) {
            throw new ValidationException("Unit id is required");
        }
        if (mode == null) {
            throw new ValidationException("Disposal mode is required");
        }
    }

    private void putContext(String actor, String classId, BigInteger unitId) {
        MDC.put(CorrelationContext.ACTOR_MDC_KEY, String.valueOf(actor));
        MDC.put(CorrelationContext.CLASS_ID_MDC_KEY, String.valueOf(classId));
        MDC.put(CorrelationContext.UNIT_ID_MDC_KEY, String.valueOf(unitId));
    }

    private void clearContext() {
        MDC.remove(CorrelationContext.ACTOR_MDC_KEY);
        MDC.remove(CorrelationContext.CLASS_ID_MDC_KEY);
        MDC.remove(CorrelationContext.UNIT_ID_MDC_KEY);
    }
}
