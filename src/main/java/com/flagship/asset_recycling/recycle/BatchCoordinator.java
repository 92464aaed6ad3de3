package com.flagship.asset_recycling.recycle;

import com.flagship.asset_recycling.admin.PauseSwitch;
import com.flagship.asset_recycling.event.RecyclingFailedEvent;
import com.flagship.asset_recycling.exception.ErrorKind;
import com.flagship.asset_recycling.exception.RecyclingException;
import com.flagship.asset_recycling.exception.ValidationException;
import com.flagship.asset_recycling.ledger.DisposalMode;
import com.flagship.asset_recycling.ledger.RecyclingRecord;
import com.flagship.asset_recycling.observability.CorrelationContext;
import com.flagship.asset_recycling.observability.RecyclingMetrics;
import com.flagship.asset_recycling.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs up to {@value #MAX_BATCH_SIZE} exchanges in one call.
 *
 * Items are processed strictly in input order. Each item is isolated: its
 * failure is turned into an {@link ItemResult} plus a RecyclingFailed event,
 * earlier successes stay committed, and later items still run. Nothing is
 * retried and no item exception leaves this class.
 *
 * Whole-batch rejections (paused, bad shape) happen before the first item.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchCoordinator {

    public static final int MAX_BATCH_SIZE = 50;

    private final RecycleProcessor processor;
    private final PauseSwitch pauseSwitch;
    private final OutboxService outboxService;
    private final RecyclingMetrics metrics;
    private final Clock clock;

    /**
     * @param classIds       class of each item
     * @param unitIds        unit of each item
     * @param useDestruction per item: true = destroy, false = custody transfer
     * @throws ValidationException if the lists differ in length, are empty, or exceed the ceiling
     */
    public BatchOutcome recycleBatch(String actor, List<String> classIds, List<BigInteger> unitIds,
                                     List<Boolean> useDestruction) {
        if (classIds == null || unitIds == null || useDestruction == null) {
            throw new ValidationException("Batch lists are required");
        }
        if (classIds.size() != unitIds.size() || classIds.size() != useDestruction.size()) {
            throw new ValidationException(String.format(
                "Batch lists must have equal length: classIds=%d, unitIds=%d, flags=%d",
                classIds.size(), unitIds.size(), useDestruction.size()));
        }
        List<BatchItem> items = new ArrayList<>(classIds.size());
        for (int i = 0; i < classIds.size(); i++) {
            items.add(new BatchItem(classIds.get(i), unitIds.get(i), useDestruction.get(i)));
        }
        return recycleBatch(actor, items);
    }

    public BatchOutcome recycleBatch(String actor, List<BatchItem> items) {
        long startTime = System.currentTimeMillis();

        try {
            BatchOutcome outcome = processor.inTransaction(() -> {
                pauseSwitch.ensureNotPaused();
                validateShape(actor, items);

                MDC.put(CorrelationContext.ACTOR_MDC_KEY, actor);
                List<ItemResult> results = new ArrayList<>(items.size());
                long totalPoints = 0;

                for (int i = 0; i < items.size(); i++) {
                    ItemResult result = processItem(actor, i, items.get(i));
                    results.add(result);
                    if (result.isSuccess()) {
                        totalPoints = Math.addExact(totalPoints, result.getPointsGenerated());
                    }
                }
                return new BatchOutcome(actor, List.copyOf(results), totalPoints);
            });

            metrics.recordBatch(items.size(), (int) outcome.getFailureCount());
            log.info("Batch completed: actor={}, items={}, succeeded={}, failed={}, totalPoints={}",
                    actor, items.size(), outcome.getSuccessCount(), outcome.getFailureCount(),
                    outcome.getTotalPoints());
            return outcome;

        } catch (RecyclingException e) {
            log.warn("Batch rejected: reason={}, error={}", e.getReason(), e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("batch", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.ACTOR_MDC_KEY);
        }
    }

    private ItemResult processItem(String actor, int index, BatchItem item) {
        DisposalMode mode = item.getUseDestruction() == null ? null
            : item.getUseDestruction() ? DisposalMode.DESTRUCTION : DisposalMode.CUSTODY;
        MDC.put(CorrelationContext.CLASS_ID_MDC_KEY, String.valueOf(item.getClassId()));
        MDC.put(CorrelationContext.UNIT_ID_MDC_KEY, String.valueOf(item.getUnitId()));

        try {
            RecyclingRecord record = processor.exchange(actor, item.getClassId(), item.getUnitId(), mode);
            metrics.recordExchange(modeTag(mode), "success");
            metrics.recordPointsAwarded(record.getPointsGenerated());
            log.debug("Batch item {} recycled: seq={}, points={}", index, record.getSequenceNumber(),
                    record.getPointsGenerated());
            return ItemResult.success(index, record);

        } catch (RecyclingException e) {
            if (e.getKind() == ErrorKind.POSTCONDITION_VIOLATED) {
                log.error("Batch item {} hit a destruction postcondition violation: {}", index, e.getMessage());
            } else {
                log.warn("Batch item {} failed: reason={}, error={}", index, e.getReason(), e.getMessage());
            }
            return recordFailure(actor, index, item, mode, e.getKind(), e.getMessage());

        } catch (RuntimeException e) {
            log.error("Batch item {} failed unexpectedly", index, e);
            return recordFailure(actor, index, item, mode, ErrorKind.UNEXPECTED, e.getMessage());

        } finally {
            MDC.remove(CorrelationContext.CLASS_ID_MDC_KEY);
            MDC.remove(CorrelationContext.UNIT_ID_MDC_KEY);
        }
    }

    private ItemResult recordFailure(String actor, int index, BatchItem item, DisposalMode mode,
                                     ErrorKind kind, String detail) {
        metrics.recordExchange(modeTag(mode), kind.name().toLowerCase());
        metrics.recordBatchItemFailure(kind.getLabel());
        outboxService.saveEvent(RecyclingFailedEvent.of(
                actor, item.getClassId(), item.getUnitId(), kind.getLabel(), detail, clock.instant()));
        return ItemResult.failure(index, item.getClassId(), item.getUnitId(), mode, kind.getLabel(), detail);
    }

    private void validateShape(String actor, List<BatchItem> items) {
        if (actor == null || actor.isBlank()) {
            throw new ValidationException("Actor is required");
        }
        if (items == null || items.isEmpty()) {
            throw new ValidationException("Batch must contain at least one item");
        }
        if (items.size() > MAX_BATCH_SIZE) {
            throw new ValidationException(String.format(
                "Batch size %d exceeds maximum %d", items.size(), MAX_BATCH_SIZE));
        }
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) == null) {
                throw new ValidationException("Batch item " + i + " is missing");
            }
        }
    }

    private String modeTag(DisposalMode mode) {
        return mode == null ? "unknown" : mode.name().toLowerCase();
    }
}
