package com.flagship.asset_recycling.recycle;

import com.flagship.asset_recycling.event.RecyclingFailedEvent;
import com.flagship.asset_recycling.exception.PausedException;
import com.flagship.asset_recycling.exception.ValidationException;
import com.flagship.asset_recycling.ledger.DisposalMode;
import com.flagship.asset_recycling.support.FakeAssetClass;
import com.flagship.asset_recycling.support.RecyclingHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Batch exchanges: per-item isolation, ordering and the size ceiling.
 */
class BatchCoordinatorTest {

    private static final String ALICE = "alice";
    private static final String BOB = "bob";

    private RecyclingHarness harness;
    private BatchCoordinator batch;

    @BeforeEach
    void setUp() {
        harness = new RecyclingHarness();
        batch = harness.batch;
    }

    private static BigInteger unit(long id) {
        return BigInteger.valueOf(id);
    }

    @Test
    @DisplayName("A failing item does not undo earlier items or stop later ones")
    void partialFailure() {
        harness.activate("GEMS", 100, FakeAssetClass.destructible().mint(1, ALICE).mint(2, BOB).mint(3, ALICE));

        BatchOutcome outcome = batch.recycleBatch(ALICE,
                List.of("GEMS", "GEMS"), List.of(unit(1), unit(2)), List.of(true, true));

        assertEquals(100, outcome.getTotalPoints());
        assertEquals(1, outcome.getSuccessCount());
        assertEquals(1, outcome.getFailureCount());
        ItemResult failure = outcome.getFailures().get(0);
        assertEquals(1, failure.getIndex());
        assertEquals("not owner", failure.getReason());
        assertEquals(unit(2), failure.getUnitId());
        assertEquals(1, harness.ledger.getTotalRecyclings());

        List<?> failedEvents = harness.outboxService.getEventsOfType(RecyclingFailedEvent.EVENT_TYPE);
        assertEquals(1, failedEvents.size());
    }

    @Test
    @DisplayName("Items are processed in input order and mixed modes are honored")
    void orderAndModes() {
        harness.activate("GEMS", 100, FakeAssetClass.destructible().mint(1, ALICE));
        FakeAssetClass coins = harness.activate("COINS", 30, FakeAssetClass.transferOnly().mint(5, ALICE));

        BatchOutcome outcome = batch.recycleBatch(ALICE,
                List.of("COINS", "GEMS"), List.of(unit(5), unit(1)), List.of(false, true));

        assertEquals(130, outcome.getTotalPoints());
        ItemResult first = outcome.getResults().get(0);
        ItemResult second = outcome.getResults().get(1);
        assertEquals(0L, first.getSequenceNumber());
        assertEquals(DisposalMode.CUSTODY, first.getDisposalMode());
        assertEquals(1L, second.getSequenceNumber());
        assertEquals(DisposalMode.DESTRUCTION, second.getDisposalMode());
        assertEquals(RecyclingHarness.CUSTODY, coins.currentOwner(5));
    }

    @Test
    @DisplayName("The same unit twice in one batch succeeds only once")
    void duplicateUnitInBatch() {
        harness.activate("GEMS", 100, FakeAssetClass.destructible().mint(1, ALICE));

        BatchOutcome outcome = batch.recycleBatch(ALICE,
                List.of("GEMS", "GEMS"), List.of(unit(1), unit(1)), List.of(true, true));

        assertEquals(1, outcome.getSuccessCount());
        assertEquals("unit not found", outcome.getFailures().get(0).getReason());
        assertEquals(100, harness.ledger.getTotalPointsGenerated());
    }

    @Test
    @DisplayName("Destruction on a transfer-only class fails that item only")
    void unsupportedDestructionIsItemFailure() {
        harness.activate("COINS", 30, FakeAssetClass.transferOnly().mint(5, ALICE).mint(6, ALICE));

        BatchOutcome outcome = batch.recycleBatch(ALICE,
                List.of("COINS", "COINS"), List.of(unit(5), unit(6)), List.of(true, false));

        assertEquals("operation failed", outcome.getResults().get(0).getReason());
        assertTrue(outcome.getResults().get(1).isSuccess());
        assertEquals(30, outcome.getTotalPoints());
    }

    @Test
    @DisplayName("Fifty items are accepted")
    void maxBatchAccepted() {
        FakeAssetClass gems = FakeAssetClass.destructible();
        List<String> classes = new ArrayList<>();
        List<BigInteger> units = new ArrayList<>();
        List<Boolean> flags = new ArrayList<>();
        for (int i = 0; i < BatchCoordinator.MAX_BATCH_SIZE; i++) {
            gems.mint(i, ALICE);
            classes.add("GEMS");
            units.add(unit(i));
            flags.add(true);
        }
        harness.activate("GEMS", 10, gems);

        BatchOutcome outcome = batch.recycleBatch(ALICE, classes, units, flags);

        assertEquals(50, outcome.getSuccessCount());
        assertEquals(500, outcome.getTotalPoints());
        assertEquals(50, harness.ledger.getTotalRecyclings());
        assertEquals(50, harness.registry.find("GEMS").orElseThrow().getTotalRecycled());
    }

    @Test
    @DisplayName("Fifty-one items or an empty batch are rejected before processing")
    void sizeLimits() {
        FakeAssetClass gems = FakeAssetClass.destructible();
        for (int i = 0; i <= BatchCoordinator.MAX_BATCH_SIZE; i++) {
            gems.mint(i, ALICE);
        }
        harness.activate("GEMS", 10, gems);

        List<BatchItem> tooMany = new ArrayList<>();
        for (int i = 0; i <= BatchCoordinator.MAX_BATCH_SIZE; i++) {
            tooMany.add(BatchItem.of("GEMS", unit(i), true));
        }

        assertThrows(ValidationException.class, () -> batch.recycleBatch(ALICE, tooMany));
        assertThrows(ValidationException.class, () -> batch.recycleBatch(ALICE, Collections.emptyList()));
        assertEquals(0, gems.getDestroyCalls());
        assertEquals(0, harness.ledger.getTotalRecyclings());
    }

    @Test
    @DisplayName("Mismatched list lengths are rejected")
    void mismatchedLengths() {
        assertThrows(ValidationException.class, () -> batch.recycleBatch(ALICE,
                List.of("GEMS", "GEMS"), List.of(unit(1)), List.of(true, true)));
        assertThrows(ValidationException.class, () -> batch.recycleBatch(ALICE,
                List.of("GEMS"), List.of(unit(1)), List.of()));
    }

    @Test
    @DisplayName("A missing item rejects the whole batch before any item runs")
    void missingItemRejected() {
        FakeAssetClass gems = harness.activate("GEMS", 100,
                FakeAssetClass.destructible().mint(1, ALICE).mint(3, ALICE));
        List<BatchItem> items = Arrays.asList(
                new BatchItem("GEMS", unit(1), true), null, new BatchItem("GEMS", unit(3), true));

        ValidationException error = assertThrows(ValidationException.class,
                () -> batch.recycleBatch(ALICE, items));

        assertTrue(error.getMessage().contains("item 1"));
        assertEquals(0, harness.ledger.getTotalRecyclings());
        assertTrue(gems.exists(1));
        assertTrue(gems.exists(3));
    }

    @Test
    @DisplayName("A paused service rejects the whole batch")
    void pausedBatch() {
        harness.activate("GEMS", 100, FakeAssetClass.destructible().mint(1, ALICE));
        harness.pauseSwitch.pause();

        assertThrows(PausedException.class, () -> batch.recycleBatch(ALICE,
                List.of("GEMS"), List.of(unit(1)), List.of(true)));
        assertTrue(harness.outboxService.getEventsOfType(RecyclingFailedEvent.EVENT_TYPE).isEmpty());
    }

    @Test
    @DisplayName("A collaborator calling back into a batch gets a reentrancy failure for that item")
    void reentrantBatchItem() {
        FakeAssetClass evil = FakeAssetClass.transferOnly().mint(1, ALICE).mint(2, ALICE);
        evil.onDisposal(() -> batch.recycleBatch(ALICE, List.of(BatchItem.of("EVIL", unit(2), false))));
        harness.activate("EVIL", 100, evil);

        BatchOutcome outcome = batch.recycleBatch(ALICE, List.of(BatchItem.of("EVIL", unit(1), false)));

        assertEquals(1, outcome.getFailureCount());
        assertEquals("operation failed", outcome.getFailures().get(0).getReason());
        assertTrue(outcome.getFailures().get(0).getDetail().contains("already in progress"));
        assertEquals(0, harness.ledger.getTotalRecyclings());
        assertEquals(ALICE, evil.currentOwner(1));
    }
}
