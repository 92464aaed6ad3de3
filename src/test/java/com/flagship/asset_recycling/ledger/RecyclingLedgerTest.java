package com.flagship.asset_recycling.ledger;

import com.flagship.asset_recycling.common.StateLock;
import com.flagship.asset_recycling.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Append-only ledger: sequence numbers, aggregates, indices and pagination.
 */
class RecyclingLedgerTest {

    private static final Instant AT = Instant.parse("2026-01-15T10:00:00Z");

    private RecyclingLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new RecyclingLedger(new StateLock());
    }

    private RecyclingRecord append(String actor, String classId, long unitId, long points) {
        return ledger.append(actor, classId, BigInteger.valueOf(unitId), points, DisposalMode.DESTRUCTION, AT);
    }

    @Test
    @DisplayName("Sequence numbers start at zero and are dense")
    void sequenceNumbersAreDense() {
        RecyclingRecord first = append("alice", "GEMS", 1, 100);
        RecyclingRecord second = append("bob", "GEMS", 2, 100);
        RecyclingRecord third = append("alice", "COINS", 3, 50);

        assertEquals(0, first.getSequenceNumber());
        assertEquals(1, second.getSequenceNumber());
        assertEquals(2, third.getSequenceNumber());
        assertEquals(3, ledger.getTotalRecyclings());
        assertEquals(second, ledger.getRecord(1).orElseThrow());
        assertTrue(ledger.getRecord(3).isEmpty());
        assertTrue(ledger.getRecord(-1).isEmpty());
    }

    @Test
    @DisplayName("Total points equal the sum over records")
    void totalPointsMatchRecords() {
        append("alice", "GEMS", 1, 100);
        append("bob", "GEMS", 2, 200);
        append("alice", "COINS", 3, 7);

        long sum = ledger.snapshot().stream().mapToLong(RecyclingRecord::getPointsGenerated).sum();
        assertEquals(307, ledger.getTotalPointsGenerated());
        assertEquals(sum, ledger.getTotalPointsGenerated());
    }

    @Test
    @DisplayName("Actor and class indices return records in append order")
    void indicesPreserveOrder() {
        append("alice", "GEMS", 1, 100);
        append("bob", "GEMS", 2, 100);
        append("alice", "COINS", 3, 50);

        List<RecyclingRecord> alice = ledger.historyForActor("alice");
        assertEquals(2, alice.size());
        assertEquals(0, alice.get(0).getSequenceNumber());
        assertEquals(2, alice.get(1).getSequenceNumber());

        List<RecyclingRecord> gems = ledger.historyForClass("GEMS");
        assertEquals(List.of(0L, 1L), gems.stream().map(RecyclingRecord::getSequenceNumber).toList());

        assertTrue(ledger.historyForActor("carol").isEmpty());
    }

    @Test
    @DisplayName("Paged history clamps to the available range")
    void pagination() {
        for (int i = 0; i < 5; i++) {
            append("alice", "GEMS", i, 10);
        }

        assertEquals(2, ledger.historyForActor("alice", 1, 2).size());
        assertEquals(1, ledger.historyForActor("alice", 1, 2).get(0).getSequenceNumber());
        assertEquals(1, ledger.historyForActor("alice", 4, 10).size());
        assertTrue(ledger.historyForActor("alice", 5, 10).isEmpty());
        assertTrue(ledger.historyForActor("alice", 0, 0).isEmpty());
        assertThrows(ValidationException.class, () -> ledger.historyForActor("alice", -1, 2));
        assertThrows(ValidationException.class, () -> ledger.historyForClass("GEMS", 0, -2));
    }

    @Test
    @DisplayName("An append that would overflow the total is rejected without mutation")
    void overflowIsRejected() {
        append("alice", "GEMS", 1, Long.MAX_VALUE - 10);

        assertThrows(ValidationException.class, () -> ledger.checkCanAppend(11));
        assertThrows(ValidationException.class, () -> append("bob", "GEMS", 2, 11));
        assertEquals(1, ledger.getTotalRecyclings());
        assertEquals(Long.MAX_VALUE - 10, ledger.getTotalPointsGenerated());
        assertTrue(ledger.historyForActor("bob").isEmpty());

        assertDoesNotThrow(() -> ledger.checkCanAppend(10));
    }

    @Test
    @DisplayName("A prepared record is stored only if nothing was appended after it was built")
    void preparedRecordMustBeCurrent() {
        RecyclingRecord prepared = ledger.nextRecord("alice", "GEMS", BigInteger.ONE, 100,
                DisposalMode.CUSTODY, AT);
        assertEquals(0, prepared.getSequenceNumber());
        assertEquals(0, ledger.getTotalRecyclings());

        append("bob", "GEMS", 2, 100);

        assertThrows(IllegalStateException.class, () -> ledger.append(prepared));
        assertEquals(1, ledger.getTotalRecyclings());
        assertEquals(100, ledger.getTotalPointsGenerated());
    }

    @Test
    @DisplayName("Returned history is a copy")
    void historyIsImmutable() {
        append("alice", "GEMS", 1, 100);

        List<RecyclingRecord> history = ledger.historyForActor("alice");
        assertThrows(UnsupportedOperationException.class, () -> history.clear());
        assertThrows(UnsupportedOperationException.class, () -> ledger.snapshot().clear());
    }
}
