package com.flagship.asset_recycling.ledger;

import com.flagship.asset_recycling.common.StateLock;
import com.flagship.asset_recycling.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only audit trail of completed exchanges.
 *
 * Invariants:
 * 1. Records are never mutated or removed; sequence number == list position
 * 2. totalRecyclings == records.size()
 * 3. totalPointsGenerated == sum of pointsGenerated over all records
 *
 * The two totals are caches kept for O(1) reads; they are updated only in
 * {@link #append}, together with the actor and class indices. History reads
 * go through the indices and never scan the whole ledger.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecyclingLedger {

    private final StateLock stateLock;

    private final List<RecyclingRecord> records = new ArrayList<>();
    private final Map<String, List<Integer>> positionsByActor = new HashMap<>();
    private final Map<String, List<Integer>> positionsByClass = new HashMap<>();
    private long totalPointsGenerated;

    /**
     * Fails if appending a record worth {@code points} would overflow the totals.
     * Lets a commit reject the exchange before it mutates anything.
     */
    public void checkCanAppend(long points) {
        stateLock.read(() -> {
            try {
                Math.addExact(totalPointsGenerated, points);
            } catch (ArithmeticException e) {
                throw new ValidationException("Total points generated would overflow");
            }
            return null;
        });
    }

    /**
     * Appends a record with the next sequence number and updates all
     * aggregates and indices in one write-lock step.
     */
    public RecyclingRecord append(String actor, String classId, BigInteger unitId,
                                  long pointsGenerated, DisposalMode mode, Instant timestamp) {
        return stateLock.write(() -> append(nextRecord(actor, classId, unitId, pointsGenerated, mode, timestamp)));
    }

    /**
     * Builds the record the next append would store, without storing it.
     * Only meaningful while the caller holds the write lock until it appends.
     *
     * @throws ValidationException if the record would overflow the point total
     */
    public RecyclingRecord nextRecord(String actor, String classId, BigInteger unitId,
                                      long pointsGenerated, DisposalMode mode, Instant timestamp) {
        return stateLock.read(() -> {
            checkCanAppend(pointsGenerated);
            return new RecyclingRecord(
                records.size(), actor, classId, unitId, pointsGenerated, mode, timestamp);
        });
    }

    /**
     * Stores a record obtained from {@link #nextRecord} under the same write lock.
     *
     * @throws IllegalStateException if another record was appended in between
     */
    public RecyclingRecord append(RecyclingRecord record) {
        return stateLock.write(() -> {
            int position = records.size();
            if (record.getSequenceNumber() != position) {
                throw new IllegalStateException("Stale ledger record: seq=" + record.getSequenceNumber()
                        + ", next=" + position);
            }
            long newTotal;
            try {
                newTotal = Math.addExact(totalPointsGenerated, record.getPointsGenerated());
            } catch (ArithmeticException e) {
                throw new ValidationException("Total points generated would overflow");
            }

            records.add(record);
            positionsByActor.computeIfAbsent(record.getActor(), k -> new ArrayList<>()).add(position);
            positionsByClass.computeIfAbsent(record.getClassId(), k -> new ArrayList<>()).add(position);
            totalPointsGenerated = newTotal;

            log.debug("Ledger append: seq={}, actor={}, classId={}, unitId={}, points={}",
                    position, record.getActor(), record.getClassId(), record.getUnitId(),
                    record.getPointsGenerated());
            return record;
        });
    }

    public long getTotalRecyclings() {
        return stateLock.read(() -> (long) records.size());
    }

    public long getTotalPointsGenerated() {
        return stateLock.read(() -> totalPointsGenerated);
    }

    public Optional<RecyclingRecord> getRecord(long sequenceNumber) {
        return stateLock.read(() -> {
            if (sequenceNumber < 0 || sequenceNumber >= records.size()) {
                return Optional.<RecyclingRecord>empty();
            }
            return Optional.of(records.get((int) sequenceNumber));
        });
    }

    public List<RecyclingRecord> historyForActor(String actor) {
        return historyForActor(actor, 0, Integer.MAX_VALUE);
    }

    public List<RecyclingRecord> historyForActor(String actor, int offset, int limit) {
        return stateLock.read(() -> page(positionsByActor.get(actor), offset, limit));
    }

    public List<RecyclingRecord> historyForClass(String classId) {
        return historyForClass(classId, 0, Integer.MAX_VALUE);
    }

    public List<RecyclingRecord> historyForClass(String classId, int offset, int limit) {
        return stateLock.read(() -> page(positionsByClass.get(classId), offset, limit));
    }

    /**
     * Full copy of the ledger in sequence order.
     */
    public List<RecyclingRecord> snapshot() {
        return stateLock.read(() -> List.copyOf(records));
    }

    private List<RecyclingRecord> page(List<Integer> positions, int offset, int limit) {
        if (offset < 0 || limit < 0) {
            throw new ValidationException("Offset and limit must not be negative");
        }
        if (positions == null || offset >= positions.size()) {
            return Collections.emptyList();
        }
        int end = (int) Math.min((long) offset + limit, positions.size());
        List<RecyclingRecord> result = new ArrayList<>(end - offset);
        for (int i = offset; i < end; i++) {
            result.add(records.get(positions.get(i)));
        }
        return Collections.unmodifiableList(result);
    }
}
