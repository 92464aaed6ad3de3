package com.flagship.asset_recycling.recycle;

import com.flagship.asset_recycling.ledger.DisposalMode;
import com.flagship.asset_recycling.ledger.RecyclingRecord;
import lombok.Value;

import java.math.BigInteger;

/**
 * Outcome of one batch item: either the record it produced or the reason it failed.
 */
@Value
public class ItemResult {
    int index;
    String classId;
    BigInteger unitId;
    DisposalMode disposalMode;
    boolean success;
    long pointsGenerated;
    Long sequenceNumber;
    String reason;
    String detail;

    public static ItemResult success(int index, RecyclingRecord record) {
        return new ItemResult(
            index,
            record.getClassId(),
            record.getUnitId(),
            record.getDisposalMode(),
            true,
            record.getPointsGenerated(),
            record.getSequenceNumber(),
            null,
            null
        );
    }

    public static ItemResult failure(int index, String classId, BigInteger unitId, DisposalMode mode,
                                     String reason, String detail) {
        return new ItemResult(index, classId, unitId, mode, false, 0L, null, reason, detail);
    }
}
