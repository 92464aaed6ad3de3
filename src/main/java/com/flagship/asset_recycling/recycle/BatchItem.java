package com.flagship.asset_recycling.recycle;

import lombok.Value;

import java.math.BigInteger;

/**
 * One requested exchange inside a batch.
 */
@Value
public class BatchItem {
    String classId;
    BigInteger unitId;
    Boolean useDestruction;

    public static BatchItem of(String classId, BigInteger unitId, boolean useDestruction) {
        return new BatchItem(classId, unitId, useDestruction);
    }
}
