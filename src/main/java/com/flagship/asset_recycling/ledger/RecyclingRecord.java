package com.flagship.asset_recycling.ledger;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One completed exchange.
 *
 * Records are created exactly once, by {@link RecyclingLedger#append}, and
 * are never updated or removed. {@code pointsGenerated} is the class rate at
 * the moment of the exchange.
 */
@Value
public class RecyclingRecord {
    long sequenceNumber;
    String actor;
    String classId;
    BigInteger unitId;
    long pointsGenerated;
    DisposalMode disposalMode;
    Instant timestamp;
}
