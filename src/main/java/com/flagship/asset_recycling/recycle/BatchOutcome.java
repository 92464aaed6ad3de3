package com.flagship.asset_recycling.recycle;

import lombok.Value;

import java.util.List;

/**
 * Result of a batch call. {@code totalPoints} counts successful items only.
 */
@Value
public class BatchOutcome {
    String actor;
    List<ItemResult> results;
    long totalPoints;

    public long getSuccessCount() {
        return results.stream().filter(ItemResult::isSuccess).count();
    }

    public long getFailureCount() {
        return results.size() - getSuccessCount();
    }

    public List<ItemResult> getFailures() {
        return results.stream().filter(r -> !r.isSuccess()).toList();
    }
}
