package com.flagship.asset_recycling.query;

import lombok.Value;

/**
 * Answer of an eligibility check. {@code reason} is null when eligible.
 */
@Value
public class Eligibility {
    boolean eligible;
    String reason;

    public static Eligibility eligible() {
        return new Eligibility(true, null);
    }

    public static Eligibility rejected(String reason) {
        return new Eligibility(false, reason);
    }
}
