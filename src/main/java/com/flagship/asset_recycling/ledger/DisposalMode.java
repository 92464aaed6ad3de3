package com.flagship.asset_recycling.ledger;

/**
 * How a unit left its owner's hands during an exchange.
 */
public enum DisposalMode {
    /**
     * The unit was destroyed and verified gone.
     */
    DESTRUCTION,

    /**
     * The unit was transferred to the custody address.
     */
    CUSTODY
}
