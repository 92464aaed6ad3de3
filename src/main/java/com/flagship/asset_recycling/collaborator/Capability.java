package com.flagship.asset_recycling.collaborator;

/**
 * Capabilities an asset-class collaborator can be probed for. Destruction is
 * not probed; support is discovered when {@code destroy} is invoked.
 */
public enum Capability {
    /**
     * {@code ownerOf(unitId)}; required for registration.
     */
    OWNERSHIP_QUERY
}
