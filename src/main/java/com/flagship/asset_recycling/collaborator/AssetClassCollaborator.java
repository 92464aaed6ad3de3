package com.flagship.asset_recycling.collaborator;

import java.math.BigInteger;

/**
 * Contract the recycling core requires from any asset class it accepts.
 *
 * Implementations are external and untrusted: any method may throw, and
 * {@link #transfer} or {@link #destroy} may call back into the service.
 */
public interface AssetClassCollaborator {

    /**
     * Returns the current owner of a unit.
     *
     * @throws RuntimeException if the unit does not exist
     */
    String ownerOf(BigInteger unitId);

    /**
     * Moves a unit between identities.
     *
     * @throws RuntimeException if the transfer is rejected
     */
    void transfer(String from, String to, BigInteger unitId);

    /**
     * Destroys a unit. Classes without destruction support keep this default.
     *
     * @throws UnsupportedOperationException if destruction is not supported
     * @throws RuntimeException if the destruction is rejected
     */
    default void destroy(BigInteger unitId) {
        throw new UnsupportedOperationException("Destruction is not supported by this asset class");
    }

    /**
     * Capability introspection used at registration time.
     */
    boolean supportsCapability(Capability capability);
}
