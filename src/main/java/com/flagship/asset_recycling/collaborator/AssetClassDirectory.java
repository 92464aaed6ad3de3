package com.flagship.asset_recycling.collaborator;

import java.util.Optional;

/**
 * Resolves an asset-class identifier to the collaborator that governs it.
 */
public interface AssetClassDirectory {

    Optional<AssetClassCollaborator> resolve(String classId);
}
