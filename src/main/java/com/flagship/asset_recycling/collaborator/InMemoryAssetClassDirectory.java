package com.flagship.asset_recycling.collaborator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Binding table from class id to collaborator, filled by the integrating system.
 */
@Component
@Slf4j
public class InMemoryAssetClassDirectory implements AssetClassDirectory {

    private final Map<String, AssetClassCollaborator> bindings = new ConcurrentHashMap<>();

    public void bind(String classId, AssetClassCollaborator collaborator) {
        Objects.requireNonNull(classId, "classId");
        Objects.requireNonNull(collaborator, "collaborator");
        AssetClassCollaborator previous = bindings.put(classId, collaborator);
        if (previous != null && previous != collaborator) {
            log.warn("Rebound asset class {} to a different collaborator", classId);
        } else {
            log.debug("Bound asset class {}", classId);
        }
    }

    @Override
    public Optional<AssetClassCollaborator> resolve(String classId) {
        if (classId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(bindings.get(classId));
    }
}
