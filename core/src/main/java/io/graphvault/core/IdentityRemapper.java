package io.graphvault.core;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Translation table from snapshot (legacy) node identifiers to the identifiers
 * the store assigned while a restore recreated them.
 * <p>
 * Lifetime is one restore operation. The mapping is a bijection: a legacy id
 * maps to exactly one new id and no new id is claimed by two legacy ids.
 * Only nodes actually (re)materialized in the current pass are registered,
 * so an unresolved lookup means "do not link to this node".
 * <p>
 * Not thread-safe; restores are single-writer.
 */
public final class IdentityRemapper {
    private final Map<String, String> forward = new HashMap<>();
    private final Map<String, String> reverse = new HashMap<>();

    /**
     * Record that {@code legacyId} now lives at {@code newId}.
     * Re-registering the identical pair is a no-op.
     *
     * @throws IllegalStateException if either side is already bound to something else
     */
    public void register(String legacyId, String newId) {
        Objects.requireNonNull(legacyId, "legacyId");
        Objects.requireNonNull(newId, "newId");

        String existingNew = forward.get(legacyId);
        if (existingNew != null) {
            if (existingNew.equals(newId)) return;
            throw new IllegalStateException(
                    "legacy id %s already mapped to %s".formatted(legacyId, existingNew));
        }
        String existingLegacy = reverse.get(newId);
        if (existingLegacy != null) {
            throw new IllegalStateException(
                    "store id %s already claimed by legacy id %s".formatted(newId, existingLegacy));
        }
        forward.put(legacyId, newId);
        reverse.put(newId, legacyId);
    }

    public Optional<String> resolve(String legacyId) {
        return Optional.ofNullable(forward.get(legacyId));
    }

    public boolean contains(String legacyId) {
        return forward.containsKey(legacyId);
    }

    public int size() {
        return forward.size();
    }
}
