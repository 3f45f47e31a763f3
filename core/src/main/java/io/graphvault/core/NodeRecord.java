package io.graphvault.core;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A node as captured at extraction time.
 * <p>
 * {@code legacyId} is the identifier the store had assigned when the snapshot
 * was taken. It is only meaningful inside the snapshot that carries it.
 * Labels keep their extraction order so generated statements are stable.
 */
public record NodeRecord(String legacyId, Set<String> labels, Map<String, Object> properties) {

    public NodeRecord {
        Objects.requireNonNull(legacyId, "legacyId");
        if (labels == null || labels.isEmpty()) {
            throw new IllegalArgumentException("node " + legacyId + " must have at least one label");
        }
        for (String label : labels) {
            if (label == null || label.isBlank()) {
                throw new IllegalArgumentException("node " + legacyId + " has a blank label");
            }
        }
        labels = Collections.unmodifiableSet(new LinkedHashSet<>(labels));
        properties = PropertyValues.checked(properties);
    }

    /** True if any of this node's labels is in {@code candidates}. */
    public boolean hasAnyLabel(Set<String> candidates) {
        for (String label : labels) {
            if (candidates.contains(label)) {
                return true;
            }
        }
        return false;
    }
}
