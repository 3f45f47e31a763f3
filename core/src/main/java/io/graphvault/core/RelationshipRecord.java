package io.graphvault.core;

import java.util.Map;
import java.util.Objects;

/**
 * A directed, typed relationship as captured at extraction time.
 * Endpoints refer to {@link NodeRecord#legacyId()} values of the same snapshot.
 */
public record RelationshipRecord(
        String legacyId,
        String type,
        String startLegacyId,
        String endLegacyId,
        Map<String, Object> properties
) {
    public RelationshipRecord {
        Objects.requireNonNull(legacyId, "legacyId");
        Objects.requireNonNull(startLegacyId, "startLegacyId");
        Objects.requireNonNull(endLegacyId, "endLegacyId");
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("relationship " + legacyId + " must have a type");
        }
        properties = PropertyValues.checked(properties);
    }
}
