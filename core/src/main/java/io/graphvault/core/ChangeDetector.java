// file: src/main/java/io/graphvault/core/ChangeDetector.java
package io.graphvault.core;

import java.util.Objects;

/**
 * Pure decision function: does the store's growth since the last snapshot
 * justify taking a new one?
 * <p>
 * Rules, evaluated in order:
 *  1) No previous snapshot: always back up (bootstrap).
 *  2) Absolute growth: deltaNodes >= minNewNodes OR deltaRels >= minNewRelationships.
 *  3) Relative growth: delta / last >= percentGrowth, checked separately for
 *     nodes and relationships, and only when the previous count is > 0.
 * <p>
 * Thresholds are never negative, so shrinkage alone cannot trigger a backup.
 * A threshold of zero fires even when nothing changed.
 * No I/O, no clock, no state: the same inputs always give the same answer.
 */
public final class ChangeDetector {

    private ChangeDetector() {
        // utility
    }

    /**
     * @param current    statistics of the live store
     * @param last       statistics of the latest snapshot, or null if there is none
     * @param thresholds growth thresholds
     */
    public static boolean shouldBackup(GraphStatistics current, GraphStatistics last, ChangeThresholds thresholds) {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(thresholds, "thresholds");
        if (last == null) {
            return true;
        }

        long deltaNodes = current.nodeCount() - last.nodeCount();
        long deltaRels = current.relationshipCount() - last.relationshipCount();

        if (deltaNodes >= thresholds.minNewNodes() || deltaRels >= thresholds.minNewRelationships()) {
            return true;
        }

        return grewBy(deltaNodes, last.nodeCount(), thresholds.percentGrowth())
                || grewBy(deltaRels, last.relationshipCount(), thresholds.percentGrowth());
    }

    private static boolean grewBy(long delta, long previous, double fraction) {
        if (previous <= 0) {
            return false;
        }
        return (double) delta / previous >= fraction;
    }
}
