package io.graphvault.core;

/**
 * Thresholds above which store growth warrants a new snapshot.
 *
 * @param minNewNodes          absolute node growth that triggers a backup
 * @param minNewRelationships  absolute relationship growth that triggers a backup
 * @param percentGrowth        relative growth (0.10 = 10%) that triggers a backup
 */
public record ChangeThresholds(long minNewNodes, long minNewRelationships, double percentGrowth) {

    public static final long DEFAULT_MIN_NEW_NODES = 50;
    public static final long DEFAULT_MIN_NEW_RELATIONSHIPS = 100;
    public static final double DEFAULT_PERCENT_GROWTH = 0.10;

    public ChangeThresholds {
        if (minNewNodes < 0 || minNewRelationships < 0) {
            throw new IllegalArgumentException("absolute thresholds must be >= 0");
        }
        if (Double.isNaN(percentGrowth) || percentGrowth < 0) {
            throw new IllegalArgumentException("percentGrowth must be >= 0");
        }
    }

    public static ChangeThresholds defaults() {
        return new ChangeThresholds(DEFAULT_MIN_NEW_NODES, DEFAULT_MIN_NEW_RELATIONSHIPS, DEFAULT_PERCENT_GROWTH);
    }
}
