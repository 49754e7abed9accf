package dev.pathways.model;

/**
 * Bounds walk resolution so a heavily branched procedure cannot produce an unbounded result.
 */
public record WalkLimits(
    int maxWalks
) {
    public static final int DEFAULT_MAX_WALKS = 10_000;

    public static WalkLimits defaults() {
        return new WalkLimits(DEFAULT_MAX_WALKS);
    }
}
