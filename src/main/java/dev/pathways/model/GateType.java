package dev.pathways.model;

/**
 * Whether a gate's slot set lists the slots it allows or the slots it blocks.
 */
public enum GateType {
    ALLOW,
    BLOCK;

    public GateType invert() {
        return this == ALLOW ? BLOCK : ALLOW;
    }
}
