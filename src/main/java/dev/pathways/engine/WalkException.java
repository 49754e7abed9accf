package dev.pathways.engine;

import dev.pathways.model.WalkResult;

/**
 * Thrown while resolving walks when the slot choices do not fit the flow.
 */
public class WalkException extends Exception {
    private final WalkResult result;

    public WalkException(WalkResult result) {
        super(describe(result));
        this.result = result;
    }

    /** The failure variant describing what went wrong. */
    public WalkResult result() {
        return result;
    }

    /**
     * Human readable description of a failed resolution.
     */
    public static String describe(WalkResult result) {
        if (result instanceof WalkResult.EmptyStack empty) {
            return "Not enough slot choices: no choice for branch depth " + empty.depth();
        } else if (result instanceof WalkResult.LeftoverStack leftover) {
            return "Too many slot choices: unused " + leftover.leftover();
        } else if (result instanceof WalkResult.TooManyWalks tooMany) {
            return "Selection produces more than " + tooMany.limit() + " walks";
        }
        return "Resolved " + ((WalkResult.Success) result).walks().size() + " walk(s)";
    }
}
