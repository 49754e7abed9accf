package dev.pathways.model;

import java.util.List;

/**
 * Result of resolving a flow against a sequence of slot choices.
 */
public sealed interface WalkResult {

    /** Every token sequence the slot choices select. */
    record Success(List<List<Token>> walks) implements WalkResult {
        public Success {
            walks = List.copyOf(walks);
        }
    }

    /** A split was reached at {@code depth} but no slot choice was left for it. */
    record EmptyStack(int depth) implements WalkResult {}

    /** Slot choices that no branch point consumed. */
    record LeftoverStack(List<Integer> leftover) implements WalkResult {}

    /** Resolution stopped because it would produce more than {@code limit} walks. */
    record TooManyWalks(int limit) implements WalkResult {}
}
