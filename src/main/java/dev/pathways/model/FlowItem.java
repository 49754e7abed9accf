package dev.pathways.model;

import java.util.Objects;

/**
 * One position in a flow: either a plain token or a branch point.
 * Token items order before split items.
 */
public sealed interface FlowItem extends Comparable<FlowItem> {

    /** A token that every variant passing this point includes. */
    record TokenItem(Token token) implements FlowItem {
        public TokenItem {
            Objects.requireNonNull(token, "token");
        }
    }

    /** A branch point with its gated alternatives. */
    record SplitItem(SplitSet splitSet) implements FlowItem {
        public SplitItem {
            Objects.requireNonNull(splitSet, "splitSet");
        }
    }

    static FlowItem of(Token token) {
        return new TokenItem(token);
    }

    static FlowItem of(SplitSet splits) {
        return new SplitItem(splits);
    }

    @Override
    default int compareTo(FlowItem other) {
        if (this instanceof TokenItem a && other instanceof TokenItem b) {
            return a.token().compareTo(b.token());
        }
        if (this instanceof SplitItem a && other instanceof SplitItem b) {
            return a.splitSet().compareTo(b.splitSet());
        }
        return this instanceof TokenItem ? -1 : 1;
    }
}
