package dev.pathways.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The ordered tokens and branch points that make up every variant of a procedure.
 *
 * <p>Flows are immutable, so structurally identical sub-flows can be shared freely between
 * alternatives; rewriting a flow always produces a new one.
 */
public record Flow(List<FlowItem> items) implements Comparable<Flow> {

    private static final Flow EMPTY = new Flow(List.of());

    public Flow {
        items = List.copyOf(Objects.requireNonNull(items, "items"));
    }

    public static Flow empty() {
        return EMPTY;
    }

    public static Flow of(FlowItem... items) {
        return new Flow(Arrays.asList(items));
    }

    /**
     * A flow made only of tokens.
     */
    public static Flow ofTokens(Token... tokens) {
        var items = new ArrayList<FlowItem>(tokens.length);
        for (Token token : tokens) {
            items.add(FlowItem.of(token));
        }
        return new Flow(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }

    /**
     * Rebuilds this flow bottom-up, normalizing every nested split set.
     * Split sets are normalized on construction, so for any flow built through the public
     * constructors this returns an equal flow.
     */
    public Flow normalized() {
        var rebuilt = new ArrayList<FlowItem>(items.size());
        for (FlowItem item : items) {
            if (item instanceof FlowItem.SplitItem split) {
                var splits = new ArrayList<Split>();
                for (Split s : split.splitSet().splits()) {
                    splits.add(new Split(s.flow().normalized(), s.gate()));
                }
                rebuilt.add(FlowItem.of(new SplitSet(splits)));
            } else {
                rebuilt.add(item);
            }
        }
        return new Flow(rebuilt);
    }

    /**
     * The deepest split nesting anywhere in this flow: 0 for a flow without splits,
     * 1 for splits whose alternatives hold only tokens, and so on.
     */
    public int depth() {
        int depth = 0;
        for (FlowItem item : items) {
            if (item instanceof FlowItem.SplitItem split) {
                for (Split s : split.splitSet().splits()) {
                    depth = Math.max(depth, 1 + s.flow().depth());
                }
            }
        }
        return depth;
    }

    @Override
    public int compareTo(Flow other) {
        int common = Math.min(items.size(), other.items.size());
        for (int i = 0; i < common; i++) {
            int byItem = items.get(i).compareTo(other.items.get(i));
            if (byItem != 0) {
                return byItem;
            }
        }
        return Integer.compare(items.size(), other.items.size());
    }
}
