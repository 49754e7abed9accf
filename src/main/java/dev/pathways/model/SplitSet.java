package dev.pathways.model;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * All alternatives at one branch point, always held in normalized form: the gates together
 * allow every slot, no gate is block-all, and no two alternatives share a sub-flow.
 * Alternatives are kept in ascending {@link Split} order.
 */
public record SplitSet(List<Split> splits) implements Comparable<SplitSet> {

    private static final Logger log = LogManager.getLogger(SplitSet.class);

    public SplitSet {
        splits = normalize(Objects.requireNonNull(splits, "splits"));
    }

    public static SplitSet of(Split... splits) {
        return new SplitSet(Arrays.asList(splits));
    }

    /**
     * Normalize a collection of alternatives.
     *
     * <ol>
     *   <li>Alternatives with a block-all gate are dropped.</li>
     *   <li>If the union of the remaining gates is not allow-all, an empty alternative gated by
     *       the inverse of that union is added, so every slot reaches some alternative.</li>
     *   <li>Alternatives with structurally equal sub-flows are merged, their gates unioned.</li>
     * </ol>
     *
     * Nested split sets are not revisited; they were normalized when they were built.
     *
     * @return the normalized alternatives in ascending order
     */
    public static List<Split> normalize(Collection<Split> splits) {
        var live = new ArrayList<Split>(splits.size() + 1);
        for (Split split : splits) {
            if (!split.gate().isBlockAll()) {
                live.add(split);
            }
        }

        Gate union = Gate.blockAll();
        for (Split split : live) {
            union = union.union(split.gate());
        }

        if (!union.isAllowAll()) {
            live.add(new Split(Flow.empty(), union.invert()));
        }

        Map<Flow, Gate> byFlow = new TreeMap<>();
        for (Split split : live) {
            byFlow.merge(split.flow(), split.gate(), (a, b) -> a.union(b));
        }

        var result = new ArrayList<Split>(byFlow.size());
        for (var entry : byFlow.entrySet()) {
            result.add(new Split(entry.getKey(), entry.getValue()));
        }

        if (log.isTraceEnabled() && result.size() != splits.size()) {
            log.trace("Normalized {} alternatives into {}", splits.size(), result.size());
        }
        return List.copyOf(result);
    }

    /**
     * The union of all alternative gates. Allow-all for every normalized set.
     */
    public Gate coverage() {
        Gate union = Gate.blockAll();
        for (Split split : splits) {
            union = union.union(split.gate());
        }
        return union;
    }

    public int size() {
        return splits.size();
    }

    @Override
    public int compareTo(SplitSet other) {
        int common = Math.min(splits.size(), other.splits.size());
        for (int i = 0; i < common; i++) {
            int bySplit = splits.get(i).compareTo(other.splits.get(i));
            if (bySplit != 0) {
                return bySplit;
            }
        }
        return Integer.compare(splits.size(), other.splits.size());
    }
}
