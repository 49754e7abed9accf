package dev.pathways.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * One alternative at a branch point: the sub-flow is taken when the gate allows the selected slot.
 */
public record Split(Flow flow, Gate gate) implements Comparable<Split> {

    private static final Comparator<Split> ORDER =
        Comparator.comparing(Split::flow).thenComparing(Split::gate);

    public Split {
        Objects.requireNonNull(flow, "flow");
        Objects.requireNonNull(gate, "gate");
    }

    @Override
    public int compareTo(Split other) {
        return ORDER.compare(this, other);
    }
}
