package dev.pathways.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * A filter over variant slots. An {@link GateType#ALLOW} gate permits exactly the listed slots,
 * a {@link GateType#BLOCK} gate permits every slot except the listed ones.
 *
 * <p>Equality is syntactic: {@code ALLOW[0, 1, 2]} and a block gate that happens to permit the
 * same slots in some finite universe are different gates. The universe of slots is unknown to a
 * gate, so only {@code BLOCK[]} is recognized as allow-all and only {@code ALLOW[]} as block-all.
 */
public record Gate(GateType type, SortedSet<Integer> slots) implements Comparable<Gate> {

    public static final int MIN_SLOT = 0;
    public static final int MAX_SLOT = 255;

    public Gate {
        Objects.requireNonNull(type, "type");
        var copy = new TreeSet<Integer>();
        for (Integer slot : Objects.requireNonNull(slots, "slots")) {
            copy.add(checkSlot(slot));
        }
        slots = Collections.unmodifiableSortedSet(copy);
    }

    public static Gate allow(Collection<Integer> slots) {
        return new Gate(GateType.ALLOW, new TreeSet<>(slots));
    }

    public static Gate allow(Integer... slots) {
        return allow(Arrays.asList(slots));
    }

    public static Gate block(Collection<Integer> slots) {
        return new Gate(GateType.BLOCK, new TreeSet<>(slots));
    }

    public static Gate block(Integer... slots) {
        return block(Arrays.asList(slots));
    }

    /** A gate that allows every slot. */
    public static Gate allowAll() {
        return block();
    }

    /** A gate that blocks every slot. */
    public static Gate blockAll() {
        return allow();
    }

    /**
     * Rejects slot values outside the one-byte range.
     */
    public static int checkSlot(Integer slot) {
        Objects.requireNonNull(slot, "slot");
        if (slot < MIN_SLOT || slot > MAX_SLOT) {
            throw new IllegalArgumentException(
                "Slot %d out of range %d..%d".formatted(slot, MIN_SLOT, MAX_SLOT));
        }
        return slot;
    }

    public boolean isAllow() {
        return type == GateType.ALLOW;
    }

    public boolean isBlock() {
        return type == GateType.BLOCK;
    }

    public boolean isAllowAll() {
        return isBlock() && slots.isEmpty();
    }

    public boolean isBlockAll() {
        return isAllow() && slots.isEmpty();
    }

    /**
     * The resulting gate allows any slots blocked by this gate, and vice versa.
     */
    public Gate invert() {
        return new Gate(type.invert(), slots);
    }

    public boolean allowsSlot(int slot) {
        return slots.contains(slot) == isAllow();
    }

    public boolean blocksSlot(int slot) {
        return !allowsSlot(slot);
    }

    /**
     * Allows any slot allowed by either gate.
     */
    public Gate union(Gate other) {
        SortedSet<Integer> ls = slots;
        SortedSet<Integer> rs = other.slots;

        if (isAllow() && other.isAllow()) {
            return allow(union(ls, rs));
        } else if (isAllow()) {
            return block(difference(rs, ls));
        } else if (other.isAllow()) {
            return block(difference(ls, rs));
        }
        return block(intersection(ls, rs));
    }

    /**
     * Allows any slot allowed by both gates.
     */
    public Gate intersection(Gate other) {
        SortedSet<Integer> ls = slots;
        SortedSet<Integer> rs = other.slots;

        if (isAllow() && other.isAllow()) {
            return allow(intersection(ls, rs));
        } else if (isAllow()) {
            return allow(difference(ls, rs));
        } else if (other.isAllow()) {
            return allow(difference(rs, ls));
        }
        return block(union(ls, rs));
    }

    /**
     * Allows any slot allowed by this gate but not by the other.
     */
    public Gate difference(Gate other) {
        return intersection(other.invert());
    }

    /**
     * Allows any slot allowed by exactly one of the two gates.
     */
    public Gate symDifference(Gate other) {
        SortedSet<Integer> symmetric = difference(union(slots, other.slots), intersection(slots, other.slots));
        return type == other.type ? allow(symmetric) : block(symmetric);
    }

    @Override
    public int compareTo(Gate other) {
        int byType = type.compareTo(other.type);
        if (byType != 0) {
            return byType;
        }
        Iterator<Integer> left = slots.iterator();
        Iterator<Integer> right = other.slots.iterator();
        while (left.hasNext() && right.hasNext()) {
            int bySlot = Integer.compare(left.next(), right.next());
            if (bySlot != 0) {
                return bySlot;
            }
        }
        return Boolean.compare(left.hasNext(), right.hasNext());
    }

    @Override
    public String toString() {
        return slots.stream()
            .map(String::valueOf)
            .collect(Collectors.joining(", ", type + "[", "]"));
    }

    private static SortedSet<Integer> union(SortedSet<Integer> a, SortedSet<Integer> b) {
        var result = new TreeSet<>(a);
        result.addAll(b);
        return result;
    }

    private static SortedSet<Integer> intersection(SortedSet<Integer> a, SortedSet<Integer> b) {
        var result = new TreeSet<>(a);
        result.retainAll(b);
        return result;
    }

    private static SortedSet<Integer> difference(SortedSet<Integer> a, SortedSet<Integer> b) {
        var result = new TreeSet<>(a);
        result.removeAll(b);
        return result;
    }
}
