package dev.pathways.engine;

import dev.pathways.model.Gate;
import dev.pathways.model.WalkResult;

import java.util.List;

/**
 * Cursor over the slot choices of one resolution. Entry {@code i} is the choice for branch points
 * at nesting depth {@code i}; the cursor remembers how deep any live path has read.
 */
public final class SlotStack {
    private final List<Integer> slots;
    private int reached;

    public SlotStack(List<Integer> slots) {
        for (Integer slot : slots) {
            Gate.checkSlot(slot);
        }
        this.slots = List.copyOf(slots);
        this.reached = 0;
    }

    /**
     * Read the choice for the given nesting depth.
     *
     * @throws WalkException with {@link WalkResult.EmptyStack} if no choice was supplied for that depth
     */
    public int slotAt(int depth) throws WalkException {
        if (depth >= slots.size()) {
            throw new WalkException(new WalkResult.EmptyStack(depth));
        }
        reached = Math.max(reached, depth + 1);
        return slots.get(depth);
    }

    public int size() {
        return slots.size();
    }

    /** Number of leading choices some live path has read. */
    public int reached() {
        return reached;
    }

    /** Choices no live path has read. */
    public List<Integer> leftover() {
        return slots.subList(reached, slots.size());
    }
}
