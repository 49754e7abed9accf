package dev.pathways.engine;

import dev.pathways.model.Flow;
import dev.pathways.model.FlowItem;
import dev.pathways.model.Procedure;
import dev.pathways.model.Split;
import dev.pathways.model.Token;
import dev.pathways.model.WalkLimits;
import dev.pathways.model.WalkResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves a flow against slot choices into the concrete token sequences they select.
 *
 * <p>One slot choice is consumed per nesting level of branch points, not per branch point:
 * every split directly inside a flow shares the choice read for that flow, and a split nested
 * inside one of its alternatives reads the next choice.
 */
public final class FlowWalker {

    private static final Logger log = LogManager.getLogger(FlowWalker.class);

    private FlowWalker() {}

    /**
     * Resolve a procedure using its own walk limits.
     */
    public static WalkResult walks(Procedure procedure, List<Integer> slots) {
        return walks(procedure.flow(), slots, procedure.limits());
    }

    public static WalkResult walks(Flow flow, List<Integer> slots) {
        return walks(flow, slots, WalkLimits.defaults());
    }

    /**
     * Resolve a flow against slot choices.
     *
     * @param flow   a normalized flow
     * @param slots  slot choices, first entry for the outermost branch points
     * @param limits bound on the number of walks produced
     * @return the walks, or the reason the choices do not fit the flow
     */
    public static WalkResult walks(Flow flow, List<Integer> slots, WalkLimits limits) {
        var stack = new SlotStack(slots);
        List<List<Token>> walks;
        try {
            walks = findWalks(flow, stack, 0, limits);
        } catch (WalkException e) {
            log.debug("Resolution of slots {} failed: {}", slots, e.getMessage());
            return e.result();
        }

        if (!stack.leftover().isEmpty()) {
            log.debug("Slots {} left unused after walking", stack.leftover());
            return new WalkResult.LeftoverStack(List.copyOf(stack.leftover()));
        }

        log.debug("Slots {} resolved to {} walk(s)", slots, walks.size());
        return new WalkResult.Success(walks);
    }

    /**
     * Walk one flow level. The first split met reads the choice for {@code depth}; alternatives
     * it allows are walked at {@code depth + 1}. Blocked alternatives contribute no walks.
     */
    public static List<List<Token>> findWalks(Flow flow, SlotStack stack, int depth, WalkLimits limits)
            throws WalkException {
        List<List<Token>> results = new ArrayList<>();
        results.add(new ArrayList<>());
        Integer target = null;

        for (FlowItem item : flow.items()) {
            if (item instanceof FlowItem.TokenItem tokenItem) {
                for (List<Token> result : results) {
                    result.add(tokenItem.token());
                }
                continue;
            }

            var splitItem = (FlowItem.SplitItem) item;
            if (target == null) {
                target = stack.slotAt(depth);
                log.trace("Depth {} selects slot {}", depth, target);
            }

            var contributed = new ArrayList<List<Token>>();
            for (Split split : splitItem.splitSet().splits()) {
                if (split.gate().allowsSlot(target)) {
                    contributed.addAll(findWalks(split.flow(), stack, depth + 1, limits));
                }
            }

            if ((long) results.size() * contributed.size() > limits.maxWalks()) {
                throw new WalkException(new WalkResult.TooManyWalks(limits.maxWalks()));
            }

            List<List<Token>> expanded = new ArrayList<>(results.size() * contributed.size());
            for (List<Token> prefix : results) {
                for (List<Token> suffix : contributed) {
                    var walk = new ArrayList<Token>(prefix.size() + suffix.size());
                    walk.addAll(prefix);
                    walk.addAll(suffix);
                    expanded.add(walk);
                }
            }
            results = expanded;
        }

        var frozen = new ArrayList<List<Token>>(results.size());
        for (List<Token> result : results) {
            frozen.add(List.copyOf(result));
        }
        return List.copyOf(frozen);
    }
}
