package dev.pathways.engine;

import dev.pathways.model.Flow;
import dev.pathways.model.FlowItem;
import dev.pathways.model.Gate;
import dev.pathways.model.ProcessItem;
import dev.pathways.model.Split;
import dev.pathways.model.Token;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders flows and walks as indented text.
 */
public final class FlowPrinter {

    private static final String INDENT = "  ";

    private FlowPrinter() {}

    /**
     * Render a flow as a tree, one token per line, alternatives indented under their gate.
     * Gate slots are shown by name where a name is known.
     */
    public static String printTree(Flow flow, Map<Integer, String> slotNames) {
        var sb = new StringBuilder();
        appendFlow(sb, flow, slotNames, 0);
        return sb.toString();
    }

    /**
     * Render one resolved walk, one token per line.
     */
    public static String printWalk(List<Token> walk) {
        var sb = new StringBuilder();
        for (Token token : walk) {
            sb.append(token).append('\n');
        }
        return sb.toString();
    }

    /**
     * Render one meta-processed walk: {@code * apple (large) [chopped]}.
     */
    public static String printItems(List<ProcessItem> items) {
        var sb = new StringBuilder();
        for (ProcessItem item : items) {
            sb.append(item.kind().sigil()).append(' ').append(item.name());
            if (!item.modifiers().isEmpty()) {
                sb.append(" (").append(String.join(", ", item.modifiers())).append(')');
            }
            if (!item.annotations().isEmpty()) {
                sb.append(" [").append(String.join("; ", item.annotations())).append(']');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static void appendFlow(StringBuilder sb, Flow flow, Map<Integer, String> names, int level) {
        for (FlowItem item : flow.items()) {
            if (item instanceof FlowItem.TokenItem tokenItem) {
                sb.append(INDENT.repeat(level)).append(tokenItem.token()).append('\n');
                continue;
            }
            var splitItem = (FlowItem.SplitItem) item;
            sb.append(INDENT.repeat(level)).append("[\n");
            for (Split split : splitItem.splitSet().splits()) {
                sb.append(INDENT.repeat(level + 1)).append(describe(split.gate(), names));
                if (split.flow().isEmpty()) {
                    sb.append(" (skip)");
                }
                sb.append('\n');
                appendFlow(sb, split.flow(), names, level + 2);
            }
            sb.append(INDENT.repeat(level)).append("]\n");
        }
    }

    static String describe(Gate gate, Map<Integer, String> names) {
        if (gate.isAllowAll()) {
            return "# any";
        }
        String slots = gate.slots().stream()
            .map(s -> names.getOrDefault(s, String.valueOf(s)))
            .collect(Collectors.joining(","));
        return (gate.isBlock() ? "#!" : "#") + slots;
    }
}
