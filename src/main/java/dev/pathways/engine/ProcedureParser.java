package dev.pathways.engine;

import dev.pathways.model.Flow;
import dev.pathways.model.FlowItem;
import dev.pathways.model.Gate;
import dev.pathways.model.Split;
import dev.pathways.model.SplitSet;
import dev.pathways.model.Token;
import dev.pathways.model.TokenKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses procedure text into a flow.
 *
 * <pre>
 *   * flour          ingredient
 *   = whisk          action
 *   / fold together  combination
 *   , sifted         modifier
 *   ; gently         annotation
 *   [ #0 * milk | #1,2 * oat milk | #! * water ]   branch point with gated alternatives
 * </pre>
 *
 * A token's text is a run of letters and digits, words separated by spaces or tabs.
 * A gate is {@code #} followed by an optional {@code !} (block instead of allow) and a
 * comma-separated slot list with no spaces; an alternative without a gate allows every slot.
 * Split sets are normalized as they are built, innermost first.
 */
public final class ProcedureParser {

    private final String text;
    private int pos;

    private ProcedureParser(String text) {
        this.text = text;
        this.pos = 0;
    }

    public static Flow parse(String text) throws ProcedureParseException {
        var parser = new ProcedureParser(text);
        Flow flow = parser.parseFlow();
        if (!parser.atEnd()) {
            throw parser.error("Unexpected '" + parser.peek() + "' outside of a branch");
        }
        return flow;
    }

    private Flow parseFlow() throws ProcedureParseException {
        var items = new ArrayList<FlowItem>();
        while (true) {
            skipWhitespace();
            if (atEnd()) {
                break;
            }
            char c = peek();
            if (c == '[') {
                items.add(FlowItem.of(parseSplitSet()));
            } else if (TokenKind.fromSigil(c) != null) {
                items.add(FlowItem.of(parseToken()));
            } else if (c == '|' || c == ']') {
                break;
            } else {
                throw error("Expected a sigil or '[' but found '" + c + "'");
            }
        }
        return new Flow(items);
    }

    private Token parseToken() throws ProcedureParseException {
        TokenKind kind = TokenKind.fromSigil(peek());
        pos++;
        skipInlineSpace();
        int start = pos;
        int end = pos;
        while (!atEnd() && Character.isLetterOrDigit(peek())) {
            while (!atEnd() && Character.isLetterOrDigit(peek())) {
                pos++;
            }
            end = pos;
            skipInlineSpace();
        }
        if (end == start) {
            throw error("Expected text after '" + kind.sigil() + "'");
        }
        return new Token(kind, text.substring(start, end));
    }

    private SplitSet parseSplitSet() throws ProcedureParseException {
        int open = pos;
        pos++;
        var splits = new ArrayList<Split>();
        while (true) {
            skipWhitespace();
            Gate gate = !atEnd() && peek() == '#' ? parseGate() : Gate.allowAll();
            Flow flow = parseFlow();
            splits.add(new Split(flow, gate));

            if (atEnd()) {
                pos = open;
                throw error("Unclosed '['");
            }
            char c = peek();
            pos++;
            if (c == ']') {
                return new SplitSet(splits);
            }
        }
    }

    private Gate parseGate() throws ProcedureParseException {
        pos++;
        boolean block = !atEnd() && peek() == '!';
        if (block) {
            pos++;
        }
        List<Integer> slots = new ArrayList<>();
        if (!atEnd() && Character.isDigit(peek())) {
            slots.add(parseSlot());
            while (pos + 1 < text.length() && peek() == ',' && Character.isDigit(text.charAt(pos + 1))) {
                pos++;
                slots.add(parseSlot());
            }
        }
        return block ? Gate.block(slots) : Gate.allow(slots);
    }

    private int parseSlot() throws ProcedureParseException {
        int start = pos;
        while (!atEnd() && Character.isDigit(peek())) {
            pos++;
        }
        String digits = text.substring(start, pos);
        int slot;
        try {
            slot = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            slot = Integer.MAX_VALUE;
        }
        if (slot > Gate.MAX_SLOT) {
            pos = start;
            throw error("Slot " + digits + " out of range " + Gate.MIN_SLOT + ".." + Gate.MAX_SLOT);
        }
        return slot;
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
    }

    private void skipInlineSpace() {
        while (!atEnd() && (peek() == ' ' || peek() == '\t')) {
            pos++;
        }
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private char peek() {
        return text.charAt(pos);
    }

    private ProcedureParseException error(String message) {
        int line = 1;
        int column = 1;
        for (int i = 0; i < pos && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new ProcedureParseException(message, line, column);
    }
}
