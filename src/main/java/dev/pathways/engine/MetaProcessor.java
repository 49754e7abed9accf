package dev.pathways.engine;

import dev.pathways.model.ProcessItem;
import dev.pathways.model.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds modifier and annotation tokens onto the concrete item they follow.
 */
public final class MetaProcessor {

    private MetaProcessor() {}

    /**
     * Process one walk. {@code * apple , large ; chopped} becomes a single apple item
     * with modifier "large" and annotation "chopped".
     *
     * @throws ProcessException if a modifier or annotation comes before any concrete item
     */
    public static List<ProcessItem> process(List<Token> walk) throws ProcessException {
        var items = new ArrayList<ProcessItem>();
        for (Token token : walk) {
            if (!token.kind().isMeta()) {
                items.add(ProcessItem.of(token));
                continue;
            }
            if (items.isEmpty()) {
                throw new ProcessException(token);
            }
            int last = items.size() - 1;
            ProcessItem target = items.get(last);
            items.set(last, switch (token.kind()) {
                case MODIFIER -> target.withModifier(token.text());
                case ANNOTATION -> target.withAnnotation(token.text());
                default -> throw new IllegalStateException("Not a meta token: " + token);
            });
        }
        return items;
    }
}
