package dev.pathways.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A concrete procedure element with the modifiers and annotations folded onto it.
 */
public record ProcessItem(
    TokenKind kind,
    String name,
    List<String> modifiers,
    List<String> annotations
) {
    public ProcessItem {
        modifiers = List.copyOf(modifiers);
        annotations = List.copyOf(annotations);
    }

    public static ProcessItem of(Token token) {
        return new ProcessItem(token.kind(), token.text(), List.of(), List.of());
    }

    public ProcessItem withModifier(String modifier) {
        var mods = new ArrayList<>(modifiers);
        mods.add(modifier);
        return new ProcessItem(kind, name, mods, annotations);
    }

    public ProcessItem withAnnotation(String annotation) {
        var anns = new ArrayList<>(annotations);
        anns.add(annotation);
        return new ProcessItem(kind, name, modifiers, anns);
    }
}
