package dev.pathways.model;

/**
 * The kinds of procedure tokens, each introduced by its own sigil in procedure text.
 */
public enum TokenKind {
    INGREDIENT('*'),
    ACTION('='),
    COMBINATION('/'),
    MODIFIER(','),
    ANNOTATION(';');

    private final char sigil;

    TokenKind(char sigil) {
        this.sigil = sigil;
    }

    public char sigil() {
        return sigil;
    }

    /** Modifiers and annotations decorate the item before them rather than standing alone. */
    public boolean isMeta() {
        return this == MODIFIER || this == ANNOTATION;
    }

    /**
     * @return the kind introduced by the sigil, or null if the character is not a sigil
     */
    public static TokenKind fromSigil(char c) {
        for (TokenKind kind : values()) {
            if (kind.sigil == c) {
                return kind;
            }
        }
        return null;
    }
}
