package dev.pathways.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A single element of a procedure step, such as an ingredient or an action.
 */
public record Token(TokenKind kind, String text) implements Comparable<Token> {

    private static final Comparator<Token> ORDER =
        Comparator.comparing(Token::kind).thenComparing(Token::text);

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public static Token ingredient(String text) {
        return new Token(TokenKind.INGREDIENT, text);
    }

    public static Token action(String text) {
        return new Token(TokenKind.ACTION, text);
    }

    public static Token combination(String text) {
        return new Token(TokenKind.COMBINATION, text);
    }

    public static Token modifier(String text) {
        return new Token(TokenKind.MODIFIER, text);
    }

    public static Token annotation(String text) {
        return new Token(TokenKind.ANNOTATION, text);
    }

    @Override
    public int compareTo(Token other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return kind.sigil() + " " + text;
    }
}
