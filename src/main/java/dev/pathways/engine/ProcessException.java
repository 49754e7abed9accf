package dev.pathways.engine;

import dev.pathways.model.Token;

/**
 * A modifier or annotation that has no item before it to attach to.
 */
public class ProcessException extends Exception {
    private final Token token;

    public ProcessException(Token token) {
        super("'%s' has no preceding item to apply to".formatted(token));
        this.token = token;
    }

    public Token token() {
        return token;
    }
}
