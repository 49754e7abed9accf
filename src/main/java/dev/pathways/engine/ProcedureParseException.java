package dev.pathways.engine;

/**
 * Procedure text that does not follow the procedure grammar.
 */
public class ProcedureParseException extends Exception {
    private final int line;
    private final int column;

    public ProcedureParseException(String message, int line, int column) {
        super("%s at line %d, column %d".formatted(message, line, column));
        this.line = line;
        this.column = column;
    }

    /** 1-based line of the offending character. */
    public int line() { return line; }

    /** 1-based column of the offending character. */
    public int column() { return column; }
}
