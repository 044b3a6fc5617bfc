package com.viffx.Pda.Rules;

/**
 * Thrown when a line of a rule definition does not have the form
 * {@code (state,input,stackTop) -> (newState,newStackTop)}.
 * <p>
 * The message is always {@link #MESSAGE}; the position of the failure is kept
 * separately so callers can point at it without changing the text shown to users.
 */
public class RuleFormatException extends Exception {
    public static final String MESSAGE = "Invalid rule format. Use (state, input, stackTop) -> (newState, newStackTop)";

    private final int line;
    private final int column;
    private final String text;

    public RuleFormatException(int line, int column, String text) {
        super(MESSAGE);
        this.line = line;
        this.column = column;
        this.text = text;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public String text() {
        return text;
    }

    public String location() {
        return "line " + line + ", column " + column + ": \"" + text + "\"";
    }
}
