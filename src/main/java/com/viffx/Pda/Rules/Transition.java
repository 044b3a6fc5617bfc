package com.viffx.Pda.Rules;

import java.util.Objects;

/**
 * One rule of a pushdown automaton definition.
 * <p>
 * Read as: in {@code state}, reading {@code input} (or anything, when {@code input} is
 * {@link #EPSILON}) with {@code stackTop} on top of the stack, move to {@code newState}
 * and replace the top with {@code newStackTop}. The replacement is read left to right with
 * its first character ending on top; {@link #EPSILON} pops without pushing.
 *
 * @param state       state the rule fires from
 * @param input       input symbol, or {@link #EPSILON}
 * @param stackTop    symbol required on top of the stack
 * @param newState    state entered when the rule fires
 * @param newStackTop replacement for the popped top, or {@link #EPSILON}
 */
public record Transition(String state, String input, String stackTop, String newState, String newStackTop) {
    public static final String EPSILON = "ε";

    public Transition {
        Objects.requireNonNull(state, "state cannot be null");
        Objects.requireNonNull(input, "input cannot be null");
        Objects.requireNonNull(stackTop, "stackTop cannot be null");
        Objects.requireNonNull(newState, "newState cannot be null");
        Objects.requireNonNull(newStackTop, "newStackTop cannot be null");
    }

    public boolean isEpsilonInput() {
        return EPSILON.equals(input);
    }

    public boolean popsOnly() {
        return EPSILON.equals(newStackTop);
    }

    /**
     * Returns whether this rule fires from {@code currentState} on {@code symbol}, ignoring
     * the stack. An epsilon rule accepts any symbol.
     */
    public boolean appliesTo(String currentState, String symbol) {
        return state.equals(currentState) && (input.equals(symbol) || isEpsilonInput());
    }

    /**
     * Returns whether this rule is eligible for the given configuration.
     */
    public boolean matches(String currentState, String symbol, String top) {
        return appliesTo(currentState, symbol) && stackTop.equals(top);
    }

    /**
     * Returns whether this rule accepts from {@code finalState}: an epsilon move popping
     * the bottom marker {@code bottom} without pushing anything.
     */
    public boolean acceptsFrom(String finalState, String bottom) {
        return state.equals(finalState) && isEpsilonInput() && stackTop.equals(bottom) && popsOnly();
    }

    public boolean isSelfLoop() {
        return state.equals(newState);
    }

    @Override
    public String toString() {
        return "(" + state + "," + input + "," + stackTop + ") -> (" + newState + "," + newStackTop + ")";
    }
}
