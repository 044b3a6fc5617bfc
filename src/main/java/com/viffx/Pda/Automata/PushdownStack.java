package com.viffx.Pda.Automata;

import com.viffx.Pda.Rules.Transition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Symbol stack of a running pushdown automaton. Symbols are strings; a replacement
 * pushed through {@link #replaceTop(String)} contributes one symbol per character.
 */
public class PushdownStack {
    public static final String BOTTOM = "Z";

    // head of the deque is the top of the stack
    private final Deque<String> deque = new ArrayDeque<>();

    public PushdownStack() {
        deque.push(BOTTOM);
    }

    public boolean isEmpty() {
        return deque.isEmpty();
    }

    public int size() {
        return deque.size();
    }

    public String top() throws SimulationException {
        if (deque.isEmpty()) throw new SimulationException("Stack underflow: the stack is empty, there is no top symbol to match.");
        return deque.peek();
    }

    public String pop() throws SimulationException {
        if (deque.isEmpty()) throw new SimulationException("Stack underflow: cannot pop from an empty stack.");
        return deque.pop();
    }

    /**
     * Pushes {@code symbols} so that its first character ends up on top. {@link Transition#EPSILON}
     * pushes nothing.
     */
    public void push(String symbols) {
        if (Transition.EPSILON.equals(symbols)) return;
        int[] codePoints = symbols.codePoints().toArray();
        for (int i = codePoints.length - 1; i >= 0; i--) {
            deque.push(new String(codePoints, i, 1));
        }
    }

    /**
     * Pops the top symbol and pushes {@code replacement} in its place.
     */
    public void replaceTop(String replacement) throws SimulationException {
        pop();
        push(replacement);
    }

    /**
     * Returns the contents bottom first, the last element being the top.
     */
    public List<String> contents() {
        List<String> contents = new ArrayList<>(deque);
        Collections.reverse(contents);
        return contents;
    }

    @Override
    public String toString() {
        return contents().toString();
    }
}
