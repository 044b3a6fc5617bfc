package com.viffx.Pda.Automata;

/**
 * Thrown when a simulation reaches a configuration the rules leave undefined, such as
 * needing the top of an empty stack. This is not a rejection: a rejected input has a
 * well-defined answer, a failed simulation has none.
 */
public class SimulationException extends Exception {
    public SimulationException(String message) {
        super(message);
    }
}
