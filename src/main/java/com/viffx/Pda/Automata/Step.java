package com.viffx.Pda.Automata;

import com.viffx.Pda.Rules.Transition;

import java.util.List;

/**
 * One fired rule of a simulation run.
 *
 * @param position   0-based index of the input symbol consumed
 * @param symbol     the input symbol consumed
 * @param transition the rule that fired
 * @param state      state after firing
 * @param stack      stack contents after firing, bottom first
 */
public record Step(int position, String symbol, Transition transition, String state, List<String> stack) {
    public Step {
        stack = List.copyOf(stack);
    }

    @Override
    public String toString() {
        return "Fire: '" + symbol + "' @" + position + " " + transition + " => " + state + " " + stack;
    }
}
