package com.viffx.Pda.Automata;

import java.util.List;

/**
 * Outcome of one simulation run together with the trace that produced it.
 *
 * @param outcome     why the run ended
 * @param finalState  state the run ended in
 * @param finalStack  stack contents at the end, bottom first
 * @param steps       every fired rule, in order
 * @param stuckAt     index of the input symbol no rule matched, or {@code -1}
 */
public record SimulationResult(Outcome outcome, String finalState, List<String> finalStack, List<Step> steps, int stuckAt) {
    public enum Outcome {
        ACCEPTED,
        NO_TRANSITION,      // some input symbol had no eligible rule
        NO_ACCEPTING_RULE,  // input consumed, but no (state, ε, Z) -> (_, ε) rule for the final state
    }

    public SimulationResult {
        finalStack = List.copyOf(finalStack);
        steps = List.copyOf(steps);
    }

    public static SimulationResult stuck(String state, List<String> stack, List<Step> steps, int position) {
        return new SimulationResult(Outcome.NO_TRANSITION, state, stack, steps, position);
    }

    public static SimulationResult finished(boolean accepted, String state, List<String> stack, List<Step> steps) {
        return new SimulationResult(accepted ? Outcome.ACCEPTED : Outcome.NO_ACCEPTING_RULE, state, stack, steps, -1);
    }

    public boolean accepted() {
        return outcome == Outcome.ACCEPTED;
    }
}
