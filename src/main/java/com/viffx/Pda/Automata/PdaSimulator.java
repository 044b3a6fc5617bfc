package com.viffx.Pda.Automata;

import com.viffx.Pda.Rules.Transition;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs a pushdown automaton, given as an ordered rule list, over an input string.
 * <p>
 * Every run starts in {@link #START_STATE} with only {@link PushdownStack#BOTTOM} on the stack
 * and reads the input one symbol at a time. For each symbol the <b>first</b> rule, in list
 * order, whose state, input and stack top match the configuration fires: its stack top is
 * popped, its replacement pushed and its target state entered. There is no backtracking, so
 * an ambiguous rule set behaves deterministically. An epsilon rule matches any symbol and
 * still consumes it. If no rule matches, the input is rejected.
 * <p>
 * Once the input is consumed the input is accepted iff some rule pops the bottom marker on
 * epsilon from the final state, i.e. {@code (final, ε, Z) -> (_, ε)}.
 * <p>
 * A simulator keeps no state between runs; the stack and current state live inside each call.
 */
public class PdaSimulator {
    public static final String START_STATE = "q0";

    @Nullable
    private final PrintStream trace;

    public PdaSimulator() {
        this(null);
    }

    /**
     * @param trace receives one line per fired rule and one per verdict, or {@code null} for silence
     */
    public PdaSimulator(@Nullable PrintStream trace) {
        this.trace = trace;
    }

    // ====== PUBLIC API ====== //

    /**
     * Decides whether {@code rules} accept {@code input}.
     *
     * @param input the string to test, possibly empty
     * @param rules the transition list, in the order it was written
     * @return {@code true} if the input is accepted
     * @throws SimulationException if a rule needs the top of an empty stack
     */
    public boolean accepts(String input, List<Transition> rules) throws SimulationException {
        return simulate(input, rules).accepted();
    }

    /**
     * Runs the automaton and returns the verdict along with the full trace.
     *
     * @param input the string to test, possibly empty
     * @param rules the transition list, in the order it was written
     * @return the outcome, final configuration and fired rules
     * @throws SimulationException if a rule needs the top of an empty stack
     */
    @NotNull
    public SimulationResult simulate(String input, List<Transition> rules) throws SimulationException {
        Objects.requireNonNull(input, "input cannot be null");
        Objects.requireNonNull(rules, "rules cannot be null");

        PushdownStack stack = new PushdownStack();
        String currentState = START_STATE;
        List<Step> steps = new ArrayList<>();

        int[] symbols = input.codePoints().toArray();
        for (int position = 0; position < symbols.length; position++) {
            String symbol = new String(symbols, position, 1);

            Transition fired = firstMatch(rules, currentState, symbol, stack);
            if (fired == null) {
                log("Stuck: no rule for (" + currentState + "," + symbol + "," + describeTop(stack) + ") @" + position);
                return SimulationResult.stuck(currentState, stack.contents(), steps, position);
            }

            stack.replaceTop(fired.newStackTop());
            currentState = fired.newState();

            Step step = new Step(position, symbol, fired, currentState, stack.contents());
            steps.add(step);
            log(step.toString());
        }

        boolean accepted = acceptingRule(rules, currentState) != null;
        log((accepted ? "Accept: " : "Reject: ") + currentState + " " + stack);
        return SimulationResult.finished(accepted, currentState, stack.contents(), steps);
    }

    /**
     * Returns the first rule eligible for the configuration, or {@code null}. The stack top is
     * only consulted for rules whose state and input already match.
     *
     * @throws SimulationException if such a rule exists and the stack is empty
     */
    @Nullable
    public static Transition firstMatch(List<Transition> rules, String state, String symbol, PushdownStack stack) throws SimulationException {
        for (Transition rule : rules) {
            if (!rule.appliesTo(state, symbol)) continue;
            if (rule.stackTop().equals(stack.top())) return rule;
        }
        return null;
    }

    /**
     * Returns the first rule of the form {@code (state, ε, Z) -> (_, ε)}, or {@code null}.
     */
    @Nullable
    public static Transition acceptingRule(List<Transition> rules, String state) {
        for (Transition rule : rules) {
            if (rule.acceptsFrom(state, PushdownStack.BOTTOM)) return rule;
        }
        return null;
    }

    // ====== TRACE ====== //
    private void log(String line) {
        if (trace != null) trace.println(line);
    }

    private static String describeTop(PushdownStack stack) {
        return stack.isEmpty() ? "<empty>" : stack.contents().get(stack.size() - 1);
    }
}
