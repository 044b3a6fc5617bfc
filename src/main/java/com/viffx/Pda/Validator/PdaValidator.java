package com.viffx.Pda.Validator;

import com.viffx.Pda.Automata.PdaSimulator;
import com.viffx.Pda.Automata.SimulationException;
import com.viffx.Pda.Rules.RuleFormatException;
import com.viffx.Pda.Rules.RuleParser;
import com.viffx.Pda.Rules.Transition;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Parses a submission's rules, runs the test string through them and phrases the answer.
 * Each call is independent; nothing is remembered between submissions.
 */
public class PdaValidator {
    private final PdaSimulator simulator;

    public PdaValidator() {
        this(new PdaSimulator());
    }

    public PdaValidator(PdaSimulator simulator) {
        this.simulator = Objects.requireNonNull(simulator, "simulator cannot be null");
    }

    @NotNull
    public Verdict check(Submission submission) {
        Objects.requireNonNull(submission, "submission cannot be null");

        List<Transition> transitions;
        try {
            transitions = RuleParser.parse(submission.ruleText());
        } catch (RuleFormatException e) {
            return Verdict.failed(e.getMessage());
        }

        try {
            boolean accepted = simulator.accepts(submission.testString(), transitions);
            return Verdict.decided(submission.testString(), accepted, transitions);
        } catch (SimulationException e) {
            return Verdict.failed(e.getMessage());
        }
    }
}
