package com.viffx.Pda.Validator;

import com.viffx.Pda.Rules.Transition;
import org.jetbrains.annotations.Nullable;
import org.json.JSONObject;

import java.util.List;

/**
 * Answer to a {@link Submission}: either an accept/reject decision with its message and the
 * parsed rules, or an error message and no rules.
 *
 * @param accepted    the decision, {@code null} for an error
 * @param message     the user-facing decision message, {@code null} for an error
 * @param error       the user-facing error message, {@code null} on success
 * @param transitions the parsed rules, empty for an error
 */
public record Verdict(@Nullable Boolean accepted, @Nullable String message, @Nullable String error, List<Transition> transitions) {
    public Verdict {
        transitions = List.copyOf(transitions);
    }

    public static Verdict decided(String testString, boolean accepted, List<Transition> transitions) {
        String message = "The string \"" + testString + "\" is " + (accepted ? "ACCEPTED" : "REJECTED") + " by the PDA.";
        return new Verdict(accepted, message, null, transitions);
    }

    public static Verdict failed(String reason) {
        return new Verdict(null, null, "Error: " + reason, List.of());
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * The line shown to the user: the decision message or the error.
     */
    public String text() {
        return isError() ? error : message;
    }

    public JSONObject toJson() {
        JSONObject ret = new JSONObject();
        if (isError()) {
            ret.put("error", error);
        } else {
            ret.put("accepted", accepted.booleanValue());
            ret.put("message", message);
        }
        return ret;
    }
}
