package com.viffx.Pda.Validator;

import java.util.Objects;

/**
 * A rule definition and the string to test against it.
 *
 * @param ruleText   rule definition, one rule per line
 * @param testString the input string, possibly empty
 */
public record Submission(String ruleText, String testString) {
    public Submission {
        Objects.requireNonNull(ruleText, "ruleText cannot be null");
        Objects.requireNonNull(testString, "testString cannot be null");
    }
}
