package com.viffx.Pda.Rules;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleParserTest {
    private static final String ANBN = String.join("\n",
            "(q0,a,Z) -> (q0,AZ)",
            "(q0,a,A) -> (q0,AA)",
            "(q0,b,A) -> (q1,ε)",
            "(q1,b,A) -> (q1,ε)",
            "(q1,ε,Z) -> (qf,ε)");

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(RuleParserTest.class.getResource("/rules/" + name).toURI());
    }

    @Test
    void parsesEveryLineInOrder() throws Exception {
        List<Transition> transitions = RuleParser.parse(ANBN);

        assertEquals(5, transitions.size());
        assertEquals(new Transition("q0", "a", "Z", "q0", "AZ"), transitions.get(0));
        assertEquals(new Transition("q0", "a", "A", "q0", "AA"), transitions.get(1));
        assertEquals(new Transition("q0", "b", "A", "q1", "ε"), transitions.get(2));
        assertEquals(new Transition("q1", "b", "A", "q1", "ε"), transitions.get(3));
        assertEquals(new Transition("q1", "ε", "Z", "qf", "ε"), transitions.get(4));
    }

    @Test
    void trimsWhitespaceAroundFieldsAndArrow() throws Exception {
        Transition transition = RuleParser.parse("  ( q0 , a ,Z )   ->  (q1 ,  AZ )\t").get(0);

        assertEquals(new Transition("q0", "a", "Z", "q1", "AZ"), transition);
    }

    @Test
    void acceptsArrowWithoutSurroundingSpaces() throws Exception {
        assertEquals(new Transition("q0", "a", "Z", "q0", "AZ"), RuleParser.parse("(q0,a,Z)->(q0,AZ)").get(0));
    }

    @Test
    void keepsMultiCharacterTokens() throws Exception {
        Transition transition = RuleParser.parse("(start,x,Z) -> (loop state,XYZ)").get(0);

        assertEquals("start", transition.state());
        assertEquals("loop state", transition.newState());
        assertEquals("XYZ", transition.newStackTop());
    }

    @Test
    void toleratesCarriageReturns() throws Exception {
        assertEquals(2, RuleParser.parse("(q0,a,Z) -> (q0,AZ)\r\n(q0,b,A) -> (q0,ε)").size());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "(q0,a,Z) -> q0,AZ)",        // missing opening parenthesis on target
            "(q0,a,Z) (q0,AZ)",          // missing arrow
            "(q0,a,Z) - (q0,AZ)",        // broken arrow
            "q0,a,Z) -> (q0,AZ)",        // missing opening parenthesis on source
            "(q0,a,Z -> (q0,AZ)",        // missing closing parenthesis on source
            "(q0,a,Z) -> (q0,AZ",        // missing closing parenthesis on target
            "(q0,a) -> (q0,AZ)",         // too few source fields
            "(q0,a,Z,X) -> (q0,AZ)",     // too many source fields
            "(q0,a,Z) -> (q0)",          // too few target fields
            "(q0,a,Z) -> (q0,AZ,B)",     // too many target fields
            "(q0,,Z) -> (q0,AZ)",        // empty field
            "(q0, ,Z) -> (q0,AZ)",       // blank field
            "(q0,a,Z) -> (q0,AZ) extra", // trailing text
            "(q0,a->b,Z) -> (q0,AZ)",    // arrow inside a field
    })
    void rejectsMalformedLines(String line) {
        RuleFormatException e = assertThrows(RuleFormatException.class, () -> RuleParser.parse(line));
        assertEquals("Invalid rule format. Use (state, input, stackTop) -> (newState, newStackTop)", e.getMessage());
        assertEquals(1, e.line());
    }

    @Test
    void blankLineBetweenValidRulesFailsTheWholeParse() {
        RuleFormatException e = assertThrows(RuleFormatException.class,
                () -> RuleParser.parse("(q0,a,Z) -> (q0,AZ)\n   \n(q0,b,A) -> (q0,ε)"));
        assertEquals(2, e.line());
        assertEquals("", e.text());
    }

    @Test
    void emptyTextIsASingleBlankLine() {
        assertThrows(RuleFormatException.class, () -> RuleParser.parse(""));
    }

    @Test
    void trailingNewlineIsABlankLine() {
        RuleFormatException e = assertThrows(RuleFormatException.class, () -> RuleParser.parse("(q0,a,Z) -> (q0,AZ)\n"));
        assertEquals(2, e.line());
    }

    @Test
    void errorReportsTheColumnWhereScanningStopped() {
        RuleFormatException e = assertThrows(RuleFormatException.class, () -> RuleParser.parse("(q0,a,Z) -> q0,AZ)"));
        assertEquals(13, e.column());
        assertEquals("(q0,a,Z) -> q0,AZ)", e.text());
        assertTrue(e.location().startsWith("line 1, column 13"));
    }

    @Test
    void reparsingYieldsEqualTransitions() throws Exception {
        assertEquals(RuleParser.parse(ANBN), RuleParser.parse(ANBN));
    }

    @Test
    void resultIsReadOnly() throws Exception {
        List<Transition> transitions = RuleParser.parse(ANBN);
        assertThrows(UnsupportedOperationException.class, () -> transitions.add(transitions.get(0)));
    }

    @Test
    void loadDropsTheFinalLineTerminatorOfAFile() throws Exception {
        List<Transition> transitions = RuleParser.load(resource("anbn.txt"), StandardCharsets.UTF_8);

        assertEquals(RuleParser.parse(ANBN), transitions);
    }

    @Test
    void loadStillRejectsBlankLinesInsideAFile() {
        assertThrows(RuleFormatException.class,
                () -> RuleParser.load(resource("blank-line.txt"), StandardCharsets.UTF_8));
    }

    @Test
    void loadRejectsMalformedFiles() {
        assertThrows(RuleFormatException.class,
                () -> RuleParser.load(resource("malformed.txt"), StandardCharsets.UTF_8));
    }
}
