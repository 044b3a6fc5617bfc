package com.viffx.Pda.Diagram;

import com.viffx.Pda.Rules.Transition;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StateLayoutTest {
    @Test
    void conventionalStatesSitAtFixedPositions() {
        StateLayout layout = StateLayout.of(List.of());

        assertEquals(new Point(100, 100), layout.position("q0"));
        assertEquals(new Point(350, 200), layout.position("q1"));
        assertEquals(new Point(600, 100), layout.position("q2"));
        assertEquals(new Point(800, 200), layout.position("qf"));
        assertEquals(4, layout.positions().size());
    }

    @Test
    void unknownStatesFallBackToTheGridInOrderOfAppearance() {
        StateLayout layout = StateLayout.of(List.of(
                new Transition("q0", "a", "Z", "q7", "AZ"),
                new Transition("q7", "b", "A", "done", "ε"),
                new Transition("q7", "b", "A", "q7", "ε")));

        assertEquals(new Point(100, 350), layout.position("q7"));
        assertEquals(new Point(250, 350), layout.position("done"));
        assertFalse(layout.isFixed("q7"));
        assertTrue(layout.isFixed("q0"));
        assertEquals(6, layout.positions().size());
    }

    @Test
    void gridWrapsAfterAFullRow() {
        List<Transition> transitions = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            transitions.add(new Transition("s" + i, "a", "Z", "s" + i, "Z"));
        }
        StateLayout layout = StateLayout.of(transitions);

        assertEquals(new Point(850, 350), layout.position("s5"));
        assertEquals(new Point(100, 470), layout.position("s6"));
    }

    @Test
    void statesOutsideTheLayoutAreAnError() {
        assertThrows(IllegalArgumentException.class, () -> StateLayout.of(List.of()).position("q9"));
    }
}
