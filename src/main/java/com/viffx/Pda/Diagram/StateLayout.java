package com.viffx.Pda.Diagram;

import com.viffx.Pda.Rules.Transition;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assigns drawing coordinates to state labels.
 * <p>
 * The four conventional states {@code q0}, {@code q1}, {@code q2} and {@code qf} always sit at
 * fixed positions. Any other state gets the next free cell of a grid below them, in order of
 * first appearance, so rule sets naming unknown states can still be drawn.
 */
public class StateLayout {
    // ====== FIXED TABLE ====== //
    public static final Map<String, Point> FIXED;
    static {
        Map<String, Point> fixed = new LinkedHashMap<>();
        fixed.put("q0", new Point(100, 100));
        fixed.put("q1", new Point(350, 200));
        fixed.put("q2", new Point(600, 100));
        fixed.put("qf", new Point(800, 200));
        FIXED = Collections.unmodifiableMap(fixed);
    }

    // ====== GRID FALLBACK ====== //
    public static final double GRID_LEFT = 100;
    public static final double GRID_TOP = 350;
    public static final double GRID_COLUMN_WIDTH = 150;
    public static final double GRID_ROW_HEIGHT = 120;
    public static final int GRID_COLUMNS = 6;

    private final Map<String, Point> positions = new LinkedHashMap<>(FIXED);
    private int placed = 0;

    private StateLayout() {}

    /**
     * Lays out every state named by {@code transitions}, as source or target.
     */
    @NotNull
    @Contract("_ -> new")
    public static StateLayout of(List<Transition> transitions) {
        Objects.requireNonNull(transitions, "transitions cannot be null");
        StateLayout layout = new StateLayout();
        for (Transition transition : transitions) {
            layout.place(transition.state());
            layout.place(transition.newState());
        }
        return layout;
    }

    public Point position(String state) {
        Point point = positions.get(state);
        if (point == null) throw new IllegalArgumentException("state " + state + " is not part of this layout");
        return point;
    }

    public boolean isFixed(String state) {
        return FIXED.containsKey(state);
    }

    /**
     * Returns every laid out state with its position; fixed states first.
     */
    public Map<String, Point> positions() {
        return Collections.unmodifiableMap(positions);
    }

    private void place(String state) {
        if (positions.containsKey(state)) return;
        int row = placed / GRID_COLUMNS;
        int column = placed % GRID_COLUMNS;
        positions.put(state, new Point(GRID_LEFT + column * GRID_COLUMN_WIDTH, GRID_TOP + row * GRID_ROW_HEIGHT));
        placed++;
    }
}
