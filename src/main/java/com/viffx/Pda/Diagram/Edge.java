package com.viffx.Pda.Diagram;

import com.viffx.Pda.Rules.Transition;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;

/**
 * The arrow drawn for one transition.
 *
 * @param transition the rule the arrow stands for
 * @param points     flat polyline {@code [x0, y0, x1, y1, ...]}, arrow head at the end
 * @param text       arrow caption, {@code "input, stackTop -> newStackTop"}
 * @param label      where the caption is written
 * @param selfLoop   whether the rule returns to its own state
 */
public record Edge(Transition transition, List<Double> points, String text, Point label, boolean selfLoop) {
    public Edge {
        points = List.copyOf(points);
    }

    public static String caption(Transition transition) {
        return transition.input() + ", " + transition.stackTop() + " -> " + transition.newStackTop();
    }

    public JSONObject toJson() {
        JSONObject ret = new JSONObject();
        ret.put("from", transition.state());
        ret.put("to", transition.newState());
        ret.put("points", new JSONArray(points));
        ret.put("text", text);
        ret.put("label", label.toJson());
        ret.put("selfLoop", selfLoop);
        return ret;
    }

    @Override
    public String toString() {
        return transition.state() + " --[" + text + "]--> " + transition.newState();
    }
}
