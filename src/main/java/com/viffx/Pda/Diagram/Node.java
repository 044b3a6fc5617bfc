package com.viffx.Pda.Diagram;

import org.json.JSONObject;

/**
 * A state circle of the diagram.
 *
 * @param state  state label
 * @param center circle center
 * @param radius circle radius
 * @param label  where the state label is written
 * @param fixed  whether the position comes from the fixed table rather than the grid
 */
public record Node(String state, Point center, double radius, Point label, boolean fixed) {
    public JSONObject toJson() {
        JSONObject ret = new JSONObject();
        ret.put("state", state);
        ret.put("center", center.toJson());
        ret.put("radius", radius);
        ret.put("label", label.toJson());
        ret.put("fixed", fixed);
        return ret;
    }
}
