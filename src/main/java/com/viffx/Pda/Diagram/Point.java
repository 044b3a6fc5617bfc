package com.viffx.Pda.Diagram;

import org.json.JSONObject;

public record Point(double x, double y) {
    public Point offset(double dx, double dy) {
        return new Point(x + dx, y + dy);
    }

    public static Point midpoint(Point a, Point b) {
        return new Point((a.x + b.x) / 2, (a.y + b.y) / 2);
    }

    public JSONObject toJson() {
        JSONObject ret = new JSONObject();
        ret.put("x", x);
        ret.put("y", y);
        return ret;
    }
}
