package com.viffx.Pda.Diagram;

import com.viffx.Pda.Rules.Transition;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Geometry of a state diagram for a transition list: one circle per state and one arrow per
 * transition, in rule order. Nothing is drawn here; a renderer only has to paint the shapes.
 */
public final class DiagramModel {
    public static final double NODE_RADIUS = 30;

    private final List<Node> nodes;
    private final List<Edge> edges;

    private DiagramModel(List<Node> nodes, List<Edge> edges) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
    }

    @NotNull
    @Contract("_ -> new")
    public static DiagramModel of(List<Transition> transitions) {
        Objects.requireNonNull(transitions, "transitions cannot be null");
        StateLayout layout = StateLayout.of(transitions);

        List<Node> nodes = new ArrayList<>();
        for (Map.Entry<String, Point> entry : layout.positions().entrySet()) {
            Point center = entry.getValue();
            nodes.add(new Node(entry.getKey(), center, NODE_RADIUS, center.offset(-15, -10), layout.isFixed(entry.getKey())));
        }

        List<Edge> edges = new ArrayList<>(transitions.size());
        for (Transition transition : transitions) {
            edges.add(edge(transition, layout));
        }
        return new DiagramModel(nodes, edges);
    }

    private static Edge edge(Transition transition, StateLayout layout) {
        Point from = layout.position(transition.state());
        Point to = layout.position(transition.newState());
        boolean selfLoop = transition.isSelfLoop();

        List<Double> points = selfLoop
                // loop above the circle, head pointing back down-right
                ? List.of(from.x(), from.y() - 30, from.x(), from.y() - 60, from.x() + 20, from.y() - 45)
                : List.of(from.x(), from.y(), to.x(), to.y());
        Point label = Point.midpoint(from, to).offset(selfLoop ? 30 : 0, selfLoop ? -40 : -10);
        return new Edge(transition, points, Edge.caption(transition), label, selfLoop);
    }

    public List<Node> nodes() {
        return nodes;
    }

    public List<Edge> edges() {
        return edges;
    }

    public JSONObject toJson() {
        JSONArray nodeArray = new JSONArray();
        for (Node node : nodes) nodeArray.put(node.toJson());
        JSONArray edgeArray = new JSONArray();
        for (Edge edge : edges) edgeArray.put(edge.toJson());

        JSONObject ret = new JSONObject();
        ret.put("nodes", nodeArray);
        ret.put("edges", edgeArray);
        return ret;
    }
}
