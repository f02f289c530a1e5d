package org.e2immu.analyzer.shape.common.graph;

import java.util.ArrayList;
import java.util.List;

public class NodeBuilder {
    private final Graph graph;
    private final String id;
    private final String style;
    private final List<List<String>> rows = new ArrayList<>();
    private boolean built;

    NodeBuilder(Graph graph, String id, String style) {
        this.graph = graph;
        this.id = id;
        this.style = style;
    }

    public NodeBuilder addRowSequence(List<String> row) {
        if (row.size() != graph.columns().size()) {
            throw new IllegalArgumentException("Row " + row + " does not match columns " + graph.columns());
        }
        rows.add(List.copyOf(row));
        return this;
    }

    public void build() {
        if (built) throw new IllegalStateException("Node " + id + " was already built");
        built = true;
        graph.addNode(new Graph.Node(id, style, List.copyOf(rows)));
    }
}
