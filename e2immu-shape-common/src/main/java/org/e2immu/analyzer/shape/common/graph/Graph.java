package org.e2immu.analyzer.shape.common.graph;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * A directed graph with table-shaped nodes, written out in the DOT language.
 * <p>
 * Every node is a table with one header row holding the node id, one row with the column names, and then the rows
 * added through its {@link NodeBuilder}. Cells are written verbatim, so they may carry HTML-like markup such as
 * <code>&lt;font color="red"&gt;</code>; plain text has to go through {@link #escape(String)} first.
 */
public class Graph {
    private final List<String> columns;
    private final List<Node> nodes = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();

    record Node(String id, String style, List<List<String>> rows) {
    }

    record Edge(String source, String target, String label, boolean exit) {
    }

    private Graph(List<String> columns) {
        this.columns = columns;
    }

    public static Graph withColumns(String... columns) {
        return new Graph(List.of(columns));
    }

    public List<String> columns() {
        return columns;
    }

    @NotNull
    public NodeBuilder createNode(String id) {
        return new NodeBuilder(this, id, null);
    }

    @NotNull
    public NodeBuilder createNodeWithCustomStyle(String id, String style) {
        return new NodeBuilder(this, id, style);
    }

    void addNode(Node node) {
        nodes.add(node);
    }

    public void addRegularEdge(String source, String target) {
        edges.add(new Edge(source, target, null, false));
    }

    public void addExitEdge(String source, String label) {
        edges.add(new Edge(source, null, label, true));
    }

    public int numberOfNodes() {
        return nodes.size();
    }

    public int numberOfEdges() {
        return edges.size();
    }

    public static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '&' -> sb.append("&amp;");
                case '"' -> sb.append("&quot;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String nodeName(String id) {
        return "\"node_" + id + "\"";
    }

    public void write(Writer writer) throws IOException {
        writer.write("digraph CFG {\n");
        writer.write("graph [fontname=monospace];\n");
        writer.write("node [fontname=monospace];\n");
        writer.write("edge [fontname=monospace];\n");
        for (Node node : nodes) {
            writeNode(writer, node);
        }
        for (Edge edge : edges) {
            if (edge.exit()) {
                String exitNode = "\"exit_" + edge.source() + "\"";
                writer.write(exitNode + " [shape=point];\n");
                writer.write(nodeName(edge.source()) + " -> " + exitNode + " [label=\""
                             + escape(edge.label()) + "\"];\n");
            } else {
                writer.write(nodeName(edge.source()) + " -> " + nodeName(edge.target()) + ";\n");
            }
        }
        writer.write("}\n");
    }

    private void writeNode(Writer writer, Node node) throws IOException {
        writer.write(nodeName(node.id()));
        writer.write(" [shape=none, label=<<table border=\"0\" cellborder=\"1\" cellspacing=\"0\"");
        if (node.style() != null) {
            writer.write(" " + node.style());
        }
        writer.write(">");
        writer.write("<tr><td colspan=\"" + columns.size() + "\">" + escape(node.id()) + "</td></tr>");
        writer.write("<tr>");
        for (String column : columns) {
            writer.write("<td>" + escape(column) + "</td>");
        }
        writer.write("</tr>");
        for (List<String> row : node.rows()) {
            writer.write("<tr>");
            for (String cell : row) {
                writer.write("<td align=\"left\">" + cell + "</td>");
            }
            writer.write("</tr>");
        }
        writer.write("</table>>];\n");
    }
}
