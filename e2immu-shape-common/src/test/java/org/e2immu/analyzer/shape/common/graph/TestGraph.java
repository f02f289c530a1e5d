package org.e2immu.analyzer.shape.common.graph;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestGraph {

    @Test
    public void test1() throws IOException {
        Graph graph = Graph.withColumns("statement");
        graph.createNodeWithCustomStyle("bb0", "bgcolor=\"green\"")
                .addRowSequence(List.of("x = 1"))
                .build();
        graph.createNode("bb1").build();
        graph.addRegularEdge("bb0", "bb1");
        graph.addExitEdge("bb1", "return");
        assertEquals(2, graph.numberOfNodes());
        assertEquals(2, graph.numberOfEdges());

        StringWriter sw = new StringWriter();
        graph.write(sw);
        String dot = sw.toString();
        assertTrue(dot.startsWith("digraph CFG {\n"));
        assertTrue(dot.contains("\"node_bb0\" [shape=none, label=<<table border=\"0\" cellborder=\"1\" "
                                + "cellspacing=\"0\" bgcolor=\"green\"><tr><td colspan=\"1\">bb0</td></tr>"
                                + "<tr><td>statement</td></tr><tr><td align=\"left\">x = 1</td></tr></table>>];"), dot);
        assertTrue(dot.contains("\"node_bb1\" [shape=none, label=<<table border=\"0\" cellborder=\"1\" "
                                + "cellspacing=\"0\"><tr>"), dot);
        assertTrue(dot.contains("\"node_bb0\" -> \"node_bb1\";\n"));
        assertTrue(dot.contains("\"exit_bb1\" [shape=point];\n\"node_bb1\" -> \"exit_bb1\" [label=\"return\"];\n"));
        assertTrue(dot.endsWith("}\n"));
    }

    @Test
    public void test2() {
        assertEquals("x &lt; y &amp;&amp; z &gt; &quot;a&quot;", Graph.escape("x < y && z > \"a\""));
    }

    @Test
    public void test3() {
        Graph graph = Graph.withColumns("statement");
        NodeBuilder nodeBuilder = graph.createNode("bb0");
        assertThrows(IllegalArgumentException.class, () -> nodeBuilder.addRowSequence(List.of("a", "b")));
        nodeBuilder.build();
        assertThrows(IllegalStateException.class, nodeBuilder::build);
    }
}
