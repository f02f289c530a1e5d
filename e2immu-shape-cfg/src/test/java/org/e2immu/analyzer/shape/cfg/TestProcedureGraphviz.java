package org.e2immu.analyzer.shape.cfg;

import org.e2immu.analyzer.shape.cfg.place.Variable;
import org.e2immu.analyzer.shape.cfg.statement.BinaryOperator;
import org.e2immu.analyzer.shape.cfg.statement.Expression;
import org.e2immu.analyzer.shape.cfg.statement.Statement;
import org.e2immu.analyzer.shape.cfg.type.Type;
import org.e2immu.analyzer.shape.common.graph.Graph;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestProcedureGraphviz {

    @Test
    public void test1() throws IOException {
        ProcedureBuilder builder = new ProcedureBuilder("loop");
        Variable i = builder.addParameter("i", Type.INT);
        BasicBlockId bb0 = builder.newBlock();
        BasicBlockId bb1 = builder.newBlock();
        Expression cond = new Expression.BinaryOperation(BinaryOperator.LT, new Expression.Read(i.place()),
                Expression.Constant.of(10));
        builder.addStatement(bb0, new Statement.Comment("i < 10"))
                .addStatement(bb0, new Statement.Assign(i.place(), new Expression.BinaryOperation(BinaryOperator.ADD,
                        new Expression.Read(i.place()), Expression.Constant.of(1))))
                .setSuccessor(bb0, Successor.goToIf(cond, bb0, bb1))
                .setSuccessor(bb1, Successor.RETURN);
        Graph graph = ProcedureGraphviz.toGraph(builder.build());
        assertEquals(2, graph.numberOfNodes());
        assertEquals(3, graph.numberOfEdges());

        StringWriter sw = new StringWriter();
        graph.write(sw);
        String dot = sw.toString();
        assertTrue(dot.contains("<td align=\"left\"><font color=\"orange\">// i &lt; 10</font></td>"), dot);
        assertTrue(dot.contains("<td align=\"left\">i = i + 1</td>"), dot);
        assertTrue(dot.contains("\"node_bb0\" -> \"node_bb0\";\n\"node_bb0\" -> \"node_bb1\";\n"), dot);
        assertTrue(dot.contains("\"node_bb1\" -> \"exit_bb1\" [label=\"return\"];"), dot);
    }
}
