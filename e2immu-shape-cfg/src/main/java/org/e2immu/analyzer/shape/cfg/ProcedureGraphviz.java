package org.e2immu.analyzer.shape.cfg;

import org.e2immu.analyzer.shape.cfg.statement.Statement;
import org.e2immu.analyzer.shape.common.graph.Graph;
import org.e2immu.analyzer.shape.common.graph.NodeBuilder;

import java.util.List;

public class ProcedureGraphviz {
    public static final String STATEMENT_COLUMN = "statement";

    private ProcedureGraphviz() {
    }

    public static Graph toGraph(Procedure procedure) {
        Graph graph = Graph.withColumns(STATEMENT_COLUMN);
        for (BasicBlockId id : procedure.blockIds()) {
            BasicBlock block = procedure.basicBlock(id);
            NodeBuilder nodeBuilder = graph.createNode(id.toString());
            addStatementRows(nodeBuilder, block.statements());
            nodeBuilder.build();
            addSuccessorEdges(graph, id, block.successor());
        }
        return graph;
    }

    public static void addStatementRows(NodeBuilder nodeBuilder, List<Statement> statements) {
        for (Statement statement : statements) {
            nodeBuilder.addRowSequence(List.of(statementCell(statement)));
        }
    }

    public static String statementCell(Statement statement) {
        String escaped = Graph.escape(statement.toString());
        if (statement instanceof Statement.Comment) {
            return "<font color=\"orange\">" + escaped + "</font>";
        }
        return escaped;
    }

    public static void addSuccessorEdges(Graph graph, BasicBlockId id, Successor successor) {
        if (successor instanceof Successor.Return) {
            graph.addExitEdge(id.toString(), "return");
        } else if (successor instanceof Successor.Goto g) {
            graph.addRegularEdge(id.toString(), g.target().toString());
        } else if (successor instanceof Successor.GotoSwitch gs) {
            for (Successor.SwitchTarget switchTarget : gs.switchTargets()) {
                graph.addRegularEdge(id.toString(), switchTarget.target().toString());
            }
        } else {
            throw new UnsupportedOperationException("Unknown successor " + successor);
        }
    }
}
