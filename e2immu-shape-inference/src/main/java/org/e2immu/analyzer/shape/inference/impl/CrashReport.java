package org.e2immu.analyzer.shape.inference.impl;

import org.e2immu.analyzer.shape.cfg.BasicBlock;
import org.e2immu.analyzer.shape.cfg.BasicBlockId;
import org.e2immu.analyzer.shape.cfg.Procedure;
import org.e2immu.analyzer.shape.cfg.ProcedureGraphviz;
import org.e2immu.analyzer.shape.cfg.statement.Statement;
import org.e2immu.analyzer.shape.common.graph.Graph;
import org.e2immu.analyzer.shape.common.graph.NodeBuilder;
import org.e2immu.analyzer.shape.common.report.ReportCategory;
import org.e2immu.analyzer.shape.common.report.ReportSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Renders the traversal context when the inference of a procedure does not complete.
 * <p>
 * Use in a try-with-resources block around the traversal, and {@link #cancel()} it as the last statement of the
 * block. On any other exit, {@link #close()} hands a graph of the procedure to the report sink: the active block in
 * red, with the statements it had produced so far in red, the processed blocks in green.
 */
public class CrashReport implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(CrashReport.class);

    static final String ACTIVE_STYLE = "bgcolor=\"red\"";
    static final String DONE_STYLE = "bgcolor=\"green\"";

    private final TraversalContext context;
    private final ReportSink reportSink;
    private final String reportName;
    private final boolean enabled;
    private boolean armed = true;

    public CrashReport(TraversalContext context, ReportSink reportSink, String sourceFileName, boolean enabled) {
        this.context = context;
        this.reportSink = reportSink;
        this.reportName = ReportSink.reportName(sourceFileName, context.procedure().name(), "dot");
        this.enabled = enabled;
    }

    public void cancel() {
        armed = false;
    }

    @Override
    public void close() {
        if (!armed || !enabled) return;
        LOGGER.info("Inference of {} did not complete, writing {}", context.procedure().name(), reportName);
        Graph graph = render();
        reportSink.report(ReportCategory.CRASHING, reportName, graph::write);
    }

    Graph render() {
        Procedure procedure = context.procedure();
        Graph graph = Graph.withColumns(ProcedureGraphviz.STATEMENT_COLUMN);
        for (BasicBlockId id : procedure.blockIds()) {
            BasicBlock block = procedure.basicBlock(id);
            if (id.equals(context.currentLabel())) {
                NodeBuilder nodeBuilder = graph.createNodeWithCustomStyle(id.toString(), ACTIVE_STYLE);
                ProcedureGraphviz.addStatementRows(nodeBuilder, block.statements());
                for (Statement statement : context.currentStatements()) {
                    nodeBuilder.addRowSequence(List.of("<font color=\"red\">" + Graph.escape(statement.toString())
                                                       + "</font>"));
                }
                nodeBuilder.build();
            } else if (context.status(id) == BlockStatus.DONE) {
                NodeBuilder nodeBuilder = graph.createNodeWithCustomStyle(id.toString(), DONE_STYLE);
                ProcedureGraphviz.addStatementRows(nodeBuilder, context.processedStatements(id));
                nodeBuilder.build();
            } else {
                NodeBuilder nodeBuilder = graph.createNode(id.toString());
                ProcedureGraphviz.addStatementRows(nodeBuilder, block.statements());
                nodeBuilder.build();
            }
            ProcedureGraphviz.addSuccessorEdges(graph, id, block.successor());
        }
        return graph;
    }
}
