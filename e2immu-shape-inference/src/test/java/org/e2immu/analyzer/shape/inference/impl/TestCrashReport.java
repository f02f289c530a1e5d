package org.e2immu.analyzer.shape.inference.impl;

import org.e2immu.analyzer.shape.cfg.BasicBlockId;
import org.e2immu.analyzer.shape.cfg.Procedure;
import org.e2immu.analyzer.shape.cfg.ProcedureBuilder;
import org.e2immu.analyzer.shape.cfg.Successor;
import org.e2immu.analyzer.shape.cfg.place.Variable;
import org.e2immu.analyzer.shape.cfg.statement.Statement;
import org.e2immu.analyzer.shape.cfg.type.Type;
import org.e2immu.analyzer.shape.common.InferenceException;
import org.e2immu.analyzer.shape.inference.CommonTest;
import org.e2immu.analyzer.shape.inference.RecordingReportSink;
import org.e2immu.analyzer.shape.inference.ShapeInference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestCrashReport extends CommonTest {
    private static final String REPORT = "graphviz_method_crashing_foldunfold/crash.rs.crashing.dot";
    private static final String TABLE = " [shape=none, label=<<table border=\"0\" cellborder=\"1\" cellspacing=\"0\"";

    private static Procedure crashing(boolean crash) {
        ProcedureBuilder builder = new ProcedureBuilder("crashing");
        Variable x = builder.addParameter("x", POINT);
        Variable r = builder.addReturn("r", Type.INT);
        Variable k = builder.addLocal("k", Type.INT);
        BasicBlockId bb0 = builder.newBlock();
        BasicBlockId bb1 = builder.newBlock();
        BasicBlockId bb2 = builder.newBlock();
        BasicBlockId bb3 = builder.newBlock();
        builder.addStatement(bb0, new Statement.Comment("start"))
                .setSuccessor(bb0, Successor.goTo(bb1))
                .addStatement(bb1, new Statement.Assign(k.place(), read(place(x, "x"))))
                .setSuccessor(bb1, Successor.goTo(bb2))
                .addStatement(bb2, new Statement.Assign(k.place(), read(place(x, "y"))));
        if (crash) {
            builder.addStatement(bb2, new Statement.Assign(k.place(), read(r.place())));
        }
        builder.setSuccessor(bb2, Successor.goTo(bb3))
                .setSuccessor(bb3, Successor.RETURN);
        return builder.build();
    }

    private static ShapeInference shapeInference(boolean graphvizOnCrash, RecordingReportSink sink) {
        ShapeInference.Configuration configuration = new ShapeInferenceImpl.ConfigurationBuilder()
                .setGraphvizOnCrash(graphvizOnCrash)
                .setSourceFileName("crash.rs")
                .build();
        return new ShapeInferenceImpl(TYPES, configuration, sink);
    }

    private static int count(String s, String sub) {
        int count = 0;
        int index = s.indexOf(sub);
        while (index >= 0) {
            count++;
            index = s.indexOf(sub, index + sub.length());
        }
        return count;
    }

    @DisplayName("active block in red, processed blocks in green")
    @Test
    public void test1() {
        RecordingReportSink sink = new RecordingReportSink();
        InferenceException e = assertThrows(InferenceException.class,
                () -> shapeInference(true, sink).infer(crashing(true)));
        assertEquals("bb2", e.getBlockLabel());

        assertEquals(1, sink.reports.size());
        String dot = sink.reports.get(REPORT);
        assertNotNull(dot);
        assertEquals(1, count(dot, "bgcolor=\"red\""));
        assertEquals(2, count(dot, "bgcolor=\"green\""));
        assertTrue(dot.contains("\"node_bb2\"" + TABLE + " bgcolor=\"red\">"), dot);
        assertTrue(dot.contains("\"node_bb0\"" + TABLE + " bgcolor=\"green\">"), dot);
        assertTrue(dot.contains("\"node_bb1\"" + TABLE + " bgcolor=\"green\">"), dot);
        assertTrue(dot.contains("\"node_bb3\"" + TABLE + "><tr>"), dot);

        assertTrue(dot.contains("<td align=\"left\"><font color=\"orange\">// start</font></td>"), dot);
        assertTrue(dot.contains("<td align=\"left\">unfold acc(x, 1)</td></tr>"), dot);
        assertTrue(dot.contains("<td align=\"left\">k = x.y</td></tr><tr><td align=\"left\">k = r</td></tr>"
                                + "<tr><td align=\"left\"><font color=\"red\">k = x.y</font></td></tr></table>"), dot);
        assertTrue(dot.contains("\"node_bb2\" -> \"node_bb3\";"), dot);
        assertTrue(dot.contains("\"node_bb3\" -> \"exit_bb3\" [label=\"return\"];"), dot);
    }

    @Test
    public void test2() {
        RecordingReportSink sink = new RecordingReportSink();
        assertThrows(InferenceException.class, () -> shapeInference(false, sink).infer(crashing(true)));
        assertTrue(sink.reports.isEmpty());
    }

    @Test
    public void test3() {
        RecordingReportSink sink = new RecordingReportSink();
        shapeInference(true, sink).infer(crashing(false));
        assertTrue(sink.reports.isEmpty());
    }

    @DisplayName("a block made active again shows no statements of the previously active block")
    @Test
    public void test4() {
        TraversalContext context = new TraversalContext(crashing(false));
        context.enter(new BasicBlockId(0), null);
        context.addStatement(new Statement.Comment("in progress"));
        context.reconcile(new BasicBlockId(1));
        assertTrue(context.currentStatements().isEmpty());

        RecordingReportSink sink = new RecordingReportSink();
        new CrashReport(context, sink, "crash.rs", true).close();
        String dot = sink.reports.get(REPORT);
        assertNotNull(dot);
        assertTrue(dot.contains("\"node_bb1\"" + TABLE + " bgcolor=\"red\">"), dot);
        assertFalse(dot.contains("in progress"), dot);
        assertFalse(dot.contains("<font color=\"red\">"), dot);
    }
}
