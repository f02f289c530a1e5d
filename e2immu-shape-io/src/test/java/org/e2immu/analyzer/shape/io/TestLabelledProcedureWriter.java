package org.e2immu.analyzer.shape.io;

import org.e2immu.analyzer.shape.cfg.BasicBlockId;
import org.e2immu.analyzer.shape.cfg.Procedure;
import org.e2immu.analyzer.shape.cfg.ProcedureBuilder;
import org.e2immu.analyzer.shape.cfg.Successor;
import org.e2immu.analyzer.shape.cfg.place.Amount;
import org.e2immu.analyzer.shape.cfg.place.Place;
import org.e2immu.analyzer.shape.cfg.place.Variable;
import org.e2immu.analyzer.shape.cfg.statement.Expression;
import org.e2immu.analyzer.shape.cfg.statement.Statement;
import org.e2immu.analyzer.shape.cfg.type.Field;
import org.e2immu.analyzer.shape.cfg.type.Type;
import org.e2immu.analyzer.shape.cfg.type.TypeDeclarations;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class TestLabelledProcedureWriter {
    private final Type point = new Type.Struct("Point");
    private final TypeDeclarations typeDeclarations = new TypeDeclarations.Builder()
            .addStruct("Point", new Field("x", Type.INT), new Field("y", Type.INT))
            .build();

    @Test
    public void test1() {
        ProcedureBuilder builder = new ProcedureBuilder("choose");
        Variable x = builder.addParameter("x", point);
        Variable c = builder.addParameter("c", Type.BOOL);
        Variable r = builder.addReturn("r", Type.INT);
        builder.addLocal("k", Type.INT);
        BasicBlockId bb0 = builder.newBlock();
        BasicBlockId bb1 = builder.newBlock();
        BasicBlockId bb2 = builder.newBlock();
        Place xx = x.place().field("x", typeDeclarations);
        builder.setSuccessor(bb0, Successor.goToIf(new Expression.Read(c.place()), bb1, bb2))
                .addStatement(bb1, new Statement.Unfold(x.place(), Amount.FULL))
                .addStatement(bb1, new Statement.Assign(r.place(), new Expression.Read(xx)))
                .addStatement(bb1, new Statement.Fold(x.place(), Amount.FULL))
                .setSuccessor(bb1, Successor.RETURN)
                .addStatement(bb2, new Statement.Assign(r.place(), Expression.Constant.of(0)))
                .setSuccessor(bb2, Successor.RETURN);
        Procedure procedure = builder.build();

        assertEquals("""
                method choose(x: Point, c: Bool) returns (r: Int)
                {
                  var k: Int
                  label __viper_choose_0
                  if (c) { goto __viper_choose_1 }
                  if (true) { goto __viper_choose_2 }
                  assert false
                  label __viper_choose_1
                  unfold acc(x, 1)
                  r = x.x
                  fold acc(x, 1)
                  goto __viper_choose_return
                  label __viper_choose_2
                  r = 0
                  goto __viper_choose_return
                  label __viper_choose_return
                }
                """, new LabelledProcedureWriter().write(procedure));
    }

    @Test
    public void test2() {
        ProcedureBuilder builder = new ProcedureBuilder("later");
        BasicBlockId bb0 = builder.newBlock();
        BasicBlockId bb1 = builder.newBlock();
        builder.setSuccessor(bb0, Successor.RETURN)
                .setSuccessor(bb1, Successor.goTo(bb0))
                .setEntry(bb1);
        assertEquals("""
                method later() returns ()
                {
                  goto __viper_later_1
                  label __viper_later_0
                  goto __viper_later_return
                  label __viper_later_1
                  goto __viper_later_0
                  label __viper_later_return
                }
                """, new LabelledProcedureWriter().write(builder.build()));
    }
}
