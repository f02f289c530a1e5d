package org.e2immu.analyzer.shape.inference.impl;

import org.e2immu.analyzer.shape.cfg.Successor;
import org.e2immu.analyzer.shape.cfg.BasicBlockId;
import org.e2immu.analyzer.shape.cfg.place.Amount;
import org.e2immu.analyzer.shape.cfg.place.Variable;
import org.e2immu.analyzer.shape.cfg.statement.BinaryOperator;
import org.e2immu.analyzer.shape.cfg.statement.Expression;
import org.e2immu.analyzer.shape.cfg.statement.Statement;
import org.e2immu.analyzer.shape.cfg.type.Type;
import org.e2immu.analyzer.shape.inference.CommonTest;
import org.e2immu.analyzer.shape.inference.state.PermissionState;
import org.e2immu.analyzer.shape.inference.state.UnsatisfiablePermissionException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestSemantics extends CommonTest {
    private final Semantics semantics = new Semantics(TYPES);
    private final Variable p = new Variable("p", POINT);
    private final Variable q = new Variable("q", Type.INT);
    private final Variable r = new Variable("r", Type.INT);
    private final Variable b = new Variable("b", POINT);

    @Test
    public void test1() {
        Statement assign = new Statement.Assign(r.place(), new Expression.BinaryOperation(BinaryOperator.ADD,
                read(place(p, "x")), new Expression.Move(q.place())));
        assertEquals("r = p.x + move q", assign.toString());
        assertEquals("[owned(p.x, _), owned(q, 1), memory_block(r)]", semantics.requirements(assign).toString());

        Statement twice = new Statement.Assert(new Expression.BinaryOperation(BinaryOperator.EQ, read(q.place()),
                read(q.place())));
        assertEquals("[owned(q, _)]", semantics.requirements(twice).toString());
        assertEquals("[]", semantics.requirements(new Statement.Comment("nothing")).toString());
    }

    @Test
    public void test2() {
        assertEquals("[memory_block(b), owned(p, 1)]",
                semantics.requirements(new Statement.Borrow(b.place(), p.place(), true)).toString());
        assertEquals("[memory_block(b), owned(p, _)]",
                semantics.requirements(new Statement.Borrow(b.place(), p.place(), false)).toString());
        assertThrows(UnsatisfiablePermissionException.class,
                () -> semantics.requirements(new Statement.Borrow(place(b, "x"), q.place(), false)));
        assertThrows(UnsatisfiablePermissionException.class,
                () -> semantics.requirements(new Statement.Borrow(b.place(), q.place(), false)));
    }

    @Test
    public void test3() {
        assertEquals("[owned(p.x, 1), owned(p.y, 1)]",
                semantics.requirements(new Statement.Fold(p.place(), Amount.FULL)).toString());
        assertEquals("[owned(p, 1/2)]",
                semantics.requirements(new Statement.Unfold(p.place(), Amount.of(1, 2))).toString());
        assertEquals("[memory_block(b)]", semantics.requirements(new Statement.Unfold(b.place(), null)).toString());
        assertEquals("[]", semantics.requirements(new Statement.Restore(p.place())).toString());
        assertEquals("[memory_block(p)]", semantics.requirements(new Statement.IntoMemoryBlock(p.place())).toString());
    }

    @Test
    public void test4() {
        Variable c = new Variable("c", Type.BOOL);
        Successor successor = Successor.goToIf(read(c.place()), new BasicBlockId(1), new BasicBlockId(2));
        assertEquals("[owned(c, _)]", semantics.requirements(successor).toString());
        assertEquals("[]", semantics.requirements(Successor.RETURN).toString());
    }

    @Test
    public void test5() {
        PermissionState state = PermissionState.initial(TYPES, List.of(p, q), List.of(r), List.of(b));
        semantics.apply(state, new Statement.Assign(r.place(), new Expression.Move(q.place())));
        assertEquals("owned={p=1, r=1}, unfolded=[], memoryBlocks=[b, q], loans={}", state.toString());

        semantics.apply(state, new Statement.Borrow(b.place(), p.place(), true));
        assertEquals("owned={b=1, r=1}, unfolded=[], memoryBlocks=[q], loans={b=&mut p}", state.toString());

        Statement call = new Statement.Call(q.place(), "length", List.of(read(b.place())));
        semantics.checkAll(state, call, semantics.requirements(call));
        semantics.apply(state, call);
        assertEquals("owned={b=1, q=1, r=1}, unfolded=[], memoryBlocks=[], loans={b=&mut p}", state.toString());

        semantics.apply(state, new Statement.Restore(p.place()));
        assertEquals("owned={p=1, q=1, r=1}, unfolded=[], memoryBlocks=[b], loans={}", state.toString());

        Statement assertB = new Statement.Assert(read(b.place()));
        assertThrows(UnsatisfiablePermissionException.class,
                () -> semantics.checkAll(state, assertB, semantics.requirements(assertB)));
    }
}
