package org.e2immu.analyzer.shape.inference.state;

import org.e2immu.analyzer.shape.cfg.place.Amount;
import org.e2immu.analyzer.shape.cfg.place.Variable;
import org.e2immu.analyzer.shape.cfg.type.Type;
import org.e2immu.analyzer.shape.inference.CommonTest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestMerge extends CommonTest {
    private final Variable p = new Variable("p", POINT);
    private final Variable b = new Variable("b", POINT);
    private final Variable r = new Variable("r", Type.INT);

    private PermissionState initial() {
        return PermissionState.initial(TYPES, List.of(p), List.of(r), List.of(b));
    }

    @Test
    public void test1() {
        PermissionState state = initial();
        state.obtain(place(p, "x"), Amount.ANY);
        MergeResult mergeResult = state.merge(state.copy(), "bb1");
        assertEquals(state, mergeResult.state());
        assertTrue(mergeResult.leftActions().isEmpty());
        assertTrue(mergeResult.rightActions().isEmpty());
    }

    @Test
    public void test2() {
        PermissionState folded = initial();
        PermissionState unfolded = initial();
        unfolded.obtain(place(p, "y"), Amount.ANY);

        MergeResult mergeResult = folded.merge(unfolded, "bb3");
        assertEquals(folded, mergeResult.state());
        assertEquals("[]", mergeResult.leftActions().toString());
        assertEquals("[Fold(p)]", mergeResult.rightActions().toString());

        MergeResult swapped = unfolded.merge(folded, "bb3");
        assertEquals(mergeResult.state(), swapped.state());
        assertEquals("[Fold(p)]", swapped.leftActions().toString());
        assertEquals("[]", swapped.rightActions().toString());

        // the inputs are not modified
        assertEquals("owned={p.x=1, p.y=1}, unfolded=[p], memoryBlocks=[b, r], loans={}", unfolded.toString());
    }

    @Test
    public void test3() {
        PermissionState owned = initial();
        PermissionState moved = initial();
        moved.move(p.place());

        MergeResult mergeResult = owned.merge(moved, "bb2");
        assertEquals("[IntoMemoryBlock(p)]", mergeResult.leftActions().toString());
        assertEquals("[]", mergeResult.rightActions().toString());
        assertEquals(moved, mergeResult.state());
    }

    @Test
    public void test4() {
        PermissionState owned = initial();
        PermissionState partlyMoved = initial();
        partlyMoved.obtain(place(p, "x"), Amount.FULL);
        partlyMoved.move(place(p, "x"));
        assertEquals("owned={p.y=1}, unfolded=[p], memoryBlocks=[b, p.x, r], loans={}", partlyMoved.toString());

        MergeResult mergeResult = owned.merge(partlyMoved, "bb4");
        assertEquals("[IntoMemoryBlock(p)]", mergeResult.leftActions().toString());
        assertEquals("[IntoMemoryBlock(p)]", mergeResult.rightActions().toString());
        assertEquals("owned={}, unfolded=[], memoryBlocks=[b, p, r], loans={}", mergeResult.state().toString());
    }

    @Test
    public void test5() {
        PermissionState borrowed = initial();
        borrowed.borrow(b.place(), p.place(), false);
        PermissionState plain = initial();

        MergeResult mergeResult = borrowed.merge(plain, "bb7");
        assertEquals("[Restore(p)]", mergeResult.leftActions().toString());
        assertEquals("[]", mergeResult.rightActions().toString());
        assertEquals(plain, mergeResult.state());

        MergeResult both = borrowed.merge(borrowed.copy(), "bb7");
        assertEquals(borrowed, both.state());
        assertTrue(both.leftActions().isEmpty());
    }

    @Test
    public void test6() {
        PermissionState state = initial();
        PermissionState other = PermissionState.initial(TYPES, List.of(p), List.of(r));
        assertThrows(UnsatisfiablePermissionException.class, () -> state.merge(other, "bb0"));
    }

    @Test
    public void test7() {
        PermissionState unfolded = initial();
        unfolded.borrow(b.place(), p.place(), false);
        unfolded.obtain(place(p, "x"), Amount.ANY);
        PermissionState folded = initial();
        folded.borrow(b.place(), p.place(), false);

        MergeResult mergeResult = unfolded.merge(folded, "bb2");
        assertEquals("[Fold(p)]", mergeResult.leftActions().toString());
        assertEquals("[]", mergeResult.rightActions().toString());
        assertEquals(folded, mergeResult.state());
        assertEquals("owned={b=1/2, p=1/2}, unfolded=[], memoryBlocks=[r], loans={b=&p:1/2}",
                mergeResult.state().toString());
    }
}
