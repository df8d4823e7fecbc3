package io.github.eutro.llair.test;

import io.github.eutro.llair.exp.*;
import io.github.eutro.llair.util.Pair;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DeepExpTest {
    static final int WIDTH = 20_000;

    final Var x = Var.fresh("x", VarSet.empty()).left;
    final Var y = Var.fresh("y", VarSet.empty()).left;

    static Exp wideRecord(int last) {
        List<Exp> elts = new ArrayList<>(WIDTH);
        for (int i = 0; i < WIDTH - 1; i++) {
            elts.add(Exps.integer(i));
        }
        elts.add(Exps.integer(last));
        return Exps.record(elts);
    }

    static Exp wideRecordOf(Exp elt) {
        List<Exp> elts = new ArrayList<>(WIDTH);
        for (int i = 0; i < WIDTH; i++) {
            elts.add(elt);
        }
        return Exps.record(elts);
    }

    @Test
    void wideRecordsCompare() {
        Exp a = wideRecord(0);
        Exp b = wideRecord(0);
        Exp c = wideRecord(1);
        assertEquals(a, b);
        assertEquals(0, a.compareTo(b));
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
        assertTrue(a.compareTo(c) < 0);
        assertTrue(c.compareTo(a) > 0);
        assertEquals(a.sexp(), b.sexp());
        assertEquals(a.toString(), b.toString());
        Invariants.check(a);
    }

    @Test
    void wideRecordsRename() {
        Exp e = wideRecordOf(Exps.var(x));
        Exp renamed = ExpFolds.rename(e, Subst.empty().extend(x, y));
        assertEquals(wideRecordOf(Exps.var(y)), renamed);
        assertEquals(VarSet.of(y), ExpFolds.fv(renamed));
        assertSame(e, ExpFolds.rename(e, Subst.empty().extend(y, x)));
    }

    @Test
    void wideRecordsMap() {
        Exp e = wideRecord(0);
        assertSame(e, ExpFolds.map(e, sub -> sub));
        int count = ExpFolds.foldMap(e, 0, (n, sub) -> Pair.of(n + 1, sub)).left;
        assertEquals((int) ExpFolds.foldExps(e, 0, (n, sub) -> n + 1), count);
        assertTrue(ExpFolds.isConstant(e));
    }
}
