package io.github.eutro.llair.test;

import io.github.eutro.llair.exp.*;
import io.github.eutro.llair.util.GraphWalker;
import io.github.eutro.llair.util.Pair;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StructRecTest {
    static Exp selfCycle() {
        StructRecBuilder<String> builder = Exps.structRec();
        return builder.build("self", () -> builder.build("self"));
    }

    @Test
    void selfCycleCloses() {
        StructRec self = assertInstanceOf(StructRec.class, selfCycle());
        assertEquals(1, self.size());
        assertSame(self, self.elt(0));
        assertTrue(self.isForced(0));
        Invariants.check(self);
    }

    @Test
    void foldsTerminateOnCycles() {
        Exp self = selfCycle();
        assertEquals(1, (int) ExpFolds.fold(self, 0, (n, sub) -> n + 1));
        assertEquals(1, (int) ExpFolds.foldExps(self, 0, (n, sub) -> n + 1));
        assertTrue(ExpFolds.isConstant(self));
        assertTrue(ExpFolds.fv(self).isEmpty());
        assertEquals(GraphWalker.expWalker(self).preOrder().toList(),
                GraphWalker.expWalker(self).postOrder().toList());
    }

    @Test
    void mutualRecursion() {
        StructRecBuilder<String> builder = Exps.structRec();
        StructRec a = (StructRec) builder.build("a",
                () -> Exps.integer(1),
                () -> builder.build("b", () -> builder.build("a")));
        StructRec b = assertInstanceOf(StructRec.class, a.elt(1));
        assertSame(a, b.elt(0));
        assertNotEquals(a, b);
        // a, b and the literal
        assertEquals(3, (int) ExpFolds.foldExps(a, 0, (n, sub) -> n + 1));
        Invariants.check(a);
    }

    @Test
    void structsHaveIdentityEquality() {
        StructRecBuilder<String> builder = Exps.structRec();
        Exp first = builder.build("first", () -> Exps.integer(1));
        Exp second = builder.build("second", () -> Exps.integer(1));
        assertNotEquals(first, second);
        assertNotEquals(first.sexp(), second.sexp());
        assertNotEquals(0, first.compareTo(second));
        assertEquals(first, first);
        assertSame(first, builder.build("first"));
    }

    @Test
    void freeVarsOfCycles() {
        Var x = Var.fresh("x", VarSet.empty()).left;
        StructRecBuilder<String> builder = Exps.structRec();
        Exp s = builder.build("s", () -> Exps.var(x), () -> builder.build("s"));
        assertEquals(VarSet.of(x), ExpFolds.fv(s));
        assertFalse(ExpFolds.isConstant(s));
        assertFalse(ExpFolds.isConstant(Exps.record(s)));
    }

    @Test
    void renamePreservesCycles() {
        Var x = Var.fresh("x", VarSet.empty()).left;
        Var y = Var.fresh("y", VarSet.empty()).left;
        StructRecBuilder<String> builder = Exps.structRec();
        Exp s = builder.build("s", () -> Exps.var(x), () -> builder.build("s"));

        StructRec renamed = assertInstanceOf(StructRec.class, ExpFolds.rename(s, Subst.empty().extend(x, y)));
        assertNotSame(s, renamed);
        assertSame(y, renamed.elt(0));
        assertSame(renamed, renamed.elt(1));
        assertEquals(VarSet.of(y), ExpFolds.fv(renamed));
        Invariants.check(renamed);

        Var z = Var.fresh("z", VarSet.empty()).left;
        assertSame(s, ExpFolds.rename(s, Subst.empty().extend(z, y)));
    }

    @Test
    void renameSkipsUnaffectedStructs() {
        Var x = Var.fresh("x", VarSet.empty()).left;
        Var y = Var.fresh("y", VarSet.empty()).left;
        Exp self = selfCycle();
        Exp e = Exps.record(self, Exps.var(x));
        List<Exp> args = Exps.uncurry(ExpFolds.rename(e, Subst.empty().extend(x, y))).right;
        assertSame(self, args.get(0));
        assertSame(y, args.get(1));
    }

    @Test
    void printingTerminates() {
        StructRec self = (StructRec) selfCycle();
        assertEquals("#" + self.serial() + "{|#" + self.serial() + "|}", self.toString());
    }

    @Test
    void unfinishedStructsAreOnlyPartiallyValid() {
        StructRecBuilder<String> builder = Exps.structRec();
        Exp done = builder.build("p", () -> {
            Exp underConstruction = builder.build("p");
            assertThrows(IllegalStateException.class, () -> Invariants.check(underConstruction));
            Invariants.check(underConstruction, true);
            assertTrue(underConstruction.toString().contains("<lazy>"));
            return Exps.integer(1);
        });
        Invariants.check(done);
        assertFalse(done.toString().contains("<lazy>"));
    }

    private static Exp chain(StructRecBuilder<Integer> builder, int i, int end) {
        if (i == end) return Exps.integer(i);
        return builder.build(i, () -> chain(builder, i + 1, end));
    }

    @Test
    void depthIsBounded() {
        int maxDepth = StructRecBuilder.MAX_DEPTH;
        StructRecBuilder.MAX_DEPTH = 8;
        try {
            StructRec ok = assertInstanceOf(StructRec.class, chain(Exps.structRec(), 0, 8));
            assertEquals(9, (int) ExpFolds.foldExps(ok, 0, (n, sub) -> n + 1));
            assertThrows(IllegalStateException.class, () -> chain(Exps.structRec(), 0, 100));
        } finally {
            StructRecBuilder.MAX_DEPTH = maxDepth;
        }
    }

    @Test
    void identityMapKeepsCycles() {
        Exp self = selfCycle();
        assertSame(self, ExpFolds.map(self, sub -> sub));

        StructRecBuilder<String> mutual = Exps.structRec();
        Exp a = mutual.build("a",
                () -> Exps.integer(1),
                () -> mutual.build("b", () -> mutual.build("a")));
        assertSame(a, ExpFolds.map(a, sub -> sub));
        Exp outer = Exps.record(a, Exps.var(Var.fresh("v", VarSet.empty()).left));
        assertSame(outer, ExpFolds.map(outer, sub -> sub));

        StructRecBuilder<String> throughApp = Exps.structRec();
        Exp s = throughApp.build("s", () -> Exps.add(throughApp.build("s"), Exps.integer(1)));
        assertSame(s, ExpFolds.map(s, sub -> sub));
        assertSame(s, ExpFolds.foldMap(s, 0, (n, sub) -> Pair.of(n + 1, sub)).right);
    }

    @Test
    void identityMapKeepsNestedCycles() {
        // an unchanged cycle inside a struct whose own elements change
        Var x = Var.fresh("x", VarSet.empty()).left;
        Var y = Var.fresh("y", VarSet.empty()).left;
        Exp inner = selfCycle();
        StructRecBuilder<String> builder = Exps.structRec();
        Exp s = builder.build("s", () -> inner, () -> Exps.var(x), () -> builder.build("s"));
        StructRec mapped = assertInstanceOf(StructRec.class,
                ExpFolds.map(s, sub -> sub == x ? y : sub));
        assertNotSame(s, mapped);
        assertSame(inner, mapped.elt(0));
        assertSame(y, mapped.elt(1));
        assertSame(mapped, mapped.elt(2));
    }

    @Test
    void mapRebuildsChangedCycles() {
        Var x = Var.fresh("x", VarSet.empty()).left;
        Var y = Var.fresh("y", VarSet.empty()).left;
        StructRecBuilder<String> builder = Exps.structRec();
        Exp s = builder.build("s", () -> Exps.add(builder.build("s"), Exps.var(x)));

        StructRec mapped = assertInstanceOf(StructRec.class, ExpFolds.map(s, sub -> sub == x ? y : sub));
        assertNotSame(s, mapped);
        List<Exp> args = Exps.uncurry(mapped.elt(0)).right;
        assertSame(mapped, args.get(0));
        assertSame(y, args.get(1));
        Invariants.check(mapped);

        StructRecBuilder<String> mutual = Exps.structRec();
        StructRec a = (StructRec) mutual.build("a",
                () -> Exps.var(x),
                () -> mutual.build("b", () -> mutual.build("a")));
        StructRec mappedA = assertInstanceOf(StructRec.class, ExpFolds.map(a, sub -> sub == x ? y : sub));
        StructRec mappedB = assertInstanceOf(StructRec.class, mappedA.elt(1));
        assertNotSame(a, mappedA);
        assertNotSame(a.elt(1), mappedB);
        assertSame(mappedA, mappedB.elt(0));
        assertSame(y, mappedA.elt(0));
    }
}
