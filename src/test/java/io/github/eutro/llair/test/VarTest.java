package io.github.eutro.llair.test;

import io.github.eutro.llair.exp.Var;
import io.github.eutro.llair.exp.VarSet;
import io.github.eutro.llair.util.Pair;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class VarTest {
    @Test
    void programVarsAreStable() {
        Var a = Var.program("stable");
        Var b = Var.program("stable");
        assertSame(a, b);
        assertEquals("stable", a.name());
        assertNotEquals(a, Var.program("stable2"));
    }

    @Test
    void freshVarsAvoidWrt() {
        Var p = Var.program("p");
        VarSet wrt = VarSet.of(p);
        Set<Integer> ids = new HashSet<>();
        ids.add(p.id());
        for (int i = 0; i < 100; i++) {
            Pair<Var, VarSet> fresh = Var.fresh("t", wrt);
            assertFalse(wrt.contains(fresh.left));
            assertTrue(fresh.right.contains(fresh.left));
            assertTrue(fresh.left.id() > wrt.maxId());
            assertTrue(ids.add(fresh.left.id()), "id reused: " + fresh.left.id());
            wrt = fresh.right;
        }
        assertEquals(101, wrt.size());
    }

    @Test
    void freshVarsWithSameNameDiffer() {
        Var a = Var.fresh("same", VarSet.empty()).left;
        Var b = Var.fresh("same", VarSet.empty()).left;
        assertNotEquals(a, b);
        assertEquals(a.name(), b.name());
        assertNotEquals(a.sexp(), b.sexp());
    }

    @Test
    void display() {
        Var var = Var.fresh("llvm.memcpy.p0i8", VarSet.empty()).left;
        assertEquals("%llvm.memcpy.p0i8_" + var.id(), var.toString());
        assertEquals("llvm", var.demangledName());

        Var method = Var.fresh("std::vector::push_back(int)", VarSet.empty()).left;
        assertEquals("push_back", method.demangledName());
        assertEquals("%push_back_" + method.id(), method.toDemangledString());

        Var plain = Var.fresh("x", VarSet.empty()).left;
        assertEquals("x", plain.demangledName());
        plain.invariant();
    }

    @Test
    void varSets() {
        Var a = Var.fresh("a", VarSet.empty()).left;
        Var b = Var.fresh("b", VarSet.empty()).left;
        Var c = Var.fresh("c", VarSet.empty()).left;
        VarSet ab = VarSet.of(a, b);
        VarSet bc = VarSet.of(b, c);

        assertEquals(VarSet.of(a, b, c), ab.union(bc));
        assertEquals(VarSet.of(a), ab.diff(bc));
        assertEquals(VarSet.of(b), ab.inter(bc));
        assertFalse(ab.isDisjoint(bc));
        assertTrue(VarSet.of(a).isDisjoint(VarSet.of(c)));
        assertTrue(VarSet.empty().isDisjoint(ab));
        assertSame(ab, ab.add(a));
        assertEquals(0, VarSet.empty().maxId());
        assertEquals(c.id(), ab.union(bc).maxId());
        assertEquals(VarSet.of(b, a), ab);
        assertEquals(VarSet.of(b, a).hashCode(), ab.hashCode());
        assertTrue(ab.compareTo(VarSet.of(a)) > 0);
        assertTrue(VarSet.of(a).compareTo(VarSet.of(b)) < 0);
        assertEquals(0, ab.compareTo(VarSet.of(b, a)));
        assertEquals("{" + a + ", " + b + "}", ab.toString());
    }
}
