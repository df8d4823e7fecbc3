package io.github.eutro.llair.exp;

import io.github.eutro.llair.exp.display.ExpPrinter;
import io.github.eutro.llair.util.Sexps;
import org.jetbrains.annotations.NotNull;

import java.util.Comparator;

/**
 * A pure (heap-independent) expression: an arithmetic, bitwise-logical, etc. operation
 * over literal values and registers.
 * <p>
 * Expressions are represented in curried form, where the only recursive constructor
 * is {@link App}, an application of a function symbol to a single argument. This makes
 * "subexpression" trivial to define, which helps when reasoning about equality between
 * expressions using congruence closure. The constructors in {@link Exps} check the arity
 * of each function symbol.
 * <p>
 * {@link StructRec} is also recursive, but its values are treated as atomic: they may be
 * cyclic, so they are compared, hashed and traversed by identity.
 * <p>
 * Expressions are immutable. {@link #equals(Object)}, {@link #hashCode()},
 * {@link #compareTo(Exp)} and {@link #sexp()} all agree with each other.
 */
public abstract class Exp implements Comparable<Exp> {
    /**
     * The total order on expressions.
     */
    public static final Comparator<Exp> COMPARATOR = Exp::compareTo;

    /**
     * The kinds of expression, in the order in which expressions of different kinds compare.
     */
    public enum Kind {
        VAR,
        NONDET,
        LABEL,
        APP,
        NULL,
        SPLAT,
        MEMORY,
        CONCAT,
        INTEGER,
        FLOAT,
        EQ,
        DQ,
        GT,
        GE,
        LT,
        LE,
        UGT,
        UGE,
        ULT,
        ULE,
        ORD,
        UNO,
        ADD,
        SUB,
        MUL,
        DIV,
        UDIV,
        REM,
        UREM,
        AND,
        OR,
        XOR,
        SHL,
        LSHR,
        ASHR,
        CONDITIONAL,
        RECORD,
        SELECT,
        UPDATE,
        STRUCT_REC,
        CONVERT,
    }

    Exp() {
    }

    public abstract Kind kind();

    @Override
    public int compareTo(@NotNull Exp o) {
        if (this == o) return 0;
        int c = kind().compareTo(o.kind());
        if (c != 0) return c;
        return compareSame(o);
    }

    // o has the same kind as this
    abstract int compareSame(Exp o);

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Exp)) return false;
        Exp o = (Exp) obj;
        return kind() == o.kind() && hashCode() == o.hashCode() && compareSame(o) == 0;
    }

    @Override
    public abstract int hashCode();

    /**
     * Get the canonical serialized form of this expression.
     * <p>
     * Two expressions have the same serialized form exactly when they are equal.
     *
     * @return The serialized form.
     */
    public String sexp() {
        StringBuilder sb = new StringBuilder();
        appendSexp(sb);
        return sb.toString();
    }

    abstract void appendSexp(StringBuilder sb);

    static void appendQuoted(StringBuilder sb, String s) {
        Sexps.appendQuoted(sb, s);
    }

    @Override
    public String toString() {
        return ExpPrinter.print(this);
    }
}
