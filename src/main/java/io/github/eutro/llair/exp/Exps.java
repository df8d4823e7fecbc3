package io.github.eutro.llair.exp;

import io.github.eutro.llair.typ.Typ;
import io.github.eutro.llair.util.Pair;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Constructors for {@link Exp}s.
 * <p>
 * These are the only way to build expressions. Each constructor fixes the arity of its
 * operator, and builds the curried chain of {@link App}s for it.
 */
public final class Exps {
    /**
     * Whether to run the {@link Invariants invariant checker} on every expression constructed.
     */
    public static boolean CHECK_INVARIANTS = System.getenv("LLAIR_CHECK_INVARIANTS") != null;

    public static final Exp NULL = Op.NULL;
    public static final Exp TRUE = new IntLit(BigInteger.ONE);
    public static final Exp FALSE = new IntLit(BigInteger.ZERO);

    private Exps() {
    }

    static Exp app1(Exp op, Exp arg) {
        Exp app = new App(Objects.requireNonNull(op), Objects.requireNonNull(arg));
        if (CHECK_INVARIANTS) Invariants.check(app, true);
        return app;
    }

    private static Exp app(Exp op, Exp... args) {
        Exp e = op;
        for (Exp arg : args) {
            e = app1(e, arg);
        }
        return e;
    }

    /**
     * Split an expression into the head of its application spine and the arguments it
     * is applied to, outermost last.
     * <p>
     * An expression that is not an {@link App} is its own head, with no arguments.
     *
     * @param exp The expression.
     * @return The head and the arguments.
     */
    public static Pair<Exp, List<Exp>> uncurry(Exp exp) {
        List<Exp> args = new ArrayList<>();
        Exp head = exp;
        while (head instanceof App) {
            App app = (App) head;
            args.add(app.arg());
            head = app.op();
        }
        Collections.reverse(args);
        return Pair.of(head, args);
    }

    // leaves

    public static Exp var(Var var) {
        return Objects.requireNonNull(var);
    }

    public static Exp nondet(String msg) {
        return new Nondet(Objects.requireNonNull(msg));
    }

    public static Exp label(String parent, String name) {
        return new Label(Objects.requireNonNull(parent), Objects.requireNonNull(name));
    }

    public static Exp bool(boolean b) {
        return b ? TRUE : FALSE;
    }

    public static Exp integer(BigInteger data) {
        return new IntLit(Objects.requireNonNull(data));
    }

    public static Exp integer(long data) {
        return integer(BigInteger.valueOf(data));
    }

    /**
     * Construct a floating-point constant from its source text, which is kept verbatim.
     *
     * @param data The text of the constant.
     * @return The constant.
     */
    public static Exp floating(String data) {
        return new FloatLit(Objects.requireNonNull(data));
    }

    // memory

    public static Exp splat(Exp byt, Exp siz) {
        return app(Op.SPLAT, byt, siz);
    }

    public static Exp memory(Exp siz, Exp arr) {
        return app(Op.MEMORY, siz, arr);
    }

    public static Exp concat(Exp x, Exp y) {
        return app(Op.CONCAT, x, y);
    }

    // comparisons

    public static Exp eq(Exp x, Exp y) {
        return app(Op.EQ, x, y);
    }

    public static Exp dq(Exp x, Exp y) {
        return app(Op.DQ, x, y);
    }

    public static Exp gt(Exp x, Exp y) {
        return app(Op.GT, x, y);
    }

    public static Exp ge(Exp x, Exp y) {
        return app(Op.GE, x, y);
    }

    public static Exp lt(Exp x, Exp y) {
        return app(Op.LT, x, y);
    }

    public static Exp le(Exp x, Exp y) {
        return app(Op.LE, x, y);
    }

    public static Exp ugt(Exp x, Exp y) {
        return app(Op.UGT, x, y);
    }

    public static Exp uge(Exp x, Exp y) {
        return app(Op.UGE, x, y);
    }

    public static Exp ult(Exp x, Exp y) {
        return app(Op.ULT, x, y);
    }

    public static Exp ule(Exp x, Exp y) {
        return app(Op.ULE, x, y);
    }

    public static Exp ord(Exp x, Exp y) {
        return app(Op.ORD, x, y);
    }

    public static Exp uno(Exp x, Exp y) {
        return app(Op.UNO, x, y);
    }

    // arithmetic

    public static Exp add(Exp x, Exp y) {
        return app(Op.ADD, x, y);
    }

    public static Exp sub(Exp x, Exp y) {
        return app(Op.SUB, x, y);
    }

    public static Exp mul(Exp x, Exp y) {
        return app(Op.MUL, x, y);
    }

    public static Exp div(Exp x, Exp y) {
        return app(Op.DIV, x, y);
    }

    public static Exp udiv(Exp x, Exp y) {
        return app(Op.UDIV, x, y);
    }

    public static Exp rem(Exp x, Exp y) {
        return app(Op.REM, x, y);
    }

    public static Exp urem(Exp x, Exp y) {
        return app(Op.UREM, x, y);
    }

    // boolean / bitwise

    public static Exp and(Exp x, Exp y) {
        return app(Op.AND, x, y);
    }

    public static Exp or(Exp x, Exp y) {
        return app(Op.OR, x, y);
    }

    public static Exp xor(Exp x, Exp y) {
        return app(Op.XOR, x, y);
    }

    public static Exp shl(Exp x, Exp y) {
        return app(Op.SHL, x, y);
    }

    public static Exp lshr(Exp x, Exp y) {
        return app(Op.LSHR, x, y);
    }

    public static Exp ashr(Exp x, Exp y) {
        return app(Op.ASHR, x, y);
    }

    // if-then-else

    public static Exp conditional(Exp cnd, Exp thn, Exp els) {
        return app(Op.CONDITIONAL, cnd, thn, els);
    }

    // records

    public static Exp record(List<Exp> elts) {
        Exp e = Op.RECORD;
        for (Exp elt : elts) {
            e = app1(e, elt);
        }
        return e;
    }

    public static Exp record(Exp... elts) {
        return record(Arrays.asList(elts));
    }

    public static Exp select(Exp rcd, Exp idx) {
        return app(Op.SELECT, rcd, idx);
    }

    public static Exp update(Exp rcd, Exp elt, Exp idx) {
        return app(Op.UPDATE, rcd, elt, idx);
    }

    /**
     * Create a builder for one possibly-cyclic struct value.
     * <p>
     * See {@link StructRecBuilder} for the obligations on its use.
     *
     * @param <K> The type of the ids identifying points on cycles.
     * @return The builder.
     */
    public static <K> StructRecBuilder<K> structRec() {
        return new StructRecBuilder<>();
    }

    // type conversion

    public static Exp convert(boolean signed, Typ dst, Typ src, Exp arg) {
        return app1(new Convert(signed, Objects.requireNonNull(dst), Objects.requireNonNull(src)), arg);
    }

    public static Exp convert(Typ dst, Typ src, Exp arg) {
        return convert(false, dst, src, arg);
    }
}
