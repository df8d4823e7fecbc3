package io.github.eutro.llair.exp;

import io.github.eutro.llair.util.Pair;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * The application of a function symbol to an argument.
 * <p>
 * An operator of arity {@code n} applied to its arguments is {@code n} nested
 * applications, with the operator innermost: {@code a + b} is {@code App(App(Add, a), b)}.
 */
public final class App extends Exp {
    private final Exp op;
    private final Exp arg;
    // there are a lot of these, and equality checks on deep spines want it fast
    private final int hash;

    App(Exp op, Exp arg) {
        this.op = op;
        this.arg = arg;
        this.hash = 31 * (31 * Kind.APP.ordinal() + op.hashCode()) + arg.hashCode();
    }

    public Exp op() {
        return op;
    }

    public Exp arg() {
        return arg;
    }

    @Override
    public Kind kind() {
        return Kind.APP;
    }

    // spines are as long as a record is wide, so they are walked with a loop
    @Override
    int compareSame(Exp o) {
        Deque<Exp> xs = new ArrayDeque<>();
        Deque<Exp> ys = new ArrayDeque<>();
        Exp x = this;
        Exp y = o;
        while (x != y && x instanceof App && y instanceof App) {
            App ax = (App) x;
            App ay = (App) y;
            xs.push(ax.arg);
            ys.push(ay.arg);
            x = ax.op;
            y = ay.op;
        }
        int c = x.compareTo(y);
        while (c == 0 && !xs.isEmpty()) {
            c = xs.pop().compareTo(ys.pop());
        }
        return c;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    void appendSexp(StringBuilder sb) {
        Pair<Exp, List<Exp>> uncurried = Exps.uncurry(this);
        for (int i = 0; i < uncurried.right.size(); i++) {
            sb.append("(App ");
        }
        uncurried.left.appendSexp(sb);
        for (Exp arg : uncurried.right) {
            sb.append(' ');
            arg.appendSexp(sb);
            sb.append(')');
        }
    }
}
