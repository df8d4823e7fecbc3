package io.github.eutro.llair.exp;

import io.github.eutro.llair.util.GraphWalker;
import io.github.eutro.llair.util.Pair;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Folds, maps and queries over {@link Exp}s.
 * <p>
 * Everything here visits each physically distinct node at most once per call, so
 * shared subexpressions are not repeated and cyclic {@link StructRec}s terminate.
 * The identity tables this needs live only for the duration of one call.
 */
public final class ExpFolds {
    private ExpFolds() {
    }

    /**
     * Fold over the immediate subexpressions of {@code exp}: the operator then the argument
     * of an {@link App}, or the elements of a {@link StructRec}.
     *
     * @param exp  The expression.
     * @param init The initial accumulator.
     * @param f    The folding function.
     * @param <A>  The accumulator type.
     * @return The final accumulator.
     */
    public static <A> A fold(Exp exp, A init, BiFunction<A, Exp, A> f) {
        if (exp instanceof App) {
            App app = (App) exp;
            return f.apply(f.apply(init, app.op()), app.arg());
        } else if (exp instanceof StructRec) {
            A acc = init;
            for (Exp elt : ((StructRec) exp).elts()) {
                acc = f.apply(acc, elt);
            }
            return acc;
        }
        return init;
    }

    /**
     * Fold over every distinct subexpression of {@code exp}, including {@code exp} itself.
     * <p>
     * Subexpressions are visited before the expressions containing them, except where a
     * cycle makes that impossible; {@code exp} is visited last.
     *
     * @param exp  The expression.
     * @param init The initial accumulator.
     * @param f    The folding function.
     * @param <A>  The accumulator type.
     * @return The final accumulator.
     */
    public static <A> A foldExps(Exp exp, A init, BiFunction<A, Exp, A> f) {
        A acc = init;
        for (Exp sub : GraphWalker.expWalker(exp).postOrder()) {
            acc = f.apply(acc, sub);
        }
        return acc;
    }

    /**
     * Fold over every distinct variable occurring in {@code exp}.
     *
     * @param exp  The expression.
     * @param init The initial accumulator.
     * @param f    The folding function.
     * @param <A>  The accumulator type.
     * @return The final accumulator.
     */
    public static <A> A foldVars(Exp exp, A init, BiFunction<A, Var, A> f) {
        return foldExps(exp, init, (acc, sub) -> sub instanceof Var ? f.apply(acc, (Var) sub) : acc);
    }

    /**
     * Rebuild {@code exp} bottom-up while threading an accumulator.
     * <p>
     * Each distinct node is visited once: its children are rebuilt first, then the node
     * itself is rebuilt if any child changed, and finally {@code f} is given the accumulator
     * and the rebuilt node, returning the new accumulator and the replacement node. A node
     * whose children are unchanged is passed to {@code f} as itself, so a function that
     * returns its argument leaves the expression physically unchanged.
     * <p>
     * Struct values are rebuilt through a placeholder, so their cycles are preserved;
     * references to a struct from within its own cycle see the rebuilt struct,
     * not {@code f}'s replacement of it. A struct whose cycle contains no changed node is
     * returned as it is, along with every node on its cycles.
     *
     * @param exp  The expression.
     * @param init The initial accumulator.
     * @param f    The function giving the new accumulator and replacement of each node.
     * @param <A>  The accumulator type.
     * @return The final accumulator and the rebuilt expression.
     */
    public static <A> Pair<A, Exp> foldMap(Exp exp, A init, BiFunction<A, Exp, Pair<A, Exp>> f) {
        Rebuilder<A> rebuilder = new Rebuilder<>(init, f, null);
        Exp result = rebuilder.visit(exp);
        return Pair.of(rebuilder.acc, result);
    }

    /**
     * Rebuild {@code exp} bottom-up, replacing each node by the result of {@code f}.
     *
     * @param exp The expression.
     * @param f   The replacement function.
     * @return The rebuilt expression.
     * @see #foldMap(Exp, Object, BiFunction)
     */
    public static Exp map(Exp exp, UnaryOperator<Exp> f) {
        return foldMap(exp, null, (acc, sub) -> Pair.of(null, f.apply(sub))).right;
    }

    /**
     * Rename the free variables of {@code exp} according to {@code subst}.
     * <p>
     * Parts of {@code exp} with no variable in the domain of {@code subst} are returned as
     * they are, so if none of the free variables of {@code exp} are renamed, the result is
     * {@code exp} itself.
     *
     * @param exp   The expression.
     * @param subst The renaming.
     * @return The renamed expression.
     */
    public static Exp rename(Exp exp, Subst subst) {
        if (subst.isEmpty()) return exp;
        VarSet domain = subst.domain();
        if (fv(exp).isDisjoint(domain)) return exp;
        Rebuilder<Void> rebuilder = new Rebuilder<>(
                null,
                (acc, sub) -> Pair.of(null, sub instanceof Var ? subst.apply((Var) sub) : sub),
                sub -> !(sub instanceof StructRec) || !fv(sub).isDisjoint(domain)
        );
        return rebuilder.visit(exp);
    }

    /**
     * Get the free variables of {@code exp}.
     *
     * @param exp The expression.
     * @return The free variables.
     */
    public static VarSet fv(Exp exp) {
        List<Var> vars = new ArrayList<>();
        foldVars(exp, vars, (acc, var) -> {
            acc.add(var);
            return acc;
        });
        return VarSet.ofVector(vars);
    }

    public static boolean isTrue(Exp exp) {
        return exp instanceof IntLit && ((IntLit) exp).data().equals(BigInteger.ONE);
    }

    public static boolean isFalse(Exp exp) {
        return exp instanceof IntLit && ((IntLit) exp).data().signum() == 0;
    }

    /**
     * Check whether {@code exp} is constant: whether no variable and no
     * non-deterministic value is reachable from it, through any path.
     *
     * @param exp The expression.
     * @return Whether {@code exp} is constant.
     */
    public static boolean isConstant(Exp exp) {
        for (Exp sub : GraphWalker.expWalker(exp).preOrder()) {
            if (sub instanceof Var || sub instanceof Nondet) return false;
        }
        return true;
    }

    private static class Rebuilder<A> {
        // statuses of a rebuilt node, relative to the node it was rebuilt from;
        // any other status is the serial of the oldest struct frame its change depends on
        static final int GENUINE = -1;
        static final int UNCHANGED = Integer.MAX_VALUE;

        A acc;
        final BiFunction<A, Exp, Pair<A, Exp>> f;
        @Nullable
        final Predicate<Exp> descend;
        final Map<Exp, Exp> memo = new IdentityHashMap<>();
        /*
         * Rebuilt nodes which differ from their originals only because they refer to the
         * placeholder of a struct that is still being visited. If that struct turns out to be
         * unchanged they are discarded, and the originals are used instead.
         */
        final Map<Exp, Integer> pendingLow = new IdentityHashMap<>();
        final Map<Exp, Exp> pendingOrigin = new IdentityHashMap<>();
        int nextFrame = 0;

        Rebuilder(A acc, BiFunction<A, Exp, Pair<A, Exp>> f, @Nullable Predicate<Exp> descend) {
            this.acc = acc;
            this.f = f;
            this.descend = descend;
        }

        int status(Exp original, Exp result) {
            if (result == original) return UNCHANGED;
            Integer low = pendingLow.get(result);
            return low == null ? GENUINE : low;
        }

        boolean skip(Exp exp) {
            return memo.containsKey(exp) || descend != null && !descend.test(exp);
        }

        Exp visit(Exp exp) {
            Exp done = memo.get(exp);
            if (done != null) return done;
            if (descend != null && !descend.test(exp)) {
                memo.put(exp, exp);
                return exp;
            }
            if (exp instanceof App) {
                return visitSpine((App) exp);
            }
            Exp rebuilt = exp instanceof StructRec ? visitStruct((StructRec) exp) : exp;
            Pair<A, Exp> result = f.apply(acc, rebuilt);
            acc = result.left;
            memo.put(exp, result.right);
            return result.right;
        }

        // loops down the operator spine, which is as long as a record is wide
        private Exp visitSpine(App exp) {
            List<App> spine = new ArrayList<>();
            Exp head = exp;
            do {
                spine.add((App) head);
                head = ((App) head).op();
            } while (head instanceof App && !skip(head));
            Exp op = visit(head);
            for (int i = spine.size() - 1; i >= 0; i--) {
                App app = spine.get(i);
                Exp arg = visit(app.arg());
                int status = Math.min(status(app.op(), op), status(app.arg(), arg));
                Exp rebuilt = status == UNCHANGED ? app : Exps.app1(op, arg);
                Pair<A, Exp> result = f.apply(acc, rebuilt);
                acc = result.left;
                if (result.right != rebuilt) {
                    status = GENUINE;
                } else if (status != GENUINE && status != UNCHANGED) {
                    pendingLow.put(rebuilt, status);
                    pendingOrigin.put(rebuilt, app);
                }
                memo.put(app, result.right);
                op = result.right;
            }
            return op;
        }

        private Exp visitStruct(StructRec struct) {
            int frame = nextFrame++;
            StructRec placeholder = StructRec.placeholder(struct.size());
            memo.put(struct, placeholder);
            pendingLow.put(placeholder, frame);
            pendingOrigin.put(placeholder, struct);
            int status = UNCHANGED;
            for (int i = 0; i < struct.size(); i++) {
                Exp elt = struct.elt(i);
                Exp newElt = visit(elt);
                placeholder.patch(i, newElt);
                status = Math.min(status, status(elt, newElt));
            }
            if (status == GENUINE) {
                // everything waiting on this struct, or on structs inside it, really changed
                pendingLow.values().removeIf(low -> low >= frame);
                pendingOrigin.keySet().retainAll(pendingLow.keySet());
                return placeholder;
            }
            if (status >= frame) {
                // nothing in this cycle changed, so keep the originals
                Iterator<Map.Entry<Exp, Integer>> it = pendingLow.entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<Exp, Integer> entry = it.next();
                    if (entry.getValue() >= frame) {
                        Exp origin = pendingOrigin.remove(entry.getKey());
                        memo.put(origin, origin);
                        it.remove();
                    }
                }
                return struct;
            }
            // part of a cycle through a struct further out, which decides
            pendingLow.put(placeholder, status);
            return placeholder;
        }
    }
}
