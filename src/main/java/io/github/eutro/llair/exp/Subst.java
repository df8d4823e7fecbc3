package io.github.eutro.llair.exp;

import io.github.eutro.llair.util.Pair;
import org.apache.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.stream.Collectors;

/**
 * A finite renaming of variables to variables.
 * <p>
 * Substitutions are immutable: every operation returns a new substitution.
 */
public final class Subst implements Comparable<Subst> {
    private static final Logger LOGGER = Logger.getLogger(Subst.class);

    public static final Subst EMPTY = new Subst(new TreeMap<>(Var.BY_ID));

    private final NavigableMap<Var, Var> map;

    private Subst(NavigableMap<Var, Var> map) {
        this.map = map;
    }

    public static Subst empty() {
        return EMPTY;
    }

    private TreeMap<Var, Var> copy() {
        TreeMap<Var, Var> copy = new TreeMap<>(Var.BY_ID);
        copy.putAll(map);
        return copy;
    }

    /**
     * Create a substitution mapping each of {@code vars} to a fresh variable.
     * <p>
     * The fresh variables avoid every variable in {@code wrt} and in {@code vars}.
     *
     * @param vars The variables to rename.
     * @param wrt  The variables to avoid.
     * @return The substitution.
     */
    public static Subst freshen(VarSet vars, VarSet wrt) {
        if (vars.isEmpty()) return EMPTY;
        TreeMap<Var, Var> map = new TreeMap<>(Var.BY_ID);
        VarSet avoid = wrt.union(vars);
        for (Var var : vars) {
            Pair<Var, VarSet> fresh = Var.fresh(var.name(), avoid);
            map.put(var, fresh.left);
            avoid = fresh.right;
        }
        Subst subst = new Subst(map);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("freshen " + vars + " wrt " + wrt + " = " + subst);
        }
        return subst;
    }

    /**
     * Add the binding {@code replace ↦ with}.
     *
     * @param replace The variable to rename.
     * @param with    The variable to rename it to.
     * @return The extended substitution.
     * @throws IllegalArgumentException If {@code replace} is already bound; {@link #exclude(VarSet)} it first.
     */
    public Subst extend(Var replace, Var with) {
        Objects.requireNonNull(replace);
        Objects.requireNonNull(with);
        if (map.containsKey(replace)) {
            throw new IllegalArgumentException("cannot extend " + this + " with " + replace + " ↦ " + with
                    + ": " + replace + " is already bound");
        }
        TreeMap<Var, Var> copy = copy();
        copy.put(replace, with);
        return new Subst(copy);
    }

    /**
     * Reverse every binding.
     *
     * @return The inverse substitution.
     * @throws IllegalStateException If this substitution is not injective.
     */
    public Subst invert() {
        TreeMap<Var, Var> inverse = new TreeMap<>(Var.BY_ID);
        for (Map.Entry<Var, Var> entry : map.entrySet()) {
            Var prev = inverse.put(entry.getValue(), entry.getKey());
            if (prev != null) {
                throw new IllegalStateException("cannot invert " + this + ": both " + prev + " and "
                        + entry.getKey() + " map to " + entry.getValue());
            }
        }
        return new Subst(inverse);
    }

    /**
     * Remove {@code vars} from the domain.
     *
     * @param vars The variables to unbind.
     * @return The restricted substitution.
     */
    public Subst exclude(VarSet vars) {
        if (vars.isEmpty() || isEmpty()) return this;
        TreeMap<Var, Var> copy = copy();
        for (Var var : vars) {
            copy.remove(var);
        }
        return copy.size() == map.size() ? this : new Subst(copy);
    }

    /**
     * Compose this substitution with another.
     * <p>
     * Renaming by the result is the same as renaming by {@code this}, then by {@code next}.
     *
     * @param next The substitution to apply second.
     * @return The composed substitution.
     */
    public Subst compose(Subst next) {
        TreeMap<Var, Var> composed = new TreeMap<>(Var.BY_ID);
        for (Map.Entry<Var, Var> entry : next.map.entrySet()) {
            if (!map.containsKey(entry.getKey())) {
                composed.put(entry.getKey(), entry.getValue());
            }
        }
        for (Map.Entry<Var, Var> entry : map.entrySet()) {
            Var image = next.apply(entry.getValue());
            if (!image.equals(entry.getKey())) {
                composed.put(entry.getKey(), image);
            }
        }
        return composed.isEmpty() ? EMPTY : new Subst(composed);
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    public VarSet domain() {
        return VarSet.ofVector(map.keySet());
    }

    public VarSet range() {
        return VarSet.ofVector(map.values());
    }

    /**
     * Get the image of a variable.
     *
     * @param var The variable.
     * @return The variable it is bound to, or {@code var} itself if it is unbound.
     */
    public Var apply(Var var) {
        Var image = map.get(var);
        return image == null ? var : image;
    }

    /**
     * Get the image of a set of variables.
     *
     * @param vars The variables.
     * @return Each variable's {@link #apply(Var) image}.
     */
    public VarSet applySet(VarSet vars) {
        if (isEmpty()) return vars;
        List<Var> images = new ArrayList<>(vars.size());
        for (Var var : vars) {
            images.add(apply(var));
        }
        return VarSet.ofVector(images);
    }

    /**
     * Get the smallest superset of the {@link #applySet(VarSet) image} of {@code vars}
     * that is closed under this substitution.
     * <p>
     * Chains of bindings are followed until they reach an unbound variable, or one
     * already seen, so this terminates even if the bindings form a cycle.
     *
     * @param vars The variables.
     * @return The closed image.
     */
    public VarSet closeSet(VarSet vars) {
        Set<Var> closed = new TreeSet<>(Var.BY_ID);
        Deque<Var> work = new ArrayDeque<>();
        for (Var var : vars) {
            Var image = apply(var);
            if (closed.add(image)) work.add(image);
        }
        while (!work.isEmpty()) {
            Var image = map.get(work.poll());
            if (image != null && closed.add(image)) {
                work.add(image);
            }
        }
        return VarSet.ofVector(closed);
    }

    @Override
    public int compareTo(@NotNull Subst o) {
        Iterator<Map.Entry<Var, Var>> xs = map.entrySet().iterator();
        Iterator<Map.Entry<Var, Var>> ys = o.map.entrySet().iterator();
        while (xs.hasNext() && ys.hasNext()) {
            Map.Entry<Var, Var> x = xs.next();
            Map.Entry<Var, Var> y = ys.next();
            int c = x.getKey().compareTo(y.getKey());
            if (c != 0) return c;
            c = x.getValue().compareTo(y.getValue());
            if (c != 0) return c;
        }
        return Boolean.compare(xs.hasNext(), ys.hasNext());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Subst)) return false;
        return map.equals(((Subst) o).map);
    }

    @Override
    public int hashCode() {
        return map.hashCode();
    }

    @Override
    public String toString() {
        return map.entrySet().stream()
                .map(e -> e.getKey() + " ↦ " + e.getValue())
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
