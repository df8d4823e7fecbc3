package io.github.eutro.llair.exp;

import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.stream.Collectors;

/**
 * An immutable set of variables, ordered by id.
 */
public final class VarSet implements Iterable<Var>, Comparable<VarSet> {
    public static final VarSet EMPTY = new VarSet(new TreeSet<>(Var.BY_ID));

    private final NavigableSet<Var> vars;

    private VarSet(NavigableSet<Var> vars) {
        this.vars = vars;
    }

    public static VarSet empty() {
        return EMPTY;
    }

    public static VarSet of(Var... vars) {
        return ofVector(Arrays.asList(vars));
    }

    public static VarSet ofVector(Collection<Var> vars) {
        if (vars.isEmpty()) return EMPTY;
        TreeSet<Var> set = new TreeSet<>(Var.BY_ID);
        for (Var var : vars) {
            set.add(Objects.requireNonNull(var));
        }
        return new VarSet(set);
    }

    private TreeSet<Var> copy() {
        TreeSet<Var> set = new TreeSet<>(Var.BY_ID);
        set.addAll(vars);
        return set;
    }

    public boolean contains(Var var) {
        return vars.contains(var);
    }

    public boolean isEmpty() {
        return vars.isEmpty();
    }

    public int size() {
        return vars.size();
    }

    /**
     * Get the greatest id of any variable in this set.
     *
     * @return The greatest id, or 0 if this set is empty.
     */
    public int maxId() {
        return vars.isEmpty() ? 0 : vars.last().id();
    }

    public VarSet add(Var var) {
        if (vars.contains(var)) return this;
        TreeSet<Var> set = copy();
        set.add(var);
        return new VarSet(set);
    }

    public VarSet union(VarSet other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        TreeSet<Var> set = copy();
        set.addAll(other.vars);
        return set.size() == size() ? this : new VarSet(set);
    }

    public VarSet diff(VarSet other) {
        if (isEmpty() || other.isEmpty()) return this;
        TreeSet<Var> set = copy();
        set.removeAll(other.vars);
        return set.size() == size() ? this : new VarSet(set);
    }

    public VarSet inter(VarSet other) {
        TreeSet<Var> set = copy();
        set.retainAll(other.vars);
        return set.size() == size() ? this : new VarSet(set);
    }

    public boolean isDisjoint(VarSet other) {
        VarSet smaller = size() <= other.size() ? this : other;
        VarSet larger = smaller == this ? other : this;
        for (Var var : smaller) {
            if (larger.contains(var)) return false;
        }
        return true;
    }

    public List<Var> toList() {
        return new ArrayList<>(vars);
    }

    @NotNull
    @Override
    public Iterator<Var> iterator() {
        return Collections.unmodifiableSet(vars).iterator();
    }

    @Override
    public int compareTo(@NotNull VarSet o) {
        Iterator<Var> xs = vars.iterator();
        Iterator<Var> ys = o.vars.iterator();
        while (xs.hasNext() && ys.hasNext()) {
            int c = xs.next().compareTo(ys.next());
            if (c != 0) return c;
        }
        return Boolean.compare(xs.hasNext(), ys.hasNext());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VarSet)) return false;
        return vars.equals(((VarSet) o).vars);
    }

    @Override
    public int hashCode() {
        return vars.hashCode();
    }

    @Override
    public String toString() {
        return vars.stream().map(Var::toString).collect(Collectors.joining(", ", "{", "}"));
    }

    /**
     * Display this set with each variable's {@link Var#demangledName() demangled name}.
     *
     * @return The display string.
     */
    public String toDemangledString() {
        return vars.stream().map(Var::toDemangledString).collect(Collectors.joining(", ", "{", "}"));
    }
}
