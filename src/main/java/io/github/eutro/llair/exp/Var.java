package io.github.eutro.llair.exp;

import io.github.eutro.llair.util.Pair;
import org.jetbrains.annotations.Nullable;

import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A local variable, or virtual register.
 * <p>
 * The identity of a variable is its {@link #id()}. The {@link #name()} is only for display,
 * and is never consulted by equality, ordering or hashing. Every variable is created with
 * an id no variable created before it had, so the name of a variable is determined by its id.
 */
public final class Var extends Exp {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);
    private static final Map<String, Var> PROGRAM_VARS = new ConcurrentHashMap<>();

    /**
     * Orders variables by id.
     */
    public static final Comparator<Var> BY_ID = Comparator.comparingInt(Var::id);

    private final int id;
    private final String name;

    private Var(int id, String name) {
        this.id = id;
        this.name = name;
    }

    /**
     * Get the stable variable for a fixed, user-visible name.
     * <p>
     * Repeated calls with the same name return the same variable.
     *
     * @param name The name.
     * @return The variable.
     */
    public static Var program(String name) {
        Objects.requireNonNull(name);
        return PROGRAM_VARS.computeIfAbsent(name, n -> new Var(ID_COUNTER.incrementAndGet(), n));
    }

    /**
     * Create a variable whose id differs from that of every variable in {@code wrt}.
     * <p>
     * Callers should thread the returned set through subsequent calls.
     *
     * @param name The display name of the new variable.
     * @param wrt  The variables to avoid.
     * @return The new variable, and {@code wrt} extended with it.
     */
    public static Pair<Var, VarSet> fresh(String name, VarSet wrt) {
        Objects.requireNonNull(name);
        int max = wrt.maxId();
        Var var = new Var(ID_COUNTER.updateAndGet(last -> Math.max(last, max) + 1), name);
        return Pair.of(var, wrt.add(var));
    }

    /**
     * Get the variable an expression is, if it is exactly a variable.
     *
     * @param exp The expression.
     * @return The variable, or null if {@code exp} is not a variable.
     */
    @Nullable
    public static Var ofExp(Exp exp) {
        return exp instanceof Var ? (Var) exp : null;
    }

    public static Optional<Var> checkExp(Exp exp) {
        return Optional.ofNullable(ofExp(exp));
    }

    public int id() {
        return id;
    }

    public String name() {
        return name;
    }

    /**
     * Get the name of this variable with any compiler-generated qualification stripped.
     * <p>
     * A C++-style name such as {@code ns::Cls::method(int)} becomes {@code method},
     * and an LLVM-style numbered copy such as {@code x.12} becomes {@code x}.
     *
     * @return The demangled name.
     */
    public String demangledName() {
        return demangle(name);
    }

    static String demangle(String name) {
        String base = name;
        int paren = base.indexOf('(');
        if (paren > 0) base = base.substring(0, paren);
        int colons = base.lastIndexOf("::");
        if (colons >= 0 && colons + 2 < base.length()) base = base.substring(colons + 2);
        int dot = base.indexOf('.');
        if (dot > 0) base = base.substring(0, dot);
        return base;
    }

    /**
     * Check that this variable is well-formed.
     *
     * @throws IllegalStateException If it is not.
     */
    public void invariant() {
        if (id < 0) throw new IllegalStateException("negative variable id: " + id);
        if (name == null) throw new IllegalStateException("variable " + id + " has no name");
    }

    @Override
    public Kind kind() {
        return Kind.VAR;
    }

    @Override
    int compareSame(Exp o) {
        return Integer.compare(id, ((Var) o).id);
    }

    @Override
    public int hashCode() {
        return 31 * Kind.VAR.ordinal() + id;
    }

    @Override
    void appendSexp(StringBuilder sb) {
        sb.append("(Var (id ").append(id).append(") (name ");
        appendQuoted(sb, name);
        sb.append("))");
    }

    @Override
    public String toString() {
        return "%" + name + "_" + id;
    }

    /**
     * Display this variable with its {@link #demangledName() demangled name}.
     *
     * @return The display string.
     */
    public String toDemangledString() {
        return "%" + demangledName() + "_" + id;
    }
}
