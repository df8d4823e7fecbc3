package io.github.eutro.llair.exp;

import org.apache.log4j.Logger;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A builder for one possibly-cyclic {@link StructRec} value.
 * <p>
 * The element thunks given to {@link #build(Object, List)} may call back into the same
 * builder. A call with an {@code id} whose node is still being built returns that same,
 * unfinished node, which is what closes the cycle. Once all of a node's thunks have been
 * forced it is finished.
 * <p>
 * The caller must:
 * <ul>
 *     <li>use a single builder for each complete cyclic value, and never share one
 *     between unrelated values or threads;</li>
 *     <li>pass ids that uniquely identify at least one node on each cycle.</li>
 * </ul>
 * Failing to do so leads to unbounded recursion. This cannot be detected in general,
 * so the builder only fails once nesting exceeds {@link #MAX_DEPTH}.
 *
 * @param <K> The type of the ids, which must have consistent equality and hashing.
 */
public final class StructRecBuilder<K> {
    private static final Logger LOGGER = Logger.getLogger(StructRecBuilder.class);

    /**
     * How deeply calls to {@link #build(Object, List)} may nest before the builder gives up.
     */
    public static int MAX_DEPTH = maxDepthFromEnv();

    private final Map<K, StructRec> memo = new HashMap<>();
    private int depth = 0;

    StructRecBuilder() {
    }

    private static int maxDepthFromEnv() {
        String setting = System.getenv("LLAIR_STRUCT_REC_MAX_DEPTH");
        if (setting == null) return 1024;
        try {
            return Integer.parseInt(setting.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("LLAIR_STRUCT_REC_MAX_DEPTH is not an integer: " + setting, e);
        }
    }

    /**
     * Build the struct identified by {@code id}, or get it if it is already being built.
     *
     * @param id         The id of the struct.
     * @param eltThunks  The elements of the struct, computed once the struct has been
     *                   registered under {@code id}.
     * @return The struct.
     */
    public Exp build(K id, List<? extends Supplier<Exp>> eltThunks) {
        Objects.requireNonNull(id);
        StructRec existing = memo.get(id);
        if (existing != null) {
            // shares the node being built, its elements are filled in by the outer call
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("closing cycle at " + id + " (#" + existing.serial() + ")");
            }
            return existing;
        }
        if (depth >= MAX_DEPTH) {
            LOGGER.error("struct construction nested " + depth + " deep at " + id);
            throw new IllegalStateException("struct construction nested more than " + MAX_DEPTH
                    + " deep; ids may not identify a point on every cycle, or a builder is being reused");
        }
        StructRec node = StructRec.ofThunks(eltThunks);
        memo.put(id, node);
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("registered placeholder #" + node.serial() + " for " + id);
        }
        depth++;
        try {
            node.force();
        } finally {
            depth--;
        }
        if (Exps.CHECK_INVARIANTS) Invariants.check(node, depth > 0);
        return node;
    }

    @SafeVarargs
    public final Exp build(K id, Supplier<Exp>... eltThunks) {
        return build(id, Arrays.asList(eltThunks));
    }
}
