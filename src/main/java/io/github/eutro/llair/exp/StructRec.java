package io.github.eutro.llair.exp;

import io.github.eutro.llair.util.Lazy;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * A struct constant that may recursively refer to itself, directly or transitively,
 * from its elements. Values of this kind may be cyclic.
 * <p>
 * Each element is computed lazily, so that a recursive reference to this node can be
 * linked in before the node is finished; see {@link StructRecBuilder}. Struct values
 * are atomic: equality, ordering and hashing use the identity of the node, represented
 * by a serial number unique to it.
 */
public final class StructRec extends Exp {
    private static final AtomicInteger SERIAL_COUNTER = new AtomicInteger(0);

    private final int serial = SERIAL_COUNTER.incrementAndGet();
    private final List<Lazy<Exp>> elts;

    private StructRec(List<Lazy<Exp>> elts) {
        this.elts = elts;
    }

    static StructRec ofThunks(List<? extends Supplier<Exp>> thunks) {
        List<Lazy<Exp>> elts = new ArrayList<>(thunks.size());
        for (Supplier<Exp> thunk : thunks) {
            elts.add(Lazy.lazy(thunk));
        }
        return new StructRec(elts);
    }

    /**
     * Create a node whose elements must all be {@link #patch(int, Exp) patched} before use.
     */
    static StructRec placeholder(int size) {
        List<Lazy<Exp>> elts = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            elts.add(Lazy.lazy(() -> {
                throw new IllegalStateException("element of a struct read before it was constructed");
            }));
        }
        return new StructRec(elts);
    }

    void patch(int index, Exp elt) {
        elts.get(index).set(elt);
    }

    void force() {
        for (Lazy<Exp> elt : elts) {
            elt.get();
        }
    }

    public int serial() {
        return serial;
    }

    public int size() {
        return elts.size();
    }

    /**
     * Get an element, forcing it if it has not been yet.
     *
     * @param index The index of the element.
     * @return The element.
     */
    public Exp elt(int index) {
        return elts.get(index).get();
    }

    public boolean isForced(int index) {
        return elts.get(index).isForced();
    }

    /**
     * Get a view of the elements, each forced on access.
     *
     * @return The elements.
     */
    public List<Exp> elts() {
        return new AbstractList<Exp>() {
            @Override
            public Exp get(int index) {
                return elt(index);
            }

            @Override
            public int size() {
                return elts.size();
            }
        };
    }

    @Override
    public Kind kind() {
        return Kind.STRUCT_REC;
    }

    @Override
    int compareSame(Exp o) {
        return Integer.compare(serial, ((StructRec) o).serial);
    }

    @Override
    public boolean equals(Object obj) {
        return this == obj;
    }

    @Override
    public int hashCode() {
        return 31 * Kind.STRUCT_REC.ordinal() + serial;
    }

    @Override
    void appendSexp(StringBuilder sb) {
        sb.append("(Struct_rec #").append(serial).append(')');
    }
}
