package io.github.eutro.llair.typ;

import io.github.eutro.llair.util.Sexps;
import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.stream.Collectors;

/**
 * A description of the type of a value, as far as expressions need to know it.
 * <p>
 * Types are immutable, and compared structurally.
 */
public abstract class Typ implements Comparable<Typ> {
    public static final Typ BOOL = integer(1);
    public static final Typ BYT = integer(8);
    public static final Typ INT = integer(32);
    public static final Typ SIZ = integer(64);
    public static final Typ PTR = pointer(BYT);

    /**
     * The kinds of type, in the order in which types of different kinds compare.
     */
    public enum Kind {
        FUNCTION,
        INTEGER,
        FLOAT,
        POINTER,
        ARRAY,
        TUPLE,
        OPAQUE,
    }

    Typ() {
    }

    public abstract Kind kind();

    /**
     * Get the size of values of this type, in bits, if it is known.
     *
     * @return The size, or -1 if this type is unsized.
     */
    public abstract long sizeInBits();

    public boolean isSized() {
        return sizeInBits() >= 0;
    }

    /**
     * Whether values of this type are scalars: integers, floats and pointers.
     *
     * @return The above.
     */
    public boolean isScalar() {
        switch (kind()) {
            case INTEGER:
            case FLOAT:
            case POINTER:
                return true;
            default:
                return false;
        }
    }

    /**
     * Check whether a value of type {@code src} may be converted to type {@code dst}.
     * <p>
     * This holds if they are equal, if they have the same known size, if they are both
     * scalars, or if they are arrays of the same length whose element types are convertible.
     *
     * @param src The source type.
     * @param dst The destination type.
     * @return Whether the conversion is well-typed.
     */
    public static boolean convertible(Typ src, Typ dst) {
        if (src.equals(dst)) return true;
        if (src.isSized() && src.sizeInBits() == dst.sizeInBits()) return true;
        if (src.isScalar() && dst.isScalar()) return true;
        if (src instanceof Array && dst instanceof Array) {
            Array srcArr = (Array) src;
            Array dstArr = (Array) dst;
            return srcArr.len == dstArr.len && convertible(srcArr.elt, dstArr.elt);
        }
        return false;
    }

    public static Function function(Typ ret, Typ... args) {
        return new Function(ret, Arrays.asList(args));
    }

    public static Integer integer(int bits) {
        if (bits <= 0) throw new IllegalArgumentException("integer width must be positive: " + bits);
        return new Integer(bits);
    }

    public static Float floating(int bits, String enc) {
        if (bits <= 0) throw new IllegalArgumentException("float width must be positive: " + bits);
        return new Float(bits, Objects.requireNonNull(enc));
    }

    public static Pointer pointer(Typ elt) {
        return new Pointer(Objects.requireNonNull(elt));
    }

    public static Array array(Typ elt, long len) {
        if (len < 0) throw new IllegalArgumentException("array length must not be negative: " + len);
        return new Array(Objects.requireNonNull(elt), len);
    }

    public static Tuple tuple(boolean packed, Typ... elts) {
        return new Tuple(packed, Arrays.asList(elts));
    }

    public static Opaque opaque(String name) {
        return new Opaque(Objects.requireNonNull(name));
    }

    /**
     * Get the canonical serialized form of this type.
     * <p>
     * Two types have the same serialized form exactly when they are equal.
     *
     * @return The serialized form.
     */
    public String sexp() {
        StringBuilder sb = new StringBuilder();
        appendSexp(sb);
        return sb.toString();
    }

    public abstract void appendSexp(StringBuilder sb);

    private static void appendSexps(StringBuilder sb, List<Typ> typs) {
        sb.append('(');
        for (int i = 0; i < typs.size(); i++) {
            if (i != 0) sb.append(' ');
            typs.get(i).appendSexp(sb);
        }
        sb.append(')');
    }

    @Override
    public int compareTo(@NotNull Typ o) {
        if (this == o) return 0;
        int c = kind().compareTo(o.kind());
        if (c != 0) return c;
        return compareSame(o);
    }

    // o has the same kind as this
    abstract int compareSame(Typ o);

    private static int compareLists(List<Typ> xs, List<Typ> ys) {
        int len = Math.min(xs.size(), ys.size());
        for (int i = 0; i < len; i++) {
            int c = xs.get(i).compareTo(ys.get(i));
            if (c != 0) return c;
        }
        return java.lang.Integer.compare(xs.size(), ys.size());
    }

    @Override
    public boolean equals(Object obj) {
        return this == obj || obj instanceof Typ && compareTo((Typ) obj) == 0;
    }

    @Override
    public abstract int hashCode();

    public static final class Function extends Typ {
        public final Typ ret;
        public final List<Typ> args;

        Function(Typ ret, List<Typ> args) {
            this.ret = Objects.requireNonNull(ret);
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
        }

        @Override
        public Kind kind() {
            return Kind.FUNCTION;
        }

        @Override
        public long sizeInBits() {
            return -1;
        }

        @Override
        int compareSame(Typ o) {
            Function other = (Function) o;
            int c = ret.compareTo(other.ret);
            return c != 0 ? c : compareLists(args, other.args);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.FUNCTION.ordinal(), ret, args);
        }

        @Override
        public void appendSexp(StringBuilder sb) {
            sb.append("(Function (ret ");
            ret.appendSexp(sb);
            sb.append(") (args ");
            appendSexps(sb, args);
            sb.append("))");
        }

        @Override
        public String toString() {
            return ret + " (" + args.stream().map(Typ::toString).collect(Collectors.joining(", ")) + ")";
        }
    }

    public static final class Integer extends Typ {
        public final int bits;

        Integer(int bits) {
            this.bits = bits;
        }

        @Override
        public Kind kind() {
            return Kind.INTEGER;
        }

        @Override
        public long sizeInBits() {
            return bits;
        }

        @Override
        int compareSame(Typ o) {
            return java.lang.Integer.compare(bits, ((Integer) o).bits);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.INTEGER.ordinal(), bits);
        }

        @Override
        public void appendSexp(StringBuilder sb) {
            sb.append("(Integer ").append(bits).append(')');
        }

        @Override
        public String toString() {
            return "i" + bits;
        }
    }

    public static final class Float extends Typ {
        public final int bits;
        public final String enc;

        Float(int bits, String enc) {
            this.bits = bits;
            this.enc = enc;
        }

        @Override
        public Kind kind() {
            return Kind.FLOAT;
        }

        @Override
        public long sizeInBits() {
            return bits;
        }

        @Override
        int compareSame(Typ o) {
            Float other = (Float) o;
            int c = java.lang.Integer.compare(bits, other.bits);
            return c != 0 ? c : enc.compareTo(other.enc);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.FLOAT.ordinal(), bits, enc);
        }

        @Override
        public void appendSexp(StringBuilder sb) {
            sb.append("(Float (bits ").append(bits).append(") (enc ");
            Sexps.appendQuoted(sb, enc);
            sb.append("))");
        }

        @Override
        public String toString() {
            return enc + ":" + bits;
        }
    }

    public static final class Pointer extends Typ {
        public final Typ elt;

        Pointer(Typ elt) {
            this.elt = elt;
        }

        @Override
        public Kind kind() {
            return Kind.POINTER;
        }

        @Override
        public long sizeInBits() {
            return 64;
        }

        @Override
        int compareSame(Typ o) {
            return elt.compareTo(((Pointer) o).elt);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.POINTER.ordinal(), elt);
        }

        @Override
        public void appendSexp(StringBuilder sb) {
            sb.append("(Pointer ");
            elt.appendSexp(sb);
            sb.append(')');
        }

        @Override
        public String toString() {
            return elt + "*";
        }
    }

    public static final class Array extends Typ {
        public final Typ elt;
        public final long len;

        Array(Typ elt, long len) {
            this.elt = elt;
            this.len = len;
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }

        @Override
        public long sizeInBits() {
            long eltSize = elt.sizeInBits();
            return eltSize < 0 ? -1 : eltSize * len;
        }

        @Override
        int compareSame(Typ o) {
            Array other = (Array) o;
            int c = elt.compareTo(other.elt);
            return c != 0 ? c : Long.compare(len, other.len);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.ARRAY.ordinal(), elt, len);
        }

        @Override
        public void appendSexp(StringBuilder sb) {
            sb.append("(Array (elt ");
            elt.appendSexp(sb);
            sb.append(") (len ").append(len).append("))");
        }

        @Override
        public String toString() {
            return "[" + len + " x " + elt + "]";
        }
    }

    public static final class Tuple extends Typ {
        public final boolean packed;
        public final List<Typ> elts;

        Tuple(boolean packed, List<Typ> elts) {
            this.packed = packed;
            this.elts = Collections.unmodifiableList(new ArrayList<>(elts));
        }

        @Override
        public Kind kind() {
            return Kind.TUPLE;
        }

        @Override
        public long sizeInBits() {
            // padding is not modelled, so only packed tuples have a known size
            if (!packed) return -1;
            long size = 0;
            for (Typ elt : elts) {
                long eltSize = elt.sizeInBits();
                if (eltSize < 0) return -1;
                size += eltSize;
            }
            return size;
        }

        @Override
        int compareSame(Typ o) {
            Tuple other = (Tuple) o;
            int c = Boolean.compare(packed, other.packed);
            return c != 0 ? c : compareLists(elts, other.elts);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.TUPLE.ordinal(), packed, elts);
        }

        @Override
        public void appendSexp(StringBuilder sb) {
            sb.append("(Tuple (packed ").append(packed).append(") (elts ");
            appendSexps(sb, elts);
            sb.append("))");
        }

        @Override
        public String toString() {
            String body = elts.stream().map(Typ::toString).collect(Collectors.joining(", "));
            return packed ? "<{" + body + "}>" : "{" + body + "}";
        }
    }

    public static final class Opaque extends Typ {
        public final String name;

        Opaque(String name) {
            this.name = name;
        }

        @Override
        public Kind kind() {
            return Kind.OPAQUE;
        }

        @Override
        public long sizeInBits() {
            return -1;
        }

        @Override
        int compareSame(Typ o) {
            return name.compareTo(((Opaque) o).name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.OPAQUE.ordinal(), name);
        }

        @Override
        public void appendSexp(StringBuilder sb) {
            sb.append("(Opaque ");
            Sexps.appendQuoted(sb, name);
            sb.append(')');
        }

        @Override
        public String toString() {
            return "%" + name;
        }
    }
}
