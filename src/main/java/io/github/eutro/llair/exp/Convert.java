package io.github.eutro.llair.exp;

import io.github.eutro.llair.typ.Typ;

import java.util.Objects;

/**
 * Conversion between the specified types, possibly with loss of information.
 * <p>
 * A unary operator: it is only meaningful applied to the value being converted.
 */
public final class Convert extends Exp {
    private final boolean signed;
    private final Typ dst;
    private final Typ src;

    Convert(boolean signed, Typ dst, Typ src) {
        this.signed = signed;
        this.dst = dst;
        this.src = src;
    }

    public boolean signed() {
        return signed;
    }

    public Typ dst() {
        return dst;
    }

    public Typ src() {
        return src;
    }

    @Override
    public Kind kind() {
        return Kind.CONVERT;
    }

    @Override
    int compareSame(Exp o) {
        Convert other = (Convert) o;
        int c = Boolean.compare(signed, other.signed);
        if (c != 0) return c;
        c = dst.compareTo(other.dst);
        return c != 0 ? c : src.compareTo(other.src);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Kind.CONVERT.ordinal(), signed, dst, src);
    }

    @Override
    void appendSexp(StringBuilder sb) {
        sb.append("(Convert (signed ").append(signed).append(") (dst ");
        dst.appendSexp(sb);
        sb.append(") (src ");
        src.appendSexp(sb);
        sb.append("))");
    }
}
