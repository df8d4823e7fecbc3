package io.github.eutro.llair.exp;

/**
 * A floating-point constant, kept as the exact text it was written as.
 * <p>
 * The text is never parsed, so equality and ordering are textual: {@code 1.0}
 * and {@code 1.00} are different constants.
 */
public final class FloatLit extends Exp {
    private final String data;

    FloatLit(String data) {
        this.data = data;
    }

    public String data() {
        return data;
    }

    @Override
    public Kind kind() {
        return Kind.FLOAT;
    }

    @Override
    int compareSame(Exp o) {
        return data.compareTo(((FloatLit) o).data);
    }

    @Override
    public int hashCode() {
        return 31 * Kind.FLOAT.ordinal() + data.hashCode();
    }

    @Override
    void appendSexp(StringBuilder sb) {
        sb.append("(Float ");
        appendQuoted(sb, data);
        sb.append(')');
    }
}
