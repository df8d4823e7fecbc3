package io.github.eutro.llair.exp;

import java.math.BigInteger;

/**
 * An arbitrary-precision integer constant.
 * <p>
 * Boolean constants are the integers {@code 1} (true) and {@code 0} (false).
 */
public final class IntLit extends Exp {
    private final BigInteger data;

    IntLit(BigInteger data) {
        this.data = data;
    }

    public BigInteger data() {
        return data;
    }

    @Override
    public Kind kind() {
        return Kind.INTEGER;
    }

    @Override
    int compareSame(Exp o) {
        return data.compareTo(((IntLit) o).data);
    }

    @Override
    public int hashCode() {
        return 31 * Kind.INTEGER.ordinal() + data.hashCode();
    }

    @Override
    void appendSexp(StringBuilder sb) {
        sb.append("(Integer ").append(data).append(')');
    }
}
