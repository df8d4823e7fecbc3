package io.github.eutro.llair.exp;

/**
 * An anonymous value with an arbitrary value, a non-deterministic approximation
 * of the value described by its message.
 */
public final class Nondet extends Exp {
    private final String msg;

    Nondet(String msg) {
        this.msg = msg;
    }

    public String msg() {
        return msg;
    }

    @Override
    public Kind kind() {
        return Kind.NONDET;
    }

    @Override
    int compareSame(Exp o) {
        return msg.compareTo(((Nondet) o).msg);
    }

    @Override
    public int hashCode() {
        return 31 * Kind.NONDET.ordinal() + msg.hashCode();
    }

    @Override
    void appendSexp(StringBuilder sb) {
        sb.append("(Nondet ");
        appendQuoted(sb, msg);
        sb.append(')');
    }
}
