package io.github.eutro.llair.exp;

import java.util.Objects;

/**
 * The address of a named code block within a named parent function.
 */
public final class Label extends Exp {
    private final String parent;
    private final String name;

    Label(String parent, String name) {
        this.parent = parent;
        this.name = name;
    }

    public String parent() {
        return parent;
    }

    public String name() {
        return name;
    }

    @Override
    public Kind kind() {
        return Kind.LABEL;
    }

    @Override
    int compareSame(Exp o) {
        Label other = (Label) o;
        int c = parent.compareTo(other.parent);
        return c != 0 ? c : name.compareTo(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Kind.LABEL.ordinal(), parent, name);
    }

    @Override
    void appendSexp(StringBuilder sb) {
        sb.append("(Label (parent ");
        appendQuoted(sb, parent);
        sb.append(") (name ");
        appendQuoted(sb, name);
        sb.append("))");
    }
}
