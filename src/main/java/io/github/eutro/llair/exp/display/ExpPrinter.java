package io.github.eutro.llair.exp.display;

import io.github.eutro.llair.exp.*;
import io.github.eutro.llair.util.Pair;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Prints {@link Exp}s in a stable, human-readable form.
 * <p>
 * The output is meant for debugging and test expectations, not for parsing back.
 * A struct is printed in full the first time it is reached, as {@code #n{|...|}},
 * and as {@code #n} wherever it is reached again.
 */
public class ExpPrinter {
    private final StringBuilder sb = new StringBuilder();
    private final Set<StructRec> printed = Collections.newSetFromMap(new IdentityHashMap<>());
    private final boolean demangle;

    private ExpPrinter(boolean demangle) {
        this.demangle = demangle;
    }

    public static String print(Exp exp) {
        ExpPrinter printer = new ExpPrinter(false);
        printer.append(exp);
        return printer.sb.toString();
    }

    /**
     * Print an expression, showing variables by their {@link Var#demangledName() demangled names}.
     *
     * @param exp The expression.
     * @return The printed expression.
     */
    public static String printDemangled(Exp exp) {
        ExpPrinter printer = new ExpPrinter(true);
        printer.append(exp);
        return printer.sb.toString();
    }

    private void append(Exp exp) {
        switch (exp.kind()) {
            case VAR: {
                Var var = (Var) exp;
                sb.append(demangle ? var.toDemangledString() : var.toString());
                return;
            }
            case NONDET:
                sb.append("nondet(\"").append(((Nondet) exp).msg()).append("\")");
                return;
            case LABEL: {
                Label label = (Label) exp;
                sb.append(label.parent()).append(':').append(label.name());
                return;
            }
            case INTEGER:
                sb.append(((IntLit) exp).data());
                return;
            case FLOAT:
                sb.append(((FloatLit) exp).data());
                return;
            case STRUCT_REC:
                appendStruct((StructRec) exp);
                return;
            case APP:
                appendApp(exp);
                return;
            case CONVERT: {
                // unapplied
                Convert convert = (Convert) exp;
                appendConvertHead(convert);
                return;
            }
            case RECORD:
                // the empty record
                sb.append("{}");
                return;
            default:
                sb.append(exp instanceof Op ? ((Op) exp).mnemonic : exp.kind().toString());
        }
    }

    private void appendConvertHead(Convert convert) {
        sb.append(convert.signed() ? "sconvert<" : "convert<")
                .append(convert.src()).append(", ").append(convert.dst()).append('>');
    }

    private void appendStruct(StructRec struct) {
        sb.append('#').append(struct.serial());
        if (!printed.add(struct)) return;
        sb.append("{|");
        for (int i = 0; i < struct.size(); i++) {
            if (i != 0) sb.append(", ");
            if (struct.isForced(i)) {
                append(struct.elt(i));
            } else {
                sb.append("<lazy>");
            }
        }
        sb.append("|}");
    }

    private void appendApp(Exp exp) {
        Pair<Exp, List<Exp>> uncurried = Exps.uncurry(exp);
        Exp head = uncurried.left;
        List<Exp> args = uncurried.right;
        switch (head.kind()) {
            case SPLAT:
                if (args.size() != 2) break;
                append(args.get(0));
                sb.append('^');
                append(args.get(1));
                return;
            case MEMORY:
                if (args.size() != 2) break;
                sb.append('⟨');
                append(args.get(0));
                sb.append(", ");
                append(args.get(1));
                sb.append('⟩');
                return;
            case CONDITIONAL:
                if (args.size() != 3) break;
                sb.append('(');
                append(args.get(0));
                sb.append(" ? ");
                append(args.get(1));
                sb.append(" : ");
                append(args.get(2));
                sb.append(')');
                return;
            case RECORD:
                sb.append('{');
                for (int i = 0; i < args.size(); i++) {
                    if (i != 0) sb.append(", ");
                    append(args.get(i));
                }
                sb.append('}');
                return;
            case SELECT:
                if (args.size() != 2) break;
                append(args.get(0));
                sb.append('[');
                append(args.get(1));
                sb.append(']');
                return;
            case UPDATE:
                if (args.size() != 3) break;
                sb.append('[');
                append(args.get(0));
                sb.append(" | ");
                append(args.get(2));
                sb.append(" → ");
                append(args.get(1));
                sb.append(']');
                return;
            case CONVERT:
                if (args.size() != 1) break;
                appendConvertHead((Convert) head);
                sb.append('(');
                append(args.get(0));
                sb.append(')');
                return;
            default:
                if (head instanceof Op && args.size() == 2) {
                    sb.append('(');
                    append(args.get(0));
                    sb.append(' ').append(((Op) head).mnemonic).append(' ');
                    append(args.get(1));
                    sb.append(')');
                    return;
                }
        }
        // partial or malformed applications
        sb.append('(');
        append(head);
        for (Exp arg : args) {
            sb.append(' ');
            append(arg);
        }
        sb.append(')');
    }
}
