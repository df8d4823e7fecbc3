package io.github.eutro.llair.exp;

import io.github.eutro.llair.typ.Typ;
import io.github.eutro.llair.util.Pair;
import org.apache.log4j.Logger;

import java.util.*;

/**
 * The structural well-formedness check for {@link Exp}s.
 * <p>
 * This is a debugging aid. Expressions built with {@link Exps} are well-formed by
 * construction; set {@link Exps#CHECK_INVARIANTS} to check every expression as it is built.
 */
public final class Invariants {
    private static final Logger LOGGER = Logger.getLogger(Invariants.class);

    /**
     * Used for {@link Exp.Kind#RECORD}, which takes any number of arguments.
     */
    private static final int VARIADIC = -1;

    private Invariants() {
    }

    public static void check(Exp exp) {
        check(exp, false);
    }

    /**
     * Check that {@code exp} is well-formed.
     * <p>
     * Every operator must be applied to exactly as many arguments as it takes, every
     * conversion must be between convertible types, only operators and conversions may
     * be applied, and every struct must be finished.
     * <p>
     * With {@code partial}, {@code exp} may be a partial application, applying its operator to
     * fewer arguments than it takes, and structs that are still being built are accepted.
     *
     * @param exp     The expression.
     * @param partial Whether {@code exp} may still be under construction.
     * @throws IllegalStateException If {@code exp} is not well-formed.
     */
    public static void check(Exp exp, boolean partial) {
        Set<Exp> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Exp> work = new ArrayDeque<>();
        seen.add(exp);
        work.push(exp);
        while (!work.isEmpty()) {
            Exp spine = work.pop();
            Pair<Exp, List<Exp>> uncurried = Exps.uncurry(spine);
            Exp head = uncurried.left;
            List<Exp> args = uncurried.right;
            checkArity(spine, head, args.size(), partial && spine == exp);
            if (head instanceof Var) {
                try {
                    ((Var) head).invariant();
                } catch (IllegalStateException e) {
                    IllegalStateException violation = violation(spine, e.getMessage());
                    violation.initCause(e);
                    throw violation;
                }
            } else if (head instanceof Convert) {
                Convert convert = (Convert) head;
                if (!Typ.convertible(convert.src(), convert.dst())) {
                    throw violation(spine, "cannot convert from " + convert.src() + " to " + convert.dst());
                }
            } else if (head instanceof StructRec) {
                StructRec struct = (StructRec) head;
                for (int i = 0; i < struct.size(); i++) {
                    if (!struct.isForced(i)) {
                        if (partial) continue;
                        throw violation(spine, "element " + i + " of struct #" + struct.serial() + " is unfinished");
                    }
                    Exp elt = struct.elt(i);
                    if (elt == null) {
                        throw violation(spine, "element " + i + " of struct #" + struct.serial() + " is missing");
                    }
                    if (seen.add(elt)) work.push(elt);
                }
            }
            for (Exp arg : args) {
                if (seen.add(arg)) work.push(arg);
            }
        }
    }

    private static void checkArity(Exp spine, Exp head, int nargs, boolean partial) {
        int arity = arity(head.kind());
        if (arity == VARIADIC) return;
        if (nargs == arity || partial && nargs < arity) return;
        if (arity == 0) {
            throw violation(spine, head.kind() + " cannot be applied, but has " + nargs + " argument(s)");
        }
        throw violation(spine, head.kind() + " takes " + arity + " argument(s), but has " + nargs);
    }

    /**
     * Get the number of arguments an expression of the given kind takes when at the head
     * of an application spine.
     *
     * @param kind The kind.
     * @return The arity, or {@link #VARIADIC}.
     */
    static int arity(Exp.Kind kind) {
        switch (kind) {
            case VAR:
            case NONDET:
            case LABEL:
            case NULL:
            case INTEGER:
            case FLOAT:
            case STRUCT_REC:
                return 0;
            case CONVERT:
                return 1;
            case SPLAT:
            case MEMORY:
            case CONCAT:
            case EQ:
            case DQ:
            case GT:
            case GE:
            case LT:
            case LE:
            case UGT:
            case UGE:
            case ULT:
            case ULE:
            case ORD:
            case UNO:
            case ADD:
            case SUB:
            case MUL:
            case DIV:
            case UDIV:
            case REM:
            case UREM:
            case AND:
            case OR:
            case XOR:
            case SHL:
            case LSHR:
            case ASHR:
            case SELECT:
                return 2;
            case CONDITIONAL:
            case UPDATE:
                return 3;
            case RECORD:
                return VARIADIC;
            default:
                // APP is never the head of a spine
                throw new IllegalStateException("no arity for " + kind);
        }
    }

    private static IllegalStateException violation(Exp spine, String reason) {
        String message = "malformed expression: " + reason + ", in " + spine.sexp();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(message);
        }
        return new IllegalStateException(message);
    }
}
