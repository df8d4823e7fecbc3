package io.github.eutro.llair.exp;

/**
 * A nullary function symbol.
 * <p>
 * Operators are only given arguments by {@link App}. There is exactly one instance per
 * {@link Exp.Kind kind} of operator, so they compare by identity.
 */
public final class Op extends Exp {
    /**
     * Pointer value that never refers to an object.
     */
    public static final Op NULL = new Op(Kind.NULL, "null");
    /**
     * Iterated concatenation of a single byte.
     */
    public static final Op SPLAT = new Op(Kind.SPLAT, "^");
    /**
     * Size-tagged byte-array.
     */
    public static final Op MEMORY = new Op(Kind.MEMORY, "memory");
    /**
     * Byte-array concatenation.
     */
    public static final Op CONCAT = new Op(Kind.CONCAT, "++");
    public static final Op EQ = new Op(Kind.EQ, "=");
    public static final Op DQ = new Op(Kind.DQ, "!=");
    public static final Op GT = new Op(Kind.GT, ">");
    public static final Op GE = new Op(Kind.GE, ">=");
    public static final Op LT = new Op(Kind.LT, "<");
    public static final Op LE = new Op(Kind.LE, "<=");
    /**
     * Unordered or greater-than test.
     */
    public static final Op UGT = new Op(Kind.UGT, "u>");
    public static final Op UGE = new Op(Kind.UGE, "u>=");
    public static final Op ULT = new Op(Kind.ULT, "u<");
    public static final Op ULE = new Op(Kind.ULE, "u<=");
    /**
     * Ordered test (neither argument is NaN).
     */
    public static final Op ORD = new Op(Kind.ORD, "ord");
    /**
     * Unordered test (some argument is NaN).
     */
    public static final Op UNO = new Op(Kind.UNO, "uno");
    public static final Op ADD = new Op(Kind.ADD, "+");
    public static final Op SUB = new Op(Kind.SUB, "-");
    public static final Op MUL = new Op(Kind.MUL, "*");
    public static final Op DIV = new Op(Kind.DIV, "/");
    public static final Op UDIV = new Op(Kind.UDIV, "udiv");
    public static final Op REM = new Op(Kind.REM, "rem");
    public static final Op UREM = new Op(Kind.UREM, "urem");
    public static final Op AND = new Op(Kind.AND, "&&");
    public static final Op OR = new Op(Kind.OR, "||");
    /**
     * Exclusive-or, or Boolean disequality.
     */
    public static final Op XOR = new Op(Kind.XOR, "xor");
    public static final Op SHL = new Op(Kind.SHL, "shl");
    public static final Op LSHR = new Op(Kind.LSHR, "lshr");
    public static final Op ASHR = new Op(Kind.ASHR, "ashr");
    /**
     * If-then-else.
     */
    public static final Op CONDITIONAL = new Op(Kind.CONDITIONAL, "?:");
    /**
     * Record (array or struct) constant.
     */
    public static final Op RECORD = new Op(Kind.RECORD, "record");
    /**
     * Select an index from a record.
     */
    public static final Op SELECT = new Op(Kind.SELECT, "select");
    /**
     * Constant record with an updated index.
     */
    public static final Op UPDATE = new Op(Kind.UPDATE, "update");

    private final Kind kind;
    public final String mnemonic;

    private Op(Kind kind, String mnemonic) {
        this.kind = kind;
        this.mnemonic = mnemonic;
    }

    @Override
    public Kind kind() {
        return kind;
    }

    @Override
    int compareSame(Exp o) {
        return 0;
    }

    @Override
    public int hashCode() {
        return kind.ordinal();
    }

    @Override
    void appendSexp(StringBuilder sb) {
        String name = kind.name();
        sb.append(name.charAt(0)).append(name.substring(1).toLowerCase());
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
