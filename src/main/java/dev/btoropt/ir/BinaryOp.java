package dev.btoropt.ir;

public enum BinaryOp {
    ADD("add", Shape.SAME),
    SUB("sub", Shape.SAME),
    MUL("mul", Shape.SAME),
    SDIV("sdiv", Shape.SAME),
    UDIV("udiv", Shape.SAME),
    SMOD("smod", Shape.SAME),
    SLL("sll", Shape.SAME),
    SRL("srl", Shape.SAME),
    SRA("sra", Shape.SAME),
    AND("and", Shape.SAME),
    OR("or", Shape.SAME),
    XOR("xor", Shape.SAME),
    CONCAT("concat", Shape.CONCAT),
    EQ("eq", Shape.COMPARE),
    NEQ("neq", Shape.COMPARE),
    SGT("sgt", Shape.COMPARE),
    UGT("ugt", Shape.COMPARE),
    SGTE("sgte", Shape.COMPARE),
    UGTE("ugte", Shape.COMPARE),
    SLT("slt", Shape.COMPARE),
    ULT("ult", Shape.COMPARE),
    SLTE("slte", Shape.COMPARE),
    ULTE("ulte", Shape.COMPARE);

    /** How the result sort relates to the operand sorts. */
    public enum Shape {
        /** Operands and result share one bit-vector sort. */
        SAME,
        /** Operands share a sort, result is a single bit. */
        COMPARE,
        /** Result width is the sum of the operand widths. */
        CONCAT
    }

    private final String keyword;
    private final Shape shape;

    BinaryOp(String keyword, Shape shape) {
        this.keyword = keyword;
        this.shape = shape;
    }

    public String keyword() {
        return keyword;
    }

    public Shape shape() {
        return shape;
    }

    public static BinaryOp fromKeyword(String keyword) {
        for (BinaryOp op : values()) {
            if (op.keyword.equals(keyword)) {
                return op;
            }
        }
        return null;
    }
}
