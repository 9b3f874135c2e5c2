package dev.btoropt.ir;

public enum UnaryOp {
    INC("inc", false),
    DEC("dec", false),
    NEG("neg", false),
    REDAND("redand", true),
    REDOR("redor", true),
    REDXOR("redxor", true);

    private final String keyword;
    private final boolean reduction;

    UnaryOp(String keyword, boolean reduction) {
        this.keyword = keyword;
        this.reduction = reduction;
    }

    public String keyword() {
        return keyword;
    }

    /** Reductions collapse their operand to a single bit. */
    public boolean isReduction() {
        return reduction;
    }

    public static UnaryOp fromKeyword(String keyword) {
        for (UnaryOp op : values()) {
            if (op.keyword.equals(keyword)) {
                return op;
            }
        }
        return null;
    }
}
