package dev.btoropt.ir;

import java.util.Objects;

public sealed interface SortType permits SortType.BitVec, SortType.Array {
    record BitVec(int width) implements SortType {
        public BitVec {
            if (width <= 0) {
                throw new IllegalArgumentException("bit-vector width must be positive, got " + width);
            }
        }
    }

    record Array(int indexSid, int elementSid) implements SortType {}

    /** Sort keyword as written in canonical BTOR2. */
    static String keyword(SortType t) {
        Objects.requireNonNull(t, "t");
        return (t instanceof BitVec) ? "bitvec" : "array";
    }
}
