package dev.btoropt.ir;

import java.util.List;
import java.util.Objects;

public sealed class BtorError extends Exception
        permits BtorError.Parse,
                BtorError.UnresolvedReference,
                BtorError.UnknownPass,
                BtorError.ValidationFailure,
                BtorError.DisjointInterface,
                BtorError.SortMismatch,
                BtorError.LidOverflow {
    BtorError(String message) {
        super(message);
    }

    /** Malformed line, token or block. */
    public static final class Parse extends BtorError {
        private final int line;

        public Parse(String message, int line) {
            super("line " + line + ": " + message);
            this.line = line;
        }

        /** 1-based source line. */
        public int line() {
            return line;
        }
    }

    public static final class UnresolvedReference extends BtorError {
        public UnresolvedReference(String message) {
            super(message);
        }
    }

    public static final class UnknownPass extends BtorError {
        private final String passName;

        public UnknownPass(String passName) {
            super("unknown pass `" + passName + "`");
            this.passName = passName;
        }

        public String passName() {
            return passName;
        }
    }

    public static final class ValidationFailure extends BtorError {
        private final List<Diagnostic> diagnostics;

        public ValidationFailure(List<Diagnostic> diagnostics) {
            super(summary(diagnostics));
            this.diagnostics = List.copyOf(diagnostics);
        }

        public List<Diagnostic> diagnostics() {
            return diagnostics;
        }

        private static String summary(List<Diagnostic> diagnostics) {
            Objects.requireNonNull(diagnostics, "diagnostics");
            if (diagnostics.isEmpty()) {
                throw new IllegalArgumentException("validation failure without diagnostics");
            }
            return diagnostics.size() + " validation error(s), first: " + diagnostics.get(0);
        }
    }

    public static final class DisjointInterface extends BtorError {
        public DisjointInterface(String message) {
            super(message);
        }
    }

    public static final class SortMismatch extends BtorError {
        public SortMismatch(String message) {
            super(message);
        }
    }

    public static final class LidOverflow extends BtorError {
        public LidOverflow(String message) {
            super(message);
        }
    }
}
