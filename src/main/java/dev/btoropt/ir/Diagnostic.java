package dev.btoropt.ir;

import java.util.Objects;

public record Diagnostic(String pass, String scope, int lid, String message) {
    public Diagnostic {
        Objects.requireNonNull(pass, "pass");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(pass).append("] ");
        if (!scope.isEmpty()) {
            sb.append(scope).append(' ');
        }
        if (lid != 0) {
            sb.append("lid ").append(lid).append(": ");
        }
        sb.append(message);
        return sb.toString();
    }
}
