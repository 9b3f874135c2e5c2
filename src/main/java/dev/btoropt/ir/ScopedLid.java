package dev.btoropt.ir;

import java.util.Objects;

public record ScopedLid(String scope, int lid) implements Comparable<ScopedLid> {
    public static final String TOP = "";

    public ScopedLid {
        Objects.requireNonNull(scope, "scope");
    }

    public static String moduleScope(String name) {
        return "module:" + name;
    }

    public static String contractScope(String module) {
        return "contract:" + module;
    }

    @Override
    public int compareTo(ScopedLid o) {
        int c = scope.compareTo(o.scope);
        return (c != 0) ? c : Integer.compare(lid, o.lid);
    }

    @Override
    public String toString() {
        return scope.isEmpty() ? Integer.toString(lid) : scope + "#" + lid;
    }
}
