package dev.btoropt.ir;

import java.util.List;
import java.util.Objects;

public record ModuleDecl(String name, List<Instruction> body) {
    public ModuleDecl {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("module name must not be empty");
        }
        body = List.copyOf(body);
    }

    public String scope() {
        return ScopedLid.moduleScope(name);
    }
}
