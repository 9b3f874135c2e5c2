package dev.btoropt.ir;

import java.util.List;
import java.util.Objects;

public record ContractDecl(String module, List<Instruction> body) {
    public ContractDecl {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(body, "body");
        body = List.copyOf(body);
    }

    public String scope() {
        return ScopedLid.contractScope(module);
    }

    public List<Instruction.Prec> preconditions() {
        return body.stream()
                .filter(i -> i instanceof Instruction.Prec)
                .map(i -> (Instruction.Prec) i)
                .toList();
    }

    public List<Instruction.Post> postconditions() {
        return body.stream()
                .filter(i -> i instanceof Instruction.Post)
                .map(i -> (Instruction.Post) i)
                .toList();
    }
}
