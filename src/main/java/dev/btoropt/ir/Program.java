package dev.btoropt.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

public final class Program {
    private final List<Instruction> body;
    private final List<ModuleDecl> modules;
    private final List<ContractDecl> contracts;

    private final NavigableMap<String, ModuleDecl> moduleIndex = new TreeMap<>();
    private final NavigableMap<String, ContractDecl> contractIndex = new TreeMap<>();

    public Program(List<Instruction> body, List<ModuleDecl> modules, List<ContractDecl> contracts) {
        this.body = List.copyOf(Objects.requireNonNull(body, "body"));
        this.modules = List.copyOf(Objects.requireNonNull(modules, "modules"));
        this.contracts = List.copyOf(Objects.requireNonNull(contracts, "contracts"));
        for (ModuleDecl m : this.modules) {
            if (moduleIndex.put(m.name(), m) != null) {
                throw new IllegalArgumentException("duplicate module name `" + m.name() + "`");
            }
        }
        for (ContractDecl c : this.contracts) {
            if (contractIndex.put(c.module(), c) != null) {
                throw new IllegalArgumentException("module `" + c.module() + "` has more than one contract");
            }
        }
    }

    public static Program flat(List<Instruction> body) {
        return new Program(body, List.of(), List.of());
    }

    public List<Instruction> body() {
        return body;
    }

    public List<ModuleDecl> modules() {
        return modules;
    }

    public List<ContractDecl> contracts() {
        return contracts;
    }

    public Optional<ModuleDecl> module(String name) {
        return Optional.ofNullable(moduleIndex.get(name));
    }

    public Optional<ContractDecl> contract(String module) {
        return Optional.ofNullable(contractIndex.get(module));
    }

    public Program withBody(List<Instruction> newBody) {
        return new Program(newBody, modules, contracts);
    }

    /** No modules, no contracts and no extension instructions anywhere. */
    public boolean isFlat() {
        return modules.isEmpty()
                && contracts.isEmpty()
                && body.stream().noneMatch(Instruction::isExtension);
    }

    /** Every scope with its body: modules, then contracts, then the top level. */
    public Map<String, List<Instruction>> scopes() {
        Map<String, List<Instruction>> out = new LinkedHashMap<>();
        for (ModuleDecl m : modules) {
            out.put(m.scope(), m.body());
        }
        for (ContractDecl c : contracts) {
            out.put(c.scope(), c.body());
        }
        out.put(ScopedLid.TOP, body);
        return Collections.unmodifiableMap(out);
    }

    public int maxLid() {
        int max = 0;
        for (Instruction inst : body) {
            max = Math.max(max, inst.lid());
        }
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Program p)) {
            return false;
        }
        return body.equals(p.body) && modules.equals(p.modules) && contracts.equals(p.contracts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(body, modules, contracts);
    }

    @Override
    public String toString() {
        return "Program[body=" + body.size() + ", modules=" + modules.size() + ", contracts=" + contracts.size() + "]";
    }
}
