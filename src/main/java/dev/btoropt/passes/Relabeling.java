package dev.btoropt.passes;

import dev.btoropt.ir.BtorError;
import dev.btoropt.ir.ContractDecl;
import dev.btoropt.ir.Instruction;
import dev.btoropt.ir.ModuleDecl;
import dev.btoropt.ir.Program;
import dev.btoropt.ir.ScopedLid;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

public final class Relabeling {
    private Relabeling() {}

    /** Adds {@code offset} to every LID and every local reference. */
    public static List<Instruction> shift(List<Instruction> body, int offset) {
        List<Instruction> out = new ArrayList<>(body.size());
        for (Instruction inst : body) {
            out.add(inst.relabel(lid -> lid + offset));
        }
        return out;
    }

    /** Maps LIDs through {@code table}; every LID and local reference must be in it. */
    public static List<Instruction> apply(List<Instruction> body, Map<Integer, Integer> table, String scope)
            throws BtorError.UnresolvedReference {
        List<Instruction> out = new ArrayList<>(body.size());
        for (Instruction inst : body) {
            requireMapped(inst, table, scope);
            out.add(inst.relabel(lid -> table.get(lid)));
        }
        return out;
    }

    /** Contiguous LIDs from 1 in body order. */
    public static List<Instruction> renumber(List<Instruction> body) throws BtorError.UnresolvedReference {
        return apply(body, positions(body), ScopedLid.TOP);
    }

    /**
     * Renumbers the given scopes of a program. {@code ref}s anywhere in the program that point
     * into a renumbered module follow their target.
     */
    public static Program renumber(Program program, Set<String> scopes) throws BtorError.UnresolvedReference {
        Map<String, Map<Integer, Integer>> tables = new HashMap<>();
        for (Map.Entry<String, List<Instruction>> scope : program.scopes().entrySet()) {
            if (scopes.contains(scope.getKey())) {
                tables.put(scope.getKey(), positions(scope.getValue()));
            }
        }

        List<ModuleDecl> modules = new ArrayList<>(program.modules().size());
        for (ModuleDecl m : program.modules()) {
            modules.add(new ModuleDecl(m.name(), rewriteScope(m.scope(), m.body(), tables)));
        }
        List<ContractDecl> contracts = new ArrayList<>(program.contracts().size());
        for (ContractDecl c : program.contracts()) {
            contracts.add(new ContractDecl(c.module(), rewriteScope(c.scope(), c.body(), tables)));
        }
        List<Instruction> body = rewriteScope(ScopedLid.TOP, program.body(), tables);
        return new Program(body, modules, contracts);
    }

    public static Program renumberAll(Program program) throws BtorError.UnresolvedReference {
        return renumber(program, program.scopes().keySet());
    }

    private static List<Instruction> rewriteScope(
            String scope, List<Instruction> body, Map<String, Map<Integer, Integer>> tables)
            throws BtorError.UnresolvedReference {
        Map<Integer, Integer> local = tables.get(scope);
        List<Instruction> out = (local == null) ? new ArrayList<>(body) : apply(body, local, scope);
        for (int i = 0; i < out.size(); i++) {
            if (out.get(i) instanceof Instruction.Ref r) {
                Map<Integer, Integer> target = tables.get(ScopedLid.moduleScope(r.module()));
                if (target == null) {
                    continue;
                }
                Integer mapped = target.get(r.target());
                if (mapped == null) {
                    throw new BtorError.UnresolvedReference(
                            describe(scope, r.lid()) + "ref target " + r.target() + " is not declared in module `"
                                    + r.module() + "`");
                }
                out.set(i, new Instruction.Ref(r.lid(), r.module(), mapped));
            }
        }
        return out;
    }

    private static Map<Integer, Integer> positions(List<Instruction> body) throws BtorError.UnresolvedReference {
        Map<Integer, Integer> table = new HashMap<>();
        for (int i = 0; i < body.size(); i++) {
            if (table.put(body.get(i).lid(), i + 1) != null) {
                throw new BtorError.UnresolvedReference("lid " + body.get(i).lid() + " is declared more than once");
            }
        }
        return table;
    }

    private static void requireMapped(Instruction inst, Map<Integer, Integer> table, String scope)
            throws BtorError.UnresolvedReference {
        if (!table.containsKey(inst.lid())) {
            throw new BtorError.UnresolvedReference(describe(scope, inst.lid()) + "lid has no new label");
        }
        OptionalInt sid = inst.sortRef();
        if (sid.isPresent() && !table.containsKey(sid.getAsInt())) {
            throw new BtorError.UnresolvedReference(
                    describe(scope, inst.lid()) + "sort " + sid.getAsInt() + " is not declared");
        }
        for (int arg : inst.args()) {
            if (!table.containsKey(arg)) {
                throw new BtorError.UnresolvedReference(
                        describe(scope, inst.lid()) + "operand " + arg + " is not declared");
            }
        }
    }

    private static String describe(String scope, int lid) {
        return (scope.isEmpty() ? "" : scope + " ") + "lid " + lid + ": ";
    }
}
