package dev.btoropt.passes;

import dev.btoropt.ir.BtorError;
import dev.btoropt.ir.ContractDecl;
import dev.btoropt.ir.Instruction;
import dev.btoropt.ir.ModuleDecl;
import dev.btoropt.ir.Program;
import dev.btoropt.ir.ScopedLid;
import dev.btoropt.ir.SortType;
import dev.btoropt.ir.SymbolTable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Lowers a modular program to plain BTOR2.
 *
 * <p>The top-level body (if any) is copied first, then the root module is expanded: the last
 * declared module that no other module instantiates. Each {@code inst} becomes a clone of the
 * module body with fresh LIDs; inputs bound by {@code set} are replaced by the bound value. A
 * {@code ref} follows the latest preceding {@code inst} of its module, or, when there is none,
 * inlines the referenced definition at first use.</p>
 *
 * <p>Contracts follow the assume/guarantee pattern. For the root module a precondition becomes a
 * {@code constraint} and a postcondition a {@code bad} on its negation; for an instance the two
 * are swapped.</p>
 *
 * <p>Flat programs are returned unchanged.</p>
 */
public final class LowerModules implements Transform {
    public static final String NAME = "lower-modules";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Program run(Program program) throws BtorError {
        if (program.isFlat()) {
            return program;
        }
        SymbolTable table = SymbolTable.build(program);
        return new Lowering(program, table).lower();
    }

    private enum Role {
        ROOT,
        INSTANCE
    }

    /** One body being copied into the flat output, with its local-to-flat LID table. */
    private static final class Clone {
        final String scope;
        final List<Instruction> body;
        final Role role;
        /** Set for contract bodies: the module clone their refs point into. */
        final Clone owner;

        final Map<Integer, Integer> remap = new HashMap<>();
        final Set<Integer> bound = new HashSet<>();
        final Map<Integer, Clone> instances = new HashMap<>();
        final Map<Integer, Integer> refInstance = new HashMap<>();

        Clone(String scope, List<Instruction> body, Role role, Clone owner) {
            this.scope = scope;
            this.body = body;
            this.role = role;
            this.owner = owner;
        }
    }

    private static final class Lowering {
        private final Program program;
        private final SymbolTable table;

        private final List<Instruction> out = new ArrayList<>();
        private final Map<Integer, Integer> bitVecSorts = new HashMap<>();
        private final Map<String, Clone> direct = new HashMap<>();
        private final Set<ScopedLid> inlining = new HashSet<>();
        private final Deque<String> active = new ArrayDeque<>();
        private int nextLid = 1;

        Lowering(Program program, SymbolTable table) {
            this.program = program;
            this.table = table;
        }

        Program lower() throws BtorError {
            if (!program.body().isEmpty()) {
                emitBody(new Clone(ScopedLid.TOP, program.body(), Role.ROOT, null));
            }
            ModuleDecl root = root();
            if (root != null) {
                cloneModule(root, Map.of(), Role.ROOT);
            }
            return Program.flat(Relabeling.renumber(out));
        }

        private ModuleDecl root() throws BtorError.UnresolvedReference {
            if (program.modules().isEmpty()) {
                return null;
            }
            Set<String> instantiated = new HashSet<>();
            for (ModuleDecl m : program.modules()) {
                for (Instruction inst : m.body()) {
                    if (inst instanceof Instruction.Inst i) {
                        instantiated.add(i.module());
                    }
                }
            }
            ModuleDecl root = null;
            for (ModuleDecl m : program.modules()) {
                if (!instantiated.contains(m.name())) {
                    root = m;
                }
            }
            if (root == null) {
                throw new BtorError.UnresolvedReference("no root module: every module is instantiated by another");
            }
            return root;
        }

        private int fresh() {
            return nextLid++;
        }

        private Clone cloneModule(ModuleDecl m, Map<Integer, Integer> bindings, Role role) throws BtorError {
            if (active.contains(m.name())) {
                throw new BtorError.UnresolvedReference(
                        "module `" + m.name() + "` instantiates itself through " + String.join(" <- ", active));
            }
            active.push(m.name());
            Clone c = new Clone(m.scope(), m.body(), role, null);
            for (Map.Entry<Integer, Integer> b : bindings.entrySet()) {
                c.remap.put(b.getKey(), b.getValue());
                c.bound.add(b.getKey());
            }
            emitBody(c);
            ContractDecl contract = program.contract(m.name()).orElse(null);
            if (contract != null) {
                emitBody(new Clone(contract.scope(), contract.body(), role, c));
            }
            active.pop();
            return c;
        }

        private void emitBody(Clone c) throws BtorError {
            Map<String, Integer> latestInst = new HashMap<>();
            Map<Integer, Integer> lastSet = new HashMap<>();
            for (int pos = 0; pos < c.body.size(); pos++) {
                Instruction inst = c.body.get(pos);
                if (inst instanceof Instruction.Inst i) {
                    latestInst.put(i.module(), i.lid());
                } else if (inst instanceof Instruction.Ref r && c.owner == null) {
                    Integer instLid = latestInst.get(r.module());
                    if (instLid != null) {
                        c.refInstance.put(r.lid(), instLid);
                    }
                } else if (inst instanceof Instruction.Set s) {
                    lastSet.put(s.instance(), pos);
                }
            }

            for (int pos = 0; pos < c.body.size(); pos++) {
                Instruction inst = c.body.get(pos);
                if (inst instanceof Instruction.Inst i) {
                    // Instances with bound inputs are expanded at their last `set`.
                    if (!lastSet.containsKey(i.lid())) {
                        c.instances.put(i.lid(), cloneModule(module(i.module()), Map.of(), Role.INSTANCE));
                    }
                } else if (inst instanceof Instruction.Set s) {
                    if (lastSet.get(s.instance()) == pos) {
                        Instruction.Inst i = (Instruction.Inst) table.resolve(s.instance(), c.scope);
                        Map<Integer, Integer> bindings = bindings(c, s.instance());
                        c.instances.put(s.instance(), cloneModule(module(i.module()), bindings, Role.INSTANCE));
                    }
                } else if (inst instanceof Instruction.Ref) {
                    // resolved at first use
                } else if (inst instanceof Instruction.Prec p) {
                    int cond = flat(c, p.cond());
                    if (c.role == Role.ROOT) {
                        assume(cond);
                    } else {
                        assertHolds(cond);
                    }
                } else if (inst instanceof Instruction.Post p) {
                    int cond = flat(c, p.cond());
                    if (c.role == Role.ROOT) {
                        assertHolds(cond);
                    } else {
                        assume(cond);
                    }
                } else if (inst instanceof Instruction.Input in && c.bound.contains(in.lid())) {
                    // replaced by the value bound with `set`
                } else if (inst instanceof Instruction.Output && c.role == Role.INSTANCE) {
                    // instance outputs are internal signals once flattened
                } else {
                    Map<Integer, Integer> deps = new HashMap<>();
                    OptionalInt sid = inst.sortRef();
                    if (sid.isPresent()) {
                        deps.put(sid.getAsInt(), flat(c, sid.getAsInt()));
                    }
                    for (int arg : inst.args()) {
                        deps.put(arg, flat(c, arg));
                    }
                    place(c, inst, deps);
                }
            }
        }

        private Map<Integer, Integer> bindings(Clone c, int instLid) throws BtorError {
            Map<Integer, Integer> out = new HashMap<>();
            for (Instruction inst : c.body) {
                if (!(inst instanceof Instruction.Set s) || s.instance() != instLid) {
                    continue;
                }
                Instruction.Ref ref = (Instruction.Ref) table.resolve(s.ref(), c.scope);
                if (out.put(ref.target(), flat(c, s.value())) != null) {
                    throw new BtorError.UnresolvedReference(
                            c.scope + " lid " + s.lid() + ": input " + ref.target() + " of instance " + instLid
                                    + " is set more than once");
                }
            }
            return out;
        }

        /** Flat LID of local {@code lid}; states may be reserved before they are placed. */
        private int flat(Clone c, int lid) throws BtorError {
            Integer mapped = c.remap.get(lid);
            if (mapped != null) {
                return mapped;
            }
            Instruction target = table.resolve(lid, c.scope);
            if (target instanceof Instruction.State) {
                int reserved = fresh();
                c.remap.put(lid, reserved);
                return reserved;
            }
            if (target instanceof Instruction.Ref ref) {
                int value;
                if (c.owner != null) {
                    value = flat(c.owner, refTarget(ref));
                } else {
                    Integer instLid = c.refInstance.get(lid);
                    if (instLid == null) {
                        value = inline(ref.module(), refTarget(ref));
                    } else {
                        Clone instance = c.instances.get(instLid);
                        if (instance == null) {
                            throw new BtorError.UnresolvedReference(
                                    c.scope + " lid " + lid + ": ref is used before instance " + instLid
                                            + " has all of its inputs set");
                        }
                        value = flat(instance, refTarget(ref));
                    }
                }
                c.remap.put(lid, value);
                return value;
            }
            throw new BtorError.UnresolvedReference(
                    c.scope + " lid " + lid + ": used before it is declared");
        }

        /** A {@code ref} to an {@code output} stands for the output's value. */
        private int refTarget(Instruction.Ref ref) throws BtorError.UnresolvedReference {
            Instruction target = table.resolve(ref.target(), ScopedLid.moduleScope(ref.module()));
            return (target instanceof Instruction.Output out) ? out.value() : ref.target();
        }

        /** Copies one definition of a module referenced without an instance, with its operands. */
        private int inline(String moduleName, int lid) throws BtorError {
            Clone d = direct.get(moduleName);
            if (d == null) {
                ModuleDecl m = module(moduleName);
                d = new Clone(m.scope(), m.body(), Role.INSTANCE, null);
                direct.put(moduleName, d);
            }
            Integer mapped = d.remap.get(lid);
            if (mapped != null) {
                return mapped;
            }

            ScopedLid key = new ScopedLid(d.scope, lid);
            if (!inlining.add(key)) {
                throw new BtorError.UnresolvedReference("reference cycle through " + key);
            }
            Instruction target = table.resolve(lid, d.scope);
            int value;
            if (target instanceof Instruction.Ref ref) {
                value = inline(ref.module(), refTarget(ref));
                d.remap.put(lid, value);
            } else if (target.isExtension() || target instanceof Instruction.Output) {
                throw new BtorError.UnresolvedReference(
                        key + ": a `" + target.opcode() + "` cannot be referenced without an instance");
            } else {
                Map<Integer, Integer> deps = new HashMap<>();
                OptionalInt sid = target.sortRef();
                if (sid.isPresent()) {
                    deps.put(sid.getAsInt(), inline(moduleName, sid.getAsInt()));
                }
                for (int arg : target.args()) {
                    deps.put(arg, inline(moduleName, arg));
                }
                value = place(d, target, deps);
            }
            inlining.remove(key);
            return value;
        }

        /** Appends {@code inst} with its operands mapped through {@code deps}; returns its flat LID. */
        private int place(Clone c, Instruction inst, Map<Integer, Integer> deps) {
            if (inst instanceof Instruction.Sort s && s.type() instanceof SortType.BitVec bv) {
                Integer existing = bitVecSorts.get(bv.width());
                if (existing != null) {
                    c.remap.put(s.lid(), existing);
                    return existing;
                }
            }
            Integer reserved = c.remap.get(inst.lid());
            int own = (reserved != null) ? reserved : fresh();
            c.remap.put(inst.lid(), own);
            int self = inst.lid();
            out.add(inst.relabel(l -> (l == self) ? own : deps.get(l)));
            if (inst instanceof Instruction.Sort s && s.type() instanceof SortType.BitVec bv) {
                bitVecSorts.put(bv.width(), own);
            }
            return own;
        }

        private int boolSort() {
            Integer sid = bitVecSorts.get(1);
            if (sid != null) {
                return sid;
            }
            int lid = fresh();
            out.add(new Instruction.Sort(lid, new SortType.BitVec(1)));
            bitVecSorts.put(1, lid);
            return lid;
        }

        private void assume(int cond) {
            out.add(new Instruction.Constraint(fresh(), cond, null));
        }

        private void assertHolds(int cond) {
            int sid = boolSort();
            int not = fresh();
            out.add(new Instruction.Not(not, sid, cond, null));
            out.add(new Instruction.Bad(fresh(), not, null));
        }

        private ModuleDecl module(String name) throws BtorError.UnresolvedReference {
            ModuleDecl m = program.module(name).orElse(null);
            if (m == null) {
                throw new BtorError.UnresolvedReference("module `" + name + "` is not declared");
            }
            return m;
        }
    }
}
