package dev.btoropt.ir;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * LID to instruction index, one namespace per scope.
 *
 * <p>{@link #index} is lenient and is what validation passes use, so that they can report every
 * problem. {@link #build} is the resolver proper: it fails on the first duplicate or unresolved
 * reference.</p>
 */
public final class SymbolTable {
    /** Receives one reference problem at a time. */
    @FunctionalInterface
    public interface ProblemSink {
        void report(String scope, int lid, String message) throws BtorError;
    }

    private record Entry(Instruction inst, int position) {}

    private final Program program;
    private final Map<ScopedLid, Entry> entries = new HashMap<>();
    private final Map<ScopedLid, Integer> duplicates = new HashMap<>();

    private SymbolTable(Program program) {
        this.program = program;
        for (Map.Entry<String, List<Instruction>> scope : program.scopes().entrySet()) {
            List<Instruction> body = scope.getValue();
            for (int pos = 0; pos < body.size(); pos++) {
                Instruction inst = body.get(pos);
                ScopedLid key = new ScopedLid(scope.getKey(), inst.lid());
                if (entries.putIfAbsent(key, new Entry(inst, pos)) != null) {
                    duplicates.merge(key, 1, Integer::sum);
                }
            }
        }
    }

    /** Indexes without checking anything; the first declaration of a duplicated LID wins. */
    public static SymbolTable index(Program program) {
        return new SymbolTable(program);
    }

    /** Indexes and resolves every reference, failing on the first problem. */
    public static SymbolTable build(Program program) throws BtorError.UnresolvedReference {
        SymbolTable table = new SymbolTable(program);
        try {
            table.forEachProblem(
                    (scope, lid, message) -> {
                        throw new BtorError.UnresolvedReference(where(scope, lid) + message);
                    });
        } catch (BtorError.UnresolvedReference e) {
            throw e;
        } catch (BtorError e) {
            throw new IllegalStateException("unexpected error while resolving", e);
        }
        return table;
    }

    public Program program() {
        return program;
    }

    public Optional<Instruction> find(int lid, String scope) {
        Entry e = entries.get(new ScopedLid(scope, lid));
        return (e == null) ? Optional.empty() : Optional.of(e.inst());
    }

    public Instruction resolve(int lid, String scope) throws BtorError.UnresolvedReference {
        Entry e = entries.get(new ScopedLid(scope, lid));
        if (e == null) {
            throw new BtorError.UnresolvedReference(where(scope, 0) + "lid " + lid + " is not declared");
        }
        return e.inst();
    }

    public Instruction resolve(ScopedLid ref) throws BtorError.UnresolvedReference {
        return resolve(ref.lid(), ref.scope());
    }

    /** Position of {@code lid} in its scope's body, or -1. */
    public int position(int lid, String scope) {
        Entry e = entries.get(new ScopedLid(scope, lid));
        return (e == null) ? -1 : e.position();
    }

    /** The sort declared at {@code sid}, when {@code sid} is a sort. */
    public Optional<SortType> sortAt(int sid, String scope) {
        return find(sid, scope)
                .filter(i -> i instanceof Instruction.Sort)
                .map(i -> ((Instruction.Sort) i).type());
    }

    /** The sort of the value produced at {@code lid}, following {@code ref}s (and the outputs they name) across scopes. */
    public Optional<SortType> sortOfValue(int lid, String scope) {
        Optional<Instruction> inst = find(lid, scope);
        if (inst.isEmpty()) {
            return Optional.empty();
        }
        if (inst.get() instanceof Instruction.Ref r) {
            String target = ScopedLid.moduleScope(r.module());
            Optional<Instruction> t = find(r.target(), target);
            if (t.isPresent() && t.get() instanceof Instruction.Output out) {
                return sortOfValue(out.value(), target);
            }
            return sortOfValue(r.target(), target);
        }
        OptionalInt sid = inst.get().sortRef();
        return sid.isPresent() ? sortAt(sid.getAsInt(), scope) : Optional.empty();
    }

    /** Canonical structural spelling of a sort, e.g. {@code bv8} or {@code array(bv4,bv8)}. */
    public String describe(SortType type, String scope) {
        if (type instanceof SortType.BitVec bv) {
            return "bv" + bv.width();
        }
        SortType.Array a = (SortType.Array) type;
        String index = sortAt(a.indexSid(), scope).map(t -> describe(t, scope)).orElse("?" + a.indexSid());
        String element = sortAt(a.elementSid(), scope).map(t -> describe(t, scope)).orElse("?" + a.elementSid());
        return "array(" + index + "," + element + ")";
    }

    /** Width of a bit-vector sort, or -1 for arrays. */
    public static int width(SortType type) {
        return (type instanceof SortType.BitVec bv) ? bv.width() : -1;
    }

    /** Walks every scope and reports duplicates and unresolved or forward references. */
    public void forEachProblem(ProblemSink sink) throws BtorError {
        for (Map.Entry<ScopedLid, Integer> dup : duplicates.entrySet()) {
            sink.report(dup.getKey().scope(), dup.getKey().lid(), "lid declared more than once");
        }
        for (ContractDecl c : program.contracts()) {
            if (program.module(c.module()).isEmpty()) {
                sink.report(c.scope(), 0, "contract names undeclared module `" + c.module() + "`");
            }
        }
        for (Map.Entry<String, List<Instruction>> scope : program.scopes().entrySet()) {
            List<Instruction> body = scope.getValue();
            for (int pos = 0; pos < body.size(); pos++) {
                checkInstruction(scope.getKey(), pos, body.get(pos), sink);
            }
        }
    }

    private void checkInstruction(String scope, int pos, Instruction inst, ProblemSink sink) throws BtorError {
        OptionalInt sid = inst.sortRef();
        if (sid.isPresent()) {
            checkEarlier(scope, pos, inst, sid.getAsInt(), "sort", sink);
        }

        if (inst instanceof Instruction.Init || inst instanceof Instruction.Next) {
            List<Integer> args = inst.args();
            int state = args.get(0);
            Optional<Instruction> target = find(state, scope);
            if (target.isEmpty()) {
                sink.report(scope, inst.lid(), "state operand " + state + " is not declared");
            } else if (!(target.get() instanceof Instruction.State)) {
                sink.report(scope, inst.lid(), "operand " + state + " is a " + target.get().opcode() + ", not a state");
            }
            checkEarlier(scope, pos, inst, args.get(1), "value", sink);
            return;
        }

        if (inst instanceof Instruction.Ref r) {
            Optional<ModuleDecl> m = program.module(r.module());
            if (m.isEmpty()) {
                sink.report(scope, inst.lid(), "ref names undeclared module `" + r.module() + "`");
            } else if (scope.startsWith("contract:") && !scope.equals(ScopedLid.contractScope(r.module()))) {
                sink.report(scope, inst.lid(), "contract ref points outside its module, into `" + r.module() + "`");
            } else if (find(r.target(), m.get().scope()).isEmpty()) {
                sink.report(scope, inst.lid(), "module `" + r.module() + "` has no lid " + r.target());
            }
            return;
        }

        if (inst instanceof Instruction.Inst i) {
            if (program.module(i.module()).isEmpty()) {
                sink.report(scope, inst.lid(), "inst names undeclared module `" + i.module() + "`");
            }
            return;
        }

        if (inst instanceof Instruction.Set s) {
            checkSet(scope, pos, s, sink);
            return;
        }

        for (int arg : inst.args()) {
            checkEarlier(scope, pos, inst, arg, "operand", sink);
        }
    }

    private void checkSet(String scope, int pos, Instruction.Set s, ProblemSink sink) throws BtorError {
        checkEarlier(scope, pos, s, s.instance(), "instance", sink);
        checkEarlier(scope, pos, s, s.ref(), "ref", sink);
        checkEarlier(scope, pos, s, s.value(), "value", sink);

        Optional<Instruction> inst = find(s.instance(), scope);
        Optional<Instruction> ref = find(s.ref(), scope);
        if (inst.isEmpty() || ref.isEmpty()) {
            return;
        }
        if (!(inst.get() instanceof Instruction.Inst instance)) {
            sink.report(scope, s.lid(), "operand " + s.instance() + " is not an inst");
            return;
        }
        if (!(ref.get() instanceof Instruction.Ref r)) {
            sink.report(scope, s.lid(), "operand " + s.ref() + " is not a ref");
            return;
        }
        if (!r.module().equals(instance.module())) {
            sink.report(
                    scope,
                    s.lid(),
                    "ref " + s.ref() + " points into `" + r.module() + "` but the instance is of `"
                            + instance.module() + "`");
            return;
        }
        Optional<Instruction> target = find(r.target(), ScopedLid.moduleScope(r.module()));
        if (target.isPresent() && !(target.get() instanceof Instruction.Input)) {
            sink.report(
                    scope,
                    s.lid(),
                    "only inputs can be set, `" + r.module() + "` lid " + r.target() + " is a "
                            + target.get().opcode());
        }
    }

    private void checkEarlier(String scope, int pos, Instruction inst, int ref, String role, ProblemSink sink)
            throws BtorError {
        int refPos = position(ref, scope);
        if (refPos < 0) {
            sink.report(scope, inst.lid(), role + " " + ref + " is not declared");
        } else if (refPos >= pos) {
            sink.report(scope, inst.lid(), role + " " + ref + " is used before it is declared");
        }
    }

    static String where(String scope, int lid) {
        StringBuilder sb = new StringBuilder();
        if (!scope.isEmpty()) {
            sb.append(scope).append(' ');
        }
        if (lid != 0) {
            sb.append("lid ").append(lid);
        }
        if (sb.length() > 0) {
            sb.append(": ");
        }
        return sb.toString();
    }
}
