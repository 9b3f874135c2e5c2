package dev.btoropt.passes;

import dev.btoropt.ir.BinaryOp;
import dev.btoropt.ir.Diagnostic;
import dev.btoropt.ir.Instruction;
import dev.btoropt.ir.Program;
import dev.btoropt.ir.ScopedLid;
import dev.btoropt.ir.SortType;
import dev.btoropt.ir.SymbolTable;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Sort compatibility of every instruction.
 *
 * <pre>
 * not, inc, dec, neg          result = operand
 * redand, redor, redxor       operand bit-vector, result bv1
 * add .. xor, shifts          lhs = rhs = result
 * eq, neq, comparisons        lhs = rhs, result bv1
 * concat                      result width = lhs width + rhs width
 * implies, iff                all bv1
 * ite                         condition bv1, then = else = result
 * slice u l                   u &lt; operand width, result width = u - l + 1
 * uext/sext n                 result width = operand width + n
 * init, next                  sid = state sort; value = sid (init: or the array element sort)
 * bad, constraint, prec, post condition bv1
 * constants                   bit-vector sort, value fits the width
 * </pre>
 *
 * Operands that do not resolve are skipped here; {@code check-references} reports them.
 */
public final class CheckSorts implements Validation {
    public static final String NAME = "check-sorts";

    private static final int MAX_REF_CHAIN = 64;

    /** A sort together with the scope its sids live in. */
    private record Typed(SortType type, String scope) {
        int width() {
            return SymbolTable.width(type);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Diagnostic> check(Program program) {
        SymbolTable table = SymbolTable.index(program);
        List<Diagnostic> out = new ArrayList<>();
        for (Map.Entry<String, List<Instruction>> scope : program.scopes().entrySet()) {
            for (Instruction inst : scope.getValue()) {
                new Checker(table, scope.getKey(), inst, out).run();
            }
        }
        return out;
    }

    private static final class Checker {
        private final SymbolTable table;
        private final String scope;
        private final Instruction inst;
        private final List<Diagnostic> out;

        Checker(SymbolTable table, String scope, Instruction inst, List<Diagnostic> out) {
            this.table = table;
            this.scope = scope;
            this.inst = inst;
            this.out = out;
        }

        void run() {
            if (inst instanceof Instruction.Sort s) {
                if (s.type() instanceof SortType.Array a) {
                    requireSort(a.indexSid(), "index");
                    requireSort(a.elementSid(), "element");
                }
                return;
            }
            Typed result = null;
            OptionalInt sid = inst.sortRef();
            if (sid.isPresent()) {
                result = requireSort(sid.getAsInt(), "sid");
                if (result == null) {
                    return;
                }
            }

            if (inst instanceof Instruction.Output o) {
                valueSort(o.value());
            } else if (inst instanceof Instruction.Bad b) {
                requireBool(b.cond(), "condition");
            } else if (inst instanceof Instruction.Constraint c) {
                requireBool(c.cond(), "condition");
            } else if (inst instanceof Instruction.Prec p) {
                requireBool(p.cond(), "precondition");
            } else if (inst instanceof Instruction.Post p) {
                requireBool(p.cond(), "postcondition");
            } else if (inst instanceof Instruction.Zero
                    || inst instanceof Instruction.One
                    || inst instanceof Instruction.Ones) {
                requireBitVec(result, "constant");
            } else if (inst instanceof Instruction.ConstDecimal c) {
                checkLiteral(result, c.value(), true);
            } else if (inst instanceof Instruction.ConstHex c) {
                checkLiteral(result, c.value(), false);
            } else if (inst instanceof Instruction.ConstBinary c) {
                checkLiteral(result, c.value(), false);
            } else if (inst instanceof Instruction.Init i) {
                checkStateUpdate(result, i.state(), i.value(), true);
            } else if (inst instanceof Instruction.Next n) {
                checkStateUpdate(result, n.state(), n.value(), false);
            } else if (inst instanceof Instruction.Not n) {
                requireBitVec(result, "result");
                requireSame(n.operand(), result, "operand");
            } else if (inst instanceof Instruction.Unary u) {
                requireBitVec(result, "result");
                if (u.op().isReduction()) {
                    requireWidth(result, 1, "result");
                    valueSort(u.operand()).ifPresent(t -> requireBitVec(t, "operand"));
                } else {
                    requireSame(u.operand(), result, "operand");
                }
            } else if (inst instanceof Instruction.Binary b) {
                checkBinary(b, result);
            } else if (inst instanceof Instruction.Implies i) {
                requireWidth(result, 1, "result");
                requireBool(i.a(), "lhs");
                requireBool(i.b(), "rhs");
            } else if (inst instanceof Instruction.Iff i) {
                requireWidth(result, 1, "result");
                requireBool(i.a(), "lhs");
                requireBool(i.b(), "rhs");
            } else if (inst instanceof Instruction.Ite i) {
                requireBool(i.cond(), "condition");
                requireSame(i.then(), result, "then");
                requireSame(i.otherwise(), result, "else");
            } else if (inst instanceof Instruction.Slice s) {
                checkSlice(s, result);
            } else if (inst instanceof Instruction.Uext e) {
                checkExtension(e.operand(), e.width(), result);
            } else if (inst instanceof Instruction.Sext e) {
                checkExtension(e.operand(), e.width(), result);
            }
        }

        private void checkBinary(Instruction.Binary b, Typed result) {
            if (b.op().shape() == BinaryOp.Shape.SAME) {
                requireBitVec(result, "result");
                requireSame(b.a(), result, "lhs");
                requireSame(b.b(), result, "rhs");
                return;
            }
            Optional<Typed> lhs = valueSort(b.a());
            Optional<Typed> rhs = valueSort(b.b());
            switch (b.op().shape()) {
                case COMPARE -> {
                    requireWidth(result, 1, "result");
                    if (lhs.isPresent() && rhs.isPresent() && !same(lhs.get(), rhs.get())) {
                        report("operands are " + describe(lhs.get()) + " and " + describe(rhs.get()));
                    }
                }
                case CONCAT -> {
                    requireBitVec(result, "result");
                    if (lhs.isPresent() && rhs.isPresent()) {
                        int wa = lhs.get().width();
                        int wb = rhs.get().width();
                        if (wa < 0 || wb < 0) {
                            report("concat operands must be bit-vectors");
                        } else if (result.width() != wa + wb) {
                            report("concat of bv" + wa + " and bv" + wb + " has result " + describe(result));
                        }
                    }
                }
            }
        }

        private void checkSlice(Instruction.Slice s, Typed result) {
            requireBitVec(result, "result");
            Optional<Typed> operand = valueSort(s.operand());
            if (operand.isEmpty()) {
                return;
            }
            int w = operand.get().width();
            if (w < 0) {
                report("slice operand must be a bit-vector");
                return;
            }
            if (s.upper() >= w) {
                report("slice upper bit " + s.upper() + " is out of range for bv" + w);
            }
            int expected = s.upper() - s.lower() + 1;
            if (result.width() >= 0 && result.width() != expected) {
                report("slice [" + s.upper() + ":" + s.lower() + "] has width " + expected + ", result is "
                        + describe(result));
            }
        }

        private void checkExtension(int operandLid, int by, Typed result) {
            requireBitVec(result, "result");
            Optional<Typed> operand = valueSort(operandLid);
            if (operand.isEmpty() || result.width() < 0) {
                return;
            }
            int w = operand.get().width();
            if (w < 0) {
                report("extension operand must be a bit-vector");
            } else if (result.width() != w + by) {
                report("extending bv" + w + " by " + by + " gives bv" + (w + by) + ", result is " + describe(result));
            }
        }

        private void checkStateUpdate(Typed sid, int stateLid, int valueLid, boolean init) {
            Optional<Typed> state = valueSort(stateLid);
            if (state.isPresent() && !same(state.get(), sid)) {
                report("state " + stateLid + " is " + describe(state.get()) + ", sid is " + describe(sid));
            }
            Optional<Typed> value = valueSort(valueLid);
            if (value.isEmpty() || same(value.get(), sid)) {
                return;
            }
            if (init && sid.type() instanceof SortType.Array a) {
                Optional<SortType> element = table.sortAt(a.elementSid(), sid.scope());
                if (element.isPresent() && same(value.get(), new Typed(element.get(), sid.scope()))) {
                    return;
                }
            }
            report("value " + valueLid + " is " + describe(value.get()) + ", sid is " + describe(sid));
        }

        private void checkLiteral(Typed sort, BigInteger value, boolean signedAllowed) {
            if (!requireBitVec(sort, "constant")) {
                return;
            }
            int w = sort.width();
            boolean fits;
            if (value.signum() < 0) {
                fits = signedAllowed && value.compareTo(BigInteger.ONE.shiftLeft(w - 1).negate()) >= 0;
            } else {
                fits = value.bitLength() <= w;
            }
            if (!fits) {
                report("constant " + value + " does not fit in bv" + w);
            }
        }

        private Typed requireSort(int sid, String role) {
            Optional<Instruction> target = table.find(sid, scope);
            if (target.isEmpty()) {
                return null;
            }
            if (!(target.get() instanceof Instruction.Sort s)) {
                report(role + " " + sid + " is a " + target.get().opcode() + ", not a sort");
                return null;
            }
            return new Typed(s.type(), scope);
        }

        private boolean requireBitVec(Typed t, String role) {
            if (t.width() < 0) {
                report(role + " must be a bit-vector, found " + describe(t));
                return false;
            }
            return true;
        }

        private void requireWidth(Typed t, int width, String role) {
            if (t.width() != width) {
                report(role + " must be bv" + width + ", found " + describe(t));
            }
        }

        private void requireBool(int lid, String role) {
            valueSort(lid).ifPresent(t -> requireWidth(t, 1, role + " " + lid));
        }

        private void requireSame(int lid, Typed expected, String role) {
            Optional<Typed> actual = valueSort(lid);
            if (actual.isPresent() && !same(actual.get(), expected)) {
                report(role + " " + lid + " is " + describe(actual.get()) + ", expected " + describe(expected));
            }
        }

        /**
         * Sort of the value at {@code lid}, following {@code ref}s into their module; a {@code ref}
         * to an {@code output} stands for the output's value. Reports operands that are not values.
         */
        private Optional<Typed> valueSort(int lid) {
            return valueSort(lid, scope, 0, false);
        }

        private Optional<Typed> valueSort(int lid, String in, int depth, boolean viaRef) {
            Optional<Instruction> found = table.find(lid, in);
            if (found.isEmpty() || depth > MAX_REF_CHAIN) {
                return Optional.empty();
            }
            Instruction target = found.get();
            if (target instanceof Instruction.Ref r) {
                return valueSort(r.target(), ScopedLid.moduleScope(r.module()), depth + 1, true);
            }
            if (viaRef && target instanceof Instruction.Output o) {
                return valueSort(o.value(), in, depth + 1, false);
            }
            if (!producesValue(target)) {
                String where = in.equals(scope) ? "" : " of " + in;
                report("operand " + lid + where + " is a `" + target.opcode() + "`, not a value");
                return Optional.empty();
            }
            return table.sortAt(target.sortRef().getAsInt(), in).map(t -> new Typed(t, in));
        }

        private static boolean producesValue(Instruction inst) {
            return inst.sortRef().isPresent()
                    && !(inst instanceof Instruction.Init)
                    && !(inst instanceof Instruction.Next);
        }

        private boolean same(Typed a, Typed b) {
            return describe(a).equals(describe(b));
        }

        private String describe(Typed t) {
            return table.describe(t.type(), t.scope());
        }

        private void report(String message) {
            out.add(new Diagnostic(NAME, scope, inst.lid(), message));
        }
    }
}
