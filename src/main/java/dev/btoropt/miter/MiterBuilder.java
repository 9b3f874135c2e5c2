package dev.btoropt.miter;

import dev.btoropt.ir.BinaryOp;
import dev.btoropt.ir.BtorError;
import dev.btoropt.ir.Instruction;
import dev.btoropt.ir.Program;
import dev.btoropt.ir.ScopedLid;
import dev.btoropt.ir.SortType;
import dev.btoropt.ir.SymbolTable;
import dev.btoropt.passes.Relabeling;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Merges two flat circuits into one whose {@code bad} properties fire when the circuits disagree.
 *
 * <p>B is shifted past A's largest LID. Inputs with the same symbol are unified (B's uses point at
 * A's input). For every output symbol both sides declare, a {@code neq} of the two output values
 * feeds a new {@code bad}. A's outputs are kept, B's matched outputs are dropped, and everything
 * else from both sides stays. The result is renumbered from 1.</p>
 */
public final class MiterBuilder {
    private MiterBuilder() {}

    public static Program build(Program a, Program b) throws BtorError {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (!a.isFlat() || !b.isFlat()) {
            throw new IllegalArgumentException("miter inputs must be flat; run lower-modules first");
        }

        int offset = add(a.maxLid(), 1);
        int last = add(offset, b.maxLid());
        Program shifted = Program.flat(Relabeling.shift(b.body(), offset));
        SymbolTable ta = SymbolTable.build(a);
        SymbolTable tb = SymbolTable.build(shifted);

        Map<String, Instruction.Input> inputsA = named(a.body(), Instruction.Input.class);
        Map<String, Instruction.Input> inputsB = named(shifted.body(), Instruction.Input.class);
        Map<String, Instruction.Output> outputsA = named(a.body(), Instruction.Output.class);
        Map<String, Instruction.Output> outputsB = named(shifted.body(), Instruction.Output.class);

        Map<Integer, Integer> redirect = new HashMap<>();
        for (Map.Entry<String, Instruction.Input> e : inputsB.entrySet()) {
            Instruction.Input inA = inputsA.get(e.getKey());
            if (inA == null) {
                continue;
            }
            Instruction.Input inB = e.getValue();
            requireSameSort(
                    "input",
                    e.getKey(),
                    ta,
                    ta.sortAt(inA.sid(), ScopedLid.TOP),
                    tb,
                    tb.sortAt(inB.sid(), ScopedLid.TOP));
            redirect.put(inB.lid(), inA.lid());
        }

        List<String> sharedOutputs = new ArrayList<>();
        Set<Integer> droppedOutputs = new HashSet<>();
        for (Map.Entry<String, Instruction.Output> e : outputsA.entrySet()) {
            Instruction.Output outB = outputsB.get(e.getKey());
            if (outB == null) {
                continue;
            }
            requireSameSort(
                    "output",
                    e.getKey(),
                    ta,
                    ta.sortOfValue(e.getValue().value(), ScopedLid.TOP),
                    tb,
                    tb.sortOfValue(outB.value(), ScopedLid.TOP));
            sharedOutputs.add(e.getKey());
            droppedOutputs.add(outB.lid());
        }

        if (redirect.isEmpty() && sharedOutputs.isEmpty()) {
            throw new BtorError.DisjointInterface("the two circuits share no input or output name");
        }

        List<Instruction> merged = new ArrayList<>(a.body());
        for (Instruction inst : shifted.body()) {
            if (redirect.containsKey(inst.lid()) || droppedOutputs.contains(inst.lid())) {
                continue;
            }
            merged.add(inst.relabel(lid -> redirect.getOrDefault(lid, lid)));
        }

        Integer bool = boolSort(a.body());
        if (bool == null && !sharedOutputs.isEmpty()) {
            last = add(last, 1);
            bool = last;
            merged.add(new Instruction.Sort(bool, new SortType.BitVec(1)));
        }
        for (String name : sharedOutputs) {
            int valueA = outputsA.get(name).value();
            int valueB = redirect.getOrDefault(outputsB.get(name).value(), outputsB.get(name).value());
            int neq = add(last, 1);
            last = add(neq, 1);
            merged.add(new Instruction.Binary(neq, BinaryOp.NEQ, bool, valueA, valueB, null));
            merged.add(new Instruction.Bad(last, neq, null));
        }
        return Program.flat(Relabeling.renumber(merged));
    }

    private static int add(int lid, int delta) throws BtorError.LidOverflow {
        try {
            return Math.addExact(lid, delta);
        } catch (ArithmeticException e) {
            throw new BtorError.LidOverflow("lid " + lid + " + " + delta + " does not fit in a 32-bit lid");
        }
    }

    private static <T extends Instruction> Map<String, T> named(List<Instruction> body, Class<T> kind) {
        Map<String, T> out = new LinkedHashMap<>();
        for (Instruction inst : body) {
            if (kind.isInstance(inst) && inst.symbol() != null) {
                out.putIfAbsent(inst.symbol(), kind.cast(inst));
            }
        }
        return out;
    }

    private static Integer boolSort(List<Instruction> body) {
        for (Instruction inst : body) {
            if (inst instanceof Instruction.Sort s
                    && s.type() instanceof SortType.BitVec bv
                    && bv.width() == 1) {
                return s.lid();
            }
        }
        return null;
    }

    private static void requireSameSort(
            String kind,
            String name,
            SymbolTable ta,
            Optional<SortType> sortA,
            SymbolTable tb,
            Optional<SortType> sortB)
            throws BtorError.SortMismatch {
        String da = sortA.map(t -> ta.describe(t, ScopedLid.TOP)).orElse("?");
        String db = sortB.map(t -> tb.describe(t, ScopedLid.TOP)).orElse("?");
        if (!da.equals(db)) {
            throw new BtorError.SortMismatch(kind + " `" + name + "` is " + da + " in the first circuit and " + db
                    + " in the second");
        }
    }
}
