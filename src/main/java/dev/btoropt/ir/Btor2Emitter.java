package dev.btoropt.ir;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class Btor2Emitter {
    private final StringBuilder out = new StringBuilder();

    String emit(Program program) {
        for (ModuleDecl m : program.modules()) {
            out.append("module ").append(m.name()).append(" {\n");
            writeBody(m.body());
            out.append("}\n");
        }
        for (ContractDecl c : program.contracts()) {
            out.append("contract ").append(c.module()).append(" {\n");
            writeBody(c.body());
            out.append("}\n");
        }
        writeBody(program.body());
        return out.toString();
    }

    private void writeBody(List<Instruction> body) {
        // Binary literals are padded to their sort width, which is only known per scope.
        Map<Integer, Integer> widths = new HashMap<>();
        for (Instruction inst : body) {
            if (inst instanceof Instruction.Sort s && s.type() instanceof SortType.BitVec bv) {
                widths.put(s.lid(), bv.width());
            }
        }
        for (Instruction inst : body) {
            writeInstruction(inst, widths);
            out.append('\n');
        }
    }

    private void writeInstruction(Instruction inst, Map<Integer, Integer> widths) {
        out.append(inst.lid()).append(' ').append(inst.opcode());

        if (inst instanceof Instruction.Sort s) {
            out.append(' ').append(SortType.keyword(s.type()));
            if (s.type() instanceof SortType.BitVec bv) {
                out.append(' ').append(bv.width());
            } else {
                SortType.Array a = (SortType.Array) s.type();
                out.append(' ').append(a.indexSid()).append(' ').append(a.elementSid());
            }
            return;
        }
        if (inst instanceof Instruction.Ref r) {
            out.append(' ').append(r.module()).append(' ').append(r.target());
            return;
        }
        if (inst instanceof Instruction.Inst i) {
            out.append(' ').append(i.module());
            return;
        }

        inst.sortRef().ifPresent(sid -> out.append(' ').append(sid));
        for (int arg : inst.args()) {
            out.append(' ').append(arg);
        }

        if (inst instanceof Instruction.ConstDecimal c) {
            out.append(' ').append(c.value());
        } else if (inst instanceof Instruction.ConstHex c) {
            out.append(' ').append(c.value().toString(16));
        } else if (inst instanceof Instruction.ConstBinary c) {
            out.append(' ').append(binary(c.value(), widths.getOrDefault(c.sid(), 0)));
        } else if (inst instanceof Instruction.Slice s) {
            out.append(' ').append(s.upper()).append(' ').append(s.lower());
        } else if (inst instanceof Instruction.Uext u) {
            out.append(' ').append(u.width());
        } else if (inst instanceof Instruction.Sext s) {
            out.append(' ').append(s.width());
        }

        if (inst.symbol() != null) {
            out.append(' ').append(inst.symbol());
        }
    }

    private static String binary(BigInteger value, int width) {
        String digits = value.toString(2);
        if (digits.length() >= width) {
            return digits;
        }
        return "0".repeat(width - digits.length()) + digits;
    }
}
