package dev.btoropt.passes;

import dev.btoropt.ir.ContractDecl;
import dev.btoropt.ir.Diagnostic;
import dev.btoropt.ir.Instruction;
import dev.btoropt.ir.ModuleDecl;
import dev.btoropt.ir.Program;
import dev.btoropt.ir.ScopedLid;
import java.util.ArrayList;
import java.util.List;

public final class CheckFlat implements Validation {
    public static final String NAME = "check-flat";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Diagnostic> check(Program program) {
        List<Diagnostic> out = new ArrayList<>();
        for (ModuleDecl m : program.modules()) {
            out.add(new Diagnostic(NAME, m.scope(), 0, "module `" + m.name() + "` is not lowered"));
        }
        for (ContractDecl c : program.contracts()) {
            out.add(new Diagnostic(NAME, c.scope(), 0, "contract of `" + c.module() + "` is not lowered"));
        }
        for (Instruction inst : program.body()) {
            if (inst.isExtension()) {
                out.add(new Diagnostic(NAME, ScopedLid.TOP, inst.lid(), "`" + inst.opcode() + "` in a flat program"));
            }
        }
        return out;
    }
}
