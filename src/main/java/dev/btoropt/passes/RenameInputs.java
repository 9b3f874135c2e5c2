package dev.btoropt.passes;

import dev.btoropt.ir.ContractDecl;
import dev.btoropt.ir.Instruction;
import dev.btoropt.ir.ModuleDecl;
import dev.btoropt.ir.Program;
import java.util.ArrayList;
import java.util.List;

public final class RenameInputs implements Transform {
    public static final String NAME = "rename-inputs";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Program run(Program program) {
        List<ModuleDecl> modules = new ArrayList<>();
        for (ModuleDecl m : program.modules()) {
            modules.add(new ModuleDecl(m.name(), rename(m.body())));
        }
        List<ContractDecl> contracts = new ArrayList<>();
        for (ContractDecl c : program.contracts()) {
            contracts.add(new ContractDecl(c.module(), rename(c.body())));
        }
        return new Program(rename(program.body()), modules, contracts);
    }

    private static List<Instruction> rename(List<Instruction> body) {
        int n = 0;
        List<Instruction> out = new ArrayList<>(body.size());
        for (Instruction inst : body) {
            if (inst instanceof Instruction.Input in) {
                out.add(new Instruction.Input(in.lid(), in.sid(), "inp_" + n));
                n++;
            } else {
                out.add(inst);
            }
        }
        return out;
    }
}
