package dev.btoropt.passes;

import dev.btoropt.ir.BtorError;
import dev.btoropt.ir.ContractDecl;
import dev.btoropt.ir.Instruction;
import dev.btoropt.ir.ModuleDecl;
import dev.btoropt.ir.Program;
import dev.btoropt.ir.ScopedLid;
import dev.btoropt.ir.SortType;
import dev.btoropt.ir.SymbolTable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class InitAllStates implements Transform {
    public static final String NAME = "init-all-states";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Program run(Program program) throws BtorError {
        SymbolTable table = SymbolTable.index(program);
        Set<String> changed = new HashSet<>();

        List<ModuleDecl> modules = new ArrayList<>();
        for (ModuleDecl m : program.modules()) {
            List<Instruction> body = initStates(m.body(), m.scope(), table);
            if (body != m.body()) {
                changed.add(m.scope());
            }
            modules.add(new ModuleDecl(m.name(), body));
        }
        List<ContractDecl> contracts = new ArrayList<>();
        for (ContractDecl c : program.contracts()) {
            List<Instruction> body = initStates(c.body(), c.scope(), table);
            if (body != c.body()) {
                changed.add(c.scope());
            }
            contracts.add(new ContractDecl(c.module(), body));
        }
        List<Instruction> top = initStates(program.body(), ScopedLid.TOP, table);
        if (top != program.body()) {
            changed.add(ScopedLid.TOP);
        }

        if (changed.isEmpty()) {
            return program;
        }
        return Relabeling.renumber(new Program(top, modules, contracts), changed);
    }

    /** Returns {@code body} itself when nothing needed initialising. */
    private static List<Instruction> initStates(List<Instruction> body, String scope, SymbolTable table) {
        Set<Integer> initialised = new HashSet<>();
        int maxLid = 0;
        for (Instruction inst : body) {
            if (inst instanceof Instruction.Init init) {
                initialised.add(init.state());
            }
            maxLid = Math.max(maxLid, inst.lid());
        }

        List<Instruction> out = new ArrayList<>(body.size());
        boolean grew = false;
        int fresh = maxLid + 1;
        for (Instruction inst : body) {
            out.add(inst);
            if (!(inst instanceof Instruction.State state) || initialised.contains(state.lid())) {
                continue;
            }
            // zero has no array form
            if (!(table.sortAt(state.sid(), scope).orElse(null) instanceof SortType.BitVec)) {
                continue;
            }
            Instruction.Zero zero = new Instruction.Zero(fresh++, state.sid(), null);
            out.add(zero);
            out.add(new Instruction.Init(fresh++, state.sid(), state.lid(), zero.lid()));
            grew = true;
        }
        return grew ? out : body;
    }
}
