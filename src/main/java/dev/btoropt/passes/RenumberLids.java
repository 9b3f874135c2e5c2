package dev.btoropt.passes;

import dev.btoropt.ir.BtorError;
import dev.btoropt.ir.Program;

public final class RenumberLids implements Transform {
    public static final String NAME = "renumber-lids";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Program run(Program program) throws BtorError {
        return Relabeling.renumberAll(program);
    }
}
