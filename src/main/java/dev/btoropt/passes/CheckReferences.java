package dev.btoropt.passes;

import dev.btoropt.ir.BtorError;
import dev.btoropt.ir.Diagnostic;
import dev.btoropt.ir.Program;
import dev.btoropt.ir.SymbolTable;
import java.util.ArrayList;
import java.util.List;

public final class CheckReferences implements Validation {
    public static final String NAME = "check-references";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Diagnostic> check(Program program) {
        List<Diagnostic> out = new ArrayList<>();
        try {
            SymbolTable.index(program)
                    .forEachProblem((scope, lid, message) -> out.add(new Diagnostic(NAME, scope, lid, message)));
        } catch (BtorError e) {
            throw new IllegalStateException("collecting sink threw", e);
        }
        return out;
    }
}
