package dev.btoropt.passes;

import dev.btoropt.ir.Diagnostic;
import dev.btoropt.ir.Instruction;
import dev.btoropt.ir.Program;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class CheckLidOrdering implements Validation {
    public static final String NAME = "check-lid-ordering";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Diagnostic> check(Program program) {
        List<Diagnostic> out = new ArrayList<>();
        for (Map.Entry<String, List<Instruction>> scope : program.scopes().entrySet()) {
            Set<Integer> seen = new HashSet<>();
            int previous = 0;
            for (Instruction inst : scope.getValue()) {
                int lid = inst.lid();
                if (lid <= 0) {
                    out.add(new Diagnostic(NAME, scope.getKey(), lid, "lid is not positive"));
                } else if (!seen.add(lid)) {
                    out.add(new Diagnostic(NAME, scope.getKey(), lid, "lid declared more than once"));
                } else if (lid <= previous) {
                    out.add(new Diagnostic(NAME, scope.getKey(), lid, "lid follows " + previous));
                }
                previous = Math.max(previous, lid);
            }
        }
        return out;
    }
}
