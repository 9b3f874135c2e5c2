package dev.btoropt.passes;

import dev.btoropt.ir.BtorError;
import dev.btoropt.ir.Diagnostic;
import dev.btoropt.ir.Program;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class Pipeline {
    private final List<Pass> passes;

    private Pipeline(List<Pass> passes) {
        this.passes = List.copyOf(passes);
    }

    /** Looks every name up before anything runs; the first unknown name fails the whole pipeline. */
    public static Pipeline resolve(PassRegistry registry, List<String> names) throws BtorError.UnknownPass {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(names, "names");
        List<Pass> out = new ArrayList<>(names.size());
        for (String name : names) {
            Pass pass = registry.find(name).orElse(null);
            if (pass == null) {
                throw new BtorError.UnknownPass(name);
            }
            out.add(pass);
        }
        return new Pipeline(out);
    }

    public static Pipeline of(List<Pass> passes) {
        return new Pipeline(Objects.requireNonNull(passes, "passes"));
    }

    public List<Pass> passes() {
        return passes;
    }

    public Program run(Program program) throws BtorError {
        Objects.requireNonNull(program, "program");
        List<Diagnostic> diagnostics = new ArrayList<>();
        Program current = program;
        for (Pass pass : passes) {
            if (pass instanceof Transform t) {
                current = Objects.requireNonNull(t.run(current), pass.name() + " returned null");
            } else if (pass instanceof Validation v) {
                diagnostics.addAll(v.check(current));
            } else {
                throw new IllegalStateException("unknown pass kind: " + pass.getClass().getName());
            }
        }
        if (!diagnostics.isEmpty()) {
            throw new BtorError.ValidationFailure(diagnostics);
        }
        return current;
    }
}
