package dev.btoropt.passes;

import dev.btoropt.ir.Diagnostic;
import dev.btoropt.ir.Program;
import java.util.List;

/** Checks a program without changing it; returns one diagnostic per violation found. */
public non-sealed interface Validation extends Pass {
    List<Diagnostic> check(Program program);
}
