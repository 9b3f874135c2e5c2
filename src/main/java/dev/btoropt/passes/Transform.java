package dev.btoropt.passes;

import dev.btoropt.ir.BtorError;
import dev.btoropt.ir.Program;

/**
 * Rewrites a program. Implementations return a new {@link Program} and leave their argument
 * untouched; LIDs stay unique per scope and every reference still resolves.
 */
public non-sealed interface Transform extends Pass {
    Program run(Program program) throws BtorError;
}
