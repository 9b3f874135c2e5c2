package dev.btoropt.ir;

public final class Btor2 {
    private Btor2() {}

    /** Syntax only. With {@code modular} false the modular extensions are rejected. */
    public static Program parse(String text, boolean modular) throws BtorError.Parse {
        return new Btor2Parser(modular).parse(text);
    }

    public static Program parse(String text) throws BtorError.Parse {
        return parse(text, false);
    }

    /** Parses and resolves every reference; the returned program is safe to hand to passes. */
    public static Program load(String text, boolean modular) throws BtorError {
        Program program = parse(text, modular);
        SymbolTable.build(program);
        return program;
    }

    public static String emit(Program program) {
        return new Btor2Emitter().emit(program);
    }
}
