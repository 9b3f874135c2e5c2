package dev.btoropt.ir;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Line-oriented BTOR2 reader. One pass, no backtracking: the opcode keyword decides the grammar
 * of the rest of the line.
 *
 * <p>Only syntax is checked here (token counts, numbers, block structure, duplicate LIDs within
 * a scope). Whether operands resolve is the {@link SymbolTable}'s job.</p>
 */
final class Btor2Parser {
    private enum Block {
        TOP,
        MODULE,
        CONTRACT
    }

    private final boolean modular;

    private String[] tokens;
    private int tok;
    private int lineNo;

    private Block block = Block.TOP;
    private String blockName;
    private int blockStart;
    private List<Instruction> current;
    private Set<Integer> seenLids;

    private final List<Instruction> top = new ArrayList<>();
    private final Set<Integer> topLids = new HashSet<>();
    private final List<ModuleDecl> modules = new ArrayList<>();
    private final List<ContractDecl> contracts = new ArrayList<>();
    private final Map<String, Integer> moduleLines = new TreeMap<>();
    private final Map<String, Integer> contractLines = new TreeMap<>();

    Btor2Parser(boolean modular) {
        this.modular = modular;
    }

    Program parse(String text) throws BtorError.Parse {
        current = top;
        seenLids = topLids;

        String[] lines = text.split("\r?\n", -1);
        for (int i = 0; i < lines.length; i++) {
            lineNo = i + 1;
            String line = stripComment(lines[i]).trim();
            if (line.isEmpty()) {
                continue;
            }
            tokens = line.split("\\s+");
            tok = 0;
            parseLine();
        }

        if (block != Block.TOP) {
            lineNo = lines.length;
            throw err("unterminated " + blockWord() + " `" + blockName + "` opened at line " + blockStart);
        }
        return new Program(top, modules, contracts);
    }

    private static String stripComment(String line) {
        int semi = line.indexOf(';');
        return (semi < 0) ? line : line.substring(0, semi);
    }

    private BtorError.Parse err(String message) {
        return new BtorError.Parse(message, lineNo);
    }

    private String blockWord() {
        return (block == Block.CONTRACT) ? "contract" : "module";
    }

    private void parseLine() throws BtorError.Parse {
        String first = tokens[0];
        switch (first) {
            case "module", "contract" -> openBlock(first);
            case "}" -> closeBlock();
            default -> {
                Instruction inst = readInstruction();
                if (!seenLids.add(inst.lid())) {
                    throw err("duplicate lid " + inst.lid());
                }
                current.add(inst);
            }
        }
    }

    private void openBlock(String keyword) throws BtorError.Parse {
        if (!modular) {
            throw err("`" + keyword + "` requires modular mode");
        }
        if (block != Block.TOP) {
            throw err("nested `" + keyword + "` inside " + blockWord() + " `" + blockName + "`");
        }
        if (tokens.length != 3 || !tokens[2].equals("{")) {
            throw err("expected `" + keyword + " <name> {`");
        }
        String name = tokens[1];
        if (keyword.equals("module")) {
            Integer prev = moduleLines.putIfAbsent(name, lineNo);
            if (prev != null) {
                throw err("module `" + name + "` already declared at line " + prev);
            }
            block = Block.MODULE;
        } else {
            if (!moduleLines.containsKey(name)) {
                throw err("contract names undeclared module `" + name + "`");
            }
            Integer prev = contractLines.putIfAbsent(name, lineNo);
            if (prev != null) {
                throw err("module `" + name + "` already has a contract at line " + prev);
            }
            block = Block.CONTRACT;
        }
        blockName = name;
        blockStart = lineNo;
        current = new ArrayList<>();
        seenLids = new HashSet<>();
    }

    private void closeBlock() throws BtorError.Parse {
        if (tokens.length != 1) {
            throw err("unexpected tokens after `}`");
        }
        if (block == Block.TOP) {
            throw err("`}` without an open block");
        }
        if (block == Block.MODULE) {
            modules.add(new ModuleDecl(blockName, current));
        } else {
            if (current.stream().noneMatch(i -> i instanceof Instruction.Prec || i instanceof Instruction.Post)) {
                throw err("contract `" + blockName + "` has neither a precondition nor a postcondition");
            }
            contracts.add(new ContractDecl(blockName, current));
        }
        block = Block.TOP;
        blockName = null;
        current = top;
        seenLids = topLids;
    }

    private Instruction readInstruction() throws BtorError.Parse {
        int lid = readInt("lid");
        if (lid <= 0) {
            throw err("lid must be positive, got " + lid);
        }
        String op = readToken("opcode");

        Instruction inst = switch (op) {
            case "sort" -> readSort(lid);
            case "input" -> new Instruction.Input(lid, readInt("sid"), readSymbol());
            case "output" -> new Instruction.Output(lid, readInt("operand"), readSymbol());
            case "bad" -> new Instruction.Bad(lid, readInt("condition"), readSymbol());
            case "constraint" -> new Instruction.Constraint(lid, readInt("condition"), readSymbol());
            case "zero" -> new Instruction.Zero(lid, readInt("sid"), readSymbol());
            case "one" -> new Instruction.One(lid, readInt("sid"), readSymbol());
            case "ones" -> new Instruction.Ones(lid, readInt("sid"), readSymbol());
            case "constd" -> new Instruction.ConstDecimal(lid, readInt("sid"), readLiteral(10), readSymbol());
            case "consth" -> new Instruction.ConstHex(lid, readInt("sid"), readLiteral(16), readSymbol());
            case "const" -> new Instruction.ConstBinary(lid, readInt("sid"), readLiteral(2), readSymbol());
            case "state" -> new Instruction.State(lid, readInt("sid"), readSymbol());
            case "init" -> new Instruction.Init(lid, readInt("sid"), readInt("state"), readInt("value"));
            case "next" -> new Instruction.Next(lid, readInt("sid"), readInt("state"), readInt("value"));
            case "not" -> new Instruction.Not(lid, readInt("sid"), readInt("operand"), readSymbol());
            case "implies" -> new Instruction.Implies(
                    lid, readInt("sid"), readInt("lhs"), readInt("rhs"), readSymbol());
            case "iff" -> new Instruction.Iff(lid, readInt("sid"), readInt("lhs"), readInt("rhs"), readSymbol());
            case "ite" -> new Instruction.Ite(
                    lid, readInt("sid"), readInt("condition"), readInt("then"), readInt("else"), readSymbol());
            case "slice" -> readSlice(lid);
            case "uext" -> {
                int sid = readInt("sid");
                int operand = readInt("operand");
                int width = readWidth();
                yield new Instruction.Uext(lid, sid, operand, width, readSymbol());
            }
            case "sext" -> {
                int sid = readInt("sid");
                int operand = readInt("operand");
                int width = readWidth();
                yield new Instruction.Sext(lid, sid, operand, width, readSymbol());
            }
            case "ref" -> {
                requireExtension(op, Block.MODULE, Block.CONTRACT);
                yield new Instruction.Ref(lid, readToken("module name"), readInt("target lid"));
            }
            case "inst" -> {
                requireExtension(op, Block.MODULE);
                yield new Instruction.Inst(lid, readToken("module name"));
            }
            case "set" -> {
                requireExtension(op, Block.MODULE);
                yield new Instruction.Set(lid, readInt("instance"), readInt("ref"), readInt("value"));
            }
            case "prec" -> {
                requireExtension(op, Block.CONTRACT);
                yield new Instruction.Prec(lid, readInt("condition"));
            }
            case "post" -> {
                requireExtension(op, Block.CONTRACT);
                yield new Instruction.Post(lid, readInt("condition"));
            }
            default -> readOperator(lid, op);
        };

        if (tok < tokens.length) {
            throw err("unexpected token `" + tokens[tok] + "` after " + op);
        }
        return inst;
    }

    private Instruction readOperator(int lid, String op) throws BtorError.Parse {
        BinaryOp bin = BinaryOp.fromKeyword(op);
        if (bin != null) {
            return new Instruction.Binary(lid, bin, readInt("sid"), readInt("lhs"), readInt("rhs"), readSymbol());
        }
        UnaryOp un = UnaryOp.fromKeyword(op);
        if (un != null) {
            return new Instruction.Unary(lid, un, readInt("sid"), readInt("operand"), readSymbol());
        }
        throw err("unsupported operation `" + op + "`");
    }

    private void requireExtension(String op, Block... allowed) throws BtorError.Parse {
        if (!modular) {
            throw err("`" + op + "` requires modular mode");
        }
        for (Block b : allowed) {
            if (block == b) {
                return;
            }
        }
        String where = (block == Block.TOP) ? "at top level" : "inside a " + blockWord();
        throw err("`" + op + "` is not allowed " + where);
    }

    private Instruction.Sort readSort(int lid) throws BtorError.Parse {
        String kind = readToken("sort kind");
        SortType type = switch (kind) {
            case "bitvec", "bitvector" -> {
                int width = readInt("width");
                if (width <= 0) {
                    throw err("bit-vector width must be positive, got " + width);
                }
                yield new SortType.BitVec(width);
            }
            case "array" -> new SortType.Array(readInt("index sid"), readInt("element sid"));
            default -> throw err("sort must be bitvec, bitvector or array, found `" + kind + "`");
        };
        // Sorts may carry a symbol in the wild; it has no meaning and is dropped.
        readSymbol();
        return new Instruction.Sort(lid, type);
    }

    private Instruction.Slice readSlice(int lid) throws BtorError.Parse {
        int sid = readInt("sid");
        int operand = readInt("operand");
        int upper = readInt("upper bit");
        int lower = readInt("lower bit");
        if (lower < 0 || upper < lower) {
            throw err("slice bounds [" + upper + ":" + lower + "] are not a valid range");
        }
        return new Instruction.Slice(lid, sid, operand, upper, lower, readSymbol());
    }

    private int readWidth() throws BtorError.Parse {
        int width = readInt("width");
        if (width < 0) {
            throw err("extension width must be non-negative, got " + width);
        }
        return width;
    }

    private String readToken(String what) throws BtorError.Parse {
        if (tok >= tokens.length) {
            throw err("missing " + what);
        }
        return tokens[tok++];
    }

    private int readInt(String what) throws BtorError.Parse {
        String s = readToken(what);
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw err("expected " + what + " as a decimal integer, found `" + s + "`");
        }
    }

    private BigInteger readLiteral(int radix) throws BtorError.Parse {
        String s = readToken("value");
        if (radix != 10 && s.startsWith("-")) {
            throw err("negative literal `" + s + "` is only allowed for constd");
        }
        try {
            return new BigInteger(s, radix);
        } catch (NumberFormatException e) {
            throw err("invalid base-" + radix + " literal `" + s + "`");
        }
    }

    private String readSymbol() {
        return (tok < tokens.length) ? tokens[tok++] : null;
    }
}
