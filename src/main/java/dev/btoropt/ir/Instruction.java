package dev.btoropt.ir;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.IntUnaryOperator;

public sealed interface Instruction
        permits Instruction.Sort,
                Instruction.Input,
                Instruction.Output,
                Instruction.Bad,
                Instruction.Constraint,
                Instruction.Zero,
                Instruction.One,
                Instruction.Ones,
                Instruction.ConstDecimal,
                Instruction.ConstHex,
                Instruction.ConstBinary,
                Instruction.State,
                Instruction.Init,
                Instruction.Next,
                Instruction.Not,
                Instruction.Unary,
                Instruction.Binary,
                Instruction.Implies,
                Instruction.Iff,
                Instruction.Ite,
                Instruction.Slice,
                Instruction.Uext,
                Instruction.Sext,
                Instruction.Ref,
                Instruction.Inst,
                Instruction.Set,
                Instruction.Prec,
                Instruction.Post {
    int lid();

    String opcode();

    /** Sid of the value this instruction produces; empty for kinds without one. */
    OptionalInt sortRef();

    /** Local-scope operand LIDs, excluding the sid, in textual order. */
    List<Integer> args();

    Instruction relabel(IntUnaryOperator f);

    /** Trailing symbol, or null. */
    default String symbol() {
        return null;
    }

    /** True for the modular extensions that plain BTOR2 does not have. */
    default boolean isExtension() {
        return false;
    }

    record Sort(int lid, SortType type) implements Instruction {
        public Sort {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String opcode() {
            return "sort";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.empty();
        }

        @Override
        public List<Integer> args() {
            if (type instanceof SortType.Array a) {
                return List.of(a.indexSid(), a.elementSid());
            }
            return List.of();
        }

        @Override
        public Sort relabel(IntUnaryOperator f) {
            SortType t = type;
            if (t instanceof SortType.Array a) {
                t = new SortType.Array(f.applyAsInt(a.indexSid()), f.applyAsInt(a.elementSid()));
            }
            return new Sort(f.applyAsInt(lid), t);
        }
    }

    record Input(int lid, int sid, String symbol) implements Instruction {
        @Override
        public String opcode() {
            return "input";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.of(sid);
        }

        @Override
        public List<Integer> args() {
            return List.of();
        }

        @Override
        public Input relabel(IntUnaryOperator f) {
            return new Input(f.applyAsInt(lid), f.applyAsInt(sid), symbol);
        }
    }

    record Output(int lid, int value, String symbol) implements Instruction {
        @Override
        public String opcode() {
            return "output";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.empty();
        }

        @Override
        public List<Integer> args() {
            return List.of(value);
        }

        @Override
        public Output relabel(IntUnaryOperator f) {
            return new Output(f.applyAsInt(lid), f.applyAsInt(value), symbol);
        }
    }

    record Bad(int lid, int cond, String symbol) implements Instruction {
        @Override
        public String opcode() {
            return "bad";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.empty();
        }

        @Override
        public List<Integer> args() {
            return List.of(cond);
        }

        @Override
        public Bad relabel(IntUnaryOperator f) {
            return new Bad(f.applyAsInt(lid), f.applyAsInt(cond), symbol);
        }
    }

    record Constraint(int lid, int cond, String symbol) implements Instruction {
        @Override
        public String opcode() {
            return "constraint";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.empty();
        }

        @Override
        public List<Integer> args() {
            return List.of(cond);
        }

        @Override
        public Constraint relabel(IntUnaryOperator f) {
            return new Constraint(f.applyAsInt(lid), f.applyAsInt(cond), symbol);
        }
    }

    record Zero(int lid, int sid, String symbol) implements Instruction {
        @Override
        public String opcode() {
            return "zero";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.of(sid);
        }

        @Override
        public List<Integer> args() {
            return List.of();
        }

        @Override
        public Zero relabel(IntUnaryOperator f) {
            return new Zero(f.applyAsInt(lid), f.applyAsInt(sid), symbol);
        }
    }

    record One(int lid, int sid, String symbol) implements Instruction {
        @Override
        public String opcode() {
            return "one";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.of(sid);
        }

        @Override
        public List<Integer> args() {
            return List.of();
        }

        @Override
        public One relabel(IntUnaryOperator f) {
            return new One(f.applyAsInt(lid), f.applyAsInt(sid), symbol);
        }
    }

    record Ones(int lid, int sid, String symbol) implements Instruction {
        @Override
        public String opcode() {
            return "ones";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.of(sid);
        }

        @Override
        public List<Integer> args() {
            return List.of();
        }

        @Override
        public Ones relabel(IntUnaryOperator f) {
            return new Ones(f.applyAsInt(lid), f.applyAsInt(sid), symbol);
        }
    }

    record ConstDecimal(int lid, int sid, BigInteger value, String symbol) implements Instruction {
        public ConstDecimal {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String opcode() {
            return "constd";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.of(sid);
        }

        @Override
        public List<Integer> args() {
            return List.of();
        }

        @Override
        public ConstDecimal relabel(IntUnaryOperator f) {
            return new ConstDecimal(f.applyAsInt(lid), f.applyAsInt(sid), value, symbol);
        }
    }

    record ConstHex(int lid, int sid, BigInteger value, String symbol) implements Instruction {
        public ConstHex {
            Objects.requireNonNull(value, "value");
            if (value.signum() < 0) {
                throw new IllegalArgumentException("consth value must be non-negative");
            }
        }

        @Override
        public String opcode() {
            return "consth";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.of(sid);
        }

        @Override
        public List<Integer> args() {
            return List.of();
        }

        @Override
        public ConstHex relabel(IntUnaryOperator f) {
            return new ConstHex(f.applyAsInt(lid), f.applyAsInt(sid), value, symbol);
        }
    }

    record ConstBinary(int lid, int sid, BigInteger value, String symbol) implements Instruction {
        public ConstBinary {
            Objects.requireNonNull(value, "value");
            if (value.signum() < 0) {
                throw new IllegalArgumentException("const value must be non-negative");
            }
        }

        @Override
        public String opcode() {
            return "const";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.of(sid);
        }

        @Override
        public List<Integer> args() {
            return List.of();
        }

        @Override
        public ConstBinary relabel(IntUnaryOperator f) {
            return new ConstBinary(f.applyAsInt(lid), f.applyAsInt(sid), value, symbol);
        }
    }

    record State(int lid, int sid, String symbol) implements Instruction {
        @Override
        public String opcode() {
            return "state";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.of(sid);
        }

        @Override
        public List<Integer> args() {
            return List.of();
        }

        @Override
        public State relabel(IntUnaryOperator f) {
            return new State(f.applyAsInt(lid), f.applyAsInt(sid), symbol);
        }
    }

    record Init(int lid, int sid, int state, int value) implements Instruction {
        @Override
        public String opcode() {
            return "init";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.of(sid);
        }

        @Override
        public List<Integer> args() {
            return List.of(state, value);
        }

        @Override
        public Init relabel(IntUnaryOperator f) {
            return new Init(f.applyAsInt(lid), f.applyAsInt(sid), f.applyAsInt(state), f.applyAsInt(value));
        }
    }

    record Next(int lid, int sid, int state, int value) implements Instruction {
        @Override
        public String opcode() {
            return "next";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.of(sid);
        }

        @Override
        public List<Integer> args() {
            return List.of(state, value);
        }

        @Override
        public Next relabel(IntUnaryOperator f) {
            return new Next(f.applyAsInt(lid), f.applyAsInt(sid), f.applyAsInt(state), f.applyAsInt(value));
        }
    }

    record Not(int lid, int sid, int operand, String symbol) implements Instruction {
        @Override
        public String opcode() {
            return "not";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.of(sid);
        }

        @Override
        public List<Integer> args() {
            return List.of(operand);
        }

        @Override
        public Not relabel(IntUnaryOperator f) {
            return new Not(f.applyAsInt(lid), f.applyAsInt(sid), f.applyAsInt(operand), symbol);
        }
    }

    record Unary(int lid, UnaryOp op, int sid, int operand, String symbol) implements Instruction {
        public Unary {
            Objects.requireNonNull(op, "op");
        }

        @Override
        public String opcode() {
            return op.keyword();
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.of(sid);
        }

        @Override
        public List<Integer> args() {
            return List.of(operand);
        }

        @Override
        public Unary relabel(IntUnaryOperator f) {
            return new Unary(f.applyAsInt(lid), op, f.applyAsInt(sid), f.applyAsInt(operand), symbol);
        }
    }

    record Binary(int lid, BinaryOp op, int sid, int a, int b, String symbol) implements Instruction {
        public Binary {
            Objects.requireNonNull(op, "op");
        }

        @Override
        public String opcode() {
            return op.keyword();
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.of(sid);
        }

        @Override
        public List<Integer> args() {
            return List.of(a, b);
        }

        @Override
        public Binary relabel(IntUnaryOperator f) {
            return new Binary(f.applyAsInt(lid), op, f.applyAsInt(sid), f.applyAsInt(a), f.applyAsInt(b), symbol);
        }
    }

    record Implies(int lid, int sid, int a, int b, String symbol) implements Instruction {
        @Override
        public String opcode() {
            return "implies";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.of(sid);
        }

        @Override
        public List<Integer> args() {
            return List.of(a, b);
        }

        @Override
        public Implies relabel(IntUnaryOperator f) {
            return new Implies(f.applyAsInt(lid), f.applyAsInt(sid), f.applyAsInt(a), f.applyAsInt(b), symbol);
        }
    }

    record Iff(int lid, int sid, int a, int b, String symbol) implements Instruction {
        @Override
        public String opcode() {
            return "iff";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.of(sid);
        }

        @Override
        public List<Integer> args() {
            return List.of(a, b);
        }

        @Override
        public Iff relabel(IntUnaryOperator f) {
            return new Iff(f.applyAsInt(lid), f.applyAsInt(sid), f.applyAsInt(a), f.applyAsInt(b), symbol);
        }
    }

    record Ite(int lid, int sid, int cond, int then, int otherwise, String symbol) implements Instruction {
        @Override
        public String opcode() {
            return "ite";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.of(sid);
        }

        @Override
        public List<Integer> args() {
            return List.of(cond, then, otherwise);
        }

        @Override
        public Ite relabel(IntUnaryOperator f) {
            return new Ite(
                    f.applyAsInt(lid),
                    f.applyAsInt(sid),
                    f.applyAsInt(cond),
                    f.applyAsInt(then),
                    f.applyAsInt(otherwise),
                    symbol);
        }
    }

    record Slice(int lid, int sid, int operand, int upper, int lower, String symbol) implements Instruction {
        public Slice {
            if (lower < 0 || upper < lower) {
                throw new IllegalArgumentException("bad slice bounds [" + upper + ":" + lower + "]");
            }
        }

        @Override
        public String opcode() {
            return "slice";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.of(sid);
        }

        @Override
        public List<Integer> args() {
            return List.of(operand);
        }

        @Override
        public Slice relabel(IntUnaryOperator f) {
            return new Slice(f.applyAsInt(lid), f.applyAsInt(sid), f.applyAsInt(operand), upper, lower, symbol);
        }
    }

    record Uext(int lid, int sid, int operand, int width, String symbol) implements Instruction {
        public Uext {
            if (width < 0) {
                throw new IllegalArgumentException("uext width must be non-negative");
            }
        }

        @Override
        public String opcode() {
            return "uext";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.of(sid);
        }

        @Override
        public List<Integer> args() {
            return List.of(operand);
        }

        @Override
        public Uext relabel(IntUnaryOperator f) {
            return new Uext(f.applyAsInt(lid), f.applyAsInt(sid), f.applyAsInt(operand), width, symbol);
        }
    }

    record Sext(int lid, int sid, int operand, int width, String symbol) implements Instruction {
        public Sext {
            if (width < 0) {
                throw new IllegalArgumentException("sext width must be non-negative");
            }
        }

        @Override
        public String opcode() {
            return "sext";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.of(sid);
        }

        @Override
        public List<Integer> args() {
            return List.of(operand);
        }

        @Override
        public Sext relabel(IntUnaryOperator f) {
            return new Sext(f.applyAsInt(lid), f.applyAsInt(sid), f.applyAsInt(operand), width, symbol);
        }
    }

    // ---- modular extensions ----

    /** {@code <lid> ref <module> <target>}: names instruction {@code target} of another module. */
    record Ref(int lid, String module, int target) implements Instruction {
        public Ref {
            Objects.requireNonNull(module, "module");
        }

        @Override
        public String opcode() {
            return "ref";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.empty();
        }

        @Override
        public List<Integer> args() {
            return List.of();
        }

        @Override
        public Ref relabel(IntUnaryOperator f) {
            return new Ref(f.applyAsInt(lid), module, target);
        }

        public ScopedLid scopedTarget() {
            return new ScopedLid(ScopedLid.moduleScope(module), target);
        }

        @Override
        public boolean isExtension() {
            return true;
        }
    }

    /** {@code <lid> inst <module>}: a fresh instance of the named module. */
    record Inst(int lid, String module) implements Instruction {
        public Inst {
            Objects.requireNonNull(module, "module");
        }

        @Override
        public String opcode() {
            return "inst";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.empty();
        }

        @Override
        public List<Integer> args() {
            return List.of();
        }

        @Override
        public Inst relabel(IntUnaryOperator f) {
            return new Inst(f.applyAsInt(lid), module);
        }

        @Override
        public boolean isExtension() {
            return true;
        }
    }

    /** {@code <lid> set <inst> <ref> <value>}: drives the instance input named by {@code ref}. */
    record Set(int lid, int instance, int ref, int value) implements Instruction {
        @Override
        public String opcode() {
            return "set";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.empty();
        }

        @Override
        public List<Integer> args() {
            return List.of(instance, ref, value);
        }

        @Override
        public Set relabel(IntUnaryOperator f) {
            return new Set(f.applyAsInt(lid), f.applyAsInt(instance), f.applyAsInt(ref), f.applyAsInt(value));
        }

        @Override
        public boolean isExtension() {
            return true;
        }
    }

    record Prec(int lid, int cond) implements Instruction {
        @Override
        public String opcode() {
            return "prec";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.empty();
        }

        @Override
        public List<Integer> args() {
            return List.of(cond);
        }

        @Override
        public Prec relabel(IntUnaryOperator f) {
            return new Prec(f.applyAsInt(lid), f.applyAsInt(cond));
        }

        @Override
        public boolean isExtension() {
            return true;
        }
    }

    record Post(int lid, int cond) implements Instruction {
        @Override
        public String opcode() {
            return "post";
        }

        @Override
        public OptionalInt sortRef() {
            return OptionalInt.empty();
        }

        @Override
        public List<Integer> args() {
            return List.of(cond);
        }

        @Override
        public Post relabel(IntUnaryOperator f) {
            return new Post(f.applyAsInt(lid), f.applyAsInt(cond));
        }

        @Override
        public boolean isExtension() {
            return true;
        }
    }
}
