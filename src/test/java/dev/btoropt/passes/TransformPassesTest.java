package dev.btoropt.passes;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import dev.btoropt.ir.Btor2;
import dev.btoropt.ir.Instruction;
import dev.btoropt.ir.Program;
import org.junit.Test;

public class TransformPassesTest {
    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    @Test
    public void testRenameInputsInDeclarationOrder() throws Exception {
        Program p = Btor2.parse(lines("1 sort bitvec 8", "2 input 1 a", "3 input 1 b", "4 add 1 2 3 sum"));
        Program out = new RenameInputs().run(p);

        assertEquals("inp_0", out.body().get(1).symbol());
        assertEquals("inp_1", out.body().get(2).symbol());
        assertEquals(p.body().get(0), out.body().get(0));
        assertEquals(p.body().get(3), out.body().get(3));
    }

    @Test
    public void testRenameInputsCountsPerScope() throws Exception {
        Program p = Btor2.parse(
                lines("module m {", "1 sort bitvec 1", "2 input 1 a", "}", "module n {", "1 sort bitvec 1",
                        "2 input 1 b", "}"),
                true);
        Program out = new RenameInputs().run(p);
        assertEquals("inp_0", out.module("m").get().body().get(1).symbol());
        assertEquals("inp_0", out.module("n").get().body().get(1).symbol());
    }

    @Test
    public void testInitAllStatesZeroesUninitialisedStates() throws Exception {
        Program p = Btor2.parse(lines("1 sort bitvec 8", "2 state 1 s", "3 one 1", "4 next 1 2 3"));
        Program out = new InitAllStates().run(p);

        assertEquals(
                lines("1 sort bitvec 8", "2 state 1 s", "3 zero 1", "4 init 1 2 3", "5 one 1", "6 next 1 2 5"),
                Btor2.emit(out));
    }

    @Test
    public void testInitAllStatesLeavesInitialisedAndArrayStates() throws Exception {
        Program p = Btor2.parse(lines(
                "1 sort bitvec 8",
                "2 sort array 1 1",
                "3 state 1 s",
                "4 one 1",
                "5 init 1 3 4",
                "6 state 2 mem"));
        assertSame(p, new InitAllStates().run(p));
    }

    @Test
    public void testRenumberLidsFollowsReferences() throws Exception {
        Program p = Btor2.parse(
                lines(
                        "module m {",
                        "5 sort bitvec 1",
                        "7 input 5 a",
                        "}",
                        "module top {",
                        "4 inst m",
                        "8 ref m 7",
                        "10 sort bitvec 1",
                        "12 one 10",
                        "20 set 4 8 12",
                        "}"),
                true);
        Program out = new RenumberLids().run(p);

        assertEquals(
                lines(
                        "module m {",
                        "1 sort bitvec 1",
                        "2 input 1 a",
                        "}",
                        "module top {",
                        "1 inst m",
                        "2 ref m 2",
                        "3 sort bitvec 1",
                        "4 one 3",
                        "5 set 1 2 4",
                        "}"),
                Btor2.emit(out));
        assertTrue(new CheckReferences().check(out).isEmpty());
    }

    @Test
    public void testRenumberKeepsOperandGraph() throws Exception {
        Program p = Btor2.parse(lines("10 sort bitvec 1", "20 input 10 a", "30 not 10 20", "40 bad 30"));
        Program out = new RenumberLids().run(p);

        Instruction.Not not = (Instruction.Not) out.body().get(2);
        assertEquals(1, not.sid());
        assertEquals(2, not.operand());
        assertEquals(3, ((Instruction.Bad) out.body().get(3)).cond());
    }
}
