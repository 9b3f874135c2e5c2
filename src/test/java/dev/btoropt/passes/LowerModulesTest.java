package dev.btoropt.passes;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import dev.btoropt.ir.Btor2;
import dev.btoropt.ir.BtorError;
import dev.btoropt.ir.Program;
import org.junit.Test;

public class LowerModulesTest {
    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    private static Program lower(String text) throws Exception {
        Program out = new LowerModules().run(Btor2.load(text, true));
        assertTrue(out.isFlat());
        assertTrue(new CheckFlat().check(out).isEmpty());
        assertTrue(new CheckReferences().check(out).isEmpty());
        assertTrue(new CheckLidOrdering().check(out).isEmpty());
        assertTrue(new CheckSorts().check(out).isEmpty());
        return out;
    }

    private static void assertLoweringFails(String text, String fragment) throws Exception {
        Program p = Btor2.parse(text, true);
        try {
            new LowerModules().run(p);
            fail("expected lowering to fail");
        } catch (BtorError.UnresolvedReference e) {
            assertTrue(e.getMessage(), e.getMessage().contains(fragment));
        }
    }

    private static final String INCREMENT = lines(
            "module inc {",
            "1 sort bitvec 8",
            "2 input 1 a",
            "3 one 1",
            "4 add 1 2 3",
            "5 output 4 y",
            "}");

    @Test
    public void testInstanceWithBoundInput() throws Exception {
        Program out = lower(INCREMENT + lines(
                "module top {",
                "1 sort bitvec 8",
                "2 input 1 x",
                "3 inst inc",
                "4 ref inc 2",
                "5 set 3 4 2",
                "6 ref inc 4",
                "7 output 6 out",
                "}"));

        assertEquals(
                lines("1 sort bitvec 8", "2 input 1 x", "3 one 1", "4 add 1 2 3", "5 output 4 out"),
                Btor2.emit(out));
    }

    @Test
    public void testTwoInstancesAreSeparateCopies() throws Exception {
        Program out = lower(INCREMENT + lines(
                "module top {",
                "1 sort bitvec 8",
                "2 input 1 x",
                "3 inst inc",
                "4 ref inc 2",
                "5 set 3 4 2",
                "6 ref inc 4",
                "7 inst inc",
                "8 ref inc 2",
                "9 set 7 8 6",
                "10 ref inc 4",
                "11 output 10 plus_two",
                "}"));

        assertEquals(
                lines(
                        "1 sort bitvec 8",
                        "2 input 1 x",
                        "3 one 1",
                        "4 add 1 2 3",
                        "5 one 1",
                        "6 add 1 4 5",
                        "7 output 6 plus_two"),
                Btor2.emit(out));
    }

    @Test
    public void testUnboundInputStaysAnInput() throws Exception {
        Program out = lower(INCREMENT + lines("module top {", "1 inst inc", "2 ref inc 4", "3 output 2 y", "}"));

        assertEquals(
                lines("1 sort bitvec 8", "2 input 1 a", "3 one 1", "4 add 1 2 3", "5 output 4 y"),
                Btor2.emit(out));
    }

    @Test
    public void testRootContractAssumesPreconditionAndAssertsPostcondition() throws Exception {
        Program out = lower(lines(
                "module m {",
                "1 sort bitvec 1",
                "2 input 1 a",
                "3 output 2 o",
                "}",
                "contract m {",
                "1 ref m 2",
                "2 prec 1",
                "3 post 1",
                "}"));

        assertEquals(
                lines(
                        "1 sort bitvec 1",
                        "2 input 1 a",
                        "3 output 2 o",
                        "4 constraint 2",
                        "5 not 1 2",
                        "6 bad 5"),
                Btor2.emit(out));
    }

    @Test
    public void testInstanceContractAssertsPreconditionAndAssumesPostcondition() throws Exception {
        Program out = lower(lines(
                "module m {",
                "1 sort bitvec 1",
                "2 input 1 a",
                "3 output 2 o",
                "}",
                "contract m {",
                "1 ref m 2",
                "2 prec 1",
                "3 post 1",
                "}",
                "module top {",
                "1 inst m",
                "}"));

        assertEquals(
                lines("1 sort bitvec 1", "2 input 1 a", "3 not 1 2", "4 bad 3", "5 constraint 2"),
                Btor2.emit(out));
    }

    @Test
    public void testContractRefToOutputUsesItsValue() throws Exception {
        Program out = lower(lines(
                "module m {",
                "1 sort bitvec 1",
                "2 input 1 a",
                "3 not 1 2",
                "4 output 3 o",
                "}",
                "contract m {",
                "1 ref m 4",
                "2 post 1",
                "}"));

        assertEquals(
                lines(
                        "1 sort bitvec 1",
                        "2 input 1 a",
                        "3 not 1 2",
                        "4 output 3 o",
                        "5 not 1 3",
                        "6 bad 5"),
                Btor2.emit(out));
    }

    @Test
    public void testInstanceRefToOutputUsesItsValue() throws Exception {
        Program out = lower(INCREMENT + lines("module top {", "1 inst inc", "2 ref inc 5", "3 output 2 y", "}"));

        assertEquals(
                lines("1 sort bitvec 8", "2 input 1 a", "3 one 1", "4 add 1 2 3", "5 output 4 y"),
                Btor2.emit(out));
    }

    @Test
    public void testInlinedRefToOutputUsesItsValue() throws Exception {
        Program out = lower(lines(
                "module lib {",
                "1 sort bitvec 4",
                "2 constd 1 5",
                "3 output 2 five",
                "}",
                "module top {",
                "1 ref lib 3",
                "2 output 1 copy",
                "}"));

        assertEquals(lines("1 sort bitvec 4", "2 constd 1 5", "3 output 2 copy"), Btor2.emit(out));
    }

    @Test
    public void testRefWithoutInstanceInlinesDefinition() throws Exception {
        Program out = lower(lines(
                "module lib {",
                "1 sort bitvec 4",
                "2 constd 1 5",
                "}",
                "module top {",
                "1 sort bitvec 4",
                "2 ref lib 2",
                "3 output 2 five",
                "}"));

        assertEquals(lines("1 sort bitvec 4", "2 constd 1 5", "3 output 2 five"), Btor2.emit(out));
    }

    @Test
    public void testTopLevelBodyComesFirst() throws Exception {
        Program out = lower(lines(
                "module m {",
                "1 sort bitvec 2",
                "2 input 1 a",
                "}",
                "1 sort bitvec 1",
                "2 input 1 b"));

        assertEquals(lines("1 sort bitvec 1", "2 input 1 b", "3 sort bitvec 2", "4 input 3 a"), Btor2.emit(out));
    }

    @Test
    public void testStatesAreCopiedPerInstance() throws Exception {
        Program out = lower(lines(
                "module counter {",
                "1 sort bitvec 4",
                "2 state 1 c",
                "3 zero 1",
                "4 init 1 2 3",
                "5 one 1",
                "6 add 1 2 5",
                "7 next 1 2 6",
                "}",
                "module top {",
                "1 inst counter",
                "2 inst counter",
                "}"));

        assertEquals(13, out.body().size());
        assertEquals(2, out.body().stream().filter(i -> i.opcode().equals("state")).count());
    }

    @Test
    public void testFlatProgramIsUnchangedAndLoweringIsIdempotent() throws Exception {
        Program flat = Btor2.parse(lines("1 sort bitvec 1", "2 input 1 a"));
        assertSame(flat, new LowerModules().run(flat));

        Program once = lower(INCREMENT + lines("module top {", "1 inst inc", "}"));
        assertSame(once, new LowerModules().run(once));
    }

    @Test
    public void testErrors() throws Exception {
        assertLoweringFails(lines("module top {", "1 inst missing", "}"), "undeclared module `missing`");
        assertLoweringFails(
                lines("module a {", "1 inst b", "}", "module b {", "1 inst a", "}"),
                "no root module");
        assertLoweringFails(
                lines("module a {", "1 inst a", "}", "module top {", "1 inst a", "}"),
                "instantiates itself");
        assertLoweringFails(
                INCREMENT + lines(
                        "module top {",
                        "1 sort bitvec 8",
                        "2 input 1 x",
                        "3 inst inc",
                        "4 ref inc 4",
                        "5 output 4 early",
                        "6 ref inc 2",
                        "7 set 3 6 2",
                        "}"),
                "before instance 3");
    }
}
