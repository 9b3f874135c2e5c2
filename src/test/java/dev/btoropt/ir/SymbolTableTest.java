package dev.btoropt.ir;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class SymbolTableTest {
    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    private static void assertUnresolved(String text, boolean modular, String fragment) throws Exception {
        Program p = Btor2.parse(text, modular);
        try {
            SymbolTable.build(p);
            fail("expected an unresolved reference");
        } catch (BtorError.UnresolvedReference e) {
            assertTrue(e.getMessage(), e.getMessage().contains(fragment));
        }
    }

    @Test
    public void testResolveAndFind() throws Exception {
        SymbolTable t = SymbolTable.build(Btor2.parse(lines("1 sort bitvec 8", "2 input 1 x", "3 not 1 2")));

        assertTrue(t.resolve(2, ScopedLid.TOP) instanceof Instruction.Input);
        assertFalse(t.find(9, ScopedLid.TOP).isPresent());
        assertEquals(new SortType.BitVec(8), t.sortOfValue(3, ScopedLid.TOP).get());
        assertEquals(1, t.position(2, ScopedLid.TOP));
        try {
            t.resolve(9, ScopedLid.TOP);
            fail();
        } catch (BtorError.UnresolvedReference expected) {
            // lid 9 does not exist
        }
    }

    @Test
    public void testForwardOperandIsRejected() throws Exception {
        assertUnresolved(lines("1 sort bitvec 1", "2 not 1 3", "3 input 1"), false, "used before it is declared");
        assertUnresolved(lines("1 sort bitvec 1", "2 not 1 7"), false, "operand 7 is not declared");
    }

    @Test
    public void testStateOperandMayComeLater() throws Exception {
        SymbolTable.build(Btor2.parse(lines("1 sort bitvec 1", "2 zero 1", "3 init 1 4 2", "4 state 1 s")));
        assertUnresolved(lines("1 sort bitvec 1", "2 zero 1", "3 init 1 2 2"), false, "not a state");
    }

    @Test
    public void testModularReferences() throws Exception {
        String ok = lines(
                "module m {",
                "1 sort bitvec 4",
                "2 input 1 a",
                "}",
                "module top {",
                "1 inst m",
                "2 ref m 2",
                "}");
        SymbolTable t = SymbolTable.build(Btor2.parse(ok, true));
        assertEquals(new SortType.BitVec(4), t.sortOfValue(2, ScopedLid.moduleScope("top")).get());

        assertUnresolved(lines("module top {", "1 inst nowhere", "}"), true, "undeclared module `nowhere`");
        assertUnresolved(lines("module m {", "1 sort bitvec 4", "}", "module top {", "1 ref m 5", "}"), true,
                "has no lid 5");
        assertUnresolved(
                lines(
                        "module m {",
                        "1 sort bitvec 4",
                        "2 one 1",
                        "}",
                        "module top {",
                        "1 inst m",
                        "2 ref m 2",
                        "3 sort bitvec 4",
                        "4 zero 3",
                        "5 set 1 2 4",
                        "}"),
                true,
                "only inputs can be set");
    }

    @Test
    public void testIndexReportsEveryProblem() throws Exception {
        Program p = Btor2.parse(lines("1 sort bitvec 1", "2 not 1 5", "3 and 1 2 6", "4 output 9"));
        List<String> problems = new ArrayList<>();
        SymbolTable.index(p).forEachProblem((scope, lid, message) -> problems.add(lid + ": " + message));

        assertEquals(3, problems.size());
        assertTrue(problems.contains("2: operand 5 is not declared"));
        assertTrue(problems.contains("3: operand 6 is not declared"));
        assertTrue(problems.contains("4: operand 9 is not declared"));
    }

    @Test
    public void testDescribeArraySort() throws Exception {
        SymbolTable t = SymbolTable.index(Btor2.parse(lines("1 sort bitvec 4", "2 sort bitvec 8", "3 sort array 1 2")));
        SortType array = t.sortAt(3, ScopedLid.TOP).get();
        assertEquals("array(bv4,bv8)", t.describe(array, ScopedLid.TOP));
        assertEquals(-1, SymbolTable.width(array));
    }
}
