package dev.btoropt.cli;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class MainTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int run(String... args) {
        PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        return Main.run(args, out, err);
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    private String file(String name, String... lines) throws Exception {
        File f = tmp.newFile(name);
        Files.writeString(f.toPath(), String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
        return f.getPath();
    }

    @Test
    public void testUsageErrors() {
        assertEquals(Main.EXIT_USAGE, run());
        assertEquals(Main.EXIT_USAGE, run("--bogus", "x.btor2"));
        assertEquals(Main.EXIT_USAGE, run("--miter", "only-one.btor2"));
        assertTrue(err().contains("usage: btoropt"));
    }

    @Test
    public void testListPasses() {
        assertEquals(Main.EXIT_OK, run("--list-passes"));
        assertTrue(out().contains("rename-inputs\ttransform"));
        assertTrue(out().contains("check-sorts\tvalidation"));
    }

    @Test
    public void testRunsPassesAndPrintsResult() throws Exception {
        String path = file("in.btor2", "1 sort bitvec 8", "2 input 1 a", "3 input 1 b", "4 add 1 2 3");

        assertEquals(Main.EXIT_OK, run(path, "rename-inputs", "check-sorts"));
        assertEquals("1 sort bitvec 8\n2 input 1 inp_0\n3 input 1 inp_1\n4 add 1 2 3\n", out());
        assertEquals("", err());
    }

    @Test
    public void testUnknownPass() throws Exception {
        String path = file("in.btor2", "1 sort bitvec 8");

        assertEquals(Main.EXIT_ERROR, run(path, "rename-inputs", "no-such-pass"));
        assertTrue(err().contains("unknown pass `no-such-pass`"));
        assertEquals("", out());
    }

    @Test
    public void testParseAndReadErrors() throws Exception {
        String path = file("bad.btor2", "1 sort bitvec 8", "2 frob 1");

        assertEquals(Main.EXIT_ERROR, run(path));
        assertTrue(err(), err().startsWith("parse error: line 2:"));

        assertEquals(Main.EXIT_ERROR, run(new File(tmp.getRoot(), "missing.btor2").getPath()));
        assertTrue(err().contains("failed to read file"));
    }

    @Test
    public void testValidationFailureListsDiagnostics() throws Exception {
        String path = file("in.btor2", "1 sort bitvec 8", "2 input 1 x", "3 bad 2");

        assertEquals(Main.EXIT_ERROR, run(path, "check-sorts"));
        assertTrue(err(), err().startsWith("validation failed: 1 error(s)"));
        assertTrue(err(), err().contains("[check-sorts] lid 3: condition 2 must be bv1"));
    }

    @Test
    public void testModularLowering() throws Exception {
        String path = file(
                "mod.btor2",
                "module m {",
                "1 sort bitvec 1",
                "2 input 1 a",
                "3 output 2 o",
                "}");

        assertEquals(Main.EXIT_ERROR, run(path));
        assertEquals(Main.EXIT_OK, run("--modular", path, "lower-modules", "check-flat"));
        assertEquals("1 sort bitvec 1\n2 input 1 a\n3 output 2 o\n", out());
    }

    @Test
    public void testMiter() throws Exception {
        String a = file("a.btor2", "1 sort bitvec 8", "2 input 1 x", "3 one 1", "4 add 1 2 3", "5 output 4 y");
        String b = file("b.btor2", "1 sort bitvec 8", "2 input 1 x", "3 add 1 2 2", "4 output 3 y");
        String c = file("c.btor2", "1 sort bitvec 8", "2 input 1 p", "3 output 2 q");

        assertEquals(Main.EXIT_OK, run("--miter", a, b, "check-sorts"));
        assertTrue(out().contains(" neq "));
        assertEquals(Main.EXIT_ERROR, run("--miter", a, c));
        assertTrue(err().startsWith("miter error:"));
    }
}
