package dev.btoropt.passes;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import dev.btoropt.ir.Btor2;
import dev.btoropt.ir.BtorError;
import dev.btoropt.ir.Diagnostic;
import dev.btoropt.ir.Program;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class PipelineTest {
    private static final class Recording implements Transform {
        private final String name;
        private final List<String> log;

        Recording(String name, List<String> log) {
            this.name = name;
            this.log = log;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Program run(Program program) {
            log.add(name);
            return program;
        }
    }

    @Test
    public void testStandardRegistryListsEveryPass() {
        List<String> names = new ArrayList<>(PassRegistry.standard().byName().keySet());
        assertEquals(
                List.of(
                        "rename-inputs",
                        "init-all-states",
                        "renumber-lids",
                        "lower-modules",
                        "check-lid-ordering",
                        "check-references",
                        "check-sorts",
                        "check-flat"),
                names);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateRegistrationIsRejected() {
        PassRegistry reg = PassRegistry.standard();
        reg.register(new RenameInputs());
    }

    @Test
    public void testUnknownPassFailsBeforeAnythingRuns() throws Exception {
        List<String> log = new ArrayList<>();
        PassRegistry reg = new PassRegistry();
        reg.register(new Recording("first", log));
        try {
            Pipeline.resolve(reg, List.of("first", "no-such-pass", "first"));
            fail();
        } catch (BtorError.UnknownPass e) {
            assertEquals("no-such-pass", e.passName());
        }
        assertTrue(log.isEmpty());
    }

    @Test
    public void testPassesRunInRequestedOrderWithDuplicates() throws Exception {
        List<String> log = new ArrayList<>();
        PassRegistry reg = new PassRegistry();
        reg.register(new Recording("a", log));
        reg.register(new Recording("b", log));

        Pipeline.resolve(reg, List.of("b", "a", "b")).run(Btor2.parse("1 sort bitvec 1\n"));
        assertEquals(List.of("b", "a", "b"), log);
    }

    @Test
    public void testDiagnosticsAreCollectedAcrossPasses() throws Exception {
        Program modular = Btor2.parse(
                "module m {\n1 sort bitvec 1\n2 not 1 9\n}\n", true);
        Pipeline pipeline = Pipeline.resolve(
                PassRegistry.standard(), List.of(CheckReferences.NAME, CheckFlat.NAME));
        try {
            pipeline.run(modular);
            fail();
        } catch (BtorError.ValidationFailure e) {
            List<Diagnostic> ds = e.diagnostics();
            assertEquals(2, ds.size());
            assertEquals(CheckReferences.NAME, ds.get(0).pass());
            assertEquals(CheckFlat.NAME, ds.get(1).pass());
        }
    }

    @Test
    public void testTransformsSeeEarlierResults() throws Exception {
        Program p = Btor2.parse("3 sort bitvec 8\n7 input 3 a\n");
        Program out = Pipeline.resolve(PassRegistry.standard(), List.of(RenumberLids.NAME, RenameInputs.NAME))
                .run(p);
        assertEquals("1 sort bitvec 8\n2 input 1 inp_0\n", Btor2.emit(out));
    }
}
