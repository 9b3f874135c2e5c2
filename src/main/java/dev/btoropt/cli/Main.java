package dev.btoropt.cli;

import dev.btoropt.ir.Btor2;
import dev.btoropt.ir.BtorError;
import dev.btoropt.ir.Diagnostic;
import dev.btoropt.ir.Program;
import dev.btoropt.miter.MiterBuilder;
import dev.btoropt.passes.LowerModules;
import dev.btoropt.passes.Pass;
import dev.btoropt.passes.PassRegistry;
import dev.btoropt.passes.Pipeline;
import dev.btoropt.passes.Transform;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Runs the tool and returns its exit code instead of exiting. */
    static int run(String[] argv, PrintStream out, PrintStream err) {
        Args parsed = Args.parse(argv);
        if (parsed == null) {
            usage(err);
            return EXIT_USAGE;
        }
        if (parsed.help) {
            usage(out);
            return EXIT_OK;
        }

        PassRegistry registry = PassRegistry.standard();
        if (parsed.listPasses) {
            for (Pass pass : registry.all()) {
                out.println(pass.name() + "\t" + ((pass instanceof Transform) ? "transform" : "validation"));
            }
            if (parsed.files.isEmpty()) {
                return EXIT_OK;
            }
        }

        Pipeline pipeline;
        try {
            pipeline = Pipeline.resolve(registry, parsed.passes);
        } catch (BtorError.UnknownPass e) {
            err.println("error: " + e.getMessage());
            err.println("hint: run with `--list-passes` to see the available passes");
            return EXIT_ERROR;
        }

        Program program;
        try {
            if (parsed.miter) {
                Program a = load(parsed.files.get(0), parsed.modular);
                Program b = load(parsed.files.get(1), parsed.modular);
                program = MiterBuilder.build(a, b);
            } else {
                program = Btor2.load(read(parsed.files.get(0)), parsed.modular);
            }
            program = pipeline.run(program);
        } catch (IOException e) {
            err.println("failed to read file: " + e.getMessage());
            return EXIT_ERROR;
        } catch (BtorError.Parse e) {
            err.println("parse error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (BtorError.UnresolvedReference e) {
            err.println("unresolved reference: " + e.getMessage());
            return EXIT_ERROR;
        } catch (BtorError.ValidationFailure e) {
            err.println("validation failed: " + e.diagnostics().size() + " error(s)");
            for (Diagnostic d : e.diagnostics()) {
                err.println("  " + d);
            }
            return EXIT_ERROR;
        } catch (BtorError.DisjointInterface | BtorError.SortMismatch | BtorError.LidOverflow e) {
            err.println("miter error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (BtorError e) {
            err.println("error: " + e.getMessage());
            return EXIT_ERROR;
        }

        out.print(Btor2.emit(program));
        out.flush();
        return EXIT_OK;
    }

    /** Miter inputs are lowered first when they may be modular. */
    private static Program load(String path, boolean modular) throws IOException, BtorError {
        Program p = Btor2.load(read(path), modular);
        return modular ? new LowerModules().run(p) : p;
    }

    private static String read(String path) throws IOException {
        return Files.readString(Path.of(path), StandardCharsets.UTF_8);
    }

    private static void usage(PrintStream out) {
        out.println("usage: btoropt [--modular] [--list-passes] <file.btor2> [pass...]");
        out.println("       btoropt [--modular] --miter <a.btor2> <b.btor2> [pass...]");
    }

    private static final class Args {
        boolean help;
        boolean modular;
        boolean listPasses;
        boolean miter;
        List<String> files = List.of();
        List<String> passes = List.of();

        static Args parse(String[] argv) {
            Args a = new Args();
            ArrayList<String> args = new ArrayList<>(List.of(argv));
            int i = 0;
            while (i < args.size()) {
                String s = args.get(i);
                if (!s.startsWith("-")) {
                    break;
                }
                switch (s) {
                    case "--help", "-h" -> a.help = true;
                    case "--modular" -> a.modular = true;
                    case "--list-passes" -> a.listPasses = true;
                    case "--miter" -> a.miter = true;
                    default -> {
                        return null;
                    }
                }
                i++;
            }

            if (a.help) {
                return a;
            }

            int fileCount = a.miter ? 2 : 1;
            if (args.size() - i < fileCount) {
                // `--list-passes` alone is a complete command.
                return (a.listPasses && !a.miter && i == args.size()) ? a : null;
            }
            a.files = List.copyOf(args.subList(i, i + fileCount));
            a.passes = List.copyOf(args.subList(i + fileCount, args.size()));
            return a;
        }
    }
}
