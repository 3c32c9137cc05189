package brook.lang;

import static lombok.AccessLevel.PRIVATE;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor(access = PRIVATE)
public class Brook {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 64;
    static final int EXIT_SCRIPT_ERROR = 65;
    static final int EXIT_NO_INPUT = 66;
    static final int EXIT_RUNTIME_ERROR = 70;

    public static void main(String[] args) {
        var out = utf8(new FileOutputStream(FileDescriptor.out));
        var err = utf8(new FileOutputStream(FileDescriptor.err));
        System.exit(execute(args, System.in, out, err));
    }

    /** Console stream that writes UTF-8 whatever the platform charset is. */
    static PrintStream utf8(OutputStream stream) {
        return new PrintStream(stream, true, StandardCharsets.UTF_8);
    }

    static int execute(String[] args, InputStream in, PrintStream out, PrintStream err) {
        if (args.length != 1) {
            err.println("Usage: brook <script>");
            return EXIT_USAGE;
        }

        var path = args[0];
        String source;
        try {
            source = readSource(path, in);
        } catch (IOException | InvalidPathException ex) {
            err.println("brook: " + path + ": " + describe(ex));
            return EXIT_NO_INPUT;
        }
        log.debug("Loaded {} ({} chars)", path, source.length());

        return run(source, Flags.fromSystemProperties(), out, err);
    }

    private static String readSource(String path, InputStream in) throws IOException {
        byte[] bytes;
        if ("-".equals(path)) {
            bytes = in.readAllBytes();
        } else {
            bytes = Files.readAllBytes(Paths.get(path));
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Runs one program from scanning to evaluation with a fresh environment.
     * Returns the process exit code.
     */
    static int run(String source, Flags flags, PrintStream out, PrintStream err) {
        Ast.Program program;
        try {
            if (flags.printTokens()) {
                new Scanner(source).getTokens().forEach(out::println);
            }
            var parser = new Parser(new TokenStream(new Scanner(source)));
            program = parser.parse();
        } catch (LexError | ParseError ex) {
            report(err, ex);
            return EXIT_SCRIPT_ERROR;
        }
        log.debug("Parsed {} top-level statements", program.statements().size());

        if (flags.printAst()) {
            program.statements().forEach(out::println);
        }

        var environment = new Environment();
        try {
            new Interpreter(out).interpret(program, environment);
        } catch (EvalError ex) {
            report(err, ex);
            return EXIT_RUNTIME_ERROR;
        } finally {
            out.flush();
        }
        log.debug("Run finished with {} variables bound", environment.snapshot().size());

        return EXIT_OK;
    }

    private static void report(PrintStream err, ScriptError error) {
        err.println(error.stage() + ": " + error.getMessage()
            + " [line " + error.getLine() + ", col " + error.getColumn() + "]");
    }

    private static String describe(Exception ex) {
        if (ex instanceof NoSuchFileException) {
            return "No such file or directory";
        }
        if (ex instanceof AccessDeniedException) {
            return "Permission denied";
        }
        return ex.getMessage();
    }

    /**
     * Diagnostics toggles, set with {@code -Dbrook.printTokens=true} and
     * {@code -Dbrook.printAst=true}.
     */
    record Flags(boolean printTokens, boolean printAst) {

        static Flags none() {
            return new Flags(false, false);
        }

        static Flags fromSystemProperties() {
            return new Flags(
                Boolean.getBoolean("brook.printTokens"),
                Boolean.getBoolean("brook.printAst"));
        }
    }
}
