package brook.lang;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BrookTest {

    @TempDir
    Path tempDir;

    ByteArrayOutputStream out;
    ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int execute(InputStream in, String... args) {
        return Brook.execute(args, in, printStream(out), printStream(err));
    }

    private int execute(String... args) {
        return execute(InputStream.nullInputStream(), args);
    }

    private int runScript(String source) throws IOException {
        var script = tempDir.resolve("script.brook");
        Files.writeString(script, source);
        return execute(script.toString());
    }

    private static PrintStream printStream(ByteArrayOutputStream buffer) {
        return Brook.utf8(buffer);
    }

    private static List<String> lines(ByteArrayOutputStream buffer) {
        return buffer.toString(StandardCharsets.UTF_8).lines().collect(Collectors.toList());
    }

    @Test
    void writesOutputAsUtf8() throws IOException {
        var exitCode = runScript("print \"h\u00e9llo \u2603\";\n");
        assertEquals(Brook.EXIT_OK, exitCode);
        var expected = ("h\u00e9llo \u2603" + System.lineSeparator()).getBytes(StandardCharsets.UTF_8);
        assertArrayEquals(expected, out.toByteArray());
    }

    @Test
    void deeplyNestedInputIsAParseError() throws IOException {
        var exitCode = runScript("print " + "(".repeat(20000) + "1" + ")".repeat(20000) + ";\n");
        assertEquals(Brook.EXIT_SCRIPT_ERROR, exitCode);
        assertEquals("", out.toString(StandardCharsets.UTF_8));
        assertTrue(lines(err).get(0).startsWith("parser: Nesting too deep. [line 1, col "));
    }

    @Test
    void runsAScriptFile() throws IOException {
        var exitCode = runScript("// count to three\ni = 0;\nwhile i < 3 {\n  print i;\n  i = i + 1;\n}\n");
        assertEquals(Brook.EXIT_OK, exitCode);
        assertEquals(List.of("0", "1", "2"), lines(out));
        assertEquals(List.of(), lines(err));
    }

    @Test
    void wrongArgumentCountPrintsUsage() {
        assertEquals(Brook.EXIT_USAGE, execute());
        assertEquals(Brook.EXIT_USAGE, execute("a.brook", "b.brook"));
        assertEquals(List.of("Usage: brook <script>", "Usage: brook <script>"), lines(err));
        assertEquals(List.of(), lines(out));
    }

    @Test
    void missingScriptFile() {
        var missing = tempDir.resolve("missing.brook");
        assertEquals(Brook.EXIT_NO_INPUT, execute(missing.toString()));
        assertEquals(List.of("brook: " + missing + ": No such file or directory"), lines(err));
    }

    @Test
    void readsTheScriptFromStandardInput() {
        var in = new ByteArrayInputStream("print uppercase(\"stdin\");".getBytes(StandardCharsets.UTF_8));
        assertEquals(Brook.EXIT_OK, execute(in, "-"));
        assertEquals(List.of("STDIN"), lines(out));
    }

    @Test
    void parseErrorStopsBeforeEvaluation() throws IOException {
        assertEquals(Brook.EXIT_SCRIPT_ERROR, runScript("print 1;\nprint 2"));
        assertEquals(List.of(), lines(out));
        assertEquals(List.of("parser: Expect ';' after value. Found end of input. [line 2, col 8]"), lines(err));
    }

    @Test
    void lexErrorStopsBeforeEvaluation() throws IOException {
        assertEquals(Brook.EXIT_SCRIPT_ERROR, runScript("print 1;\nprint \"abc;"));
        assertEquals(List.of(), lines(out));
        assertEquals(List.of("scanner: Unterminated string. [line 2, col 7]"), lines(err));
    }

    @Test
    void evalErrorKeepsEarlierOutput() throws IOException {
        assertEquals(Brook.EXIT_RUNTIME_ERROR, runScript("print 1; print 1 / 0; print 2;"));
        assertEquals(List.of("1"), lines(out));
        assertEquals(List.of("interpreter: Division by zero. [line 1, col 18]"), lines(err));
    }

    @Test
    void fileBuiltinsWorkEndToEnd() throws IOException {
        var input = tempDir.resolve("words.txt");
        var output = tempDir.resolve("shout.txt");
        Files.writeString(input, "alpha beta gamma");

        var exitCode = runScript(
            "words = split(read_file(\"" + input + "\"), \" \");\n"
                + "print length(words);\n"
                + "write_file(\"" + output + "\", uppercase(join(\"-\", words)));\n");

        assertEquals(Brook.EXIT_OK, exitCode);
        assertEquals(List.of("3"), lines(out));
        assertEquals("ALPHA-BETA-GAMMA", Files.readString(output));
    }

    @Test
    void printTokensFlagDumpsTheTokenStream() {
        var exitCode = Brook.run("print 1;", new Brook.Flags(true, false), printStream(out), printStream(err));
        assertEquals(Brook.EXIT_OK, exitCode);
        assertEquals(
            List.of(
                "(Token PRINT \"print\" 1:1)",
                "(Token INTEGER \"1\" 1:7)",
                "(Token SEMICOLON \";\" 1:8)",
                "(Token EOF \"\" 1:9)",
                "1"),
            lines(out));
    }

    @Test
    void printAstFlagShowsStatements() {
        var exitCode = Brook.run("x = 1;", new Brook.Flags(false, true), printStream(out), printStream(err));
        assertEquals(Brook.EXIT_OK, exitCode);
        assertTrue(lines(out).get(0).startsWith("Assign["), lines(out).get(0));
    }

    @Test
    void noFlagsPrintsOnlyScriptOutput() {
        assertEquals(Brook.EXIT_OK, Brook.run("print 1;", Brook.Flags.none(), printStream(out), printStream(err)));
        assertEquals(List.of("1"), lines(out));
    }
}
