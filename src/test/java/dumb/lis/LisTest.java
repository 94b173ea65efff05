package dumb.lis;

import dumb.lis.Reader.UnexpectedCloseBracket;
import dumb.lis.Reader.UnexpectedEndOfSource;
import dumb.lis.util.Json;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LisTest extends AbstractTest {

    @TempDir
    Path dir;

    @Test
    void runReturnsTheLastResult() {
        assertEquals(i(120), run("(define (fact n) (if (= n 0) 1 (* n (fact (- n 1))))) (fact 5)"));
        assertSame(Term.NONE, run(""));
        assertSame(Term.NONE, run("; only a comment"));
    }

    @Test
    void runLinesYieldsEachResultLazily() throws Exception {
        var results = new ArrayList<Term>();
        var lines = lis.runLines("(define x 1) (display x) (+ x 1)", Map.of());
        for (var r = lines.next(); r != null; r = lines.next()) results.add(r);
        assertEquals(List.of(Term.NONE, Term.NONE, i(2)), results);
        assertEquals("1", printed().strip());

        var it = lis.runLines("(display 1) (display 2)", Map.of());
        it.next();
        assertEquals("1\n1", printed().strip().replace("\r\n", "\n"));
    }

    @Test
    void expressionsBeforeASyntaxErrorAreEvaluated() {
        assertThrows(UnexpectedEndOfSource.class, () -> lis.run("(display 1) ("));
        assertEquals("1", printed().strip());

        var lines = lis.runLines("(+ 1 2) (car (list 1)))", Map.of());
        assertDoesNotThrow(() -> {
            assertEquals(i(3), lines.next());
            assertEquals(i(1), lines.next());
        });
        assertThrows(UnexpectedCloseBracket.class, lines::next);
    }

    @Test
    void batchModeRunsEverythingBeforeASyntaxError() throws Exception {
        var file = dir.resolve("truncated.scm");
        Files.writeString(file, "(display 1)\n(display 2)\n(display (+ 1");
        var out = new ByteArrayOutputStream();
        var err = new ByteArrayOutputStream();
        var status = Lis.execute(new String[]{file.toString()}, new ByteArrayInputStream(new byte[0]),
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
        assertEquals(1, status);
        assertEquals("1\n2", out.toString(StandardCharsets.UTF_8).strip().replace("\r\n", "\n"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Unexpected EOF"));
    }

    @Test
    void overridesAreVisibleAndShadowTheStandardEnvironment() {
        assertEquals(i(42), run("(* n 2)", Map.of("n", i(21))));
        assertEquals(sym("mine"), run("car", Map.of("car", sym("mine"))));
        assertEquals(i(1), run("(car (list 1))"));
    }

    @Test
    void globalEnvLayersAnEmptyFrameOverTheStandardOne() {
        var env = lis.globalEnv(Map.of("x", i(1)));
        assertEquals(Map.of("x", i(1)), env.frame());
        assertNotNull(env.parent());
        assertTrue(env.parent().frame().containsKey("car"));
    }

    @Test
    void envFromArgsSkipsMalformedArguments() {
        var env = Lis.envFromArgs(List.of("file.scm", "a=1", "b=2.5", "c=word", "=x", "d=", "e=f=g", "plain"));
        assertEquals(Map.of("a", i(1), "b", r(2.5), "c", sym("word")), env);
    }

    @Test
    void runFile() throws Exception {
        var file = dir.resolve("prog.scm");
        Files.writeString(file, """
                ; sums the first n integers
                (define (sum n acc) (if (= n 0) acc (sum (- n 1) (+ acc n))))
                (display (sum limit 0))
                (sum limit 0)
                """);
        assertEquals(i(5050), lis.runFile(file, Map.of("limit", i(100))));
        assertEquals("5050", printed().strip());
    }

    @Test
    void batchModeReportsUnboundVariableWithAHint() throws Exception {
        var file = dir.resolve("needs-n.scm");
        Files.writeString(file, "(display (* n 2))");
        var out = new ByteArrayOutputStream();
        var err = new ByteArrayOutputStream();
        var status = Lis.execute(new String[]{file.toString()}, new ByteArrayInputStream(new byte[0]),
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
        assertEquals(1, status);
        var text = out.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("'n' was not defined."), text);
        assertTrue(text.contains(file + " n=<value>"), text);
    }

    @Test
    void batchModeUsesCommandLineBindings() throws Exception {
        var file = dir.resolve("needs-n.scm");
        Files.writeString(file, "(display (* n 2))");
        var out = new ByteArrayOutputStream();
        var status = Lis.execute(new String[]{file.toString(), "n=21"}, new ByteArrayInputStream(new byte[0]),
                new PrintStream(out, true, StandardCharsets.UTF_8), System.err);
        assertEquals(0, status);
        assertEquals("42", out.toString(StandardCharsets.UTF_8).strip());
    }

    @Test
    void batchModeReportsOtherFailures() throws Exception {
        var file = dir.resolve("bad.scm");
        Files.writeString(file, "(display 1) (car 5)");
        var out = new ByteArrayOutputStream();
        var err = new ByteArrayOutputStream();
        var status = Lis.execute(new String[]{file.toString()}, new ByteArrayInputStream(new byte[0]),
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
        assertEquals(1, status);
        assertEquals("1", out.toString(StandardCharsets.UTF_8).strip());
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("source: (car 5)"));

        assertEquals(1, Lis.execute(new String[]{dir.resolve("missing.scm").toString()}, new ByteArrayInputStream(new byte[0]),
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8)));
    }

    @Test
    void missingOptionValueIsAUsageError() {
        var err = new ByteArrayOutputStream();
        assertEquals(2, Lis.execute(new String[]{"--config"}, new ByteArrayInputStream(new byte[0]),
                System.out, new PrintStream(err, true, StandardCharsets.UTF_8)));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage"));
    }

    @Test
    void defaultConfigurationComesFromTheBundledResource() throws Exception {
        var config = Lis.Configuration.load(null);
        assertEquals(Lis.QUIT_COMMAND, config.quitCommand());
        assertEquals(Lis.PROMPT1, config.prompt1());
        assertTrue(config.tailCalls());
    }

    @Test
    void configurationFileFillsMissingFieldsWithDefaults() throws Exception {
        var file = dir.resolve("lis.json");
        Files.writeString(file, "{\"quitCommand\": \":quit\", \"tailCalls\": false}");
        var config = Lis.Configuration.load(file);
        assertEquals(":quit", config.quitCommand());
        assertFalse(config.tailCalls());
        assertEquals(Lis.ERROR_MARK, config.errorMark());

        var copy = Json.obj(Json.str(config), Lis.Configuration.class);
        assertEquals(config, copy);
    }

    @Test
    void noTcoOptionDisablesTailCalls() throws Exception {
        var file = dir.resolve("fact.scm");
        Files.writeString(file, "(define (fact n) (if (= n 0) 1 (* n (fact (- n 1))))) (display (fact 6))");
        var out = new ByteArrayOutputStream();
        assertEquals(0, Lis.execute(new String[]{"--no-tco", file.toString()}, new ByteArrayInputStream(new byte[0]),
                new PrintStream(out, true, StandardCharsets.UTF_8), System.err));
        assertEquals("720", out.toString(StandardCharsets.UTF_8).strip());
    }
}
