package dumb.lis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.lis.EvaluatorException.UnboundVariable;
import dumb.lis.Reader.ParseException;
import dumb.lis.util.Json;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs source text: batch files from the command line, or an interactive REPL.
 */
public class Lis {

    public static final String QUIT_COMMAND = ".q";
    public static final String PROMPT1 = "▹  ";
    public static final String PROMPT2 = "⋯    ";
    public static final String ERROR_MARK = "🚨 ";
    static final boolean DEFAULT_TAIL_CALLS = true;
    private static final String CONFIG_RESOURCE = "/lis.json";
    private static final Logger logger = LoggerFactory.getLogger(Lis.class);

    private final Configuration config;
    private final Evaluator evaluator;
    private final PrintStream out;

    public Lis(Configuration config, PrintStream out) {
        this.config = config;
        this.evaluator = new Evaluator(config.tailCalls());
        this.out = out;
    }

    public static void main(String[] args) {
        var status = execute(args, System.in, System.out, System.err);
        if (status != 0) System.exit(status);
    }

    static int execute(String[] args, InputStream in, PrintStream out, PrintStream err) {
        Path configFile = null;
        var noTailCalls = false;
        var positional = new ArrayList<String>();

        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-c", "--config" -> configFile = Path.of(args[++i]);
                    case "--no-tco" -> noTailCalls = true;
                    case "-h", "--help" -> {
                        printUsage(out);
                        return 0;
                    }
                    default -> positional.add(args[i]);
                }
            } catch (ArrayIndexOutOfBoundsException e) {
                err.println("Missing value for " + args[i - 1]);
                printUsage(err);
                return 2;
            }
        }

        Configuration config;
        try {
            config = Configuration.load(configFile);
        } catch (IOException e) {
            err.println("Cannot load configuration " + configFile + ": " + e.getMessage());
            return 2;
        }
        if (noTailCalls) config = config.withTailCalls(false);
        logger.debug("Configuration: {}", Json.str(config));

        var lis = new Lis(config, out);
        if (positional.isEmpty()) {
            var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            new Repl(lis, reader, out, err).run();
            return 0;
        }
        var overrides = envFromArgs(positional.subList(1, positional.size()));
        return lis.batch(Path.of(positional.get(0)), overrides, args, err);
    }

    private static void printUsage(PrintStream s) {
        s.printf("Usage: java %s [-c config.json] [--no-tco] [source_file.scm [name=value ...]]%n", Lis.class.getName());
        s.println("Without a source file, starts an interactive session.");
    }

    /**
     * Turns {@code name=value} arguments into bindings. Arguments without exactly
     * one {@code =} separating two non-empty parts are skipped.
     */
    public static Map<String, Term> envFromArgs(List<String> args) {
        var env = new LinkedHashMap<String, Term>();
        for (var arg : args) {
            if (arg.indexOf('=') < 0) continue;
            var parts = arg.split("=", -1);
            if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
                logger.warn("Ignoring malformed binding argument: {}", arg);
                continue;
            }
            env.put(parts[0], Reader.parseAtom(parts[1]));
        }
        return env;
    }

    int batch(Path file, Map<String, Term> overrides, String[] args, PrintStream err) {
        try {
            runFile(file, overrides);
            return 0;
        } catch (UnboundVariable e) {
            out.println(config.errorMark() + "'" + e.name() + "' was not defined.");
            out.println("    You can define it as an option:");
            out.println("    $ lis " + String.join(" ", args) + " " + e.name() + "=<value>");
            return 1;
        } catch (EvaluatorException | ArithmeticException | ParseException e) {
            err.println(config.errorMark() + e.getMessage());
            logger.error("Evaluation of {} failed", file, e);
            return 1;
        } catch (IOException e) {
            err.println(config.errorMark() + "Cannot read " + file + ": " + e.getMessage());
            return 1;
        }
    }

    /**
     * A fresh top-level environment: an empty frame holding {@code overrides},
     * layered over the standard environment.
     */
    public Environment globalEnv(Map<String, ? extends Term> overrides) {
        var standard = Builtins.standardEnv(evaluator, out);
        for (var name : overrides.keySet())
            if (standard.contains(name)) logger.debug("Binding '{}' shadows the standard one", name);
        var env = standard.extend();
        env.update(overrides);
        return env;
    }

    /**
     * Evaluates the top-level expressions of {@code source} one at a time, as
     * {@link Results#next()} is called. An expression is read only after the
     * previous one has been evaluated.
     */
    public Results runLines(String source, Map<String, ? extends Term> overrides) {
        var reader = Reader.of(source);
        var env = globalEnv(overrides);
        return () -> {
            var exp = reader.next();
            return exp == null ? null : evaluator.evaluate(exp, env);
        };
    }

    /** Evaluates every expression of {@code source}; the value of the last one, or no-value if there is none. */
    public Term run(String source, Map<String, ? extends Term> overrides) throws ParseException {
        var results = runLines(source, overrides);
        Term result = Term.NONE;
        for (var r = results.next(); r != null; r = results.next())
            result = r;
        return result;
    }

    public Term run(String source) throws ParseException {
        return run(source, Map.of());
    }

    public Term runFile(Path file, Map<String, ? extends Term> overrides) throws IOException, ParseException {
        logger.info("Running {}", file);
        var start = System.nanoTime();
        var result = run(Files.readString(file, StandardCharsets.UTF_8), overrides);
        logger.info("Finished {} in {} ms", file, (System.nanoTime() - start) / 1_000_000);
        return result;
    }

    public Configuration config() {
        return config;
    }

    public Evaluator evaluator() {
        return evaluator;
    }

    /** The values of a source's top-level expressions, produced on demand. */
    @FunctionalInterface
    public interface Results {
        /** Reads and evaluates the next expression; null once the source is exhausted. */
        @Nullable Term next() throws ParseException;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Configuration(
            @JsonProperty("prompt1") String prompt1,
            @JsonProperty("prompt2") String prompt2,
            @JsonProperty("errorMark") String errorMark,
            @JsonProperty("quitCommand") String quitCommand,
            @JsonProperty("tailCalls") boolean tailCalls
    ) {
        @JsonCreator
        public Configuration(
                @JsonProperty("prompt1") String prompt1,
                @JsonProperty("prompt2") String prompt2,
                @JsonProperty("errorMark") String errorMark,
                @JsonProperty("quitCommand") String quitCommand,
                @JsonProperty("tailCalls") Boolean tailCalls
        ) {
            this(
                    prompt1 != null ? prompt1 : PROMPT1,
                    prompt2 != null ? prompt2 : PROMPT2,
                    errorMark != null ? errorMark : ERROR_MARK,
                    quitCommand != null ? quitCommand : QUIT_COMMAND,
                    tailCalls != null ? tailCalls : DEFAULT_TAIL_CALLS
            );
        }

        public Configuration() {
            this(PROMPT1, PROMPT2, ERROR_MARK, QUIT_COMMAND, DEFAULT_TAIL_CALLS);
        }

        public Configuration withTailCalls(boolean tailCalls) {
            return new Configuration(prompt1, prompt2, errorMark, quitCommand, tailCalls);
        }

        /** Reads {@code file}, or the bundled defaults when it is null. */
        public static Configuration load(@Nullable Path file) throws IOException {
            if (file != null) return Json.obj(file, Configuration.class);
            try (var in = Lis.class.getResourceAsStream(CONFIG_RESOURCE)) {
                if (in == null) {
                    logger.warn("Configuration resource {} not found, using defaults", CONFIG_RESOURCE);
                    return new Configuration();
                }
                return Json.obj(in, Configuration.class);
            }
        }
    }
}
