package dumb.lis;

import dumb.lis.Reader.ParseException;
import dumb.lis.Reader.UnexpectedCloseBracket;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Map;

/**
 * Read-eval-print loop. Input continues over several lines until every open
 * bracket is closed; definitions persist from one input to the next.
 */
public class Repl {

    private static final Logger logger = LoggerFactory.getLogger(Repl.class);
    private static final String ELLIPSIS = "…";
    private static final int MAX_MESSAGE_LENGTH = 16;

    private final Lis lis;
    private final Lis.Configuration config;
    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;
    private final Environment env;

    public Repl(Lis lis, BufferedReader in, PrintStream out, PrintStream err) {
        this.lis = lis;
        this.config = lis.config();
        this.in = in;
        this.out = out;
        this.err = err;
        this.env = lis.globalEnv(Map.of());
    }

    public void run() {
        err.println("To exit type " + config.quitCommand());

        while (true) {
            String source;
            try {
                source = multilineInput();
            } catch (QuitRequest e) {
                break;
            } catch (UnexpectedCloseBracket e) {
                out.println(config.errorMark() + e.getMessage());
                continue;
            } catch (IOException e) {
                logger.error("Failed to read input", e);
                break;
            }
            if (source == null) break;
            if (source.isBlank()) continue;

            try {
                var reader = Reader.of(source);
                for (var exp = reader.next(); exp != null; exp = reader.next()) {
                    var result = lis.evaluator().evaluate(exp, env);
                    if (result != Term.NONE) out.println(result.toLisp());
                }
            } catch (ParseException | EvaluatorException | ArithmeticException e) {
                out.println(config.errorMark() + e.getMessage());
            }
        }
        out.println();
    }

    /**
     * Reads lines until brackets balance.
     *
     * @return the joined lines, or null at end of input
     */
    @Nullable String multilineInput() throws IOException, QuitRequest, UnexpectedCloseBracket {
        var depth = 0;
        var lines = new ArrayList<String>();
        var prompt = config.prompt1();
        while (true) {
            out.print(prompt);
            out.flush();
            var raw = in.readLine();
            if (raw == null) return null;
            var line = raw.stripTrailing();
            if (line.equals(config.quitCommand())) throw new QuitRequest();
            for (var i = 0; i < line.length(); i++) {
                var c = line.charAt(i);
                if (c == ';') break;
                if (Reader.isOpen(c)) depth++;
                else if (Reader.isClose(c)) depth--;
                if (depth < 0) throw unexpectedClose(line);
            }
            lines.add(line);
            prompt = config.prompt2();
            if (depth == 0) break;
        }
        return String.join("\n", lines);
    }

    private static UnexpectedCloseBracket unexpectedClose(String line) {
        var snippet = line.length() < MAX_MESSAGE_LENGTH
                ? line
                : ELLIPSIS + line.substring(line.length() - (MAX_MESSAGE_LENGTH - 1));
        return new UnexpectedCloseBracket("Unexpected close bracket", snippet);
    }

    static class QuitRequest extends Exception {
        QuitRequest() {
            super("quit");
        }
    }
}
