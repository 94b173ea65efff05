package dumb.lis;

import dumb.lis.Reader.ParseException;
import org.junit.jupiter.api.BeforeEach;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.fail;

abstract class AbstractTest {

    protected Lis lis;
    protected ByteArrayOutputStream output;

    @BeforeEach
    void setUp() {
        output = new ByteArrayOutputStream();
        lis = new Lis(configuration(), new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    protected Lis.Configuration configuration() {
        return new Lis.Configuration();
    }

    protected Term run(String source) {
        return run(source, Map.of());
    }

    protected Term run(String source, Map<String, Term> overrides) {
        try {
            return lis.run(source, overrides);
        } catch (ParseException e) {
            fail("Failed to parse source:\n" + source + "\n" + e.getMessage());
            return Term.NONE;
        }
    }

    protected static Term parse(String source) {
        try {
            return Reader.parse(source);
        } catch (ParseException e) {
            fail("Failed to parse source:\n" + source + "\n" + e.getMessage());
            return Term.NONE;
        }
    }

    protected String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    protected static Term.Int i(long value) {
        return new Term.Int(value);
    }

    protected static Term.Real r(double value) {
        return new Term.Real(value);
    }

    protected static Term.Atom sym(String name) {
        return Term.Atom.of(name);
    }

    protected static Term.Lst lst(Term... terms) {
        return new Term.Lst(terms);
    }
}
