package dumb.lis;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads source text into {@link Term}s. Any of {@code ()}, {@code []} and
 * {@code {}} delimit a list; a list must be closed by the partner of the
 * bracket that opened it. {@code ;} comments run to the end of the line.
 */
public class Reader {
    private static final int CONTEXT_BUFFER_SIZE = 50;
    private static final String OPEN = "([{";
    private static final String CLOSE = ")]}";
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT = Pattern.compile(
            "[+-]?(\\d+\\.?\\d*([eE][+-]?\\d+)?|\\.\\d+([eE][+-]?\\d+)?|(?i:inf|infinity|nan))");

    private final java.io.Reader reader;
    private final StringBuilder contextBuffer = new StringBuilder(CONTEXT_BUFFER_SIZE);
    private int currentChar = -2;
    private int line = 1;
    private int col = 0;

    private Reader(java.io.Reader reader) {
        this.reader = reader;
    }

    /** Reads exactly one expression; anything after it is ignored. */
    public static Term parse(String source) throws ParseException {
        try (var r = new StringReader(source)) {
            var reader = new Reader(r);
            reader.skipWhitespaceAndComments();
            if (reader.peek() == -1) throw reader.endOfSource("Empty source");
            return reader.readTerm();
        } catch (IOException e) {
            throw new ParseException("IO Error: " + e.getMessage());
        }
    }

    public static List<Term> readAll(String source) throws ParseException {
        var reader = of(source);
        var terms = new ArrayList<Term>();
        Term t;
        while ((t = reader.next()) != null) terms.add(t);
        return terms;
    }

    /** A reader that yields the expressions of {@code source} one at a time through {@link #next()}. */
    public static Reader of(String source) {
        return new Reader(new StringReader(source));
    }

    /** Reads the next expression, or returns null once only whitespace and comments remain. */
    public @Nullable Term next() throws ParseException {
        try {
            skipWhitespaceAndComments();
            return peek() == -1 ? null : readTerm();
        } catch (IOException e) {
            throw new ParseException("IO Error: " + e.getMessage());
        }
    }

    /** Integer if lexically an integer, else float if lexically a float, else a symbol. */
    public static Term parseAtom(String token) {
        if (INTEGER.matcher(token).matches())
            return new Term.Int(new BigInteger(token));
        if (FLOAT.matcher(token).matches()) return new Term.Real(parseFloat(token));
        return Term.Atom.of(token);
    }

    private static double parseFloat(String token) {
        var t = token.toLowerCase();
        var negative = t.startsWith("-");
        var unsigned = t.startsWith("-") || t.startsWith("+") ? t.substring(1) : t;
        return switch (unsigned) {
            case "inf", "infinity" -> negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            case "nan" -> Double.NaN;
            default -> Double.parseDouble(token);
        };
    }

    static boolean isOpen(int c) {
        return c != -1 && OPEN.indexOf(c) >= 0;
    }

    static boolean isClose(int c) {
        return c != -1 && CLOSE.indexOf(c) >= 0;
    }

    private static boolean isDelimiter(int c) {
        return c == -1 || Character.isWhitespace(c) || isOpen(c) || isClose(c) || c == ';';
    }

    private int peek() throws IOException {
        if (currentChar == -2) {
            currentChar = reader.read();
            if (contextBuffer.length() >= CONTEXT_BUFFER_SIZE) {
                contextBuffer.deleteCharAt(0);
            }
            if (currentChar != -1) {
                contextBuffer.append((char) currentChar);
            }
        }
        return currentChar;
    }

    private int consumeChar() throws IOException {
        var c = peek();
        if (c != -1) {
            currentChar = -2;
            if (c == '\n') {
                line++;
                col = 0;
            } else {
                col++;
            }
        }
        return c;
    }

    private void skipWhitespaceAndComments() throws IOException {
        while (true) {
            var c = peek();
            if (c == -1) return;
            if (Character.isWhitespace(c)) {
                consumeChar();
            } else if (c == ';') {
                consumeChar();
                while (peek() != '\n' && peek() != -1) {
                    consumeChar();
                }
            } else {
                return;
            }
        }
    }

    private Term readTerm() throws IOException, ParseException {
        skipWhitespaceAndComments();
        var c = peek();
        if (c == -1) throw endOfSource("Unexpected EOF while reading term");
        if (isOpen(c)) return readList();
        if (isClose(c)) throw unexpectedClose((char) c, null);
        return readAtom();
    }

    private Term.Lst readList() throws IOException, ParseException {
        var open = (char) consumeChar();
        var close = CLOSE.charAt(OPEN.indexOf(open));
        var terms = new ArrayList<Term>();
        skipWhitespaceAndComments();
        while (peek() != close) {
            var c = peek();
            if (c == -1) throw endOfSource("Unexpected EOF inside list opened with '" + open + "'");
            if (isClose(c)) throw unexpectedClose((char) c, close);
            terms.add(readTerm());
            skipWhitespaceAndComments();
        }
        consumeChar();
        return new Term.Lst(terms);
    }

    private Term readAtom() throws IOException {
        var sb = new StringBuilder();
        while (!isDelimiter(peek())) {
            sb.append((char) consumeChar());
        }
        return parseAtom(sb.toString());
    }

    private UnexpectedEndOfSource endOfSource(String message) {
        return new UnexpectedEndOfSource(message, line, col, contextBuffer.toString());
    }

    private UnexpectedCloseBracket unexpectedClose(char found, @Nullable Character expected) {
        var message = expected != null
                ? "Expected '" + expected + "' found '" + found + "'"
                : "Unexpected '" + found + "'";
        return new UnexpectedCloseBracket(message, line, col, contextBuffer.toString());
    }

    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String context;

        public ParseException(String message) {
            this(message, "");
        }

        public ParseException(String message, String context) {
            this(message, -1, -1, context);
        }

        public ParseException(String message, int line, int col, String context) {
            super(message);
            this.line = line;
            this.col = col;
            this.context = context;
        }

        public int line() {
            return line;
        }

        public int col() {
            return col;
        }

        @Override
        public String getMessage() {
            var location = (line != -1 && col != -1) ? " at line " + line + ", col " + col : "";
            var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + location + contextSnippet;
        }
    }

    /** A closing bracket with no open list, or closing a list opened by a different bracket. */
    public static class UnexpectedCloseBracket extends ParseException {
        public UnexpectedCloseBracket(String message, String context) {
            super(message, context);
        }

        public UnexpectedCloseBracket(String message, int line, int col, String context) {
            super(message, line, col, context);
        }
    }

    /** The source ended before an expression, or before a list was closed. */
    public static class UnexpectedEndOfSource extends ParseException {
        public UnexpectedEndOfSource(String message, int line, int col, String context) {
            super(message, line, col, context);
        }
    }
}
