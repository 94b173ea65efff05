package dumb.lis;

import dumb.lis.Reader.UnexpectedCloseBracket;
import dumb.lis.Reader.UnexpectedEndOfSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReaderTest extends AbstractTest {

    @Test
    void atoms() {
        assertEquals(i(7), parse("7"));
        assertEquals(i(-7), parse("-7"));
        assertEquals(r(1.5), parse("1.5"));
        assertEquals(r(0.5), parse(".5"));
        assertEquals(r(1000.0), parse("1e3"));
        assertEquals(sym("x"), parse("x"));
        assertEquals(sym("set!"), parse("set!"));
        assertEquals(sym("#t"), parse("#t"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"+", "-", ".", "1+", "1.2.3", "e10", "abc1"})
    void tokensThatAreNotNumbersAreSymbols(String token) {
        assertInstanceOf(Term.Atom.class, parse(token));
    }

    @Test
    void infinityAndNanAreFloats() {
        assertEquals(r(Double.POSITIVE_INFINITY), parse("inf"));
        assertEquals(r(Double.NEGATIVE_INFINITY), parse("-Infinity"));
        assertTrue(Double.isNaN(((Term.Real) parse("nan")).value()));
    }

    @Test
    void longIntegerLiteralsStayIntegral() {
        var big = parse("123456789012345678901234567890");
        assertEquals(new Term.Int(new BigInteger("123456789012345678901234567890")), big);
        assertEquals("123456789012345678901234567890", big.toLisp());
        assertEquals(new Term.Int(new BigInteger("-98765432109876543210")), parse("-98765432109876543210"));
        assertEquals(i(5), parse("+5"));
    }

    @Test
    void nextReadsOneExpressionAtATime() throws Exception {
        var reader = Reader.of("(a) ; note\n b )");
        assertEquals(lst(sym("a")), reader.next());
        assertEquals(sym("b"), reader.next());
        assertThrows(UnexpectedCloseBracket.class, reader::next);

        var empty = Reader.of("  ; only a comment");
        assertNull(empty.next());
    }

    @Test
    void lists() {
        assertEquals(lst(sym("sum"), i(1), i(2), i(3)), parse("(sum 1 2 3)"));
        assertEquals(lst(sym("+"), lst(sym("*"), i(2), i(100)), lst(sym("*"), i(1), i(10))),
                parse("(+ (* 2 100) (* 1 10))"));
        assertEquals(Term.EMPTY, parse("()"));
    }

    @Test
    void parseStopsAtFirstCompleteExpression() {
        assertEquals(i(99), parse("99 100"));
        assertEquals(lst(sym("a")), parse("(a)(b)"));
    }

    @Test
    void mixedBrackets() {
        assertEquals(lst(sym("sum"), i(1), i(2), i(3)), parse("[sum 1 2 3]"));
        assertEquals(lst(sym("+"), lst(sym("*"), i(2), i(100)), lst(sym("*"), i(1), i(10))),
                parse("(+ {* 2 100} [* 1 10])"));
    }

    @Test
    void readAllReturnsEveryExpressionAndSkipsComments() throws Exception {
        var terms = Reader.readAll("""
                ; a comment
                (define x 10) ; trailing
                x
                """);
        assertEquals(List.of(lst(sym("define"), sym("x"), i(10)), sym("x")), terms);
        assertTrue(Reader.readAll("  ; nothing here\n").isEmpty());
    }

    @Test
    void unexpectedCloseBracket() {
        assertThrows(UnexpectedCloseBracket.class, () -> Reader.parse(")"));
        assertThrows(UnexpectedCloseBracket.class, () -> Reader.parse("(a b]"));
        assertThrows(UnexpectedCloseBracket.class, () -> Reader.readAll("(a) b)"));
    }

    @Test
    void unexpectedEndOfSource() {
        assertThrows(UnexpectedEndOfSource.class, () -> Reader.parse(""));
        assertThrows(UnexpectedEndOfSource.class, () -> Reader.parse("   "));
        assertThrows(UnexpectedEndOfSource.class, () -> Reader.parse("(a (b c)"));
    }

    @Test
    void errorMessageCarriesLocation() {
        var e = assertThrows(UnexpectedCloseBracket.class, () -> Reader.readAll("(a\n b]"));
        assertEquals(2, e.line());
        assertTrue(e.getMessage().contains("Expected ')' found ']'"), e.getMessage());
        assertTrue(e.getMessage().contains("at line 2"), e.getMessage());
    }
}
