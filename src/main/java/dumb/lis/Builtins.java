package dumb.lis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;
import java.util.function.IntPredicate;

/**
 * The standard environment: constants and primitives bound in a single frame.
 */
public final class Builtins {

    private static final Logger logger = LoggerFactory.getLogger(Builtins.class);

    private Builtins() {
    }

    public static Environment standardEnv(Evaluator evaluator, PrintStream out) {
        var env = new Environment();
        new Builtins.Registry(env, evaluator, out).addAll();
        logger.debug("Standard environment has {} bindings", env.frame().size());
        return env;
    }

    static Term.Num num(Term t) {
        if (t instanceof Term.Num n) return n;
        throw new IllegalArgumentException("expected a number, got " + describe(t));
    }

    static Term.Lst list(Term t) {
        if (t instanceof Term.Lst l) return l;
        throw new IllegalArgumentException("expected a list, got " + describe(t));
    }

    static void arity(String name, List<Term> args, int n) {
        if (args.size() != n)
            throw new IllegalArgumentException(name + " takes " + n + " argument" + (n == 1 ? "" : "s") + " (" + args.size() + " given)");
    }

    static void minArity(String name, List<Term> args, int n) {
        if (args.size() < n)
            throw new IllegalArgumentException(name + " takes at least " + n + " argument" + (n == 1 ? "" : "s") + " (" + args.size() + " given)");
    }

    private static String describe(Term t) {
        return t == Term.NONE ? "no value" : "'" + t.toLisp() + "'";
    }

    static boolean allInts(List<Term> args) {
        for (var a : args)
            if (!(num(a) instanceof Term.Int)) return false;
        return true;
    }

    static BigInteger integer(Term t) {
        return ((Term.Int) t).value();
    }

    static Term.Num fold(List<Term> args, Term.Num identity, BinaryOperator<BigInteger> ints, DoubleBinaryOperator reals) {
        if (args.isEmpty()) return identity;
        if (allInts(args)) {
            var acc = integer(args.get(0));
            for (var i = 1; i < args.size(); i++)
                acc = ints.apply(acc, integer(args.get(i)));
            return new Term.Int(acc);
        }
        var acc = num(args.get(0)).doubleValue();
        for (var i = 1; i < args.size(); i++)
            acc = reals.applyAsDouble(acc, num(args.get(i)).doubleValue());
        return new Term.Real(acc);
    }

    static boolean numericEquals(Term a, Term b) {
        if (a instanceof Term.Int x && b instanceof Term.Int y) return x.value().equals(y.value());
        if (a instanceof Term.Num x && b instanceof Term.Num y) return x.doubleValue() == y.doubleValue();
        return a.equals(b);
    }

    /** Exact between integers, otherwise by double value; false whenever a NaN is involved. */
    static boolean compare(Term.Num a, Term.Num b, IntPredicate test) {
        if (a instanceof Term.Int x && b instanceof Term.Int y) return test.test(x.value().compareTo(y.value()));
        var x = a.doubleValue();
        var y = b.doubleValue();
        if (Double.isNaN(x) || Double.isNaN(y)) return false;
        return test.test(x < y ? -1 : x > y ? 1 : 0);
    }

    /** Floor division rounding toward negative infinity. */
    static BigInteger floorDiv(BigInteger a, BigInteger b) {
        var qr = a.divideAndRemainder(nonZero(b));
        return qr[1].signum() != 0 && qr[1].signum() != b.signum() ? qr[0].subtract(BigInteger.ONE) : qr[0];
    }

    private static BigInteger nonZero(BigInteger divisor) {
        if (divisor.signum() == 0) throw new ArithmeticException("integer division or modulo by zero");
        return divisor;
    }

    /** {@code d}, already rounded to a whole value, as an integer; non-finite values have none. */
    static Term.Int integral(double d) {
        if (Double.isNaN(d)) throw new ArithmeticException("cannot convert float NaN to integer");
        if (Double.isInfinite(d)) throw new ArithmeticException("cannot convert float infinity to integer");
        return new Term.Int(new BigDecimal(d).toBigInteger());
    }

    /** Structural equality; numbers compare by value across kinds. */
    static boolean equal(Term a, Term b) {
        if (a instanceof Term.Lst x && b instanceof Term.Lst y) {
            if (x.size() != y.size()) return false;
            for (var i = 0; i < x.size(); i++)
                if (!equal(x.get(i), y.get(i))) return false;
            return true;
        }
        return numericEquals(a, b);
    }

    /** Identity, except that symbols, booleans and integers are identical when equal. */
    static boolean eq(Term a, Term b) {
        if (a == b) return true;
        if (a instanceof Term.Atom || a instanceof Term.Bool || a instanceof Term.Int) return a.equals(b);
        return a instanceof Term.Lst x && b instanceof Term.Lst y && x.isEmpty() && y.isEmpty();
    }

    private static final class Registry {
        private final Environment env;
        private final Evaluator evaluator;
        private final PrintStream out;

        Registry(Environment env, Evaluator evaluator, PrintStream out) {
            this.env = env;
            this.evaluator = evaluator;
            this.out = out;
        }

        void add(String name, Function<List<Term>, Term> function) {
            env.define(name, new Primitive(name, function));
        }

        void unary(String name, Function<Term, Term> function) {
            add(name, args -> {
                arity(name, args, 1);
                return function.apply(args.get(0));
            });
        }

        void real(String name, DoubleUnaryOperator op) {
            unary(name, x -> new Term.Real(op.applyAsDouble(num(x).doubleValue())));
        }

        void comparison(String name, IntPredicate test) {
            add(name, args -> {
                minArity(name, args, 1);
                var current = num(args.get(0));
                for (var i = 1; i < args.size(); i++) {
                    var next = num(args.get(i));
                    if (!compare(current, next, test)) return Term.FALSE;
                    current = next;
                }
                return Term.TRUE;
            });
        }

        void addAll() {
            constants();
            arithmetic();
            math();
            lists();
            predicates();
            higherOrder();
            unary("display", x -> {
                out.println(x.toLisp());
                return Term.NONE;
            });
        }

        private void constants() {
            env.define("#t", Term.TRUE);
            env.define("#f", Term.FALSE);
            env.define("pi", new Term.Real(Math.PI));
            env.define("e", new Term.Real(Math.E));
            env.define("tau", new Term.Real(2 * Math.PI));
        }

        private void arithmetic() {
            add("+", args -> fold(args, new Term.Int(0), BigInteger::add, Double::sum));
            add("*", args -> fold(args, new Term.Int(1), BigInteger::multiply, (a, b) -> a * b));
            add("-", args -> {
                minArity("-", args, 1);
                if (args.size() == 1) {
                    var x = num(args.get(0));
                    return x instanceof Term.Int i ? new Term.Int(i.value().negate()) : new Term.Real(-x.doubleValue());
                }
                return fold(args, new Term.Int(0), BigInteger::subtract, (a, b) -> a - b);
            });
            add("/", args -> {
                minArity("/", args, 1);
                if (args.size() == 1) return new Term.Real(divide(1, num(args.get(0)).doubleValue()));
                var acc = num(args.get(0)).doubleValue();
                for (var i = 1; i < args.size(); i++)
                    acc = divide(acc, num(args.get(i)).doubleValue());
                return new Term.Real(acc);
            });
            add("quotient", args -> {
                arity("quotient", args, 2);
                if (allInts(args))
                    return new Term.Int(floorDiv(integer(args.get(0)), integer(args.get(1))));
                return new Term.Real(Math.floor(divide(num(args.get(0)).doubleValue(), num(args.get(1)).doubleValue())));
            });
            add("modulo", args -> {
                arity("modulo", args, 2);
                if (allInts(args)) {
                    var a = integer(args.get(0));
                    var b = integer(args.get(1));
                    return new Term.Int(a.subtract(b.multiply(floorDiv(a, b))));
                }
                var a = num(args.get(0)).doubleValue();
                var b = num(args.get(1)).doubleValue();
                if (b == 0) throw new ArithmeticException("float modulo");
                return new Term.Real(a - b * Math.floor(a / b));
            });
            add("remainder", args -> {
                arity("remainder", args, 2);
                if (allInts(args))
                    return new Term.Int(integer(args.get(0)).remainder(nonZero(integer(args.get(1)))));
                var b = num(args.get(1)).doubleValue();
                if (b == 0) throw new ArithmeticException("float remainder");
                return new Term.Real(num(args.get(0)).doubleValue() % b);
            });

            comparison("<", c -> c < 0);
            comparison(">", c -> c > 0);
            comparison("<=", c -> c <= 0);
            comparison(">=", c -> c >= 0);
            add("=", args -> {
                minArity("=", args, 1);
                for (var i = 1; i < args.size(); i++)
                    if (!numericEquals(args.get(0), args.get(i))) return Term.FALSE;
                return Term.TRUE;
            });
        }

        private static double divide(double a, double b) {
            if (b == 0) throw new ArithmeticException("division by zero");
            return a / b;
        }

        private void math() {
            real("sqrt", x -> {
                if (x < 0) throw new ArithmeticException("math domain error");
                return Math.sqrt(x);
            });
            real("sin", Math::sin);
            real("cos", Math::cos);
            real("tan", Math::tan);
            real("asin", Math::asin);
            real("acos", Math::acos);
            real("atan", Math::atan);
            real("exp", Math::exp);
            real("log10", Math::log10);
            add("log", args -> {
                if (args.size() != 1) arity("log", args, 2);
                var x = num(args.get(0)).doubleValue();
                if (x <= 0) throw new ArithmeticException("math domain error");
                if (args.size() == 1) return new Term.Real(Math.log(x));
                return new Term.Real(Math.log(x) / Math.log(num(args.get(1)).doubleValue()));
            });
            add("atan2", args -> {
                arity("atan2", args, 2);
                return new Term.Real(Math.atan2(num(args.get(0)).doubleValue(), num(args.get(1)).doubleValue()));
            });
            add("pow", args -> {
                arity("pow", args, 2);
                return new Term.Real(Math.pow(num(args.get(0)).doubleValue(), num(args.get(1)).doubleValue()));
            });
            add("hypot", args -> {
                var sum = 0.0;
                for (var a : args) {
                    var d = num(a).doubleValue();
                    sum += d * d;
                }
                return new Term.Real(Math.sqrt(sum));
            });
            unary("floor", x -> x instanceof Term.Int ? x : integral(Math.floor(num(x).doubleValue())));
            unary("ceil", x -> x instanceof Term.Int ? x : integral(Math.ceil(num(x).doubleValue())));
            unary("abs", x -> num(x) instanceof Term.Int i
                    ? new Term.Int(i.value().abs())
                    : new Term.Real(Math.abs(num(x).doubleValue())));
            add("round", args -> {
                if (args.size() != 1) arity("round", args, 2);
                var x = num(args.get(0));
                if (args.size() == 1)
                    return x instanceof Term.Int ? x : integral(Math.rint(x.doubleValue()));
                if (!(num(args.get(1)) instanceof Term.Int digits))
                    throw new IllegalArgumentException("round takes an integral number of digits");
                if (x instanceof Term.Int || !Double.isFinite(x.doubleValue())) return x;
                var rounded = new BigDecimal(Double.toString(x.doubleValue())).setScale(digits.value().intValueExact(), RoundingMode.HALF_EVEN);
                return new Term.Real(rounded.doubleValue());
            });
            add("max", args -> extreme("max", args, 1));
            add("min", args -> extreme("min", args, -1));
        }

        private static Term extreme(String name, List<Term> args, int sign) {
            var items = args.size() == 1 && args.get(0) instanceof Term.Lst l ? l.terms : args;
            if (items.isEmpty()) throw new IllegalArgumentException(name + " of an empty sequence");
            var best = num(items.get(0));
            for (var t : items) {
                var n = num(t);
                if (compare(n, best, c -> c * sign > 0)) best = n;
            }
            return best;
        }

        private void lists() {
            unary("car", x -> list(x).get(0));
            unary("cdr", x -> {
                var l = list(x);
                return l.isEmpty() ? Term.EMPTY : new Term.Lst(l.tail());
            });
            add("cons", args -> {
                arity("cons", args, 2);
                var items = new ArrayList<Term>();
                items.add(args.get(0));
                items.addAll(list(args.get(1)).terms);
                return new Term.Lst(items);
            });
            add("list", args -> new Term.Lst(args));
            add("append", args -> {
                var items = new ArrayList<Term>();
                for (var a : args) items.addAll(list(a).terms);
                return new Term.Lst(items);
            });
            unary("length", x -> new Term.Int(list(x).size()));
        }

        private void predicates() {
            unary("list?", x -> Term.bool(x instanceof Term.Lst));
            unary("null?", x -> Term.bool(x instanceof Term.Lst l && l.isEmpty()));
            unary("number?", x -> Term.bool(x instanceof Term.Num));
            unary("symbol?", x -> Term.bool(x instanceof Term.Atom));
            unary("procedure?", x -> Term.bool(x instanceof Procedure || x instanceof Primitive));
            unary("not", x -> Term.bool(!x.truthy()));
            add("eq?", args -> {
                arity("eq?", args, 2);
                return Term.bool(eq(args.get(0), args.get(1)));
            });
            add("equal?", args -> {
                arity("equal?", args, 2);
                return Term.bool(equal(args.get(0), args.get(1)));
            });
        }

        private void higherOrder() {
            add("apply", args -> {
                arity("apply", args, 2);
                return evaluator.apply(args.get(0), list(args.get(1)).terms);
            });
            add("map", args -> {
                minArity("map", args, 2);
                var f = args.get(0);
                var lists = new ArrayList<Term.Lst>();
                var n = Integer.MAX_VALUE;
                for (var a : args.subList(1, args.size())) {
                    var l = list(a);
                    lists.add(l);
                    n = Math.min(n, l.size());
                }
                var results = new ArrayList<Term>(n);
                for (var i = 0; i < n; i++) {
                    var call = new ArrayList<Term>(lists.size());
                    for (var l : lists) call.add(l.get(i));
                    results.add(evaluator.apply(f, call));
                }
                return new Term.Lst(results);
            });
            add("filter", args -> {
                arity("filter", args, 2);
                var results = new ArrayList<Term>();
                for (var x : list(args.get(1)).terms)
                    if (evaluator.apply(args.get(0), List.of(x)).truthy()) results.add(x);
                return new Term.Lst(results);
            });
        }
    }
}
