package dumb.lis;

import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Everything an evaluation can consume or produce. Lists double as code and data.
 */
sealed public interface Term permits Term.Atom, Term.Num, Term.Lst, Term.Bool, Term.None, Procedure, Primitive {

    Term NONE = None.INSTANCE;
    Bool TRUE = new Bool(true);
    Bool FALSE = new Bool(false);
    Lst EMPTY = new Lst(List.of());

    static Bool bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Printed s-expression form; the approximate inverse of {@link Reader}.
     */
    String toLisp();

    /**
     * Only {@code #f}, numeric zero of either kind and the empty list are false.
     */
    default boolean truthy() {
        if (this instanceof Bool b) return b.value();
        if (this instanceof Int i) return i.value().signum() != 0;
        if (this instanceof Real r) return r.value() != 0.0;
        if (this instanceof Lst l) return !l.isEmpty();
        return true;
    }

    record Atom(String name) implements Term {
        private static final Map<String, Atom> internCache = new ConcurrentHashMap<>(1024);

        public Atom {
            requireNonNull(name);
        }

        public static Atom of(String name) {
            return internCache.computeIfAbsent(name, Atom::new);
        }

        @Override
        public String toLisp() {
            return name;
        }
    }

    sealed interface Num extends Term permits Int, Real {
        double doubleValue();
    }

    /** Integers are unbounded. */
    record Int(BigInteger value) implements Num {
        public Int {
            requireNonNull(value);
        }

        public Int(long value) {
            this(BigInteger.valueOf(value));
        }

        @Override
        public double doubleValue() {
            return value.doubleValue();
        }

        @Override
        public String toLisp() {
            return value.toString();
        }
    }

    record Real(double value) implements Num {
        @Override
        public double doubleValue() {
            return value;
        }

        @Override
        public String toLisp() {
            if (Double.isNaN(value)) return "nan";
            if (Double.isInfinite(value)) return value > 0 ? "inf" : "-inf";
            return Double.toString(value);
        }
    }

    record Bool(boolean value) implements Term {
        @Override
        public String toLisp() {
            return value ? "#t" : "#f";
        }
    }

    enum None implements Term {
        INSTANCE;

        @Override
        public String toLisp() {
            return "";
        }
    }

    final class Lst implements Term {
        public final List<Term> terms;
        private volatile int hashCodeCache;
        private volatile boolean hashCodeCalculated = false;
        private volatile String lispStringCache;
        private volatile @Nullable Form formCache;

        public Lst(List<Term> terms) {
            this.terms = List.copyOf(terms);
        }

        public Lst(Term... terms) {
            this(List.of(terms));
        }

        public Term get(int index) {
            return terms.get(index);
        }

        public int size() {
            return terms.size();
        }

        public boolean isEmpty() {
            return terms.isEmpty();
        }

        public List<Term> tail() {
            return terms.subList(1, terms.size());
        }

        /** Head symbol name, or null if the list is empty or headed by a non-symbol. */
        public @Nullable String op() {
            return !terms.isEmpty() && terms.get(0) instanceof Atom a ? a.name() : null;
        }

        /** The shape of this list as code, classified on first use. */
        public Form form() {
            var f = formCache;
            if (f == null) formCache = f = Form.classify(this);
            return f;
        }

        @Override
        public String toLisp() {
            if (lispStringCache == null)
                lispStringCache = terms.stream().map(Term::toLisp).collect(Collectors.joining(" ", "(", ")"));
            return lispStringCache;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Lst that && this.hashCode() == that.hashCode() && terms.equals(that.terms));
        }

        @Override
        public int hashCode() {
            if (!hashCodeCalculated) {
                hashCodeCache = terms.hashCode();
                hashCodeCalculated = true;
            }
            return hashCodeCache;
        }

        @Override
        public String toString() {
            return "Lst" + terms;
        }
    }
}
