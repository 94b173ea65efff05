package dumb.lis;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The shape of an expression as code. Each list is classified once and the
 * result cached on the list, so the evaluator dispatches on a tag instead of
 * probing the list on every visit.
 */
sealed public interface Form {

    Set<String> KEYWORDS = Set.of("quote", "if", "define", "lambda", "set!", "cond", "or", "and", "begin");

    static Form of(Term exp) {
        if (exp instanceof Term.Lst l) return l.form();
        if (exp instanceof Term.Atom a) return new Ref(a.name());
        if (exp instanceof Term.Num || exp instanceof Term.Bool) return new Literal(exp);
        return new Invalid(exp);
    }

    static Form classify(Term.Lst exp) {
        if (exp.isEmpty()) return new Invalid(exp);
        var op = exp.op();
        if (op == null || !KEYWORDS.contains(op)) return new Apply(exp.get(0), exp.tail());

        var n = exp.size();
        return switch (op) {
            case "quote" -> n == 2 ? new Quote(exp.get(1)) : new Invalid(exp);
            case "if" -> n == 4 ? new If(exp.get(1), exp.get(2), exp.get(3)) : new Invalid(exp);
            case "define" -> {
                if (n == 3 && exp.get(1) instanceof Term.Atom name)
                    yield new Define(name.name(), exp.get(2));
                if (n >= 3 && exp.get(1) instanceof Term.Lst signature && !signature.isEmpty()) {
                    var names = symbols(signature.terms);
                    if (names != null)
                        yield new DefineProcedure(names.get(0), names.subList(1, names.size()), exp.terms.subList(2, n));
                }
                yield new Invalid(exp);
            }
            case "set!" -> n == 3 && exp.get(1) instanceof Term.Atom name
                    ? new Assign(name.name(), exp.get(2)) : new Invalid(exp);
            case "lambda" -> {
                if (n >= 3 && exp.get(1) instanceof Term.Lst params) {
                    var names = symbols(params.terms);
                    if (names != null) yield new Lambda(names, exp.terms.subList(2, n));
                }
                yield new Invalid(exp);
            }
            case "cond" -> new Cond(exp.tail());
            case "or" -> new Or(exp.tail());
            case "and" -> new And(exp.tail());
            case "begin" -> n >= 2 ? new Begin(exp.tail()) : new Invalid(exp);
            default -> new Invalid(exp);
        };
    }

    private static @Nullable List<String> symbols(List<Term> terms) {
        var names = new ArrayList<String>(terms.size());
        for (var t : terms) {
            if (!(t instanceof Term.Atom a)) return null;
            names.add(a.name());
        }
        return List.copyOf(names);
    }

    record Literal(Term value) implements Form {
    }

    record Ref(String name) implements Form {
    }

    record Quote(Term datum) implements Form {
    }

    record If(Term test, Term consequence, Term alternative) implements Form {
    }

    record Define(String name, Term value) implements Form {
    }

    record Assign(String name, Term value) implements Form {
    }

    record DefineProcedure(String name, List<String> params, List<Term> body) implements Form {
    }

    record Lambda(List<String> params, List<Term> body) implements Form {
    }

    record Cond(List<Term> clauses) implements Form {
    }

    record Or(List<Term> operands) implements Form {
    }

    record And(List<Term> operands) implements Form {
    }

    record Begin(List<Term> body) implements Form {
    }

    record Apply(Term operator, List<Term> operands) implements Form {
    }

    record Invalid(Term source) implements Form {
    }
}
