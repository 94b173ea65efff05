package dumb.lis;

import dumb.lis.EvaluatorException.InvalidSyntax;
import dumb.lis.EvaluatorException.PrimitiveInvocationError;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates expressions in an environment.
 * <p>
 * {@link #evaluate} loops over the pair (expression, environment). Expressions
 * in tail position (the branches of {@code if}, the last expression of
 * {@code begin} and of a procedure body) replace the pair and go around the
 * loop again instead of recursing, so tail calls run in constant stack space.
 * Everything else (operator, operands, tests, non-final body expressions) is
 * evaluated by an ordinary recursive call.
 */
public class Evaluator {

    private static final Logger logger = LoggerFactory.getLogger(Evaluator.class);
    private static final Term.Atom ELSE = Term.Atom.of("else");

    private final boolean tailCalls;

    /**
     * @param tailCalls when false, procedure calls recurse on the host stack
     */
    public Evaluator(boolean tailCalls) {
        this.tailCalls = tailCalls;
    }

    private static Procedure procedure(@Nullable String name, List<String> params, List<Term> body, Environment env) {
        var p = new Procedure(name, params, body, env);
        logger.debug("Created {}", p);
        return p;
    }

    public Term evaluate(Term exp, Environment env) {
        while (true) {
            var form = Form.of(exp);
            if (form instanceof Form.Literal l) {
                return l.value();
            } else if (form instanceof Form.Ref r) {
                return env.lookup(r.name());
            } else if (form instanceof Form.Quote q) {
                return q.datum();
            } else if (form instanceof Form.If f) {
                exp = evaluate(f.test(), env).truthy() ? f.consequence() : f.alternative();
            } else if (form instanceof Form.Define d) {
                env.define(d.name(), evaluate(d.value(), env));
                return Term.NONE;
            } else if (form instanceof Form.Assign a) {
                env.mutate(a.name(), evaluate(a.value(), env));
                return Term.NONE;
            } else if (form instanceof Form.DefineProcedure d) {
                env.define(d.name(), procedure(d.name(), d.params(), d.body(), env));
                return Term.NONE;
            } else if (form instanceof Form.Lambda l) {
                return procedure(null, l.params(), l.body(), env);
            } else if (form instanceof Form.Cond c) {
                return cond(c.clauses(), env);
            } else if (form instanceof Form.Or o) {
                return or(o.operands(), env);
            } else if (form instanceof Form.And a) {
                return and(a.operands(), env);
            } else if (form instanceof Form.Begin b) {
                var body = b.body();
                var last = body.size() - 1;
                for (var i = 0; i < last; i++)
                    evaluate(body.get(i), env);
                exp = body.get(last);
            } else if (form instanceof Form.Apply a) {
                var callable = evaluate(a.operator(), env);
                var args = new ArrayList<Term>(a.operands().size());
                for (var operand : a.operands())
                    args.add(evaluate(operand, env));
                if (tailCalls && callable instanceof Procedure p) {
                    exp = p.tailForm();
                    env = p.applicationEnv(args);
                } else {
                    return invoke(callable, args, exp);
                }
            } else {
                throw new InvalidSyntax(exp.toLisp());
            }
        }
    }

    /**
     * Calls {@code callable} outside of any tail position, as primitives such as
     * {@code map} and {@code apply} need to.
     */
    public Term apply(Term callable, List<Term> args) {
        if (callable instanceof Procedure p)
            return sequence(p.body(), p.applicationEnv(args));
        if (callable instanceof Primitive f)
            return f.apply(args);
        throw new IllegalArgumentException(quoteLisp(callable) + " is not callable");
    }

    private Term invoke(Term callable, List<Term> args, Term source) {
        if (callable instanceof Procedure p)
            return sequence(p.body(), p.applicationEnv(args));
        try {
            if (callable instanceof Primitive f)
                return f.apply(args);
            throw new IllegalArgumentException(quoteLisp(callable) + " is not callable");
        } catch (IllegalArgumentException | ClassCastException | IndexOutOfBoundsException e) {
            logger.debug("Invocation of {} failed in {}: {}", callable.toLisp(), source.toLisp(), e.toString());
            throw new PrimitiveInvocationError(callable, args, source, e);
        }
    }

    /** {@code (cond (test exp*)* (else exp*)?)} */
    Term cond(List<Term> clauses, Environment env) {
        for (var clause : clauses) {
            if (!(clause instanceof Term.Lst c) || c.isEmpty())
                throw new InvalidSyntax(clause.toLisp());
            var test = c.get(0);
            if (ELSE.equals(test) || evaluate(test, env).truthy())
                return sequence(c.tail(), env);
        }
        return Term.NONE;
    }

    /** {@code (or exp*)} */
    Term or(List<Term> operands, Environment env) {
        Term value = Term.FALSE;
        for (var exp : operands) {
            value = evaluate(exp, env);
            if (value.truthy()) return value;
        }
        return value;
    }

    /** {@code (and exp*)} */
    Term and(List<Term> operands, Environment env) {
        Term value = Term.TRUE;
        for (var exp : operands) {
            value = evaluate(exp, env);
            if (!value.truthy()) return value;
        }
        return value;
    }

    private Term sequence(List<Term> body, Environment env) {
        Term result = Term.NONE;
        for (var exp : body)
            result = evaluate(exp, env);
        return result;
    }

    private static String quoteLisp(Term t) {
        return t == Term.NONE ? "#<none>" : "'" + t.toLisp() + "'";
    }
}
