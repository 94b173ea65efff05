package dumb.lis;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * A user-defined procedure: parameter names, a non-empty body and the
 * environment it was defined in.
 */
public final class Procedure implements Term {

    private static final Term.Atom BEGIN = Term.Atom.of("begin");

    private final @Nullable String name;
    private final List<String> params;
    private final List<Term> body;
    private final Environment definitionEnv;
    private final Term.Lst tailForm;

    public Procedure(@Nullable String name, List<String> params, List<Term> body, Environment definitionEnv) {
        if (body.isEmpty()) throw new IllegalArgumentException("procedure body must not be empty");
        this.name = name;
        this.params = List.copyOf(params);
        this.body = List.copyOf(body);
        this.definitionEnv = definitionEnv;

        var seq = new ArrayList<Term>(body.size() + 1);
        seq.add(BEGIN);
        seq.addAll(body);
        this.tailForm = new Term.Lst(seq);
    }

    /**
     * Binds parameters to arguments by position. Surplus arguments are dropped
     * and missing ones left unbound.
     */
    public Environment applicationEnv(List<Term> args) {
        var n = Math.min(params.size(), args.size());
        var local = new HashMap<String, Term>(n * 2);
        for (var i = 0; i < n; i++)
            local.put(params.get(i), args.get(i));
        return definitionEnv.extend(local);
    }

    /** The body as a single {@code (begin ...)} expression. */
    Term.Lst tailForm() {
        return tailForm;
    }

    public @Nullable String name() {
        return name;
    }

    public List<Term> body() {
        return body;
    }

    @Override
    public String toLisp() {
        return name != null ? "#<procedure " + name + ">" : "#<procedure>";
    }

    @Override
    public String toString() {
        return "Procedure[" + (name != null ? name : "lambda") + " " + params + "]";
    }
}
