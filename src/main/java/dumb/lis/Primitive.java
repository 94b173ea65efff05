package dumb.lis;

import java.util.List;
import java.util.function.Function;

/**
 * A host-provided procedure. Implementations reject bad arguments with
 * {@link IllegalArgumentException} or {@link ClassCastException}.
 */
public record Primitive(String name, Function<List<Term>, Term> function) implements Term {

    public Term apply(List<Term> args) {
        return function.apply(args);
    }

    @Override
    public String toLisp() {
        return "#<primitive " + name + ">";
    }
}
