package dumb.lis;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised while evaluating. Nothing inside the evaluator recovers from these;
 * they unwind to the runner or the REPL.
 */
public class EvaluatorException extends RuntimeException {

    public EvaluatorException(String message) {
        super(message);
    }

    public EvaluatorException(String message, Throwable cause) {
        super(message, cause);
    }

    static String quote(String value) {
        return value.contains("'") ? value : "'" + value + "'";
    }

    /** A symbol, or the target of {@code set!}, is bound in no frame. */
    public static class UnboundVariable extends EvaluatorException {
        private final String name;

        public UnboundVariable(String name) {
            super("Unbound variable: " + quote(name));
            this.name = name;
        }

        public String name() {
            return name;
        }
    }

    /** An expression matches none of the recognized forms. */
    public static class InvalidSyntax extends EvaluatorException {
        private final String source;

        public InvalidSyntax(String source) {
            super("Invalid syntax: " + quote(source));
            this.source = source;
        }

        public String source() {
            return source;
        }
    }

    /** A callable rejected its evaluated arguments, or the operator was not callable at all. */
    public static class PrimitiveInvocationError extends EvaluatorException {
        private final String source;
        private final Term expression;
        private final List<Term> arguments;

        public PrimitiveInvocationError(Term callable, List<Term> arguments, Term expression, Throwable cause) {
            super(describe(cause)
                    + "\ninvoking: " + callable.toLisp() + arguments.stream().map(Term::toLisp).collect(Collectors.joining(" ", "(", ")"))
                    + "\nsource: " + expression.toLisp()
                    + "\nAST: " + expression, cause);
            this.source = expression.toLisp();
            this.expression = expression;
            this.arguments = List.copyOf(arguments);
        }

        private static String describe(Throwable cause) {
            return cause.getMessage() != null
                    ? cause.getClass().getSimpleName() + ": " + cause.getMessage()
                    : cause.getClass().getSimpleName();
        }

        public String source() {
            return source;
        }

        public Term expression() {
            return expression;
        }

        public List<Term> arguments() {
            return arguments;
        }
    }
}
