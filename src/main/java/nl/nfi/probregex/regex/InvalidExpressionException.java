package nl.nfi.probregex.regex;

public final class InvalidExpressionException extends IllegalArgumentException {

    private final Expression expression;

    public InvalidExpressionException(final Expression expression, final String reason) {
        super("Invalid expression: %s".formatted(reason));
        this.expression = expression;
    }

    public Expression expression() {
        return expression;
    }
}
