package nl.nfi.probregex.regex;

import static java.util.Objects.requireNonNull;

public record Concat(Expression left, Expression right) implements Expression {

    public Concat {
        requireNonNull(left, "left");
        requireNonNull(right, "right");
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.CONCAT;
    }
}
