package nl.nfi.probregex.regex;

import static java.util.Objects.requireNonNull;

// left with the given probability, right otherwise
public record Choice(Expression left, Expression right, Probability probability) implements Expression {

    public Choice {
        requireNonNull(left, "left");
        requireNonNull(right, "right");
        requireNonNull(probability, "probability");
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.CHOICE;
    }
}
