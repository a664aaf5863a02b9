package nl.nfi.probregex.regex;

import static java.util.Objects.requireNonNull;

// one or more repetitions of body, probability is the chance to stop after each repetition
public record Plus(Expression body, Probability probability) implements Expression {

    public Plus {
        requireNonNull(body, "body");
        requireNonNull(probability, "probability");
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.PLUS;
    }
}
