package nl.nfi.probregex.regex;

import static java.util.Objects.requireNonNull;

// NOTE: probability is the chance to produce body, not the chance to produce the empty string
public record Option(Expression body, Probability probability) implements Expression {

    public Option {
        requireNonNull(body, "body");
        requireNonNull(probability, "probability");
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.OPTION;
    }
}
