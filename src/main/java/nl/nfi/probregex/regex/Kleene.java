package nl.nfi.probregex.regex;

import static java.util.Objects.requireNonNull;

// zero or more repetitions of body, probability is the chance to stop before each repetition
public record Kleene(Expression body, Probability probability) implements Expression {

    public Kleene {
        requireNonNull(body, "body");
        requireNonNull(probability, "probability");
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.KLEENE;
    }
}
