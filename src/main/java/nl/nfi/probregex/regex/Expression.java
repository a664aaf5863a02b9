package nl.nfi.probregex.regex;

/**
 * A probabilistic regular expression: an immutable tree built from the six variants permitted below.
 * <p>
 * Consumers dispatch on {@link #kind()} with an exhaustive {@code switch} expression, so adding a
 * variant fails compilation of every consumer until it handles the new kind.
 */
public sealed interface Expression permits Char, Concat, Choice, Kleene, Option, Plus {

    ExpressionKind kind();

    static Char character(final char value) {
        return new Char(value);
    }

    static Concat concat(final Expression left, final Expression right) {
        return new Concat(left, right);
    }

    // right-nested, so concat(a, b, c) == concat(a, concat(b, c))
    static Expression concat(final Expression first, final Expression... rest) {
        if (rest.length == 0) {
            return first;
        }
        Expression result = rest[rest.length - 1];
        for (int i = rest.length - 2; i >= 0; i--) {
            result = new Concat(rest[i], result);
        }
        return new Concat(first, result);
    }

    static Choice choice(final Expression left, final Expression right, final double probability) {
        return new Choice(left, right, Probability.of(probability));
    }

    static Kleene kleene(final Expression body, final double probability) {
        return new Kleene(body, Probability.of(probability));
    }

    static Option option(final Expression body, final double probability) {
        return new Option(body, Probability.of(probability));
    }

    static Plus plus(final Expression body, final double probability) {
        return new Plus(body, Probability.of(probability));
    }
}
