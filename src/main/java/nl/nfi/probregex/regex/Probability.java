package nl.nfi.probregex.regex;

// a probability strictly between 0.0 and 1.0, e.g. the chance to stop a Kleene repetition
public record Probability(double value) {

    public Probability {
        if (!(value > 0.0 && value < 1.0)) {
            throw new InvalidProbabilityException(value);
        }
    }

    public static Probability of(final double value) {
        return new Probability(value);
    }

    public double complement() {
        return 1.0 - value;
    }
}
