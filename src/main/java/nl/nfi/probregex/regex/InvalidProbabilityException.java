package nl.nfi.probregex.regex;

public final class InvalidProbabilityException extends IllegalArgumentException {

    private final double value;

    public InvalidProbabilityException(final double value) {
        super("Invalid value for probability, expected 0.0 < p < 1.0: %s".formatted(value));
        this.value = value;
    }

    public double value() {
        return value;
    }
}
