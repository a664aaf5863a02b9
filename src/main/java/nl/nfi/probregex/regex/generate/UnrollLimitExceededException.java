package nl.nfi.probregex.regex.generate;

public final class UnrollLimitExceededException extends IllegalStateException {

    private final long maxUnrolls;

    public UnrollLimitExceededException(final long maxUnrolls) {
        super("Sampling exceeded the maximum of %d repetition steps, repetition probabilities are likely too close to 1.0".formatted(maxUnrolls));
        this.maxUnrolls = maxUnrolls;
    }

    public long maxUnrolls() {
        return maxUnrolls;
    }
}
