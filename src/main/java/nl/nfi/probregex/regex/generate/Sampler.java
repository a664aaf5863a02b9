package nl.nfi.probregex.regex.generate;

import nl.nfi.probregex.regex.Expression;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static java.util.Objects.requireNonNull;
import static nl.nfi.probregex.regex.generate.SamplerCommon.generateString;

public final class Sampler implements StringGenerator {

    public static final long DEFAULT_MAX_UNROLLS = SamplerCommon.DEFAULT_MAX_UNROLLS;

    private final Expression expression;
    private final Random random;
    private final long maxUnrolls;

    private Sampler(final Expression expression, final Random random, final long maxUnrolls) {
        this.expression = expression;
        this.random = random;
        this.maxUnrolls = maxUnrolls;
    }

    public static Sampler init(final Expression expression) {
        return new Sampler(requireNonNull(expression, "expression"), new Random(), DEFAULT_MAX_UNROLLS);
    }

    public Sampler random(final Random random) {
        return new Sampler(expression, requireNonNull(random, "random"), maxUnrolls);
    }

    public Sampler seed(final long seed) {
        return random(new Random(seed));
    }

    public Sampler maxUnrolls(final long maxUnrolls) {
        if (maxUnrolls < 0) {
            throw new IllegalArgumentException("Maximum number of repetition steps must not be negative: %d".formatted(maxUnrolls));
        }
        return new Sampler(expression, random, maxUnrolls);
    }

    public String sample() {
        return generateString(expression, random, maxUnrolls);
    }

    @Override
    public List<String> sampleMany(final int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Sample count must not be negative: %d".formatted(count));
        }
        final List<String> samples = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            samples.add(sample());
        }
        return samples;
    }

    @Override
    public void writeSamples(final long limit, final PrintStream output) {
        for (long remaining = limit; remaining > 0; remaining--) {
            output.println(sample());
        }
    }
}
