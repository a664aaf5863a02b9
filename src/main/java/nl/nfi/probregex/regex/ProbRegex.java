package nl.nfi.probregex.regex;

import nl.nfi.probregex.regex.generate.Sampler;
import nl.nfi.probregex.regex.generate.StringGenerator;
import nl.nfi.probregex.regex.generate.ThreadedSampler;
import nl.nfi.probregex.regex.infer.ProbabilityCalculator;
import nl.nfi.probregex.regex.notation.ExpressionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;

import static java.util.Objects.requireNonNull;

/**
 * Entry point tying an expression to its sampler and inference engine.
 * <p>
 * Instances are immutable apart from the {@link Random} that is shared by all samples drawn through
 * them; configuring returns a new instance.
 */
public final class ProbRegex {

    private static final Logger LOG = LoggerFactory.getLogger(ProbRegex.class);

    private final Expression expression;
    private final Random random;
    private final long maxUnrolls;
    private final int threadCount;

    private ProbRegex(final Expression expression) {
        this(expression, new Random(), Sampler.DEFAULT_MAX_UNROLLS, 1);
    }

    private ProbRegex(final Expression expression, final Random random, final long maxUnrolls, final int threadCount) {
        this.expression = expression;
        this.random = random;
        this.maxUnrolls = maxUnrolls;
        this.threadCount = threadCount;
    }

    public static ProbRegex forExpression(final Expression expression) {
        return new ProbRegex(requireNonNull(expression, "expression"));
    }

    public static ProbRegex parse(final String definition) {
        return forExpression(ExpressionParser.parse(definition));
    }

    public static ProbRegex loadFrom(final Path modelPath) throws IOException {
        return fromModel(ModelFile.loadFrom(modelPath));
    }

    public static ProbRegex fromModel(final ModelFile model) {
        ProbRegex probRegex = forExpression(model.expression()).validate(model.validation());
        if (model.seed().isPresent()) {
            probRegex = probRegex.seed(model.seed().getAsLong());
        }
        if (model.maxUnrolls().isPresent()) {
            probRegex = probRegex.maxUnrolls(model.maxUnrolls().getAsLong());
        }
        return probRegex;
    }

    public Expression expression() {
        return expression;
    }

    public ProbRegex validate(final Validation validation) {
        validation.check(expression);
        return this;
    }

    public ProbRegex random(final Random random) {
        return new ProbRegex(expression, requireNonNull(random, "random"), maxUnrolls, threadCount);
    }

    public ProbRegex seed(final long seed) {
        return random(new Random(seed));
    }

    public ProbRegex maxUnrolls(final long maxUnrolls) {
        if (maxUnrolls < 0) {
            throw new IllegalArgumentException("Maximum number of repetition steps must not be negative: %d".formatted(maxUnrolls));
        }
        return new ProbRegex(expression, random, maxUnrolls, threadCount);
    }

    public ProbRegex threadCount(final int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("Thread count must be at least 1: %d".formatted(threadCount));
        }
        return new ProbRegex(expression, random, maxUnrolls, threadCount);
    }

    public String sample() {
        return Sampler.init(expression).random(random).maxUnrolls(maxUnrolls).sample();
    }

    public List<String> sampleMany(final int count) {
        return generator().sampleMany(count);
    }

    public void writeSamples(final long limit, final PrintStream output) {
        LOG.info("Sampling: limit {}, threads {}", limit, threadCount);
        generator().writeSamples(limit, output);
    }

    public double probabilityOf(final String target) {
        return ProbabilityCalculator.probabilityOf(expression, target);
    }

    // one "target<TAB>probability" line per target
    public void writeProbabilities(final List<String> targets, final PrintStream output) {
        LOG.info("Scoring {} strings", targets.size());
        for (final String target : targets) {
            output.println(target + "\t" + probabilityOf(target));
        }
    }

    private StringGenerator generator() {
        if (threadCount == 1) {
            return Sampler.init(expression).random(random).maxUnrolls(maxUnrolls);
        }
        return ThreadedSampler.init(expression).random(random).maxUnrolls(maxUnrolls).threadCount(threadCount);
    }
}
