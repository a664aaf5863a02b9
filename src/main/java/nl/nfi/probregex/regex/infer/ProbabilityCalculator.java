package nl.nfi.probregex.regex.infer;

import nl.nfi.probregex.regex.Char;
import nl.nfi.probregex.regex.Choice;
import nl.nfi.probregex.regex.Concat;
import nl.nfi.probregex.regex.Expression;
import nl.nfi.probregex.regex.Kleene;
import nl.nfi.probregex.regex.Option;
import nl.nfi.probregex.regex.Plus;
import nl.nfi.probregex.regex.Probability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import static java.lang.Math.max;
import static java.lang.Math.min;
import static java.lang.Math.pow;
import static java.util.Objects.requireNonNull;

/**
 * Computes the exact probability that an expression derives a given string, summing over all derivations.
 * <p>
 * Concatenations are handled by summing over every split point of the (sub)string, repetitions by
 * unrolling the body into {@code Concat(body, Concat(body, ...))} continuations and summing the
 * geometric series term by term. The series is cut off once the number of unrolled copies exceeds
 * the length of the string, because a non-empty body cannot fit more copies than that.
 * <p>
 * Every (sub-expression, span) pair is evaluated once per call. Spans shorter or longer than an
 * expression can derive are zero without evaluation, and concatenations only visit the split points
 * both sides can fill. Bodies of bounded length therefore unroll in time quadratic in the length
 * of the string; bodies like {@code kleene(...)} that admit every split remain cubic or worse.
 * Instances are never shared, so concurrent calls need no coordination.
 */
public final class ProbabilityCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(ProbabilityCalculator.class);

    private final String target;
    // keyed on identity: continuations are built per call and structural hashing of deep trees is expensive
    private final Map<Expression, Map<Long, Double>> evaluated = new IdentityHashMap<>();
    private final Map<Expression, List<Expression>> continuations = new IdentityHashMap<>();
    private final Map<Expression, LengthBounds> lengthBounds = new IdentityHashMap<>();

    private ProbabilityCalculator(final String target) {
        this.target = target;
    }

    public static double probabilityOf(final Expression expression, final String target) {
        requireNonNull(expression, "expression");
        requireNonNull(target, "target");

        final ProbabilityCalculator calculator = forTarget(target);
        final double probability = calculator.probability(expression, 0, target.length());
        LOG.debug("Probability of string with length {}: {} ({} sub-expressions evaluated)", target.length(), probability, calculator.evaluated.size());
        return probability;
    }

    static ProbabilityCalculator forTarget(final String target) {
        return new ProbabilityCalculator(target);
    }

    // probability that expression derives target[start, end)
    double probability(final Expression expression, final int start, final int end) {
        if (!lengthBounds(expression).admits(end - start)) {
            return 0.0;
        }

        final Map<Long, Double> spans = evaluated.computeIfAbsent(expression, e -> new HashMap<>());
        final long span = ((long) start << 32) | end;

        final Double known = spans.get(span);
        if (known != null) {
            return known;
        }

        final double probability = switch (expression.kind()) {
            case CHAR -> matchChar((Char) expression, start, end);
            case CONCAT -> sumSplits((Concat) expression, start, end);
            case CHOICE -> {
                final Choice choice = (Choice) expression;
                yield choice.probability().value() * probability(choice.left(), start, end)
                    + choice.probability().complement() * probability(choice.right(), start, end);
            }
            case KLEENE -> start == end
                ? ((Kleene) expression).probability().value()
                : repetitionSeries(expression, start, end);
            case OPTION -> {
                final Option option = (Option) expression;
                yield start == end
                    ? option.probability().complement()
                    : option.probability().value() * probability(option.body(), start, end);
            }
            case PLUS -> start == end
                ? 0.0
                : repetitionSeries(expression, start, end);
        };

        spans.put(span, probability);
        return probability;
    }

    private double matchChar(final Char expression, final int start, final int end) {
        return end - start == 1 && target.charAt(start) == expression.value() ? 1.0 : 0.0;
    }

    // every split point in [start, end] that both sides can fill, the all-or-nothing splits included
    private double sumSplits(final Concat expression, final int start, final int end) {
        final LengthBounds left = lengthBounds(expression.left());
        final LengthBounds right = lengthBounds(expression.right());
        final long first = max((long) start + left.min(), (long) end - right.max());
        final long last = min((long) end - right.min(), (long) start + left.max());

        double sum = 0.0;
        for (long split = first; split <= last; split++) {
            final double leftProbability = probability(expression.left(), start, (int) split);
            if (leftProbability == 0.0) {
                continue;
            }
            sum += leftProbability * probability(expression.right(), (int) split, end);
        }
        return sum;
    }

    double repetitionSeries(final Expression expression, final int start, final int end) {
        final Repetition repetition = switch (expression.kind()) {
            case KLEENE -> new Repetition(((Kleene) expression).body(), ((Kleene) expression).probability(), 1);
            case PLUS -> new Repetition(((Plus) expression).body(), ((Plus) expression).probability(), 0);
            default -> throw new IllegalStateException("Repetition series is only defined for KLEENE and PLUS, not for %s".formatted(expression.kind()));
        };

        final double stop = repetition.probability().value();
        final double proceed = repetition.probability().complement();

        double sum = 0.0;
        for (int i = repetition.firstIndex(); i <= end - start; i++) {
            final Expression continuation = unrolled(repetition.body(), i - repetition.firstIndex() + 1);
            sum += pow(proceed, i) * stop * probability(continuation, start, end);
        }
        return sum;
    }

    // body concatenated with itself, copies times, shared between all spans and repetitions of the same body
    private Expression unrolled(final Expression body, final int copies) {
        final List<Expression> chain = continuations.computeIfAbsent(body, b -> {
            final List<Expression> list = new ArrayList<>();
            list.add(b);
            return list;
        });
        while (chain.size() < copies) {
            chain.add(new Concat(body, chain.get(chain.size() - 1)));
        }
        return chain.get(copies - 1);
    }

    // shortest and longest string the expression can derive, Integer.MAX_VALUE when unbounded
    private LengthBounds lengthBounds(final Expression expression) {
        final LengthBounds known = lengthBounds.get(expression);
        if (known != null) {
            return known;
        }

        final LengthBounds bounds = switch (expression.kind()) {
            case CHAR -> new LengthBounds(1, 1);
            case CONCAT -> {
                final LengthBounds left = lengthBounds(((Concat) expression).left());
                final LengthBounds right = lengthBounds(((Concat) expression).right());
                yield new LengthBounds(saturatedSum(left.min(), right.min()), saturatedSum(left.max(), right.max()));
            }
            case CHOICE -> {
                final LengthBounds left = lengthBounds(((Choice) expression).left());
                final LengthBounds right = lengthBounds(((Choice) expression).right());
                yield new LengthBounds(min(left.min(), right.min()), max(left.max(), right.max()));
            }
            case KLEENE -> new LengthBounds(0, Integer.MAX_VALUE);
            case OPTION -> new LengthBounds(0, lengthBounds(((Option) expression).body()).max());
            case PLUS -> new LengthBounds(lengthBounds(((Plus) expression).body()).min(), Integer.MAX_VALUE);
        };

        lengthBounds.put(expression, bounds);
        return bounds;
    }

    private static int saturatedSum(final int a, final int b) {
        return (int) min((long) a + b, Integer.MAX_VALUE);
    }

    private record LengthBounds(int min, int max) {

        boolean admits(final int length) {
            return length >= min && length <= max;
        }
    }

    private record Repetition(Expression body, Probability probability, int firstIndex) {
    }
}
