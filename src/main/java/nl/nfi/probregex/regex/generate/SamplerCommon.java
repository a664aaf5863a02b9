package nl.nfi.probregex.regex.generate;

import nl.nfi.probregex.regex.Char;
import nl.nfi.probregex.regex.Choice;
import nl.nfi.probregex.regex.Concat;
import nl.nfi.probregex.regex.Expression;
import nl.nfi.probregex.regex.Kleene;
import nl.nfi.probregex.regex.Option;
import nl.nfi.probregex.regex.Plus;

import java.util.Random;

final class SamplerCommon {

    static final long DEFAULT_MAX_UNROLLS = 1_000_000;

    private SamplerCommon() {
    }

    static String generateString(final Expression expression, final Random random, final long maxUnrolls) {
        final UnrollBudget budget = new UnrollBudget();
        budget.remaining = maxUnrolls;
        budget.max = maxUnrolls;

        final StringBuilder result = new StringBuilder();
        generateString(expression, random, budget, result);
        return result.toString();
    }

    // repetitions are looped instead of recursed, draws happen in the same order as the recursive definition
    private static StringBuilder generateString(final Expression expression, final Random random, final UnrollBudget budget, final StringBuilder result) {
        return switch (expression.kind()) {
            case CHAR -> result.append(((Char) expression).value());
            case CONCAT -> {
                final Concat concat = (Concat) expression;
                generateString(concat.left(), random, budget, result);
                yield generateString(concat.right(), random, budget, result);
            }
            case CHOICE -> {
                final Choice choice = (Choice) expression;
                yield random.nextDouble() < choice.probability().value()
                    ? generateString(choice.left(), random, budget, result)
                    : generateString(choice.right(), random, budget, result);
            }
            case KLEENE -> {
                final Kleene kleene = (Kleene) expression;
                while (random.nextDouble() >= kleene.probability().value()) {
                    budget.consume();
                    generateString(kleene.body(), random, budget, result);
                }
                yield result;
            }
            case OPTION -> {
                final Option option = (Option) expression;
                yield random.nextDouble() < option.probability().value()
                    ? generateString(option.body(), random, budget, result)
                    : result;
            }
            case PLUS -> {
                final Plus plus = (Plus) expression;
                boolean stop;
                do {
                    stop = random.nextDouble() < plus.probability().value();
                    budget.consume();
                    generateString(plus.body(), random, budget, result);
                } while (!stop);
                yield result;
            }
        };
    }

    private static final class UnrollBudget {

        long remaining;
        long max;

        void consume() {
            if (remaining <= 0) {
                throw new UnrollLimitExceededException(max);
            }
            remaining--;
        }
    }
}
