package nl.nfi.probregex.regex;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static nl.nfi.probregex.regex.infer.ProbabilityCalculator.probabilityOf;

public final class Validity {

    private Validity() {
    }

    // only inspects the given node itself, nested Kleene expressions are not checked
    public static <E extends Expression> E checkValid(final E expression) {
        if (expression instanceof Kleene kleene) {
            final double emptyProbability = probabilityOf(kleene.body(), "");
            if (emptyProbability > 0.0) {
                throw new InvalidExpressionException(expression,
                    "body of Kleene expression derives the empty string with probability %s".formatted(emptyProbability));
            }
        }
        return expression;
    }

    public static <E extends Expression> E checkValidRecursively(final E expression) {
        final Deque<Expression> pending = new ArrayDeque<>();
        pending.push(expression);

        while (!pending.isEmpty()) {
            final Expression current = checkValid(pending.pop());
            final List<Expression> children = switch (current.kind()) {
                case CHAR -> List.of();
                case CONCAT -> List.of(((Concat) current).left(), ((Concat) current).right());
                case CHOICE -> List.of(((Choice) current).left(), ((Choice) current).right());
                case KLEENE -> List.of(((Kleene) current).body());
                case OPTION -> List.of(((Option) current).body());
                case PLUS -> List.of(((Plus) current).body());
            };
            // pushed in reverse, so children are checked left to right
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return expression;
    }
}
