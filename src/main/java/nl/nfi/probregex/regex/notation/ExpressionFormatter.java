package nl.nfi.probregex.regex.notation;

import nl.nfi.probregex.regex.Char;
import nl.nfi.probregex.regex.Choice;
import nl.nfi.probregex.regex.Concat;
import nl.nfi.probregex.regex.Expression;
import nl.nfi.probregex.regex.Kleene;
import nl.nfi.probregex.regex.Option;
import nl.nfi.probregex.regex.Plus;
import nl.nfi.probregex.regex.Probability;

public final class ExpressionFormatter {

    private ExpressionFormatter() {
    }

    public static String format(final Expression expression) {
        final StringBuilder output = new StringBuilder();
        format(expression, output);
        return output.toString();
    }

    private static StringBuilder format(final Expression expression, final StringBuilder output) {
        return switch (expression.kind()) {
            case CHAR -> {
                final char value = ((Char) expression).value();
                output.append('\'');
                if (value == '\'' || value == '\\') {
                    output.append('\\');
                }
                yield output.append(value).append('\'');
            }
            case CONCAT -> {
                output.append("concat(");
                Expression remaining = expression;
                // flatten the right spine, which parses back to the same nesting
                while (remaining instanceof Concat concat) {
                    format(concat.left(), output);
                    output.append(", ");
                    remaining = concat.right();
                }
                yield format(remaining, output).append(')');
            }
            case CHOICE -> {
                final Choice choice = (Choice) expression;
                output.append("choice(");
                format(choice.left(), output);
                output.append(", ");
                format(choice.right(), output);
                yield appendProbability(choice.probability(), output);
            }
            case KLEENE -> unary("kleene", ((Kleene) expression).body(), ((Kleene) expression).probability(), output);
            case OPTION -> unary("option", ((Option) expression).body(), ((Option) expression).probability(), output);
            case PLUS -> unary("plus", ((Plus) expression).body(), ((Plus) expression).probability(), output);
        };
    }

    private static StringBuilder unary(final String name, final Expression body, final Probability probability, final StringBuilder output) {
        output.append(name).append('(');
        format(body, output);
        return appendProbability(probability, output);
    }

    private static StringBuilder appendProbability(final Probability probability, final StringBuilder output) {
        return output.append(", ").append(probability.value()).append(')');
    }
}
