package nl.nfi.probregex.regex.notation;

import nl.nfi.probregex.regex.Char;
import nl.nfi.probregex.regex.Choice;
import nl.nfi.probregex.regex.Concat;
import nl.nfi.probregex.regex.Expression;
import nl.nfi.probregex.regex.InvalidProbabilityException;
import nl.nfi.probregex.regex.Kleene;
import nl.nfi.probregex.regex.Option;
import nl.nfi.probregex.regex.Plus;
import nl.nfi.probregex.regex.Probability;

import java.util.ArrayList;
import java.util.List;

import static java.lang.Character.isDigit;
import static java.lang.Character.isLetter;
import static java.lang.Character.isWhitespace;

/**
 * Parses the functional notation written by {@link ExpressionFormatter}, e.g.:
 * <pre>
 *     concat(kleene(choice('a', 'b', 0.4), 0.3), 'c')
 * </pre>
 * where {@code concat} takes two or more arguments and nests to the right.
 */
public final class ExpressionParser {

    private final String text;
    private int position;

    private ExpressionParser(final String text) {
        this.text = text;
    }

    public static Expression parse(final String text) {
        final ExpressionParser parser = new ExpressionParser(text);
        final Expression expression = parser.readExpression();
        parser.skipWhitespace();
        if (parser.position != text.length()) {
            throw new ExpressionSyntaxException("Unexpected trailing input", parser.position);
        }
        return expression;
    }

    private Expression readExpression() {
        skipWhitespace();
        if (atEnd()) {
            throw new ExpressionSyntaxException("Expected expression but reached end of input", position);
        }
        if (text.charAt(position) == '\'') {
            return readChar();
        }

        final int start = position;
        final String name = readName();
        expect('(');
        final Expression expression = switch (name) {
            case "concat" -> readConcatArguments();
            case "choice" -> {
                final Expression left = readExpression();
                expect(',');
                final Expression right = readExpression();
                expect(',');
                yield new Choice(left, right, readProbability());
            }
            case "kleene" -> {
                final Expression body = readExpression();
                expect(',');
                yield new Kleene(body, readProbability());
            }
            case "option" -> {
                final Expression body = readExpression();
                expect(',');
                yield new Option(body, readProbability());
            }
            case "plus" -> {
                final Expression body = readExpression();
                expect(',');
                yield new Plus(body, readProbability());
            }
            default -> throw new ExpressionSyntaxException("Unknown operator '%s'".formatted(name), start);
        };
        expect(')');
        return expression;
    }

    private Expression readConcatArguments() {
        final List<Expression> parts = new ArrayList<>();
        parts.add(readExpression());
        do {
            expect(',');
            parts.add(readExpression());
        } while (peek() == ',');

        Expression result = parts.get(parts.size() - 1);
        for (int i = parts.size() - 2; i >= 0; i--) {
            result = new Concat(parts.get(i), result);
        }
        return result;
    }

    private Char readChar() {
        final int start = position;
        position++; // opening quote
        if (atEnd()) {
            throw new ExpressionSyntaxException("Unterminated character literal", start);
        }
        char value = text.charAt(position++);
        if (value == '\\') {
            if (atEnd()) {
                throw new ExpressionSyntaxException("Unterminated escape in character literal", start);
            }
            value = text.charAt(position++);
            if (value != '\\' && value != '\'') {
                throw new ExpressionSyntaxException("Unsupported escape '\\%c'".formatted(value), position - 2);
            }
        } else if (value == '\'') {
            throw new ExpressionSyntaxException("Empty character literal", start);
        }
        if (atEnd() || text.charAt(position) != '\'') {
            throw new ExpressionSyntaxException("Character literal must contain exactly one character", start);
        }
        position++; // closing quote
        return new Char(value);
    }

    private Probability readProbability() {
        skipWhitespace();
        final int start = position;
        while (!atEnd() && isNumberPart(text.charAt(position))) {
            position++;
        }
        if (start == position) {
            throw new ExpressionSyntaxException("Expected probability", start);
        }
        final String literal = text.substring(start, position);
        try {
            return Probability.of(Double.parseDouble(literal));
        } catch (final NumberFormatException e) {
            throw new ExpressionSyntaxException("Malformed probability '%s'".formatted(literal), start, e);
        } catch (final InvalidProbabilityException e) {
            throw new ExpressionSyntaxException(e.getMessage(), start, e);
        }
    }

    private String readName() {
        final int start = position;
        while (!atEnd() && isLetter(text.charAt(position))) {
            position++;
        }
        if (start == position) {
            throw new ExpressionSyntaxException("Expected operator or character literal, found '%c'".formatted(text.charAt(start)), start);
        }
        return text.substring(start, position);
    }

    private void expect(final char expected) {
        skipWhitespace();
        if (atEnd()) {
            throw new ExpressionSyntaxException("Expected '%c' but reached end of input".formatted(expected), position);
        }
        if (text.charAt(position) != expected) {
            throw new ExpressionSyntaxException("Expected '%c', found '%c'".formatted(expected, text.charAt(position)), position);
        }
        position++;
    }

    private char peek() {
        skipWhitespace();
        return atEnd() ? 0 : text.charAt(position);
    }

    private void skipWhitespace() {
        while (!atEnd() && isWhitespace(text.charAt(position))) {
            position++;
        }
    }

    private boolean atEnd() {
        return position >= text.length();
    }

    private static boolean isNumberPart(final char c) {
        return isDigit(c) || c == '.' || c == 'e' || c == 'E' || c == '+' || c == '-';
    }
}
