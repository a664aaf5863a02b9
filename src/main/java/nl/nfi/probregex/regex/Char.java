package nl.nfi.probregex.regex;

public record Char(char value) implements Expression {

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.CHAR;
    }
}
