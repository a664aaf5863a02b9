package nl.nfi.probregex.regex.notation;

public final class ExpressionSyntaxException extends IllegalArgumentException {

    private final int position;

    public ExpressionSyntaxException(final String message, final int position) {
        super("%s (at position %d)".formatted(message, position));
        this.position = position;
    }

    public ExpressionSyntaxException(final String message, final int position, final Throwable cause) {
        super("%s (at position %d)".formatted(message, position), cause);
        this.position = position;
    }

    public int position() {
        return position;
    }
}
