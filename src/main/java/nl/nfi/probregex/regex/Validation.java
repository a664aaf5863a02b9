package nl.nfi.probregex.regex;

public enum Validation {

    NONE,
    SHALLOW,
    RECURSIVE;

    public <E extends Expression> E check(final E expression) {
        return switch (this) {
            case NONE -> expression;
            case SHALLOW -> Validity.checkValid(expression);
            case RECURSIVE -> Validity.checkValidRecursively(expression);
        };
    }
}
