package nl.nfi.probregex.regex;

public enum ExpressionKind {
    CHAR,
    CONCAT,
    CHOICE,
    KLEENE,
    OPTION,
    PLUS
}
