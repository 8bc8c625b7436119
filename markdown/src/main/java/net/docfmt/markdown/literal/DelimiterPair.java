package net.docfmt.markdown.literal;

import org.jetbrains.annotations.Nullable;

/**
 * The opening and closing delimiters of a literal.
 */
public enum DelimiterPair {
    TRIPLE_DOUBLE_QUOTE("\"\"\"", "\"\"\""),
    TRIPLE_SINGLE_QUOTE("'''", "'''"),
    DOUBLE_QUOTE("\"", "\""),
    SINGLE_QUOTE("'", "'"),
    SLASH("/", "/"),
    PIPE("|", "|"),
    PARENS("(", ")"),
    BRACKETS("[", "]"),
    BRACES("{", "}"),
    ANGLES("<", ">");

    private final String opening;
    private final String closing;

    DelimiterPair(String opening, String closing) {
        this.opening = opening;
        this.closing = closing;
    }

    public String opening() {
        return opening;
    }

    public String closing() {
        return closing;
    }

    /**
     * Block pairs put the body on its own lines.
     */
    public boolean isBlock() {
        return this == TRIPLE_DOUBLE_QUOTE || this == TRIPLE_SINGLE_QUOTE;
    }

    public static @Nullable DelimiterPair byOpening(String opening) {
        for (var pair : values()) {
            if (pair.opening.equals(opening)) {
                return pair;
            }
        }
        return null;
    }
}
