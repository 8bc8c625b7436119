package net.docfmt.syntax;

/**
 * A quoted string or charlist, single-line or heredoc.
 */
public final class StringLiteral extends SyntaxNode {
    private final Quote quote;
    private final TextRange bodyRange;
    private final boolean interpolated;

    StringLiteral(TextRange textRange, Quote quote, TextRange bodyRange, boolean interpolated) {
        super(textRange);
        this.quote = quote;
        this.bodyRange = bodyRange;
        this.interpolated = interpolated;
    }

    public Quote getQuote() {
        return quote;
    }

    /**
     * The characters between the delimiters. For heredocs this starts after the line break following the opening
     * delimiter and ends at the start of the line holding the closing delimiter.
     */
    public TextRange getBodyRange() {
        return bodyRange;
    }

    public String getBody() {
        return bodyRange.substring(getContainingFile().getText());
    }

    /**
     * {@code true} if the body contains at least one {@code #{...}} interpolation.
     */
    public boolean isInterpolated() {
        return interpolated;
    }

    @Override
    public void accept(SyntaxVisitor visitor) {
        visitor.visitStringLiteral(this);
    }

    public enum Quote {
        DOUBLE("\""),
        SINGLE("'"),
        DOUBLE_HEREDOC("\"\"\""),
        SINGLE_HEREDOC("'''");

        private final String delimiter;

        Quote(String delimiter) {
            this.delimiter = delimiter;
        }

        public String delimiter() {
            return delimiter;
        }

        public boolean isHeredoc() {
            return this == DOUBLE_HEREDOC || this == SINGLE_HEREDOC;
        }
    }
}
