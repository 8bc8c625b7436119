package net.docfmt.syntax;

/**
 * A sigil such as {@code ~S(text)}, {@code ~s"""...."""} or {@code ~r/regex/i}.
 */
public final class SigilLiteral extends SyntaxNode {
    private final String name;
    private final String openingDelimiter;
    private final String closingDelimiter;
    private final TextRange bodyRange;
    private final String modifiers;
    private final boolean interpolated;

    SigilLiteral(TextRange textRange, String name, String openingDelimiter, String closingDelimiter,
                 TextRange bodyRange, String modifiers, boolean interpolated) {
        super(textRange);
        this.name = name;
        this.openingDelimiter = openingDelimiter;
        this.closingDelimiter = closingDelimiter;
        this.bodyRange = bodyRange;
        this.modifiers = modifiers;
        this.interpolated = interpolated;
    }

    /**
     * The sigil letters without the leading {@code ~}.
     */
    public String getName() {
        return name;
    }

    public String getOpeningDelimiter() {
        return openingDelimiter;
    }

    public String getClosingDelimiter() {
        return closingDelimiter;
    }

    public TextRange getBodyRange() {
        return bodyRange;
    }

    public String getBody() {
        return bodyRange.substring(getContainingFile().getText());
    }

    public String getModifiers() {
        return modifiers;
    }

    /**
     * Lowercase sigils process escapes and interpolation; uppercase sigils are raw.
     */
    public boolean isInterpolating() {
        return Character.isLowerCase(name.charAt(0));
    }

    public boolean isInterpolated() {
        return interpolated;
    }

    public boolean isHeredoc() {
        return openingDelimiter.length() == 3;
    }

    @Override
    public void accept(SyntaxVisitor visitor) {
        visitor.visitSigilLiteral(this);
    }
}
