package net.docfmt.syntax;

/**
 * Any lexeme that has no dedicated node type.
 */
public final class Token extends SyntaxNode {
    private final Kind kind;

    Token(TextRange textRange, Kind kind) {
        super(textRange);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public void accept(SyntaxVisitor visitor) {
        visitor.visitToken(this);
    }

    @Override
    public String toString() {
        return "Token(" + kind + ")" + getTextRange();
    }

    public enum Kind {
        /** {@code @name} */
        ATTRIBUTE,
        IDENTIFIER,
        ALIAS,
        /** {@code name:} in a keyword list */
        KEYWORD_KEY,
        ATOM,
        NUMBER,
        /** {@code ?a} */
        CHAR,
        OPERATOR,
        /** {@code ,} {@code ;} and a lone {@code :} */
        PUNCTUATION
    }
}
