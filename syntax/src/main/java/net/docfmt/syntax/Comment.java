package net.docfmt.syntax;

/**
 * A {@code #} comment up to, but excluding, the end of its line.
 */
public final class Comment extends SyntaxNode {
    Comment(TextRange textRange) {
        super(textRange);
    }

    @Override
    public void accept(SyntaxVisitor visitor) {
        visitor.visitComment(this);
    }
}
