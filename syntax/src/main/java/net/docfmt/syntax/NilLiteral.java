package net.docfmt.syntax;

public final class NilLiteral extends SyntaxNode {
    NilLiteral(TextRange textRange) {
        super(textRange);
    }

    @Override
    public void accept(SyntaxVisitor visitor) {
        visitor.visitNilLiteral(this);
    }
}
