package net.docfmt.syntax;

public final class BooleanLiteral extends SyntaxNode {
    private final boolean value;

    BooleanLiteral(TextRange textRange, boolean value) {
        super(textRange);
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public void accept(SyntaxVisitor visitor) {
        visitor.visitBooleanLiteral(this);
    }
}
