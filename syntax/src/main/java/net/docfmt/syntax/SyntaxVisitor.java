package net.docfmt.syntax;

/**
 * Visits nodes of the positioned tree. Every specific method delegates to {@link #visitNode} unless overridden.
 */
public abstract class SyntaxVisitor {
    public void visitNode(SyntaxNode node) {
    }

    public void visitFile(SourceFile file) {
        visitNode(file);
    }

    public void visitGroup(Group group) {
        visitNode(group);
    }

    public void visitAttributeDeclaration(AttributeDeclaration declaration) {
        visitNode(declaration);
    }

    public void visitStringLiteral(StringLiteral literal) {
        visitNode(literal);
    }

    public void visitSigilLiteral(SigilLiteral literal) {
        visitNode(literal);
    }

    public void visitBooleanLiteral(BooleanLiteral literal) {
        visitNode(literal);
    }

    public void visitNilLiteral(NilLiteral literal) {
        visitNode(literal);
    }

    public void visitComment(Comment comment) {
        visitNode(comment);
    }

    public void visitToken(Token token) {
        visitNode(token);
    }
}
