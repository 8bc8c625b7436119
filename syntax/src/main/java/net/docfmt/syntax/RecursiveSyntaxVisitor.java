package net.docfmt.syntax;

/**
 * Visits every node of a tree depth-first in source order. Subclasses overriding a specific visit method must call
 * {@code super} to keep descending.
 */
public abstract class RecursiveSyntaxVisitor extends SyntaxVisitor {
    @Override
    public void visitNode(SyntaxNode node) {
        for (var child : node.getChildren()) {
            child.accept(this);
        }
    }
}
