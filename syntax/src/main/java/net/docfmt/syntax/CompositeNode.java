package net.docfmt.syntax;

import java.util.List;

/**
 * A node that owns child nodes.
 */
public abstract class CompositeNode extends SyntaxNode {
    private final List<SyntaxNode> children;

    protected CompositeNode(TextRange textRange, List<SyntaxNode> children) {
        super(textRange);
        this.children = List.copyOf(children);
        for (var child : this.children) {
            child.setParent(this);
        }
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children;
    }
}
