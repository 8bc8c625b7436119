package net.docfmt.syntax;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A node of the positioned tree. Every node keeps the range it was parsed from, so its source text can be
 * reproduced exactly.
 */
public abstract class SyntaxNode {
    private final TextRange textRange;
    @Nullable
    private SyntaxNode parent;

    protected SyntaxNode(TextRange textRange) {
        this.textRange = textRange;
    }

    public abstract void accept(SyntaxVisitor visitor);

    public List<SyntaxNode> getChildren() {
        return List.of();
    }

    public TextRange getTextRange() {
        return textRange;
    }

    public int getStartOffset() {
        return textRange.startOffset();
    }

    public int getEndOffset() {
        return textRange.endOffset();
    }

    public @Nullable SyntaxNode getParent() {
        return parent;
    }

    void setParent(SyntaxNode parent) {
        if (this.parent != null) {
            throw new IllegalStateException(this + " is already attached to " + this.parent);
        }
        this.parent = parent;
    }

    public SourceFile getContainingFile() {
        SyntaxNode node = this;
        while (node.parent != null) {
            node = node.parent;
        }
        if (!(node instanceof SourceFile file)) {
            throw new IllegalStateException(this + " is not attached to a file");
        }
        return file;
    }

    public String getText() {
        return textRange.substring(getContainingFile().getText());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + textRange;
    }
}
