package net.docfmt.syntax;

import java.util.List;

/**
 * The root of a parsed source text.
 */
public final class SourceFile extends CompositeNode {
    private final String text;

    SourceFile(String text, List<SyntaxNode> children) {
        super(new TextRange(0, text.length()), children);
        this.text = text;
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    public SourceFile getContainingFile() {
        return this;
    }

    @Override
    public void accept(SyntaxVisitor visitor) {
        visitor.visitFile(this);
    }
}
