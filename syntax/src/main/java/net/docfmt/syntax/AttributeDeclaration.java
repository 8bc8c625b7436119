package net.docfmt.syntax;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A module attribute, {@code @name value}. The value is the expression that follows the name on the same line,
 * or a parenthesized argument directly attached to the name, as in {@code @doc("text")}.
 */
public final class AttributeDeclaration extends CompositeNode {
    private final Token nameToken;
    @Nullable
    private final SyntaxNode value;
    private final boolean parenthesized;
    private final boolean standalone;

    AttributeDeclaration(Token nameToken, @Nullable SyntaxNode value, boolean parenthesized, boolean standalone) {
        super(new TextRange(nameToken.getStartOffset(), value != null ? value.getEndOffset() : nameToken.getEndOffset()),
                children(nameToken, value));
        this.nameToken = nameToken;
        this.value = value;
        this.parenthesized = parenthesized;
        this.standalone = standalone;
    }

    private static List<SyntaxNode> children(Token nameToken, @Nullable SyntaxNode value) {
        var children = new ArrayList<SyntaxNode>(2);
        children.add(nameToken);
        if (value != null) {
            children.add(value);
        }
        return children;
    }

    /**
     * The attribute name without the leading {@code @}.
     */
    public String getName() {
        return nameToken.getText().substring(1);
    }

    public @Nullable SyntaxNode getValue() {
        return value;
    }

    public boolean isParenthesized() {
        return parenthesized;
    }

    /**
     * {@code true} if nothing else continues the expression after the value, i.e. the value is the whole argument.
     */
    public boolean isStandalone() {
        return standalone;
    }

    /**
     * The single node bound to the name, looking through a parenthesized argument list of exactly one element.
     */
    public @Nullable SyntaxNode getBoundValue() {
        if (value == null || !standalone) {
            return null;
        }
        if (parenthesized) {
            var elements = value.getChildren();
            return elements.size() == 1 ? elements.get(0) : null;
        }
        return value;
    }

    @Override
    public void accept(SyntaxVisitor visitor) {
        visitor.visitAttributeDeclaration(this);
    }
}
