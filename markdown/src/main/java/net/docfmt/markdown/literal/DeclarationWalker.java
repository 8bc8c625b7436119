package net.docfmt.markdown.literal;

import net.docfmt.markdown.config.TargetSet;
import net.docfmt.syntax.AttributeDeclaration;
import net.docfmt.syntax.ElixirParser;
import net.docfmt.syntax.RecursiveSyntaxVisitor;
import net.docfmt.syntax.SigilLiteral;
import net.docfmt.syntax.SourceFile;
import net.docfmt.syntax.SourceParseException;
import net.docfmt.syntax.StringLiteral;
import net.docfmt.syntax.SyntaxNode;
import net.docfmt.syntax.TextRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the documentation literals of the targeted attributes, in source order.
 * <p>
 * An attribute qualifies only if its whole value is a single string literal: a double-quoted string, a heredoc or
 * an {@code ~S}/{@code ~s} sigil without modifiers. Interpolated values, booleans, lists and compound expressions
 * are skipped.
 */
public final class DeclarationWalker {
    private DeclarationWalker() {
    }

    public static List<LiteralNode> walk(SourceFile file, TargetSet targets) {
        var found = new ArrayList<LiteralNode>();
        if (targets.isEmpty()) {
            return found;
        }
        file.accept(new RecursiveSyntaxVisitor() {
            @Override
            public void visitAttributeDeclaration(AttributeDeclaration declaration) {
                if (targets.contains(declaration.getName())) {
                    toLiteralNode(declaration).ifPresent(found::add);
                }
                super.visitAttributeDeclaration(declaration);
            }
        });
        return found;
    }

    /**
     * Reads {@code literalText} as the value of a {@code @doc} attribute.
     *
     * @return the literal, or empty if {@code literalText} is not exactly one documentation literal
     * @throws SourceParseException if {@code literalText} is not a complete literal
     */
    public static Optional<LiteralNode> readLiteral(String literalText) throws SourceParseException {
        var prefix = "@doc ";
        var literals = walk(ElixirParser.parse(prefix + literalText), TargetSet.of("doc"));
        if (literals.size() != 1) {
            return Optional.empty();
        }
        var range = literals.get(0).range();
        if (range.startOffset() != prefix.length() || range.endOffset() != prefix.length() + literalText.length()) {
            return Optional.empty();
        }
        return Optional.of(literals.get(0));
    }

    static Optional<LiteralNode> toLiteralNode(AttributeDeclaration declaration) {
        var value = declaration.getBoundValue();
        if (value == null) {
            return Optional.empty();
        }
        var kind = DelimiterClassifier.classify(value);
        if (kind.isEmpty() || kind.get().isInterpolating() && isInterpolated(value)) {
            return Optional.empty();
        }
        var range = value.getTextRange();
        if (kind.get() instanceof DelimiterKind.Tagged && value.getText().indexOf('\n') >= 0) {
            range = range.withEndOffset(range.endOffset() + lineBreakLength(value.getContainingFile().getText(), range.endOffset()));
        }
        return Optional.of(new LiteralNode(declaration.getName(), range, kind.get(), LiteralContent.extract(value)));
    }

    private static boolean isInterpolated(SyntaxNode value) {
        if (value instanceof StringLiteral string) {
            return string.isInterpolated();
        }
        return value instanceof SigilLiteral sigil && sigil.isInterpolated();
    }

    private static int lineBreakLength(String text, int offset) {
        if (text.startsWith("\r\n", offset)) {
            return 2;
        }
        return text.startsWith("\n", offset) ? 1 : 0;
    }

    /**
     * {@code true} if {@code range} ends with a line break that is not part of the literal itself.
     */
    public static boolean consumesLineBreak(CharSequence text, TextRange range) {
        return range.endOffset() > range.startOffset() && text.charAt(range.endOffset() - 1) == '\n';
    }
}
