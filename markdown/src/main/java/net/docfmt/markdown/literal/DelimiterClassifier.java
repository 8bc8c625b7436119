package net.docfmt.markdown.literal;

import net.docfmt.syntax.SigilLiteral;
import net.docfmt.syntax.StringLiteral;
import net.docfmt.syntax.SyntaxNode;

import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a value node is a documentation literal, and of which family.
 */
public final class DelimiterClassifier {
    /**
     * Sigils that produce plain strings.
     */
    private static final Set<String> STRING_SIGILS = Set.of("S", "s");

    private DelimiterClassifier() {
    }

    public static Optional<DelimiterKind> classify(SyntaxNode node) {
        if (node instanceof StringLiteral literal) {
            return switch (literal.getQuote()) {
                case DOUBLE -> Optional.of(DelimiterKind.PlainQuote.INSTANCE);
                case DOUBLE_HEREDOC -> Optional.of(DelimiterKind.BlockQuote.DOUBLE);
                // Both single-quoted forms are charlists. A ''' heredoc is still a block of doc text and is
                // rewritten with the same marker, while a one-line '...' is a charlist value and stays as written.
                case SINGLE_HEREDOC -> Optional.of(DelimiterKind.BlockQuote.SINGLE);
                case SINGLE -> Optional.empty();
            };
        }
        if (node instanceof SigilLiteral sigil) {
            if (!STRING_SIGILS.contains(sigil.getName()) || !sigil.getModifiers().isEmpty()) {
                return Optional.empty();
            }
            var pair = DelimiterPair.byOpening(sigil.getOpeningDelimiter());
            if (pair == null) {
                return Optional.empty();
            }
            return Optional.of(sigil.isInterpolating()
                    ? new DelimiterKind.TaggedInterpolated(sigil.getName(), pair)
                    : new DelimiterKind.TaggedRaw(sigil.getName(), pair));
        }
        return Optional.empty();
    }
}
