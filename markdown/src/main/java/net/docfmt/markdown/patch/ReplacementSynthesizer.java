package net.docfmt.markdown.patch;

import net.docfmt.markdown.literal.DeclarationWalker;
import net.docfmt.markdown.literal.DelimiterKind;
import net.docfmt.markdown.literal.LiteralNode;
import net.docfmt.syntax.SourceParseException;

import java.util.Optional;

/**
 * Writes formatted content back as a literal of the same family as the one it came from.
 * <p>
 * Single-line forms become block forms when the content spans lines or contains their closing delimiter. Block
 * forms of tagged literals end with a line break, which the collector reconciles with the replaced range.
 * <p>
 * Every produced literal is parsed again and must yield the same family and the same content, otherwise the
 * content is refused.
 */
public final class ReplacementSynthesizer {
    private static final String HEREDOC = "\"\"\"";

    private ReplacementSynthesizer() {
    }

    public static Synthesis synthesize(String content, DelimiterKind kind) {
        if (kind.isInterpolating() && containsUnescaped(content, "#{")) {
            return Synthesis.refused("Formatted content would introduce an interpolation");
        }
        if (endsWithEscape(content)) {
            return Synthesis.refused("Formatted content ends with a backslash that would escape the closing delimiter");
        }
        var synthesis = write(content, kind);
        if (synthesis instanceof Synthesis.Produced produced) {
            return verify(produced.text(), content, kind);
        }
        return synthesis;
    }

    private static Synthesis write(String content, DelimiterKind kind) {
        if (kind instanceof DelimiterKind.PlainQuote) {
            if (content.indexOf('\n') < 0 && !containsUnescaped(content, "\"")) {
                return Synthesis.produced("\"" + content + "\"");
            }
            return block("", HEREDOC, content, "");
        }
        if (kind instanceof DelimiterKind.BlockQuote quote) {
            return block("", quote.marker(), content, "");
        }
        if (kind instanceof DelimiterKind.Tagged tagged) {
            var pair = tagged.pair();
            if (pair.isBlock()) {
                return block(tagged.prefix(), pair.opening(), content, "\n");
            }
            if (containsUnescaped(content, pair.closing())) {
                return block(tagged.prefix(), HEREDOC, content, "\n");
            }
            if (content.indexOf('\n') < 0) {
                return Synthesis.produced(tagged.prefix() + pair.opening() + content + pair.closing());
            }
            return Synthesis.produced(tagged.prefix() + pair.opening() + "\n" + content + "\n" + pair.closing() + "\n");
        }
        throw new IllegalArgumentException("Unsupported delimiter kind: " + kind);
    }

    private static Synthesis verify(String text, String content, DelimiterKind kind) {
        Optional<LiteralNode> readBack;
        try {
            readBack = DeclarationWalker.readLiteral(text);
        } catch (SourceParseException e) {
            return Synthesis.refused("Formatted content does not form a valid literal: " + e.getMessage());
        }
        if (readBack.isEmpty() || !kind.isSameFamily(readBack.get().delimiter())
                || !normalizeLineBreaks(readBack.get().content()).equals(normalizeLineBreaks(content))) {
            return Synthesis.refused("Formatted content does not read back unchanged as " + kind);
        }
        return Synthesis.produced(text);
    }

    private static String normalizeLineBreaks(String text) {
        return text.replace("\r\n", "\n");
    }

    /**
     * {@code true} if the last character of {@code text} is a backslash that is not itself escaped.
     */
    static boolean endsWithEscape(String text) {
        int backslashes = 0;
        for (int i = text.length() - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    private static Synthesis block(String prefix, String marker, String content, String suffix) {
        for (var line : content.split("\n", -1)) {
            if (line.stripLeading().startsWith(marker)) {
                return Synthesis.refused("Formatted content has a line starting with " + marker);
            }
        }
        return Synthesis.produced(prefix + marker + "\n" + content + "\n" + marker + suffix);
    }

    /**
     * {@code true} if {@code token} occurs in {@code text} without a backslash escaping its first character.
     */
    static boolean containsUnescaped(String text, String token) {
        int i = 0;
        while (i < text.length()) {
            if (text.charAt(i) == '\\') {
                i += 2;
            } else if (text.startsWith(token, i)) {
                return true;
            } else {
                i++;
            }
        }
        return false;
    }
}
