package net.docfmt.markdown.literal;

import net.docfmt.syntax.SigilLiteral;
import net.docfmt.syntax.StringLiteral;
import net.docfmt.syntax.SyntaxNode;

/**
 * Extracts the text of a documentation literal the way the markdown formatter should see it.
 * <p>
 * Single-line bodies are taken verbatim, escape sequences included. Block bodies lose the line breaks next to the
 * delimiters and the indentation of the closing delimiter.
 */
public final class LiteralContent {
    private LiteralContent() {
    }

    public static String extract(SyntaxNode literal) {
        if (literal instanceof StringLiteral string) {
            if (!string.getQuote().isHeredoc()) {
                return string.getBody();
            }
            int closingStart = string.getEndOffset() - string.getQuote().delimiter().length();
            return dedent(string.getBody(), closingStart - string.getBodyRange().endOffset());
        }
        if (literal instanceof SigilLiteral sigil) {
            var body = sigil.getBody();
            if (sigil.isHeredoc()) {
                int closingStart = sigil.getEndOffset() - sigil.getModifiers().length() - sigil.getClosingDelimiter().length();
                return dedent(body, closingStart - sigil.getBodyRange().endOffset());
            }
            return isBlockShaped(body) ? dedentBlockShaped(body) : body;
        }
        throw new IllegalArgumentException("Not a documentation literal: " + literal);
    }

    /**
     * A body that starts with a line break and whose closing delimiter sits on its own line, like
     * <pre>
     * ~S(
     * text
     * )
     * </pre>
     */
    static boolean isBlockShaped(String body) {
        if (!body.startsWith("\n") && !body.startsWith("\r\n")) {
            return false;
        }
        int lastBreak = body.lastIndexOf('\n');
        return body.substring(lastBreak + 1).isBlank();
    }

    private static String dedentBlockShaped(String body) {
        int firstBreak = body.indexOf('\n');
        int lastBreak = body.lastIndexOf('\n');
        if (firstBreak == lastBreak) {
            return "";
        }
        return dedent(body.substring(firstBreak + 1, lastBreak + 1), body.length() - lastBreak - 1);
    }

    /**
     * Joins the lines of {@code block} (which ends with a line break unless empty), removing up to {@code indent}
     * leading blanks from each.
     */
    static String dedent(String block, int indent) {
        if (block.isEmpty()) {
            return "";
        }
        var text = block.endsWith("\n") ? block.substring(0, block.length() - 1) : block;
        var lines = text.split("\n", -1);
        var result = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            var line = lines[i];
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            int start = 0;
            while (start < indent && start < line.length() && (line.charAt(start) == ' ' || line.charAt(start) == '\t')) {
                start++;
            }
            if (i > 0) {
                result.append('\n');
            }
            result.append(line, start, line.length());
        }
        return result.toString();
    }
}
