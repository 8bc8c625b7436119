package net.docfmt.api;

import net.docfmt.syntax.SyntaxNode;
import net.docfmt.syntax.TextRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Replacements {
    private final List<Replacement> replacements;

    public Replacements(List<Replacement> replacements) {
        this.replacements = replacements;
    }

    public Replacements() {
        this(new ArrayList<>());
    }

    public boolean isEmpty() {
        return replacements.isEmpty();
    }

    public List<Replacement> asList() {
        return Collections.unmodifiableList(replacements);
    }

    public void replace(SyntaxNode node, String newText) {
        add(new Replacement(node.getTextRange(), newText));
    }

    public void replace(TextRange range, String newText) {
        add(new Replacement(range, newText));
    }

    public void add(Replacement replacement) {
        replacements.add(replacement);
    }

    /**
     * Sorts the collected replacements and verifies that no two of them overlap.
     *
     * @throws IllegalStateException if two replacements overlap
     */
    public void sortAndVerify() {
        replacements.sort(Replacement.COMPARATOR);
        for (int i = 1; i < replacements.size(); i++) {
            var previous = replacements.get(i - 1);
            var current = replacements.get(i);
            if (previous.range().endOffset() > current.range().startOffset()) {
                throw new IllegalStateException("Trying to replace overlapping ranges: " + current + " and " + previous);
            }
        }
    }

    public String apply(CharSequence originalContent) {
        return applyTracked(originalContent).text();
    }

    /**
     * Splices all replacements into {@code originalContent}.
     * <p>
     * Every line of a replacement after its first is indented like the line on which the replaced range starts,
     * except for the empty remainder after a trailing line break. Line breaks in replacements are written with
     * the line separator of {@code originalContent}.
     *
     * @throws IllegalStateException if two replacements overlap
     */
    public PatchedText applyTracked(CharSequence originalContent) {
        // We will assemble the resulting file by iterating all ranges (replaced or not)
        // For this to work, the replacement ranges need to be in ascending order and non-overlapping
        sortAndVerify();

        var lineSeparator = usesCrLf(originalContent) ? "\r\n" : "\n";
        var writer = new StringBuilder(originalContent.length());
        var insertedRanges = new ArrayList<TextRange>(replacements.size());
        int copiedUpTo = 0;
        for (var replacement : replacements) {
            var range = replacement.range();
            // Copy between previous and current replacement verbatim
            writer.append(originalContent, copiedUpTo, range.startOffset());

            int insertedStart = writer.length();
            appendIndented(writer, replacement.newText(), indentationAt(originalContent, range.startOffset()), lineSeparator);
            insertedRanges.add(new TextRange(insertedStart, writer.length()));
            copiedUpTo = range.endOffset();
        }
        writer.append(originalContent, copiedUpTo, originalContent.length());
        return new PatchedText(writer.toString(), insertedRanges);
    }

    private static void appendIndented(StringBuilder writer, String text, String indentation, String lineSeparator) {
        var lines = text.replace("\r\n", "\n").split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                writer.append(lineSeparator);
                if (i == lines.length - 1 && lines[i].isEmpty()) {
                    break;
                }
                writer.append(indentation);
            }
            writer.append(lines[i]);
        }
    }

    /**
     * The run of spaces and tabs that starts the line containing {@code offset}, cut off at {@code offset}.
     */
    static String indentationAt(CharSequence text, int offset) {
        int lineStart = offset;
        while (lineStart > 0 && text.charAt(lineStart - 1) != '\n') {
            lineStart--;
        }
        int end = lineStart;
        while (end < offset && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
            end++;
        }
        return text.subSequence(lineStart, end).toString();
    }

    private static boolean usesCrLf(CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                return i > 0 && text.charAt(i - 1) == '\r';
            }
        }
        return false;
    }
}
