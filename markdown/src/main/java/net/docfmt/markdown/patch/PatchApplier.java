package net.docfmt.markdown.patch;

import net.docfmt.api.PatchedText;
import net.docfmt.api.Replacements;

/**
 * Applies replacements to a source text and removes the trailing blanks that re-indentation leaves on empty lines.
 * Only lines inside replaced regions are cleaned; the rest of the file is never touched.
 */
public final class PatchApplier {
    private PatchApplier() {
    }

    public static PatchResult apply(String original, Replacements replacements) {
        if (replacements.isEmpty()) {
            return PatchResult.unchanged(original);
        }

        PatchedText patched;
        try {
            patched = replacements.applyTracked(original);
        } catch (IllegalStateException e) {
            return PatchResult.failed(original, e.getMessage());
        }
        return PatchResult.patched(clearBlankLines(patched));
    }

    /**
     * Empties every line that starts inside an inserted range and consists only of spaces and tabs.
     */
    static String clearBlankLines(PatchedText patched) {
        var text = patched.text();
        var result = new StringBuilder(text.length());
        int copiedUpTo = 0;
        for (var range : patched.insertedRanges()) {
            int lineStart = range.startOffset();
            if (lineStart > 0 && text.charAt(lineStart - 1) != '\n') {
                lineStart = nextLineStart(text, lineStart);
            }
            while (lineStart >= 0 && lineStart < range.endOffset()) {
                int blankEnd = lineStart;
                while (blankEnd < text.length() && (text.charAt(blankEnd) == ' ' || text.charAt(blankEnd) == '\t')) {
                    blankEnd++;
                }
                if (blankEnd > lineStart && blankEnd <= range.endOffset() && isLineEnd(text, blankEnd)) {
                    result.append(text, copiedUpTo, lineStart);
                    copiedUpTo = blankEnd;
                }
                lineStart = nextLineStart(text, lineStart);
            }
        }
        result.append(text, copiedUpTo, text.length());
        return result.toString();
    }

    private static int nextLineStart(String text, int from) {
        int lineBreak = text.indexOf('\n', from);
        return lineBreak < 0 ? -1 : lineBreak + 1;
    }

    private static boolean isLineEnd(String text, int offset) {
        return offset == text.length() || text.charAt(offset) == '\n' || text.startsWith("\r\n", offset);
    }
}
