package net.docfmt.api;

import net.docfmt.syntax.TextRange;

import java.util.List;

/**
 * The result of applying {@link Replacements}.
 *
 * @param text           the patched text
 * @param insertedRanges the ranges of {@code text} that were produced by replacements, in ascending order
 */
public record PatchedText(String text, List<TextRange> insertedRanges) {
    public PatchedText {
        insertedRanges = List.copyOf(insertedRanges);
    }
}
