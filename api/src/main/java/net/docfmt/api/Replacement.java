package net.docfmt.api;

import net.docfmt.syntax.TextRange;

import java.util.Comparator;

public record Replacement(TextRange range, String newText) {

    public static final Comparator<Replacement> COMPARATOR = Comparator
            .<Replacement>comparingInt(replacement -> replacement.range.startOffset())
            .thenComparingInt(replacement -> replacement.range.endOffset());
}
