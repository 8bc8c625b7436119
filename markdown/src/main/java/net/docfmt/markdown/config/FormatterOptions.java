package net.docfmt.markdown.config;

import java.util.Objects;

/**
 * Options handed to the markdown formatter. Instances are always valid; use {@link OptionsValidator} to build them
 * from untyped configuration.
 */
public record FormatterOptions(int lineWidth,
                               TextWrap textWrap,
                               EmphasisKind emphasisKind,
                               EmphasisKind strongKind,
                               NewLineKind newLineKind,
                               UnorderedListKind unorderedListKind) {
    public static final int MIN_LINE_WIDTH = 1;
    public static final int MAX_LINE_WIDTH = 1000;

    public static final FormatterOptions DEFAULT = new FormatterOptions(
            80,
            TextWrap.ALWAYS,
            EmphasisKind.ASTERISKS,
            EmphasisKind.ASTERISKS,
            NewLineKind.AUTO,
            UnorderedListKind.DASHES
    );

    public FormatterOptions {
        if (lineWidth < MIN_LINE_WIDTH || lineWidth > MAX_LINE_WIDTH) {
            throw new IllegalArgumentException("lineWidth must be between " + MIN_LINE_WIDTH + " and " + MAX_LINE_WIDTH + ": " + lineWidth);
        }
        Objects.requireNonNull(textWrap, "textWrap");
        Objects.requireNonNull(emphasisKind, "emphasisKind");
        Objects.requireNonNull(strongKind, "strongKind");
        Objects.requireNonNull(newLineKind, "newLineKind");
        Objects.requireNonNull(unorderedListKind, "unorderedListKind");
    }

    public FormatterOptions withLineWidth(int lineWidth) {
        return new FormatterOptions(lineWidth, textWrap, emphasisKind, strongKind, newLineKind, unorderedListKind);
    }

    public FormatterOptions withTextWrap(TextWrap textWrap) {
        return new FormatterOptions(lineWidth, textWrap, emphasisKind, strongKind, newLineKind, unorderedListKind);
    }

    public FormatterOptions withEmphasisKind(EmphasisKind emphasisKind) {
        return new FormatterOptions(lineWidth, textWrap, emphasisKind, strongKind, newLineKind, unorderedListKind);
    }

    public FormatterOptions withStrongKind(EmphasisKind strongKind) {
        return new FormatterOptions(lineWidth, textWrap, emphasisKind, strongKind, newLineKind, unorderedListKind);
    }

    public FormatterOptions withNewLineKind(NewLineKind newLineKind) {
        return new FormatterOptions(lineWidth, textWrap, emphasisKind, strongKind, newLineKind, unorderedListKind);
    }

    public FormatterOptions withUnorderedListKind(UnorderedListKind unorderedListKind) {
        return new FormatterOptions(lineWidth, textWrap, emphasisKind, strongKind, newLineKind, unorderedListKind);
    }
}
