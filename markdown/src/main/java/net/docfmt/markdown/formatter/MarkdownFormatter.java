package net.docfmt.markdown.formatter;

import net.docfmt.markdown.config.FormatterOptions;

/**
 * Lays out markdown text. Implementations must be stateless.
 */
public interface MarkdownFormatter {
    /**
     * @param markdown the markdown text
     * @param options  the layout options
     * @return the formatted text, ending with exactly one line break unless it is empty
     * @throws MarkdownFormatException if the text cannot be formatted
     */
    String format(String markdown, FormatterOptions options) throws MarkdownFormatException;
}
