package net.docfmt.markdown.formatter;

/**
 * Accessed via {@link java.util.ServiceLoader}.
 */
public interface MarkdownFormatterProvider {
    /**
     * Unique name used to select this formatter.
     */
    String name();

    MarkdownFormatter create();
}
