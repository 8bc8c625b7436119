package net.docfmt.markdown.formatter;

/**
 * Thrown by a {@link MarkdownFormatter} that cannot format its input.
 */
public class MarkdownFormatException extends Exception {
    public MarkdownFormatException(String message) {
        super(message);
    }

    public MarkdownFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
