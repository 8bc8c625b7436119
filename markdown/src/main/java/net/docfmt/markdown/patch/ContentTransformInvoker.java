package net.docfmt.markdown.patch;

import net.docfmt.markdown.config.FormatterOptions;
import net.docfmt.markdown.formatter.MarkdownFormatException;
import net.docfmt.markdown.formatter.MarkdownFormatter;

/**
 * Runs the markdown formatter on the content of a single literal.
 */
public final class ContentTransformInvoker {
    private final MarkdownFormatter formatter;

    public ContentTransformInvoker(MarkdownFormatter formatter) {
        this.formatter = formatter;
    }

    public TransformOutcome invoke(String content, FormatterOptions options) {
        if (content.isEmpty()) {
            return TransformOutcome.unchanged();
        }

        String output;
        try {
            output = formatter.format(content, options);
        } catch (MarkdownFormatException e) {
            return TransformOutcome.failed(e.getMessage() != null ? e.getMessage() : e.toString());
        } catch (RuntimeException e) {
            return TransformOutcome.failed("Markdown formatter crashed: " + e);
        }
        if (output == null) {
            return TransformOutcome.failed("Markdown formatter returned no output");
        }

        var formatted = stripTrailingLineBreaks(output);
        return formatted.equals(content) ? TransformOutcome.unchanged() : TransformOutcome.changed(formatted);
    }

    static String stripTrailingLineBreaks(String text) {
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(0, end);
    }
}
