package net.docfmt.markdown;

import net.docfmt.markdown.config.FormatterOptions;
import net.docfmt.markdown.formatter.MarkdownFormatException;
import net.docfmt.markdown.formatter.MarkdownFormatter;

import java.util.ArrayList;
import java.util.regex.Pattern;

/**
 * A predictable stand-in for a real markdown formatter: collapses runs of spaces, trims lines, normalizes list
 * bullets and drops trailing blank lines. Text containing {@code FAIL} is rejected.
 */
public final class SpacingMarkdownFormatter implements MarkdownFormatter {
    private static final Pattern SPACES = Pattern.compile(" {2,}");

    @Override
    public String format(String markdown, FormatterOptions options) throws MarkdownFormatException {
        if (markdown.contains("FAIL")) {
            throw new MarkdownFormatException("Cannot format FAIL");
        }
        var lines = new ArrayList<String>();
        for (var line : markdown.replace("\r\n", "\n").split("\n", -1)) {
            var formatted = SPACES.matcher(line.strip()).replaceAll(" ");
            if (formatted.startsWith("* ") || formatted.startsWith("- ")) {
                formatted = options.unorderedListKind().bullet() + formatted.substring(1);
            }
            lines.add(formatted);
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines.isEmpty() ? "" : String.join("\n", lines) + "\n";
    }
}
