package net.docfmt.markdown.formatter.flexmark;

import net.docfmt.markdown.formatter.MarkdownFormatter;
import net.docfmt.markdown.formatter.MarkdownFormatterProvider;
import net.docfmt.markdown.formatter.MarkdownFormatters;

public class FlexmarkMarkdownFormatterProvider implements MarkdownFormatterProvider {
    @Override
    public String name() {
        return MarkdownFormatters.DEFAULT_NAME;
    }

    @Override
    public MarkdownFormatter create() {
        return new FlexmarkMarkdownFormatter();
    }
}
