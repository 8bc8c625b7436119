package net.docfmt.markdown;

import net.docfmt.api.SourceTransformer;
import net.docfmt.api.SourceTransformerPlugin;

/**
 * Formats the markdown held in documentation attributes of Elixir sources, and markdown files as a whole.
 */
public class MarkdownPlugin implements SourceTransformerPlugin {
    @Override
    public String getName() {
        return "markdown";
    }

    @Override
    public SourceTransformer createTransformer() {
        return new MarkdownTransformer();
    }
}
