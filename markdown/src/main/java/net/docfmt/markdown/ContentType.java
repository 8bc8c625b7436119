package net.docfmt.markdown;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * How a piece of text is treated by {@link DocFormatter}.
 */
public enum ContentType {
    /**
     * The body of a markdown sigil, formatted as a whole without a trailing line break.
     */
    SIGIL,
    /**
     * Elixir source; only documentation attributes are formatted.
     */
    ELIXIR_SOURCE,
    /**
     * Anything else, formatted as a whole markdown document.
     */
    MARKDOWN;

    public static ContentType of(FormatContext context) {
        if (context.sigil()) {
            return SIGIL;
        }
        return ofExtension(context.extension());
    }

    public static ContentType ofExtension(@Nullable String extension) {
        if (extension == null) {
            return MARKDOWN;
        }
        var normalized = extension.startsWith(".") ? extension.substring(1) : extension;
        return switch (normalized.toLowerCase(Locale.ROOT)) {
            case "ex", "exs" -> ELIXIR_SOURCE;
            default -> MARKDOWN;
        };
    }
}
