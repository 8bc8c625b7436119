package net.docfmt.markdown;

import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Describes what is being formatted and how.
 *
 * @param configuration  the raw configuration: formatter options keyed by their names and the attribute selection
 *                       under {@code format_module_attributes}
 * @param runtimeOptions option overrides that take precedence over {@code configuration}
 * @param extension      the extension of the file being formatted, if known
 * @param sigil          whether the text is the body of a markdown sigil rather than a whole file
 */
public record FormatContext(Map<String, ?> configuration,
                            Map<String, ?> runtimeOptions,
                            @Nullable String extension,
                            boolean sigil) {
    public FormatContext {
        configuration = configuration == null ? Map.of() : configuration;
        runtimeOptions = runtimeOptions == null ? Map.of() : runtimeOptions;
    }

    public static FormatContext forExtension(Map<String, ?> configuration, @Nullable String extension) {
        return new FormatContext(configuration, Map.of(), extension, false);
    }

    public static FormatContext forSigil(Map<String, ?> configuration) {
        return new FormatContext(configuration, Map.of(), null, true);
    }

    public FormatContext withRuntimeOptions(Map<String, ?> runtimeOptions) {
        return new FormatContext(configuration, runtimeOptions, extension, sigil);
    }

    public ContentType contentType() {
        return ContentType.of(this);
    }
}
