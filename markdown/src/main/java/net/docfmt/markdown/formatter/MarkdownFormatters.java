package net.docfmt.markdown.formatter;

import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

public final class MarkdownFormatters {
    public static final String DEFAULT_NAME = "flexmark";

    private MarkdownFormatters() {
    }

    public static List<MarkdownFormatterProvider> providers() {
        return ServiceLoader.load(MarkdownFormatterProvider.class).stream().map(ServiceLoader.Provider::get).toList();
    }

    /**
     * Creates the formatter registered under {@code name}.
     *
     * @throws IllegalArgumentException if no such formatter is registered
     */
    public static MarkdownFormatter create(String name) {
        var providers = providers();
        for (var provider : providers) {
            if (provider.name().equals(name)) {
                return provider.create();
            }
        }
        var available = providers.stream().map(MarkdownFormatterProvider::name).sorted().collect(Collectors.joining(", "));
        throw new IllegalArgumentException("Unknown markdown formatter '" + name + "'. Available: " + available);
    }
}
