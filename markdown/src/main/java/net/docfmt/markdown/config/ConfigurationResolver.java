package net.docfmt.markdown.config;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns raw configuration into the attribute names to format and the options to format them with.
 * Configuration is layered: defaults, then the configuration map, then runtime options.
 */
public final class ConfigurationResolver {
    /**
     * The configuration key selecting which attributes are formatted.
     */
    public static final String ATTRIBUTES_KEY = "format_module_attributes";

    private ConfigurationResolver() {
    }

    public static TargetSet resolveTargets(@Nullable Object raw) {
        return AttributeSelection.classify(raw).resolve();
    }

    public static ValidatedOptions resolveOptions(@Nullable Map<String, ?> configuration, @Nullable Map<String, ?> runtimeOptions) {
        var configured = OptionsValidator.validate(configuration);
        var merged = merge(configured.options(), runtimeOptions);

        var failures = new ArrayList<ValidationFailure>(configured.failures());
        failures.addAll(merged.failures());
        return new ValidatedOptions(merged.options(), failures);
    }

    /**
     * Applies {@code overrides} on top of {@code base}. Rejected overrides keep the base value.
     */
    public static ValidatedOptions merge(FormatterOptions base, @Nullable Map<String, ?> overrides) {
        return OptionsValidator.applyAll(base, overrides);
    }

    public static List<String> defaultDocAttributes() {
        return AttributeSelection.DEFAULT_DOC_ATTRIBUTES;
    }
}
