package net.docfmt.markdown.config;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Map;

/**
 * Validates untyped option maps such as a parsed JSON configuration file.
 * <p>
 * Each value is checked on its own. A rejected value never replaces the value it would have overridden, and
 * keys that are not formatter options are ignored.
 */
public final class OptionsValidator {
    private OptionsValidator() {
    }

    public static ValidatedOptions validate(@Nullable Map<String, ?> input) {
        return applyAll(FormatterOptions.DEFAULT, input);
    }

    public static ValidatedOptions applyAll(FormatterOptions base, @Nullable Map<String, ?> overrides) {
        var options = base;
        var failures = new ArrayList<ValidationFailure>();
        if (overrides != null) {
            for (var entry : overrides.entrySet()) {
                var validation = validateOption(entry.getKey(), entry.getValue());
                if (validation instanceof Validation.Valid valid) {
                    options = valid.applyTo(options);
                } else if (validation instanceof Validation.Invalid invalid) {
                    failures.add(invalid.failure());
                }
            }
        }
        return new ValidatedOptions(options, failures);
    }

    public static Validation validateOption(String key, @Nullable Object value) {
        var option = FormatterOption.byKey(key);
        if (option == null) {
            return Validation.ignored(key);
        }
        return option.validate(value);
    }
}
