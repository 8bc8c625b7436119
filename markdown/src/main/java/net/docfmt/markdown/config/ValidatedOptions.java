package net.docfmt.markdown.config;

import java.util.List;

/**
 * Options built from untyped input, together with every entry that had to be rejected on the way.
 */
public record ValidatedOptions(FormatterOptions options, List<ValidationFailure> failures) {
    public ValidatedOptions {
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
