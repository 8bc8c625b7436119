package net.docfmt.markdown.config;

import org.jetbrains.annotations.Nullable;

/**
 * The outcome of validating one configuration entry.
 */
public abstract class Validation {
    private Validation() {
    }

    public static Validation valid(FormatterOption option, Object value) {
        return new Valid(option, value);
    }

    public static Validation invalid(FormatterOption option, @Nullable Object value, String expected, String message) {
        return new Invalid(new ValidationFailure(option.key(), value, expected, message));
    }

    public static Validation ignored(String key) {
        return new Ignored(key);
    }

    public static final class Valid extends Validation {
        private final FormatterOption option;
        private final Object value;

        private Valid(FormatterOption option, Object value) {
            this.option = option;
            this.value = value;
        }

        public FormatterOption option() {
            return option;
        }

        public Object value() {
            return value;
        }

        public FormatterOptions applyTo(FormatterOptions options) {
            return option.applyTo(options, value);
        }
    }

    public static final class Invalid extends Validation {
        private final ValidationFailure failure;

        private Invalid(ValidationFailure failure) {
            this.failure = failure;
        }

        public ValidationFailure failure() {
            return failure;
        }
    }

    /**
     * A key that is not a formatter option. Unknown keys are accepted so that configurations can carry other settings.
     */
    public static final class Ignored extends Validation {
        private final String key;

        private Ignored(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }
    }
}
