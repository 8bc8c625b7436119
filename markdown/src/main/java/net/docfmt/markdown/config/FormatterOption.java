package net.docfmt.markdown.config;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The configuration keys that map onto {@link FormatterOptions}.
 */
public enum FormatterOption {
    LINE_WIDTH("line_width") {
        @Override
        public Validation validate(@Nullable Object value) {
            if (!(value instanceof Number number) || !isIntegral(number)) {
                return Validation.invalid(this, value, "positive integer", "Line width must be an integer");
            }
            long width = number.longValue();
            if (width < FormatterOptions.MIN_LINE_WIDTH || width > FormatterOptions.MAX_LINE_WIDTH) {
                return Validation.invalid(this, value, "integer between 1 and 1000", "Line width must be between 1 and 1000");
            }
            return Validation.valid(this, (int) width);
        }

        @Override
        FormatterOptions applyTo(FormatterOptions options, Object value) {
            return options.withLineWidth((Integer) value);
        }
    },
    TEXT_WRAP("text_wrap") {
        @Override
        public Validation validate(@Nullable Object value) {
            return validateChoice(this, value, TextWrap.class);
        }

        @Override
        FormatterOptions applyTo(FormatterOptions options, Object value) {
            return options.withTextWrap((TextWrap) value);
        }
    },
    EMPHASIS_KIND("emphasis_kind") {
        @Override
        public Validation validate(@Nullable Object value) {
            return validateChoice(this, value, EmphasisKind.class);
        }

        @Override
        FormatterOptions applyTo(FormatterOptions options, Object value) {
            return options.withEmphasisKind((EmphasisKind) value);
        }
    },
    STRONG_KIND("strong_kind") {
        @Override
        public Validation validate(@Nullable Object value) {
            return validateChoice(this, value, EmphasisKind.class);
        }

        @Override
        FormatterOptions applyTo(FormatterOptions options, Object value) {
            return options.withStrongKind((EmphasisKind) value);
        }
    },
    NEW_LINE_KIND("new_line_kind") {
        @Override
        public Validation validate(@Nullable Object value) {
            return validateChoice(this, value, NewLineKind.class);
        }

        @Override
        FormatterOptions applyTo(FormatterOptions options, Object value) {
            return options.withNewLineKind((NewLineKind) value);
        }
    },
    UNORDERED_LIST_KIND("unordered_list_kind") {
        @Override
        public Validation validate(@Nullable Object value) {
            return validateChoice(this, value, UnorderedListKind.class);
        }

        @Override
        FormatterOptions applyTo(FormatterOptions options, Object value) {
            return options.withUnorderedListKind((UnorderedListKind) value);
        }
    };

    private final String key;

    FormatterOption(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public abstract Validation validate(@Nullable Object value);

    abstract FormatterOptions applyTo(FormatterOptions options, Object value);

    /**
     * Looks up an option by its configuration key. A leading {@code :} is ignored, so {@code ":line_width"} works too.
     */
    public static @Nullable FormatterOption byKey(String key) {
        var normalized = key.startsWith(":") ? key.substring(1) : key;
        for (var option : values()) {
            if (option.key.equals(normalized)) {
                return option;
            }
        }
        return null;
    }

    private static boolean isIntegral(Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof Short || number instanceof Byte) {
            return true;
        }
        // JSON numbers arrive as doubles
        double value = number.doubleValue();
        return !Double.isInfinite(value) && value == Math.rint(value);
    }

    private static <E extends Enum<E>> Validation validateChoice(FormatterOption option, @Nullable Object value, Class<E> type) {
        if (type.isInstance(value)) {
            return Validation.valid(option, value);
        }
        var constants = type.getEnumConstants();
        var expected = Arrays.stream(constants)
                .map(constant -> ":" + constant.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(", "));
        var fieldName = option.key.replace('_', ' ');
        if (!(value instanceof String text)) {
            var capitalized = Character.toUpperCase(fieldName.charAt(0)) + fieldName.substring(1);
            return Validation.invalid(option, value, expected, capitalized + " must be a name");
        }
        var spelling = text.startsWith(":") ? text.substring(1) : text;
        for (var constant : constants) {
            if (constant.name().equalsIgnoreCase(spelling)) {
                return Validation.valid(option, constant);
            }
        }
        return Validation.invalid(option, value, expected, "Invalid " + fieldName);
    }
}
