package net.docfmt.markdown.config;

import org.jetbrains.annotations.Nullable;

/**
 * A rejected configuration value.
 *
 * @param field    the configuration key
 * @param value    the rejected value
 * @param expected a description of the accepted values
 * @param message  a short summary of the problem
 */
public record ValidationFailure(String field, @Nullable Object value, String expected, String message) {
    public String describe() {
        return message + " (" + field + "): expected " + expected + ", got: " + inspect(value);
    }

    private static String inspect(@Nullable Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence) {
            return "\"" + value + "\"";
        }
        return value.toString();
    }
}
