package net.docfmt.markdown.config;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * The accepted shapes of the {@code format_module_attributes} setting.
 */
public abstract class AttributeSelection {
    public static final List<String> DEFAULT_DOC_ATTRIBUTES = List.of("moduledoc", "doc", "typedoc", "shortdoc", "deprecated");

    private AttributeSelection() {
    }

    public abstract TargetSet resolve();

    /**
     * Determines the shape of a raw setting. Never throws; anything unexpected becomes {@link Unrecognized}.
     */
    public static AttributeSelection classify(@Nullable Object raw) {
        if (raw == null) {
            return Absent.INSTANCE;
        }
        if (raw instanceof Boolean enabled) {
            return new Toggle(enabled);
        }
        if (raw instanceof String[] array) {
            return classifyNames(raw, Arrays.asList(array));
        }
        if (raw instanceof Collection<?> items) {
            return classifyNames(raw, items);
        }
        if (raw instanceof Map<?, ?> map) {
            var enabled = new ArrayList<String>();
            for (var entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String name) || !(entry.getValue() instanceof Boolean on)) {
                    return new Unrecognized(raw);
                }
                if (on) {
                    enabled.add(stripColon(name));
                }
            }
            return new LegacyMap(enabled);
        }
        return new Unrecognized(raw);
    }

    private static AttributeSelection classifyNames(Object raw, Collection<?> items) {
        var names = new ArrayList<String>(items.size());
        for (var item : items) {
            if (!(item instanceof String name)) {
                return new Unrecognized(raw);
            }
            names.add(stripColon(name));
        }
        return new Names(names);
    }

    private static String stripColon(String name) {
        return name.startsWith(":") ? name.substring(1) : name;
    }

    public static final class Absent extends AttributeSelection {
        public static final Absent INSTANCE = new Absent();

        private Absent() {
        }

        @Override
        public TargetSet resolve() {
            return TargetSet.EMPTY;
        }
    }

    /**
     * {@code true} selects the default documentation attributes, {@code false} selects nothing.
     */
    public static final class Toggle extends AttributeSelection {
        private final boolean enabled;

        private Toggle(boolean enabled) {
            this.enabled = enabled;
        }

        @Override
        public TargetSet resolve() {
            return enabled ? TargetSet.of(DEFAULT_DOC_ATTRIBUTES) : TargetSet.EMPTY;
        }
    }

    public static final class Names extends AttributeSelection {
        private final List<String> names;

        private Names(List<String> names) {
            this.names = List.copyOf(names);
        }

        @Override
        public TargetSet resolve() {
            return TargetSet.of(names);
        }
    }

    /**
     * An older map form, {@code {"doc": true, "moduledoc": false}}. Only enabled names are selected.
     */
    public static final class LegacyMap extends AttributeSelection {
        private final List<String> enabledNames;

        private LegacyMap(List<String> enabledNames) {
            this.enabledNames = List.copyOf(enabledNames);
        }

        @Override
        public TargetSet resolve() {
            return TargetSet.of(enabledNames);
        }
    }

    public static final class Unrecognized extends AttributeSelection {
        private final Object value;

        private Unrecognized(Object value) {
            this.value = value;
        }

        public Object value() {
            return value;
        }

        @Override
        public TargetSet resolve() {
            return TargetSet.EMPTY;
        }
    }
}
