package net.docfmt.markdown.config;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * The attribute names whose values get formatted, in configuration order and without duplicates.
 */
public record TargetSet(List<String> names) {
    public static final TargetSet EMPTY = new TargetSet(List.of());

    public TargetSet {
        names = List.copyOf(new LinkedHashSet<>(names));
    }

    public static TargetSet of(String... names) {
        return new TargetSet(List.of(names));
    }

    public static TargetSet of(Collection<String> names) {
        return new TargetSet(List.copyOf(names));
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }
}
