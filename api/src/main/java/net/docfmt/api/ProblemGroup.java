package net.docfmt.api;

import java.util.Objects;

/**
 * Groups related {@link ProblemId problem ids}, typically one group per transformer.
 */
public record ProblemGroup(String id, String displayName) {
    public ProblemGroup {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(displayName, "displayName");
    }

    public static ProblemGroup create(String id, String displayName) {
        return new ProblemGroup(id, displayName);
    }

    @Override
    public String toString() {
        return id;
    }
}
