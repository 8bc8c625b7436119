package net.docfmt.markdown;

import net.docfmt.api.ProblemSeverity;

/**
 * A problem found while formatting. Diagnostics never stop formatting; the affected option, literal or file is
 * left as it was.
 *
 * @param offset the character offset the problem refers to, or {@link #NO_OFFSET}
 */
public record FormatDiagnostic(Kind kind, ProblemSeverity severity, String message, int offset) {
    public static final int NO_OFFSET = -1;

    public FormatDiagnostic(Kind kind, ProblemSeverity severity, String message) {
        this(kind, severity, message, NO_OFFSET);
    }

    public boolean hasOffset() {
        return offset != NO_OFFSET;
    }

    public enum Kind {
        INVALID_OPTION("invalid-option", "Invalid Option"),
        PARSE_FAILURE("parse-failure", "Parse Failure"),
        TRANSFORM_FAILURE("transform-failure", "Transform Failure"),
        UNREPRESENTABLE_CONTENT("unrepresentable-content", "Unrepresentable Content"),
        PATCH_FAILURE("patch-failure", "Patch Failure");

        private final String id;
        private final String displayName;

        Kind(String id, String displayName) {
            this.id = id;
            this.displayName = displayName;
        }

        public String id() {
            return id;
        }

        public String displayName() {
            return displayName;
        }
    }
}
