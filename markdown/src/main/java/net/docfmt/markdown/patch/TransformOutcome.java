package net.docfmt.markdown.patch;

import java.util.Objects;

/**
 * What the markdown formatter did with the content of one literal.
 */
public abstract class TransformOutcome {
    private TransformOutcome() {
    }

    public static TransformOutcome unchanged() {
        return Unchanged.INSTANCE;
    }

    public static TransformOutcome changed(String text) {
        return new Changed(text);
    }

    public static TransformOutcome failed(String reason) {
        return new Failed(reason);
    }

    public static final class Unchanged extends TransformOutcome {
        private static final Unchanged INSTANCE = new Unchanged();

        private Unchanged() {
        }

        @Override
        public String toString() {
            return "Unchanged";
        }
    }

    public static final class Changed extends TransformOutcome {
        private final String text;

        private Changed(String text) {
            this.text = Objects.requireNonNull(text, "text");
        }

        public String text() {
            return text;
        }

        @Override
        public String toString() {
            return "Changed[" + text + "]";
        }
    }

    public static final class Failed extends TransformOutcome {
        private final String reason;

        private Failed(String reason) {
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        public String reason() {
            return reason;
        }

        @Override
        public String toString() {
            return "Failed[" + reason + "]";
        }
    }
}
