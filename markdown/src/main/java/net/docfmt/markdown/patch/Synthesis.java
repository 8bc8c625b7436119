package net.docfmt.markdown.patch;

import java.util.Objects;

/**
 * Replacement literal text, or the reason why the new content cannot be written in the literal's family.
 */
public abstract class Synthesis {
    private Synthesis() {
    }

    public static Synthesis produced(String text) {
        return new Produced(text);
    }

    public static Synthesis refused(String reason) {
        return new Refused(reason);
    }

    public static final class Produced extends Synthesis {
        private final String text;

        private Produced(String text) {
            this.text = Objects.requireNonNull(text, "text");
        }

        public String text() {
            return text;
        }

        @Override
        public String toString() {
            return "Produced[" + text + "]";
        }
    }

    public static final class Refused extends Synthesis {
        private final String reason;

        private Refused(String reason) {
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        public String reason() {
            return reason;
        }

        @Override
        public String toString() {
            return "Refused[" + reason + "]";
        }
    }
}
