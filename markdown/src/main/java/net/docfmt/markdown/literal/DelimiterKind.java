package net.docfmt.markdown.literal;

import java.util.Objects;

/**
 * The lexical family of a documentation literal. A replacement is always written in the family of the literal it
 * replaces.
 */
public abstract class DelimiterKind {
    private DelimiterKind() {
    }

    /**
     * Whether {@code #{...}} in the body would be evaluated.
     */
    public abstract boolean isInterpolating();

    /**
     * Strings and heredocs form one family; a sigil only matches a sigil of the same letter.
     */
    public boolean isSameFamily(DelimiterKind other) {
        if (this instanceof Tagged tagged) {
            return other instanceof Tagged that && tagged.tag().equals(that.tag());
        }
        return !(other instanceof Tagged);
    }

    /**
     * {@code "text"}
     */
    public static final class PlainQuote extends DelimiterKind {
        public static final PlainQuote INSTANCE = new PlainQuote();

        private PlainQuote() {
        }

        @Override
        public boolean isInterpolating() {
            return true;
        }

        @Override
        public String toString() {
            return "PlainQuote";
        }
    }

    /**
     * A heredoc delimited by {@code """} or {@code '''}.
     */
    public static final class BlockQuote extends DelimiterKind {
        public static final BlockQuote DOUBLE = new BlockQuote("\"\"\"");
        public static final BlockQuote SINGLE = new BlockQuote("'''");

        private final String marker;

        private BlockQuote(String marker) {
            this.marker = marker;
        }

        public String marker() {
            return marker;
        }

        @Override
        public boolean isInterpolating() {
            return true;
        }

        @Override
        public String toString() {
            return "BlockQuote(" + marker + ")";
        }
    }

    /**
     * A sigil such as {@code ~S(text)} or {@code ~s"""...."""}.
     */
    public abstract static class Tagged extends DelimiterKind {
        private final String tag;
        private final DelimiterPair pair;

        private Tagged(String tag, DelimiterPair pair) {
            this.tag = Objects.requireNonNull(tag, "tag");
            this.pair = Objects.requireNonNull(pair, "pair");
        }

        /**
         * The sigil letter, without the {@code ~}.
         */
        public String tag() {
            return tag;
        }

        public DelimiterPair pair() {
            return pair;
        }

        public String prefix() {
            return "~" + tag;
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || getClass() != o.getClass()) return false;
            Tagged that = (Tagged) o;
            return tag.equals(that.tag) && pair == that.pair;
        }

        @Override
        public int hashCode() {
            return Objects.hash(getClass(), tag, pair);
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "(" + prefix() + pair.opening() + pair.closing() + ")";
        }
    }

    /**
     * An uppercase sigil; escapes and interpolation are left as written.
     */
    public static final class TaggedRaw extends Tagged {
        public TaggedRaw(String tag, DelimiterPair pair) {
            super(tag, pair);
        }

        @Override
        public boolean isInterpolating() {
            return false;
        }
    }

    /**
     * A lowercase sigil.
     */
    public static final class TaggedInterpolated extends Tagged {
        public TaggedInterpolated(String tag, DelimiterPair pair) {
            super(tag, pair);
        }

        @Override
        public boolean isInterpolating() {
            return true;
        }
    }
}
