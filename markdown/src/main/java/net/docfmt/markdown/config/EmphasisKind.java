package net.docfmt.markdown.config;

/**
 * The marker character used for emphasis ({@code *a*} / {@code _a_}) and strong emphasis ({@code **a**} / {@code __a__}).
 */
public enum EmphasisKind {
    ASTERISKS('*'),
    UNDERSCORES('_');

    private final char marker;

    EmphasisKind(char marker) {
        this.marker = marker;
    }

    public char marker() {
        return marker;
    }
}
