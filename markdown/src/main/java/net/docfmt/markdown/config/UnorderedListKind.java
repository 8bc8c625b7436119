package net.docfmt.markdown.config;

public enum UnorderedListKind {
    DASHES('-'),
    ASTERISKS('*');

    private final char bullet;

    UnorderedListKind(char bullet) {
        this.bullet = bullet;
    }

    public char bullet() {
        return bullet;
    }
}
