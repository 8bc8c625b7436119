package net.docfmt.markdown.config;

public enum NewLineKind {
    /** Use the line separator found in the input, {@code \n} if there is none. */
    AUTO,
    LF,
    CRLF
}
