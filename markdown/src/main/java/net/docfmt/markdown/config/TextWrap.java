package net.docfmt.markdown.config;

public enum TextWrap {
    /** Wrap paragraphs at the line width. */
    ALWAYS,
    /** Join each paragraph onto a single line. */
    NEVER,
    /** Keep the existing line breaks. */
    MAINTAIN
}
