package net.docfmt.syntax;

/**
 * A half-open range of character offsets into a source text.
 */
public record TextRange(int startOffset, int endOffset) {
    public TextRange {
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("Invalid range [" + startOffset + ", " + endOffset + ")");
        }
    }

    public static TextRange from(int startOffset, int length) {
        return new TextRange(startOffset, startOffset + length);
    }

    public int length() {
        return endOffset - startOffset;
    }

    public boolean isEmpty() {
        return startOffset == endOffset;
    }

    public boolean contains(int offset) {
        return offset >= startOffset && offset < endOffset;
    }

    public boolean contains(TextRange range) {
        return range.startOffset >= startOffset && range.endOffset <= endOffset;
    }

    public TextRange withEndOffset(int endOffset) {
        return new TextRange(startOffset, endOffset);
    }

    public String substring(CharSequence text) {
        return text.subSequence(startOffset, endOffset).toString();
    }

    @Override
    public String toString() {
        return "(" + startOffset + "," + endOffset + ")";
    }
}
