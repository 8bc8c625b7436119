package net.docfmt.syntax;

import java.io.IOException;

/**
 * Thrown when a source text is not structurally valid Elixir.
 */
public class SourceParseException extends IOException {
    public final int line;
    public final int column;

    public SourceParseException(String message, int line, int column) {
        super(line + ":" + column + ": " + message);
        this.line = line;
        this.column = column;
    }
}
