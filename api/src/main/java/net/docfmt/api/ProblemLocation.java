package net.docfmt.api;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

/**
 * @param line   1-based line number, or {@code null} if the problem concerns the whole file
 * @param column 1-based column number, or {@code null} if the problem concerns the whole file
 */
public record ProblemLocation(Path file, @Nullable Integer line, @Nullable Integer column) {
    public static ProblemLocation ofFile(Path file) {
        return new ProblemLocation(file, null, null);
    }

    public static ProblemLocation ofLocationInFile(Path file, int line, int column) {
        return new ProblemLocation(file, line, column);
    }
}
