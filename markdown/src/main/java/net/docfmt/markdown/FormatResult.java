package net.docfmt.markdown;

import net.docfmt.api.ProblemSeverity;

import java.util.List;

/**
 * @param text        the formatted text, or the input text where formatting was not possible
 * @param diagnostics the problems found, in the order they were found
 */
public record FormatResult(String text, List<FormatDiagnostic> diagnostics) {
    public FormatResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == ProblemSeverity.ERROR);
    }
}
