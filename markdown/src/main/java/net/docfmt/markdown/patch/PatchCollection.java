package net.docfmt.markdown.patch;

import net.docfmt.api.Replacements;
import net.docfmt.markdown.FormatDiagnostic;

import java.util.List;

/**
 * @param replacements sorted, non-overlapping replacements
 * @param diagnostics  problems with individual literals, which were left unpatched
 */
public record PatchCollection(Replacements replacements, List<FormatDiagnostic> diagnostics) {
    public PatchCollection {
        diagnostics = List.copyOf(diagnostics);
    }
}
