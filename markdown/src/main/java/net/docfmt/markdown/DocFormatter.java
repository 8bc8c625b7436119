package net.docfmt.markdown;

import net.docfmt.api.ProblemSeverity;
import net.docfmt.markdown.config.AttributeSelection;
import net.docfmt.markdown.config.ConfigurationResolver;
import net.docfmt.markdown.config.FormatterOptions;
import net.docfmt.markdown.formatter.MarkdownFormatException;
import net.docfmt.markdown.formatter.MarkdownFormatter;
import net.docfmt.markdown.patch.AttributePatchCollector;
import net.docfmt.markdown.patch.ContentTransformInvoker;
import net.docfmt.markdown.patch.PatchApplier;
import net.docfmt.syntax.ElixirParser;
import net.docfmt.syntax.SourceFile;
import net.docfmt.syntax.SourceParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Formats markdown, either a whole document or the documentation attributes of an Elixir source file.
 * <p>
 * Formatting never fails: whatever cannot be formatted is returned as it was, and the reason is reported as a
 * {@link FormatDiagnostic}. Instances hold no state besides the markdown formatter and can be shared.
 */
public final class DocFormatter {
    private final MarkdownFormatter markdownFormatter;

    public DocFormatter(MarkdownFormatter markdownFormatter) {
        this.markdownFormatter = markdownFormatter;
    }

    public String format(String text, FormatContext context) {
        return formatWithDiagnostics(text, context).text();
    }

    public FormatResult formatWithDiagnostics(String text, FormatContext context) {
        var diagnostics = new ArrayList<FormatDiagnostic>();
        var validated = ConfigurationResolver.resolveOptions(context.configuration(), context.runtimeOptions());
        for (var failure : validated.failures()) {
            diagnostics.add(new FormatDiagnostic(FormatDiagnostic.Kind.INVALID_OPTION, ProblemSeverity.WARNING, failure.describe()));
        }
        var options = validated.options();

        var formatted = switch (context.contentType()) {
            case SIGIL -> stripTrailingLineBreak(formatDocument(text, options, diagnostics));
            case MARKDOWN -> formatDocument(text, options, diagnostics);
            case ELIXIR_SOURCE -> formatSource(text, context, options, diagnostics);
        };
        return new FormatResult(formatted, diagnostics);
    }

    private String formatDocument(String text, FormatterOptions options, List<FormatDiagnostic> diagnostics) {
        try {
            return markdownFormatter.format(text, options);
        } catch (MarkdownFormatException | RuntimeException e) {
            diagnostics.add(new FormatDiagnostic(FormatDiagnostic.Kind.TRANSFORM_FAILURE, ProblemSeverity.ERROR,
                    "Failed to format markdown: " + e.getMessage()));
            return text;
        }
    }

    private String formatSource(String text, FormatContext context, FormatterOptions options, List<FormatDiagnostic> diagnostics) {
        var selection = AttributeSelection.classify(context.configuration().get(ConfigurationResolver.ATTRIBUTES_KEY));
        if (selection instanceof AttributeSelection.Unrecognized unrecognized) {
            diagnostics.add(new FormatDiagnostic(FormatDiagnostic.Kind.INVALID_OPTION, ProblemSeverity.WARNING,
                    "Ignoring " + ConfigurationResolver.ATTRIBUTES_KEY + ": expected a boolean, a list of attribute names or a map of names to booleans, got: " + unrecognized.value()));
        }
        var targets = selection.resolve();
        if (targets.isEmpty()) {
            return text;
        }

        SourceFile file;
        try {
            file = ElixirParser.parse(text);
        } catch (SourceParseException e) {
            diagnostics.add(new FormatDiagnostic(FormatDiagnostic.Kind.PARSE_FAILURE, ProblemSeverity.ERROR,
                    e.getMessage(), offsetOf(text, e.line, e.column)));
            return text;
        }

        var collector = new AttributePatchCollector(new ContentTransformInvoker(markdownFormatter));
        var collection = collector.collect(file, targets, options);
        diagnostics.addAll(collection.diagnostics());

        var result = PatchApplier.apply(text, collection.replacements());
        if (result.isFailed()) {
            diagnostics.add(new FormatDiagnostic(FormatDiagnostic.Kind.PATCH_FAILURE, ProblemSeverity.ERROR, result.failure()));
        }
        return result.text();
    }

    public static List<String> defaultDocAttributes() {
        return ConfigurationResolver.defaultDocAttributes();
    }

    private static String stripTrailingLineBreak(String text) {
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(0, end);
    }

    /**
     * Converts a 1-based line and column into a character offset, clamped to the text.
     */
    static int offsetOf(String text, int line, int column) {
        int offset = 0;
        for (int i = 1; i < line; i++) {
            int lineBreak = text.indexOf('\n', offset);
            if (lineBreak < 0) {
                return text.length();
            }
            offset = lineBreak + 1;
        }
        return Math.min(text.length(), offset + Math.max(0, column - 1));
    }
}
