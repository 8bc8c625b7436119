package net.docfmt.markdown.patch;

import net.docfmt.api.ProblemSeverity;
import net.docfmt.api.Replacements;
import net.docfmt.markdown.FormatDiagnostic;
import net.docfmt.markdown.config.FormatterOptions;
import net.docfmt.markdown.config.TargetSet;
import net.docfmt.markdown.literal.DeclarationWalker;
import net.docfmt.markdown.literal.LiteralNode;
import net.docfmt.syntax.SourceFile;

import java.util.ArrayList;

/**
 * Produces one replacement per documentation literal whose formatted content differs from the original.
 */
public final class AttributePatchCollector {
    private final ContentTransformInvoker invoker;

    public AttributePatchCollector(ContentTransformInvoker invoker) {
        this.invoker = invoker;
    }

    public PatchCollection collect(SourceFile file, TargetSet targets, FormatterOptions options) {
        var text = file.getText();
        var replacements = new Replacements();
        var diagnostics = new ArrayList<FormatDiagnostic>();

        for (var literal : DeclarationWalker.walk(file, targets)) {
            var outcome = invoker.invoke(literal.content(), options);
            if (outcome instanceof TransformOutcome.Failed failed) {
                diagnostics.add(new FormatDiagnostic(FormatDiagnostic.Kind.TRANSFORM_FAILURE, ProblemSeverity.WARNING,
                        "Failed to format @" + literal.ownerName() + ": " + failed.reason(), literal.range().startOffset()));
                continue;
            }
            if (!(outcome instanceof TransformOutcome.Changed changed)) {
                continue;
            }

            var synthesis = ReplacementSynthesizer.synthesize(changed.text(), literal.delimiter());
            if (synthesis instanceof Synthesis.Refused refused) {
                diagnostics.add(new FormatDiagnostic(FormatDiagnostic.Kind.UNREPRESENTABLE_CONTENT, ProblemSeverity.WARNING,
                        "Left @" + literal.ownerName() + " unchanged: " + refused.reason(), literal.range().startOffset()));
                continue;
            }

            var newText = reconcileLineBreak(((Synthesis.Produced) synthesis).text(), literal, text);
            if (newText.equals(literal.range().substring(text).replace("\r\n", "\n"))) {
                continue;
            }
            replacements.replace(literal.range(), newText);
        }

        replacements.sortAndVerify();
        return new PatchCollection(replacements, diagnostics);
    }

    /**
     * Makes the replacement end with a line break exactly when the replaced range does.
     */
    static String reconcileLineBreak(String replacement, LiteralNode literal, String text) {
        boolean rangeHasBreak = DeclarationWalker.consumesLineBreak(text, literal.range());
        boolean replacementHasBreak = replacement.endsWith("\n");
        if (rangeHasBreak && !replacementHasBreak) {
            return replacement + "\n";
        }
        if (!rangeHasBreak && replacementHasBreak) {
            return replacement.substring(0, replacement.length() - 1);
        }
        return replacement;
    }
}
