package net.docfmt.markdown.formatter.flexmark;

import com.vladsch.flexmark.ast.Emphasis;
import com.vladsch.flexmark.ast.StrongEmphasis;
import com.vladsch.flexmark.ext.gfm.strikethrough.StrikethroughExtension;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.formatter.Formatter;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Document;
import com.vladsch.flexmark.util.data.MutableDataSet;
import com.vladsch.flexmark.util.format.options.ListBulletMarker;
import com.vladsch.flexmark.util.sequence.BasedSequence;
import net.docfmt.markdown.config.EmphasisKind;
import net.docfmt.markdown.config.FormatterOptions;
import net.docfmt.markdown.config.NewLineKind;
import net.docfmt.markdown.formatter.MarkdownFormatException;
import net.docfmt.markdown.formatter.MarkdownFormatter;

import java.util.List;

/**
 * Formats markdown with the flexmark-java {@link Formatter}.
 * <p>
 * Line width and wrap mode map onto the right margin, the list style onto the bullet marker. Emphasis markers
 * are rewritten on the parsed document since the formatter writes them back as they were parsed.
 */
public final class FlexmarkMarkdownFormatter implements MarkdownFormatter {
    /**
     * Wide enough that no paragraph is ever wrapped, which joins its lines.
     */
    static final int UNWRAPPED_MARGIN = 1_000_000;

    @Override
    public String format(String markdown, FormatterOptions options) throws MarkdownFormatException {
        if (markdown.isBlank()) {
            return "";
        }

        var dataSet = createDataSet(options);
        String output;
        try {
            var document = Parser.builder(dataSet).build().parse(markdown);
            rewriteEmphasis(document, options);
            output = Formatter.builder(dataSet).build().render(document);
        } catch (RuntimeException e) {
            throw new MarkdownFormatException("flexmark failed to format markdown: " + e, e);
        }
        return withLineEndings(withSingleTrailingLineBreak(output), options.newLineKind(), markdown.contains("\r\n"));
    }

    static MutableDataSet createDataSet(FormatterOptions options) {
        var dataSet = new MutableDataSet();
        dataSet.set(Parser.EXTENSIONS, List.of(TablesExtension.create(), StrikethroughExtension.create()));
        dataSet.set(Formatter.RIGHT_MARGIN, rightMargin(options));
        dataSet.set(Formatter.LIST_BULLET_MARKER, switch (options.unorderedListKind()) {
            case DASHES -> ListBulletMarker.DASH;
            case ASTERISKS -> ListBulletMarker.ASTERISK;
        });
        return dataSet;
    }

    static int rightMargin(FormatterOptions options) {
        return switch (options.textWrap()) {
            case ALWAYS -> options.lineWidth();
            case NEVER -> UNWRAPPED_MARGIN;
            // 0 disables wrapping and keeps the existing line breaks
            case MAINTAIN -> 0;
        };
    }

    private static void rewriteEmphasis(Document document, FormatterOptions options) {
        var emphasis = marker(options.emphasisKind(), 1);
        var strong = marker(options.strongKind(), 2);
        for (var node : document.getDescendants()) {
            if (node instanceof Emphasis e) {
                e.setOpeningMarker(emphasis);
                e.setClosingMarker(emphasis);
            } else if (node instanceof StrongEmphasis e) {
                e.setOpeningMarker(strong);
                e.setClosingMarker(strong);
            }
        }
    }

    private static BasedSequence marker(EmphasisKind kind, int count) {
        return BasedSequence.of(String.valueOf(kind.marker()).repeat(count));
    }

    static String withSingleTrailingLineBreak(String text) {
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return end == 0 ? "" : text.substring(0, end) + "\n";
    }

    static String withLineEndings(String text, NewLineKind kind, boolean inputUsesCrLf) {
        var lf = text.replace("\r\n", "\n");
        boolean crlf = switch (kind) {
            case AUTO -> inputUsesCrLf;
            case LF -> false;
            case CRLF -> true;
        };
        return crlf ? lf.replace("\n", "\r\n") : lf;
    }
}
