package net.docfmt.markdown.patch;

import net.docfmt.markdown.SpacingMarkdownFormatter;
import net.docfmt.markdown.config.FormatterOptions;
import net.docfmt.markdown.formatter.MarkdownFormatException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ContentTransformInvokerTest {
    private final ContentTransformInvoker invoker = new ContentTransformInvoker(new SpacingMarkdownFormatter());

    @Test
    void testChangedContent() {
        var outcome = invoker.invoke("This is   messy", FormatterOptions.DEFAULT);
        assertThat(outcome).isInstanceOfSatisfying(TransformOutcome.Changed.class,
                changed -> assertEquals("This is messy", changed.text()));
    }

    @Test
    void testTrailingLineBreaksAreIgnored() {
        assertThat(invoker.invoke("Already clean", FormatterOptions.DEFAULT)).isSameAs(TransformOutcome.unchanged());
    }

    @Test
    void testEmptyContentIsNotFormatted() {
        var calls = new int[1];
        var counting = new ContentTransformInvoker((text, options) -> {
            calls[0]++;
            return text;
        });
        assertThat(counting.invoke("", FormatterOptions.DEFAULT)).isSameAs(TransformOutcome.unchanged());
        assertEquals(0, calls[0]);
    }

    @Test
    void testFormatterFailure() {
        assertThat(invoker.invoke("FAIL here", FormatterOptions.DEFAULT)).isInstanceOfSatisfying(TransformOutcome.Failed.class,
                failed -> assertEquals("Cannot format FAIL", failed.reason()));
    }

    @Test
    void testFormatterCrash() {
        var crashing = new ContentTransformInvoker((text, options) -> {
            throw new IllegalStateException("broken");
        });
        assertThat(crashing.invoke("Text", FormatterOptions.DEFAULT)).isInstanceOfSatisfying(TransformOutcome.Failed.class,
                failed -> assertThat(failed.reason()).contains("broken"));
    }

    @Test
    void testFormatterWithoutMessage() {
        var failing = new ContentTransformInvoker((text, options) -> {
            throw new MarkdownFormatException(null);
        });
        assertThat(failing.invoke("Text", FormatterOptions.DEFAULT)).isInstanceOf(TransformOutcome.Failed.class);
    }

    @Test
    void testStripTrailingLineBreaks() {
        assertEquals("a\n\nb", ContentTransformInvoker.stripTrailingLineBreaks("a\n\nb\r\n\n"));
        assertEquals("", ContentTransformInvoker.stripTrailingLineBreaks("\n"));
    }
}
