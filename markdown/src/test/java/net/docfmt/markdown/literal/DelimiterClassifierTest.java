package net.docfmt.markdown.literal;

import net.docfmt.syntax.AttributeDeclaration;
import net.docfmt.syntax.ElixirParser;
import net.docfmt.syntax.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class DelimiterClassifierTest {
    private static Optional<DelimiterKind> classify(String valueText) throws Exception {
        var file = ElixirParser.parse("@doc " + valueText + "\n");
        var declaration = (AttributeDeclaration) file.getChildren().get(0);
        SyntaxNode value = declaration.getBoundValue();
        assertThat(value).isNotNull();
        return DelimiterClassifier.classify(value);
    }

    @Test
    void testStrings() throws Exception {
        assertEquals(Optional.of(DelimiterKind.PlainQuote.INSTANCE), classify("\"text\""));
        assertEquals(Optional.of(DelimiterKind.BlockQuote.DOUBLE), classify("\"\"\"\ntext\n\"\"\""));
    }

    @Test
    void testSingleQuotedHeredocIsFormattedButCharlistIsNot() throws Exception {
        assertEquals(Optional.of(DelimiterKind.BlockQuote.SINGLE), classify("'''\ntext\n'''"));
        assertEquals(Optional.empty(), classify("'text'"));
    }

    @Test
    void testFamilies() {
        var parens = new DelimiterKind.TaggedRaw("S", DelimiterPair.PARENS);
        assertThat(DelimiterKind.PlainQuote.INSTANCE.isSameFamily(DelimiterKind.BlockQuote.DOUBLE)).isTrue();
        assertThat(DelimiterKind.BlockQuote.SINGLE.isSameFamily(DelimiterKind.PlainQuote.INSTANCE)).isTrue();
        assertThat(parens.isSameFamily(new DelimiterKind.TaggedRaw("S", DelimiterPair.TRIPLE_DOUBLE_QUOTE))).isTrue();
        assertThat(parens.isSameFamily(new DelimiterKind.TaggedInterpolated("s", DelimiterPair.PARENS))).isFalse();
        assertThat(parens.isSameFamily(DelimiterKind.PlainQuote.INSTANCE)).isFalse();
        assertThat(DelimiterKind.PlainQuote.INSTANCE.isSameFamily(parens)).isFalse();
    }

    @Test
    void testSigilDelimiters() throws Exception {
        assertEquals(Optional.of(new DelimiterKind.TaggedRaw("S", DelimiterPair.SLASH)), classify("~S/text/"));
        assertEquals(Optional.of(new DelimiterKind.TaggedRaw("S", DelimiterPair.PIPE)), classify("~S|text|"));
        assertEquals(Optional.of(new DelimiterKind.TaggedRaw("S", DelimiterPair.SINGLE_QUOTE)), classify("~S'text'"));
        assertEquals(Optional.of(new DelimiterKind.TaggedRaw("S", DelimiterPair.ANGLES)), classify("~S<text>"));
        assertEquals(Optional.of(new DelimiterKind.TaggedInterpolated("s", DelimiterPair.BRACES)), classify("~s{text}"));
        assertEquals(Optional.of(new DelimiterKind.TaggedInterpolated("s", DelimiterPair.DOUBLE_QUOTE)), classify("~s\"text\""));
    }

    @Test
    void testNonStringValues() throws Exception {
        assertEquals(Optional.empty(), classify("~r/regex/"));
        assertEquals(Optional.empty(), classify("~S(text)a"));
        assertEquals(Optional.empty(), classify("false"));
        assertEquals(Optional.empty(), classify(":atom"));
    }

    @Test
    void testInterpolation() {
        assertThat(DelimiterKind.PlainQuote.INSTANCE.isInterpolating()).isTrue();
        assertThat(new DelimiterKind.TaggedRaw("S", DelimiterPair.PARENS).isInterpolating()).isFalse();
        assertThat(new DelimiterKind.TaggedInterpolated("s", DelimiterPair.PARENS).isInterpolating()).isTrue();
    }
}
