package net.docfmt.markdown.literal;

import net.docfmt.markdown.config.TargetSet;
import net.docfmt.syntax.ElixirParser;
import net.docfmt.syntax.SourceParseException;
import net.docfmt.syntax.TextRange;
import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class DeclarationWalkerTest {
    private static final TargetSet DOCS = TargetSet.of("moduledoc", "doc");

    private static List<LiteralNode> walk(@Language("elixir") String text) throws SourceParseException {
        return DeclarationWalker.walk(ElixirParser.parse(text), DOCS);
    }

    private static LiteralNode single(String text) throws SourceParseException {
        var found = walk(text);
        assertThat(found).hasSize(1);
        return found.get(0);
    }

    @Test
    void testFindsTargetsInSourceOrder() throws Exception {
        var found = walk("""
                defmodule Foo do
                  @moduledoc "Module"
                  @typedoc "Type"
                  @doc "First"
                  def a, do: 1

                  defmodule Inner do
                    @doc "Nested"
                    def b, do: 2
                  end
                end
                """);

        assertThat(found).extracting(LiteralNode::ownerName).containsExactly("moduledoc", "doc", "doc");
        assertThat(found).extracting(LiteralNode::content).containsExactly("Module", "First", "Nested");
    }

    @Test
    void testNothingIsFoundWithoutTargets() throws Exception {
        var file = ElixirParser.parse("@doc \"text\"\n");
        assertThat(DeclarationWalker.walk(file, TargetSet.EMPTY)).isEmpty();
    }

    @Nested
    class NonLiteralValues {
        @Test
        void testBooleanAndNilValuesAreSkipped() throws Exception {
            assertThat(walk("""
                    @moduledoc false
                    @doc nil
                    @doc true
                    """)).isEmpty();
        }

        @Test
        void testListsAndCompoundExpressionsAreSkipped() throws Exception {
            assertThat(walk("""
                    @doc ["a", "b"]
                    @doc "a" <> "b"
                    @doc since: "1.0"
                    """)).isEmpty();
        }

        @Test
        void testInterpolatedStringsAreSkipped() throws Exception {
            assertThat(walk("@doc \"Version #{@version}\"\n")).isEmpty();
        }

        @Test
        void testRawSigilKeepsInterpolationText() throws Exception {
            var literal = single("@doc ~S(Version #{@version})\n");
            assertEquals("Version #{@version}", literal.content());
            assertThat(literal.delimiter()).isInstanceOf(DelimiterKind.TaggedRaw.class);
        }

        @Test
        void testCharlistsAndOtherSigilsAreSkipped() throws Exception {
            assertThat(walk("""
                    @doc 'charlist'
                    @doc ~w(a b c)
                    @doc ~S"modified"i
                    """)).isEmpty();
        }
    }

    @Nested
    class Content {
        @Test
        void testPlainStringKeepsEscapes() throws Exception {
            var literal = single("@doc \"Say \\\"hi\\\"\\n\"\n");
            assertEquals("Say \\\"hi\\\"\\n", literal.content());
            assertEquals(DelimiterKind.PlainQuote.INSTANCE, literal.delimiter());
            assertEquals(new TextRange(5, 19), literal.range());
        }

        @Test
        void testHeredocIsDedented() throws Exception {
            var text = """
                    defmodule Foo do
                      @moduledoc \"""
                      Title

                        Indented code
                      \"""
                    end
                    """;
            var literal = single(text);
            assertEquals("Title\n\n  Indented code", literal.content());
            assertEquals(DelimiterKind.BlockQuote.DOUBLE, literal.delimiter());
            assertThat(literal.range().substring(text)).startsWith("\"\"\"").endsWith("\"\"\"");
        }

        @Test
        void testSingleQuoteHeredoc() throws Exception {
            var literal = single("@doc '''\nText\n'''\n");
            assertEquals("Text", literal.content());
            assertEquals(DelimiterKind.BlockQuote.SINGLE, literal.delimiter());
        }

        @Test
        void testParenthesizedValue() throws Exception {
            var literal = single("@doc(\"Text\")\n");
            assertEquals("Text", literal.content());
        }

        @Test
        void testMultiLineSigilRangeIncludesLineBreak() throws Exception {
            var text = "  @doc ~S(\n  Text\n  )\n  def a, do: 1\n";
            var literal = single(text);
            assertEquals("Text", literal.content());
            assertEquals("~S(\n  Text\n  )\n", literal.range().substring(text));
            assertThat(DeclarationWalker.consumesLineBreak(text, literal.range())).isTrue();
        }

        @Test
        void testSingleLineSigilRangeIsTheLiteral() throws Exception {
            var text = "@doc ~s[Text]\n";
            var literal = single(text);
            assertEquals("~s[Text]", literal.range().substring(text));
            assertThat(literal.delimiter()).isEqualTo(new DelimiterKind.TaggedInterpolated("s", DelimiterPair.BRACKETS));
            assertThat(DeclarationWalker.consumesLineBreak(text, literal.range())).isFalse();
        }

        @Test
        void testHeredocSigil() throws Exception {
            var text = "  @moduledoc ~S\"\"\"\n  Text\n  \"\"\"\n";
            var literal = single(text);
            assertEquals("Text", literal.content());
            assertThat(literal.delimiter()).isEqualTo(new DelimiterKind.TaggedRaw("S", DelimiterPair.TRIPLE_DOUBLE_QUOTE));
        }

        @Test
        void testCrLfLinesAreJoinedWithLf() throws Exception {
            var literal = single("@doc \"\"\"\r\nOne\r\nTwo\r\n\"\"\"\r\n");
            assertEquals("One\nTwo", literal.content());
        }
    }
}
