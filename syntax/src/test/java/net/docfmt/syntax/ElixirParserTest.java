package net.docfmt.syntax;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ElixirParserTest {
    private static List<AttributeDeclaration> declarations(String text) throws SourceParseException {
        var file = ElixirParser.parse(text);
        var result = new ArrayList<AttributeDeclaration>();
        file.accept(new RecursiveSyntaxVisitor() {
            @Override
            public void visitAttributeDeclaration(AttributeDeclaration declaration) {
                result.add(declaration);
                super.visitAttributeDeclaration(declaration);
            }
        });
        return result;
    }

    private static AttributeDeclaration single(String text) throws SourceParseException {
        var found = declarations(text);
        assertThat(found).hasSize(1);
        return found.get(0);
    }

    @Test
    void testAttributesInsideModuleBlock() throws Exception {
        var found = declarations("""
                defmodule Foo do
                  @moduledoc "Module"

                  @doc "Function"
                  def bar, do: :ok
                end
                """);

        assertThat(found).extracting(AttributeDeclaration::getName).containsExactly("moduledoc", "doc");
        assertThat(found.get(0).getParent()).isInstanceOfSatisfying(Group.class,
                group -> assertThat(group.getKind()).isEqualTo(Group.Kind.DO_BLOCK));
        assertThat(found.get(1).getBoundValue()).isInstanceOfSatisfying(StringLiteral.class, literal -> {
            assertThat(literal.getQuote()).isEqualTo(StringLiteral.Quote.DOUBLE);
            assertThat(literal.getBody()).isEqualTo("Function");
            assertThat(literal.getText()).isEqualTo("\"Function\"");
        });
    }

    @Test
    void testTreeCoversWholeText() throws Exception {
        var text = "defmodule Foo do\n  # comment\n  @doc false\nend\n";
        var file = ElixirParser.parse(text);
        assertThat(file.getTextRange()).isEqualTo(new TextRange(0, text.length()));
        assertThat(file.getChildren()).hasSize(3);
        assertThat(file.getChildren().get(2).getText()).isEqualTo("do\n  # comment\n  @doc false\nend");
    }

    @Nested
    class Heredocs {
        @Test
        void testBodyExcludesOpeningLineAndClosingIndentation() throws Exception {
            var declaration = single("""
                      @moduledoc \"""
                      Line one
                        Line two
                      \"""
                    """);

            assertThat(declaration.getBoundValue()).isInstanceOfSatisfying(StringLiteral.class, literal -> {
                assertThat(literal.getQuote()).isEqualTo(StringLiteral.Quote.DOUBLE_HEREDOC);
                assertThat(literal.getBody()).isEqualTo("  Line one\n    Line two\n");
                assertThat(literal.getText()).endsWith("\"\"\"");
            });
            assertThat(declaration.isStandalone()).isTrue();
        }

        @Test
        void testSingleQuotedHeredoc() throws Exception {
            var declaration = single("@doc '''\nText\n'''\n");
            assertThat(declaration.getBoundValue()).isInstanceOfSatisfying(StringLiteral.class,
                    literal -> assertThat(literal.getQuote()).isEqualTo(StringLiteral.Quote.SINGLE_HEREDOC));
        }

        @Test
        void testQuotesInsideBodyDoNotCloseIt() throws Exception {
            var declaration = single("@doc \"\"\"\nSay \"hi\" and \"\"\" inline\n\"\"\"\n");
            assertThat(((StringLiteral) declaration.getBoundValue()).getBody()).isEqualTo("Say \"hi\" and \"\"\" inline\n");
        }

        @Test
        void testTextAfterOpeningDelimiterIsAnError() {
            assertThatThrownBy(() -> ElixirParser.parse("@doc \"\"\"text\n\"\"\"\n"))
                    .isInstanceOf(SourceParseException.class)
                    .hasMessageContaining("Heredoc");
        }
    }

    @Nested
    class Sigils {
        @Test
        void testBracketSigil() throws Exception {
            var declaration = single("@doc ~S(Some text)\n");
            assertThat(declaration.getBoundValue()).isInstanceOfSatisfying(SigilLiteral.class, sigil -> {
                assertThat(sigil.getName()).isEqualTo("S");
                assertThat(sigil.getOpeningDelimiter()).isEqualTo("(");
                assertThat(sigil.getClosingDelimiter()).isEqualTo(")");
                assertThat(sigil.getBody()).isEqualTo("Some text");
                assertThat(sigil.getModifiers()).isEmpty();
                assertThat(sigil.isInterpolating()).isFalse();
            });
        }

        @Test
        void testHeredocSigil() throws Exception {
            var declaration = single("@moduledoc ~s\"\"\"\nText\n\"\"\"\n");
            assertThat(declaration.getBoundValue()).isInstanceOfSatisfying(SigilLiteral.class, sigil -> {
                assertThat(sigil.isHeredoc()).isTrue();
                assertThat(sigil.isInterpolating()).isTrue();
                assertThat(sigil.getBody()).isEqualTo("Text\n");
            });
        }

        @Test
        void testModifiers() throws Exception {
            var declaration = single("@pattern ~r/a+b/iu\n");
            assertThat(((SigilLiteral) declaration.getBoundValue()).getModifiers()).isEqualTo("iu");
        }

        @Test
        void testRawSigilDoesNotInterpolate() throws Exception {
            var declaration = single("@doc ~S|uses #{x}|\n");
            assertThat(((SigilLiteral) declaration.getBoundValue()).isInterpolated()).isFalse();
        }

        @Test
        void testEscapedClosingDelimiter() throws Exception {
            var declaration = single("@doc ~s(a \\) b)\n");
            assertThat(((SigilLiteral) declaration.getBoundValue()).getBody()).isEqualTo("a \\) b");
        }
    }

    @Nested
    class Interpolation {
        @Test
        void testInterpolationIsRecorded() throws Exception {
            var declaration = single("@doc \"Hello #{name}\"\n");
            assertThat(((StringLiteral) declaration.getBoundValue()).isInterpolated()).isTrue();
        }

        @Test
        void testNestedStringsAndBracesInsideInterpolation() throws Exception {
            var declaration = single("@doc \"a #{Map.get(%{\"k\" => \"}\"}, \"k\")} b\"\n");
            assertThat(((StringLiteral) declaration.getBoundValue()).getBody())
                    .isEqualTo("a #{Map.get(%{\"k\" => \"}\"}, \"k\")} b");
        }

        @Test
        void testEscapedInterpolationMarkerIsText() throws Exception {
            var declaration = single("@doc \"not \\#{interpolated}\"\n");
            assertThat(((StringLiteral) declaration.getBoundValue()).isInterpolated()).isFalse();
        }
    }

    @Nested
    class Values {
        @Test
        void testBooleanValue() throws Exception {
            assertThat(single("@doc false\n").getBoundValue()).isInstanceOfSatisfying(BooleanLiteral.class,
                    literal -> assertThat(literal.getValue()).isFalse());
        }

        @Test
        void testNilValue() throws Exception {
            assertThat(single("@doc nil\n").getBoundValue()).isInstanceOf(NilLiteral.class);
        }

        @Test
        void testKeywordListIsNotStandalone() throws Exception {
            var declaration = single("@doc since: \"1.0.0\"\n");
            assertThat(declaration.getValue()).isInstanceOfSatisfying(Token.class,
                    token -> assertThat(token.getKind()).isEqualTo(Token.Kind.KEYWORD_KEY));
            assertThat(declaration.isStandalone()).isFalse();
            assertThat(declaration.getBoundValue()).isNull();
        }

        @Test
        void testConcatenationIsNotStandalone() throws Exception {
            assertThat(single("@doc \"a\" <> \"b\"\n").isStandalone()).isFalse();
        }

        @Test
        void testOperatorOnNextLineContinuesExpression() throws Exception {
            assertThat(single("@doc \"a\"\n     |> String.trim()\n").isStandalone()).isFalse();
        }

        @Test
        void testTrailingCommentKeepsValueStandalone() throws Exception {
            assertThat(single("@doc \"a\" # note\n").isStandalone()).isTrue();
        }

        @Test
        void testParenthesizedValue() throws Exception {
            var declaration = single("@doc(\"text\")\n");
            assertThat(declaration.isParenthesized()).isTrue();
            assertThat(declaration.getBoundValue()).isInstanceOf(StringLiteral.class);
        }

        @Test
        void testValueOnFollowingLineIsNotBound() throws Exception {
            var found = declarations("@doc\n\"text\"\n");
            assertThat(found).hasSize(1);
            assertThat(found.get(0).getValue()).isNull();
        }

        @Test
        void testAttributeReadInsideExpression() throws Exception {
            var found = declarations("def version, do: @version\n");
            assertThat(found).extracting(AttributeDeclaration::getName).containsExactly("version");
            assertThat(found.get(0).getValue()).isNull();
        }
    }

    @Nested
    class Lexing {
        @Test
        void testQuotesInCommentsAreIgnored() throws Exception {
            var found = declarations("# don't \"break\"\n@doc \"x\"\n");
            assertThat(found).hasSize(1);
        }

        @Test
        void testCharLiteralsDoNotOpenStrings() throws Exception {
            var found = declarations("x = ?\"\ny = ?\\\"\n@doc \"x\"\n");
            assertThat(found).hasSize(1);
        }

        @Test
        void testQuotedAtomsAndKeywordKeys() throws Exception {
            var file = ElixirParser.parse("[do: :\"x y\", end: 1]\n");
            var group = (Group) file.getChildren().get(0);
            assertThat(group.getKind()).isEqualTo(Group.Kind.BRACKETS);
            assertThat(group.getChildren()).extracting(node -> ((Token) node).getKind()).containsExactly(
                    Token.Kind.KEYWORD_KEY, Token.Kind.ATOM, Token.Kind.PUNCTUATION, Token.Kind.KEYWORD_KEY, Token.Kind.NUMBER);
        }

        @Test
        void testFnBlocks() throws Exception {
            var file = ElixirParser.parse("Enum.map(list, fn x -> x end)\n");
            assertThat(file.getChildren()).hasSize(4);
        }
    }

    @Nested
    class Errors {
        @Test
        void testUnterminatedString() {
            assertThatThrownBy(() -> ElixirParser.parse("@doc \"open\n"))
                    .isInstanceOfSatisfying(SourceParseException.class, e -> {
                        assertThat(e.line).isEqualTo(1);
                        assertThat(e.column).isEqualTo(6);
                    });
        }

        @Test
        void testMissingEnd() {
            assertThatThrownBy(() -> ElixirParser.parse("defmodule Foo do\n  @doc \"x\"\n"))
                    .isInstanceOf(SourceParseException.class)
                    .hasMessageContaining("Missing terminator 'end'");
        }

        @Test
        void testMismatchedBracket() {
            assertThatThrownBy(() -> ElixirParser.parse("foo(]\n"))
                    .isInstanceOfSatisfying(SourceParseException.class, e -> assertThat(e.column).isEqualTo(5));
        }

        @Test
        void testUnexpectedEnd() {
            assertThatThrownBy(() -> ElixirParser.parse("x = 1\nend\n"))
                    .isInstanceOfSatisfying(SourceParseException.class, e -> assertThat(e.line).isEqualTo(2));
        }

        @Test
        void testUnterminatedSigil() {
            assertThatThrownBy(() -> ElixirParser.parse("@doc ~S(never closed\n"))
                    .isInstanceOf(SourceParseException.class);
        }
    }
}
