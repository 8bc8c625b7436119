package net.docfmt.syntax;

import java.util.List;

/**
 * A bracketed expression or a {@code do}/{@code fn} block, including its delimiters.
 */
public final class Group extends CompositeNode {
    private final Kind kind;

    Group(TextRange textRange, Kind kind, List<SyntaxNode> children) {
        super(textRange, children);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public void accept(SyntaxVisitor visitor) {
        visitor.visitGroup(this);
    }

    public enum Kind {
        PARENS("(", ")"),
        BRACKETS("[", "]"),
        BRACES("{", "}"),
        DO_BLOCK("do", "end"),
        FN_BLOCK("fn", "end");

        private final String opening;
        private final String closing;

        Kind(String opening, String closing) {
            this.opening = opening;
            this.closing = closing;
        }

        public String opening() {
            return opening;
        }

        public String closing() {
            return closing;
        }

        public boolean isBlock() {
            return this == DO_BLOCK || this == FN_BLOCK;
        }
    }
}
