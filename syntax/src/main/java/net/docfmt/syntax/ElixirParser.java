package net.docfmt.syntax;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Builds a positioned tree from Elixir source text.
 * <p>
 * The parser is structural only: it recognizes every kind of literal (so that their contents never leak into the
 * surrounding code), balances brackets and {@code do}/{@code fn}...{@code end} blocks, and binds module attributes
 * to the expression that follows them. It does not build a full expression tree.
 */
public final class ElixirParser {
    private static final String OPERATOR_CHARS = "+-*/=<>!&|^\\.%~";
    private static final String SIGIL_DELIMITERS = "\"'/|([{<";
    private static final Set<String> CONTINUATION_OPERATORS = Set.of(
            "|>", "<>", "++", "--", "+++", "---", "..", "...", ".", "<-", "\\\\", "=", "==", "!=", "===", "!==",
            "||", "|||", "&&", "&&&", "|", "::", "=~", "+", "-", "*", "/", "**", ">", "<", ">=", "<=", "->",
            "<<<", ">>>", "~>", "<~", "~>>", "<<~", "<~>", "<|>", "^^^");
    private static final Set<String> CONTINUATION_WORDS = Set.of("and", "or", "in", "when", "not");

    private final String text;
    private final int length;
    private final Deque<Frame> frames = new ArrayDeque<>();
    private int pos;

    private ElixirParser(String text) {
        this.text = text;
        this.length = text.length();
    }

    public static SourceFile parse(String text) throws SourceParseException {
        return new ElixirParser(text).parseFile();
    }

    private SourceFile parseFile() throws SourceParseException {
        frames.push(new Frame(null, 0));
        while (pos < length) {
            parseNext();
        }
        var top = frames.pop();
        if (top.kind != null) {
            throw parseError("Missing terminator '" + top.kind.closing() + "' for '" + top.kind.opening() + "'", top.start);
        }
        return new SourceFile(text, attachDeclarations(top.children));
    }

    private void parseNext() throws SourceParseException {
        char c = text.charAt(pos);
        if (Character.isWhitespace(c)) {
            pos++;
            return;
        }
        switch (c) {
            case '#' -> parseComment();
            case '"', '\'' -> parseString(c);
            case '~' -> {
                if (isSigilStart(pos)) {
                    parseSigil();
                } else {
                    parseOperator();
                }
            }
            case '?' -> addToken(Token.Kind.CHAR, pos, skipCharLiteral(pos));
            case ':' -> parseColon();
            case '@' -> parseAttributeName();
            case '(' -> openGroup(Group.Kind.PARENS, 1);
            case '[' -> openGroup(Group.Kind.BRACKETS, 1);
            case '{' -> openGroup(Group.Kind.BRACES, 1);
            case ')' -> closeGroup(Group.Kind.PARENS);
            case ']' -> closeGroup(Group.Kind.BRACKETS);
            case '}' -> closeGroup(Group.Kind.BRACES);
            case ',', ';' -> addToken(Token.Kind.PUNCTUATION, pos, pos + 1);
            default -> {
                if (isDigit(c)) {
                    parseNumber();
                } else if (isIdentifierStart(c)) {
                    parseIdentifier();
                } else if (isAliasStart(c)) {
                    parseAlias();
                } else {
                    parseOperator();
                }
            }
        }
    }

    private void parseComment() {
        int end = text.indexOf('\n', pos);
        if (end < 0) {
            end = length;
        }
        if (end > pos && text.charAt(end - 1) == '\r') {
            end--;
        }
        add(new Comment(new TextRange(pos, end)));
    }

    private void parseString(char quote) throws SourceParseException {
        int start = pos;
        String triple = String.valueOf(quote).repeat(3);
        if (text.startsWith(triple, start)) {
            int bodyStart = heredocBodyStart(start + 3, start);
            var scan = scanHeredocBody(bodyStart, triple, true, start);
            var quoteKind = quote == '"' ? StringLiteral.Quote.DOUBLE_HEREDOC : StringLiteral.Quote.SINGLE_HEREDOC;
            var bodyRange = new TextRange(bodyStart, lineStart(scan.closeStart()));
            add(new StringLiteral(new TextRange(start, scan.closeStart() + 3), quoteKind, bodyRange, scan.interpolated()));
        } else {
            var scan = scanDelimited(start + 1, quote, true, start, "string");
            var quoteKind = quote == '"' ? StringLiteral.Quote.DOUBLE : StringLiteral.Quote.SINGLE;
            var bodyRange = new TextRange(start + 1, scan.closeStart());
            add(new StringLiteral(new TextRange(start, scan.closeStart() + 1), quoteKind, bodyRange, scan.interpolated()));
        }
    }

    private void parseSigil() throws SourceParseException {
        var scan = scanSigil(pos);
        add(new SigilLiteral(new TextRange(scan.start(), scan.end()), scan.name(), scan.opening(), scan.closing(),
                new TextRange(scan.bodyStart(), scan.bodyEnd()), scan.modifiers(), scan.interpolated()));
    }

    private void parseColon() throws SourceParseException {
        int start = pos;
        char next = charAt(start + 1);
        if (next == ':') {
            addToken(Token.Kind.OPERATOR, start, start + 2);
        } else if (next == '"' || next == '\'') {
            addToken(Token.Kind.ATOM, start, skipQuoted(start + 1));
        } else if (isIdentifierStart(next) || isAliasStart(next)) {
            addToken(Token.Kind.ATOM, start, identifierEnd(start + 1));
        } else if (isOperatorChar(next) || next == '@') {
            addToken(Token.Kind.ATOM, start, operatorEnd(start + 1));
        } else {
            addToken(Token.Kind.PUNCTUATION, start, start + 1);
        }
    }

    private void parseAttributeName() {
        if (isIdentifierStart(charAt(pos + 1))) {
            addToken(Token.Kind.ATTRIBUTE, pos, identifierEnd(pos + 1));
        } else {
            addToken(Token.Kind.OPERATOR, pos, pos + 1);
        }
    }

    private void parseIdentifier() throws SourceParseException {
        int start = pos;
        int end = identifierEnd(start);
        if (isKeywordKey(end)) {
            addToken(Token.Kind.KEYWORD_KEY, start, end + 1);
            return;
        }
        if (start == 0 || text.charAt(start - 1) != '.') {
            switch (text.substring(start, end)) {
                case "do" -> {
                    openGroup(Group.Kind.DO_BLOCK, 2);
                    return;
                }
                case "fn" -> {
                    openGroup(Group.Kind.FN_BLOCK, 2);
                    return;
                }
                case "end" -> {
                    closeBlock(start, end);
                    return;
                }
                case "true", "false" -> {
                    add(new BooleanLiteral(new TextRange(start, end), end - start == 4));
                    return;
                }
                case "nil" -> {
                    add(new NilLiteral(new TextRange(start, end)));
                    return;
                }
                default -> {
                }
            }
        }
        addToken(Token.Kind.IDENTIFIER, start, end);
    }

    private void parseAlias() {
        int start = pos;
        int end = start;
        while (end < length && isIdentifierPart(text.charAt(end))) {
            end++;
        }
        if (isKeywordKey(end)) {
            addToken(Token.Kind.KEYWORD_KEY, start, end + 1);
        } else {
            addToken(Token.Kind.ALIAS, start, end);
        }
    }

    private void parseNumber() {
        int start = pos;
        int end = start;
        while (end < length) {
            char c = text.charAt(end);
            if (Character.isLetterOrDigit(c) || c == '_') {
                end++;
            } else if (c == '.' && isDigit(charAt(end + 1))) {
                end++;
            } else if ((c == '+' || c == '-') && (text.charAt(end - 1) == 'e' || text.charAt(end - 1) == 'E')
                    && text.substring(start, end).indexOf('.') >= 0) {
                end++;
            } else {
                break;
            }
        }
        addToken(Token.Kind.NUMBER, start, end);
    }

    private void parseOperator() {
        int end = operatorEnd(pos);
        if (end == pos) {
            end = pos + Character.charCount(text.codePointAt(pos));
        }
        addToken(Token.Kind.OPERATOR, pos, end);
    }

    private void openGroup(Group.Kind kind, int openingLength) {
        frames.push(new Frame(kind, pos));
        pos += openingLength;
    }

    private void closeGroup(Group.Kind kind) throws SourceParseException {
        var top = frames.peek();
        if (top.kind == null) {
            throw parseError("Unexpected '" + kind.closing() + "'", pos);
        }
        if (top.kind != kind) {
            throw parseError("Unexpected '" + kind.closing() + "', expected '" + top.kind.closing() + "'", pos);
        }
        finishGroup(pos + 1);
    }

    private void closeBlock(int start, int end) throws SourceParseException {
        var top = frames.peek();
        if (top.kind == null || !top.kind.isBlock()) {
            throw parseError("Unexpected 'end'" + (top.kind != null ? ", expected '" + top.kind.closing() + "'" : ""), start);
        }
        finishGroup(end);
    }

    private void finishGroup(int end) {
        var frame = frames.pop();
        var group = new Group(new TextRange(frame.start, end), frame.kind, attachDeclarations(frame.children));
        frames.peek().children.add(group);
        pos = end;
    }

    private void addToken(Token.Kind kind, int start, int end) {
        add(new Token(new TextRange(start, end), kind));
    }

    private void add(SyntaxNode node) {
        frames.peek().children.add(node);
        pos = node.getEndOffset();
    }

    /**
     * Binds every {@code @name} token in a sibling list to the value that follows it.
     */
    private List<SyntaxNode> attachDeclarations(List<SyntaxNode> nodes) {
        var result = new ArrayList<SyntaxNode>(nodes.size());
        int i = 0;
        while (i < nodes.size()) {
            var node = nodes.get(i);
            if (!(node instanceof Token token) || token.getKind() != Token.Kind.ATTRIBUTE) {
                result.add(node);
                i++;
                continue;
            }

            var next = i + 1 < nodes.size() ? nodes.get(i + 1) : null;
            boolean parenthesized = next instanceof Group group && group.getKind() == Group.Kind.PARENS
                    && group.getStartOffset() == token.getEndOffset();
            if (next != null && (parenthesized || isValueStart(next) && !containsLineBreak(token.getEndOffset(), next.getStartOffset()))) {
                var after = i + 2 < nodes.size() ? nodes.get(i + 2) : null;
                result.add(new AttributeDeclaration(token, next, parenthesized, isStandalone(next, after)));
                i += 2;
            } else {
                result.add(new AttributeDeclaration(token, null, false, false));
                i++;
            }
        }
        return result;
    }

    private static boolean isValueStart(SyntaxNode node) {
        if (node instanceof Group group) {
            return !group.getKind().isBlock();
        }
        if (node instanceof Token token) {
            return token.getKind() != Token.Kind.OPERATOR && token.getKind() != Token.Kind.PUNCTUATION;
        }
        return !(node instanceof Comment);
    }

    private boolean isStandalone(SyntaxNode value, @Nullable SyntaxNode after) {
        if (after == null || after instanceof Comment) {
            return true;
        }
        String afterText = after.getTextRange().substring(text);
        if (after instanceof Token token && token.getKind() == Token.Kind.PUNCTUATION && afterText.equals(";")) {
            return true;
        }
        if (!containsLineBreak(value.getEndOffset(), after.getStartOffset())) {
            return false;
        }
        return !continuesExpression(after, afterText);
    }

    private static boolean continuesExpression(SyntaxNode node, String nodeText) {
        if (!(node instanceof Token token)) {
            return false;
        }
        return switch (token.getKind()) {
            case OPERATOR -> CONTINUATION_OPERATORS.contains(nodeText);
            case IDENTIFIER -> CONTINUATION_WORDS.contains(nodeText);
            default -> false;
        };
    }

    // Scanning helpers. These only compute offsets so they can also skip literals nested in interpolations.

    private int heredocBodyStart(int from, int literalStart) throws SourceParseException {
        int i = from;
        while (i < length && (text.charAt(i) == ' ' || text.charAt(i) == '\t' || text.charAt(i) == '\r')) {
            i++;
        }
        if (i >= length) {
            throw parseError("Unterminated heredoc", literalStart);
        }
        if (text.charAt(i) != '\n') {
            throw parseError("Heredoc allows only whitespace after the opening delimiter", literalStart);
        }
        return i + 1;
    }

    private BodyScan scanHeredocBody(int from, String terminator, boolean interpolating, int literalStart) throws SourceParseException {
        boolean interpolated = false;
        boolean atLineStart = true;
        int i = from;
        while (i < length) {
            char c = text.charAt(i);
            if (atLineStart && text.startsWith(terminator, i)) {
                return new BodyScan(i, interpolated);
            }
            if (c == '\n') {
                atLineStart = true;
                i++;
                continue;
            }
            if (c == ' ' || c == '\t' || c == '\r') {
                i++;
                continue;
            }
            atLineStart = false;
            if (c == '\\') {
                i += 2;
            } else if (interpolating && c == '#' && charAt(i + 1) == '{') {
                interpolated = true;
                i = skipInterpolation(i + 2, i);
            } else {
                i++;
            }
        }
        throw parseError("Unterminated heredoc, missing " + terminator, literalStart);
    }

    private BodyScan scanDelimited(int from, char close, boolean interpolating, int literalStart, String description) throws SourceParseException {
        boolean interpolated = false;
        int i = from;
        while (i < length) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == close) {
                return new BodyScan(i, interpolated);
            } else if (interpolating && c == '#' && charAt(i + 1) == '{') {
                interpolated = true;
                i = skipInterpolation(i + 2, i);
            } else {
                i++;
            }
        }
        throw parseError("Unterminated " + description + ", missing " + close, literalStart);
    }

    private int skipInterpolation(int from, int interpolationStart) throws SourceParseException {
        int depth = 1;
        int i = from;
        while (i < length) {
            char c = text.charAt(i);
            switch (c) {
                case '{' -> {
                    depth++;
                    i++;
                }
                case '}' -> {
                    depth--;
                    i++;
                    if (depth == 0) {
                        return i;
                    }
                }
                case '"', '\'' -> i = skipQuoted(i);
                case '~' -> i = isSigilStart(i) ? scanSigil(i).end() : i + 1;
                case '?' -> i = i > 0 && isIdentifierPart(text.charAt(i - 1)) ? i + 1 : skipCharLiteral(i);
                case '#' -> {
                    int lineEnd = text.indexOf('\n', i);
                    i = lineEnd < 0 ? length : lineEnd;
                }
                default -> i++;
            }
        }
        throw parseError("Unterminated interpolation", interpolationStart);
    }

    private int skipQuoted(int start) throws SourceParseException {
        char quote = text.charAt(start);
        String triple = String.valueOf(quote).repeat(3);
        if (text.startsWith(triple, start)) {
            int bodyStart = heredocBodyStart(start + 3, start);
            return scanHeredocBody(bodyStart, triple, true, start).closeStart() + 3;
        }
        return scanDelimited(start + 1, quote, true, start, "string").closeStart() + 1;
    }

    private int skipCharLiteral(int start) {
        int end = charAt(start + 1) == '\\' ? start + 3 : start + 2;
        return Math.min(end, length);
    }

    private boolean isSigilStart(int offset) {
        char first = charAt(offset + 1);
        int i = offset + 2;
        if (isAsciiUpper(first)) {
            while (i < length && (isAsciiUpper(text.charAt(i)) || isDigit(text.charAt(i)))) {
                i++;
            }
        } else if (!isAsciiLower(first)) {
            return false;
        }
        return i < length && SIGIL_DELIMITERS.indexOf(text.charAt(i)) >= 0;
    }

    private SigilScan scanSigil(int start) throws SourceParseException {
        int i = start + 1;
        if (isAsciiUpper(text.charAt(i))) {
            i++;
            while (isAsciiUpper(charAt(i)) || isDigit(charAt(i))) {
                i++;
            }
        } else {
            i++;
        }
        String name = text.substring(start + 1, i);
        boolean interpolating = isAsciiLower(name.charAt(0));
        char delimiter = text.charAt(i);

        String opening;
        String closing;
        int bodyStart;
        int bodyEnd;
        BodyScan scan;
        String triple = String.valueOf(delimiter).repeat(3);
        if ((delimiter == '"' || delimiter == '\'') && text.startsWith(triple, i)) {
            opening = closing = triple;
            bodyStart = heredocBodyStart(i + 3, start);
            scan = scanHeredocBody(bodyStart, triple, interpolating, start);
            bodyEnd = lineStart(scan.closeStart());
        } else {
            char closingChar = closingDelimiter(delimiter);
            opening = String.valueOf(delimiter);
            closing = String.valueOf(closingChar);
            bodyStart = i + 1;
            scan = scanDelimited(bodyStart, closingChar, interpolating, start, "sigil");
            bodyEnd = scan.closeStart();
        }

        int modifiersStart = scan.closeStart() + closing.length();
        int end = modifiersStart;
        while (end < length && (isAsciiLower(text.charAt(end)) || isAsciiUpper(text.charAt(end)) || isDigit(text.charAt(end)))) {
            end++;
        }
        return new SigilScan(start, end, name, opening, closing, bodyStart, bodyEnd,
                text.substring(modifiersStart, end), scan.interpolated());
    }

    private static char closingDelimiter(char opening) {
        return switch (opening) {
            case '(' -> ')';
            case '[' -> ']';
            case '{' -> '}';
            case '<' -> '>';
            default -> opening;
        };
    }

    private int identifierEnd(int start) {
        int end = start;
        while (end < length && isIdentifierPart(text.charAt(end))) {
            end++;
        }
        if (end < length && (text.charAt(end) == '?' || text.charAt(end) == '!')) {
            end++;
        }
        return end;
    }

    private int operatorEnd(int start) {
        int end = start;
        while (end < length && isOperatorChar(text.charAt(end))) {
            if (end > start && text.charAt(end) == '~' && isSigilStart(end)) {
                break;
            }
            end++;
        }
        return end;
    }

    private boolean isKeywordKey(int identifierEnd) {
        return charAt(identifierEnd) == ':' && charAt(identifierEnd + 1) != ':'
                && (identifierEnd + 1 >= length || Character.isWhitespace(text.charAt(identifierEnd + 1)));
    }

    private boolean containsLineBreak(int from, int to) {
        int index = text.indexOf('\n', from);
        return index >= 0 && index < to;
    }

    private int lineStart(int offset) {
        return text.lastIndexOf('\n', offset - 1) + 1;
    }

    private char charAt(int offset) {
        return offset < length ? text.charAt(offset) : '\0';
    }

    private SourceParseException parseError(String message, int offset) {
        int line = 1;
        for (int i = 0; i < offset && i < length; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return new SourceParseException(message, line, offset - lineStart(offset) + 1);
    }

    private static boolean isOperatorChar(char c) {
        return c != '\0' && OPERATOR_CHARS.indexOf(c) >= 0;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAsciiLower(char c) {
        return c >= 'a' && c <= 'z';
    }

    private static boolean isAsciiUpper(char c) {
        return c >= 'A' && c <= 'Z';
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c) && !Character.isUpperCase(c);
    }

    private static boolean isAliasStart(char c) {
        return Character.isUpperCase(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    private record BodyScan(int closeStart, boolean interpolated) {
    }

    private record SigilScan(int start, int end, String name, String opening, String closing,
                             int bodyStart, int bodyEnd, String modifiers, boolean interpolated) {
    }

    private static final class Frame {
        @Nullable
        private final Group.Kind kind;
        private final int start;
        private final List<SyntaxNode> children = new ArrayList<>();

        private Frame(@Nullable Group.Kind kind, int start) {
            this.kind = kind;
            this.start = start;
        }
    }
}
