package net.docfmt.markdown.literal;

import net.docfmt.syntax.TextRange;

/**
 * A documentation literal found in a source file.
 *
 * @param ownerName the attribute name, without {@code @}
 * @param range     the characters a replacement will overwrite; for multi-line sigils this includes the line break
 *                  after the closing delimiter
 * @param delimiter the family of the literal
 * @param content   the text the markdown formatter sees
 */
public record LiteralNode(String ownerName, TextRange range, DelimiterKind delimiter, String content) {
}
