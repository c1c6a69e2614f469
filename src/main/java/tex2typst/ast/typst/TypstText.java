package tex2typst.ast.typst;

/**
 * Upright text, rendered in double quotes.
 */
public record TypstText(String content) implements TypstNode {
}
