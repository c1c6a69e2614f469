package tex2typst.ast.typst;

/**
 * Letters, digits and punctuation written as-is.
 */
public record TypstAtom(String content) implements TypstNode {
}
