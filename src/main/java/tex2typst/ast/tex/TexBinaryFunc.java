package tex2typst.ast.tex;

/**
 * Command with two arguments, e.g. {@code \frac{a}{b}}.
 */
public record TexBinaryFunc(String name, TexNode first, TexNode second) implements TexNode {
}
