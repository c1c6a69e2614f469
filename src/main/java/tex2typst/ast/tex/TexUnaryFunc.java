package tex2typst.ast.tex;

/**
 * Command with one argument, e.g. {@code \hat{x}}. The name keeps its backslash.
 */
public record TexUnaryFunc(String name, TexNode arg) implements TexNode {
}
