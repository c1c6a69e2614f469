package tex2typst.ast.tex;

/**
 * Argument-less command with a known Typst spelling. The name keeps its backslash.
 */
public record TexSymbol(String name) implements TexNode {
}
