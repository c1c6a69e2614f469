package tex2typst.ast.tex;

/**
 * {@code \left X ... \right Y}. Delimiters are kept as written, e.g.
 * {@code "("}, {@code "\\{"}, {@code "\\lfloor"} or {@code "."} for none.
 */
public record TexLeftRight(String left, TexNode body, String right) implements TexNode {
}
