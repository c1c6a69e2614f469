package tex2typst.ast.tex;

/**
 * A reserved control sequence that survives parsing: {@code \\}, {@code \,}
 * or the alignment mark {@code &}.
 */
public record TexControl(String content) implements TexNode {
}
