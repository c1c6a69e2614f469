package tex2typst.ast.tex;

public record TexNoBreakSpace() implements TexNode {
}
