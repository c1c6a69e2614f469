package tex2typst.ast.tex;

public record TexText(String content) implements TexNode {
}
