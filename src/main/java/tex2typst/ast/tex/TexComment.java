package tex2typst.ast.tex;

public record TexComment(String content) implements TexNode {
}
