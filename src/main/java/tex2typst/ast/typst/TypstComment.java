package tex2typst.ast.typst;

public record TypstComment(String content) implements TypstNode {
}
