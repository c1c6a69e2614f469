package tex2typst.ast.typst;

public record TypstWhitespace(String content) implements TypstNode {
}
