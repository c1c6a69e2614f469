package tex2typst.ast.typst;

public record TypstNoBreakSpace() implements TypstNode {
}
