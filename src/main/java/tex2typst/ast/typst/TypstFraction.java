package tex2typst.ast.typst;

public record TypstFraction(TypstNode numerator, TypstNode denominator) implements TypstNode {
}
