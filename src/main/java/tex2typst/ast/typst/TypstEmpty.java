package tex2typst.ast.typst;

public record TypstEmpty() implements TypstNode {
	public static final TypstEmpty INSTANCE = new TypstEmpty();
}
