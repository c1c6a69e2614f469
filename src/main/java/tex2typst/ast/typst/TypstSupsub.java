package tex2typst.ast.typst;

/**
 * Base with optional subscript and superscript (either may be null).
 */
public record TypstSupsub(TypstNode base, TypstNode sub, TypstNode sup) implements TypstNode {
	public TypstSupsub {
		if (base == null) {
			throw new IllegalArgumentException("Supsub without a base");
		}
	}
}
