package tex2typst.ast.tex;

/**
 * A base with a subscript, a superscript, or both. At least one of
 * {@code sub} and {@code sup} is non-null.
 */
public record TexSupSub(TexNode base, TexNode sub, TexNode sup) implements TexNode {
	public TexSupSub {
		if (base == null) {
			throw new IllegalArgumentException("SupSub without a base");
		}
	}
}
