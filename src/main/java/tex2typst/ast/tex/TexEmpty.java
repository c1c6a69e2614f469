package tex2typst.ast.tex;

/**
 * Placeholder for a missing base, as in {@code ^{a}}.
 */
public record TexEmpty() implements TexNode {
	public static final TexEmpty INSTANCE = new TexEmpty();
}
