package tex2typst.ast.tex;

import java.util.List;

/**
 * Command with an optional bracketed argument before its mandatory one, e.g.
 * {@code \sqrt[3]{x}}. {@code optional} is null when the brackets were omitted.
 */
public record TexOptionalBinaryFunc(String name, TexNode optional, TexNode mandatory) implements TexNode {
	/**
	 * Arguments in source order: one or two of them.
	 */
	public List<TexNode> args() {
		return optional == null ? List.of(mandatory) : List.of(optional, mandatory);
	}
}
