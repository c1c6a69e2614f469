package tex2typst.ast.tex;

/**
 * A space run ({@code " "}) or a line break ({@code "\n"}).
 */
public record TexWhitespace(String content) implements TexNode {
	public boolean isNewline() {
		return content.equals("\n");
	}
}
