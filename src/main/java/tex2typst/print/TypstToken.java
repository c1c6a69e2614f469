package tex2typst.print;

/**
 * One rendered unit of Typst output, queued by {@link TypstWriter} before
 * spacing is decided.
 */
public record TypstToken(TypstTokenType type, String value) {
	public String render() {
		return switch (type) {
			case TEXT -> "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
			case COMMENT -> "//" + value;
			default -> value;
		};
	}
}
