package tex2typst.parse.tex;

import tex2typst.ast.SourceSpan;

/**
 * One lexical unit of TeX math.
 *
 * Commands keep their leading backslash in {@code text}. Text blocks hold the
 * unescaped contents of the braces after {@code \text}, {@code \operatorname},
 * {@code \begin} and {@code \end}; comments hold what follows the {@code %}.
 */
public record TexToken(TexTokenType type, String text, SourceSpan span) {
	private static final String TEXT_ESCAPED = "\\{}$&#_%";

	public TexToken(TexTokenType type, String text) {
		this(type, text, SourceSpan.NONE);
	}

	public boolean is(TexTokenType type, String text) {
		return this.type == type && this.text.equals(text);
	}

	public boolean isControl(String text) {
		return is(TexTokenType.CONTROL, text);
	}

	public boolean isElement(String text) {
		return is(TexTokenType.ELEMENT, text);
	}

	public boolean isWhitespace() {
		return type == TexTokenType.SPACE || type == TexTokenType.NEWLINE;
	}

	/**
	 * Same kind and text, ignoring where the token came from.
	 */
	public boolean sameAs(TexToken other) {
		return is(other.type, other.text);
	}

	/**
	 * Command name without the backslash.
	 */
	public String commandName() {
		if (type != TexTokenType.COMMAND) {
			throw new IllegalStateException("Not a command: " + text);
		}
		return text.substring(1);
	}

	public TexToken withSpan(SourceSpan span) {
		return new TexToken(type, text, span);
	}

	/**
	 * Renders the token back to TeX source so that tokenizing the result yields
	 * the same token again.
	 */
	public String toSource() {
		return switch (type) {
			case TEXT -> escapeText(text);
			case COMMENT -> "%" + text;
			default -> text;
		};
	}

	private static String escapeText(String raw) {
		StringBuilder sb = new StringBuilder(raw.length());
		for (int i = 0; i < raw.length(); i++) {
			char c = raw.charAt(i);
			if (TEXT_ESCAPED.indexOf(c) >= 0) {
				sb.append('\\');
			}
			sb.append(c);
		}
		return sb.toString();
	}
}
