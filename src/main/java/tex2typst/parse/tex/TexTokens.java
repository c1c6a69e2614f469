package tex2typst.parse.tex;

import java.util.List;

/**
 * Token constants and group matching shared by the parser and the macro
 * expander.
 */
public final class TexTokens {
	public static final TexToken LEFT_BRACE = new TexToken(TexTokenType.CONTROL, "{");
	public static final TexToken RIGHT_BRACE = new TexToken(TexTokenType.CONTROL, "}");
	public static final TexToken LEFT_BRACKET = new TexToken(TexTokenType.ELEMENT, "[");
	public static final TexToken RIGHT_BRACKET = new TexToken(TexTokenType.ELEMENT, "]");
	public static final TexToken LEFT_COMMAND = new TexToken(TexTokenType.COMMAND, "\\left");
	public static final TexToken RIGHT_COMMAND = new TexToken(TexTokenType.COMMAND, "\\right");
	public static final TexToken BEGIN_COMMAND = new TexToken(TexTokenType.COMMAND, "\\begin");
	public static final TexToken END_COMMAND = new TexToken(TexTokenType.COMMAND, "\\end");

	private TexTokens() {
		// utility class
	}

	/**
	 * Index of the token that closes the group opened at {@code open}, or -1
	 * when the group is never closed. Tokens compare by kind and text, so an
	 * escaped {@code \}} (an element) never closes a brace group.
	 */
	public static int findClosing(List<TexToken> tokens, int open, TexToken left, TexToken right) {
		if (!tokens.get(open).sameAs(left)) {
			throw new IllegalStateException("Expected " + left.text() + " at index " + open);
		}
		int depth = 1;
		for (int i = open + 1; i < tokens.size(); i++) {
			TexToken t = tokens.get(i);
			if (t.sameAs(left)) {
				depth++;
			} else if (t.sameAs(right)) {
				depth--;
				if (depth == 0) {
					return i;
				}
			}
		}
		return -1;
	}

	/**
	 * Index of the first token at or after {@code start} that is not a space or
	 * line break.
	 */
	public static int skipWhitespace(List<TexToken> tokens, int start) {
		int i = start;
		while (i < tokens.size() && tokens.get(i).isWhitespace()) {
			i++;
		}
		return i;
	}
}
