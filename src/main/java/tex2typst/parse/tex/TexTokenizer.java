package tex2typst.parse.tex;

import tex2typst.TokenizeException;
import tex2typst.ast.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Single-pass lexer for TeX math.
 *
 * Notes:
 * - A run of spaces or tabs becomes one SPACE token; CR and CRLF become NEWLINE.
 * - A command name is the maximal run of letters after the backslash, so
 * {@code \alphax} is the single command {@code alphax}.
 * - Characters the grammar does not know become UNKNOWN tokens; rejecting them
 * is left to the parser.
 */
public final class TexTokenizer {
	private static final Set<String> TEXT_BLOCK_COMMANDS = Set.of("\\text", "\\operatorname", "\\begin", "\\end");
	private static final String CONTROL_CHARS = "{}_^&";
	private static final String ESCAPED_ELEMENTS = "{}%$&#_|";
	private static final String PUNCTUATION = "+-*/='<>!.,;:?()[]|";
	private static final String TEXT_UNESCAPED = "{}\\$&#_%";

	public List<TexToken> tokenize(String input) throws TokenizeException {
		List<TexToken> tokens = new ArrayList<>();
		int i = 0;
		while (i < input.length()) {
			char c = input.charAt(i);
			int start = i;

			if (c == '%') {
				i = consumeLineComment(input, i);
				tokens.add(new TexToken(TexTokenType.COMMENT, input.substring(start + 1, i), new SourceSpan(start, i)));
				continue;
			}

			if (CONTROL_CHARS.indexOf(c) >= 0) {
				i++;
				tokens.add(new TexToken(TexTokenType.CONTROL, String.valueOf(c), new SourceSpan(start, i)));
				continue;
			}

			if (c == '\n' || c == '\r') {
				i++;
				if (c == '\r' && i < input.length() && input.charAt(i) == '\n') {
					i++;
				}
				tokens.add(new TexToken(TexTokenType.NEWLINE, "\n", new SourceSpan(start, i)));
				continue;
			}

			if (c == ' ' || c == '\t') {
				while (i < input.length() && (input.charAt(i) == ' ' || input.charAt(i) == '\t')) {
					i++;
				}
				tokens.add(new TexToken(TexTokenType.SPACE, " ", new SourceSpan(start, i)));
				continue;
			}

			if (c == '\\') {
				TexToken token = lexBackslash(input, i);
				tokens.add(token);
				i = token.span().endOffset();
				if (TEXT_BLOCK_COMMANDS.contains(token.text())) {
					i = lexTextBlock(input, i, token, tokens);
				}
				continue;
			}

			if (c >= '0' && c <= '9') {
				while (i < input.length() && input.charAt(i) >= '0' && input.charAt(i) <= '9') {
					i++;
				}
				tokens.add(new TexToken(TexTokenType.ELEMENT, input.substring(start, i), new SourceSpan(start, i)));
				continue;
			}

			i++;
			SourceSpan span = new SourceSpan(start, i);
			if (Character.isLetter(c) || PUNCTUATION.indexOf(c) >= 0) {
				tokens.add(new TexToken(TexTokenType.ELEMENT, String.valueOf(c), span));
			} else if (c == '~') {
				tokens.add(new TexToken(TexTokenType.NO_BREAK_SPACE, "~", span));
			} else {
				tokens.add(new TexToken(TexTokenType.UNKNOWN, String.valueOf(c), span));
			}
		}
		return tokens;
	}

	private static TexToken lexBackslash(String input, int start) throws TokenizeException {
		if (start + 1 >= input.length()) {
			throw new TokenizeException("Expecting command name after '\\' at offset " + start);
		}
		char n = input.charAt(start + 1);
		SourceSpan two = new SourceSpan(start, start + 2);
		if (n == '\\' || n == ',') {
			return new TexToken(TexTokenType.CONTROL, "\\" + n, two);
		}
		if (ESCAPED_ELEMENTS.indexOf(n) >= 0) {
			return new TexToken(TexTokenType.ELEMENT, "\\" + n, two);
		}
		if (Character.isLetter(n)) {
			int i = start + 1;
			while (i < input.length() && Character.isLetter(input.charAt(i))) {
				i++;
			}
			return new TexToken(TexTokenType.COMMAND, input.substring(start, i), new SourceSpan(start, i));
		}
		// control symbols such as \; \! and control space
		String name = Character.isWhitespace(n) ? " " : String.valueOf(n);
		return new TexToken(TexTokenType.COMMAND, "\\" + name, two);
	}

	/**
	 * Reads the mandatory {@code {...}} block after a text-taking command and
	 * emits it as CONTROL, TEXT, CONTROL.
	 */
	private static int lexTextBlock(String input, int pos, TexToken command, List<TexToken> tokens)
			throws TokenizeException {
		int i = pos;
		while (i < input.length() && Character.isWhitespace(input.charAt(i))) {
			i++;
		}
		if (i >= input.length() || input.charAt(i) != '{') {
			throw new TokenizeException("No content for " + command.text() + " command" + command.span().describe());
		}
		int close = findClosingBrace(input, i);
		if (close < 0) {
			throw new TokenizeException("Unmatched curly brackets after " + command.text() + command.span().describe());
		}
		tokens.add(new TexToken(TexTokenType.CONTROL, "{", new SourceSpan(i, i + 1)));
		tokens.add(new TexToken(TexTokenType.TEXT, unescape(input.substring(i + 1, close)), new SourceSpan(i + 1, close)));
		tokens.add(new TexToken(TexTokenType.CONTROL, "}", new SourceSpan(close, close + 1)));
		return close + 1;
	}

	private static int findClosingBrace(String input, int open) {
		int depth = 0;
		int i = open;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (c == '\\') {
				// an escaped character never opens or closes a group
				i += 2;
				continue;
			}
			if (c == '{') {
				depth++;
			} else if (c == '}') {
				depth--;
				if (depth == 0) {
					return i;
				}
			}
			i++;
		}
		return -1;
	}

	private static String unescape(String raw) {
		StringBuilder sb = new StringBuilder(raw.length());
		int i = 0;
		while (i < raw.length()) {
			char c = raw.charAt(i);
			if (c == '\\' && i + 1 < raw.length() && TEXT_UNESCAPED.indexOf(raw.charAt(i + 1)) >= 0) {
				sb.append(raw.charAt(i + 1));
				i += 2;
				continue;
			}
			sb.append(c);
			i++;
		}
		return sb.toString();
	}

	private static int consumeLineComment(String input, int start) {
		int i = start + 1;
		while (i < input.length() && input.charAt(i) != '\n' && input.charAt(i) != '\r') {
			i++;
		}
		return i;
	}
}
