package tex2typst.macro;

import tex2typst.parse.tex.CommandType;

import java.util.List;

/**
 * A user macro from {@code \newcommand{\name}[count][default]{body}}.
 *
 * The body is kept as raw TeX with {@code #1}/{@code #2} placeholders. The
 * name has no backslash. {@code defaultValue} is null unless the first
 * argument is optional.
 */
public record MacroDefinition(String name, CommandType type, String defaultValue, String body) {
	public MacroDefinition {
		if (type.hasOptionalArgument() != (defaultValue != null)) {
			throw new IllegalArgumentException("Default value must be given exactly for optional macros: \\" + name);
		}
		int highest = highestPlaceholder(body);
		if (highest < 0 || highest > type.argumentCount()) {
			throw new IllegalArgumentException("Illegal parameter number in definition of \\" + name);
		}
	}

	public static MacroDefinition symbol(String name, String body) {
		return new MacroDefinition(name, CommandType.SYMBOL, null, body);
	}

	/**
	 * Replaces each {@code #n} in the body with the n-th argument text.
	 *
	 * A space is put where an argument boundary would otherwise glue a command
	 * name to a following letter, so {@code \partial#1} with {@code x} stays
	 * two tokens.
	 */
	public String substitute(List<String> args) {
		if (args.size() != type.argumentCount()) {
			throw new IllegalArgumentException(
					"\\" + name + " takes " + type.argumentCount() + " arguments, got " + args.size());
		}
		StringBuilder out = new StringBuilder(body.length());
		boolean afterArgument = false;
		int i = 0;
		while (i < body.length()) {
			char c = body.charAt(i);
			if (isPlaceholder(body, i)) {
				appendSeparated(out, args.get(body.charAt(i + 1) - '1'));
				afterArgument = true;
				i += 2;
				continue;
			}
			if (afterArgument) {
				appendSeparated(out, String.valueOf(c));
			} else {
				out.append(c);
			}
			afterArgument = false;
			i++;
		}
		return out.toString();
	}

	/**
	 * Highest {@code #n} placeholder used in {@code body}, or 0 when it has none.
	 * Returns -1 for the invalid placeholder {@code #0}.
	 */
	public static int highestPlaceholder(String body) {
		int highest = 0;
		for (int i = 0; i + 1 < body.length(); i++) {
			if (isPlaceholder(body, i)) {
				int n = body.charAt(i + 1) - '0';
				if (n == 0) {
					return -1;
				}
				highest = Math.max(highest, n);
			}
		}
		return highest;
	}

	/**
	 * True when a {@code #n} placeholder starts at {@code i}. An escaped
	 * {@code \#} is a literal hash.
	 */
	private static boolean isPlaceholder(String body, int i) {
		if (body.charAt(i) != '#' || i + 1 >= body.length() || !Character.isDigit(body.charAt(i + 1))) {
			return false;
		}
		int slashes = 0;
		for (int j = i - 1; j >= 0 && body.charAt(j) == '\\'; j--) {
			slashes++;
		}
		return slashes % 2 == 0;
	}

	static void appendSeparated(StringBuilder out, String next) {
		if (!next.isEmpty() && Character.isLetter(next.charAt(0)) && endsWithCommandName(out)) {
			out.append(' ');
		}
		out.append(next);
	}

	private static boolean endsWithCommandName(CharSequence text) {
		int i = text.length() - 1;
		if (i < 0 || !Character.isLetter(text.charAt(i))) {
			return false;
		}
		while (i >= 0 && Character.isLetter(text.charAt(i))) {
			i--;
		}
		if (i < 0 || text.charAt(i) != '\\') {
			return false;
		}
		// an even run of backslashes is an escaped backslash followed by letters
		int slashes = 0;
		while (i >= 0 && text.charAt(i) == '\\') {
			slashes++;
			i--;
		}
		return slashes % 2 == 1;
	}
}
