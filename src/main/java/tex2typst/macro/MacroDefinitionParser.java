package tex2typst.macro;

import tex2typst.MacroException;
import tex2typst.parse.tex.CommandType;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a block of {@code \newcommand} (or {@code \renewcommand}) statements.
 *
 * Accepted form: {@code \newcommand{\NAME}[COUNT][DEFAULT]{BODY}} where COUNT
 * is 0, 1 or 2 and DEFAULT, the value of an omitted first argument, needs a
 * non-zero COUNT. The braces around the name may be left out. Whitespace and
 * {@code %} comments between statements are ignored.
 */
public final class MacroDefinitionParser {
	private static final String[] DEFINING_COMMANDS = { "\\newcommand", "\\renewcommand" };
	private static final int MAX_ARGUMENTS = 2;

	public List<MacroDefinition> parse(String input) throws MacroException {
		Cursor c = new Cursor(input);
		List<MacroDefinition> definitions = new ArrayList<>();
		while (true) {
			c.skipBlank();
			if (c.isAtEnd()) {
				return definitions;
			}
			definitions.add(parseDefinition(c));
		}
	}

	private MacroDefinition parseDefinition(Cursor c) throws MacroException {
		int start = c.pos;
		if (!c.consumeDefiningCommand()) {
			throw new MacroException("Unexpected text in macro definitions at offset " + start);
		}

		c.skipBlank();
		String name = parseName(c);

		c.skipBlank();
		int argumentCount = 0;
		String defaultValue = null;
		if (c.peek() == '[') {
			argumentCount = parseArgumentCount(c.bracketed('[', ']', name), name);
			c.skipBlank();
			if (c.peek() == '[') {
				defaultValue = c.bracketed('[', ']', name);
				if (argumentCount == 0) {
					throw new MacroException("Default value given for \\" + name + " which takes no arguments");
				}
			}
		}

		c.skipBlank();
		if (c.peek() != '{') {
			throw new MacroException("Expecting '{' before the body of \\" + name);
		}
		String body = c.bracketed('{', '}', name);

		int highest = MacroDefinition.highestPlaceholder(body);
		if (highest < 0 || highest > argumentCount) {
			throw new MacroException("Illegal parameter number in definition of \\" + name);
		}
		return new MacroDefinition(name, CommandType.forMacro(argumentCount, defaultValue != null), defaultValue,
				body);
	}

	private static String parseName(Cursor c) throws MacroException {
		String raw;
		if (c.peek() == '{') {
			raw = c.bracketed('{', '}', "newcommand").strip();
		} else {
			raw = c.commandName();
		}
		if (raw.length() < 2 || raw.charAt(0) != '\\' || !raw.substring(1).chars().allMatch(Character::isLetter)) {
			throw new MacroException("Invalid macro name: " + (raw.isEmpty() ? "<empty>" : raw));
		}
		return raw.substring(1);
	}

	private static int parseArgumentCount(String raw, String name) throws MacroException {
		int count;
		try {
			count = Integer.parseInt(raw.strip());
		} catch (NumberFormatException ex) {
			throw new MacroException("Invalid argument count for \\" + name + ": " + raw);
		}
		if (count < 0 || count > MAX_ARGUMENTS) {
			throw new MacroException("Argument count for \\" + name + " must be between 0 and " + MAX_ARGUMENTS
					+ " but was " + count);
		}
		return count;
	}

	private static final class Cursor {
		private final String input;
		private int pos;

		Cursor(String input) {
			this.input = input;
			this.pos = 0;
		}

		boolean isAtEnd() {
			return pos >= input.length();
		}

		char peek() {
			return isAtEnd() ? '\0' : input.charAt(pos);
		}

		void skipBlank() {
			while (!isAtEnd()) {
				char ch = input.charAt(pos);
				if (Character.isWhitespace(ch)) {
					pos++;
				} else if (ch == '%') {
					while (!isAtEnd() && input.charAt(pos) != '\n') {
						pos++;
					}
				} else {
					return;
				}
			}
		}

		boolean consumeDefiningCommand() {
			for (String command : DEFINING_COMMANDS) {
				int end = pos + command.length();
				if (input.startsWith(command, pos) && (end >= input.length() || !Character.isLetter(input.charAt(end)))) {
					pos = end;
					return true;
				}
			}
			return false;
		}

		String commandName() {
			int start = pos;
			if (peek() == '\\') {
				pos++;
				while (!isAtEnd() && Character.isLetter(input.charAt(pos))) {
					pos++;
				}
			}
			return input.substring(start, pos);
		}

		/**
		 * Consumes {@code open ... close} with nesting and returns what is inside.
		 * A backslash escapes the next character.
		 */
		String bracketed(char open, char close, String name) throws MacroException {
			int start = pos;
			int depth = 0;
			while (!isAtEnd()) {
				char ch = input.charAt(pos);
				if (ch == '\\') {
					pos += 2;
					continue;
				}
				if (ch == open) {
					depth++;
				} else if (ch == close) {
					depth--;
					if (depth == 0) {
						pos++;
						return input.substring(start + 1, pos - 1);
					}
				}
				pos++;
			}
			throw new MacroException("Unmatched '" + open + "' in definition of \\" + name);
		}
	}
}
