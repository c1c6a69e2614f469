package tex2typst.parse.tex;

import tex2typst.ConverterOptions;
import tex2typst.ParseException;
import tex2typst.SymbolTable;
import tex2typst.ast.SourceSpan;
import tex2typst.ast.tex.TexBeginEnd;
import tex2typst.ast.tex.TexBinaryFunc;
import tex2typst.ast.tex.TexComment;
import tex2typst.ast.tex.TexControl;
import tex2typst.ast.tex.TexElement;
import tex2typst.ast.tex.TexEmpty;
import tex2typst.ast.tex.TexLeftRight;
import tex2typst.ast.tex.TexNoBreakSpace;
import tex2typst.ast.tex.TexNode;
import tex2typst.ast.tex.TexOptionalBinaryFunc;
import tex2typst.ast.tex.TexOrdgroup;
import tex2typst.ast.tex.TexSupSub;
import tex2typst.ast.tex.TexSymbol;
import tex2typst.ast.tex.TexText;
import tex2typst.ast.tex.TexUnaryFunc;
import tex2typst.ast.tex.TexUnknownMacro;
import tex2typst.ast.tex.TexWhitespace;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser from TeX tokens to the TeX syntax tree.
 *
 * Command arity comes from the {@link CommandRegistry}, so macros registered
 * for a conversion change how their (unexpanded) names are parsed. Brace
 * groups, {@code \left..\right} bodies and environment bodies are located by
 * depth counting first and then parsed as nested sequences.
 */
public final class TexParser {
	private static final Set<String> DELIMITERS = Set.of("(", ")", "[", "]", "|", "\\{", "\\}", ".");
	private static final Set<String> DELIMITER_COMMANDS = Set.of(
			"\\lfloor", "\\rfloor", "\\lceil", "\\rceil", "\\langle", "\\rangle");
	private static final Set<String> STRUCTURAL_COMMANDS = Set.of("left", "right", "begin", "end");

	private static final TexToken SUB = new TexToken(TexTokenType.CONTROL, "_");
	private static final TexToken SUP = new TexToken(TexTokenType.CONTROL, "^");
	private static final TexToken PRIME = new TexToken(TexTokenType.ELEMENT, "'");

	private final ConverterOptions options;
	private final CommandRegistry commands;

	public TexParser() {
		this(ConverterOptions.defaults(), new CommandRegistry());
	}

	public TexParser(ConverterOptions options, CommandRegistry commands) {
		this.options = options;
		this.commands = commands;
	}

	/**
	 * Parses a whole token sequence. No expression yields {@link TexEmpty}, one
	 * yields that expression, more are wrapped in a {@link TexOrdgroup}.
	 */
	public TexNode parse(List<TexToken> tokens) throws ParseException {
		Cursor c = new Cursor(tokens);
		List<TexNode> results = new ArrayList<>();
		while (!c.isAtEnd()) {
			TexToken first = c.peek();
			TexNode node = parseNextExpr(c);
			if (isInsignificant(node)) {
				continue;
			}
			if (node instanceof TexControl control && control.content().equals("&")) {
				throw new ParseException("Unexpected alignment mark '&' outside of an environment"
						+ first.span().describe());
			}
			results.add(node);
		}

		if (results.isEmpty()) {
			return TexEmpty.INSTANCE;
		}
		if (results.size() == 1) {
			return results.get(0);
		}
		return new TexOrdgroup(results);
	}

	private boolean isInsignificant(TexNode node) {
		if (!(node instanceof TexWhitespace ws)) {
			return false;
		}
		return ws.isNewline() ? !options.newlineSensitive() : !options.spaceSensitive();
	}

	private TexNode parseNextExpr(Cursor c) throws ParseException {
		TexNode base = parseWithoutSupSub(c);
		if (base instanceof TexWhitespace) {
			return base;
		}

		int primes = eatPrimes(c);
		TexNode sub = null;
		TexNode sup = null;
		if (c.acceptAfterWhitespace(SUB)) {
			sub = parseScript(c, SUB);
			int more = eatPrimes(c);
			if (primes > 0 && more > 0) {
				throw doubleScript("superscript", c);
			}
			primes += more;
			if (c.acceptAfterWhitespace(SUP)) {
				sup = parseScript(c, SUP);
				if (eatPrimes(c) > 0) {
					throw doubleScript("superscript", c);
				}
			}
		} else if (c.acceptAfterWhitespace(SUP)) {
			sup = parseScript(c, SUP);
			if (eatPrimes(c) > 0) {
				throw doubleScript("superscript", c);
			}
			if (c.acceptAfterWhitespace(SUB)) {
				sub = parseScript(c, SUB);
				if (eatPrimes(c) > 0) {
					throw doubleScript("superscript", c);
				}
			}
		}

		if (sub == null && sup == null && primes == 0) {
			return base;
		}
		if (c.peekAfterWhitespace(SUP) && (sup != null || primes > 0)) {
			throw doubleScript("superscript", c);
		}
		if (c.peekAfterWhitespace(SUB) && sub != null) {
			throw doubleScript("subscript", c);
		}
		return new TexSupSub(base, sub, foldPrimes(primes, sup));
	}

	private static int eatPrimes(Cursor c) {
		int count = 0;
		while (c.acceptAfterWhitespace(PRIME)) {
			count++;
		}
		return count;
	}

	/**
	 * Primes become the superscript: one prime alone is the element {@code '},
	 * otherwise a group of the primes followed by the explicit superscript.
	 */
	private static TexNode foldPrimes(int primes, TexNode sup) {
		if (primes == 0) {
			return sup;
		}
		List<TexNode> parts = new ArrayList<>();
		for (int i = 0; i < primes; i++) {
			parts.add(new TexElement("'"));
		}
		if (sup != null) {
			parts.add(sup);
		}
		return parts.size() == 1 ? parts.get(0) : new TexOrdgroup(parts);
	}

	private TexNode parseScript(Cursor c, TexToken mark) throws ParseException {
		c.skipWhitespace();
		if (c.isAtEnd()) {
			throw new ParseException("Expecting argument after '" + mark.text() + "'");
		}
		return parseWithoutSupSub(c);
	}

	private static ParseException doubleScript(String kind, Cursor c) {
		return new ParseException("Double " + kind + c.spanAhead().describe());
	}

	private TexNode parseWithoutSupSub(Cursor c) throws ParseException {
		if (c.isAtEnd()) {
			throw new ParseException("Unexpected end of input");
		}
		TexToken t = c.peek();
		return switch (t.type()) {
			case COMMAND -> parseCommand(c);
			case CONTROL -> parseControl(c);
			case UNKNOWN -> throw new ParseException("Unexpected character '" + t.text() + "'" + t.span().describe());
			default -> leaf(c.next());
		};
	}

	private static TexNode leaf(TexToken t) {
		return switch (t.type()) {
			case ELEMENT -> new TexElement(t.text());
			case TEXT -> new TexText(t.text());
			case COMMENT -> new TexComment(t.text());
			case SPACE, NEWLINE -> new TexWhitespace(t.text());
			case NO_BREAK_SPACE -> new TexNoBreakSpace();
			default -> throw new IllegalStateException("Not a leaf token: " + t);
		};
	}

	private TexNode parseControl(Cursor c) throws ParseException {
		TexToken t = c.peek();
		switch (t.text()) {
			case "{" -> {
				int close = TexTokens.findClosing(c.tokens, c.pos, TexTokens.LEFT_BRACE, TexTokens.RIGHT_BRACE);
				if (close < 0) {
					throw new ParseException("Unmatched '{'" + t.span().describe());
				}
				TexNode inner = parse(c.tokens.subList(c.pos + 1, close));
				c.pos = close + 1;
				return inner;
			}
			case "}" -> throw new ParseException("Unexpected '}'" + t.span().describe());
			case "_", "^" -> {
				// missing base; the caller consumes the script
				return TexEmpty.INSTANCE;
			}
			default -> {
				c.next();
				return new TexControl(t.text());
			}
		}
	}

	private TexNode parseCommand(Cursor c) throws ParseException {
		TexToken t = c.next();
		if (t.sameAs(TexTokens.BEGIN_COMMAND)) {
			return parseBeginEnd(c, t);
		}
		if (t.sameAs(TexTokens.LEFT_COMMAND)) {
			return parseLeftRight(c, t);
		}
		String name = t.commandName();
		if (STRUCTURAL_COMMANDS.contains(name)) {
			throw new ParseException("Unexpected command " + t.text() + t.span().describe());
		}

		return switch (commands.commandType(name)) {
			case SYMBOL -> SymbolTable.contains(name) ? new TexSymbol(t.text()) : new TexUnknownMacro(t.text());
			case UNARY -> name.equals("text") ? parseTextBlock(c, t) : new TexUnaryFunc(t.text(), parseArgument(c, t));
			case BINARY -> {
				TexNode first = parseArgument(c, t);
				TexNode second = parseArgument(c, t);
				yield new TexBinaryFunc(t.text(), first, second);
			}
			case OPTIONAL_BINARY -> {
				TexNode optional = parseOptionalArgument(c, t);
				yield new TexOptionalBinaryFunc(t.text(), optional, parseArgument(c, t));
			}
			case OPTIONAL_UNARY -> {
				TexNode optional = parseOptionalArgument(c, t);
				yield new TexUnaryFunc(t.text(), optional == null ? TexEmpty.INSTANCE : optional);
			}
		};
	}

	private TexNode parseArgument(Cursor c, TexToken command) throws ParseException {
		c.skipWhitespace();
		if (c.isAtEnd()) {
			throw new ParseException("Expecting argument for " + command.text() + command.span().describe());
		}
		return parseWithoutSupSub(c);
	}

	private TexNode parseOptionalArgument(Cursor c, TexToken command) throws ParseException {
		if (!c.peekAfterWhitespace(TexTokens.LEFT_BRACKET)) {
			return null;
		}
		c.skipWhitespace();
		int close = TexTokens.findClosing(c.tokens, c.pos, TexTokens.LEFT_BRACKET, TexTokens.RIGHT_BRACKET);
		if (close < 0) {
			throw new ParseException("No matching ']' for the optional argument of " + command.text()
					+ command.span().describe());
		}
		TexNode optional = parse(c.tokens.subList(c.pos + 1, close));
		c.pos = close + 1;
		return optional;
	}

	private static TexText parseTextBlock(Cursor c, TexToken command) throws ParseException {
		return new TexText(readBraced(c, command));
	}

	/**
	 * Reads the {@code {TEXT}} shape the tokenizer emits after text-taking
	 * commands.
	 */
	private static String readBraced(Cursor c, TexToken command) throws ParseException {
		int i = c.pos;
		List<TexToken> tokens = c.tokens;
		if (i + 2 >= tokens.size() || !tokens.get(i).sameAs(TexTokens.LEFT_BRACE)
				|| tokens.get(i + 1).type() != TexTokenType.TEXT || !tokens.get(i + 2).sameAs(TexTokens.RIGHT_BRACE)) {
			throw new ParseException("Expecting text in braces after " + command.text() + command.span().describe());
		}
		c.pos = i + 3;
		return tokens.get(i + 1).text();
	}

	private TexNode parseLeftRight(Cursor c, TexToken left) throws ParseException {
		int leftIndex = c.pos - 1;
		TexToken leftDelimiter = readDelimiter(c, left);
		int bodyStart = c.pos;

		int rightIndex = TexTokens.findClosing(c.tokens, leftIndex, TexTokens.LEFT_COMMAND, TexTokens.RIGHT_COMMAND);
		if (rightIndex < 0) {
			throw new ParseException("No matching \\right for \\left" + left.span().describe());
		}
		c.pos = rightIndex + 1;
		TexToken rightDelimiter = readDelimiter(c, c.tokens.get(rightIndex));

		TexNode body = parse(c.tokens.subList(bodyStart, rightIndex));
		return new TexLeftRight(leftDelimiter.text(), body, rightDelimiter.text());
	}

	private static TexToken readDelimiter(Cursor c, TexToken command) throws ParseException {
		c.skipWhitespace();
		if (c.isAtEnd()) {
			throw new ParseException("Expecting delimiter after " + command.text() + command.span().describe());
		}
		TexToken delimiter = c.next();
		boolean valid = delimiter.type() == TexTokenType.ELEMENT && DELIMITERS.contains(delimiter.text())
				|| delimiter.type() == TexTokenType.COMMAND && DELIMITER_COMMANDS.contains(delimiter.text());
		if (!valid) {
			throw new ParseException("Invalid delimiter '" + delimiter.text() + "' after " + command.text()
					+ delimiter.span().describe());
		}
		return delimiter;
	}

	private TexNode parseBeginEnd(Cursor c, TexToken begin) throws ParseException {
		int beginIndex = c.pos - 1;
		String name = readBraced(c, begin);
		int bodyStart = TexTokens.skipWhitespace(c.tokens, c.pos);

		int endIndex = TexTokens.findClosing(c.tokens, beginIndex, TexTokens.BEGIN_COMMAND, TexTokens.END_COMMAND);
		if (endIndex < 0) {
			throw new ParseException("No matching \\end for \\begin{" + name + "}" + begin.span().describe());
		}
		c.pos = endIndex + 1;
		TexToken end = c.tokens.get(endIndex);
		String endName = readBraced(c, end);
		if (!endName.equals(name)) {
			throw new ParseException("Mismatched environments: \\begin{" + name + "} closed by \\end{" + endName + "}"
					+ end.span().describe());
		}

		int bodyEnd = endIndex;
		while (bodyEnd > bodyStart && c.tokens.get(bodyEnd - 1).isWhitespace()) {
			bodyEnd--;
		}
		return new TexBeginEnd(name, parseAligned(c.tokens.subList(bodyStart, bodyEnd)));
	}

	/**
	 * Splits an environment body into rows on {@code \\} and cells on
	 * {@code &}. Every cell is an ordgroup; a trailing {@code \\} does not open
	 * an extra row.
	 */
	private List<List<TexNode>> parseAligned(List<TexToken> tokens) throws ParseException {
		Cursor c = new Cursor(tokens);
		List<List<TexNode>> rows = new ArrayList<>();
		List<TexNode> row = new ArrayList<>();
		List<TexNode> cell = new ArrayList<>();
		while (!c.isAtEnd()) {
			TexNode node = parseNextExpr(c);
			if (isInsignificant(node)) {
				continue;
			}
			if (node instanceof TexControl control && control.content().equals("\\\\")) {
				row.add(new TexOrdgroup(cell));
				rows.add(row);
				row = new ArrayList<>();
				cell = new ArrayList<>();
			} else if (node instanceof TexControl control && control.content().equals("&")) {
				row.add(new TexOrdgroup(cell));
				cell = new ArrayList<>();
			} else {
				cell.add(node);
			}
		}
		if (rows.isEmpty() || !row.isEmpty() || !cell.isEmpty()) {
			row.add(new TexOrdgroup(cell));
			rows.add(row);
		}
		return rows;
	}

	private static final class Cursor {
		private final List<TexToken> tokens;
		private int pos;

		Cursor(List<TexToken> tokens) {
			this.tokens = tokens;
			this.pos = 0;
		}

		boolean isAtEnd() {
			return pos >= tokens.size();
		}

		TexToken peek() {
			return tokens.get(pos);
		}

		TexToken next() {
			return tokens.get(pos++);
		}

		void skipWhitespace() {
			pos = TexTokens.skipWhitespace(tokens, pos);
		}

		boolean peekAfterWhitespace(TexToken expected) {
			int i = TexTokens.skipWhitespace(tokens, pos);
			return i < tokens.size() && tokens.get(i).sameAs(expected);
		}

		/**
		 * Consumes optional whitespace and {@code expected} if it comes next;
		 * otherwise nothing is consumed.
		 */
		boolean acceptAfterWhitespace(TexToken expected) {
			int i = TexTokens.skipWhitespace(tokens, pos);
			if (i < tokens.size() && tokens.get(i).sameAs(expected)) {
				pos = i + 1;
				return true;
			}
			return false;
		}

		SourceSpan spanAhead() {
			int i = TexTokens.skipWhitespace(tokens, pos);
			if (i < tokens.size()) {
				return tokens.get(i).span();
			}
			return tokens.isEmpty() ? SourceSpan.NONE : tokens.get(tokens.size() - 1).span();
		}
	}
}
