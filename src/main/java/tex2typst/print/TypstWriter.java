package tex2typst.print;

import tex2typst.WriteException;
import tex2typst.ast.typst.TypstAlign;
import tex2typst.ast.typst.TypstAtom;
import tex2typst.ast.typst.TypstComment;
import tex2typst.ast.typst.TypstEmpty;
import tex2typst.ast.typst.TypstFraction;
import tex2typst.ast.typst.TypstFuncCall;
import tex2typst.ast.typst.TypstGroup;
import tex2typst.ast.typst.TypstMatrix;
import tex2typst.ast.typst.TypstNoBreakSpace;
import tex2typst.ast.typst.TypstNode;
import tex2typst.ast.typst.TypstSupsub;
import tex2typst.ast.typst.TypstSymbol;
import tex2typst.ast.typst.TypstText;
import tex2typst.ast.typst.TypstUnknown;
import tex2typst.ast.typst.TypstWhitespace;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Typst AST -> text.
 *
 * {@link #serialize} queues tokens; {@link #finish} decides the spacing
 * between them and runs the floor/ceil/round canonicalization over the
 * result. A writer renders one tree.
 */
public final class TypstWriter {
	private static final TypstToken LEFT_PAREN = new TypstToken(TypstTokenType.ELEMENT, "(");
	private static final TypstToken RIGHT_PAREN = new TypstToken(TypstTokenType.ELEMENT, ")");
	private static final TypstToken COMMA = new TypstToken(TypstTokenType.ELEMENT, ",");
	private static final TypstToken NEWLINE = new TypstToken(TypstTokenType.SYMBOL, "\n");
	private static final TypstToken SOFT_SPACE = new TypstToken(TypstTokenType.CONTROL, " ");

	private static final Set<String> DELIMITER_ATOMS = Set.of(
			"(", ")", "[", "]", "{", "}", "|",
			"floor.l", "floor.r", "ceil.l", "ceil.r",
			"⌊", "⌋", "⌈", "⌉");

	// floor and ceil must run before round, whose pattern mixes the two
	private static final List<Canonicalization> PASSES = List.of(
			new Canonicalization(Pattern.compile("floor\\.l\\s*(.*?)\\s*floor\\.r"), "floor"),
			new Canonicalization(Pattern.compile("ceil\\.l\\s*(.*?)\\s*ceil\\.r"), "ceil"),
			new Canonicalization(Pattern.compile("floor\\.l\\s*(.*?)\\s*ceil\\.r"), "round"));

	private final List<TypstToken> queue = new ArrayList<>();
	private final StringBuilder buffer = new StringBuilder();
	private int insideFunctionDepth;

	public void serialize(TypstNode node) throws WriteException {
		if (node instanceof TypstEmpty) {
			return;
		}
		if (node instanceof TypstAtom atom) {
			if (atom.content().equals(",") && insideFunctionDepth > 0) {
				queue.add(new TypstToken(TypstTokenType.SYMBOL, "comma"));
			} else {
				queue.add(new TypstToken(TypstTokenType.ELEMENT, atom.content()));
			}
			return;
		}
		if (node instanceof TypstSymbol symbol) {
			queue.add(new TypstToken(TypstTokenType.SYMBOL, symbol.name()));
			return;
		}
		if (node instanceof TypstUnknown unknown) {
			queue.add(new TypstToken(TypstTokenType.SYMBOL, unknown.content()));
			return;
		}
		if (node instanceof TypstText text) {
			queue.add(new TypstToken(TypstTokenType.TEXT, text.content()));
			return;
		}
		if (node instanceof TypstComment comment) {
			queue.add(new TypstToken(TypstTokenType.COMMENT, comment.content()));
			queue.add(NEWLINE);
			return;
		}
		if (node instanceof TypstWhitespace ws) {
			writeWhitespace(ws);
			return;
		}
		if (node instanceof TypstNoBreakSpace) {
			queue.add(new TypstToken(TypstTokenType.SYMBOL, "space.nobreak"));
			return;
		}
		if (node instanceof TypstGroup group) {
			for (TypstNode child : group.children()) {
				serialize(child);
			}
			return;
		}
		if (node instanceof TypstSupsub supsub) {
			writeSupsub(supsub);
			return;
		}
		if (node instanceof TypstFuncCall call) {
			writeFuncCall(call);
			return;
		}
		if (node instanceof TypstFraction fraction) {
			parenthesizeGroup(fraction.numerator());
			queue.add(new TypstToken(TypstTokenType.SYMBOL, "/"));
			parenthesizeGroup(fraction.denominator());
			return;
		}
		if (node instanceof TypstAlign align) {
			writeAlign(align);
			return;
		}
		if (node instanceof TypstMatrix matrix) {
			writeMatrix(matrix);
			return;
		}
		throw new WriteException("No rendering rule for " + node);
	}

	private void writeWhitespace(TypstWhitespace ws) throws WriteException {
		for (char c : ws.content().toCharArray()) {
			if (c == '\n') {
				queue.add(NEWLINE);
			} else if (c != ' ') {
				throw new WriteException("Unexpected whitespace character: U+" + String.format("%04X", (int) c));
			}
		}
	}

	private void writeSupsub(TypstSupsub node) throws WriteException {
		appendWithBracketsIfNeeded(node.base());

		boolean trailingSpaceNeeded = false;
		boolean prime = node.sup() instanceof TypstAtom atom && atom.content().equals("'");
		if (prime) {
			queue.add(new TypstToken(TypstTokenType.ELEMENT, "'"));
		}
		if (node.sub() != null) {
			queue.add(new TypstToken(TypstTokenType.ELEMENT, "_"));
			trailingSpaceNeeded = appendWithBracketsIfNeeded(node.sub());
		}
		if (node.sup() != null && !prime) {
			queue.add(new TypstToken(TypstTokenType.ELEMENT, "^"));
			trailingSpaceNeeded = appendWithBracketsIfNeeded(node.sup());
		}
		if (trailingSpaceNeeded) {
			queue.add(SOFT_SPACE);
		}
	}

	private void writeFuncCall(TypstFuncCall call) throws WriteException {
		queue.add(new TypstToken(TypstTokenType.SYMBOL, call.name()));
		insideFunctionDepth++;
		queue.add(LEFT_PAREN);
		List<TypstNode> args = call.args();
		for (int i = 0; i < args.size(); i++) {
			if (i > 0) {
				queue.add(COMMA);
			}
			serialize(args.get(i));
		}
		for (Map.Entry<String, String> option : call.options().entrySet()) {
			queue.add(new TypstToken(TypstTokenType.SYMBOL, ", " + option.getKey() + ": " + option.getValue()));
		}
		queue.add(RIGHT_PAREN);
		insideFunctionDepth--;
	}

	private void writeAlign(TypstAlign align) throws WriteException {
		List<List<TypstNode>> rows = align.rows();
		for (int i = 0; i < rows.size(); i++) {
			if (i > 0) {
				queue.add(new TypstToken(TypstTokenType.SYMBOL, "\\"));
			}
			List<TypstNode> row = rows.get(i);
			for (int j = 0; j < row.size(); j++) {
				if (j > 0) {
					queue.add(new TypstToken(TypstTokenType.ELEMENT, "&"));
				}
				serialize(row.get(j));
			}
		}
	}

	private void writeMatrix(TypstMatrix matrix) throws WriteException {
		queue.add(new TypstToken(TypstTokenType.SYMBOL, "mat"));
		insideFunctionDepth++;
		queue.add(LEFT_PAREN);
		for (Map.Entry<String, String> option : matrix.options().entrySet()) {
			queue.add(new TypstToken(TypstTokenType.SYMBOL, option.getKey() + ": " + option.getValue() + ", "));
		}
		List<List<TypstNode>> rows = matrix.rows();
		for (int i = 0; i < rows.size(); i++) {
			if (i > 0) {
				queue.add(new TypstToken(TypstTokenType.ELEMENT, ";"));
			}
			List<TypstNode> row = rows.get(i);
			for (int j = 0; j < row.size(); j++) {
				if (j > 0) {
					queue.add(COMMA);
				}
				serialize(row.get(j));
			}
		}
		queue.add(RIGHT_PAREN);
		insideFunctionDepth--;
	}

	private void parenthesizeGroup(TypstNode node) throws WriteException {
		if (node instanceof TypstGroup) {
			queue.add(LEFT_PAREN);
			serialize(node);
			queue.add(RIGHT_PAREN);
		} else {
			serialize(node);
		}
	}

	/**
	 * Writes a script base or a script, in parentheses when it would otherwise
	 * not bind as one unit. Returns true when nothing closed it off, so a
	 * following token could glue onto it.
	 */
	private boolean appendWithBracketsIfNeeded(TypstNode node) throws WriteException {
		boolean wrap = node instanceof TypstGroup || node instanceof TypstSupsub || node instanceof TypstEmpty;
		if (node instanceof TypstGroup group && isDelimited(group)) {
			wrap = false;
		}

		if (wrap) {
			queue.add(LEFT_PAREN);
			serialize(node);
			queue.add(RIGHT_PAREN);
		} else {
			serialize(node);
		}
		return !wrap;
	}

	private static boolean isDelimited(TypstGroup group) {
		List<TypstNode> children = group.children();
		return !children.isEmpty() && isDelimiter(children.get(0)) && isDelimiter(children.get(children.size() - 1));
	}

	private static boolean isDelimiter(TypstNode node) {
		return node instanceof TypstAtom atom && DELIMITER_ATOMS.contains(atom.content());
	}

	/**
	 * Renders everything serialized so far and returns the finished text.
	 */
	public String finish() {
		flushQueue();
		String text = buffer.toString();
		for (Canonicalization pass : PASSES) {
			text = pass.apply(text);
		}
		return text;
	}

	private void flushQueue() {
		for (int i = 0; i < queue.size(); i++) {
			if (queue.get(i).equals(SOFT_SPACE) && !isSoftSpaceNeeded(i)) {
				continue;
			}
			write(queue.get(i).render());
		}
		queue.clear();
	}

	private boolean isSoftSpaceNeeded(int index) {
		if (index == queue.size() - 1) {
			return false;
		}
		TypstToken next = queue.get(index + 1);
		return !next.equals(RIGHT_PAREN) && !next.equals(COMMA) && !next.equals(NEWLINE);
	}

	private void write(String str) {
		if (str.isEmpty()) {
			return;
		}
		if (needsSpaceBefore(str)) {
			buffer.append(' ');
		}
		buffer.append(str);
	}

	private boolean needsSpaceBefore(String str) {
		if (buffer.length() == 0) {
			return false;
		}
		char first = str.charAt(0);
		char last = buffer.charAt(buffer.length() - 1);

		// first token of a clause
		if ("([|".indexOf(last) >= 0 && Character.isLetterOrDigit(first)) {
			return false;
		}
		// closing a clause
		if (")}]|".indexOf(first) >= 0) {
			return false;
		}
		// argument list of a call
		if (first == '(' && last != '=') {
			return false;
		}
		if ("_^,;!".indexOf(first) >= 0 || str.equals("'")) {
			return false;
		}
		if (Character.isDigit(last) && Character.isDigit(first)) {
			return false;
		}
		// leading sign, "(-1" rather than "( -1"
		if ("([{".indexOf(last) >= 0 && (first == '-' || first == '+')) {
			return false;
		}
		if (buffer.length() == 1 && (last == '-' || last == '+')) {
			return false;
		}
		if (Character.isWhitespace(first)) {
			return false;
		}
		if (last == '&' && str.equals("=")) {
			return false;
		}
		if ((last == '/' || first == '/') && !str.startsWith("//")) {
			return false;
		}
		return !Character.isWhitespace(last) && "_^{(".indexOf(last) < 0;
	}

	private record Canonicalization(Pattern pattern, String function) {
		String apply(String text) {
			String replaced = pattern.matcher(text).replaceAll(function + "($1)");
			return replaced.replace(function + "()", function + "(\"\")");
		}
	}
}
