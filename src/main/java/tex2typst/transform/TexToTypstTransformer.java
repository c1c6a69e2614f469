package tex2typst.transform;

import tex2typst.SymbolTable;
import tex2typst.TransformException;
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

/**
 * TeX AST -> Typst AST.
 *
 * Mostly a structural mapping; the special cases are brace fusion, elided
 * {@code \left..\right} pairs, fractions, roots, blackboard letters,
 * {@code \operatorname} and {@code \overset}.
 */
public final class TexToTypstTransformer {
	/**
	 * Operator names Typst provides that KaTeX does not.
	 */
	private static final Set<String> INTRINSIC_OPERATORS = Set.of("dim", "id", "im", "mod", "Pr", "sech", "csch");

	private static final Set<String> FRACTION_COMMANDS = Set.of("\\frac", "\\dfrac", "\\tfrac");

	private static final Set<List<String>> ELIDED_PAIRS = Set.of(
			List.of("[", "]"),
			List.of("(", ")"),
			List.of("\\{", "\\}"),
			List.of("\\lfloor", "\\rfloor"),
			List.of("\\lceil", "\\rceil"),
			List.of("\\lfloor", "\\rceil"));

	private static final Map<String, String> MATRIX_DELIMITERS = Map.of(
			"pmatrix", "\"(\"",
			"bmatrix", "\"[\"",
			"Bmatrix", "\"{\"",
			"vmatrix", "\"|\"",
			"Vmatrix", "\"||\"");

	public TypstNode transform(TexNode node) throws TransformException {
		if (node instanceof TexEmpty) {
			return TypstEmpty.INSTANCE;
		}
		if (node instanceof TexWhitespace ws) {
			return new TypstWhitespace(ws.content());
		}
		if (node instanceof TexNoBreakSpace) {
			return new TypstNoBreakSpace();
		}
		if (node instanceof TexOrdgroup group) {
			return new TypstGroup(transformAll(group.children()));
		}
		if (node instanceof TexElement element) {
			return new TypstAtom(convertToken(element.content()));
		}
		if (node instanceof TexSymbol symbol) {
			return new TypstSymbol(convertToken(symbol.name()));
		}
		if (node instanceof TexUnknownMacro unknown) {
			return new TypstUnknown(convertToken(unknown.name()));
		}
		if (node instanceof TexText text) {
			return new TypstText(text.content());
		}
		if (node instanceof TexComment comment) {
			return new TypstComment(comment.content());
		}
		if (node instanceof TexControl control) {
			return transformControl(control);
		}
		if (node instanceof TexSupSub supSub) {
			return transformSupSub(supSub);
		}
		if (node instanceof TexLeftRight leftRight) {
			return transformLeftRight(leftRight);
		}
		if (node instanceof TexOptionalBinaryFunc func) {
			return transformOptionalBinary(func);
		}
		if (node instanceof TexBinaryFunc func) {
			return transformBinary(func);
		}
		if (node instanceof TexUnaryFunc func) {
			return transformUnary(func);
		}
		if (node instanceof TexBeginEnd env) {
			return transformEnvironment(env);
		}
		throw new TransformException("Unsupported node: " + node);
	}

	private List<TypstNode> transformAll(List<TexNode> nodes) throws TransformException {
		List<TypstNode> out = new ArrayList<>(nodes.size());
		for (TexNode n : nodes) {
			out.add(transform(n));
		}
		return out;
	}

	private static TypstNode transformControl(TexControl control) throws TransformException {
		return switch (control.content()) {
			case "\\\\" -> new TypstSymbol("\\");
			case "\\," -> new TypstSymbol("thin");
			default -> throw new TransformException("Unknown control sequence: " + control.content());
		};
	}

	private TypstNode transformSupSub(TexSupSub node) throws TransformException {
		TexNode base = node.base();
		if (base instanceof TexUnaryFunc func) {
			if (func.name().equals("\\overbrace") && node.sup() != null) {
				return new TypstFuncCall("overbrace", transform(func.arg()), transform(node.sup()));
			}
			if (func.name().equals("\\underbrace") && node.sub() != null) {
				return new TypstFuncCall("underbrace", transform(func.arg()), transform(node.sub()));
			}
		}

		TypstNode typstBase = transform(base);
		if (typstBase instanceof TypstEmpty) {
			typstBase = new TypstText("");
		}
		TypstNode sub = node.sub() == null ? null : transform(node.sub());
		TypstNode sup = node.sup() == null ? null : transform(node.sup());
		return new TypstSupsub(typstBase, sub, sup);
	}

	private TypstNode transformLeftRight(TexLeftRight node) throws TransformException {
		String left = node.left();
		String right = node.right();
		TypstNode body = transform(node.body());

		if (ELIDED_PAIRS.contains(List.of(left, right))) {
			return new TypstGroup(List.of(delimiter(left), body, delimiter(right)));
		}
		if (left.equals(".") && right.equals(".")) {
			return new TypstGroup(List.of(body));
		}
		if (right.equals(".")) {
			return new TypstGroup(List.of(delimiter(left), body));
		}
		if (left.equals(".")) {
			return new TypstFuncCall("lr", new TypstGroup(List.of(body, delimiter(right))));
		}
		return new TypstFuncCall("lr", new TypstGroup(List.of(delimiter(left), body, delimiter(right))));
	}

	private static TypstNode delimiter(String delimiter) {
		return new TypstAtom(convertToken(delimiter));
	}

	private TypstNode transformOptionalBinary(TexOptionalBinaryFunc node) throws TransformException {
		if (!node.name().equals("\\sqrt")) {
			throw new TransformException("Unknown option binary function: " + node.name());
		}
		TypstNode radicand = transform(node.mandatory());
		if (node.optional() == null) {
			return new TypstFuncCall("sqrt", radicand);
		}
		return new TypstFuncCall("root", transform(node.optional()), radicand);
	}

	private TypstNode transformBinary(TexBinaryFunc node) throws TransformException {
		if (node.name().equals("\\overset")) {
			return transformOverset(node);
		}
		if (FRACTION_COMMANDS.contains(node.name())) {
			return new TypstFraction(transform(node.first()), transform(node.second()));
		}
		return new TypstFuncCall(convertToken(node.name()), transform(node.first()), transform(node.second()));
	}

	/**
	 * {@code \overset{def}{=}} is the definition symbol; anything else puts the
	 * first argument above an operator made of the second.
	 */
	private TypstNode transformOverset(TexBinaryFunc node) throws TransformException {
		TexNode above = node.first();
		TexNode base = node.second();
		if (isDef(above) && base.equals(new TexElement("="))) {
			return new TypstSymbol("eq.def");
		}
		TypstFuncCall op = new TypstFuncCall("op", transform(base)).withOption("limits", "#true");
		return new TypstSupsub(op, null, transform(above));
	}

	private static boolean isDef(TexNode node) {
		if (node.equals(new TexText("def"))) {
			return true;
		}
		return node instanceof TexOrdgroup group
				&& group.children().equals(List.of(new TexElement("d"), new TexElement("e"), new TexElement("f")));
	}

	private TypstNode transformUnary(TexUnaryFunc node) throws TransformException {
		if (node.name().equals("\\operatorname")) {
			if (!(node.arg() instanceof TexText text)) {
				throw new TransformException("Expecting body of \\operatorname to be text but got " + node.arg());
			}
			if (INTRINSIC_OPERATORS.contains(text.content())) {
				return new TypstSymbol(text.content());
			}
			return new TypstFuncCall("op", new TypstText(text.content()));
		}

		TypstNode arg = transform(node.arg());
		if (node.name().equals("\\mathbf")) {
			return new TypstFuncCall("upright", new TypstFuncCall("bold", arg));
		}
		if (node.name().equals("\\mathbb") && arg instanceof TypstAtom atom && isUpperAscii(atom.content())) {
			return new TypstSymbol(atom.content().repeat(2));
		}
		return new TypstFuncCall(convertToken(node.name()), arg);
	}

	private static boolean isUpperAscii(String s) {
		return !s.isEmpty() && s.chars().allMatch(ch -> ch >= 'A' && ch <= 'Z');
	}

	private TypstNode transformEnvironment(TexBeginEnd node) throws TransformException {
		List<List<TypstNode>> rows = new ArrayList<>(node.rows().size());
		for (List<TexNode> row : node.rows()) {
			rows.add(transformAll(row));
		}
		if (node.name().startsWith("align")) {
			return new TypstAlign(rows);
		}
		String delim = MATRIX_DELIMITERS.getOrDefault(node.name(), "#none");
		return new TypstMatrix(rows, Map.of("delim", delim));
	}

	/**
	 * Translates the text of an element or command into Typst spelling.
	 * Commands missing from the symbol table keep their bare name, which is
	 * right for Greek letters and most operator names.
	 */
	static String convertToken(String token) {
		if (!token.isEmpty() && token.chars().allMatch(Character::isLetterOrDigit)) {
			return token;
		}
		switch (token) {
			case "/":
				return "\\/";
			case "\\|":
				return "parallel";
			case "\\\\":
				return "\\";
			case "\\$":
			case "\\#":
			case "\\&":
			case "\\_":
				return token;
			default:
				break;
		}
		if (token.startsWith("\\")) {
			String name = token.substring(1);
			return SymbolTable.lookup(name).orElse(name);
		}
		return token;
	}
}
