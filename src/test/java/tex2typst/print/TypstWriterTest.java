package tex2typst.print;

import org.junit.jupiter.api.Test;
import tex2typst.WriteException;
import tex2typst.ast.typst.TypstAlign;
import tex2typst.ast.typst.TypstAtom;
import tex2typst.ast.typst.TypstComment;
import tex2typst.ast.typst.TypstFraction;
import tex2typst.ast.typst.TypstFuncCall;
import tex2typst.ast.typst.TypstGroup;
import tex2typst.ast.typst.TypstMatrix;
import tex2typst.ast.typst.TypstNoBreakSpace;
import tex2typst.ast.typst.TypstNode;
import tex2typst.ast.typst.TypstSupsub;
import tex2typst.ast.typst.TypstSymbol;
import tex2typst.ast.typst.TypstText;
import tex2typst.ast.typst.TypstWhitespace;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class TypstWriterTest {
	private static String write(TypstNode node) throws WriteException {
		TypstWriter writer = new TypstWriter();
		writer.serialize(node);
		return writer.finish();
	}

	private static TypstAtom atom(String s) {
		return new TypstAtom(s);
	}

	private static TypstGroup group(TypstNode... children) {
		return new TypstGroup(List.of(children));
	}

	@Test
	void tokensAreSpaceSeparated() throws Exception {
		assertEquals("a + b", write(group(atom("a"), atom("+"), atom("b"))));
		assertEquals("alpha dot.op beta", write(group(new TypstSymbol("alpha"), new TypstSymbol("dot.op"),
				new TypstSymbol("beta"))));
	}

	@Test
	void leadingSignSticksToNumber() throws Exception {
		assertEquals("-1", write(group(atom("-"), atom("1"))));
	}

	@Test
	void scriptKeepsSoftSpaceBeforeParenthesis() throws Exception {
		TypstSupsub ef = new TypstSupsub(atom("e"), atom("f"), null);
		assertEquals("e_f (x)", write(group(ef, atom("("), atom("x"), atom(")"))));
	}

	@Test
	void groupedScriptIsParenthesized() throws Exception {
		TypstSupsub ef = new TypstSupsub(atom("e"), group(atom("f"), atom("("), atom("x"), atom(")")), null);
		assertEquals("e_(f(x))", write(ef));
	}

	@Test
	void softSpaceIsDroppedAtEndAndBeforeSeparators() throws Exception {
		TypstSupsub square = new TypstSupsub(atom("x"), null, atom("2"));
		assertEquals("x^2", write(square));
		assertEquals("f(x^2, y)", write(new TypstFuncCall("f", square, atom("y"))));
		assertEquals("x^2\ny", write(group(square, new TypstWhitespace("\n"), atom("y"))));
	}

	@Test
	void delimitedBaseIsNotWrappedTwice() throws Exception {
		TypstGroup parens = group(atom("("), atom("a"), atom("+"), atom("b"), atom(")"));
		assertEquals("(a + b)^2", write(new TypstSupsub(parens, null, atom("2"))));
		TypstGroup bare = group(atom("a"), atom("+"), atom("b"));
		assertEquals("(a + b)^2", write(new TypstSupsub(bare, null, atom("2"))));
	}

	@Test
	void primeIsBare() throws Exception {
		assertEquals("f'", write(new TypstSupsub(atom("f"), null, atom("'"))));
		assertEquals("f'_1", write(new TypstSupsub(atom("f"), atom("1"), atom("'"))));
	}

	@Test
	void fractions() throws Exception {
		assertEquals("1/2", write(new TypstFraction(atom("1"), atom("2"))));
		assertEquals("(a + b)/(2 a)", write(new TypstFraction(group(atom("a"), atom("+"), atom("b")),
				group(atom("2"), atom("a")))));
	}

	@Test
	void callsAndOptions() throws Exception {
		assertEquals("root(3, x)", write(new TypstFuncCall("root", atom("3"), atom("x"))));
		TypstFuncCall op = new TypstFuncCall("op", new TypstText("sn")).withOption("limits", "#true");
		assertEquals("op(\"sn\", limits: #true)", write(op));
	}

	@Test
	void commaInsideCallIsSpelledOut() throws Exception {
		assertEquals("f(a comma b)", write(new TypstFuncCall("f", group(atom("a"), atom(","), atom("b")))));
		assertEquals("a, b", write(group(atom("a"), atom(","), atom("b"))));
	}

	@Test
	void matrixAndAlign() throws Exception {
		TypstMatrix matrix = new TypstMatrix(List.of(List.of(atom("a"), atom("b")), List.of(atom("c"), atom("d"))),
				Map.of("delim", "#none"));
		assertEquals("mat(delim: #none, a, b; c, d)", write(matrix));

		TypstAlign align = new TypstAlign(List.of(
				List.of(atom("a"), group(atom("="), atom("b"))),
				List.of(atom("c"), group(atom("="), atom("d")))));
		assertEquals("a &= b \\ c &= d", write(align));
	}

	@Test
	void textIsQuotedAndEscaped() throws Exception {
		assertEquals("\"some text\"", write(new TypstText("some text")));
		assertEquals("\"say \\\"hi\\\"\"", write(new TypstText("say \"hi\"")));
	}

	@Test
	void commentEndsTheLine() throws Exception {
		assertEquals("a // note\nb", write(group(atom("a"), new TypstComment(" note"), atom("b"))));
	}

	@Test
	void whitespaceAndNoBreakSpace() throws Exception {
		assertEquals("a\nb", write(group(atom("a"), new TypstWhitespace("\n"), atom("b"))));
		assertEquals("a space.nobreak b", write(group(atom("a"), new TypstNoBreakSpace(), atom("b"))));
		WriteException ex = assertThrows(WriteException.class, () -> write(new TypstWhitespace("\t")));
		assertEquals("Unexpected whitespace character: U+0009", ex.getMessage());
	}

	@Test
	void floorCeilAndRoundAreCanonicalized() throws Exception {
		TypstFraction ab = new TypstFraction(atom("a"), atom("b"));
		assertEquals("floor(a/b)", write(group(atom("floor.l"), ab, atom("floor.r"))));
		assertEquals("ceil(x)", write(group(atom("ceil.l"), atom("x"), atom("ceil.r"))));
		assertEquals("round(x)", write(group(atom("floor.l"), atom("x"), atom("ceil.r"))));
		assertEquals("floor(\"\")", write(group(atom("floor.l"), atom("floor.r"))));
	}
}
