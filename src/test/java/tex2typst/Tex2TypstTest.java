package tex2typst;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class Tex2TypstTest {
	private static final String PP = "\\newcommand{\\pp}[2][]{\\frac{\\partial #1}{\\partial #2}}";

	private final Tex2Typst converter = new Tex2Typst();

	@Test
	void basics() throws Exception {
		this.assertConverts("\\frac{1}{2}", "1/2");
		this.assertConverts("\\sqrt{2}", "sqrt(2)");
		this.assertConverts("\\sum_{i=1}^n i", "sum_(i = 1)^n i");
		this.assertConverts("\\int_{a}^{b} f(x) dx", "integral_a^b f(x) d x");
		this.assertConverts("\\sqrt[3]{x}", "root(3, x)");
		this.assertConverts("\\sqrt [3]{x}", "root(3, x)");
		this.assertConverts("e_f(x)", "e_f (x)");
		this.assertConverts("e_{f (x)}", "e_(f(x))");
		this.assertConverts("\\sqrt{3} \\sqrt[3]{x}", "sqrt(3) root(3, x)");
	}

	@Test
	void symbols() throws Exception {
		this.assertConverts("\\square", "square");
		this.assertConverts("\\alpha \\leq \\beta", "alpha lt.eq beta");
		this.assertConverts("\\mathbb{R}", "RR");
		this.assertConverts("\\mathbf{v}", "upright(bold(v))");
		this.assertConverts("a \\overset{def}{=} b", "a eq.def b");
	}

	@Test
	void floor() throws Exception {
		this.assertConverts("\\left\\lfloor \\frac{a}{b} \\right\\rfloor \\floor{\\frac{a}{b}}", "floor(a/b) floor(a/b)");
	}

	@Test
	void delimiters() throws Exception {
		this.assertConverts("\\left( x \\right)", "(x)");
		this.assertConverts("\\left| x \\right|", "lr(|x|)");
	}

	@Test
	void textWithSpace() throws Exception {
		this.assertConverts("\\text        {some text}", "\"some text\"");
		assertThrows(TokenizeException.class, () -> converter.convert("\\text "));
	}

	@Test
	void operatorname() throws Exception {
		this.assertConverts("\\operatorname{sn} x", "op(\"sn\") x");
	}

	@Test
	void environments() throws Exception {
		this.assertConverts("\\begin{aligned}asd \\end{aligned}", "a s d");
		this.assertConverts("\\begin{pmatrix} a & b \\\\ c & d \\end{pmatrix}", "mat(delim: \"(\", a, b; c, d)");
	}

	@Test
	void lackingSpace() throws Exception {
		this.assertConverts("           x       =  \\frac{a-b \\pm \\sqrt{b^2 - 4ac}}{2a} ",
				"x = (a - b plus.minus sqrt(b^2 - 4 a c))/(2 a)");
	}

	@Test
	void longFormula() throws Exception {
		this.assertConverts(
				"\\widehat{f}(\\xi)=\\int_{-\\infty}^{\\infty} f(x) e^{-i 2 \\pi \\xi x} d x, \\quad \\forall \\xi \\in \\mathbb{R}",
				"hat(f)(xi) = integral_(- infinity)^infinity f(x) e^(- i 2 pi xi x) d x, quad forall xi in RR");
	}

	@Test
	void macros() throws Exception {
		assertEquals("diff^2", converter.convertWithMacros("\\d^2", "\\newcommand{\\d}{\\partial}"));
		assertEquals("(diff f)/(diff x) diff/(diff y)", converter.convertWithMacros("\\pp[f]{x} \\pp{y}", PP));
		assertEquals("(diff f [x])/(diff y)", converter.convertWithMacros("\\pp[f[x]]{y}", PP));
	}

	@Test
	void escapedHashInMacroBodyIsLiteral() throws Exception {
		assertEquals("\\# 1", converter.convertWithMacros("\\h", "\\newcommand{\\h}{\\#1}"));
	}

	@Test
	void macrosDoNotLeakBetweenCalls() throws Exception {
		assertEquals("diff^2", converter.convertWithMacros("\\d^2", "\\newcommand{\\d}{\\partial}"));
		assertEquals("d^2", converter.convert("\\d^2"));
	}

	@Test
	void shorthands() throws Exception {
		List<SymbolShorthand> shorthands = List.of(
				new SymbolShorthand("plus.minus", "+-"),
				new SymbolShorthand("integral", "int"),
				new SymbolShorthand("arrow.r.long", "-->"),
				new SymbolShorthand("arrow.r.double.long", "==>"));
		assertEquals("--> ==> +- int_a^b",
				converter.convertWithShorthands("\\longrightarrow \\Longrightarrow \\pm \\int_a^b", shorthands));
	}

	@Test
	void newlineSensitivity() throws Exception {
		this.assertConverts("a\nb", "a b");
		assertEquals("a\nb", new Tex2Typst(new ConverterOptions(false, true)).convert("a\nb"));
	}

	@Test
	void errors() {
		assertThrows(ParseException.class, () -> converter.convert("a^b^c"));
		assertThrows(ParseException.class, () -> converter.convert("a & b"));
		assertThrows(ParseException.class, () -> converter.convert("{a"));
		assertThrows(MacroException.class, () -> converter.convertWithMacros("x", "\\newcommand{\\x}{#1}"));
	}

	private void assertConverts(String tex, String expected) throws ConversionException {
		assertEquals(expected, converter.convert(tex));
	}
}
