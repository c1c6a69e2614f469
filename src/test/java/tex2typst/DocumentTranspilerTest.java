package tex2typst;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DocumentTranspilerTest {
	private final DocumentTranspiler echo = new DocumentTranspiler(tex -> "<" + tex + ">");

	@Test
	void inlineAndDisplaySpans() throws Exception {
		assertEquals("x $<a>$ and $\n<b>\n$ y", echo.transpile("x \\( a \\) and \\[b\\] y"));
	}

	@Test
	void displaySpanMayCrossLines() throws Exception {
		assertEquals("before\n$\n<a^2>\n$\nafter", echo.transpile("before\n\\[\n a^2 \n\\]\nafter"));
	}

	@Test
	void inlineSpanStaysOnOneLine() throws Exception {
		assertEquals("\\( a\nb \\)", echo.transpile("\\( a\nb \\)"));
	}

	@Test
	void textWithoutMathIsUnchanged() throws Exception {
		assertEquals("plain $ text", echo.transpile("plain $ text"));
	}

	@Test
	void realConversion() throws Exception {
		assertEquals("some text and some formula: $1/2$",
				new Tex2Typst().convertInDocument("some text and some formula: \\(\\frac{1}{2}\\)"));
	}

	@Test
	void macrosApplyToEverySpan() throws Exception {
		String converted = new Tex2Typst().convertInDocumentWithMacros("\\(\\d x\\) and \\(\\d y\\)",
				"\\newcommand{\\d}{\\partial}");
		assertEquals("$diff x$ and $diff y$", converted);
	}

	@Test
	void unknownCharacterFailsTheDocument() {
		String document = "ok \\(x\\) then \\[\\sqrt[a]{123} \\frac{a\\frac{a}{b}}{b} \\frac{a}{b} !@#@$#%\\]";
		ParseException ex = assertThrows(ParseException.class, () -> new Tex2Typst().convertInDocument(document));
		assertTrue(ex.getMessage().startsWith("Unexpected character '@'"), ex.getMessage());
	}

	@Test
	void oneBadSpanFailsTheDocument() {
		String document = "ok \\(x\\) then \\[ \\\\ \\ } {\\sqrt[a]{123} \\frac{a\\frac{a}{b}}{b} \\frac{a}{b} !@#@$#%\\]";
		assertThrows(ConversionException.class, () -> new Tex2Typst().convertInDocument(document));
	}
}
