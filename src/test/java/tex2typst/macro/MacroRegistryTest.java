package tex2typst.macro;

import org.junit.jupiter.api.Test;
import tex2typst.ConversionException;
import tex2typst.MacroException;
import tex2typst.ast.SourceSpan;
import tex2typst.parse.tex.CommandType;
import tex2typst.parse.tex.TexToken;
import tex2typst.parse.tex.TexTokenizer;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MacroRegistryTest {
	private static MacroRegistry registry(String definitions) throws MacroException {
		MacroRegistry registry = new MacroRegistry();
		registry.registerAll(new MacroDefinitionParser().parse(definitions));
		return registry;
	}

	private static String expand(MacroRegistry registry, String tex) throws ConversionException {
		return MacroRegistry.render(registry.expand(new TexTokenizer().tokenize(tex)));
	}

	@Test
	void symbolMacro() throws Exception {
		assertEquals("\\partial^2", expand(registry("\\newcommand{\\d}{\\partial}"), "\\d^2"));
	}

	@Test
	void optionalArgumentAndDefault() throws Exception {
		MacroRegistry registry = registry("\\newcommand{\\pp}[2][]{\\frac{\\partial #1}{\\partial #2}}");
		assertEquals("\\frac{\\partial f}{\\partial x}", expand(registry, "\\pp[f]{x}"));
		assertEquals("\\frac{\\partial }{\\partial y}", expand(registry, "\\pp{y}"));
		assertEquals("\\frac{\\partial f[x]}{\\partial y}", expand(registry, "\\pp[f[x]]{y}"));
	}

	@Test
	void escapedHashSurvivesExpansion() throws Exception {
		assertEquals("\\#1", expand(registry("\\newcommand{\\h}{\\#1}"), "\\h"));
	}

	@Test
	void mandatoryArgumentsMaySkipWhitespace() throws Exception {
		MacroRegistry registry = registry("\\newcommand{\\pair}[2]{(#1, #2)}");
		assertEquals("(a, b)", expand(registry, "\\pair {a} {b}"));
	}

	@Test
	void expansionIsRecursive() throws Exception {
		MacroRegistry registry = registry("\\newcommand{\\R}{\\mathbb{R}}\n\\newcommand{\\RR}{\\R^2}");
		assertEquals("\\mathbb{R}^2", expand(registry, "\\RR"));
	}

	@Test
	void argumentsAreExpandedBeforeSubstitution() throws Exception {
		MacroRegistry registry = registry("\\newcommand{\\d}{\\partial}\n\\newcommand{\\sq}[1]{#1^2}");
		assertEquals("\\partial^2", expand(registry, "\\sq{\\d}"));
	}

	@Test
	void expandingTwiceChangesNothing() throws Exception {
		MacroRegistry registry = registry("\\newcommand{\\d}{\\partial}");
		List<TexToken> once = registry.expand(new TexTokenizer().tokenize("\\d x + \\alpha"));
		assertEquals(MacroRegistry.render(once), MacroRegistry.render(registry.expand(once)));
	}

	@Test
	void expandedTokensPointAtTheInvocation() throws Exception {
		MacroRegistry registry = registry("\\newcommand{\\d}{\\partial}");
		List<TexToken> tokens = registry.expand(new TexTokenizer().tokenize("x \\d"));
		TexToken last = tokens.get(tokens.size() - 1);
		assertEquals("\\partial", last.text());
		assertEquals(new SourceSpan(2, 4), last.span());
	}

	@Test
	void registrationClassifiesCommands() throws Exception {
		MacroRegistry registry = registry("\\newcommand{\\pp}[2][]{#1#2}\n\\newcommand{\\d}{\\partial}");
		assertEquals(CommandType.OPTIONAL_BINARY, registry.commands().commandType("pp"));
		assertEquals(CommandType.SYMBOL, registry.commands().commandType("d"));
		assertTrue(registry.lookup("pp").isPresent());
	}

	@Test
	void laterDefinitionWins() throws Exception {
		MacroRegistry registry = registry("\\newcommand{\\x}{a}\n\\renewcommand{\\x}{b}");
		assertEquals("b", expand(registry, "\\x"));
	}

	@Test
	void missingArguments() throws Exception {
		MacroRegistry registry = registry("\\newcommand{\\pp}[2][]{#1#2}");
		MacroException missing = assertThrows(MacroException.class, () -> expand(registry, "\\pp"));
		assertEquals("Expecting '{' for argument 2 of \\pp", missing.getMessage());

		MacroException unmatched = assertThrows(MacroException.class, () -> expand(registry, "\\pp{x"));
		assertEquals("Unmatched '{' in arguments of \\pp", unmatched.getMessage());

		MacroException bracket = assertThrows(MacroException.class, () -> expand(registry, "\\pp[x{y}"));
		assertEquals("Unmatched '[' in arguments of \\pp", bracket.getMessage());
	}
}
