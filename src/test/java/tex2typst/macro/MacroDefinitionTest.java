package tex2typst.macro;

import org.junit.jupiter.api.Test;
import tex2typst.parse.tex.CommandType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class MacroDefinitionTest {
	@Test
	void substituteKeepsCommandNamesApart() {
		MacroDefinition macro = new MacroDefinition("dd", CommandType.UNARY, null, "\\partial#1");
		assertEquals("\\partial x", macro.substitute(List.of("x")));
		assertEquals("\\partial2", macro.substitute(List.of("2")));
	}

	@Test
	void substituteSeparatesArgumentFromFollowingLetters() {
		MacroDefinition macro = new MacroDefinition("g", CommandType.UNARY, null, "#1x");
		assertEquals("\\alpha x", macro.substitute(List.of("\\alpha")));
		assertEquals("ax", macro.substitute(List.of("a")));
	}

	@Test
	void placeholdersCanRepeat() {
		MacroDefinition macro = new MacroDefinition("sq", CommandType.UNARY, null, "#1 #1");
		assertEquals("y y", macro.substitute(List.of("y")));
	}

	@Test
	void escapedHashIsNotAPlaceholder() {
		MacroDefinition hash = MacroDefinition.symbol("h", "\\#1");
		assertEquals("\\#1", hash.substitute(List.of()));

		MacroDefinition mixed = new MacroDefinition("m", CommandType.UNARY, null, "\\#1 #1");
		assertEquals("\\#1 x", mixed.substitute(List.of("x")));

		MacroDefinition afterLineBreak = new MacroDefinition("n", CommandType.UNARY, null, "\\\\#1");
		assertEquals("\\\\x", afterLineBreak.substitute(List.of("x")));
	}

	@Test
	void wrongArgumentCount() {
		MacroDefinition macro = new MacroDefinition("pair", CommandType.BINARY, null, "#1,#2");
		assertThrows(IllegalArgumentException.class, () -> macro.substitute(List.of("a")));
	}

	@Test
	void definitionIsValidated() {
		assertThrows(IllegalArgumentException.class,
				() -> new MacroDefinition("x", CommandType.SYMBOL, null, "#1"));
		assertThrows(IllegalArgumentException.class,
				() -> new MacroDefinition("x", CommandType.OPTIONAL_UNARY, null, "#1"));
		assertThrows(IllegalArgumentException.class,
				() -> new MacroDefinition("x", CommandType.UNARY, "d", "#1"));
	}

	@Test
	void highestPlaceholder() {
		assertEquals(0, MacroDefinition.highestPlaceholder("\\alpha"));
		assertEquals(2, MacroDefinition.highestPlaceholder("#2 + #1"));
		assertEquals(-1, MacroDefinition.highestPlaceholder("#0"));
		assertEquals(0, MacroDefinition.highestPlaceholder("\\#2"));
		assertEquals(2, MacroDefinition.highestPlaceholder("\\\\#2"));
	}
}
