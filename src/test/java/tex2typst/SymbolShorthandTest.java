package tex2typst;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class SymbolShorthandTest {
	@Test
	void parse() {
		assertEquals(new SymbolShorthand("plus.minus", "+-"), SymbolShorthand.parse("plus.minus=+-"));
		assertEquals(new SymbolShorthand("eq", "=="), SymbolShorthand.parse("eq==="));
		assertThrows(IllegalArgumentException.class, () -> SymbolShorthand.parse("plus.minus"));
		assertThrows(IllegalArgumentException.class, () -> SymbolShorthand.parse("=x"));
	}

	@Test
	void replacesWholeSymbolsOnly() {
		SymbolShorthand arrow = new SymbolShorthand("arrow.r", "->");
		assertEquals("-> arrow.r.long x", arrow.apply("arrow.r arrow.r.long x"));
		assertEquals("(->)", arrow.apply("(arrow.r)"));

		SymbolShorthand in = new SymbolShorthand("in", "∈");
		assertEquals("integral ∈ x", in.apply("integral in x"));
	}

	@Test
	void sameSymbolWithDifferentShorthands() {
		assertEquals("+- x", new SymbolShorthand("plus.minus", "+-").apply("plus.minus x"));
		assertEquals("± x", new SymbolShorthand("plus.minus", "±").apply("plus.minus x"));
		assertEquals("+- +-", new SymbolShorthand("plus.minus", "+-").apply("plus.minus plus.minus"));
	}

	@Test
	void appliesInOrder() {
		List<SymbolShorthand> shorthands = List.of(
				new SymbolShorthand("arrow.r.long", "-->"),
				new SymbolShorthand("arrow.r", "->"));
		assertEquals("--> ->", SymbolShorthand.applyAll("arrow.r.long arrow.r", shorthands));
	}

	@Test
	void emptySymbolIsRejected() {
		assertThrows(IllegalArgumentException.class, () -> new SymbolShorthand("", "x"));
		assertThrows(NullPointerException.class, () -> new SymbolShorthand("x", null));
	}
}
