package tex2typst;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces a Typst symbol spelling with a shorter one in rendered output,
 * e.g. {@code plus.minus} with {@code +-}.
 *
 * Only whole symbols are replaced: {@code arrow.r} does not touch
 * {@code arrow.r.long}, and {@code in} does not touch {@code integral}.
 */
public record SymbolShorthand(String original, String shorthand) {
	private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

	public SymbolShorthand {
		Objects.requireNonNull(original, "original");
		Objects.requireNonNull(shorthand, "shorthand");
		if (original.isEmpty()) {
			throw new IllegalArgumentException("Shorthand for an empty symbol");
		}
	}

	/**
	 * Parses {@code ORIGINAL=SHORTHAND}.
	 */
	public static SymbolShorthand parse(String text) {
		int eq = text.indexOf('=');
		if (eq <= 0) {
			throw new IllegalArgumentException("Expecting ORIGINAL=SHORTHAND but got '" + text + "'");
		}
		return new SymbolShorthand(text.substring(0, eq), text.substring(eq + 1));
	}

	public String apply(String text) {
		Pattern whole = PATTERNS.computeIfAbsent(original, SymbolShorthand::wholeSymbol);
		return whole.matcher(text).replaceAll(Matcher.quoteReplacement(shorthand));
	}

	private static Pattern wholeSymbol(String symbol) {
		return Pattern.compile("(?<![\\p{L}\\p{N}.])" + Pattern.quote(symbol) + "(?![\\p{L}\\p{N}.])");
	}

	public static String applyAll(String text, List<SymbolShorthand> shorthands) {
		String result = text;
		for (SymbolShorthand s : shorthands) {
			result = s.apply(result);
		}
		return result;
	}
}
