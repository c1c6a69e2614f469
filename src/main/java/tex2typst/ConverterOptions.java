package tex2typst;

/**
 * Parser switches for one conversion.
 *
 * @param spaceSensitive   keep space runs as nodes instead of dropping them
 * @param newlineSensitive keep source line breaks and render them as target
 *                         line breaks
 */
public record ConverterOptions(boolean spaceSensitive, boolean newlineSensitive) {
	private static final ConverterOptions DEFAULTS = new ConverterOptions(false, false);

	public static ConverterOptions defaults() {
		return DEFAULTS;
	}
}
