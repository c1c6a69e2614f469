package tex2typst;

/**
 * Raised when a token sequence does not form a well-shaped TeX expression.
 */
public class ParseException extends ConversionException {
	public ParseException(String message) {
		super(message);
	}
}
