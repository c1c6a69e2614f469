package tex2typst;

/**
 * Raised by the tokenizer when the raw TeX text cannot be split into tokens.
 */
public class TokenizeException extends ConversionException {
	public TokenizeException(String message) {
		super(message);
	}
}
