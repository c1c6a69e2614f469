package tex2typst;

/**
 * Base of every failure raised while translating TeX math into Typst.
 *
 * Each pipeline stage throws its own subclass; callers that only care about
 * success or failure catch this type.
 */
public class ConversionException extends Exception {
	public ConversionException(String message) {
		super(message);
	}

	public ConversionException(String message, Throwable cause) {
		super(message, cause);
	}
}
