package tex2typst;

/**
 * Raised when a Typst tree cannot be rendered to text.
 */
public class WriteException extends ConversionException {
	public WriteException(String message) {
		super(message);
	}
}
