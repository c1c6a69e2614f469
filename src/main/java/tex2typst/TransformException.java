package tex2typst;

/**
 * Raised when a TeX tree has no Typst counterpart.
 */
public class TransformException extends ConversionException {
	public TransformException(String message) {
		super(message);
	}
}
