package tex2typst;

/**
 * Raised for malformed macro definitions and for invocations whose arguments
 * cannot be extracted.
 */
public class MacroException extends ConversionException {
	public MacroException(String message) {
		super(message);
	}
}
