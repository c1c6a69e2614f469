package tex2typst.print;

public enum TypstTokenType {
	ELEMENT,
	SYMBOL,
	TEXT,
	COMMENT,
	/**
	 * Writer-internal tokens such as the soft space after a script.
	 */
	CONTROL
}
