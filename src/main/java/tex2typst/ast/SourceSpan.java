package tex2typst.ast;

/**
 * Source span for diagnostics.
 *
 * Offsets are 0-based character indices into the text that was tokenized.
 */
public record SourceSpan(int startOffset, int endOffset) {
	public static final SourceSpan NONE = new SourceSpan(-1, -1);

	public boolean isKnown() {
		return startOffset >= 0;
	}

	public String describe() {
		return isKnown() ? " at offset " + startOffset : "";
	}
}
