package tex2typst.parse.tex;

/**
 * How many arguments a command consumes, and of which kind.
 */
public enum CommandType {
	/** No argument. */
	SYMBOL,
	/** One mandatory argument. */
	UNARY,
	/** Two mandatory arguments. */
	BINARY,
	/** One argument, written {@code [x]}, which may be left out. */
	OPTIONAL_UNARY,
	/** An optional {@code [x]} followed by one mandatory argument. */
	OPTIONAL_BINARY;

	public int argumentCount() {
		return switch (this) {
			case SYMBOL -> 0;
			case UNARY, OPTIONAL_UNARY -> 1;
			case BINARY, OPTIONAL_BINARY -> 2;
		};
	}

	public boolean hasOptionalArgument() {
		return this == OPTIONAL_UNARY || this == OPTIONAL_BINARY;
	}

	/**
	 * Classification of a {@code \newcommand} with {@code argumentCount}
	 * parameters, the first of which has a default when {@code optionalFirst}.
	 */
	public static CommandType forMacro(int argumentCount, boolean optionalFirst) {
		return switch (argumentCount) {
			case 0 -> SYMBOL;
			case 1 -> optionalFirst ? OPTIONAL_UNARY : UNARY;
			case 2 -> optionalFirst ? OPTIONAL_BINARY : BINARY;
			default -> throw new IllegalArgumentException("Unsupported argument count: " + argumentCount);
		};
	}
}
