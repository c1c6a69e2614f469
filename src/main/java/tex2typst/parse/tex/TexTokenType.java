package tex2typst.parse.tex;

public enum TexTokenType {
	ELEMENT,
	COMMAND,
	TEXT,
	COMMENT,
	SPACE,
	NEWLINE,
	NO_BREAK_SPACE,
	CONTROL,
	UNKNOWN
}
