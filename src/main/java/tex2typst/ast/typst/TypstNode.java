package tex2typst.ast.typst;

/**
 * Node of the Typst math tree produced by the transformer.
 */
public sealed interface TypstNode permits TypstEmpty, TypstAtom, TypstSymbol, TypstText, TypstComment,
		TypstWhitespace, TypstNoBreakSpace, TypstGroup, TypstSupsub, TypstFuncCall, TypstFraction, TypstAlign,
		TypstMatrix, TypstUnknown {
}
