package tex2typst.ast.tex;

/**
 * Node of the TeX syntax tree. Every node owns its children; trees are never
 * shared or mutated after construction.
 */
public sealed interface TexNode permits TexElement, TexText, TexComment, TexWhitespace, TexNoBreakSpace, TexControl,
		TexOrdgroup, TexSupSub, TexUnaryFunc, TexBinaryFunc, TexOptionalBinaryFunc, TexLeftRight, TexBeginEnd,
		TexSymbol, TexUnknownMacro, TexEmpty {
}
