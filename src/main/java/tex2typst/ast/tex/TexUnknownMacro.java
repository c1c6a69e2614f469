package tex2typst.ast.tex;

/**
 * Argument-less command the symbol table does not know. Kept so the converter
 * can still pass its bare name through.
 */
public record TexUnknownMacro(String name) implements TexNode {
}
