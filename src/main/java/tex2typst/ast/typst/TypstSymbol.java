package tex2typst.ast.typst;

/**
 * A named Typst symbol such as {@code plus.minus} or {@code alpha}.
 */
public record TypstSymbol(String name) implements TypstNode {
}
