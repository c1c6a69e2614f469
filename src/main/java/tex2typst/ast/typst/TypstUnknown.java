package tex2typst.ast.typst;

/**
 * A command with no known Typst counterpart, passed through by name.
 */
public record TypstUnknown(String content) implements TypstNode {
}
