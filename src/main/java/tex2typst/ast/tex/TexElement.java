package tex2typst.ast.tex;

/**
 * A letter, a digit run, punctuation, or an escaped character such as {@code \{}.
 */
public record TexElement(String content) implements TexNode {
}
