package tex2typst.ast.typst;

import java.util.List;

/**
 * Aligned equations: rows separated by line breaks, columns by {@code &}.
 */
public record TypstAlign(List<List<TypstNode>> rows) implements TypstNode {
	public TypstAlign {
		rows = rows.stream().map(List::copyOf).toList();
	}
}
