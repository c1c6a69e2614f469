package tex2typst.ast.tex;

import java.util.List;

/**
 * An environment and its cells, row-major. Rows may have different lengths.
 */
public record TexBeginEnd(String name, List<List<TexNode>> rows) implements TexNode {
	public TexBeginEnd {
		rows = rows.stream().map(List::copyOf).toList();
	}
}
