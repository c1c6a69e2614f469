package tex2typst.ast.typst;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code mat(...)}: rows separated by {@code ;}, columns by {@code ,}.
 */
public record TypstMatrix(List<List<TypstNode>> rows, Map<String, String> options) implements TypstNode {
	public TypstMatrix {
		rows = rows.stream().map(List::copyOf).toList();
		options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
	}
}
