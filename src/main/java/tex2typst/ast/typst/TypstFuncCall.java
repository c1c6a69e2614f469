package tex2typst.ast.typst;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code name(arg, ..., key: value)}. Named options keep insertion order.
 */
public record TypstFuncCall(String name, List<TypstNode> args, Map<String, String> options) implements TypstNode {
	public TypstFuncCall {
		args = List.copyOf(args);
		options = options.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
	}

	public TypstFuncCall(String name, List<TypstNode> args) {
		this(name, args, Map.of());
	}

	public TypstFuncCall(String name, TypstNode... args) {
		this(name, List.of(args), Map.of());
	}

	public TypstFuncCall withOption(String key, String value) {
		Map<String, String> merged = new LinkedHashMap<>(options);
		merged.put(key, value);
		return new TypstFuncCall(name, args, merged);
	}
}
