package tex2typst.ast.typst;

import java.util.List;

public record TypstGroup(List<TypstNode> children) implements TypstNode {
	public TypstGroup {
		children = List.copyOf(children);
	}
}
