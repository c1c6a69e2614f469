package tex2typst.ast.tex;

import java.util.List;

public record TexOrdgroup(List<TexNode> children) implements TexNode {
	public TexOrdgroup {
		children = List.copyOf(children);
	}
}
