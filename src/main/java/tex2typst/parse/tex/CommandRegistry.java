package tex2typst.parse.tex;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Arity table for TeX commands: a fixed built-in set plus the macros defined
 * for the current conversion.
 *
 * Names are stored without the leading backslash. Anything unknown is a
 * symbol.
 */
public final class CommandRegistry {
	static final Set<String> UNARY_COMMANDS = Set.of(
			"text",
			"bar",
			"bold",
			"boldsymbol",
			"ddot",
			"dot",
			"hat",
			"mathbb",
			"mathbf",
			"mathcal",
			"mathfrak",
			"mathit",
			"mathrm",
			"mathscr",
			"mathsf",
			"mathtt",
			"operatorname",
			"overbrace",
			"overline",
			"pmb",
			"rm",
			"tilde",
			"underbrace",
			"underline",
			"vec",
			"overrightarrow",
			"widehat",
			"widetilde",
			"floor");

	static final Set<String> BINARY_COMMANDS = Set.of(
			"frac", "tfrac", "binom", "dbinom", "dfrac", "tbinom", "overset");

	static final Set<String> OPTIONAL_BINARY_COMMANDS = Set.of("sqrt");

	private final Map<String, CommandType> customCommands = new HashMap<>();

	public CommandType commandType(String name) {
		if (UNARY_COMMANDS.contains(name)) {
			return CommandType.UNARY;
		}
		if (BINARY_COMMANDS.contains(name)) {
			return CommandType.BINARY;
		}
		if (OPTIONAL_BINARY_COMMANDS.contains(name)) {
			return CommandType.OPTIONAL_BINARY;
		}
		return customCommands.getOrDefault(name, CommandType.SYMBOL);
	}

	/**
	 * Registers or re-classifies a custom command; the last registration wins.
	 */
	public void register(String name, CommandType type) {
		customCommands.put(name, type);
	}
}
