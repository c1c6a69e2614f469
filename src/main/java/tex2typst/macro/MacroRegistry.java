package tex2typst.macro;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tex2typst.MacroException;
import tex2typst.TokenizeException;
import tex2typst.parse.tex.CommandRegistry;
import tex2typst.parse.tex.TexToken;
import tex2typst.parse.tex.TexTokenType;
import tex2typst.parse.tex.TexTokenizer;
import tex2typst.parse.tex.TexTokens;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The macros of one conversion, and the expander that substitutes them.
 *
 * Registering a macro also classifies its name in the {@link CommandRegistry}
 * handed to the parser. Expansion is applicative-order: arguments are
 * expanded first, substituted into the body as text, and the result is
 * tokenized and expanded again. A macro that keeps invoking itself never
 * terminates.
 */
public final class MacroRegistry {
	private static final Logger LOG = LoggerFactory.getLogger(MacroRegistry.class);

	private final Map<String, MacroDefinition> macros = new HashMap<>();
	private final CommandRegistry commands;
	private final TexTokenizer tokenizer = new TexTokenizer();

	public MacroRegistry() {
		this(new CommandRegistry());
	}

	public MacroRegistry(CommandRegistry commands) {
		this.commands = commands;
	}

	public CommandRegistry commands() {
		return commands;
	}

	public void register(MacroDefinition macro) {
		MacroDefinition previous = macros.put(macro.name(), macro);
		commands.register(macro.name(), macro.type());
		if (previous != null) {
			LOG.debug("Redefined macro \\{} as {}", macro.name(), macro.type());
		} else {
			LOG.debug("Defined macro \\{} as {}", macro.name(), macro.type());
		}
	}

	public void registerAll(Collection<MacroDefinition> definitions) {
		for (MacroDefinition macro : definitions) {
			register(macro);
		}
	}

	public Optional<MacroDefinition> lookup(String name) {
		return Optional.ofNullable(macros.get(name));
	}

	public boolean isEmpty() {
		return macros.isEmpty();
	}

	/**
	 * Returns {@code tokens} with every macro invocation replaced by its
	 * expansion. The input list is not modified.
	 */
	public List<TexToken> expand(List<TexToken> tokens) throws MacroException, TokenizeException {
		List<TexToken> out = new ArrayList<>(tokens.size());
		int i = 0;
		while (i < tokens.size()) {
			TexToken token = tokens.get(i);
			MacroDefinition macro = token.type() == TexTokenType.COMMAND ? macros.get(token.commandName()) : null;
			if (macro == null) {
				out.add(token);
				i++;
				continue;
			}

			List<String> args = new ArrayList<>();
			i = readArguments(tokens, i + 1, macro, args);
			String text = macro.substitute(args);
			LOG.debug("Expanding {} to {}", token.text(), text);

			List<TexToken> replacement = new ArrayList<>();
			for (TexToken t : tokenizer.tokenize(text)) {
				replacement.add(t.withSpan(token.span()));
			}
			out.addAll(expand(replacement));
		}
		return out;
	}

	private int readArguments(List<TexToken> tokens, int start, MacroDefinition macro, List<String> args)
			throws MacroException, TokenizeException {
		int pos = start;
		int mandatory = macro.type().argumentCount();

		if (macro.type().hasOptionalArgument()) {
			mandatory--;
			if (pos < tokens.size() && tokens.get(pos).isElement("[")) {
				int close = TexTokens.findClosing(tokens, pos, TexTokens.LEFT_BRACKET, TexTokens.RIGHT_BRACKET);
				if (close < 0) {
					throw new MacroException("Unmatched '[' in arguments of \\" + macro.name());
				}
				args.add(render(expand(tokens.subList(pos + 1, close))));
				pos = close + 1;
			} else {
				args.add(macro.defaultValue());
			}
		}

		for (int k = 0; k < mandatory; k++) {
			pos = TexTokens.skipWhitespace(tokens, pos);
			if (pos >= tokens.size() || !tokens.get(pos).isControl("{")) {
				throw new MacroException("Expecting '{' for argument " + (args.size() + 1) + " of \\" + macro.name());
			}
			int close = TexTokens.findClosing(tokens, pos, TexTokens.LEFT_BRACE, TexTokens.RIGHT_BRACE);
			if (close < 0) {
				throw new MacroException("Unmatched '{' in arguments of \\" + macro.name());
			}
			args.add(render(expand(tokens.subList(pos + 1, close))));
			pos = close + 1;
		}
		return pos;
	}

	static String render(List<TexToken> tokens) {
		StringBuilder sb = new StringBuilder();
		for (TexToken t : tokens) {
			MacroDefinition.appendSeparated(sb, t.toSource());
		}
		return sb.toString();
	}
}
