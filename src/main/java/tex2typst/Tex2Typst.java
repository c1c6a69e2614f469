package tex2typst;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tex2typst.ast.tex.TexNode;
import tex2typst.ast.typst.TypstNode;
import tex2typst.macro.MacroDefinition;
import tex2typst.macro.MacroDefinitionParser;
import tex2typst.macro.MacroRegistry;
import tex2typst.parse.tex.TexParser;
import tex2typst.parse.tex.TexToken;
import tex2typst.parse.tex.TexTokenizer;
import tex2typst.print.TypstWriter;
import tex2typst.transform.TexToTypstTransformer;

import java.util.List;

/**
 * Entry points: TeX math in, Typst math out.
 *
 * Each call runs the whole pipeline (tokenize, expand macros, parse,
 * transform, write) with its own macro table, so one instance can be shared
 * between threads.
 */
public final class Tex2Typst {
	private static final Logger LOG = LoggerFactory.getLogger(Tex2Typst.class);

	private final ConverterOptions options;

	public Tex2Typst() {
		this(ConverterOptions.defaults());
	}

	public Tex2Typst(ConverterOptions options) {
		this.options = options;
	}

	public String convert(String tex) throws ConversionException {
		return run(tex, List.of(), List.of());
	}

	/**
	 * Converts {@code tex} after expanding the {@code \newcommand} statements in
	 * {@code macroDefinitions}.
	 */
	public String convertWithMacros(String tex, String macroDefinitions) throws ConversionException {
		return run(tex, parseMacros(macroDefinitions), List.of());
	}

	public String convertWithShorthands(String tex, List<SymbolShorthand> shorthands) throws ConversionException {
		return run(tex, List.of(), shorthands);
	}

	/**
	 * Full form of {@link #convert}; {@code macroDefinitions} may be null.
	 */
	public String convert(String tex, String macroDefinitions, List<SymbolShorthand> shorthands)
			throws ConversionException {
		return run(tex, parseMacros(macroDefinitions), shorthands);
	}

	public String convertInDocument(String document) throws ConversionException {
		return convertInDocument(document, null, List.of());
	}

	public String convertInDocumentWithMacros(String document, String macroDefinitions) throws ConversionException {
		return convertInDocument(document, macroDefinitions, List.of());
	}

	public String convertInDocumentWithShorthands(String document, List<SymbolShorthand> shorthands)
			throws ConversionException {
		return convertInDocument(document, null, shorthands);
	}

	/**
	 * Full form of {@link #convertInDocument}; the macro definitions are read
	 * once and every span gets a fresh table built from them.
	 */
	public String convertInDocument(String document, String macroDefinitions, List<SymbolShorthand> shorthands)
			throws ConversionException {
		List<MacroDefinition> macros = parseMacros(macroDefinitions);
		return new DocumentTranspiler(tex -> run(tex, macros, shorthands)).transpile(document);
	}

	private static List<MacroDefinition> parseMacros(String macroDefinitions) throws MacroException {
		if (macroDefinitions == null || macroDefinitions.isBlank()) {
			return List.of();
		}
		return new MacroDefinitionParser().parse(macroDefinitions);
	}

	private String run(String tex, List<MacroDefinition> macros, List<SymbolShorthand> shorthands)
			throws ConversionException {
		List<TexToken> tokens = new TexTokenizer().tokenize(tex);

		MacroRegistry registry = new MacroRegistry();
		registry.registerAll(macros);
		if (!registry.isEmpty()) {
			tokens = registry.expand(tokens);
		}

		TexNode tree = new TexParser(options, registry.commands()).parse(tokens);
		TypstNode typst = new TexToTypstTransformer().transform(tree);

		TypstWriter writer = new TypstWriter();
		writer.serialize(typst);
		String result = SymbolShorthand.applyAll(writer.finish(), shorthands);
		LOG.debug("Converted '{}' to '{}'", tex, result);
		return result;
	}
}
