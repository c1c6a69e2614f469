package tex2typst.cli;

import picocli.CommandLine;
import tex2typst.ConverterOptions;
import tex2typst.SymbolShorthand;
import tex2typst.Tex2Typst;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(
		name = "tex2typst",
		description = "Convert LaTeX math to Typst math.",
		mixinStandardHelpOptions = true,
		versionProvider = VersionProvider.class)
final class Tex2TypstCommand implements Callable<Integer> {
	private static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

	@CommandLine.Spec
	private CommandLine.Model.CommandSpec spec;

	@CommandLine.Parameters(
			index = "0",
			arity = "0..1",
			paramLabel = "FILE",
			description = "Input file; standard input when omitted.")
	private Path input;

	@CommandLine.Option(
			names = { "-e", "--expression" },
			paramLabel = "TEX",
			description = "Convert this expression instead of reading FILE.")
	private String expression;

	@CommandLine.Option(
			names = { "-d", "--document" },
			description = "Treat the input as a document and convert its \\( \\) and \\[ \\] spans.")
	private boolean document;

	@CommandLine.Option(
			names = { "-m", "--macros" },
			paramLabel = "FILE",
			description = "File of \\newcommand definitions to expand.")
	private Path macros;

	@CommandLine.Option(
			names = { "-s", "--shorthand" },
			paramLabel = "ORIGINAL=SHORTHAND",
			description = "Replace a Typst symbol in the output, e.g. plus.minus=+-. Repeatable.")
	private List<String> shorthands = new ArrayList<>();

	@CommandLine.Option(names = "--space-sensitive", description = "Keep spaces from the source.")
	private boolean spaceSensitive;

	@CommandLine.Option(names = "--newline-sensitive", description = "Keep line breaks from the source.")
	private boolean newlineSensitive;

	@CommandLine.Option(names = { "-v", "--verbose" }, description = "Log each conversion step.")
	private boolean verbose;

	@Override
	public Integer call() throws Exception {
		if (verbose) {
			// must happen before the first logger is created
			System.setProperty(LOG_LEVEL_PROPERTY, "debug");
		}
		if (expression != null && input != null) {
			throw new CommandLine.ParameterException(spec.commandLine(), "Give either FILE or --expression, not both.");
		}

		List<SymbolShorthand> parsedShorthands = new ArrayList<>();
		for (String s : shorthands) {
			try {
				parsedShorthands.add(SymbolShorthand.parse(s));
			} catch (IllegalArgumentException ex) {
				throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage(), ex);
			}
		}

		String source = expression != null ? expression : readInput();
		String macroDefinitions = macros == null ? null : Files.readString(macros, StandardCharsets.UTF_8);

		Tex2Typst converter = new Tex2Typst(new ConverterOptions(spaceSensitive, newlineSensitive));
		String result = document
				? converter.convertInDocument(source, macroDefinitions, parsedShorthands)
				: converter.convert(source.strip(), macroDefinitions, parsedShorthands);

		spec.commandLine().getOut().println(result);
		spec.commandLine().getOut().flush();
		return 0;
	}

	private String readInput() throws IOException {
		if (input != null) {
			return Files.readString(input, StandardCharsets.UTF_8);
		}
		InputStream in = System.in;
		return new String(in.readAllBytes(), StandardCharsets.UTF_8);
	}
}
