package tex2typst.cli;

import picocli.CommandLine;

/**
 * Prints a failed conversion as one line; the stack trace only with
 * {@code -Dtex2typst.debug=true}. Usage errors raised while running get the
 * usage text and the invalid-input exit code.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
	static final String DEBUG_PROPERTY = "tex2typst.debug";

	@Override
	public int handleExecutionException(Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult) {
		if (ex instanceof CommandLine.ParameterException) {
			// option combinations checked in call() are usage errors
			commandLine.getErr().println(commandLine.getColorScheme().errorText(ex.getMessage()));
			commandLine.usage(commandLine.getErr(), commandLine.getColorScheme());
			return commandLine.getCommandSpec().exitCodeOnInvalidInput();
		}
		String message = ex.getMessage();
		if (message == null || message.isBlank()) {
			message = ex.getClass().getSimpleName();
		}
		commandLine.getErr().println(commandLine.getColorScheme().errorText("error: " + message));
		if (Boolean.getBoolean(DEBUG_PROPERTY)) {
			ex.printStackTrace(commandLine.getErr());
		}
		return commandLine.getCommandSpec().exitCodeOnExecutionException();
	}
}
