package tex2typst;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the math spans of a text document and leaves the rest alone.
 *
 * Inline spans {@code \( .. \)} become {@code $..$}; display spans
 * {@code \[ .. \]}, which may run over several lines, become
 * {@code $\n..\n$}. A span that fails to convert fails the whole document.
 */
public final class DocumentTranspiler {
	private static final Logger LOG = LoggerFactory.getLogger(DocumentTranspiler.class);

	private static final Pattern MATH_SPAN = Pattern.compile("\\\\\\((.+?)\\\\\\)|\\\\\\[(?s:(.+?))\\\\\\]");

	/**
	 * Converts the TeX inside one span.
	 */
	@FunctionalInterface
	public interface SpanConverter {
		String convert(String tex) throws ConversionException;
	}

	private final SpanConverter converter;

	public DocumentTranspiler(SpanConverter converter) {
		this.converter = converter;
	}

	public String transpile(String document) throws ConversionException {
		Matcher m = MATH_SPAN.matcher(document);
		StringBuilder out = new StringBuilder(document.length());
		int last = 0;
		int spans = 0;
		while (m.find()) {
			out.append(document, last, m.start());
			if (m.group(1) != null) {
				out.append('$').append(converter.convert(m.group(1).strip())).append('$');
			} else {
				out.append("$\n").append(converter.convert(m.group(2).strip())).append("\n$");
			}
			last = m.end();
			spans++;
		}
		out.append(document, last, document.length());
		LOG.debug("Converted {} math span(s)", spans);
		return out.toString();
	}
}
