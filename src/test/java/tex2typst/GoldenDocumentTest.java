package tex2typst;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class GoldenDocumentTest {
	@Test
	void convertsSampleDocumentToExpectedTypst() throws Exception {
		Path inputPath = Path.of("src", "test", "resources", "golden", "Sample.md");
		Path expectedPath = Path.of("src", "test", "resources", "golden", "Sample.typ.md");

		String input = Files.readString(inputPath);
		String expected = Files.readString(expectedPath);
		String actual = new Tex2Typst().convertInDocument(input);

		assertEquals(normalize(expected), normalize(actual));
	}

	private static String normalize(String s) {
		String normalized = s.replace("\r\n", "\n");
		if (!normalized.endsWith("\n")) {
			normalized += "\n";
		}
		return normalized;
	}
}
