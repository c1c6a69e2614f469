package tex2typst.cli;

import picocli.CommandLine;

final class VersionProvider implements CommandLine.IVersionProvider {
	@Override
	public String[] getVersion() {
		String implementationVersion = Main.class.getPackage().getImplementationVersion();
		String version = implementationVersion != null ? implementationVersion : "development";
		return new String[] { "tex2typst " + version };
	}
}
