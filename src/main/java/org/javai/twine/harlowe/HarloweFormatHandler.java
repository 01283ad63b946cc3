package org.javai.twine.harlowe;

import java.util.List;
import java.util.Locale;
import org.javai.twine.PassageParser;
import org.javai.twine.ast.Node;
import org.javai.twine.harlowe.config.HarloweParserConfig;
import org.javai.twine.harlowe.config.HarloweParserConfigLoader;
import org.javai.twine.harlowe.macro.DefaultMacroRegistry;
import org.javai.twine.harlowe.macro.MacroRegistry;

/**
 * Entry point for Harlowe story formats: identifies the format and parses its
 * passages.
 *
 * <pre>{@code
 * HarloweFormatHandler handler = HarloweFormatHandler.create();
 * handler.registry().register("cycling-link", myTranslator);
 * List<Node> nodes = handler.parsePassage("(set: $gold to 10)You have $gold gold.");
 * }</pre>
 */
public class HarloweFormatHandler implements PassageParser {

	public static final String FORMAT_NAME = "harlowe";
	public static final List<String> SUPPORTED_VERSIONS = List.of("3.0", "3.1", "3.2", "3.3");

	private final MacroRegistry registry;
	private final MacroScanner scanner;

	public HarloweFormatHandler(MacroRegistry registry, HarloweParserConfig config) {
		this.registry = registry;
		this.scanner = new MacroScanner(registry, config);
	}

	/**
	 * Creates a handler with the bundled configuration and the standard macros.
	 */
	public static HarloweFormatHandler create() {
		return create(new HarloweParserConfigLoader().loadDefault());
	}

	public static HarloweFormatHandler create(HarloweParserConfig config) {
		return new HarloweFormatHandler(DefaultMacroRegistry.standard(config), config);
	}

	@Override
	public List<Node> parsePassage(String text) {
		return scanner.parsePassage(text);
	}

	public String formatName() {
		return FORMAT_NAME;
	}

	public List<String> supportedVersions() {
		return SUPPORTED_VERSIONS;
	}

	/**
	 * Returns true if a story format name, such as {@code "Harlowe"} or
	 * {@code "harlowe-3"}, denotes this format.
	 */
	public boolean detect(String formatName) {
		return formatName != null && formatName.strip().toLowerCase(Locale.ROOT).startsWith(FORMAT_NAME);
	}

	/**
	 * Returns true if the version is one of the supported major.minor releases.
	 * Patch levels are ignored, so {@code "3.3.8"} is supported.
	 */
	public boolean isVersionSupported(String version) {
		if (version == null) {
			return false;
		}
		String[] parts = version.strip().split("\\.");
		if (parts.length < 2) {
			return false;
		}
		return SUPPORTED_VERSIONS.contains(parts[0] + "." + parts[1]);
	}

	/**
	 * The registry used for translation; register translators here to support
	 * additional macros.
	 */
	public MacroRegistry registry() {
		return registry;
	}
}
