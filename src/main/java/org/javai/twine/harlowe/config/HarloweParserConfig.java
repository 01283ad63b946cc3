package org.javai.twine.harlowe.config;

import java.util.Map;

/**
 * Settings for passage parsing.
 *
 * @param maxNestingDepth how deep hooks and nested macro calls may nest before the
 *        scanner replaces the excess with an {@code Error} node
 * @param aliases alternative macro names mapped to the registered name they stand for
 */
public record HarloweParserConfig(int maxNestingDepth, Map<String, String> aliases) {

	public static final int DEFAULT_MAX_NESTING_DEPTH = 64;

	public HarloweParserConfig {
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("maxNestingDepth must be >= 1, was " + maxNestingDepth);
		}
		aliases = aliases != null ? Map.copyOf(aliases) : Map.of();
	}

	/**
	 * Built-in defaults, used when no configuration resource is present.
	 */
	public static HarloweParserConfig defaults() {
		return new HarloweParserConfig(DEFAULT_MAX_NESTING_DEPTH, Map.of(
				"array", "a",
				"datamap", "dm",
				"dataset", "ds",
				"elsif", "else-if",
				"link-reveal", "link"));
	}

	public HarloweParserConfig withMaxNestingDepth(int depth) {
		return new HarloweParserConfig(depth, aliases);
	}
}
