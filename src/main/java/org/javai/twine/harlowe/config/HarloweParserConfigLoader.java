package org.javai.twine.harlowe.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads {@link HarloweParserConfig} from YAML.
 * <p>
 * Expected layout:
 * <pre>
 * parser:
 *   max_nesting_depth: 64
 * macros:
 *   aliases:
 *     array: a
 * </pre>
 * Missing sections fall back to {@link HarloweParserConfig#defaults()}. A present
 * {@code aliases} section replaces the default aliases.
 */
public class HarloweParserConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(HarloweParserConfigLoader.class);

	public static final String DEFAULT_RESOURCE = "META-INF/harlowe-parser.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Loads the configuration bundled on the classpath, or the built-in defaults if
	 * the resource is absent.
	 */
	public HarloweParserConfig loadDefault() {
		ClassLoader loader = HarloweParserConfigLoader.class.getClassLoader();
		if (loader.getResource(DEFAULT_RESOURCE) == null) {
			logger.warn("Resource {} not found; using built-in parser defaults", DEFAULT_RESOURCE);
			return HarloweParserConfig.defaults();
		}
		return loadResource(DEFAULT_RESOURCE, loader);
	}

	/**
	 * Loads configuration from a classpath resource.
	 *
	 * @throws IllegalArgumentException if the resource cannot be found
	 * @throws HarloweConfigException if the resource cannot be parsed
	 */
	public HarloweParserConfig loadResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new IllegalArgumentException("Resource not found: " + resourcePath);
			}
			return load(is);
		} catch (IllegalArgumentException | HarloweConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new HarloweConfigException("Failed to load parser configuration from resource: " + resourcePath, e);
		}
	}

	public HarloweParserConfig load(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		try (Reader reader = Files.newBufferedReader(path)) {
			return build(yaml.load(reader));
		} catch (HarloweConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new HarloweConfigException("Failed to load parser configuration from path: " + path, e);
		}
	}

	public HarloweParserConfig load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (HarloweConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new HarloweConfigException("Failed to load parser configuration from input stream", e);
		}
	}

	public HarloweParserConfig loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (HarloweConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new HarloweConfigException("Failed to load parser configuration from string", e);
		}
	}

	private HarloweParserConfig build(Object document) {
		HarloweParserConfig defaults = HarloweParserConfig.defaults();
		if (document == null) {
			return defaults;
		}
		Map<String, Object> root = asMap(document, "document root");

		int maxDepth = defaults.maxNestingDepth();
		Map<String, Object> parser = asMap(root.get("parser"), "parser");
		Object depthValue = parser.get("max_nesting_depth");
		if (depthValue != null) {
			if (!(depthValue instanceof Number number)) {
				throw new HarloweConfigException("parser.max_nesting_depth must be a number, was: " + depthValue);
			}
			maxDepth = number.intValue();
		}

		Map<String, String> aliases = defaults.aliases();
		Map<String, Object> macros = asMap(root.get("macros"), "macros");
		if (macros.containsKey("aliases")) {
			aliases = new LinkedHashMap<>();
			for (Map.Entry<String, Object> entry : asMap(macros.get("aliases"), "macros.aliases").entrySet()) {
				aliases.put(entry.getKey(), String.valueOf(entry.getValue()));
			}
		}

		try {
			return new HarloweParserConfig(maxDepth, aliases);
		} catch (IllegalArgumentException e) {
			throw new HarloweConfigException("Invalid parser configuration: " + e.getMessage(), e);
		}
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> asMap(Object value, String section) {
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map)) {
			throw new HarloweConfigException("Section '" + section + "' must be a mapping");
		}
		Map<String, Object> result = new LinkedHashMap<>();
		((Map<Object, Object>) value).forEach((k, v) -> result.put(String.valueOf(k), v));
		return result;
	}
}
