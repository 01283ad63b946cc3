package org.javai.twine.harlowe.macro;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.javai.twine.harlowe.config.HarloweParserConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default implementation of {@link MacroRegistry}.
 *
 * <p>Translators and aliases are keyed by normalised macro name (see
 * {@link MacroNames}). Alias resolution happens at lookup time, so an alias may be
 * declared before its target is registered.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Backed by concurrent maps: a registration completes before any lookup that
 * observes it, so scanners on other threads may read while a plugin registers.</p>
 */
public class DefaultMacroRegistry implements MacroRegistry {

	private static final Logger logger = LoggerFactory.getLogger(DefaultMacroRegistry.class);

	private final Map<String, MacroTranslator> translators = new ConcurrentHashMap<>();
	private final Map<String, String> aliases = new ConcurrentHashMap<>();

	/**
	 * Creates a registry holding the core and advanced macro sets plus the aliases
	 * from the given configuration.
	 */
	public static DefaultMacroRegistry standard(HarloweParserConfig config) {
		DefaultMacroRegistry registry = new DefaultMacroRegistry();
		new CoreMacros().registerInto(registry);
		new AdvancedMacros().registerInto(registry);
		config.aliases().forEach(registry::alias);
		logger.debug("Standard registry ready with {} translators and {} aliases",
				registry.translators.size(), registry.aliases.size());
		return registry;
	}

	@Override
	public DefaultMacroRegistry register(String name, MacroTranslator translator) {
		if (translator == null) {
			throw new IllegalArgumentException("translator must not be null");
		}
		String key = requireName(name);
		if (translators.put(key, translator) != null) {
			logger.debug("Replaced translator for macro '{}'", key);
		}
		else {
			logger.debug("Registered translator for macro '{}'", key);
		}
		return this;
	}

	@Override
	public DefaultMacroRegistry alias(String alias, String target) {
		String aliasKey = requireName(alias);
		String targetKey = requireName(target);
		if (aliasKey.equals(targetKey)) {
			throw new IllegalArgumentException("Macro '" + alias + "' cannot be an alias of itself");
		}
		aliases.put(aliasKey, targetKey);
		logger.debug("Registered alias '{}' -> '{}'", aliasKey, targetKey);
		return this;
	}

	@Override
	public Optional<MacroTranslator> lookup(String name) {
		String key = MacroNames.normalize(name);
		MacroTranslator translator = translators.get(key);
		if (translator == null) {
			String target = aliases.get(key);
			if (target != null) {
				translator = translators.get(target);
			}
		}
		return Optional.ofNullable(translator);
	}

	@Override
	public Set<String> names() {
		return Set.copyOf(translators.keySet());
	}

	/**
	 * Gets the number of directly registered translators.
	 */
	public int translatorCount() {
		return translators.size();
	}

	private static String requireName(String name) {
		String key = MacroNames.normalize(name);
		if (key.isEmpty()) {
			throw new IllegalArgumentException("Macro name must not be blank");
		}
		return key;
	}
}
