package org.javai.twine.harlowe.macro;

import java.util.Optional;
import java.util.Set;

/**
 * Name-keyed table of macro translators. Registration is the only extension
 * point: supporting a new macro needs no change to the scanner.
 * <p>
 * Populate the registry before scanning starts; lookups during scanning never
 * modify it.
 */
public interface MacroRegistry {

	/**
	 * Registers a translator under a macro name, replacing any existing one.
	 *
	 * @return this registry for chaining
	 */
	MacroRegistry register(String name, MacroTranslator translator);

	/**
	 * Makes {@code alias} resolve to whatever is registered under {@code target}.
	 *
	 * @return this registry for chaining
	 */
	MacroRegistry alias(String alias, String target);

	/**
	 * Looks up the translator for a macro name, following aliases.
	 */
	Optional<MacroTranslator> lookup(String name);

	/**
	 * Returns true if a translator or alias exists for the name.
	 */
	default boolean isRegistered(String name) {
		return lookup(name).isPresent();
	}

	/**
	 * Normalised names of all directly registered translators.
	 */
	Set<String> names();
}
