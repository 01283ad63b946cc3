package org.javai.twine.harlowe.macro;

/**
 * A group of translators that registers itself into a registry.
 */
public interface MacroSet {

	void registerInto(MacroRegistry registry);
}
