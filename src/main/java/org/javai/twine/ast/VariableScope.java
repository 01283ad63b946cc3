package org.javai.twine.ast;

/**
 * Scope of a variable reference, derived from its sigil.
 * <p>
 * Story variables ({@code $name}) persist for the whole playthrough; temporary
 * variables ({@code _name}) live only as long as the passage or hook that set them.
 */
public enum VariableScope {
	STORY('$'),
	TEMPORARY('_');

	private final char sigil;

	VariableScope(char sigil) {
		this.sigil = sigil;
	}

	public char sigil() {
		return sigil;
	}

	/**
	 * Returns the scope introduced by the given sigil, or {@code null} if the
	 * character is not a variable sigil.
	 */
	public static VariableScope fromSigil(char sigil) {
		for (VariableScope scope : values()) {
			if (scope.sigil == sigil) {
				return scope;
			}
		}
		return null;
	}
}
