package org.javai.twine.harlowe.macro;

import java.util.Locale;

/**
 * Macro name normalisation shared by registration and lookup. Names are
 * case-insensitive and ignore {@code -} and {@code _}, so {@code else-if},
 * {@code elseif} and {@code Else_If} are the same macro.
 */
public final class MacroNames {

	private MacroNames() {
		// Utility class - no instantiation
	}

	public static String normalize(String name) {
		if (name == null) {
			return "";
		}
		StringBuilder sb = new StringBuilder(name.length());
		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);
			if (c != '-' && c != '_' && !Character.isWhitespace(c)) {
				sb.append(c);
			}
		}
		return sb.toString().toLowerCase(Locale.ROOT);
	}
}
