package org.javai.twine.harlowe;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * Nesting- and string-aware searches over raw passage text.
 * <p>
 * Inside a quoted string ({@code "..."} or {@code '...'}) delimiters are inert; a
 * backslash escapes the following character. A quote that directly follows a
 * letter, digit or {@code _} is an apostrophe ({@code Don't}, {@code $x's}) and
 * never opens a string.
 */
public final class DelimiterScanner {

	private DelimiterScanner() {
		// Utility class - no instantiation
	}

	/**
	 * Finds the delimiter that closes the one at {@code openIndex}.
	 *
	 * @param text the text to search
	 * @param openIndex position of the opening delimiter
	 * @param open the opening delimiter character
	 * @param close the closing delimiter character
	 * @return the index of the matching closer, or -1 if the text ends first
	 */
	public static int findMatching(String text, int openIndex, char open, char close) {
		return findMatching(text, openIndex, open, close, null);
	}

	/**
	 * Finds the delimiter that closes the one at {@code openIndex}. When the text
	 * ends first, every opener the search passed that was still open at the end is
	 * set in {@code unclosed}; a later search from any of them would fail as well.
	 *
	 * @param unclosed collects the indexes of openers proven unclosed, or null
	 * @return the index of the matching closer, or -1 if the text ends first
	 */
	public static int findMatching(String text, int openIndex, char open, char close, BitSet unclosed) {
		if (text == null || openIndex < 0 || openIndex >= text.length() || text.charAt(openIndex) != open) {
			return -1;
		}
		int[] openers = new int[16];
		int depth = 0;
		char quote = 0;
		for (int i = openIndex; i < text.length(); i++) {
			char c = text.charAt(i);
			if (quote != 0) {
				if (c == '\\') {
					i++;
				}
				else if (c == quote) {
					quote = 0;
				}
				continue;
			}
			if (opensString(text, i)) {
				quote = c;
			}
			else if (c == open) {
				if (depth == openers.length) {
					openers = Arrays.copyOf(openers, depth * 2);
				}
				openers[depth++] = i;
			}
			else if (c == close) {
				depth--;
				if (depth == 0) {
					return i;
				}
			}
		}
		if (unclosed != null) {
			for (int d = 0; d < depth; d++) {
				unclosed.set(openers[d]);
			}
		}
		return -1;
	}

	/**
	 * Marks the characters that sit outside every string literal and every
	 * {@code (...)} or {@code [...]} group. Delimiters and quotes themselves are
	 * never marked.
	 */
	public static boolean[] topLevelMask(String text) {
		boolean[] mask = new boolean[text.length()];
		int depth = 0;
		char quote = 0;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (quote != 0) {
				if (c == '\\') {
					i++;
				}
				else if (c == quote) {
					quote = 0;
				}
				continue;
			}
			if (opensString(text, i)) {
				quote = c;
			}
			else if (c == '(' || c == '[') {
				depth++;
			}
			else if (c == ')' || c == ']') {
				depth = Math.max(0, depth - 1);
			}
			else {
				mask[i] = depth == 0;
			}
		}
		return mask;
	}

	/**
	 * Splits text on a separator that appears at top level only. Pieces are
	 * returned untrimmed; an empty input yields one empty piece.
	 */
	public static List<String> splitTopLevel(String text, char separator) {
		List<String> pieces = new ArrayList<>();
		boolean[] mask = topLevelMask(text);
		int start = 0;
		for (int i = 0; i < text.length(); i++) {
			if (mask[i] && text.charAt(i) == separator) {
				pieces.add(text.substring(start, i));
				start = i + 1;
			}
		}
		pieces.add(text.substring(start));
		return pieces;
	}

	/**
	 * Finds the first top-level occurrence of a keyword that stands as a separate
	 * word, surrounded by whitespace on both sides.
	 *
	 * @return the index of the keyword, or -1
	 */
	public static int indexOfKeyword(String text, String keyword) {
		boolean[] mask = topLevelMask(text);
		for (int i = 1; i + keyword.length() < text.length(); i++) {
			if (isKeywordAt(text, mask, i, keyword)) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * Finds the last top-level occurrence of a whitespace-delimited keyword.
	 *
	 * @return the index of the keyword, or -1
	 */
	public static int lastIndexOfKeyword(String text, String keyword) {
		boolean[] mask = topLevelMask(text);
		for (int i = text.length() - keyword.length() - 1; i >= 1; i--) {
			if (isKeywordAt(text, mask, i, keyword)) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * Finds the first top-level occurrence of a symbolic operator such as
	 * {@code >=}. When {@code exclusiveOf} is given, occurrences directly followed
	 * by that character are skipped, so {@code >} does not match inside {@code >=}.
	 *
	 * @return the index of the operator, or -1
	 */
	public static int indexOfOperator(String text, String operator, char exclusiveOf) {
		boolean[] mask = topLevelMask(text);
		for (int i = 0; i + operator.length() <= text.length(); i++) {
			if (!allMarked(mask, i, operator.length()) || !text.startsWith(operator, i)) {
				continue;
			}
			int after = i + operator.length();
			if (exclusiveOf != 0 && after < text.length() && text.charAt(after) == exclusiveOf) {
				continue;
			}
			return i;
		}
		return -1;
	}

	/**
	 * Returns true if the quote character at {@code index} opens a string literal.
	 */
	static boolean opensString(String text, int index) {
		char c = text.charAt(index);
		if (c != '"' && c != '\'') {
			return false;
		}
		if (index == 0) {
			return true;
		}
		char previous = text.charAt(index - 1);
		return previous != '\\' && !isWordChar(previous);
	}

	static boolean isWordChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}

	private static boolean isKeywordAt(String text, boolean[] mask, int index, String keyword) {
		if (!text.startsWith(keyword, index) || !allMarked(mask, index, keyword.length())) {
			return false;
		}
		return Character.isWhitespace(text.charAt(index - 1))
				&& Character.isWhitespace(text.charAt(index + keyword.length()));
	}

	private static boolean allMarked(boolean[] mask, int from, int length) {
		for (int i = from; i < from + length; i++) {
			if (!mask[i]) {
				return false;
			}
		}
		return true;
	}
}
