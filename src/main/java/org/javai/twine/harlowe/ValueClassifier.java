package org.javai.twine.harlowe;

import java.util.regex.Pattern;
import org.javai.twine.ast.ClassifiedValue;
import org.javai.twine.ast.VariableScope;

/**
 * Classifies a raw macro argument into a typed value.
 * <p>
 * Checks run in a fixed order and the first match wins: quoted string, number,
 * boolean keyword, sigil-prefixed variable. Anything else is kept verbatim as an
 * expression for the expression builder to examine.
 */
public class ValueClassifier {

	private static final Pattern NUMBER = Pattern.compile("-?\\d+\\.?\\d*");
	private static final Pattern VARIABLE = Pattern.compile("[$_][A-Za-z0-9_]+");

	public ClassifiedValue classify(String raw) {
		String text = raw != null ? raw.strip() : "";

		if (isQuotedString(text)) {
			return new ClassifiedValue.StringValue(unescape(text.substring(1, text.length() - 1)));
		}
		if (NUMBER.matcher(text).matches()) {
			return new ClassifiedValue.NumberValue(Double.parseDouble(text));
		}
		if (text.equals("true")) {
			return new ClassifiedValue.BooleanValue(true);
		}
		if (text.equals("false")) {
			return new ClassifiedValue.BooleanValue(false);
		}
		if (VARIABLE.matcher(text).matches()) {
			return new ClassifiedValue.VariableValue(VariableScope.fromSigil(text.charAt(0)), text.substring(1));
		}
		return new ClassifiedValue.ExpressionValue(text);
	}

	/**
	 * True only when the opening quote is closed by the very last character, so
	 * {@code "a" + "b"} is not mistaken for a single string.
	 */
	private static boolean isQuotedString(String text) {
		if (text.length() < 2) {
			return false;
		}
		char quote = text.charAt(0);
		if ((quote != '"' && quote != '\'') || text.charAt(text.length() - 1) != quote) {
			return false;
		}
		for (int i = 1; i < text.length() - 1; i++) {
			char c = text.charAt(i);
			if (c == '\\') {
				if (++i == text.length() - 1) {
					return false;
				}
			}
			else if (c == quote) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Removes the backslash before an escaped quote or backslash. Any other
	 * backslash is kept, so {@code "C:\new"} stays as written.
	 */
	private static String unescape(String content) {
		if (content.indexOf('\\') < 0) {
			return content;
		}
		StringBuilder sb = new StringBuilder(content.length());
		for (int i = 0; i < content.length(); i++) {
			char c = content.charAt(i);
			if (c == '\\' && i + 1 < content.length()) {
				char next = content.charAt(i + 1);
				if (next == '"' || next == '\'' || next == '\\') {
					sb.append(next);
					i++;
				}
				else {
					sb.append(c);
				}
			}
			else {
				sb.append(c);
			}
		}
		return sb.toString();
	}
}
