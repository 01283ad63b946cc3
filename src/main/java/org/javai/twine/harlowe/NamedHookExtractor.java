package org.javai.twine.harlowe;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes named hook definitions from passage text before macro scanning.
 * <p>
 * Recognised forms:
 * <pre>
 * |name&gt;[content]    visible, name before the hook
 * |name)[content]    hidden, name before the hook
 * [content]&lt;name|    visible, name after the hook
 * [content](name|    hidden, name after the hook
 * </pre>
 * Only hooks at the top level of the given text are extracted. Hooks nested inside
 * another hook, or inside a macro call, stay in place and are found when that
 * content is parsed in turn. A bracket directly attached to a macro call is left
 * to the macro.
 */
public class NamedHookExtractor {

	private static final Pattern PREFIX_NAME = Pattern.compile("\\|([A-Za-z0-9_]+)([>)])\\[");
	private static final Pattern SUFFIX_NAME = Pattern.compile("([<(])([A-Za-z0-9_]+)\\|");
	private static final Pattern MACRO_OPEN = Pattern.compile("\\([A-Za-z0-9_-]+:");

	/**
	 * A named hook as found in the source, content not yet parsed.
	 */
	public record RawNamedHook(String name, String content, boolean hidden) {
		public RawNamedHook {
			Objects.requireNonNull(name, "name must not be null");
			Objects.requireNonNull(content, "content must not be null");
		}
	}

	/**
	 * The text left after extraction, plus the hooks that were removed from it in
	 * source order.
	 */
	public record Extraction(String remainingText, List<RawNamedHook> hooks) {
		public Extraction {
			hooks = hooks != null ? List.copyOf(hooks) : List.of();
		}
	}

	public Extraction extract(String text) {
		if (text == null || text.isEmpty()) {
			return new Extraction("", List.of());
		}

		List<RawNamedHook> hooks = new ArrayList<>();
		StringBuilder remaining = new StringBuilder(text.length());
		BitSet unclosedBrackets = new BitSet();
		BitSet unclosedParentheses = new BitSet();
		int pos = 0;

		while (pos < text.length()) {
			char c = text.charAt(pos);

			if (c == '|') {
				Matcher prefix = PREFIX_NAME.matcher(text).region(pos, text.length());
				if (prefix.lookingAt()) {
					int open = prefix.end() - 1;
					int close = DelimiterScanner.findMatching(text, open, '[', ']');
					if (close >= 0) {
						boolean hidden = prefix.group(2).equals(")");
						hooks.add(new RawNamedHook(prefix.group(1), text.substring(open + 1, close), hidden));
						pos = close + 1;
						continue;
					}
				}
			}
			else if (c == '[' && !unclosedBrackets.get(pos)) {
				int close = DelimiterScanner.findMatching(text, pos, '[', ']', unclosedBrackets);
				if (close >= 0) {
					boolean attachedToMacro = pos > 0 && text.charAt(pos - 1) == ')';
					Matcher suffix = SUFFIX_NAME.matcher(text).region(close + 1, text.length());
					if (!attachedToMacro && suffix.lookingAt()) {
						boolean hidden = suffix.group(1).equals("(");
						hooks.add(new RawNamedHook(suffix.group(2), text.substring(pos + 1, close), hidden));
						pos = suffix.end();
					}
					else {
						remaining.append(text, pos, close + 1);
						pos = close + 1;
					}
					continue;
				}
			}
			else if (c == '(' && !unclosedParentheses.get(pos)
					&& MACRO_OPEN.matcher(text).region(pos, text.length()).lookingAt()) {
				int close = DelimiterScanner.findMatching(text, pos, '(', ')', unclosedParentheses);
				if (close >= 0) {
					remaining.append(text, pos, close + 1);
					pos = close + 1;
					continue;
				}
			}

			remaining.append(c);
			pos++;
		}

		return new Extraction(remaining.toString(), hooks);
	}
}
