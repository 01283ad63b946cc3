package org.javai.twine.ast;

import java.util.List;
import java.util.Objects;

/**
 * A macro invocation as recognised by the scanner: the name as written, its
 * classified arguments and the raw text of an attached hook, if any.
 * <p>
 * Hook text is left unparsed; translators decide whether and how to recurse into it.
 *
 * @param name macro name exactly as written in the source
 * @param arguments classified arguments in source order
 * @param hook raw hook content, or {@code null} when no hook is attached
 */
public record MacroCall(String name, List<ClassifiedValue> arguments, String hook) {

	public MacroCall {
		Objects.requireNonNull(name, "name must not be null");
		arguments = arguments != null ? List.copyOf(arguments) : List.of();
	}

	public static MacroCall of(String name, ClassifiedValue... arguments) {
		return new MacroCall(name, List.of(arguments), null);
	}

	public boolean hasHook() {
		return hook != null;
	}

	public int argumentCount() {
		return arguments.size();
	}

	public ClassifiedValue argument(int index) {
		return arguments.get(index);
	}
}
