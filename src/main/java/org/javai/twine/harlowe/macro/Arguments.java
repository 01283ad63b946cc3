package org.javai.twine.harlowe.macro;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.twine.ast.ClassifiedValue;
import org.javai.twine.ast.MacroCall;
import org.javai.twine.ast.Node;
import org.javai.twine.ast.VariableScope;

/**
 * Argument helpers shared by the built-in translator sets.
 */
final class Arguments {

	private static final Pattern VARIABLE = Pattern.compile("^([$_])([A-Za-z0-9_]+)$");
	private static final Pattern HOOK_REFERENCE = Pattern.compile("^\\?([A-Za-z0-9_]+)$");

	private Arguments() {
		// Utility class - no instantiation
	}

	/**
	 * A variable target of an assignment or loop.
	 */
	record Variable(VariableScope scope, String name) {
	}

	/**
	 * Plain text of an argument: string contents, or the source text otherwise.
	 */
	static String stringValue(ClassifiedValue value) {
		if (value instanceof ClassifiedValue.StringValue string) {
			return string.value();
		}
		return value.text().strip();
	}

	static Optional<Variable> variable(String text) {
		Matcher matcher = VARIABLE.matcher(text.strip());
		if (!matcher.matches()) {
			return Optional.empty();
		}
		return Optional.of(new Variable(VariableScope.fromSigil(matcher.group(1).charAt(0)), matcher.group(2)));
	}

	static Optional<Variable> variable(ClassifiedValue value) {
		if (value instanceof ClassifiedValue.VariableValue variable) {
			return Optional.of(new Variable(variable.scope(), variable.name()));
		}
		if (value instanceof ClassifiedValue.ExpressionValue expression) {
			return variable(expression.expression());
		}
		return Optional.empty();
	}

	/**
	 * Reads a {@code ?name} hook reference, returning the name without the
	 * leading {@code ?}.
	 */
	static Optional<String> hookReference(ClassifiedValue value) {
		Matcher matcher = HOOK_REFERENCE.matcher(value.text().strip());
		return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
	}

	static List<Node> hookBody(MacroCall call, TranslationContext context) {
		return call.hasHook() ? context.parseHook(call.hook()) : List.of();
	}
}
