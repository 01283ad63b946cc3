package org.javai.twine.harlowe.macro;

import java.util.List;
import java.util.Optional;
import org.javai.twine.ast.MacroCall;
import org.javai.twine.ast.Node;
import org.javai.twine.ast.Nodes;
import org.javai.twine.harlowe.DelimiterScanner;

/**
 * Translators for variables, control flow, output and navigation:
 * {@code set}, {@code put}, {@code if}, {@code else-if}, {@code else},
 * {@code unless}, {@code print}, {@code link}, {@code link-goto} and {@code goto}.
 * <p>
 * A missing assignment target is a hard failure and yields an {@code Error}
 * node. A condition that is missing or is not a condition at all, such as a bare
 * string, becomes an {@code Error} in the condition slot; the conditional and its
 * hook body are still built.
 */
public class CoreMacros implements MacroSet {

	@Override
	public void registerInto(MacroRegistry registry) {
		registry.register("set", this::set)
				.register("put", this::put)
				.register("if", this::ifMacro)
				.register("else-if", this::elseIf)
				.register("else", this::otherwise)
				.register("unless", this::unless)
				.register("print", this::print)
				.register("link", this::link)
				.register("link-goto", this::linkGoto)
				.register("goto", this::goTo);
	}

	/**
	 * {@code (set: $v to value)}, also written as three arguments
	 * {@code (set: $v, to, value)}.
	 */
	Node set(MacroCall call, TranslationContext context) {
		if (call.argumentCount() == 0) {
			return Nodes.error("set requires at least 1 argument");
		}

		if (call.argumentCount() >= 3 && "to".equals(call.argument(1).text().strip())) {
			Optional<Arguments.Variable> target = Arguments.variable(call.argument(0));
			if (target.isPresent()) {
				return assignment(target.get(), context.expression(call.argument(2)));
			}
			return Nodes.error("set requires: $variable to value");
		}

		String text = call.argument(0).text();
		int to = DelimiterScanner.indexOfKeyword(text, "to");
		if (to < 0) {
			return Nodes.error("set requires: $variable to value");
		}
		Optional<Arguments.Variable> target = Arguments.variable(text.substring(0, to));
		if (target.isEmpty()) {
			return Nodes.error("set requires: $variable to value");
		}
		return assignment(target.get(), context.expression(text.substring(to + 2)));
	}

	/**
	 * {@code (put: value into $v)}. The last top-level {@code into} separates value
	 * from target.
	 */
	Node put(MacroCall call, TranslationContext context) {
		if (call.argumentCount() == 0) {
			return Nodes.error("put requires at least 1 argument");
		}
		String text = call.argument(0).text();
		int into = DelimiterScanner.lastIndexOfKeyword(text, "into");
		if (into < 0) {
			return Nodes.error("put requires: value into $variable");
		}
		Optional<Arguments.Variable> target = Arguments.variable(text.substring(into + 4));
		if (target.isEmpty()) {
			return Nodes.error("put requires: value into $variable");
		}
		return assignment(target.get(), context.expression(text.substring(0, into)));
	}

	Node ifMacro(MacroCall call, TranslationContext context) {
		return Nodes.conditional(condition(call, context), Arguments.hookBody(call, context));
	}

	Node elseIf(MacroCall call, TranslationContext context) {
		return Nodes.elsif(condition(call, context), Arguments.hookBody(call, context));
	}

	Node otherwise(MacroCall call, TranslationContext context) {
		return Nodes.otherwise(Arguments.hookBody(call, context));
	}

	Node unless(MacroCall call, TranslationContext context) {
		Node condition = condition(call, context);
		Node negated = condition instanceof Node.Error ? condition : Nodes.not(condition);
		return Nodes.conditional(negated, Arguments.hookBody(call, context));
	}

	Node print(MacroCall call, TranslationContext context) {
		if (call.argumentCount() == 0) {
			return Nodes.error("print requires an expression");
		}
		return Nodes.print(context.expression(call.argument(0)));
	}

	/**
	 * {@code (link: "text")[hook]}: a choice whose body runs when taken.
	 */
	Node link(MacroCall call, TranslationContext context) {
		if (call.argumentCount() == 0) {
			return Nodes.error("link requires link text");
		}
		return Nodes.choice(Arguments.stringValue(call.argument(0)), Arguments.hookBody(call, context), null);
	}

	/**
	 * {@code (link-goto: "text", "passage")}. With one argument the text is also
	 * the destination.
	 */
	Node linkGoto(MacroCall call, TranslationContext context) {
		if (call.argumentCount() == 0) {
			return Nodes.error("link-goto requires link text");
		}
		String text = Arguments.stringValue(call.argument(0));
		String destination = call.argumentCount() > 1 ? Arguments.stringValue(call.argument(1)) : text;
		return Nodes.choice(text, List.of(), destination);
	}

	Node goTo(MacroCall call, TranslationContext context) {
		if (call.argumentCount() == 0) {
			return Nodes.error("goto requires a destination");
		}
		return Nodes.goTo(Arguments.stringValue(call.argument(0)));
	}

	private static Node condition(MacroCall call, TranslationContext context) {
		if (call.argumentCount() == 0) {
			return Nodes.error(call.name() + " requires a condition", call);
		}
		Node condition = context.condition(call.argument(0));
		if (condition instanceof Node.Error error && error.original() == null) {
			return Nodes.error(error.message(), call);
		}
		return condition;
	}

	private static Node assignment(Arguments.Variable target, Node value) {
		return Nodes.assignment(target.name(), target.scope(), value);
	}
}
