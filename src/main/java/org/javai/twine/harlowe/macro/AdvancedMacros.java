package org.javai.twine.harlowe.macro;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.twine.ast.ClassifiedValue;
import org.javai.twine.ast.HookOperation;
import org.javai.twine.ast.MacroCall;
import org.javai.twine.ast.Node;
import org.javai.twine.ast.Nodes;
import org.javai.twine.ast.TableEntry;
import org.javai.twine.ast.VisibilityOperation;
import org.javai.twine.harlowe.DelimiterScanner;

/**
 * Translators for loops, live content, data literals, named-hook mutation and
 * randomness.
 * <p>
 * {@code live} and {@code event} always translate; their nodes carry an advisory
 * diagnostic because continuous behaviour needs a runtime that re-renders the
 * passage.
 */
public class AdvancedMacros implements MacroSet {

	static final double DEFAULT_LIVE_INTERVAL_SECONDS = 1.0;

	private static final Pattern EACH = Pattern.compile("^each\\s+([$_][A-Za-z0-9_]+)$", Pattern.CASE_INSENSITIVE);
	private static final Pattern LOOP_INDEX = Pattern.compile("^[$_][A-Za-z0-9_]+$");
	private static final Pattern INTERVAL = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*([A-Za-z]*)$");
	private static final Pattern WHEN = Pattern.compile("^when\\s+(.+)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
	private static final String SPREAD = "...";

	@Override
	public void registerInto(MacroRegistry registry) {
		registry.register("for", this::forLoop)
				.register("live", this::live)
				.register("event", this::event)
				.register("a", this::array)
				.register("dm", this::datamap)
				.register("ds", this::dataset)
				.register("replace", (call, context) -> hookUpdate(HookOperation.REPLACE, call, context))
				.register("append", (call, context) -> hookUpdate(HookOperation.APPEND, call, context))
				.register("prepend", (call, context) -> hookUpdate(HookOperation.PREPEND, call, context))
				.register("show", (call, context) -> hookVisibility(VisibilityOperation.SHOW, call))
				.register("hide", (call, context) -> hookVisibility(VisibilityOperation.HIDE, call))
				.register("either", this::either)
				.register("random", this::random)
				.register("range", this::range);
	}

	/**
	 * {@code (for: each _item, ...$list)[body]}. An index variable between the two
	 * ({@code each _item, _i, ...$list}) is accepted and ignored. The combined form
	 * with all parts in one argument translates the same way.
	 */
	Node forLoop(MacroCall call, TranslationContext context) {
		List<String> parts = new ArrayList<>();
		for (ClassifiedValue argument : call.arguments()) {
			for (String piece : DelimiterScanner.splitTopLevel(argument.text(), ',')) {
				if (!piece.isBlank()) {
					parts.add(piece.strip());
				}
			}
		}

		Matcher each = parts.isEmpty() ? null : EACH.matcher(parts.get(0));
		if (each == null || !each.matches()) {
			return Nodes.error("for requires 'each _variable' syntax");
		}
		String spread = parts.size() > 1 ? parts.get(parts.size() - 1) : "";
		boolean indexOnly = parts.size() <= 3 && (parts.size() < 3 || LOOP_INDEX.matcher(parts.get(1)).matches());
		if (!spread.startsWith(SPREAD) || spread.length() == SPREAD.length() || !indexOnly) {
			return Nodes.error("for requires '...$collection' spread syntax");
		}

		String variable = each.group(1).substring(1);
		Node collection = context.expression(spread.substring(SPREAD.length()));
		return Nodes.forLoop(variable, collection, Arguments.hookBody(call, context));
	}

	/**
	 * {@code (live: 2s)[body]}. Intervals accept {@code ms}, {@code s} and {@code m}
	 * units; a bare number is seconds and anything unreadable is one second.
	 */
	Node live(MacroCall call, TranslationContext context) {
		double seconds = call.argumentCount() > 0 ? parseInterval(call.argument(0)) : DEFAULT_LIVE_INTERVAL_SECONDS;
		return Nodes.liveUpdate(seconds, Arguments.hookBody(call, context));
	}

	/**
	 * {@code (event: when $x is 5)[body]}, also written {@code (event: when, $x is 5)}.
	 */
	Node event(MacroCall call, TranslationContext context) {
		if (call.argumentCount() == 0) {
			return Nodes.error("event requires: when condition");
		}
		String first = call.argument(0).text().strip();
		String condition;
		Matcher when = WHEN.matcher(first);
		if (when.matches()) {
			condition = when.group(1);
		}
		else if (call.argumentCount() >= 2 && "when".equals(first.toLowerCase(Locale.ROOT))) {
			condition = call.argument(1).text();
		}
		else {
			return Nodes.error("event requires 'when' keyword");
		}
		return Nodes.eventListener(context.condition(condition), Arguments.hookBody(call, context));
	}

	Node array(MacroCall call, TranslationContext context) {
		return Nodes.arrayLiteral(expressions(call.arguments(), context));
	}

	/**
	 * {@code (dm: key, value, ...)}. Keys keep their text; values are expressions.
	 */
	Node datamap(MacroCall call, TranslationContext context) {
		if (call.argumentCount() % 2 != 0) {
			return Nodes.error("dm requires even number of arguments (key-value pairs)");
		}
		List<TableEntry> entries = new ArrayList<>();
		for (int i = 0; i < call.argumentCount(); i += 2) {
			entries.add(new TableEntry(Arguments.stringValue(call.argument(i)),
					context.expression(call.argument(i + 1))));
		}
		return Nodes.tableLiteral(entries);
	}

	Node dataset(MacroCall call, TranslationContext context) {
		return Nodes.datasetLiteral(expressions(call.arguments(), context));
	}

	private Node hookUpdate(HookOperation operation, MacroCall call, TranslationContext context) {
		Optional<String> hookName = hookName(call);
		if (hookName.isEmpty()) {
			return Nodes.error(call.name() + " requires hook name (?hookName)");
		}
		return Nodes.hookUpdate(operation, hookName.get(), Arguments.hookBody(call, context));
	}

	private Node hookVisibility(VisibilityOperation operation, MacroCall call) {
		Optional<String> hookName = hookName(call);
		if (hookName.isEmpty()) {
			return Nodes.error(call.name() + " requires hook name (?hookName)");
		}
		return Nodes.hookVisibility(operation, hookName.get());
	}

	/**
	 * {@code (either: "a", "b")} picks one of its arguments;
	 * {@code (either: ...$list)} picks from a collection.
	 */
	Node either(MacroCall call, TranslationContext context) {
		if (call.argumentCount() == 0) {
			return Nodes.error("either requires at least one argument");
		}
		String first = call.argument(0).text().strip();
		if (call.argumentCount() == 1 && first.startsWith(SPREAD) && first.length() > SPREAD.length()) {
			return Nodes.randomChoice(context.expression(first.substring(SPREAD.length())));
		}
		return Nodes.randomChoice(Nodes.arrayLiteral(expressions(call.arguments(), context)));
	}

	Node random(MacroCall call, TranslationContext context) {
		Optional<Node> error = checkBounds(call);
		if (error.isPresent()) {
			return error.get();
		}
		return Nodes.randomNumber(context.expression(call.argument(0)), context.expression(call.argument(1)));
	}

	Node range(MacroCall call, TranslationContext context) {
		Optional<Node> error = checkBounds(call);
		if (error.isPresent()) {
			return error.get();
		}
		return Nodes.range(context.expression(call.argument(0)), context.expression(call.argument(1)));
	}

	static double parseInterval(ClassifiedValue value) {
		if (value instanceof ClassifiedValue.NumberValue number) {
			return number.value();
		}
		Matcher matcher = INTERVAL.matcher(value.text().strip().toLowerCase(Locale.ROOT));
		if (!matcher.matches()) {
			return DEFAULT_LIVE_INTERVAL_SECONDS;
		}
		double amount = Double.parseDouble(matcher.group(1));
		switch (matcher.group(2)) {
			case "":
			case "s":
				return amount;
			case "ms":
				return amount / 1000;
			case "m":
				return amount * 60;
			default:
				return DEFAULT_LIVE_INTERVAL_SECONDS;
		}
	}

	private static Optional<Node> checkBounds(MacroCall call) {
		if (call.argumentCount() != 2) {
			return Optional.of(Nodes.error(call.name() + " requires exactly two arguments (start and end)"));
		}
		for (ClassifiedValue bound : call.arguments()) {
			if (bound instanceof ClassifiedValue.StringValue || bound instanceof ClassifiedValue.BooleanValue) {
				return Optional.of(Nodes.error(call.name() + " bounds must be numbers or expressions, was: " + bound.text()));
			}
		}
		return Optional.empty();
	}

	private static Optional<String> hookName(MacroCall call) {
		return call.argumentCount() == 0 ? Optional.empty() : Arguments.hookReference(call.argument(0));
	}

	private static List<Node> expressions(List<ClassifiedValue> values, TranslationContext context) {
		List<Node> nodes = new ArrayList<>(values.size());
		for (ClassifiedValue value : values) {
			nodes.add(context.expression(value));
		}
		return nodes;
	}
}
