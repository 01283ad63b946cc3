package org.javai.twine.harlowe;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.twine.PassageParser;
import org.javai.twine.ast.ClassifiedValue;
import org.javai.twine.ast.MacroCall;
import org.javai.twine.ast.Node;
import org.javai.twine.ast.Nodes;
import org.javai.twine.harlowe.config.HarloweParserConfig;
import org.javai.twine.harlowe.macro.MacroRegistry;
import org.javai.twine.harlowe.macro.MacroTranslator;
import org.javai.twine.harlowe.macro.TranslationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scans passage text for macro calls and turns it into an ordered node list.
 * <p>
 * The scan never fails. Named hooks are extracted first and become
 * {@code NamedHook} nodes ahead of everything else. The remaining text is walked
 * left to right: a {@code (name: args)} call whose closing parenthesis can be
 * found is parsed and dispatched to the registry, and everything in between is
 * emitted as {@code Text}. A call that is never closed, or whose interior is not a
 * macro name, is plain text.
 * <p>
 * A hook is attached to a call only when its {@code [} immediately follows the
 * call's {@code )}; {@code (if: $x) [a]} leaves {@code " [a]"} as text.
 * <p>
 * Hooks, nested macro calls and the operands of their expressions all draw on the
 * one depth budget given by {@link HarloweParserConfig#maxNestingDepth()}.
 * <p>
 * Instances hold no per-passage state and may be shared between threads once the
 * registry is populated.
 */
public class MacroScanner implements PassageParser {

	private static final Logger logger = LoggerFactory.getLogger(MacroScanner.class);

	private static final Pattern MACRO_WITH_ARGUMENTS = Pattern.compile("^([A-Za-z0-9_-]+):\\s*(.*)$", Pattern.DOTALL);
	private static final Pattern BARE_MACRO = Pattern.compile("^([A-Za-z0-9_-]+):?\\s*$");

	private final MacroRegistry registry;
	private final HarloweParserConfig config;
	private final ValueClassifier classifier;
	private final PossessiveResolver possessiveResolver;
	private final NamedHookExtractor hookExtractor;

	public MacroScanner(MacroRegistry registry, HarloweParserConfig config) {
		this(registry, config, new ValueClassifier(), new PossessiveResolver(), new NamedHookExtractor());
	}

	public MacroScanner(MacroRegistry registry, HarloweParserConfig config, ValueClassifier classifier,
			PossessiveResolver possessiveResolver, NamedHookExtractor hookExtractor) {
		if (registry == null || config == null) {
			throw new IllegalArgumentException("registry and config must not be null");
		}
		this.registry = registry;
		this.config = config;
		this.classifier = classifier;
		this.possessiveResolver = possessiveResolver;
		this.hookExtractor = hookExtractor;
	}

	@Override
	public List<Node> parsePassage(String text) {
		return parse(text, 0);
	}

	/**
	 * Splits an argument list on top-level commas and classifies each piece.
	 * Blank pieces are dropped, so a trailing separator adds no argument.
	 */
	public List<ClassifiedValue> parseArguments(String argumentText) {
		if (argumentText == null || argumentText.isBlank()) {
			return List.of();
		}
		List<ClassifiedValue> arguments = new ArrayList<>();
		for (String piece : DelimiterScanner.splitTopLevel(argumentText, ',')) {
			if (!piece.isBlank()) {
				arguments.add(classifier.classify(piece));
			}
		}
		return arguments;
	}

	private List<Node> parse(String text, int depth) {
		if (text == null || text.isEmpty()) {
			return List.of();
		}
		if (depth > config.maxNestingDepth()) {
			logger.warn("Nesting depth {} exceeds limit {}; content replaced by an error node",
					depth, config.maxNestingDepth());
			return List.of(depthExceeded());
		}

		List<Node> nodes = new ArrayList<>();
		NamedHookExtractor.Extraction extraction = hookExtractor.extract(text);
		for (NamedHookExtractor.RawNamedHook hook : extraction.hooks()) {
			nodes.add(Nodes.namedHook(hook.name(), parse(hook.content(), depth + 1), hook.hidden()));
		}

		ScanState state = new ScanState(extraction.remainingText());
		while (!state.isAtEnd()) {
			MacroMatch match = state.current() == '(' && !state.isKnownUnclosed()
					? matchMacro(state.text(), state.position(), true, state.unclosedOpeners())
					: null;
			if (match == null) {
				state.consumeCharacter();
				continue;
			}
			state.flushText(nodes);
			nodes.add(translate(match.call(), depth));
			state.skipTo(match.end());
		}
		state.flushText(nodes);
		return List.copyOf(nodes);
	}

	/**
	 * Tries to read a macro call starting at {@code start}, which must be an
	 * opening parenthesis.
	 *
	 * @param allowHook whether an adjacent {@code [...]} may be attached
	 * @param unclosedOpeners receives the openers a failed search proves unclosed,
	 *        or null
	 * @return the call and the index just past it, or null if there is no macro here
	 */
	private MacroMatch matchMacro(String text, int start, boolean allowHook, BitSet unclosedOpeners) {
		int close = DelimiterScanner.findMatching(text, start, '(', ')', unclosedOpeners);
		if (close < 0) {
			return null;
		}
		String interior = text.substring(start + 1, close);

		String name;
		String argumentText;
		Matcher withArguments = MACRO_WITH_ARGUMENTS.matcher(interior);
		if (withArguments.matches()) {
			name = withArguments.group(1);
			argumentText = withArguments.group(2);
		}
		else {
			Matcher bare = BARE_MACRO.matcher(interior);
			if (!bare.matches()) {
				return null;
			}
			name = bare.group(1);
			argumentText = "";
		}

		String hook = null;
		int end = close + 1;
		if (allowHook && end < text.length() && text.charAt(end) == '[') {
			int hookClose = DelimiterScanner.findMatching(text, end, '[', ']');
			if (hookClose >= 0) {
				hook = text.substring(end + 1, hookClose);
				end = hookClose + 1;
			}
			else {
				logger.warn("Hook after macro '{}' at offset {} is never closed; left as text", name, end);
			}
		}
		return new MacroMatch(new MacroCall(name, parseArguments(argumentText), hook), end);
	}

	private Node translate(MacroCall call, int depth) {
		Optional<MacroTranslator> translator = registry.lookup(call.name());
		if (translator.isEmpty()) {
			logger.debug("No translator registered for macro '{}'", call.name());
			return Nodes.unsupportedMacro(call);
		}
		try {
			Node node = translator.get().translate(call, new ScanContext(depth));
			if (node == null) {
				return Nodes.error("Translator for macro '" + call.name() + "' produced no node", call);
			}
			if (node instanceof Node.Error error && error.original() == null) {
				return Nodes.error(error.message(), call);
			}
			return node;
		}
		catch (RuntimeException e) {
			logger.warn("Translator for macro '{}' failed", call.name(), e);
			return Nodes.error("Failed to translate macro '" + call.name() + "': " + e.getMessage(), call);
		}
	}

	/**
	 * Translates text that consists of exactly one {@code (name: args)} call, as
	 * found inside another macro's arguments.
	 */
	private Optional<Node> resolveNestedMacro(String text, int depth) {
		MacroMatch match = matchMacro(text, 0, false, null);
		if (match == null || match.end() != text.length() || !MACRO_WITH_ARGUMENTS.matcher(text.substring(1, text.length() - 1)).matches()) {
			return Optional.empty();
		}
		if (depth > config.maxNestingDepth()) {
			logger.warn("Nested macro depth {} exceeds limit {}", depth, config.maxNestingDepth());
			return Optional.of(depthExceeded());
		}
		return Optional.of(translate(match.call(), depth));
	}

	private Node depthExceeded() {
		return Nodes.error("Maximum nesting depth " + config.maxNestingDepth() + " exceeded");
	}

	private record MacroMatch(MacroCall call, int end) {
	}

	/**
	 * Cursor and pending-text buffer for one scan of one piece of text.
	 */
	private static final class ScanState {
		private final String text;
		private final StringBuilder pendingText = new StringBuilder();
		private final BitSet unclosedOpeners = new BitSet();
		private int position = 0;

		ScanState(String text) {
			this.text = text;
		}

		String text() {
			return text;
		}

		int position() {
			return position;
		}

		boolean isAtEnd() {
			return position >= text.length();
		}

		char current() {
			return text.charAt(position);
		}

		boolean isKnownUnclosed() {
			return unclosedOpeners.get(position);
		}

		BitSet unclosedOpeners() {
			return unclosedOpeners;
		}

		void consumeCharacter() {
			pendingText.append(text.charAt(position++));
		}

		void skipTo(int newPosition) {
			position = newPosition;
		}

		void flushText(List<Node> nodes) {
			if (pendingText.length() > 0) {
				nodes.add(Nodes.text(pendingText.toString()));
				pendingText.setLength(0);
			}
		}
	}

	/**
	 * The services handed to translators, bound to the depth of the call being
	 * translated.
	 */
	private final class ScanContext implements TranslationContext {
		private final int depth;
		private final ExpressionParser expressionParser;

		ScanContext(int depth) {
			this.depth = depth;
			this.expressionParser = new ExpressionParser(classifier, possessiveResolver,
					(text, level) -> resolveNestedMacro(text, level + 1), depth, config.maxNestingDepth());
		}

		@Override
		public List<Node> parseHook(String hookText) {
			return parse(hookText, depth + 1);
		}

		@Override
		public Node expression(ClassifiedValue value) {
			return expressionParser.build(value);
		}

		@Override
		public Node expression(String text) {
			return expressionParser.parseExpression(text);
		}

		@Override
		public Node condition(ClassifiedValue value) {
			return expressionParser.buildCondition(value);
		}

		@Override
		public Node condition(String text) {
			return expressionParser.parseCondition(text);
		}

		@Override
		public ClassifiedValue classify(String raw) {
			return classifier.classify(raw);
		}
	}
}
