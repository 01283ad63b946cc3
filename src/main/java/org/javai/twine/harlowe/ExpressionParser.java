package org.javai.twine.harlowe;

import java.util.Optional;
import org.javai.twine.ast.ClassifiedValue;
import org.javai.twine.ast.Node;
import org.javai.twine.ast.Nodes;

/**
 * Builds value and condition nodes from argument text.
 * <p>
 * This is not a full expression grammar. It splits on top-level
 * operators only (never inside strings or nested groups), recognises literals,
 * variables, possessives and nested macro calls, and keeps everything else as a
 * {@code RawExpression}.
 * <p>
 * Condition precedence, loosest first: {@code or}, {@code and}, {@code not},
 * comparisons. Arithmetic is left-associative with {@code * /} binding tighter
 * than {@code + -}.
 * <p>
 * Every enclosed group and operand split costs one level of depth. A parser starts
 * at the depth of the macro call that owns it and never goes past
 * {@code maxDepth}; operands beyond it are kept raw, and a nested macro call found
 * there is handed to the resolver at a depth it will refuse.
 */
public class ExpressionParser {

	private static final String OPERATOR_CHARS = "+-*/<>=,";

	/**
	 * Translates text that is exactly one macro call found at the given depth, or
	 * returns empty when the text is not a macro call.
	 */
	@FunctionalInterface
	public interface NestedMacroResolver {
		Optional<Node> resolve(String text, int depth);
	}

	private final ValueClassifier classifier;
	private final PossessiveResolver possessiveResolver;
	private final NestedMacroResolver nestedMacroResolver;
	private final int startDepth;
	private final int maxDepth;

	public ExpressionParser(ValueClassifier classifier, PossessiveResolver possessiveResolver,
			NestedMacroResolver nestedMacroResolver, int startDepth, int maxDepth) {
		this.classifier = classifier;
		this.possessiveResolver = possessiveResolver;
		this.nestedMacroResolver = nestedMacroResolver;
		this.startDepth = startDepth;
		this.maxDepth = maxDepth;
	}

	/**
	 * Creates a parser that leaves nested macro calls as raw expressions.
	 */
	public static ExpressionParser withoutNestedMacros(int maxDepth) {
		return new ExpressionParser(new ValueClassifier(), new PossessiveResolver(),
				(text, depth) -> Optional.empty(), 0, maxDepth);
	}

	public Node build(ClassifiedValue value) {
		if (value instanceof ClassifiedValue.NumberValue number) {
			return Nodes.number(number.value());
		}
		if (value instanceof ClassifiedValue.StringValue string) {
			return Nodes.string(string.value());
		}
		if (value instanceof ClassifiedValue.BooleanValue bool) {
			return Nodes.bool(bool.value());
		}
		if (value instanceof ClassifiedValue.VariableValue variable) {
			return Nodes.variable(variable.scope(), variable.name());
		}
		return parseExpression(value.text(), startDepth);
	}

	public Node buildCondition(ClassifiedValue value) {
		if (value instanceof ClassifiedValue.ExpressionValue expression) {
			return parseCondition(expression.expression(), startDepth);
		}
		if (value instanceof ClassifiedValue.VariableValue variable) {
			return Nodes.variable(variable.scope(), variable.name());
		}
		if (value instanceof ClassifiedValue.BooleanValue bool) {
			return Nodes.bool(bool.value());
		}
		return Nodes.error("Invalid condition type: " + value.text());
	}

	public Node parseExpression(String text) {
		return parseExpression(text, startDepth);
	}

	public Node parseCondition(String text) {
		return parseCondition(text, startDepth);
	}

	private Node parseExpression(String text, int level) {
		String expr = text != null ? text.strip() : "";
		if (expr.isEmpty() || level > maxDepth) {
			return Nodes.raw(expr);
		}

		ClassifiedValue simple = classifier.classify(expr);
		if (!(simple instanceof ClassifiedValue.ExpressionValue)) {
			return build(simple);
		}

		if (isEnclosed(expr)) {
			Optional<Node> macro = nestedMacroResolver.resolve(expr, level);
			if (macro.isPresent()) {
				return macro.get();
			}
			return parseExpression(expr.substring(1, expr.length() - 1), level + 1);
		}

		Node arithmetic = splitArithmetic(expr, level);
		if (arithmetic != null) {
			return arithmetic;
		}

		return possessiveResolver.resolve(expr).orElseGet(() -> Nodes.raw(expr));
	}

	private Node parseCondition(String text, int level) {
		String expr = text != null ? text.strip() : "";
		if (expr.isEmpty() || level > maxDepth) {
			return Nodes.raw(expr);
		}
		int next = level + 1;

		int index = DelimiterScanner.indexOfKeyword(expr, "or");
		if (index > 0) {
			return Nodes.logical("or", parseCondition(expr.substring(0, index), next),
					parseCondition(expr.substring(index + 2), next));
		}
		index = DelimiterScanner.indexOfKeyword(expr, "and");
		if (index > 0) {
			return Nodes.logical("and", parseCondition(expr.substring(0, index), next),
					parseCondition(expr.substring(index + 3), next));
		}
		if (expr.startsWith("not ")) {
			return Nodes.not(parseCondition(expr.substring(4), next));
		}

		index = DelimiterScanner.indexOfKeyword(expr, "is not in");
		if (index > 0) {
			return Nodes.not(Nodes.contains(parseExpression(expr.substring(index + 9), next),
					parseExpression(expr.substring(0, index), next)));
		}
		index = DelimiterScanner.indexOfKeyword(expr, "is in");
		if (index > 0) {
			return Nodes.contains(parseExpression(expr.substring(index + 5), next),
					parseExpression(expr.substring(0, index), next));
		}
		index = DelimiterScanner.indexOfKeyword(expr, "is not");
		if (index > 0) {
			return comparison("!=", expr, index, 6, next);
		}
		index = DelimiterScanner.indexOfKeyword(expr, "contains");
		if (index > 0) {
			return Nodes.contains(parseExpression(expr.substring(0, index), next),
					parseExpression(expr.substring(index + 8), next));
		}
		index = DelimiterScanner.indexOfKeyword(expr, "is");
		if (index > 0) {
			return comparison("==", expr, index, 2, next);
		}

		for (String operator : new String[] { ">=", "<=" }) {
			index = DelimiterScanner.indexOfOperator(expr, operator, (char) 0);
			if (index > 0) {
				return comparison(operator, expr, index, 2, next);
			}
		}
		for (String operator : new String[] { ">", "<" }) {
			index = DelimiterScanner.indexOfOperator(expr, operator, '=');
			if (index > 0) {
				return comparison(operator, expr, index, 1, next);
			}
		}

		return parseExpression(expr, level);
	}

	private Node comparison(String operator, String expr, int index, int length, int level) {
		return Nodes.binary(operator, parseExpression(expr.substring(0, index), level),
				parseExpression(expr.substring(index + length), level));
	}

	private Node splitArithmetic(String expr, int level) {
		int index = lastBinaryOperator(expr, "+-");
		if (index < 0) {
			index = lastBinaryOperator(expr, "*/");
		}
		if (index < 0) {
			return null;
		}
		return Nodes.binary(String.valueOf(expr.charAt(index)),
				parseExpression(expr.substring(0, index), level + 1),
				parseExpression(expr.substring(index + 1), level + 1));
	}

	/**
	 * Finds the rightmost top-level operator from {@code operators} that has an
	 * operand on its left, so a leading sign is never taken as a binary operator.
	 */
	private static int lastBinaryOperator(String expr, String operators) {
		boolean[] mask = DelimiterScanner.topLevelMask(expr);
		for (int i = expr.length() - 1; i > 0; i--) {
			if (!mask[i] || operators.indexOf(expr.charAt(i)) < 0) {
				continue;
			}
			String left = expr.substring(0, i).stripTrailing();
			if (!left.isEmpty() && OPERATOR_CHARS.indexOf(left.charAt(left.length() - 1)) < 0) {
				return i;
			}
		}
		return -1;
	}

	private static boolean isEnclosed(String expr) {
		return expr.charAt(0) == '(' && DelimiterScanner.findMatching(expr, 0, '(', ')') == expr.length() - 1;
	}
}
