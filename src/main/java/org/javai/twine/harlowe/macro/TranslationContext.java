package org.javai.twine.harlowe.macro;

import java.util.List;
import org.javai.twine.ast.ClassifiedValue;
import org.javai.twine.ast.Node;

/**
 * Services the scanner offers a translator while it translates one macro call.
 * Recursive parsing through this context is subject to the scanner's nesting
 * depth limit.
 */
public interface TranslationContext {

	/**
	 * Parses hook content into nodes, recognising macros and named hooks inside it.
	 */
	List<Node> parseHook(String hookText);

	/**
	 * Builds a value expression node from a classified argument.
	 */
	Node expression(ClassifiedValue value);

	/**
	 * Builds a value expression node from raw expression text.
	 */
	Node expression(String text);

	/**
	 * Builds a condition node from a classified argument. Arguments that cannot be
	 * a condition, such as string or number literals, yield an {@code Error} node.
	 */
	Node condition(ClassifiedValue value);

	/**
	 * Builds a condition node from raw condition text.
	 */
	Node condition(String text);

	/**
	 * Classifies raw text the same way the scanner classifies macro arguments.
	 */
	ClassifiedValue classify(String raw);
}
