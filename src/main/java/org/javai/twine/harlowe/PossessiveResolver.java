package org.javai.twine.harlowe;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.twine.ast.Node;
import org.javai.twine.ast.Nodes;

/**
 * Resolves the dialect's possessive addressing syntax, {@code $name's property}.
 * <ul>
 *   <li>{@code length}, {@code keys}, {@code values}, {@code last} map to dedicated nodes</li>
 *   <li>an ordinal such as {@code 1st} or {@code 22nd} maps to element access; only the
 *   leading digits are read, the suffix is not checked against them</li>
 *   <li>any other property becomes a generic property access</li>
 * </ul>
 */
public class PossessiveResolver {

	private static final Pattern POSSESSIVE = Pattern.compile("^\\$([A-Za-z0-9_]+)'s\\s+(.+)$", Pattern.DOTALL);
	private static final Pattern ORDINAL = Pattern.compile("^(\\d+)[A-Za-z]+$");

	/**
	 * @return the resolved node, or empty if the expression is not possessive
	 */
	public Optional<Node> resolve(String expression) {
		if (expression == null) {
			return Optional.empty();
		}
		Matcher matcher = POSSESSIVE.matcher(expression.strip());
		if (!matcher.matches()) {
			return Optional.empty();
		}
		Node target = Nodes.storyVariable(matcher.group(1));
		String property = matcher.group(2).strip();

		return Optional.of(switch (property) {
			case "length" -> Nodes.lengthOf(target);
			case "keys" -> Nodes.datamapKeys(target);
			case "values" -> Nodes.datamapValues(target);
			case "last" -> Nodes.arrayLast(target);
			default -> resolveProperty(target, property);
		});
	}

	private static Node resolveProperty(Node target, String property) {
		Matcher ordinal = ORDINAL.matcher(property);
		if (ordinal.matches()) {
			try {
				return Nodes.ordinalAccess(target, Integer.parseInt(ordinal.group(1)));
			}
			catch (NumberFormatException e) {
				// digit run too long for an index; keep it as a named property
				return Nodes.propertyAccess(target, property);
			}
		}
		return Nodes.propertyAccess(target, property);
	}
}
