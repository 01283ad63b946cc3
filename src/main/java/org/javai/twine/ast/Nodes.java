package org.javai.twine.ast;

import java.util.List;

/**
 * Factory for syntax-tree nodes. Translators build nodes only through these
 * methods so that conventions such as ordinal indexing and the advisory text of
 * live nodes are applied in one place.
 */
public final class Nodes {

	static final String LIVE_UPDATE_ADVISORY =
			"Live updates execute once in text mode; true live updates require a GUI runtime";
	static final String EVENT_LISTENER_ADVISORY =
			"Event listeners are checked on turn changes in text mode";

	private Nodes() {
		// Utility class - no instantiation
	}

	public static Node.Text text(String content) {
		return new Node.Text(content);
	}

	public static Node.Literal number(double value) {
		return new Node.Literal(LiteralKind.NUMBER, value);
	}

	public static Node.Literal string(String value) {
		return new Node.Literal(LiteralKind.STRING, value);
	}

	public static Node.Literal bool(boolean value) {
		return new Node.Literal(LiteralKind.BOOLEAN, value);
	}

	public static Node.Literal nil() {
		return new Node.Literal(LiteralKind.NULL, null);
	}

	public static Node.VariableRef variable(VariableScope scope, String name) {
		return new Node.VariableRef(scope, name);
	}

	public static Node.VariableRef storyVariable(String name) {
		return new Node.VariableRef(VariableScope.STORY, name);
	}

	public static Node.VariableRef temporaryVariable(String name) {
		return new Node.VariableRef(VariableScope.TEMPORARY, name);
	}

	public static Node.RawExpression raw(String expression) {
		return new Node.RawExpression(expression);
	}

	public static Node.PropertyAccess propertyAccess(Node target, String property) {
		return new Node.PropertyAccess(target, property);
	}

	public static Node.ArrayAccess arrayAccess(Node target, Node index) {
		return new Node.ArrayAccess(target, index);
	}

	/**
	 * Element access from an ordinal position written in the source ({@code 1st},
	 * {@code 2nd}, ...). This is the only place where 1-based positions become
	 * 0-based indices.
	 *
	 * @param ordinal the 1-based position as written
	 */
	public static Node.ArrayAccess ordinalAccess(Node target, int ordinal) {
		return new Node.ArrayAccess(target, number(ordinal - 1));
	}

	public static Node.LengthOf lengthOf(Node target) {
		return new Node.LengthOf(target);
	}

	public static Node.DatamapKeys datamapKeys(Node target) {
		return new Node.DatamapKeys(target);
	}

	public static Node.DatamapValues datamapValues(Node target) {
		return new Node.DatamapValues(target);
	}

	public static Node.ArrayLast arrayLast(Node target) {
		return new Node.ArrayLast(target);
	}

	public static Node.Assignment assignment(String variable, VariableScope scope, Node value) {
		return new Node.Assignment(variable, scope, "=", value);
	}

	public static Node.Conditional conditional(Node condition, List<Node> body) {
		return new Node.Conditional(condition, body);
	}

	public static Node.Elsif elsif(Node condition, List<Node> body) {
		return new Node.Elsif(condition, body);
	}

	public static Node.Else otherwise(List<Node> body) {
		return new Node.Else(body);
	}

	public static Node.ForLoop forLoop(String variable, Node collection, List<Node> body) {
		return new Node.ForLoop(variable, collection, body);
	}

	public static Node.Choice choice(String text, List<Node> body, String destination) {
		return new Node.Choice(text, body, destination);
	}

	public static Node.Goto goTo(String destination) {
		return new Node.Goto(destination);
	}

	public static Node.Print print(Node expression) {
		return new Node.Print(expression);
	}

	public static Node.BinaryOp binary(String operator, Node left, Node right) {
		return new Node.BinaryOp(operator, left, right);
	}

	public static Node.LogicalOp logical(String operator, Node left, Node right) {
		return new Node.LogicalOp(operator, left, right);
	}

	public static Node.UnaryOp not(Node operand) {
		return new Node.UnaryOp("not", operand);
	}

	public static Node.Contains contains(Node collection, Node item) {
		return new Node.Contains(collection, item);
	}

	public static Node.ArrayLiteral arrayLiteral(List<Node> items) {
		return new Node.ArrayLiteral(items);
	}

	public static Node.TableLiteral tableLiteral(List<TableEntry> entries) {
		return new Node.TableLiteral(entries);
	}

	public static Node.DatasetLiteral datasetLiteral(List<Node> items) {
		return new Node.DatasetLiteral(items);
	}

	public static Node.RandomChoice randomChoice(Node collection) {
		return new Node.RandomChoice(collection);
	}

	public static Node.RandomNumber randomNumber(Node min, Node max) {
		return new Node.RandomNumber(min, max);
	}

	public static Node.Range range(Node start, Node end) {
		return new Node.Range(start, end);
	}

	public static Node.NamedHook namedHook(String name, List<Node> content, boolean hidden) {
		return new Node.NamedHook(name, content, hidden);
	}

	public static Node.HookUpdate hookUpdate(HookOperation operation, String hookName, List<Node> content) {
		return new Node.HookUpdate(operation, hookName, content);
	}

	public static Node.HookVisibility hookVisibility(VisibilityOperation operation, String hookName) {
		return new Node.HookVisibility(operation, hookName);
	}

	public static Node.EventListener eventListener(Node condition, List<Node> body) {
		return new Node.EventListener(condition, body, Diagnostic.warning(EVENT_LISTENER_ADVISORY));
	}

	public static Node.LiveUpdate liveUpdate(double intervalSeconds, List<Node> body) {
		return new Node.LiveUpdate(intervalSeconds, body, Diagnostic.warning(LIVE_UPDATE_ADVISORY));
	}

	public static Node.Error error(String message) {
		return new Node.Error(message, null);
	}

	public static Node.Error error(String message, MacroCall original) {
		return new Node.Error(message, original);
	}

	public static Node.Warning warning(String message, MacroCall original) {
		return new Node.Warning(message, original);
	}

	/**
	 * The fallback for a macro with no registered translator. Keeps the call so
	 * that nothing the author wrote is lost.
	 */
	public static Node.Warning unsupportedMacro(MacroCall call) {
		return new Node.Warning("Unsupported Harlowe macro: " + call.name(), call);
	}
}
