package org.javai.twine.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A node of the dialect-independent syntax tree. Sealed so that every consumer
 * (exporters, engines, the JSON mapper) sees the same closed variant set.
 * <p>
 * Nodes are immutable: list-valued fields are copied on construction and a parent
 * exclusively owns its children. Equality is structural.
 * <p>
 * Use {@link Nodes} to build nodes and {@link NodeVisitor} to consume them.
 */
public sealed interface Node {

	<R> R accept(NodeVisitor<R> visitor);

	/**
	 * Direct children in source order. Leaves return an empty list.
	 */
	default List<Node> children() {
		return List.of();
	}

	// ---------------------------------------------------------------------
	// Text and values
	// ---------------------------------------------------------------------

	record Text(String content) implements Node {
		public Text {
			Objects.requireNonNull(content, "content must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitText(this);
		}
	}

	/**
	 * A literal value. {@code value} is a {@link Double}, {@link String},
	 * {@link Boolean} or {@code null}, matching {@code kind}.
	 */
	record Literal(LiteralKind kind, Object value) implements Node {
		public Literal {
			Objects.requireNonNull(kind, "kind must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitLiteral(this);
		}
	}

	record VariableRef(VariableScope scope, String name) implements Node {
		public VariableRef {
			Objects.requireNonNull(scope, "scope must not be null");
			Objects.requireNonNull(name, "name must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitVariableRef(this);
		}
	}

	record RawExpression(String expression) implements Node {
		public RawExpression {
			Objects.requireNonNull(expression, "expression must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitRawExpression(this);
		}
	}

	// ---------------------------------------------------------------------
	// Possessive access
	// ---------------------------------------------------------------------

	record PropertyAccess(Node target, String property) implements Node {
		public PropertyAccess {
			Objects.requireNonNull(target, "target must not be null");
			Objects.requireNonNull(property, "property must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitPropertyAccess(this);
		}

		@Override
		public List<Node> children() {
			return List.of(target);
		}
	}

	/**
	 * Element access by a 0-based index.
	 */
	record ArrayAccess(Node target, Node index) implements Node {
		public ArrayAccess {
			Objects.requireNonNull(target, "target must not be null");
			Objects.requireNonNull(index, "index must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitArrayAccess(this);
		}

		@Override
		public List<Node> children() {
			return List.of(target, index);
		}
	}

	record LengthOf(Node target) implements Node {
		public LengthOf {
			Objects.requireNonNull(target, "target must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitLengthOf(this);
		}

		@Override
		public List<Node> children() {
			return List.of(target);
		}
	}

	record DatamapKeys(Node target) implements Node {
		public DatamapKeys {
			Objects.requireNonNull(target, "target must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitDatamapKeys(this);
		}

		@Override
		public List<Node> children() {
			return List.of(target);
		}
	}

	record DatamapValues(Node target) implements Node {
		public DatamapValues {
			Objects.requireNonNull(target, "target must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitDatamapValues(this);
		}

		@Override
		public List<Node> children() {
			return List.of(target);
		}
	}

	record ArrayLast(Node target) implements Node {
		public ArrayLast {
			Objects.requireNonNull(target, "target must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitArrayLast(this);
		}

		@Override
		public List<Node> children() {
			return List.of(target);
		}
	}

	// ---------------------------------------------------------------------
	// Statements
	// ---------------------------------------------------------------------

	record Assignment(String variable, VariableScope scope, String operator, Node value) implements Node {
		public Assignment {
			Objects.requireNonNull(variable, "variable must not be null");
			Objects.requireNonNull(scope, "scope must not be null");
			Objects.requireNonNull(operator, "operator must not be null");
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitAssignment(this);
		}

		@Override
		public List<Node> children() {
			return List.of(value);
		}
	}

	record Conditional(Node condition, List<Node> body) implements Node {
		public Conditional {
			Objects.requireNonNull(condition, "condition must not be null");
			body = body != null ? List.copyOf(body) : List.of();
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitConditional(this);
		}

		@Override
		public List<Node> children() {
			return prepend(condition, body);
		}
	}

	record Elsif(Node condition, List<Node> body) implements Node {
		public Elsif {
			Objects.requireNonNull(condition, "condition must not be null");
			body = body != null ? List.copyOf(body) : List.of();
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitElsif(this);
		}

		@Override
		public List<Node> children() {
			return prepend(condition, body);
		}
	}

	record Else(List<Node> body) implements Node {
		public Else {
			body = body != null ? List.copyOf(body) : List.of();
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitElse(this);
		}

		@Override
		public List<Node> children() {
			return body;
		}
	}

	record ForLoop(String variable, Node collection, List<Node> body) implements Node {
		public ForLoop {
			Objects.requireNonNull(variable, "variable must not be null");
			Objects.requireNonNull(collection, "collection must not be null");
			body = body != null ? List.copyOf(body) : List.of();
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitForLoop(this);
		}

		@Override
		public List<Node> children() {
			return prepend(collection, body);
		}
	}

	/**
	 * A player choice. {@code destination} is {@code null} when the choice reveals
	 * its body in place instead of navigating.
	 */
	record Choice(String text, List<Node> body, String destination) implements Node {
		public Choice {
			Objects.requireNonNull(text, "text must not be null");
			body = body != null ? List.copyOf(body) : List.of();
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitChoice(this);
		}

		@Override
		public List<Node> children() {
			return body;
		}
	}

	record Goto(String destination) implements Node {
		public Goto {
			Objects.requireNonNull(destination, "destination must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitGoto(this);
		}
	}

	record Print(Node expression) implements Node {
		public Print {
			Objects.requireNonNull(expression, "expression must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitPrint(this);
		}

		@Override
		public List<Node> children() {
			return List.of(expression);
		}
	}

	// ---------------------------------------------------------------------
	// Operators
	// ---------------------------------------------------------------------

	record BinaryOp(String operator, Node left, Node right) implements Node {
		public BinaryOp {
			Objects.requireNonNull(operator, "operator must not be null");
			Objects.requireNonNull(left, "left must not be null");
			Objects.requireNonNull(right, "right must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitBinaryOp(this);
		}

		@Override
		public List<Node> children() {
			return List.of(left, right);
		}
	}

	record LogicalOp(String operator, Node left, Node right) implements Node {
		public LogicalOp {
			Objects.requireNonNull(operator, "operator must not be null");
			Objects.requireNonNull(left, "left must not be null");
			Objects.requireNonNull(right, "right must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitLogicalOp(this);
		}

		@Override
		public List<Node> children() {
			return List.of(left, right);
		}
	}

	record UnaryOp(String operator, Node operand) implements Node {
		public UnaryOp {
			Objects.requireNonNull(operator, "operator must not be null");
			Objects.requireNonNull(operand, "operand must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitUnaryOp(this);
		}

		@Override
		public List<Node> children() {
			return List.of(operand);
		}
	}

	/**
	 * Membership test, produced by both {@code contains} and {@code is in}.
	 */
	record Contains(Node collection, Node item) implements Node {
		public Contains {
			Objects.requireNonNull(collection, "collection must not be null");
			Objects.requireNonNull(item, "item must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitContains(this);
		}

		@Override
		public List<Node> children() {
			return List.of(collection, item);
		}
	}

	// ---------------------------------------------------------------------
	// Data literals and random values
	// ---------------------------------------------------------------------

	record ArrayLiteral(List<Node> items) implements Node {
		public ArrayLiteral {
			items = items != null ? List.copyOf(items) : List.of();
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitArrayLiteral(this);
		}

		@Override
		public List<Node> children() {
			return items;
		}
	}

	record TableLiteral(List<TableEntry> entries) implements Node {
		public TableLiteral {
			entries = entries != null ? List.copyOf(entries) : List.of();
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitTableLiteral(this);
		}

		@Override
		public List<Node> children() {
			return entries.stream().map(TableEntry::value).toList();
		}
	}

	/**
	 * A collection of unique values. Uniqueness is enforced by the runtime.
	 */
	record DatasetLiteral(List<Node> items) implements Node {
		public DatasetLiteral {
			items = items != null ? List.copyOf(items) : List.of();
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitDatasetLiteral(this);
		}

		@Override
		public List<Node> children() {
			return items;
		}
	}

	record RandomChoice(Node collection) implements Node {
		public RandomChoice {
			Objects.requireNonNull(collection, "collection must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitRandomChoice(this);
		}

		@Override
		public List<Node> children() {
			return List.of(collection);
		}
	}

	record RandomNumber(Node min, Node max) implements Node {
		public RandomNumber {
			Objects.requireNonNull(min, "min must not be null");
			Objects.requireNonNull(max, "max must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitRandomNumber(this);
		}

		@Override
		public List<Node> children() {
			return List.of(min, max);
		}
	}

	record Range(Node start, Node end) implements Node {
		public Range {
			Objects.requireNonNull(start, "start must not be null");
			Objects.requireNonNull(end, "end must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitRange(this);
		}

		@Override
		public List<Node> children() {
			return List.of(start, end);
		}
	}

	// ---------------------------------------------------------------------
	// Hooks
	// ---------------------------------------------------------------------

	record NamedHook(String name, List<Node> content, boolean hidden) implements Node {
		public NamedHook {
			Objects.requireNonNull(name, "name must not be null");
			content = content != null ? List.copyOf(content) : List.of();
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitNamedHook(this);
		}

		@Override
		public List<Node> children() {
			return content;
		}
	}

	record HookUpdate(HookOperation operation, String hookName, List<Node> content) implements Node {
		public HookUpdate {
			Objects.requireNonNull(operation, "operation must not be null");
			Objects.requireNonNull(hookName, "hookName must not be null");
			content = content != null ? List.copyOf(content) : List.of();
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitHookUpdate(this);
		}

		@Override
		public List<Node> children() {
			return content;
		}
	}

	record HookVisibility(VisibilityOperation operation, String hookName) implements Node {
		public HookVisibility {
			Objects.requireNonNull(operation, "operation must not be null");
			Objects.requireNonNull(hookName, "hookName must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitHookVisibility(this);
		}
	}

	// ---------------------------------------------------------------------
	// Live behaviour
	// ---------------------------------------------------------------------

	/**
	 * Runs its body when the condition becomes true. Static conversion can only
	 * approximate this, which {@code advisory} records.
	 */
	record EventListener(Node condition, List<Node> body, Diagnostic advisory) implements Node {
		public EventListener {
			Objects.requireNonNull(condition, "condition must not be null");
			Objects.requireNonNull(advisory, "advisory must not be null");
			body = body != null ? List.copyOf(body) : List.of();
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitEventListener(this);
		}

		@Override
		public List<Node> children() {
			return prepend(condition, body);
		}
	}

	record LiveUpdate(double intervalSeconds, List<Node> body, Diagnostic advisory) implements Node {
		public LiveUpdate {
			Objects.requireNonNull(advisory, "advisory must not be null");
			body = body != null ? List.copyOf(body) : List.of();
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitLiveUpdate(this);
		}

		@Override
		public List<Node> children() {
			return body;
		}
	}

	// ---------------------------------------------------------------------
	// Diagnostics
	// ---------------------------------------------------------------------

	/**
	 * A macro that could not be translated because it is malformed.
	 *
	 * @param message what is wrong
	 * @param original the offending macro call, or {@code null} when not known
	 */
	record Error(String message, MacroCall original) implements Node {
		public Error {
			Objects.requireNonNull(message, "message must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitError(this);
		}
	}

	/**
	 * A macro that was recognised but not translated, typically because no
	 * translator is registered for it.
	 */
	record Warning(String message, MacroCall original) implements Node {
		public Warning {
			Objects.requireNonNull(message, "message must not be null");
		}

		@Override
		public <R> R accept(NodeVisitor<R> visitor) {
			return visitor.visitWarning(this);
		}
	}

	private static List<Node> prepend(Node first, List<Node> rest) {
		List<Node> all = new ArrayList<>(rest.size() + 1);
		all.add(first);
		all.addAll(rest);
		return List.copyOf(all);
	}
}
