package org.javai.twine.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Locale;
import org.javai.twine.ast.ClassifiedValue;
import org.javai.twine.ast.Diagnostic;
import org.javai.twine.ast.MacroCall;
import org.javai.twine.ast.Node;
import org.javai.twine.ast.NodeVisitor;
import org.javai.twine.ast.TableEntry;

/**
 * Utility to render syntax trees as JSON for downstream converters and
 * diagnostics. Every node becomes an object whose {@code type} field names the
 * variant in snake case ({@code text}, {@code variable_ref}, {@code for_loop}, ...).
 */
public final class SyntaxTreeJsonMapper {

	private static final ObjectMapper mapper = new ObjectMapper();
	private static final Renderer renderer = new Renderer();

	private SyntaxTreeJsonMapper() {
	}

	public static ObjectNode toJson(Node node) {
		return node.accept(renderer);
	}

	public static ArrayNode toJsonArray(List<Node> nodes) {
		ArrayNode array = mapper.createArrayNode();
		for (Node node : nodes) {
			array.add(toJson(node));
		}
		return array;
	}

	public static String toJsonString(List<Node> nodes) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJsonArray(nodes));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render syntax tree as JSON", e);
		}
	}

	private static ObjectNode typed(String type) {
		ObjectNode node = mapper.createObjectNode();
		node.put("type", type);
		return node;
	}

	private static ArrayNode array(List<Node> nodes) {
		ArrayNode array = mapper.createArrayNode();
		nodes.forEach(n -> array.add(toJson(n)));
		return array;
	}

	private static JsonNode optional(Node node) {
		return node != null ? toJson(node) : mapper.nullNode();
	}

	private static ObjectNode diagnostic(Diagnostic diagnostic) {
		ObjectNode node = mapper.createObjectNode();
		node.put("severity", diagnostic.severity().name().toLowerCase(Locale.ROOT));
		node.put("message", diagnostic.message());
		return node;
	}

	private static JsonNode macroCall(MacroCall call) {
		if (call == null) {
			return mapper.nullNode();
		}
		ObjectNode node = mapper.createObjectNode();
		node.put("name", call.name());
		ArrayNode arguments = node.putArray("arguments");
		for (ClassifiedValue argument : call.arguments()) {
			ObjectNode arg = arguments.addObject();
			arg.put("kind", argumentKind(argument));
			if (argument instanceof ClassifiedValue.NumberValue number) {
				arg.put("value", number.value());
			}
			else if (argument instanceof ClassifiedValue.BooleanValue bool) {
				arg.put("value", bool.value());
			}
			else {
				arg.put("value", argument.text());
			}
		}
		if (call.hasHook()) {
			node.put("hook", call.hook());
		}
		return node;
	}

	private static String argumentKind(ClassifiedValue value) {
		if (value instanceof ClassifiedValue.NumberValue) {
			return "number";
		}
		if (value instanceof ClassifiedValue.StringValue) {
			return "string";
		}
		if (value instanceof ClassifiedValue.BooleanValue) {
			return "boolean";
		}
		if (value instanceof ClassifiedValue.VariableValue) {
			return "variable";
		}
		return "expression";
	}

	private static final class Renderer implements NodeVisitor<ObjectNode> {

		@Override
		public ObjectNode visitText(Node.Text node) {
			ObjectNode json = typed("text");
			json.put("content", node.content());
			return json;
		}

		@Override
		public ObjectNode visitLiteral(Node.Literal node) {
			ObjectNode json = typed("literal");
			json.put("kind", node.kind().name().toLowerCase(Locale.ROOT));
			json.set("value", node.value() != null ? mapper.valueToTree(node.value()) : mapper.nullNode());
			return json;
		}

		@Override
		public ObjectNode visitVariableRef(Node.VariableRef node) {
			ObjectNode json = typed("variable_ref");
			json.put("name", node.name());
			json.put("scope", node.scope().name().toLowerCase(Locale.ROOT));
			return json;
		}

		@Override
		public ObjectNode visitRawExpression(Node.RawExpression node) {
			ObjectNode json = typed("raw_expression");
			json.put("expression", node.expression());
			return json;
		}

		@Override
		public ObjectNode visitPropertyAccess(Node.PropertyAccess node) {
			ObjectNode json = typed("property_access");
			json.set("target", toJson(node.target()));
			json.put("property", node.property());
			return json;
		}

		@Override
		public ObjectNode visitArrayAccess(Node.ArrayAccess node) {
			ObjectNode json = typed("array_access");
			json.set("target", toJson(node.target()));
			json.set("index", toJson(node.index()));
			return json;
		}

		@Override
		public ObjectNode visitLengthOf(Node.LengthOf node) {
			return withTarget("length_of", node.target());
		}

		@Override
		public ObjectNode visitDatamapKeys(Node.DatamapKeys node) {
			return withTarget("datamap_keys", node.target());
		}

		@Override
		public ObjectNode visitDatamapValues(Node.DatamapValues node) {
			return withTarget("datamap_values", node.target());
		}

		@Override
		public ObjectNode visitArrayLast(Node.ArrayLast node) {
			return withTarget("array_last", node.target());
		}

		@Override
		public ObjectNode visitAssignment(Node.Assignment node) {
			ObjectNode json = typed("assignment");
			json.put("variable", node.variable());
			json.put("scope", node.scope().name().toLowerCase(Locale.ROOT));
			json.put("operator", node.operator());
			json.set("value", toJson(node.value()));
			return json;
		}

		@Override
		public ObjectNode visitConditional(Node.Conditional node) {
			ObjectNode json = typed("conditional");
			json.set("condition", toJson(node.condition()));
			json.set("body", array(node.body()));
			return json;
		}

		@Override
		public ObjectNode visitElsif(Node.Elsif node) {
			ObjectNode json = typed("elsif");
			json.set("condition", toJson(node.condition()));
			json.set("body", array(node.body()));
			return json;
		}

		@Override
		public ObjectNode visitElse(Node.Else node) {
			ObjectNode json = typed("else");
			json.set("body", array(node.body()));
			return json;
		}

		@Override
		public ObjectNode visitForLoop(Node.ForLoop node) {
			ObjectNode json = typed("for_loop");
			json.put("variable", node.variable());
			json.set("collection", toJson(node.collection()));
			json.set("body", array(node.body()));
			return json;
		}

		@Override
		public ObjectNode visitChoice(Node.Choice node) {
			ObjectNode json = typed("choice");
			json.put("text", node.text());
			json.set("body", array(node.body()));
			if (node.destination() != null) {
				json.put("destination", node.destination());
			}
			return json;
		}

		@Override
		public ObjectNode visitGoto(Node.Goto node) {
			ObjectNode json = typed("goto");
			json.put("destination", node.destination());
			return json;
		}

		@Override
		public ObjectNode visitPrint(Node.Print node) {
			ObjectNode json = typed("print");
			json.set("expression", toJson(node.expression()));
			return json;
		}

		@Override
		public ObjectNode visitBinaryOp(Node.BinaryOp node) {
			return binary("binary_op", node.operator(), node.left(), node.right());
		}

		@Override
		public ObjectNode visitLogicalOp(Node.LogicalOp node) {
			return binary("logical_op", node.operator(), node.left(), node.right());
		}

		@Override
		public ObjectNode visitUnaryOp(Node.UnaryOp node) {
			ObjectNode json = typed("unary_op");
			json.put("operator", node.operator());
			json.set("operand", toJson(node.operand()));
			return json;
		}

		@Override
		public ObjectNode visitContains(Node.Contains node) {
			ObjectNode json = typed("contains");
			json.set("collection", toJson(node.collection()));
			json.set("item", toJson(node.item()));
			return json;
		}

		@Override
		public ObjectNode visitArrayLiteral(Node.ArrayLiteral node) {
			ObjectNode json = typed("array_literal");
			json.set("items", array(node.items()));
			return json;
		}

		@Override
		public ObjectNode visitTableLiteral(Node.TableLiteral node) {
			ObjectNode json = typed("table_literal");
			ArrayNode entries = json.putArray("entries");
			for (TableEntry entry : node.entries()) {
				ObjectNode e = entries.addObject();
				e.put("key", entry.key());
				e.set("value", toJson(entry.value()));
			}
			return json;
		}

		@Override
		public ObjectNode visitDatasetLiteral(Node.DatasetLiteral node) {
			ObjectNode json = typed("dataset_literal");
			json.set("items", array(node.items()));
			return json;
		}

		@Override
		public ObjectNode visitRandomChoice(Node.RandomChoice node) {
			ObjectNode json = typed("random_choice");
			json.set("collection", toJson(node.collection()));
			return json;
		}

		@Override
		public ObjectNode visitRandomNumber(Node.RandomNumber node) {
			ObjectNode json = typed("random_number");
			json.set("min", toJson(node.min()));
			json.set("max", toJson(node.max()));
			return json;
		}

		@Override
		public ObjectNode visitRange(Node.Range node) {
			ObjectNode json = typed("range");
			json.set("start", toJson(node.start()));
			json.set("end", toJson(node.end()));
			return json;
		}

		@Override
		public ObjectNode visitNamedHook(Node.NamedHook node) {
			ObjectNode json = typed("named_hook");
			json.put("name", node.name());
			json.put("hidden", node.hidden());
			json.set("content", array(node.content()));
			return json;
		}

		@Override
		public ObjectNode visitHookUpdate(Node.HookUpdate node) {
			ObjectNode json = typed("hook_update");
			json.put("operation", node.operation().name().toLowerCase(Locale.ROOT));
			json.put("hook_name", node.hookName());
			json.set("content", array(node.content()));
			return json;
		}

		@Override
		public ObjectNode visitHookVisibility(Node.HookVisibility node) {
			ObjectNode json = typed("hook_visibility");
			json.put("operation", node.operation().name().toLowerCase(Locale.ROOT));
			json.put("hook_name", node.hookName());
			return json;
		}

		@Override
		public ObjectNode visitEventListener(Node.EventListener node) {
			ObjectNode json = typed("event_listener");
			json.set("condition", optional(node.condition()));
			json.set("body", array(node.body()));
			json.set("advisory", diagnostic(node.advisory()));
			return json;
		}

		@Override
		public ObjectNode visitLiveUpdate(Node.LiveUpdate node) {
			ObjectNode json = typed("live_update");
			json.put("interval_seconds", node.intervalSeconds());
			json.set("body", array(node.body()));
			json.set("advisory", diagnostic(node.advisory()));
			return json;
		}

		@Override
		public ObjectNode visitError(Node.Error node) {
			ObjectNode json = typed("error");
			json.put("message", node.message());
			json.set("original", macroCall(node.original()));
			return json;
		}

		@Override
		public ObjectNode visitWarning(Node.Warning node) {
			ObjectNode json = typed("warning");
			json.put("message", node.message());
			json.set("original", macroCall(node.original()));
			return json;
		}

		private ObjectNode withTarget(String type, Node target) {
			ObjectNode json = typed(type);
			json.set("target", toJson(target));
			return json;
		}

		private ObjectNode binary(String type, String operator, Node left, Node right) {
			ObjectNode json = typed(type);
			json.put("operator", operator);
			json.set("left", toJson(left));
			json.set("right", toJson(right));
			return json;
		}
	}
}
