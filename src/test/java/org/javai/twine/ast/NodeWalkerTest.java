package org.javai.twine.ast;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class NodeWalkerTest {

	private final List<Node> tree = List.of(
			Nodes.text("a"),
			Nodes.conditional(Nodes.storyVariable("x"), List.of(
					Nodes.warning("Unsupported Harlowe macro: foo", MacroCall.of("foo")),
					Nodes.liveUpdate(1, List.of(Nodes.error("inner"))))),
			Nodes.eventListener(Nodes.bool(true), List.of()));

	@Test
	void preOrderVisitsParentsFirst() {
		List<String> seen = new ArrayList<>();

		NodeWalker.walkAll(tree, node -> seen.add(node.getClass().getSimpleName()));

		assertThat(seen).containsExactly("Text", "Conditional", "VariableRef", "Warning", "LiveUpdate", "Error",
				"EventListener", "Literal");
	}

	@Test
	void postOrderVisitsChildrenFirst() {
		List<String> seen = new ArrayList<>();

		NodeWalker.walkPostOrder(tree.get(1), node -> seen.add(node.getClass().getSimpleName()));

		assertThat(seen).containsExactly("VariableRef", "Warning", "Error", "LiveUpdate", "Conditional");
	}

	@Test
	void diagnosticsInSourceOrder() {
		List<Diagnostic> diagnostics = NodeWalker.diagnostics(tree);

		assertThat(diagnostics).extracting(Diagnostic::severity).containsExactly(
				Severity.WARNING, Severity.WARNING, Severity.ERROR, Severity.WARNING);
		assertThat(diagnostics.get(0).message()).isEqualTo("Unsupported Harlowe macro: foo");
		assertThat(diagnostics.get(2).message()).isEqualTo("inner");
		assertThat(NodeWalker.hasErrors(tree)).isTrue();
		assertThat(NodeWalker.hasErrors(List.of(Nodes.text("fine")))).isFalse();
	}

	@Test
	void nullInputsAreIgnored() {
		List<Node> seen = new ArrayList<>();

		NodeWalker.walkAll(null, seen::add);
		NodeWalker.walkPreOrder(null, seen::add);

		assertThat(seen).isEmpty();
	}
}
