package org.javai.twine.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Utility class for walking syntax trees.
 * Provides common traversal patterns and diagnostic collection.
 */
public final class NodeWalker {

	private NodeWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Visits a node and then its children, depth first, in source order.
	 *
	 * @param node the root node to start traversal from
	 * @param action called once per node
	 */
	public static void walkPreOrder(Node node, Consumer<Node> action) {
		if (node == null) {
			return;
		}
		action.accept(node);
		for (Node child : node.children()) {
			walkPreOrder(child, action);
		}
	}

	/**
	 * Visits the children of a node before the node itself.
	 */
	public static void walkPostOrder(Node node, Consumer<Node> action) {
		if (node == null) {
			return;
		}
		for (Node child : node.children()) {
			walkPostOrder(child, action);
		}
		action.accept(node);
	}

	/**
	 * Walks a list of top-level nodes in pre-order.
	 */
	public static void walkAll(List<Node> nodes, Consumer<Node> action) {
		if (nodes == null) {
			return;
		}
		for (Node node : nodes) {
			walkPreOrder(node, action);
		}
	}

	/**
	 * Collects every diagnostic in the tree, in source order: {@code Error} and
	 * {@code Warning} nodes, and the advisories carried by live and event nodes.
	 */
	public static List<Diagnostic> diagnostics(List<Node> nodes) {
		List<Diagnostic> diagnostics = new ArrayList<>();
		walkAll(nodes, node -> {
			if (node instanceof Node.Error error) {
				diagnostics.add(new Diagnostic(Severity.ERROR, error.message()));
			}
			else if (node instanceof Node.Warning warning) {
				diagnostics.add(new Diagnostic(Severity.WARNING, warning.message()));
			}
			else if (node instanceof Node.LiveUpdate live) {
				diagnostics.add(live.advisory());
			}
			else if (node instanceof Node.EventListener event) {
				diagnostics.add(event.advisory());
			}
		});
		return diagnostics;
	}

	/**
	 * Returns true if the tree contains at least one {@code Error} node.
	 */
	public static boolean hasErrors(List<Node> nodes) {
		return diagnostics(nodes).stream().anyMatch(d -> d.severity() == Severity.ERROR);
	}
}
