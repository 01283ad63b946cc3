package org.javai.twine;

import java.util.List;
import org.javai.twine.ast.Node;

/**
 * Converts the raw text of one passage into an ordered list of syntax-tree nodes.
 * <p>
 * Implementations never throw for malformed passage content. Defects are reported
 * as {@code Error} and {@code Warning} nodes at the position where they occur, so
 * a single pass over the result recovers both structure and diagnostics.
 */
public interface PassageParser {

	/**
	 * @param text passage source; {@code null} is treated as empty
	 * @return the passage's nodes in source order, never {@code null}
	 */
	List<Node> parsePassage(String text);
}
