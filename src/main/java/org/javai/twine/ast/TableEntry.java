package org.javai.twine.ast;

import java.util.Objects;

/**
 * One key/value pair of a {@link Node.TableLiteral}, kept in source order.
 */
public record TableEntry(String key, Node value) {

	public TableEntry {
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(value, "value must not be null");
	}
}
