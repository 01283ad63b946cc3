package org.javai.twine.ast;

/**
 * Kind of value carried by a {@link Node.Literal}.
 */
public enum LiteralKind {
	NUMBER,
	STRING,
	BOOLEAN,
	NULL
}
