package org.javai.twine.ast;

/**
 * Mutation applied to the content of a named hook.
 */
public enum HookOperation {
	REPLACE,
	APPEND,
	PREPEND
}
