package org.javai.twine.harlowe.macro;

import org.javai.twine.ast.MacroCall;
import org.javai.twine.ast.Node;

/**
 * Translates one recognised macro call into a syntax-tree node.
 * <p>
 * Translators are pure: everything they may use is in the call and the context.
 * Malformed calls are reported by returning an {@code Error} node, never by
 * throwing.
 */
@FunctionalInterface
public interface MacroTranslator {

	Node translate(MacroCall call, TranslationContext context);
}
