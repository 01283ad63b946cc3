package org.javai.twine.ast;

import java.util.Objects;

/**
 * A structured diagnostic attached to a node whose conversion lost fidelity.
 *
 * @param severity how serious the loss is
 * @param message human-readable explanation
 */
public record Diagnostic(Severity severity, String message) {

	public Diagnostic {
		Objects.requireNonNull(severity, "severity must not be null");
		Objects.requireNonNull(message, "message must not be null");
	}

	public static Diagnostic warning(String message) {
		return new Diagnostic(Severity.WARNING, message);
	}
}
