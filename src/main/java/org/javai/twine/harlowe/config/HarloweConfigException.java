package org.javai.twine.harlowe.config;

/**
 * Exception thrown when parser configuration cannot be read.
 */
public class HarloweConfigException extends RuntimeException {

	public HarloweConfigException(String message) {
		super(message);
	}

	public HarloweConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
