package org.javai.xpp;

/**
 * Exception thrown when an AST cannot be written back to XPP text.
 */
public class XppGenerationException extends RuntimeException {

	public XppGenerationException(String message) {
		super(message);
	}

	public XppGenerationException(String message, Throwable cause) {
		super(message, cause);
	}
}
