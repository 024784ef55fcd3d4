package org.javai.xpp;

/**
 * Exception thrown when reading XPP input fails.
 */
public class XppParseException extends RuntimeException {

	public XppParseException(String message) {
		super(message);
	}

	public XppParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
