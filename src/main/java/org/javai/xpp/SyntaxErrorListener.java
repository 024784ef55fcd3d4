package org.javai.xpp;

/**
 * Receives the statements the parser dropped while recovering from syntax errors.
 */
@FunctionalInterface
public interface SyntaxErrorListener {

	/**
	 * Called once per dropped statement, in program order.
	 *
	 * @param error the violation that caused the statement to be dropped
	 */
	void statementDropped(XppSyntaxException error);
}
