package org.javai.xpp;

/**
 * Thrown when a statement cannot be reduced to any grammar rule.
 * 
 * <p>The parser recovers from these inside a statement and only propagates
 * them when the violation is met at end of input.</p>
 */
public class XppSyntaxException extends XppParseException {

	private final XppToken token;

	public XppSyntaxException(String detail, XppToken token) {
		super("Syntax error at line " + token.line() + " near " + token + ": " + detail);
		this.token = token;
	}

	public XppSyntaxException(String detail, XppToken token, Throwable cause) {
		super("Syntax error at line " + token.line() + " near " + token + ": " + detail, cause);
		this.token = token;
	}

	public int line() {
		return token.line();
	}

	public XppToken token() {
		return token;
	}

	public boolean atEndOfInput() {
		return token.isType(XppToken.TokenType.EOF);
	}
}
