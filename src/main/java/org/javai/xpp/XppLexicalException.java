package org.javai.xpp;

/**
 * Thrown when the tokenizer meets a character that starts no token.
 * Tokenizing stops at the first such character.
 */
public class XppLexicalException extends XppParseException {

	private final char character;
	private final int line;

	public XppLexicalException(char character, int line) {
		super("Unexpected character '" + character + "' at line " + line);
		this.character = character;
		this.line = line;
	}

	public char character() {
		return character;
	}

	public int line() {
		return line;
	}
}
