package org.javai.xpp;

import java.util.EnumSet;
import java.util.Set;

/**
 * Represents a token of an XPP model file.
 *
 * @param type the token type
 * @param value the token value (lower-cased for words)
 * @param line the 1-based line the token starts on
 */
public record XppToken(TokenType type, String value, int line) {

	public enum TokenType {
		INTEGER,       // 42
		FLOAT,         // 4.2, .5, 1e-3
		PLUS,          // +
		MINUS,         // -
		TIMES,         // *
		DIVIDE,        // /
		POWER,         // ^ or **
		EQUALS,        // =
		LT,            // <
		LE,            // <=
		GT,            // >
		GE,            // >=
		NE,            // <>
		EQ,            // ==
		LPAREN,        // (
		RPAREN,        // )
		LBRACKET,      // [
		RBRACKET,      // ]
		LBRACE,        // {
		RBRACE,        // }
		COMMA,         // ,
		SEMICOLON,     // ;
		APOSTROPHE,    // ' after an array range
		RANGE,         // .. inside an array range
		PARAMETER,     // p, par, param at line start
		INITIAL,       // i, init at line start
		AUXILIARY,     // aux at line start
		OPTION,        // @ at line start
		GLOBAL,        // global at line start
		NUMBER,        // number at line start
		DONE,          // done at line start
		IF,
		THEN,
		ELSE,
		SUM,
		OF,
		LEIBNIZ,       // dv/dt
		EULER,         // v'
		IDENTIFIER,
		NEWLINE,
		EOF;

		private static final Set<TokenType> LINE_KEYWORDS =
				EnumSet.of(PARAMETER, INITIAL, AUXILIARY, OPTION, GLOBAL, NUMBER, DONE);

		private static final Set<TokenType> COMPARISONS = EnumSet.of(LT, LE, GT, GE, NE, EQ);

		/**
		 * Keywords that are only recognized as the first word of a line.
		 */
		public boolean isLineKeyword() {
			return LINE_KEYWORDS.contains(this);
		}

		public boolean isComparison() {
			return COMPARISONS.contains(this);
		}
	}

	@Override
	public String toString() {
		return switch (type) {
			case NEWLINE -> "NEWLINE";
			case EOF -> "EOF";
			default -> type + "(" + value + ")";
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	/**
	 * Returns the bare state variable carried by a {@code LEIBNIZ} or {@code EULER} token.
	 *
	 * @throws IllegalStateException for any other token type
	 */
	public String stateVariable() {
		return switch (type) {
			case LEIBNIZ -> value.substring(1, value.length() - "/dt".length());
			case EULER -> value.substring(0, value.length() - 1);
			default -> throw new IllegalStateException("Token " + this + " does not name a state variable");
		};
	}
}
