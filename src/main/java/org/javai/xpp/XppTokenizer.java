package org.javai.xpp;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.xpp.XppToken.TokenType;
import org.javai.xpp.grammar.XppLanguage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tokenizer for XPP model files.
 * Converts input text into a stream of tokens.
 *
 * <p>The language is line oriented: newlines are emitted as tokens and line keywords
 * ({@code par}, {@code init}, {@code @}, ...) are only recognized as the first word of
 * a line. Identifiers are lower-cased.</p>
 *
 * <p>A tokenizer holds the cursor for one input and is not meant to be shared between
 * threads; {@link #tokenize()} can be called again and starts over.</p>
 */
public class XppTokenizer {

	private static final Logger logger = LoggerFactory.getLogger(XppTokenizer.class);

	private static final Pattern LEIBNIZ = Pattern.compile("[dD]([A-Za-z_]\\w*)/[dD][tT](?=[ \\t\\r]*=)");

	private static final Map<String, TokenType> RESERVED_WORDS = Map.of(
		"if", TokenType.IF,
		"then", TokenType.THEN,
		"else", TokenType.ELSE,
		"sum", TokenType.SUM,
		"of", TokenType.OF
	);

	private final String input;
	private final XppLanguage language;
	private int pos;
	private int line;
	private boolean atLineStart;

	public XppTokenizer(String input) {
		this(input, XppLanguage.standard());
	}

	public XppTokenizer(String input, XppLanguage language) {
		if (language == null) {
			throw new IllegalArgumentException("Language cannot be null");
		}
		this.input = input != null ? input : "";
		this.language = language;
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens (includes EOF token at end)
	 * @throws XppLexicalException at the first character that starts no token
	 */
	public List<XppToken> tokenize() {
		pos = 0;
		line = 1;
		atLineStart = true;
		List<XppToken> tokens = new ArrayList<>();

		while (true) {
			skipBlanks();
			if (isAtEnd()) break;
			if (atLineStart && skipDiscardedLine()) continue;

			XppToken token = nextToken();
			tokens.add(token);
			atLineStart = token.isType(TokenType.NEWLINE);
		}

		tokens.add(new XppToken(TokenType.EOF, "", line));
		return tokens;
	}

	private XppToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '\n' -> {
				advance();
				XppToken token = new XppToken(TokenType.NEWLINE, "\n", line);
				line++;
				yield token;
			}
			case '+' -> single(TokenType.PLUS);
			case '-' -> single(TokenType.MINUS);
			case '^' -> single(TokenType.POWER);
			case '/' -> single(TokenType.DIVIDE);
			case '(' -> single(TokenType.LPAREN);
			case ')' -> single(TokenType.RPAREN);
			case '[' -> single(TokenType.LBRACKET);
			case ']' -> single(TokenType.RBRACKET);
			case '{' -> single(TokenType.LBRACE);
			case '}' -> single(TokenType.RBRACE);
			case ',' -> single(TokenType.COMMA);
			case ';' -> single(TokenType.SEMICOLON);
			case '\'' -> single(TokenType.APOSTROPHE);
			case '*' -> peekNext() == '*' ? pair(TokenType.POWER) : single(TokenType.TIMES);
			case '=' -> peekNext() == '=' ? pair(TokenType.EQ) : single(TokenType.EQUALS);
			case '<' -> switch (peekNext()) {
				case '=' -> pair(TokenType.LE);
				case '>' -> pair(TokenType.NE);
				default -> single(TokenType.LT);
			};
			case '>' -> peekNext() == '=' ? pair(TokenType.GE) : single(TokenType.GT);
			case '.' -> {
				if (peekNext() == '.') {
					yield pair(TokenType.RANGE);
				}
				if (isDigit(peekNext())) {
					yield scanNumber();
				}
				throw new XppLexicalException(c, line);
			}
			default -> {
				if (c == language.optionMarker() && atLineStart) {
					advance();
					yield new XppToken(TokenType.OPTION, String.valueOf(c), line);
				} else if (isDigit(c)) {
					yield scanNumber();
				} else if (isIdentifierStart(c)) {
					yield scanWord();
				} else {
					throw new XppLexicalException(input.charAt(start), line);
				}
			}
		};
	}

	private XppToken single(TokenType type) {
		int start = pos;
		advance();
		return new XppToken(type, input.substring(start, pos), line);
	}

	private XppToken pair(TokenType type) {
		int start = pos;
		advance();
		advance();
		return new XppToken(type, input.substring(start, pos), line);
	}

	private XppToken scanNumber() {
		int start = pos;
		boolean floating = false;

		while (!isAtEnd() && isDigit(peek())) {
			advance();
		}

		// A dot next to another dot belongs to an array range, not to the number
		if (peek() == '.' && peekNext() != '.') {
			floating = true;
			advance(); // consume '.'
			while (!isAtEnd() && isDigit(peek())) {
				advance();
			}
		}

		if ((peek() == 'e' || peek() == 'E') && startsExponent()) {
			floating = true;
			advance(); // consume 'e'
			if (peek() == '+' || peek() == '-') {
				advance();
			}
			while (!isAtEnd() && isDigit(peek())) {
				advance();
			}
		}

		String value = input.substring(start, pos);
		return new XppToken(floating ? TokenType.FLOAT : TokenType.INTEGER, value, line);
	}

	private boolean startsExponent() {
		char next = peekNext();
		if (isDigit(next)) {
			return true;
		}
		return (next == '+' || next == '-') && pos + 2 < input.length() && isDigit(input.charAt(pos + 2));
	}

	private XppToken scanWord() {
		// dx/dt names a derivative only as the left-hand side of an equation
		Matcher leibniz = LEIBNIZ.matcher(input).region(pos, input.length());
		if (atLineStart && leibniz.lookingAt()) {
			pos = leibniz.end();
			return new XppToken(TokenType.LEIBNIZ, leibniz.group().toLowerCase(Locale.ROOT), line);
		}

		String word = readWord();
		if (peek() == '\'') {
			advance();
			return new XppToken(TokenType.EULER, word + "'", line);
		}
		if (atLineStart && followedByBlank()) {
			Optional<TokenType> keyword = language.keywordFor(word);
			if (keyword.isPresent()) {
				return new XppToken(keyword.get(), word, line);
			}
		}
		TokenType reserved = RESERVED_WORDS.get(word);
		return new XppToken(reserved != null ? reserved : TokenType.IDENTIFIER, word, line);
	}

	private String readWord() {
		int start = pos;
		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}
		return input.substring(start, pos).toLowerCase(Locale.ROOT);
	}

	/**
	 * Skips comment lines, unsupported directives and pseudo-array blocks. The cursor
	 * stays on the terminating newline so it is still emitted and counted.
	 */
	private boolean skipDiscardedLine() {
		char c = peek();
		if (language.isCommentPrefix(c) || language.isIgnoredLinePrefix(c)) {
			skipToEndOfLine();
			return true;
		}
		if (c == language.blockDelimiter()) {
			skipBlock();
			return true;
		}
		if (isIdentifierStart(c)) {
			int start = pos;
			String word = readWord();
			if (language.isIgnoredDirective(word) && followedByBlank()) {
				logger.debug("Skipping unsupported directive '{}' at line {}", word, line);
				skipToEndOfLine();
				return true;
			}
			pos = start;
		}
		return false;
	}

	private void skipToEndOfLine() {
		while (!isAtEnd() && peek() != '\n') {
			advance();
		}
	}

	private void skipBlock() {
		int startLine = line;
		advance(); // consume opening delimiter
		while (!isAtEnd() && peek() != language.blockDelimiter()) {
			if (advance() == '\n') {
				line++;
			}
		}
		logger.debug("Skipping block from line {} to line {}", startLine, line);
		skipToEndOfLine();
	}

	private boolean followedByBlank() {
		return isAtEnd() || isBlank(peek()) || peek() == '\n';
	}

	private void skipBlanks() {
		while (!isAtEnd() && isBlank(peek())) {
			advance();
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char peekNext() {
		return pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isBlank(char c) {
		return c == ' ' || c == '\t' || c == '\r';
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || isDigit(c);
	}
}
