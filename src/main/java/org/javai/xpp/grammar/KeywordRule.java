package org.javai.xpp.grammar;

import java.util.Objects;
import org.javai.xpp.XppToken.TokenType;

/**
 * Recognizes a line keyword by its abbreviation.
 *
 * @param type the keyword token produced on a match
 * @param prefix the shortest accepted spelling
 * @param exact whether the word must equal the prefix rather than start with it
 */
public record KeywordRule(TokenType type, String prefix, boolean exact) {

	public KeywordRule {
		Objects.requireNonNull(type, "type must not be null");
		if (!type.isLineKeyword()) {
			throw new IllegalArgumentException("Not a line keyword: " + type);
		}
		if (prefix == null || prefix.isBlank()) {
			throw new IllegalArgumentException("Keyword " + type + " needs a prefix");
		}
	}

	/**
	 * @param word a lower-cased word made of identifier characters
	 */
	public boolean matches(String word) {
		return exact ? word.equals(prefix) : word.startsWith(prefix);
	}
}
