package org.javai.xpp.grammar;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.xpp.XppToken.TokenType;

/**
 * Read-only lexical tables of the XPP language.
 * 
 * <p>Instances are immutable and safe to share between threads; the tokenizer and
 * parser keep their cursor state per instance and only read from here.</p>
 *
 * @param id language id
 * @param version table version
 * @param keywords line keyword rules, first match wins
 * @param optionMarker character that opens an option line
 * @param commentPrefixes characters that turn a whole line into a comment
 * @param ignoredDirectives directive words whose lines are skipped
 * @param ignoredLinePrefixes characters whose lines are skipped
 * @param blockDelimiter character that opens and closes a skipped block
 * @param indexVariable the array expansion variable used in {@code x[j+1]}
 */
public record XppLanguage(
		String id,
		String version,
		List<KeywordRule> keywords,
		char optionMarker,
		Set<Character> commentPrefixes,
		Set<String> ignoredDirectives,
		Set<Character> ignoredLinePrefixes,
		char blockDelimiter,
		String indexVariable
) {

	static final String STANDARD_RESOURCE = "META-INF/xpp-language.yml";

	public XppLanguage {
		Objects.requireNonNull(id, "id must not be null");
		keywords = keywords != null ? List.copyOf(keywords) : List.of();
		commentPrefixes = commentPrefixes != null ? Set.copyOf(commentPrefixes) : Set.of();
		ignoredDirectives = ignoredDirectives != null ? Set.copyOf(ignoredDirectives) : Set.of();
		ignoredLinePrefixes = ignoredLinePrefixes != null ? Set.copyOf(ignoredLinePrefixes) : Set.of();
		if (indexVariable == null || indexVariable.isBlank()) {
			throw new IllegalArgumentException("Language '" + id + "' is missing an index variable");
		}
	}

	/**
	 * The bundled XPP tables, loaded once from {@value #STANDARD_RESOURCE}.
	 */
	public static XppLanguage standard() {
		return StandardHolder.INSTANCE;
	}

	/**
	 * Classifies a word found at the start of a line.
	 */
	public Optional<TokenType> keywordFor(String word) {
		for (KeywordRule rule : keywords) {
			if (rule.matches(word)) {
				return Optional.of(rule.type());
			}
		}
		return Optional.empty();
	}

	public boolean isCommentPrefix(char c) {
		return commentPrefixes.contains(c);
	}

	public boolean isIgnoredDirective(String word) {
		return ignoredDirectives.contains(word);
	}

	public boolean isIgnoredLinePrefix(char c) {
		return ignoredLinePrefixes.contains(c);
	}

	private static final class StandardHolder {

		private static final XppLanguage INSTANCE = load();

		private static XppLanguage load() {
			ClassLoader loader = XppLanguage.class.getClassLoader();
			try (InputStream is = loader.getResourceAsStream(STANDARD_RESOURCE)) {
				if (is == null) {
					throw new IllegalStateException("Resource not found: " + STANDARD_RESOURCE);
				}
				return new XppLanguageParser().parse(is);
			}
			catch (IOException e) {
				throw new IllegalStateException("Failed to load " + STANDARD_RESOURCE, e);
			}
		}
	}
}
