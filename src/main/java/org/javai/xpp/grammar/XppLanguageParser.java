package org.javai.xpp.grammar;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.xpp.XppParseException;
import org.javai.xpp.XppToken.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Parser for XPP language table YAML files.
 * Parses YAML and creates an {@link XppLanguage} instance.
 */
public class XppLanguageParser {

	private static final Logger logger = LoggerFactory.getLogger(XppLanguageParser.class);

	private final Yaml yaml = new Yaml();

	/**
	 * Parse a language table from a path.
	 */
	public XppLanguage parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (Exception e) {
			throw new XppParseException("Failed to parse language table from path: " + path, e);
		}
	}

	/**
	 * Parse a language table from an input stream.
	 */
	public XppLanguage parse(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return buildLanguage(data);
		} catch (Exception e) {
			throw new XppParseException("Failed to parse language table from input stream", e);
		}
	}

	/**
	 * Parse a language table from a reader.
	 */
	public XppLanguage parse(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return buildLanguage(data);
		} catch (Exception e) {
			throw new XppParseException("Failed to parse language table from reader", e);
		}
	}

	/**
	 * Parse a language table from a string.
	 */
	public XppLanguage parseString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return buildLanguage(data);
		} catch (Exception e) {
			throw new XppParseException("Failed to parse language table from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private XppLanguage buildLanguage(Map<String, Object> data) {
		if (data == null) {
			throw new XppParseException("Language table is empty");
		}
		Map<String, Object> languageMap = (Map<String, Object>) data.get("language");
		if (languageMap == null) {
			throw new XppParseException("Missing required 'language' section");
		}

		List<Map<String, Object>> keywordList = (List<Map<String, Object>>) data.get("keywords");
		List<KeywordRule> keywords = buildKeywords(keywordList);

		XppLanguage language = new XppLanguage(
			toString(languageMap.get("id")),
			toString(languageMap.get("version")),
			keywords,
			toChar(data.get("option_marker"), "option_marker"),
			toChars((List<Object>) data.get("comment_prefixes"), "comment_prefixes"),
			toWords((List<Object>) data.get("ignored_directives")),
			toChars((List<Object>) data.get("ignored_line_prefixes"), "ignored_line_prefixes"),
			toChar(data.get("block_delimiter"), "block_delimiter"),
			toString(data.get("index_variable"))
		);
		logger.debug("Loaded language table '{}' version {} with {} keyword rules",
				language.id(), language.version(), keywords.size());
		return language;
	}

	private List<KeywordRule> buildKeywords(List<Map<String, Object>> keywordList) {
		if (keywordList == null) {
			return List.of();
		}
		List<KeywordRule> rules = new ArrayList<>();
		for (Map<String, Object> keywordData : keywordList) {
			String typeStr = toString(keywordData.get("type"));
			TokenType type;
			try {
				type = TokenType.valueOf(typeStr);
			} catch (IllegalArgumentException e) {
				throw new XppParseException("Unknown keyword type: " + typeStr, e);
			}
			Boolean exact = (Boolean) keywordData.get("exact");
			rules.add(new KeywordRule(type, toString(keywordData.get("prefix")), exact != null && exact));
		}
		return rules;
	}

	private String toString(Object obj) {
		if (obj == null) {
			return null;
		}
		return obj instanceof String ? (String) obj : String.valueOf(obj);
	}

	private char toChar(Object obj, String field) {
		String value = toString(obj);
		if (value == null || value.length() != 1) {
			throw new XppParseException("'" + field + "' must be a single character, found: " + value);
		}
		return value.charAt(0);
	}

	private Set<Character> toChars(List<Object> values, String field) {
		Set<Character> chars = new LinkedHashSet<>();
		if (values != null) {
			for (Object value : values) {
				chars.add(toChar(value, field));
			}
		}
		return chars;
	}

	private Set<String> toWords(List<Object> values) {
		Set<String> words = new LinkedHashSet<>();
		if (values != null) {
			for (Object value : values) {
				words.add(toString(value));
			}
		}
		return words;
	}
}
