package org.javai.xpp.grammar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.javai.xpp.XppFrontEnd;
import org.javai.xpp.XppParseException;
import org.javai.xpp.XppToken;
import org.javai.xpp.XppToken.TokenType;
import org.javai.xpp.ast.Command;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("XppLanguageParser")
class XppLanguageParserTest {

	private final XppLanguageParser parser = new XppLanguageParser();

	private static final String MINIMAL = """
			language:
			  id: mini
			  version: "0.1"
			keywords:
			  - type: PARAMETER
			    prefix: param
			  - type: DONE
			    prefix: end
			    exact: true
			option_marker: "@"
			comment_prefixes: ["#"]
			index_variable: k
			block_delimiter: "%"
			""";

	@Nested
	@DisplayName("Bundled table")
	class BundledTable {

		@Test
		@DisplayName("loads the standard language once")
		void standardLanguage() {
			XppLanguage language = XppLanguage.standard();

			assertThat(language).isSameAs(XppLanguage.standard());
			assertThat(language.id()).isEqualTo("xpp");
			assertThat(language.indexVariable()).isEqualTo("j");
			assertThat(language.optionMarker()).isEqualTo('@');
			assertThat(language.ignoredDirectives()).contains("table", "bdry", "set");
		}

		@Test
		@DisplayName("classifies keyword spellings, first rule wins")
		void keywordFor() {
			XppLanguage language = XppLanguage.standard();

			assertThat(language.keywordFor("parameter")).contains(TokenType.PARAMETER);
			assertThat(language.keywordFor("initial")).contains(TokenType.INITIAL);
			assertThat(language.keywordFor("auxiliary")).contains(TokenType.AUXILIARY);
			assertThat(language.keywordFor("numbers")).contains(TokenType.NUMBER);
			assertThat(language.keywordFor("done")).contains(TokenType.DONE);
			assertThat(language.keywordFor("donee")).isEmpty();
			assertThat(language.keywordFor("x")).isEmpty();
		}
	}

	@Nested
	@DisplayName("Custom tables")
	class CustomTables {

		@Test
		@DisplayName("parses a minimal table from a string")
		void minimalTable() {
			XppLanguage language = parser.parseString(MINIMAL);

			assertThat(language.id()).isEqualTo("mini");
			assertThat(language.version()).isEqualTo("0.1");
			assertThat(language.keywords()).containsExactly(
					new KeywordRule(TokenType.PARAMETER, "param", false),
					new KeywordRule(TokenType.DONE, "end", true));
			assertThat(language.ignoredDirectives()).isEmpty();
			assertThat(language.isCommentPrefix('#')).isTrue();
			assertThat(language.isCommentPrefix('"')).isFalse();
		}

		@Test
		@DisplayName("drives the tokenizer and parser")
		void drivesFrontEnd() {
			XppFrontEnd frontEnd = new XppFrontEnd(parser.parseString(MINIMAL));

			List<XppToken> tokens = frontEnd.tokenize("par a=1\nend\n");
			assertThat(tokens.get(0).type()).isEqualTo(TokenType.IDENTIFIER);
			assertThat(frontEnd.tokenize("param a=1").get(0).type()).isEqualTo(TokenType.PARAMETER);

			assertThat(frontEnd.parse("x[1..2]'=x[k+1]\nend").commands())
					.hasSize(3)
					.last().isEqualTo(new Command.Done());
		}

		@Test
		@DisplayName("reads a table from a file")
		void fromPath(@TempDir Path dir) throws IOException {
			Path file = dir.resolve("mini.yml");
			Files.writeString(file, MINIMAL);

			assertThat(parser.parse(file).id()).isEqualTo("mini");
		}
	}

	@Nested
	@DisplayName("Errors")
	class Errors {

		@Test
		@DisplayName("rejects a table without language section")
		void missingLanguageSection() {
			assertThatThrownBy(() -> parser.parseString("index_variable: j\n"))
					.isInstanceOf(XppParseException.class)
					.hasRootCauseMessage("Missing required 'language' section");
		}

		@Test
		@DisplayName("rejects an unknown keyword type")
		void unknownKeywordType() {
			String yaml = MINIMAL.replace("type: PARAMETER", "type: PARAMETERS");

			assertThatThrownBy(() -> parser.parseString(yaml))
					.isInstanceOf(XppParseException.class)
					.hasStackTraceContaining("Unknown keyword type: PARAMETERS");
		}

		@Test
		@DisplayName("rejects a keyword type that is not a line keyword")
		void notALineKeyword() {
			String yaml = MINIMAL.replace("type: PARAMETER", "type: IDENTIFIER");

			assertThatThrownBy(() -> parser.parseString(yaml))
					.isInstanceOf(XppParseException.class)
					.hasStackTraceContaining("Not a line keyword: IDENTIFIER");
		}

		@Test
		@DisplayName("rejects multi-character markers")
		void multiCharacterMarker() {
			String yaml = MINIMAL.replace("option_marker: \"@\"", "option_marker: \"@@\"");

			assertThatThrownBy(() -> parser.parseString(yaml))
					.isInstanceOf(XppParseException.class)
					.hasStackTraceContaining("'option_marker' must be a single character");
		}

		@Test
		@DisplayName("wraps a missing file")
		void missingFile(@TempDir Path dir) {
			assertThatThrownBy(() -> parser.parse(dir.resolve("none.yml")))
					.isInstanceOf(XppParseException.class)
					.hasMessageContaining("none.yml");
		}
	}
}
