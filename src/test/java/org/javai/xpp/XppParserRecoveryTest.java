package org.javai.xpp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.xpp.ast.Command;
import org.javai.xpp.grammar.XppLanguage;
import org.javai.xpp.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

@DisplayName("XppParser error recovery")
class XppParserRecoveryTest {

	@Mock
	private SyntaxErrorListener listener;

	XppParserRecoveryTest() {
		MockitoAnnotations.openMocks(this);
	}

	private Program parse(String text) {
		return new XppParser(new XppTokenizer(text).tokenize(), XppLanguage.standard(), listener).parse();
	}

	@Test
	@DisplayName("drops a malformed statement and keeps the others")
	void dropsMalformedStatement() {
		Program program = parse("par a=1\npar b=*\npar c=3\n");

		assertThat(program.commands()).hasSize(2);
		assertThat(((Command.Par) program.get(0)).assigns("a")).isTrue();
		assertThat(((Command.Par) program.get(1)).assigns("c")).isTrue();
		verify(listener).statementDropped(argThat(error -> error.line() == 2));
	}

	@Test
	@DisplayName("reports every dropped statement in program order")
	void reportsEveryDroppedStatement() {
		Program program = parse("x'=(\ny'=y\nglobal 5 {x} {y=0}\nf()=1\n");

		assertThat(program.stateVariables()).containsExactly("y");
		verify(listener, times(3)).statementDropped(any());
		verify(listener).statementDropped(argThat(error -> error.line() == 1));
		verify(listener).statementDropped(argThat(error -> error.line() == 3));
		verify(listener).statementDropped(argThat(error -> error.line() == 4));
	}

	@Test
	@DisplayName("reports statements rejected by node validation")
	void nodeValidationFailure() {
		Program program = parse("f(x,x)=x\nx'=1\n");

		assertThat(program.commands()).hasSize(1);
		verify(listener).statementDropped(argThat(error ->
				error.getCause() instanceof IllegalArgumentException && !error.atEndOfInput()));
	}

	@Test
	@DisplayName("throws when the violation is met at end of input")
	void fatalAtEndOfInput() {
		assertThatThrownBy(() -> parse("par a=1\npar b=(1+2"))
				.isInstanceOfSatisfying(XppSyntaxException.class, e -> {
					assertThat(e.atEndOfInput()).isTrue();
					assertThat(e.line()).isEqualTo(2);
					assertThat(e.token().type()).isEqualTo(XppToken.TokenType.EOF);
				});
		verify(listener, never()).statementDropped(any());
	}

	@Test
	@DisplayName("a malformed last line followed by a newline is recovered")
	void lastLineWithNewline() {
		Program program = parse("par a=1\npar b=\n");

		assertThat(program.commands()).hasSize(1);
		verify(listener).statementDropped(argThat(error -> error.token().isType(XppToken.TokenType.NEWLINE)));
	}

	@Test
	@DisplayName("the default listener logs dropped statements at WARN")
	void defaultListenerLogs() {
		try (LogCaptorAppender appender = LogCaptorAppender.create(XppParser.class, Level.WARN)) {
			Program program = new XppParser(new XppTokenizer("a=1\nb=)\nc=3\n").tokenize()).parse();

			assertThat(program.commands()).hasSize(2);
			assertThat(appender.messages(Level.WARN))
					.singleElement()
					.satisfies(msg -> assertThat(msg).startsWith("Dropped statement at line 2"));
		}
	}

	@Test
	@DisplayName("rejects a null listener")
	void nullListener() {
		assertThatThrownBy(() -> new XppParser(List.of(), XppLanguage.standard(), null))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
