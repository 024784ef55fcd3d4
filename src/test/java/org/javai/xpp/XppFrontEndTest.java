package org.javai.xpp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.javai.xpp.ast.Assignment;
import org.javai.xpp.ast.Command;
import org.javai.xpp.ast.Expression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("XppFrontEnd")
class XppFrontEndTest {

	private final XppFrontEnd xpp = XppFrontEnd.standard();

	private static String model() throws IOException {
		try (InputStream in = XppFrontEndTest.class.getClassLoader().getResourceAsStream("models/morris-lecar.ode")) {
			if (in == null) {
				throw new IllegalStateException("Could not load model resource");
			}
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
	}

	@Test
	@DisplayName("standard() returns a shared instance")
	void sharedInstance() {
		assertThat(XppFrontEnd.standard()).isSameAs(xpp);
		assertThat(xpp.language().id()).isEqualTo("xpp");
	}

	@Nested
	@DisplayName("Files")
	class ModelFiles {

		@Test
		@DisplayName("parses the bundled model")
		void parsesModel() throws IOException {
			Program program = xpp.parse(model());

			assertThat(program.size()).isEqualTo(15);
			assertThat(program.stateVariables()).containsExactly("v", "w");
			assertThat(program.parameters()).hasSize(13);
			assertThat(program.initialConditions()).containsOnlyKeys("v", "w");
			assertThat(program.options()).containsKeys("total", "dt", "xhi", "xlo", "ylo", "yhi");
			assertThat(program.auxiliaryVariables()).containsExactly("iion");
		}

		@Test
		@DisplayName("reads and writes model files")
		void readAndWrite(@TempDir Path dir) throws IOException {
			Path source = dir.resolve("ml.ode");
			Files.writeString(source, model());

			Program program = xpp.parseFile(source);
			Path target = dir.resolve("ml-out.ode");
			xpp.write(program, target);

			assertThat(Files.readString(target)).isEqualTo(xpp.generate(program));
			assertThat(xpp.parseFile(target).withoutGroups()).isEqualTo(program.withoutGroups());
		}

		@Test
		@DisplayName("wraps read failures")
		void missingFile(@TempDir Path dir) {
			Path missing = dir.resolve("missing.ode");

			assertThatThrownBy(() -> xpp.parseFile(missing))
					.isInstanceOf(XppParseException.class)
					.hasMessageContaining("missing.ode")
					.hasCauseInstanceOf(IOException.class);
		}

		@Test
		@DisplayName("wraps write failures")
		void unwritableTarget(@TempDir Path dir) {
			Program program = xpp.parse("x'=1\n");

			assertThatThrownBy(() -> xpp.write(program, dir.resolve("no-such-dir").resolve("out.ode")))
					.isInstanceOf(XppGenerationException.class)
					.hasCauseInstanceOf(IOException.class);
		}
	}

	@Nested
	@DisplayName("Single commands")
	class SingleCommands {

		@Test
		@DisplayName("parses one command")
		void parsesOneCommand() {
			assertThat(xpp.parseCommand("@ xhi=60")).isEqualTo(
					new Command.Option(List.of(Assignment.of("xhi", Expression.Number.of(60)))));
		}

		@Test
		@DisplayName("rejects text with several commands")
		void rejectsSeveralCommands() {
			assertThatThrownBy(() -> xpp.parseCommand("par a=1\npar b=2"))
					.isInstanceOf(XppSyntaxException.class)
					.hasMessageContaining("found 2");
			assertThatThrownBy(() -> xpp.parseCommand("# nothing"))
					.isInstanceOf(XppSyntaxException.class)
					.hasMessageContaining("found 0");
		}

		@Test
		@DisplayName("does not recover from syntax errors")
		void failsFast() {
			assertThatThrownBy(() -> xpp.parseCommand("par a=)\n"))
					.isInstanceOf(XppSyntaxException.class)
					.hasMessageContaining("Expected an expression");
		}
	}

	@Nested
	@DisplayName("Option overrides")
	class OptionOverrides {

		@Test
		@DisplayName("replaces the value inside the existing option command")
		void mergesIntoExistingOption() throws IOException {
			Program program = xpp.parse(model());
			int index = program.indexOfOption("xhi", 0);

			Program patched = xpp.withOption(program, "XHI", "60");

			assertThat(patched.size()).isEqualTo(program.size());
			assertThat(xpp.generate(Program.of(patched.get(index)))).startsWith("@ total=150,dt=0.25,xhi=60\n");
			assertThat(patched.options().get("xhi")).isEqualTo(Expression.Number.of(60));
		}

		@Test
		@DisplayName("inserts a new option before done")
		void insertsBeforeDone() {
			Program program = xpp.parse("x'=-x\ndone\n");

			Program patched = xpp.withOption(program, "ylo", "-2.5");

			assertThat(new XppGenerator().generateLines(patched)).containsExactly("x'=-x", "@ ylo=-2.5", "done");
		}

		@Test
		@DisplayName("appends a new option when there is no done")
		void appendsWithoutDone() {
			Program program = xpp.parse("x'=-x\n");

			Program patched = xpp.withOption(program, "total", "20");

			assertThat(patched.get(patched.size() - 1)).isInstanceOf(Command.Option.class);
		}

		@Test
		@DisplayName("rejects a malformed value")
		void malformedValue() {
			Program program = xpp.parse("x'=-x\n");

			assertThatThrownBy(() -> xpp.withOption(program, "total", "*"))
					.isInstanceOf(XppSyntaxException.class);
		}
	}

	@Test
	@DisplayName("concurrent parses do not interfere")
	void concurrentParsing() throws Exception {
		List<String> sources = new ArrayList<>();
		for (int i = 0; i < 16; i++) {
			sources.add("par p" + i + "=" + i + "\nx" + i + "'=-p" + i + "*x" + i + "\n@ total=" + i + "\n");
		}

		ExecutorService executor = Executors.newFixedThreadPool(4);
		try {
			List<Callable<Program>> tasks = new ArrayList<>();
			for (String source : sources) {
				tasks.add(() -> xpp.parse(source));
			}
			List<Future<Program>> results = executor.invokeAll(tasks);
			for (int i = 0; i < results.size(); i++) {
				Program program = results.get(i).get();
				assertThat(program.stateVariables()).containsExactly("x" + i);
				assertThat(program.parameters()).containsOnlyKeys("p" + i);
				assertThat(program).isEqualTo(xpp.parse(sources.get(i)));
			}
		} finally {
			executor.shutdownNow();
		}
	}

	@Test
	@DisplayName("rejects a null language")
	void nullLanguage() {
		assertThatThrownBy(() -> new XppFrontEnd(null)).isInstanceOf(IllegalArgumentException.class);
	}
}
