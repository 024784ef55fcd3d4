package org.javai.xpp;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.javai.xpp.ast.Assignment;
import org.javai.xpp.ast.Command;
import org.javai.xpp.grammar.XppLanguage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for reading, patching and writing XPP model files.
 *
 * <p>The front-end only holds the immutable language table. Every call creates its own
 * tokenizer and parser, so one instance can serve concurrent callers.</p>
 *
 * <pre>
 * XppFrontEnd xpp = XppFrontEnd.standard();
 * Program model = xpp.parseFile(Path.of("ml.ode"));
 * model = xpp.withOption(model, "xhi", "60");
 * xpp.write(model, Path.of("ml-patched.ode"));
 * </pre>
 */
public class XppFrontEnd {

	private static final Logger logger = LoggerFactory.getLogger(XppFrontEnd.class);

	private static final SyntaxErrorListener FAIL_FAST = error -> {
		throw error;
	};

	private final XppLanguage language;
	private final XppGenerator generator = new XppGenerator();

	public XppFrontEnd(XppLanguage language) {
		if (language == null) {
			throw new IllegalArgumentException("Language cannot be null");
		}
		this.language = language;
	}

	/**
	 * Shared front-end over the bundled language table.
	 */
	public static XppFrontEnd standard() {
		return StandardHolder.INSTANCE;
	}

	public XppLanguage language() {
		return language;
	}

	public List<XppToken> tokenize(String text) {
		return new XppTokenizer(text, language).tokenize();
	}

	/**
	 * Parses model text, logging and dropping malformed statements.
	 */
	public Program parse(String text) {
		return parse(text, XppParser.LOGGING_LISTENER);
	}

	public Program parse(String text, SyntaxErrorListener listener) {
		return new XppParser(tokenize(text), language, listener).parse();
	}

	/**
	 * Parses text that must hold exactly one command, such as a single patch line.
	 *
	 * @throws XppSyntaxException if the text is malformed or holds no or several commands
	 */
	public Command parseCommand(String line) {
		List<XppToken> tokens = tokenize(line);
		Program program = new XppParser(tokens, language, FAIL_FAST).parse();
		if (program.size() != 1) {
			throw new XppSyntaxException("Expected exactly one command, found " + program.size(),
					tokens.get(tokens.size() - 1));
		}
		return program.get(0);
	}

	/**
	 * Reads and parses a model file.
	 *
	 * @throws XppParseException if the file cannot be read or is malformed at end of input
	 */
	public Program parseFile(Path path) {
		String text;
		try {
			text = Files.readString(path, StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new XppParseException("Failed to read model file: " + path, e);
		}
		Program program = parse(text);
		logger.debug("Parsed {} into {} commands", path, program.size());
		return program;
	}

	public String generate(Program program) {
		return generator.generate(program);
	}

	/**
	 * Writes the generated text of {@code program} to {@code path}, replacing any existing file.
	 */
	public void write(Program program, Path path) {
		String text = generate(program);
		try {
			Files.writeString(path, text, StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new XppGenerationException("Failed to write model file: " + path, e);
		}
		logger.debug("Wrote {} commands to {}", program.size(), path);
	}

	/**
	 * Sets a numerical option, the way axis bounds are overridden before a run.
	 *
	 * <p>When an option command already assigns {@code key}, that command is replaced by one
	 * with the new value. Otherwise a new option command is inserted before a trailing
	 * {@code done}, or appended.</p>
	 *
	 * @param value option value as XPP expression text
	 * @throws XppSyntaxException if {@code key=value} is not a valid option assignment
	 */
	public Program withOption(Program program, String key, String value) {
		Command.Option parsed = (Command.Option) parseCommand("@ " + key + "=" + value);
		Assignment assignment = parsed.assignments().get(0);

		int index = program.indexOfOption(key, 0);
		if (index >= 0) {
			Command.Option existing = (Command.Option) program.get(index);
			List<Assignment> merged = new ArrayList<>(existing.assignments());
			for (int i = 0; i < merged.size(); i++) {
				if (merged.get(i).target().equals(assignment.target())) {
					merged.set(i, assignment);
				}
			}
			return program.replace(index, existing.withAssignments(merged));
		}

		int position = program.endsWithDone() ? program.size() - 1 : program.size();
		return program.insert(position, parsed);
	}

	private static final class StandardHolder {

		private static final XppFrontEnd INSTANCE = new XppFrontEnd(XppLanguage.standard());
	}
}
