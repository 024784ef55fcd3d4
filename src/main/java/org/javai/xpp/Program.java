package org.javai.xpp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.xpp.ast.Assignment;
import org.javai.xpp.ast.Command;
import org.javai.xpp.ast.Expression;
import org.javai.xpp.ast.Expressions;

/**
 * Parsed XPP model: commands in program order.
 *
 * <p>Programs are immutable. Patching a program replaces one command at a known
 * index and returns a new program; callers rely on positions staying stable.</p>
 */
public record Program(List<Command> commands) {

	public Program {
		Objects.requireNonNull(commands, "commands must not be null");
		commands = List.copyOf(commands);
	}

	public static Program of(Command... commands) {
		return new Program(Arrays.asList(commands));
	}

	public int size() {
		return commands.size();
	}

	public Command get(int index) {
		return commands.get(index);
	}

	/**
	 * Returns a program with the command at {@code index} replaced.
	 *
	 * @throws IndexOutOfBoundsException if {@code index} is not a command position
	 */
	public Program replace(int index, Command replacement) {
		Objects.requireNonNull(replacement, "replacement must not be null");
		Objects.checkIndex(index, commands.size());
		List<Command> patched = new ArrayList<>(commands);
		patched.set(index, replacement);
		return new Program(patched);
	}

	/**
	 * Returns a program with {@code command} inserted at {@code index}; later commands move up one.
	 */
	public Program insert(int index, Command command) {
		Objects.requireNonNull(command, "command must not be null");
		if (index < 0 || index > commands.size()) {
			throw new IndexOutOfBoundsException("Insert position " + index + " out of bounds for length " + commands.size());
		}
		List<Command> patched = new ArrayList<>(commands);
		patched.add(index, command);
		return new Program(patched);
	}

	public boolean endsWithDone() {
		return !commands.isEmpty() && commands.get(commands.size() - 1) instanceof Command.Done;
	}

	/**
	 * Index of the first par, init, aux or option command that assigns {@code key}.
	 *
	 * @return the index, or -1 if no such command exists
	 */
	public int indexOfAssignment(String key) {
		for (int i = 0; i < commands.size(); i++) {
			Command command = commands.get(i);
			if (isDeclaration(command) && ((Command.AssignmentCommand) command).assigns(key)) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * Index of the {@code occurrence}-th (zero-based) option command that assigns {@code key}.
	 *
	 * @return the index, or -1 if there are not that many
	 */
	public int indexOfOption(String key, int occurrence) {
		int seen = 0;
		for (int i = 0; i < commands.size(); i++) {
			if (commands.get(i) instanceof Command.Option option && option.assigns(key)) {
				if (seen == occurrence) {
					return i;
				}
				seen++;
			}
		}
		return -1;
	}

	/**
	 * State variables in the order their equations appear.
	 */
	public List<String> stateVariables() {
		List<String> names = new ArrayList<>();
		for (Command command : commands) {
			if (command instanceof Command.ODE ode) {
				names.add(ode.stateVariable().id());
			}
		}
		return names;
	}

	public List<String> auxiliaryVariables() {
		return new ArrayList<>(collect(Command.Aux.class).keySet());
	}

	public Map<String, Expression> parameters() {
		return collect(Command.Par.class);
	}

	public Map<String, Expression> initialConditions() {
		return collect(Command.Init.class);
	}

	public Map<String, Expression> options() {
		return collect(Command.Option.class);
	}

	/**
	 * Copy of this program with explicit parentheses removed from every expression.
	 */
	public Program withoutGroups() {
		List<Command> stripped = new ArrayList<>(commands.size());
		for (Command command : commands) {
			stripped.add(Expressions.withoutGroups(command));
		}
		return new Program(stripped);
	}

	private Map<String, Expression> collect(Class<? extends Command.AssignmentCommand> kind) {
		Map<String, Expression> values = new LinkedHashMap<>();
		for (Command command : commands) {
			if (kind.isInstance(command)) {
				for (Assignment assignment : kind.cast(command).assignments()) {
					values.put(assignment.target().id(), assignment.value());
				}
			}
		}
		return values;
	}

	private static boolean isDeclaration(Command command) {
		return command instanceof Command.Par
				|| command instanceof Command.Init
				|| command instanceof Command.Aux
				|| command instanceof Command.Option;
	}
}
