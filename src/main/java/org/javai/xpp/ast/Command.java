package org.javai.xpp.ast;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One XPP statement. A program is an ordered list of commands.
 */
public sealed interface Command {

	/**
	 * Accepts a visitor and dispatches to the method for this variant.
	 */
	<R> R accept(CommandVisitor<R> visitor);

	/**
	 * Commands that consist of a list of assignments and differ only by their keyword.
	 */
	sealed interface AssignmentCommand extends Command {

		List<Assignment> assignments();

		/**
		 * Returns a command of the same kind holding the given assignments.
		 */
		AssignmentCommand withAssignments(List<Assignment> assignments);

		default boolean assigns(String name) {
			String key = new Expression.Name(name).id();
			return assignments().stream().anyMatch(a -> a.target().id().equals(key));
		}
	}

	/**
	 * Bare {@code name=expr} line or {@code number} line.
	 */
	record FixedVar(List<Assignment> assignments) implements AssignmentCommand {

		public FixedVar {
			assignments = requireAssignments(assignments, "fixed variable");
		}

		@Override
		public FixedVar withAssignments(List<Assignment> assignments) {
			return new FixedVar(assignments);
		}

		@Override
		public <R> R accept(CommandVisitor<R> visitor) {
			return visitor.visitFixedVar(this);
		}
	}

	record Par(List<Assignment> assignments) implements AssignmentCommand {

		public Par {
			assignments = requireAssignments(assignments, "par");
		}

		@Override
		public Par withAssignments(List<Assignment> assignments) {
			return new Par(assignments);
		}

		@Override
		public <R> R accept(CommandVisitor<R> visitor) {
			return visitor.visitPar(this);
		}
	}

	record Init(List<Assignment> assignments) implements AssignmentCommand {

		public Init {
			assignments = requireAssignments(assignments, "init");
		}

		@Override
		public Init withAssignments(List<Assignment> assignments) {
			return new Init(assignments);
		}

		@Override
		public <R> R accept(CommandVisitor<R> visitor) {
			return visitor.visitInit(this);
		}
	}

	record Aux(List<Assignment> assignments) implements AssignmentCommand {

		public Aux {
			assignments = requireAssignments(assignments, "aux");
		}

		@Override
		public Aux withAssignments(List<Assignment> assignments) {
			return new Aux(assignments);
		}

		@Override
		public <R> R accept(CommandVisitor<R> visitor) {
			return visitor.visitAux(this);
		}
	}

	/**
	 * Numerical option line ({@code @ total=100,dt=.05}).
	 */
	record Option(List<Assignment> assignments) implements AssignmentCommand {

		public Option {
			assignments = requireAssignments(assignments, "option");
		}

		@Override
		public Option withAssignments(List<Assignment> assignments) {
			return new Option(assignments);
		}

		@Override
		public <R> R accept(CommandVisitor<R> visitor) {
			return visitor.visitOption(this);
		}
	}

	/**
	 * Event detection: runs {@code body} whenever {@code condition} crosses zero in the
	 * direction selected by {@code sign} (1 upwards, -1 downwards, 0 either way).
	 */
	record Global(int sign, Expression condition, List<Assignment> body) implements Command {

		public Global {
			if (sign < -1 || sign > 1) {
				throw new IllegalArgumentException("Global sign must be -1, 0 or 1, found: " + sign);
			}
			Expressions.requireCondition(condition);
			body = requireAssignments(body, "global body");
		}

		@Override
		public <R> R accept(CommandVisitor<R> visitor) {
			return visitor.visitGlobal(this);
		}
	}

	/**
	 * User function {@code name(p1,p2)=body}.
	 */
	record FunDef(Expression.Name name, List<Expression.Name> parameters, Expression body) implements Command {

		public FunDef {
			Objects.requireNonNull(name, "name must not be null");
			if (parameters == null || parameters.isEmpty()) {
				throw new IllegalArgumentException("Function " + name.id() + " needs at least one parameter");
			}
			parameters = List.copyOf(parameters);
			Set<Expression.Name> seen = new HashSet<>();
			for (Expression.Name parameter : parameters) {
				if (!seen.add(parameter)) {
					throw new IllegalArgumentException(
							"Duplicate parameter '" + parameter.id() + "' in function " + name.id());
				}
			}
			Expressions.requireArithmetic(body, "body of " + name.id());
		}

		@Override
		public <R> R accept(CommandVisitor<R> visitor) {
			return visitor.visitFunDef(this);
		}
	}

	/**
	 * Right-hand side of one state variable, whichever notation the source used.
	 */
	record ODE(Assignment assignment) implements Command {

		public ODE {
			Objects.requireNonNull(assignment, "assignment must not be null");
		}

		public static ODE of(String stateVariable, Expression rhs) {
			return new ODE(Assignment.of(stateVariable, rhs));
		}

		public Expression.Name stateVariable() {
			return assignment.target();
		}

		@Override
		public <R> R accept(CommandVisitor<R> visitor) {
			return visitor.visitOde(this);
		}
	}

	/**
	 * End of program marker.
	 */
	record Done() implements Command {

		@Override
		public <R> R accept(CommandVisitor<R> visitor) {
			return visitor.visitDone(this);
		}
	}

	private static List<Assignment> requireAssignments(List<Assignment> assignments, String what) {
		if (assignments == null || assignments.isEmpty()) {
			throw new IllegalArgumentException("A " + what + " command needs at least one assignment");
		}
		return List.copyOf(assignments);
	}
}
