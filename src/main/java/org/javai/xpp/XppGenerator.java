package org.javai.xpp;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.javai.xpp.ast.Assignment;
import org.javai.xpp.ast.Command;
import org.javai.xpp.ast.CommandVisitor;
import org.javai.xpp.ast.Expression;
import org.javai.xpp.ast.ExpressionVisitor;

/**
 * Visitor that writes a {@link Program} back to XPP source text.
 *
 * <p>The output re-parses to the same tree, except that operands which had to be
 * parenthesized come back wrapped in {@link Expression.Group}.</p>
 */
public class XppGenerator implements CommandVisitor<String> {

	/**
	 * One line per command, followed by {@code done} unless the program already ends with it.
	 */
	public List<String> generateLines(Program program) {
		if (program == null) {
			throw new XppGenerationException("Cannot generate a null program");
		}
		List<String> lines = new ArrayList<>(program.size() + 1);
		for (Command command : program.commands()) {
			lines.add(generate(command));
		}
		if (!program.endsWithDone()) {
			lines.add(visitDone(new Command.Done()));
		}
		return lines;
	}

	/**
	 * Complete model file text, newline terminated.
	 */
	public String generate(Program program) {
		return String.join("\n", generateLines(program)) + "\n";
	}

	public String generate(Command command) {
		if (command == null) {
			throw new XppGenerationException("Cannot generate a null command");
		}
		return command.accept(this);
	}

	public String generate(Expression expression) {
		return new ExpressionWriter().write(expression);
	}

	@Override
	public String visitFixedVar(Command.FixedVar fixedVar) {
		return assignments(fixedVar.assignments(), ",");
	}

	@Override
	public String visitPar(Command.Par par) {
		return "par " + assignments(par.assignments(), ",");
	}

	@Override
	public String visitInit(Command.Init init) {
		return "init " + assignments(init.assignments(), ",");
	}

	@Override
	public String visitAux(Command.Aux aux) {
		return "aux " + assignments(aux.assignments(), ",");
	}

	@Override
	public String visitOption(Command.Option option) {
		return "@ " + assignments(option.assignments(), ",");
	}

	@Override
	public String visitGlobal(Command.Global global) {
		return "global " + global.sign()
				+ " {" + generate(global.condition()) + "}"
				+ " {" + assignments(global.body(), ";") + "}";
	}

	@Override
	public String visitFunDef(Command.FunDef funDef) {
		String parameters = funDef.parameters().stream()
				.map(Expression.Name::id)
				.collect(Collectors.joining(","));
		return funDef.name().id() + "(" + parameters + ")=" + generate(funDef.body());
	}

	@Override
	public String visitOde(Command.ODE ode) {
		return ode.stateVariable().id() + "'=" + generate(ode.assignment().value());
	}

	@Override
	public String visitDone(Command.Done done) {
		return "done";
	}

	private String assignments(List<Assignment> assignments, String separator) {
		return assignments.stream()
				.map(a -> a.target().id() + "=" + generate(a.value()))
				.collect(Collectors.joining(separator));
	}

	/**
	 * Expression printer. Tracks the enclosing sums so a stray {@code i'} is rejected.
	 */
	private static final class ExpressionWriter implements ExpressionVisitor<String> {

		private int sumDepth;

		String write(Expression expression) {
			if (expression == null) {
				throw new XppGenerationException("Cannot generate a null expression");
			}
			return expression.accept(this);
		}

		private String operand(Expression operand) {
			String text = write(operand);
			return operand instanceof Expression.BinOp ? "(" + text + ")" : text;
		}

		@Override
		public String visitNumber(Expression.Number number) {
			return number.value().toPlainString();
		}

		@Override
		public String visitName(Expression.Name name) {
			return name.id();
		}

		@Override
		public String visitBinOp(Expression.BinOp binOp) {
			return operand(binOp.left()) + binOp.operator() + operand(binOp.right());
		}

		@Override
		public String visitUnaryOp(Expression.UnaryOp unaryOp) {
			return unaryOp.operator() + operand(unaryOp.operand());
		}

		@Override
		public String visitCompare(Expression.Compare compare) {
			return write(compare.left()) + compare.operator() + write(compare.right());
		}

		@Override
		public String visitFunCall(Expression.FunCall funCall) {
			List<String> arguments = new ArrayList<>(funCall.arguments().size());
			for (Expression argument : funCall.arguments()) {
				arguments.add(write(argument));
			}
			return funCall.name().id() + "(" + String.join(",", arguments) + ")";
		}

		@Override
		public String visitGroup(Expression.Group group) {
			return "(" + write(group.inner()) + ")";
		}

		@Override
		public String visitConditional(Expression.Conditional conditional) {
			return "if(" + write(conditional.condition()) + ")"
					+ "then(" + write(conditional.whenTrue()) + ")"
					+ "else(" + write(conditional.whenFalse()) + ")";
		}

		@Override
		public String visitSum(Expression.Sum sum) {
			String bounds = "sum(" + write(sum.lower()) + "," + write(sum.upper()) + ")";
			sumDepth++;
			try {
				return bounds + "of(" + write(sum.body()) + ")";
			} finally {
				sumDepth--;
			}
		}

		@Override
		public String visitSumIndex(Expression.SumIndex sumIndex) {
			if (sumDepth == 0) {
				throw new XppGenerationException("Summation index i' used outside a sum");
			}
			return "i'";
		}
	}
}
