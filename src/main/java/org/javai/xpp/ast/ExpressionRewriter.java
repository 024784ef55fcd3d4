package org.javai.xpp.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds expression trees bottom-up.
 * 
 * <p>Every variant is copied with rewritten children; subclasses override the
 * methods for the nodes they replace. Leaves are returned as they are, so a
 * rewriter that overrides nothing returns an equal tree.</p>
 */
public class ExpressionRewriter implements ExpressionVisitor<Expression> {

	public Expression rewrite(Expression expression) {
		return expression.accept(this);
	}

	public Assignment rewrite(Assignment assignment) {
		return new Assignment(assignment.target(), rewrite(assignment.value()));
	}

	public List<Assignment> rewriteAll(List<Assignment> assignments) {
		List<Assignment> rewritten = new ArrayList<>(assignments.size());
		for (Assignment assignment : assignments) {
			rewritten.add(rewrite(assignment));
		}
		return rewritten;
	}

	/**
	 * Rewrites every expression held by a command.
	 */
	public Command rewrite(Command command) {
		return command.accept(new CommandVisitor<Command>() {
			@Override
			public Command visitFixedVar(Command.FixedVar fixedVar) {
				return fixedVar.withAssignments(rewriteAll(fixedVar.assignments()));
			}

			@Override
			public Command visitPar(Command.Par par) {
				return par.withAssignments(rewriteAll(par.assignments()));
			}

			@Override
			public Command visitInit(Command.Init init) {
				return init.withAssignments(rewriteAll(init.assignments()));
			}

			@Override
			public Command visitAux(Command.Aux aux) {
				return aux.withAssignments(rewriteAll(aux.assignments()));
			}

			@Override
			public Command visitOption(Command.Option option) {
				return option.withAssignments(rewriteAll(option.assignments()));
			}

			@Override
			public Command visitGlobal(Command.Global global) {
				return new Command.Global(global.sign(), rewrite(global.condition()), rewriteAll(global.body()));
			}

			@Override
			public Command visitFunDef(Command.FunDef funDef) {
				return new Command.FunDef(funDef.name(), funDef.parameters(), rewrite(funDef.body()));
			}

			@Override
			public Command visitOde(Command.ODE ode) {
				return new Command.ODE(rewrite(ode.assignment()));
			}

			@Override
			public Command visitDone(Command.Done done) {
				return done;
			}
		});
	}

	@Override
	public Expression visitNumber(Expression.Number number) {
		return number;
	}

	@Override
	public Expression visitName(Expression.Name name) {
		return name;
	}

	@Override
	public Expression visitBinOp(Expression.BinOp binOp) {
		return new Expression.BinOp(rewrite(binOp.left()), binOp.operator(), rewrite(binOp.right()));
	}

	@Override
	public Expression visitUnaryOp(Expression.UnaryOp unaryOp) {
		return new Expression.UnaryOp(unaryOp.operator(), rewrite(unaryOp.operand()));
	}

	@Override
	public Expression visitCompare(Expression.Compare compare) {
		return new Expression.Compare(compare.operator(), rewrite(compare.left()), rewrite(compare.right()));
	}

	@Override
	public Expression visitFunCall(Expression.FunCall funCall) {
		List<Expression> arguments = new ArrayList<>(funCall.arguments().size());
		for (Expression argument : funCall.arguments()) {
			arguments.add(rewrite(argument));
		}
		return new Expression.FunCall(funCall.name(), arguments);
	}

	@Override
	public Expression visitGroup(Expression.Group group) {
		return new Expression.Group(rewrite(group.inner()));
	}

	@Override
	public Expression visitConditional(Expression.Conditional conditional) {
		return new Expression.Conditional(
				rewrite(conditional.condition()),
				rewrite(conditional.whenTrue()),
				rewrite(conditional.whenFalse()));
	}

	@Override
	public Expression visitSum(Expression.Sum sum) {
		return new Expression.Sum(rewrite(sum.lower()), rewrite(sum.upper()), rewrite(sum.body()));
	}

	@Override
	public Expression visitSumIndex(Expression.SumIndex sumIndex) {
		return sumIndex;
	}
}
