package org.javai.xpp.ast;

/**
 * Static helpers for {@link Expression} trees.
 */
public final class Expressions {

	private static final ExpressionRewriter GROUP_REMOVER = new ExpressionRewriter() {
		@Override
		public Expression visitGroup(Expression.Group group) {
			return rewrite(group.inner());
		}
	};

	private Expressions() {
		// Utility class - no instantiation
	}

	/**
	 * Drops every {@link Expression.Group}. Two trees that only differ in explicit
	 * parentheses compare equal after this.
	 */
	public static Expression withoutGroups(Expression expression) {
		return GROUP_REMOVER.rewrite(expression);
	}

	public static Command withoutGroups(Command command) {
		return GROUP_REMOVER.rewrite(command);
	}

	static void requireArithmetic(Expression expression, String role) {
		if (expression == null) {
			throw new IllegalArgumentException("Missing " + role);
		}
		if (expression instanceof Expression.Compare) {
			throw new IllegalArgumentException("A comparison is not allowed as " + role);
		}
	}

	static void requireCondition(Expression expression) {
		if (expression == null) {
			throw new IllegalArgumentException("Missing condition");
		}
	}
}
