package org.javai.xpp.ast;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Right-hand side of an XPP statement.
 *
 * <p>Every variant validates itself on construction, so any tree built from these
 * records can be written back to text. Comparisons are only admitted as the condition
 * of a {@code global} block or an {@code if} expression.</p>
 */
public sealed interface Expression {

	/**
	 * Accepts a visitor and dispatches to the method for this variant.
	 */
	<R> R accept(ExpressionVisitor<R> visitor);

	/**
	 * Numeric literal. Literals are unsigned; a negative constant is a {@link UnaryOp}.
	 * Integer literals carry scale 0, floating literals a scale of at least 1.
	 */
	record Number(BigDecimal value) implements Expression {

		public Number {
			Objects.requireNonNull(value, "value must not be null");
			if (value.signum() < 0) {
				throw new IllegalArgumentException("Number literals are unsigned, found: " + value);
			}
			if (value.scale() < 0) {
				value = value.setScale(0);
			}
		}

		public static Number of(long value) {
			return new Number(BigDecimal.valueOf(value));
		}

		public static Number of(double value) {
			BigDecimal decimal = BigDecimal.valueOf(value);
			return new Number(decimal.scale() < 1 ? decimal.setScale(1) : decimal);
		}

		/**
		 * Creates a number from literal text as matched by the tokenizer.
		 *
		 * @param literal digits with optional decimal point and exponent
		 * @param floating whether the literal was a floating literal
		 */
		public static Number parse(String literal, boolean floating) {
			BigDecimal decimal = new BigDecimal(literal);
			if (floating && decimal.scale() < 1) {
				decimal = decimal.setScale(1);
			}
			return new Number(decimal);
		}

		public boolean isInteger() {
			return value.scale() == 0;
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitNumber(this);
		}
	}

	/**
	 * Variable, parameter or function name. Always lower-case.
	 */
	record Name(String id) implements Expression {

		private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");
		private static final Set<String> RESERVED = Set.of("if", "then", "else", "sum", "of");

		public Name {
			Objects.requireNonNull(id, "id must not be null");
			id = id.toLowerCase(Locale.ROOT);
			if (!IDENTIFIER.matcher(id).matches()) {
				throw new IllegalArgumentException("Not a valid identifier: '" + id + "'");
			}
			if (RESERVED.contains(id)) {
				throw new IllegalArgumentException("'" + id + "' is a reserved word");
			}
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitName(this);
		}
	}

	record BinOp(Expression left, String operator, Expression right) implements Expression {

		private static final Set<String> OPERATORS = Set.of("+", "-", "*", "/", "^", "**");

		public BinOp {
			Expressions.requireArithmetic(left, "left operand");
			Expressions.requireArithmetic(right, "right operand");
			if (!OPERATORS.contains(operator)) {
				throw new IllegalArgumentException("Unknown binary operator: " + operator);
			}
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitBinOp(this);
		}
	}

	record UnaryOp(String operator, Expression operand) implements Expression {

		public UnaryOp {
			if (!"-".equals(operator)) {
				throw new IllegalArgumentException("Unknown unary operator: " + operator);
			}
			Expressions.requireArithmetic(operand, "operand");
		}

		public static UnaryOp negate(Expression operand) {
			return new UnaryOp("-", operand);
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitUnaryOp(this);
		}
	}

	/**
	 * Relational expression. Not part of the arithmetic precedence chain.
	 */
	record Compare(String operator, Expression left, Expression right) implements Expression {

		private static final Set<String> OPERATORS = Set.of("<", "<=", ">", ">=", "<>", "==");

		public Compare {
			if (!OPERATORS.contains(operator)) {
				throw new IllegalArgumentException("Unknown comparison operator: " + operator);
			}
			Expressions.requireArithmetic(left, "left operand");
			Expressions.requireArithmetic(right, "right operand");
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitCompare(this);
		}
	}

	record FunCall(Name name, List<Expression> arguments) implements Expression {

		public FunCall {
			Objects.requireNonNull(name, "name must not be null");
			if (arguments == null || arguments.isEmpty()) {
				throw new IllegalArgumentException("Call of " + name.id() + " needs at least one argument");
			}
			arguments = List.copyOf(arguments);
			for (Expression argument : arguments) {
				Expressions.requireArithmetic(argument, "argument of " + name.id());
			}
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitFunCall(this);
		}
	}

	/**
	 * Parentheses written in the source.
	 */
	record Group(Expression inner) implements Expression {

		public Group {
			Expressions.requireArithmetic(inner, "grouped expression");
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitGroup(this);
		}
	}

	/**
	 * {@code if(condition)then(whenTrue)else(whenFalse)}.
	 */
	record Conditional(Expression condition, Expression whenTrue, Expression whenFalse) implements Expression {

		public Conditional {
			Expressions.requireCondition(condition);
			Expressions.requireArithmetic(whenTrue, "then branch");
			Expressions.requireArithmetic(whenFalse, "else branch");
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitConditional(this);
		}
	}

	/**
	 * {@code sum(lower,upper)of(body)}; the body refers to the running index as {@code i'}.
	 */
	record Sum(Expression lower, Expression upper, Expression body) implements Expression {

		public Sum {
			Expressions.requireArithmetic(lower, "lower bound");
			Expressions.requireArithmetic(upper, "upper bound");
			Expressions.requireArithmetic(body, "summand");
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitSum(this);
		}
	}

	/**
	 * The running index {@code i'} of the enclosing {@link Sum}.
	 */
	record SumIndex() implements Expression {

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitSumIndex(this);
		}
	}
}
