package org.javai.xpp.ast;

import java.util.Objects;

/**
 * {@code target=value}.
 */
public record Assignment(Expression.Name target, Expression value) {

	public Assignment {
		Objects.requireNonNull(target, "target must not be null");
		Expressions.requireArithmetic(value, "value of " + target.id());
	}

	public static Assignment of(String target, Expression value) {
		return new Assignment(new Expression.Name(target), value);
	}
}
