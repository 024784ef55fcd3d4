package org.javai.xpp.ast;

import java.util.Objects;

/**
 * Integer map applied to an array expansion index, as written in {@code x[j+1]}.
 *
 * @param kind the operation
 * @param operand the literal operand, 0 for {@link Kind#IDENTITY}
 */
public record IndexTransform(Kind kind, int operand) {

	public enum Kind {
		IDENTITY,
		ADD,
		SUBTRACT,
		MULTIPLY
	}

	public IndexTransform {
		Objects.requireNonNull(kind, "kind must not be null");
		if (kind == Kind.IDENTITY && operand != 0) {
			throw new IllegalArgumentException("Identity transform takes no operand");
		}
	}

	public static IndexTransform identity() {
		return new IndexTransform(Kind.IDENTITY, 0);
	}

	public static IndexTransform add(int k) {
		return new IndexTransform(Kind.ADD, k);
	}

	public static IndexTransform subtract(int k) {
		return new IndexTransform(Kind.SUBTRACT, k);
	}

	public static IndexTransform multiply(int k) {
		return new IndexTransform(Kind.MULTIPLY, k);
	}

	public int apply(int index) {
		return switch (kind) {
			case IDENTITY -> index;
			case ADD -> Math.addExact(index, operand);
			case SUBTRACT -> Math.subtractExact(index, operand);
			case MULTIPLY -> Math.multiplyExact(index, operand);
		};
	}
}
