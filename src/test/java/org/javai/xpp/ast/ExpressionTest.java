package org.javai.xpp.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.javai.xpp.ast.Expression.BinOp;
import org.javai.xpp.ast.Expression.Name;
import org.javai.xpp.ast.Expression.Number;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AST nodes")
class ExpressionTest {

	@Nested
	@DisplayName("Number")
	class Numbers {

		@Test
		@DisplayName("keeps integer and floating literals apart")
		void scale() {
			assertThat(Number.parse("2", false).isInteger()).isTrue();
			assertThat(Number.parse("2", true).isInteger()).isFalse();
			assertThat(Number.parse("2", true)).isEqualTo(Number.of(2.0));
			assertThat(Number.of(2.0).value()).isEqualTo(new BigDecimal("2.0"));
		}

		@Test
		@DisplayName("normalizes negative scales")
		void negativeScale() {
			assertThat(new Number(new BigDecimal("1E+3"))).isEqualTo(Number.of(1000));
		}

		@Test
		@DisplayName("rejects negative values")
		void negative() {
			assertThatThrownBy(() -> new Number(new BigDecimal("-1")))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("unsigned");
		}
	}

	@Nested
	@DisplayName("Name")
	class Names {

		@Test
		@DisplayName("lower-cases identifiers")
		void lowerCase() {
			assertThat(new Name("Vk")).isEqualTo(new Name("vk"));
		}

		@Test
		@DisplayName("rejects malformed and reserved identifiers")
		void invalid() {
			assertThatThrownBy(() -> new Name("1x")).isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> new Name("a-b")).isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> new Name("SUM"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("reserved");
		}
	}

	@Nested
	@DisplayName("Validation")
	class Validation {

		private final Expression comparison = new Expression.Compare("<", new Name("a"), new Name("b"));

		@Test
		@DisplayName("comparisons are only accepted as conditions")
		void comparisonPlacement() {
			assertThatThrownBy(() -> new BinOp(comparison, "+", new Name("c")))
					.isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> Assignment.of("x", comparison))
					.isInstanceOf(IllegalArgumentException.class);
			assertThat(new Expression.Conditional(comparison, Number.of(1), Number.of(0)).condition())
					.isEqualTo(comparison);
		}

		@Test
		@DisplayName("rejects unknown operators")
		void operators() {
			assertThatThrownBy(() -> new BinOp(new Name("a"), "%", new Name("b")))
					.isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> new Expression.UnaryOp("+", new Name("a")))
					.isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> new Expression.Compare("=", new Name("a"), new Name("b")))
					.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("calls need arguments and copy them")
		void callArguments() {
			List<Expression> arguments = new ArrayList<>(List.of(new Name("a")));
			Expression.FunCall call = new Expression.FunCall(new Name("f"), arguments);
			arguments.add(new Name("b"));

			assertThat(call.arguments()).hasSize(1);
			assertThatThrownBy(() -> new Expression.FunCall(new Name("f"), List.of()))
					.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("commands validate their shape")
		void commands() {
			assertThatThrownBy(() -> new Command.Par(List.of()))
					.isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> new Command.Global(2, new Name("x"), List.of(Assignment.of("y", Number.of(0)))))
					.isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> new Command.FunDef(new Name("f"), List.of(), new Name("x")))
					.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("assignment commands look up their targets case-insensitively")
		void assigns() {
			Command.AssignmentCommand par = new Command.Par(List.of(Assignment.of("gk", Number.of(8))));

			assertThat(par.assigns("GK")).isTrue();
			assertThat(par.assigns("gl")).isFalse();
			assertThat(par.withAssignments(List.of(Assignment.of("gl", Number.of(2))))).isInstanceOf(Command.Par.class);
		}
	}

	@Nested
	@DisplayName("IndexTransform")
	class IndexTransforms {

		@Test
		@DisplayName("applies the integer map")
		void apply() {
			assertThat(IndexTransform.identity().apply(4)).isEqualTo(4);
			assertThat(IndexTransform.add(2).apply(4)).isEqualTo(6);
			assertThat(IndexTransform.subtract(1).apply(4)).isEqualTo(3);
			assertThat(IndexTransform.multiply(3).apply(4)).isEqualTo(12);
		}

		@Test
		@DisplayName("identity takes no operand")
		void identityOperand() {
			assertThatThrownBy(() -> new IndexTransform(IndexTransform.Kind.IDENTITY, 1))
					.isInstanceOf(IllegalArgumentException.class);
		}
	}

	@Nested
	@DisplayName("Rewriting")
	class Rewriting {

		@Test
		@DisplayName("removes groups at any depth")
		void withoutGroups() {
			Expression grouped = new Expression.Group(new BinOp(
					new Expression.Group(new Name("a")), "*",
					new Expression.FunCall(new Name("f"), List.of(new Expression.Group(Number.of(1))))));

			assertThat(Expressions.withoutGroups(grouped)).isEqualTo(new BinOp(
					new Name("a"), "*", new Expression.FunCall(new Name("f"), List.of(Number.of(1)))));
		}

		@Test
		@DisplayName("rewrites every expression of a command")
		void rewriteCommand() {
			ExpressionRewriter renamer = new ExpressionRewriter() {
				@Override
				public Expression visitName(Name name) {
					return name.id().equals("a") ? new Name("b") : name;
				}
			};
			Command global = new Command.Global(0, new Name("a"), List.of(Assignment.of("a", new Name("a"))));

			assertThat(renamer.rewrite(global)).isEqualTo(
					new Command.Global(0, new Name("b"), List.of(Assignment.of("a", new Name("b")))));
		}

		@Test
		@DisplayName("a rewriter that overrides nothing returns an equal tree")
		void identityRewrite() {
			Expression expression = new Expression.Sum(Number.of(1), new Name("n"),
					new Expression.Conditional(new Expression.Compare("==", new Expression.SumIndex(), Number.of(2)),
							Expression.UnaryOp.negate(new Name("w")), Number.of(0)));

			assertThat(new ExpressionRewriter().rewrite(expression)).isEqualTo(expression);
		}
	}
}
