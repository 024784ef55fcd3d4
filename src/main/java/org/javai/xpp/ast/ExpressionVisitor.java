package org.javai.xpp.ast;

/**
 * Visitor over the {@link Expression} variants.
 * 
 * Used for code generation, JSON export and tree rewriting.
 *
 * @param <R> the return type of the visitor operations
 */
public interface ExpressionVisitor<R> {

	R visitNumber(Expression.Number number);

	R visitName(Expression.Name name);

	R visitBinOp(Expression.BinOp binOp);

	R visitUnaryOp(Expression.UnaryOp unaryOp);

	R visitCompare(Expression.Compare compare);

	R visitFunCall(Expression.FunCall funCall);

	R visitGroup(Expression.Group group);

	R visitConditional(Expression.Conditional conditional);

	R visitSum(Expression.Sum sum);

	R visitSumIndex(Expression.SumIndex sumIndex);
}
