package org.javai.xpp.ast;

/**
 * Visitor over the {@link Command} variants.
 *
 * @param <R> the return type of the visitor operations
 */
public interface CommandVisitor<R> {

	R visitFixedVar(Command.FixedVar fixedVar);

	R visitPar(Command.Par par);

	R visitInit(Command.Init init);

	R visitAux(Command.Aux aux);

	R visitOption(Command.Option option);

	R visitGlobal(Command.Global global);

	R visitFunDef(Command.FunDef funDef);

	R visitOde(Command.ODE ode);

	R visitDone(Command.Done done);
}
