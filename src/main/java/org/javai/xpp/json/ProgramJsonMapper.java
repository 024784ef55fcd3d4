package org.javai.xpp.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.javai.xpp.Program;
import org.javai.xpp.ast.Assignment;
import org.javai.xpp.ast.Command;
import org.javai.xpp.ast.CommandVisitor;
import org.javai.xpp.ast.Expression;
import org.javai.xpp.ast.ExpressionVisitor;

/**
 * Utility to convert a parsed {@link Program} into JSON for diagnostics and tooling.
 *
 * <p>Commands carry a {@code "type"} field, expressions a {@code "kind"} field.</p>
 */
public final class ProgramJsonMapper {

	private static final ObjectMapper mapper = new ObjectMapper();

	private ProgramJsonMapper() {
	}

	public static ArrayNode toJson(Program program) {
		ArrayNode array = mapper.createArrayNode();
		for (Command command : program.commands()) {
			array.add(toJson(command));
		}
		return array;
	}

	public static ObjectNode toJson(Command command) {
		return command.accept(COMMANDS);
	}

	public static ObjectNode toJson(Expression expression) {
		return expression.accept(EXPRESSIONS);
	}

	/**
	 * Pretty-printed JSON text of the program.
	 */
	public static String toJsonString(Program program) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(program));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize program", e);
		}
	}

	private static ObjectNode assignments(String type, List<Assignment> assignments) {
		ObjectNode node = mapper.createObjectNode();
		node.put("type", type);
		node.set("assignments", assignmentArray(assignments));
		return node;
	}

	private static ArrayNode assignmentArray(List<Assignment> assignments) {
		ArrayNode array = mapper.createArrayNode();
		for (Assignment assignment : assignments) {
			ObjectNode a = array.addObject();
			a.put("target", assignment.target().id());
			a.set("value", toJson(assignment.value()));
		}
		return array;
	}

	private static final CommandVisitor<ObjectNode> COMMANDS = new CommandVisitor<ObjectNode>() {

		@Override
		public ObjectNode visitFixedVar(Command.FixedVar fixedVar) {
			return assignments("fixed", fixedVar.assignments());
		}

		@Override
		public ObjectNode visitPar(Command.Par par) {
			return assignments("par", par.assignments());
		}

		@Override
		public ObjectNode visitInit(Command.Init init) {
			return assignments("init", init.assignments());
		}

		@Override
		public ObjectNode visitAux(Command.Aux aux) {
			return assignments("aux", aux.assignments());
		}

		@Override
		public ObjectNode visitOption(Command.Option option) {
			return assignments("option", option.assignments());
		}

		@Override
		public ObjectNode visitGlobal(Command.Global global) {
			ObjectNode node = mapper.createObjectNode();
			node.put("type", "global");
			node.put("sign", global.sign());
			node.set("condition", toJson(global.condition()));
			node.set("body", assignmentArray(global.body()));
			return node;
		}

		@Override
		public ObjectNode visitFunDef(Command.FunDef funDef) {
			ObjectNode node = mapper.createObjectNode();
			node.put("type", "function");
			node.put("name", funDef.name().id());
			ArrayNode parameters = node.putArray("parameters");
			funDef.parameters().forEach(p -> parameters.add(p.id()));
			node.set("body", toJson(funDef.body()));
			return node;
		}

		@Override
		public ObjectNode visitOde(Command.ODE ode) {
			ObjectNode node = mapper.createObjectNode();
			node.put("type", "ode");
			node.put("variable", ode.stateVariable().id());
			node.set("rhs", toJson(ode.assignment().value()));
			return node;
		}

		@Override
		public ObjectNode visitDone(Command.Done done) {
			ObjectNode node = mapper.createObjectNode();
			node.put("type", "done");
			return node;
		}
	};

	private static final ExpressionVisitor<ObjectNode> EXPRESSIONS = new ExpressionVisitor<ObjectNode>() {

		private ObjectNode node(String kind) {
			ObjectNode node = mapper.createObjectNode();
			node.put("kind", kind);
			return node;
		}

		@Override
		public ObjectNode visitNumber(Expression.Number number) {
			ObjectNode node = node("number");
			node.put("value", number.value());
			node.put("literal", number.value().toPlainString());
			node.put("integer", number.isInteger());
			return node;
		}

		@Override
		public ObjectNode visitName(Expression.Name name) {
			ObjectNode node = node("name");
			node.put("id", name.id());
			return node;
		}

		@Override
		public ObjectNode visitBinOp(Expression.BinOp binOp) {
			ObjectNode node = node("binary");
			node.put("operator", binOp.operator());
			node.set("left", binOp.left().accept(this));
			node.set("right", binOp.right().accept(this));
			return node;
		}

		@Override
		public ObjectNode visitUnaryOp(Expression.UnaryOp unaryOp) {
			ObjectNode node = node("unary");
			node.put("operator", unaryOp.operator());
			node.set("operand", unaryOp.operand().accept(this));
			return node;
		}

		@Override
		public ObjectNode visitCompare(Expression.Compare compare) {
			ObjectNode node = node("compare");
			node.put("operator", compare.operator());
			node.set("left", compare.left().accept(this));
			node.set("right", compare.right().accept(this));
			return node;
		}

		@Override
		public ObjectNode visitFunCall(Expression.FunCall funCall) {
			ObjectNode node = node("call");
			node.put("name", funCall.name().id());
			ArrayNode arguments = node.putArray("arguments");
			for (Expression argument : funCall.arguments()) {
				arguments.add(argument.accept(this));
			}
			return node;
		}

		@Override
		public ObjectNode visitGroup(Expression.Group group) {
			ObjectNode node = node("group");
			node.set("inner", group.inner().accept(this));
			return node;
		}

		@Override
		public ObjectNode visitConditional(Expression.Conditional conditional) {
			ObjectNode node = node("if");
			node.set("condition", conditional.condition().accept(this));
			node.set("then", conditional.whenTrue().accept(this));
			node.set("else", conditional.whenFalse().accept(this));
			return node;
		}

		@Override
		public ObjectNode visitSum(Expression.Sum sum) {
			ObjectNode node = node("sum");
			node.set("lower", sum.lower().accept(this));
			node.set("upper", sum.upper().accept(this));
			node.set("body", sum.body().accept(this));
			return node;
		}

		@Override
		public ObjectNode visitSumIndex(Expression.SumIndex sumIndex) {
			return node("sumIndex");
		}
	};
}
