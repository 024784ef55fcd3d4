package org.javai.xpp;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.javai.xpp.XppToken.TokenType;
import org.javai.xpp.ast.Assignment;
import org.javai.xpp.ast.Command;
import org.javai.xpp.ast.Expression;
import org.javai.xpp.ast.ExpressionRewriter;
import org.javai.xpp.ast.IndexTransform;
import org.javai.xpp.grammar.XppLanguage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive descent parser for XPP model files.
 *
 * <p>Each line holds one statement. A statement that violates the grammar is dropped,
 * reported to the {@link SyntaxErrorListener} and parsing resumes on the next line.
 * Only a violation met at end of input is thrown to the caller.</p>
 *
 * <p>Example usage:</p>
 *
 * <pre>
 * List&lt;XppToken&gt; tokens = new XppTokenizer(text).tokenize();
 * Program program = new XppParser(tokens).parse();
 * </pre>
 *
 * <p>A parser holds the cursor for one token list and is not meant to be shared
 * between threads.</p>
 */
public class XppParser {

	private static final Logger logger = LoggerFactory.getLogger(XppParser.class);

	/**
	 * Listener used when none is supplied: logs each dropped statement at WARN.
	 */
	public static final SyntaxErrorListener LOGGING_LISTENER =
			error -> logger.warn("Dropped statement at line {}: {}", error.line(), error.getMessage());

	private final List<XppToken> tokens;
	private final XppLanguage language;
	private final SyntaxErrorListener listener;

	private int current;
	private int sumDepth;
	// Non-null while the right-hand side of a ranged declarator is parsed
	private Map<Expression.Name, ArraySelect> arraySelects;

	public XppParser(List<XppToken> tokens) {
		this(tokens, XppLanguage.standard(), LOGGING_LISTENER);
	}

	public XppParser(List<XppToken> tokens, XppLanguage language) {
		this(tokens, language, LOGGING_LISTENER);
	}

	public XppParser(List<XppToken> tokens, XppLanguage language, SyntaxErrorListener listener) {
		if (language == null) {
			throw new IllegalArgumentException("Language cannot be null");
		}
		if (listener == null) {
			throw new IllegalArgumentException("Syntax error listener cannot be null");
		}
		this.tokens = withEndOfInput(tokens);
		this.language = language;
		this.listener = listener;
	}

	/**
	 * Parses all statements.
	 *
	 * @return the program, without the statements that were dropped
	 * @throws XppSyntaxException if a statement is malformed at end of input
	 */
	public Program parse() {
		current = 0;
		List<Command> commands = new ArrayList<>();

		while (!isAtEnd()) {
			if (match(TokenType.NEWLINE)) continue;

			try {
				List<Command> statement = parseStatement();
				expectEndOfStatement();
				commands.addAll(statement);
			} catch (XppSyntaxException e) {
				recover(e);
			} catch (IllegalArgumentException e) {
				recover(new XppSyntaxException(e.getMessage(), previous(), e));
			}
		}

		logger.debug("Parsed {} commands from {} tokens", commands.size(), tokens.size());
		return new Program(commands);
	}

	private void recover(XppSyntaxException error) {
		sumDepth = 0;
		arraySelects = null;
		if (error.atEndOfInput()) {
			throw error;
		}
		listener.statementDropped(error);
		while (!isAtEnd() && !check(TokenType.NEWLINE)) {
			advance();
		}
	}

	private List<Command> parseStatement() {
		XppToken token = peek();
		return switch (token.type()) {
			case PARAMETER -> {
				advance();
				yield List.of(new Command.Par(parseDeclarations()));
			}
			case INITIAL -> {
				advance();
				yield List.of(new Command.Init(parseDeclarations()));
			}
			case AUXILIARY -> {
				advance();
				yield List.of(new Command.Aux(parseDeclarations()));
			}
			case OPTION -> {
				advance();
				yield List.of(new Command.Option(parseDeclarations()));
			}
			case NUMBER -> {
				advance();
				yield List.of(new Command.FixedVar(parseDeclarations()));
			}
			case GLOBAL -> List.of(parseGlobal());
			case DONE -> {
				advance();
				yield List.of(new Command.Done());
			}
			case LEIBNIZ, EULER -> List.of(parseOde());
			case IDENTIFIER -> parseIdentifierStatement();
			default -> throw error("Unexpected start of statement");
		};
	}

	/**
	 * Statements that start with a name: function definitions, array equations,
	 * {@code x(0)=...} initial values and bare fixed variables.
	 */
	private List<Command> parseIdentifierStatement() {
		if (checkAt(1, TokenType.LPAREN) && !isNumberType(peekAt(2).type())) {
			return List.of(parseFunDef());
		}
		int afterTarget = skipRange(current + 1);
		if (tokenAt(afterTarget).isType(TokenType.APOSTROPHE)) {
			return parseArrayOde();
		}
		if (tokenAt(afterTarget).isType(TokenType.LPAREN)) {
			return List.of(new Command.Init(parseDeclarations()));
		}
		return List.of(new Command.FixedVar(parseDeclarations()));
	}

	private int skipRange(int index) {
		if (!tokenAt(index).isType(TokenType.LBRACKET)) {
			return index;
		}
		int i = index;
		while (i < tokens.size() - 1 && !tokens.get(i).isType(TokenType.RBRACKET)
				&& !tokens.get(i).isType(TokenType.NEWLINE)) {
			i++;
		}
		return i + 1;
	}

	private Command parseGlobal() {
		consume(TokenType.GLOBAL, "Expected 'global'");
		boolean negative = match(TokenType.MINUS);
		if (!negative) {
			match(TokenType.PLUS);
		}
		XppToken signToken = consume(TokenType.INTEGER, "Expected the crossing direction -1, 0 or 1");
		int sign = Integer.parseInt(signToken.value());
		if (sign > 1) {
			throw new XppSyntaxException("Crossing direction must be -1, 0 or 1", signToken);
		}
		consume(TokenType.LBRACE, "Expected '{' before the condition");
		Expression condition = parseCondition();
		consume(TokenType.RBRACE, "Expected '}' after the condition");
		consume(TokenType.LBRACE, "Expected '{' before the event assignments");
		List<Assignment> body = parseDeclarations();
		consume(TokenType.RBRACE, "Expected '}' after the event assignments");
		return new Command.Global(negative ? -sign : sign, condition, body);
	}

	private Command parseFunDef() {
		Expression.Name name = name(consume(TokenType.IDENTIFIER, "Expected a function name"));
		consume(TokenType.LPAREN, "Expected '(' after function name");
		List<Expression.Name> parameters = new ArrayList<>();
		do {
			parameters.add(name(consume(TokenType.IDENTIFIER, "Expected a parameter name")));
		} while (match(TokenType.COMMA));
		consume(TokenType.RPAREN, "Expected ')' after parameters");
		consume(TokenType.EQUALS, "Expected '=' in function definition");
		Expression body = parseExpression();
		return new Command.FunDef(name, parameters, body);
	}

	private Command parseOde() {
		XppToken notation = advance();
		consume(TokenType.EQUALS, "Expected '=' after " + notation.value());
		return Command.ODE.of(notation.stateVariable(), parseExpression());
	}

	private List<Command> parseArrayOde() {
		XppToken nameToken = consume(TokenType.IDENTIFIER, "Expected a variable name");
		consume(TokenType.LBRACKET, "Expected '['");
		int[] range = parseRange();
		consume(TokenType.APOSTROPHE, "Expected ' after the array range");
		consume(TokenType.EQUALS, "Expected '=' in array equation");
		List<Command> odes = new ArrayList<>();
		for (Assignment assignment : expand(nameToken, range)) {
			odes.add(new Command.ODE(assignment));
		}
		return odes;
	}

	/**
	 * declaration ((COMMA | SEMICOLON)? declaration)*, with an optional trailing separator.
	 */
	private List<Assignment> parseDeclarations() {
		List<Assignment> assignments = new ArrayList<>();
		while (true) {
			assignments.addAll(parseDeclaration());
			if (match(TokenType.COMMA) || match(TokenType.SEMICOLON)) {
				if (check(TokenType.NEWLINE) || check(TokenType.RBRACE) || isAtEnd()) break;
				continue;
			}
			if (!check(TokenType.IDENTIFIER)) break;
		}
		return assignments;
	}

	private List<Assignment> parseDeclaration() {
		XppToken nameToken = consume(TokenType.IDENTIFIER, "Expected a variable name");
		if (match(TokenType.LBRACKET)) {
			int[] range = parseRange();
			skipInitialValueMarker();
			consume(TokenType.EQUALS, "Expected '=' after " + nameToken.value() + "[...]");
			return expand(nameToken, range);
		}
		skipInitialValueMarker();
		consume(TokenType.EQUALS, "Expected '=' after " + nameToken.value());
		return List.of(new Assignment(name(nameToken), parseExpression()));
	}

	// x(0)=1 is the initial value of x
	private void skipInitialValueMarker() {
		if (match(TokenType.LPAREN)) {
			if (!isNumberType(peek().type())) {
				throw error("Expected a number in initial value marker");
			}
			advance();
			consume(TokenType.RPAREN, "Expected ')' after initial value marker");
		}
	}

	private int[] parseRange() {
		XppToken lowToken = consume(TokenType.INTEGER, "Expected the lower array bound");
		consume(TokenType.RANGE, "Expected '..' in array range");
		XppToken highToken = consume(TokenType.INTEGER, "Expected the upper array bound");
		consume(TokenType.RBRACKET, "Expected ']' after array range");
		int low = Integer.parseInt(lowToken.value());
		int high = Integer.parseInt(highToken.value());
		if (low > high) {
			throw new XppSyntaxException("Array range " + low + ".." + high + " is empty", highToken);
		}
		return new int[] { low, high };
	}

	/**
	 * Parses the right-hand side once and instantiates it for every index of the range.
	 */
	private List<Assignment> expand(XppToken nameToken, int[] range) {
		arraySelects = new IdentityHashMap<>();
		Expression template = parseExpression();
		Map<Expression.Name, ArraySelect> selects = arraySelects;
		arraySelects = null;

		List<Assignment> assignments = new ArrayList<>();
		// long cursor so an upper bound of Integer.MAX_VALUE terminates
		for (long index = range[0]; index <= range[1]; index++) {
			IndexSubstitution substitution = new IndexSubstitution(selects, (int) index);
			assignments.add(Assignment.of(nameToken.value() + index, substitution.rewrite(template)));
		}
		return assignments;
	}

	private Expression parseCondition() {
		Expression left = parseExpression();
		if (peek().type().isComparison() || check(TokenType.EQUALS)) {
			XppToken operator = advance();
			Expression right = parseExpression();
			return new Expression.Compare(operator.isType(TokenType.EQUALS) ? "==" : operator.value(), left, right);
		}
		return left;
	}

	private Expression parseExpression() {
		return parseAdditive();
	}

	private Expression parseAdditive() {
		Expression left = parseMultiplicative();
		while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
			String operator = advance().value();
			left = new Expression.BinOp(left, operator, parseMultiplicative());
		}
		return left;
	}

	private Expression parseMultiplicative() {
		Expression left = parsePower();
		while (check(TokenType.TIMES) || check(TokenType.DIVIDE)) {
			String operator = advance().value();
			left = new Expression.BinOp(left, operator, parsePower());
		}
		return left;
	}

	private Expression parsePower() {
		Expression left = parseUnary();
		while (check(TokenType.POWER)) {
			String operator = advance().value();
			left = new Expression.BinOp(left, operator, parseUnary());
		}
		return left;
	}

	private Expression parseUnary() {
		if (match(TokenType.MINUS)) {
			return Expression.UnaryOp.negate(parseUnary());
		}
		return parsePrimary();
	}

	private Expression parsePrimary() {
		XppToken token = peek();
		return switch (token.type()) {
			case INTEGER, FLOAT -> {
				advance();
				yield Expression.Number.parse(token.value(), token.isType(TokenType.FLOAT));
			}
			case IDENTIFIER -> {
				if (checkAt(1, TokenType.LPAREN)) {
					yield parseFunCall();
				}
				if (checkAt(1, TokenType.LBRACKET)) {
					yield parseArraySelect();
				}
				advance();
				yield name(token);
			}
			case LPAREN -> {
				advance();
				Expression inner = parseExpression();
				consume(TokenType.RPAREN, "Expected ')'");
				yield new Expression.Group(inner);
			}
			case IF -> parseConditional();
			case SUM -> parseSum();
			case EULER -> {
				if (sumDepth == 0 || !"i".equals(token.stateVariable())) {
					throw error("Unexpected " + token.value() + " outside a sum");
				}
				advance();
				yield new Expression.SumIndex();
			}
			default -> throw error("Expected an expression");
		};
	}

	private Expression parseFunCall() {
		Expression.Name name = name(advance());
		consume(TokenType.LPAREN, "Expected '('");
		List<Expression> arguments = new ArrayList<>();
		do {
			arguments.add(parseExpression());
		} while (match(TokenType.COMMA));
		consume(TokenType.RPAREN, "Expected ')' after arguments of " + name.id());
		return new Expression.FunCall(name, arguments);
	}

	private Expression parseConditional() {
		consume(TokenType.IF, "Expected 'if'");
		consume(TokenType.LPAREN, "Expected '(' after if");
		Expression condition = parseCondition();
		consume(TokenType.RPAREN, "Expected ')' after condition");
		consume(TokenType.THEN, "Expected 'then'");
		Expression whenTrue = parseParenthesized("then");
		consume(TokenType.ELSE, "Expected 'else'");
		Expression whenFalse = parseParenthesized("else");
		return new Expression.Conditional(condition, whenTrue, whenFalse);
	}

	private Expression parseSum() {
		consume(TokenType.SUM, "Expected 'sum'");
		consume(TokenType.LPAREN, "Expected '(' after sum");
		Expression lower = parseExpression();
		consume(TokenType.COMMA, "Expected ',' between summation bounds");
		Expression upper = parseExpression();
		consume(TokenType.RPAREN, "Expected ')' after summation bounds");
		consume(TokenType.OF, "Expected 'of'");
		sumDepth++;
		Expression body = parseParenthesized("of");
		sumDepth--;
		return new Expression.Sum(lower, upper, body);
	}

	private Expression parseParenthesized(String keyword) {
		consume(TokenType.LPAREN, "Expected '(' after " + keyword);
		Expression inner = parseExpression();
		consume(TokenType.RPAREN, "Expected ')' to close " + keyword);
		return inner;
	}

	/**
	 * {@code x[j]}, {@code x[j+k]}, {@code x[j-k]} or {@code x[j*k]} inside a ranged declarator.
	 */
	private Expression parseArraySelect() {
		XppToken base = advance();
		if (arraySelects == null) {
			throw new XppSyntaxException("Array selection outside a ranged declaration", base);
		}
		consume(TokenType.LBRACKET, "Expected '['");
		XppToken index = consume(TokenType.IDENTIFIER, "Expected index variable " + language.indexVariable());
		if (!language.indexVariable().equals(index.value())) {
			throw new XppSyntaxException("Expected index variable " + language.indexVariable(), index);
		}
		IndexTransform transform = IndexTransform.identity();
		if (check(TokenType.PLUS) || check(TokenType.MINUS) || check(TokenType.TIMES)) {
			TokenType operator = advance().type();
			int operand = Integer.parseInt(consume(TokenType.INTEGER, "Expected an integer index offset").value());
			transform = switch (operator) {
				case PLUS -> IndexTransform.add(operand);
				case MINUS -> IndexTransform.subtract(operand);
				default -> IndexTransform.multiply(operand);
			};
		}
		consume(TokenType.RBRACKET, "Expected ']' after array index");

		// Placeholder, replaced per index by IndexSubstitution
		Expression.Name placeholder = name(base);
		arraySelects.put(placeholder, new ArraySelect(base, transform));
		return placeholder;
	}

	private void expectEndOfStatement() {
		if (check(TokenType.NEWLINE)) {
			advance();
		} else if (!isAtEnd()) {
			throw error("Expected end of line");
		}
	}

	private Expression.Name name(XppToken token) {
		return new Expression.Name(token.value());
	}

	private XppSyntaxException error(String detail) {
		return new XppSyntaxException(detail, peek());
	}

	private XppToken consume(TokenType type, String detail) {
		if (check(type)) {
			return advance();
		}
		throw error(detail);
	}

	private boolean match(TokenType type) {
		if (check(type)) {
			advance();
			return true;
		}
		return false;
	}

	private boolean check(TokenType type) {
		return peek().isType(type);
	}

	private boolean checkAt(int offset, TokenType type) {
		return peekAt(offset).isType(type);
	}

	private XppToken peek() {
		return tokens.get(current);
	}

	private XppToken peekAt(int offset) {
		return tokenAt(current + offset);
	}

	private XppToken tokenAt(int index) {
		return tokens.get(Math.min(index, tokens.size() - 1));
	}

	private XppToken advance() {
		if (!isAtEnd()) {
			current++;
		}
		return previous();
	}

	private XppToken previous() {
		return tokens.get(Math.max(current - 1, 0));
	}

	private boolean isAtEnd() {
		return peek().isType(TokenType.EOF);
	}

	private static boolean isNumberType(TokenType type) {
		return type == TokenType.INTEGER || type == TokenType.FLOAT;
	}

	private static List<XppToken> withEndOfInput(List<XppToken> tokens) {
		List<XppToken> normalized = tokens != null ? new ArrayList<>(tokens) : new ArrayList<>();
		int lastLine = normalized.isEmpty() ? 1 : normalized.get(normalized.size() - 1).line();
		if (normalized.isEmpty() || !normalized.get(normalized.size() - 1).isType(TokenType.EOF)) {
			normalized.add(new XppToken(TokenType.EOF, "", lastLine));
		}
		return normalized;
	}

	private record ArraySelect(XppToken base, IndexTransform transform) {
	}

	/**
	 * Replaces the array select placeholders of a template by the names for one index.
	 */
	private static final class IndexSubstitution extends ExpressionRewriter {

		private final Map<Expression.Name, ArraySelect> selects;
		private final int index;

		IndexSubstitution(Map<Expression.Name, ArraySelect> selects, int index) {
			this.selects = selects;
			this.index = index;
		}

		@Override
		public Expression visitName(Expression.Name name) {
			ArraySelect select = selects.get(name);
			if (select == null) {
				return name;
			}
			int target;
			try {
				target = select.transform().apply(index);
			} catch (ArithmeticException e) {
				throw new XppSyntaxException(
						"Index of " + select.base().value() + " overflows at " + index, select.base(), e);
			}
			if (target < 0) {
				throw new XppSyntaxException(
						"Index " + target + " of " + select.base().value() + " is negative", select.base());
			}
			return new Expression.Name(select.base().value() + target);
		}
	}
}
