package pymig.parser;

import pymig.lexer.PythonToken;
import pymig.lexer.PythonTokenType;
import pymig.model.python.*;
import pymig.util.PyStrings;
import pymig.util.SourceLocation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * A recursive descent parser for Python 3 modules.
 *
 * Node locations follow the classic CPython conventions: a compound expression starts where the production
 * that built it starts (so a parenthesized left operand makes it start at the parenthesis), the expression
 * inside parentheses starts at its own first token, and an unparenthesized tuple starts at its first element.
 *
 * Parentheses that only group an expression do not appear in the tree. They are reported as trivia, and the
 * expressions they enclose are remembered, so that a printer can put them back.
 */
public class PythonParser {

	static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
			"False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
			"def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
			"is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with",
			"yield"));

	static final Set<String> EXPRESSION_KEYWORDS = new HashSet<>(Arrays.asList(
			"False", "None", "True", "not", "lambda", "await"));

	static final Set<String> AUGMENTED_ASSIGNMENT = new HashSet<>(Arrays.asList(
			"+=", "-=", "*=", "@=", "/=", "//=", "%=", "**=", "<<=", ">>=", "|=", "^=", "&="));

	static final String[][] BINARY_LEVELS = {
			{"|"},
			{"^"},
			{"&"},
			{"<<", ">>"},
			{"+", "-"},
			{"*", "@", "/", "//", "%"},
	};

	private final Path filename;
	private final List<PythonToken> tokens;
	private final List<PyTrivia> groupingParens = new ArrayList<>();
	private final Set<PyExpression> grouped = Collections.newSetFromMap(new IdentityHashMap<>());
	private int index;

	public PythonParser(Path filename, List<PythonToken> tokens) {
		this.filename = filename;
		this.tokens = tokens;
		this.index = 0;
	}

	/**
	 * @return the grouping parentheses seen by the last parse, in source order
	 */
	public List<PyTrivia> getGroupingParens() {
		groupingParens.sort((a, b) -> a.getLocation().compareTo(b.getLocation()));
		return groupingParens;
	}

	/**
	 * @return the expressions directly enclosed by grouping parentheses, compared by identity
	 */
	public Set<PyExpression> getGroupedExpressions() {
		return grouped;
	}

	private PyExpression group(PythonToken open, PythonToken close, PyExpression expression) {
		groupingParens.add(new PyTrivia(open.getLocation(), PyTrivia.Kind.GROUP_OPEN, "("));
		groupingParens.add(new PyTrivia(close.getLocation(), PyTrivia.Kind.GROUP_CLOSE, ")"));
		grouped.add(expression);
		return expression;
	}

	private static class CallArguments {
		final List<PyExpression> arguments = new ArrayList<>();
		final List<PyKeyword> keywords = new ArrayList<>();
		boolean trailingComma = false;
	}

	// token plumbing

	private PythonToken peek() {
		return peek(0);
	}

	private PythonToken peek(int ahead) {
		int i = Math.min(index + ahead, tokens.size() - 1);
		return tokens.get(i);
	}

	private PythonToken next() {
		PythonToken token = peek();
		if (index < tokens.size() - 1) {
			index++;
		}
		return token;
	}

	private boolean isOp(String value) {
		return peek().isOp(value);
	}

	private boolean isName(String value) {
		return peek().isName(value);
	}

	private boolean isType(PythonTokenType type) {
		return peek().getType() == type;
	}

	private PythonParseException error(PythonToken token, String message) {
		return new PythonParseException(token.getLocation(), message);
	}

	private PythonParseException unexpected(PythonToken token) {
		switch (token.getType()) {
			case NEWLINE:
				return error(token, "invalid syntax: unexpected end of line");
			case INDENT:
				return error(token, "unexpected indent");
			case DEDENT:
				return error(token, "unexpected unindent");
			case ENDMARKER:
				return error(token, "unexpected end of file");
			default:
				return error(token, "invalid syntax: unexpected '" + token.getValue() + "'");
		}
	}

	private PythonToken expectOp(String value) {
		if (!isOp(value)) {
			throw unexpected(peek());
		}
		return next();
	}

	private PythonToken expectName(String value) {
		if (!isName(value)) {
			throw unexpected(peek());
		}
		return next();
	}

	private PythonToken expectType(PythonTokenType type) {
		if (!isType(type)) {
			throw unexpected(peek());
		}
		return next();
	}

	private PythonToken expectIdentifier() {
		PythonToken token = peek();
		if (token.getType() != PythonTokenType.NAME || KEYWORDS.contains(token.getValue())) {
			throw unexpected(token);
		}
		return next();
	}

	/**
	 * @return the last consumed token that stands for source text
	 */
	private PythonToken lastSignificant() {
		for (int i = index - 1; i >= 0; i--) {
			PythonToken token = tokens.get(i);
			switch (token.getType()) {
				case NEWLINE:
				case INDENT:
				case DEDENT:
					continue;
				default:
					return token;
			}
		}
		return tokens.get(0);
	}

	private SourceLocation between(PythonToken start, PythonToken end) {
		SourceLocation s = start.getLocation();
		SourceLocation e = end.getLocation();
		if (e.getEndOffset() < s.getStartOffset()) {
			return new SourceLocation(filename, s.getStartOffset(), s.getStartOffset(), s.getStartLine(),
					s.getStartLine(), s.getStartColumn(), s.getStartColumn());
		}
		return new SourceLocation(filename, s.getStartOffset(), e.getEndOffset(), s.getStartLine(), e.getEndLine(),
				s.getStartColumn(), e.getEndColumn());
	}

	private SourceLocation span(PythonToken start) {
		return between(start, lastSignificant());
	}

	private boolean startsExpression() {
		PythonToken token = peek();
		switch (token.getType()) {
			case NUMBER:
			case STRING:
				return true;
			case NAME:
				return !KEYWORDS.contains(token.getValue()) || EXPRESSION_KEYWORDS.contains(token.getValue());
			case OP:
				switch (token.getValue()) {
					case "(":
					case "[":
					case "{":
					case "-":
					case "+":
					case "~":
					case "*":
					case "...":
						return true;
					default:
						return false;
				}
			default:
				return false;
		}
	}

	// statements

	public PyModule parseModule() throws PythonParseException {
		PythonToken start = peek();
		List<PyStatement> body = new ArrayList<>();
		while (!isType(PythonTokenType.ENDMARKER)) {
			if (isType(PythonTokenType.NEWLINE)) {
				next();
				continue;
			}
			body.addAll(parseStatement());
		}
		return new PyModule(span(start), body);
	}

	private List<PyStatement> parseStatement() {
		PythonToken token = peek();
		if (token.getType() == PythonTokenType.NAME) {
			switch (token.getValue()) {
				case "if":
					return Collections.singletonList(parseIf(next(), false));
				case "while":
					return Collections.singletonList(parseWhile());
				case "for":
					return Collections.singletonList(parseFor());
				case "try":
					return Collections.singletonList(parseTry());
				case "with":
					return Collections.singletonList(parseWith());
				case "def":
				case "class":
					return Collections.singletonList(parseDecorated(Collections.emptyList()));
				case "async":
					throw error(token, "async constructs are not supported");
			}
		}
		if (token.isOp("@")) {
			List<PyDecorator> decorators = new ArrayList<>();
			while (isOp("@")) {
				PythonToken at = next();
				PyExpression expression = parseTest();
				decorators.add(new PyDecorator(span(at), expression));
				expectType(PythonTokenType.NEWLINE);
			}
			return Collections.singletonList(parseDecorated(decorators));
		}
		if (token.getType() == PythonTokenType.INDENT) {
			throw unexpected(token);
		}
		return parseSimpleStatements();
	}

	private List<PyStatement> parseSimpleStatements() {
		List<PyStatement> statements = new ArrayList<>();
		while (true) {
			statements.add(parseSmallStatement());
			if (!isOp(";")) {
				break;
			}
			next();
			if (isType(PythonTokenType.NEWLINE)) {
				break;
			}
		}
		expectType(PythonTokenType.NEWLINE);
		return statements;
	}

	private List<PyStatement> parseBlock() {
		expectOp(":");
		if (!isType(PythonTokenType.NEWLINE)) {
			return parseSimpleStatements();
		}
		next();
		expectType(PythonTokenType.INDENT);
		List<PyStatement> body = new ArrayList<>();
		while (!isType(PythonTokenType.DEDENT)) {
			if (isType(PythonTokenType.NEWLINE)) {
				next();
				continue;
			}
			body.addAll(parseStatement());
		}
		next();
		return body;
	}

	private PyIf parseIf(PythonToken keyword, boolean elif) {
		PyExpression test = parseTest();
		List<PyStatement> body = parseBlock();
		List<PyStatement> orelse = Collections.emptyList();
		SourceLocation elseLocation = null;
		if (isName("elif")) {
			orelse = Collections.singletonList(parseIf(next(), true));
		} else if (isName("else")) {
			elseLocation = next().getLocation();
			orelse = parseBlock();
		}
		return new PyIf(span(keyword), test, body, orelse, elseLocation, elif);
	}

	private PyWhile parseWhile() {
		PythonToken keyword = next();
		PyExpression test = parseTest();
		List<PyStatement> body = parseBlock();
		List<PyStatement> orelse = Collections.emptyList();
		SourceLocation elseLocation = null;
		if (isName("else")) {
			elseLocation = next().getLocation();
			orelse = parseBlock();
		}
		return new PyWhile(span(keyword), test, body, orelse, elseLocation);
	}

	private PyFor parseFor() {
		PythonToken keyword = next();
		PyExpression target = parseExprList();
		SourceLocation inLocation = expectName("in").getLocation();
		PyExpression iter = parseTestListStarExpr();
		List<PyStatement> body = parseBlock();
		List<PyStatement> orelse = Collections.emptyList();
		SourceLocation elseLocation = null;
		if (isName("else")) {
			elseLocation = next().getLocation();
			orelse = parseBlock();
		}
		return new PyFor(span(keyword), target, inLocation, iter, body, orelse, elseLocation);
	}

	private PyTry parseTry() {
		PythonToken keyword = next();
		List<PyStatement> body = parseBlock();
		List<PyExceptHandler> handlers = new ArrayList<>();
		while (isName("except")) {
			PythonToken except = next();
			PyExpression type = null;
			String name = null;
			SourceLocation nameLocation = null;
			if (!isOp(":")) {
				type = parseTest();
				if (isName("as")) {
					next();
					PythonToken nameToken = expectIdentifier();
					name = nameToken.getValue();
					nameLocation = nameToken.getLocation();
				}
			}
			List<PyStatement> handlerBody = parseBlock();
			handlers.add(new PyExceptHandler(span(except), type, name, nameLocation, handlerBody));
		}
		List<PyStatement> orelse = Collections.emptyList();
		SourceLocation elseLocation = null;
		if (!handlers.isEmpty() && isName("else")) {
			elseLocation = next().getLocation();
			orelse = parseBlock();
		}
		List<PyStatement> finalBody = Collections.emptyList();
		SourceLocation finallyLocation = null;
		if (isName("finally")) {
			finallyLocation = next().getLocation();
			finalBody = parseBlock();
		}
		if (handlers.isEmpty() && finallyLocation == null) {
			throw error(peek(), "expected 'except' or 'finally' block");
		}
		return new PyTry(span(keyword), body, handlers, orelse, elseLocation, finalBody, finallyLocation);
	}

	private PyWith parseWith() {
		PythonToken keyword = next();
		List<PyWithItem> items = new ArrayList<>();
		do {
			if (!items.isEmpty()) {
				next();
			}
			PythonToken start = peek();
			PyExpression context = parseTest();
			PyExpression optionalVars = null;
			if (isName("as")) {
				next();
				optionalVars = parseExpr();
			}
			items.add(new PyWithItem(span(start), context, optionalVars));
		} while (isOp(","));
		List<PyStatement> body = parseBlock();
		return new PyWith(span(keyword), items, body);
	}

	private PyStatement parseDecorated(List<PyDecorator> decorators) {
		if (isName("def")) {
			return parseFunctionDef(decorators);
		}
		if (isName("class")) {
			return parseClassDef(decorators);
		}
		throw unexpected(peek());
	}

	private PyFunctionDef parseFunctionDef(List<PyDecorator> decorators) {
		PythonToken keyword = next();
		PythonToken name = expectIdentifier();
		expectOp("(");
		PyArguments arguments = parseArguments(true, ")");
		expectOp(")");
		SourceLocation arrowLocation = null;
		PyExpression returns = null;
		if (isOp("->")) {
			arrowLocation = next().getLocation();
			returns = parseTest();
		}
		List<PyStatement> body = parseBlock();
		return new PyFunctionDef(span(keyword), decorators, name.getValue(), name.getLocation(), arguments,
				arrowLocation, returns, body);
	}

	private PyClassDef parseClassDef(List<PyDecorator> decorators) {
		PythonToken keyword = next();
		PythonToken name = expectIdentifier();
		boolean parenthesized = false;
		CallArguments bases = new CallArguments();
		SourceLocation closeLocation = null;
		if (isOp("(")) {
			next();
			parenthesized = true;
			bases = parseCallArguments();
			closeLocation = expectOp(")").getLocation();
		}
		List<PyStatement> body = parseBlock();
		return new PyClassDef(span(keyword), decorators, name.getValue(), name.getLocation(), parenthesized,
				bases.arguments, bases.keywords, closeLocation, bases.trailingComma, body);
	}

	private PyArguments parseArguments(boolean typed, String closer) {
		PythonToken start = peek();
		int startIndex = index;
		List<PyArgument> positional = new ArrayList<>();
		PyArgument vararg = null;
		SourceLocation bareStar = null;
		List<PyArgument> keywordOnly = new ArrayList<>();
		PyArgument kwarg = null;
		boolean trailingComma = false;
		while (!isOp(closer)) {
			if (kwarg != null) {
				throw unexpected(peek());
			}
			if (isOp("**")) {
				kwarg = parseParameter(next(), typed, false);
			} else if (isOp("*")) {
				if (vararg != null || bareStar != null) {
					throw unexpected(peek());
				}
				PythonToken star = next();
				if (isOp(",") || isOp(closer)) {
					bareStar = star.getLocation();
				} else {
					vararg = parseParameter(star, typed, false);
				}
			} else if (isOp("/")) {
				throw error(peek(), "positional-only parameters are not supported");
			} else {
				PyArgument argument = parseParameter(null, typed, true);
				if (vararg != null || bareStar != null) {
					keywordOnly.add(argument);
				} else {
					positional.add(argument);
				}
			}
			trailingComma = false;
			if (!isOp(",")) {
				break;
			}
			next();
			trailingComma = true;
		}
		SourceLocation closeLocation = closer.equals(")") ? peek().getLocation() : null;
		SourceLocation location = index == startIndex ? between(start, start) : span(start);
		return new PyArguments(location, positional, vararg, bareStar, keywordOnly, kwarg, closeLocation,
				trailingComma);
	}

	private PyArgument parseParameter(PythonToken star, boolean typed, boolean allowDefault) {
		PythonToken name = expectIdentifier();
		PythonToken first = star != null ? star : name;
		PyExpression annotation = null;
		if (typed && isOp(":")) {
			next();
			annotation = parseTest();
		}
		SourceLocation equalsLocation = null;
		PyExpression defaultValue = null;
		if (allowDefault && isOp("=")) {
			equalsLocation = next().getLocation();
			defaultValue = parseTest();
		}
		return new PyArgument(span(first), name.getValue(), name.getLocation(), annotation, equalsLocation,
				defaultValue);
	}

	private PyStatement parseSmallStatement() {
		PythonToken token = peek();
		if (token.getType() == PythonTokenType.NAME) {
			switch (token.getValue()) {
				case "pass":
					next();
					return new PyPass(span(token));
				case "break":
					next();
					return new PyBreak(span(token));
				case "continue":
					next();
					return new PyContinue(span(token));
				case "return": {
					next();
					PyExpression value = startsExpression() ? parseTestListStarExpr() : null;
					return new PyReturn(span(token), value);
				}
				case "raise": {
					next();
					PyExpression exception = null;
					PyExpression cause = null;
					if (startsExpression()) {
						exception = parseTest();
						if (isName("from")) {
							next();
							cause = parseTest();
						}
					}
					return new PyRaise(span(token), exception, cause);
				}
				case "global":
				case "nonlocal": {
					next();
					List<PyName> names = new ArrayList<>();
					do {
						if (!names.isEmpty()) {
							next();
						}
						PythonToken name = expectIdentifier();
						names.add(new PyName(name.getLocation(), name.getValue()));
					} while (isOp(","));
					return new PyGlobal(span(token), token.getValue().equals("nonlocal"), names);
				}
				case "del": {
					next();
					List<PyExpression> targets = new ArrayList<>();
					do {
						if (!targets.isEmpty()) {
							next();
						}
						targets.add(parseExprOrStar());
					} while (isOp(",") && peek(1).getType() != PythonTokenType.NEWLINE);
					return new PyDelete(span(token), targets);
				}
				case "assert": {
					next();
					PyExpression test = parseTest();
					PyExpression message = null;
					if (isOp(",")) {
						next();
						message = parseTest();
					}
					return new PyAssert(span(token), test, message);
				}
				case "import":
					return parseImport();
				case "from":
					return parseImportFrom();
			}
		}
		return parseExpressionStatement();
	}

	private PyImport parseImport() {
		PythonToken keyword = next();
		List<PyAlias> names = new ArrayList<>();
		do {
			if (!names.isEmpty()) {
				next();
			}
			names.add(parseAlias(true));
		} while (isOp(","));
		return new PyImport(span(keyword), names);
	}

	private PyAlias parseAlias(boolean dotted) {
		PythonToken start = peek();
		StringBuilder name = new StringBuilder(expectIdentifier().getValue());
		while (dotted && isOp(".")) {
			next();
			name.append('.').append(expectIdentifier().getValue());
		}
		String asName = null;
		SourceLocation asNameLocation = null;
		if (isName("as")) {
			next();
			PythonToken as = expectIdentifier();
			asName = as.getValue();
			asNameLocation = as.getLocation();
		}
		return new PyAlias(span(start), name.toString(), asName, asNameLocation);
	}

	private PyImportFrom parseImportFrom() {
		PythonToken keyword = next();
		SourceLocation moduleLocation = peek().getLocation();
		StringBuilder module = new StringBuilder();
		while (isOp(".") || isOp("...")) {
			module.append(next().getValue());
		}
		if (!isName("import")) {
			module.append(expectIdentifier().getValue());
			while (isOp(".")) {
				next();
				module.append('.').append(expectIdentifier().getValue());
			}
		}
		if (module.length() == 0) {
			throw unexpected(peek());
		}
		SourceLocation importLocation = expectName("import").getLocation();
		List<PyAlias> names = new ArrayList<>();
		boolean parenthesized = false;
		boolean trailingComma = false;
		SourceLocation closeLocation = null;
		if (isOp("*")) {
			PythonToken star = next();
			names.add(new PyAlias(star.getLocation(), "*", null, null));
		} else {
			if (isOp("(")) {
				next();
				parenthesized = true;
			}
			while (true) {
				names.add(parseAlias(false));
				trailingComma = false;
				if (!isOp(",")) {
					break;
				}
				next();
				trailingComma = true;
				if (parenthesized && isOp(")")) {
					break;
				}
			}
			if (parenthesized) {
				closeLocation = expectOp(")").getLocation();
			} else if (trailingComma) {
				throw error(peek(), "trailing comma not allowed without surrounding parentheses");
			}
		}
		return new PyImportFrom(span(keyword), module.toString(), moduleLocation, importLocation, names,
				parenthesized, closeLocation, trailingComma);
	}

	private PyStatement parseExpressionStatement() {
		PythonToken start = peek();
		PyExpression first = isName("yield") ? parseYieldExpr() : parseTestListStarExpr();
		if (isOp(":")) {
			next();
			PyExpression annotation = parseTest();
			PyExpression value = null;
			if (isOp("=")) {
				next();
				value = isName("yield") ? parseYieldExpr() : parseTestListStarExpr();
			}
			return new PyAnnAssign(span(start), first, annotation, value);
		}
		if (peek().getType() == PythonTokenType.OP && AUGMENTED_ASSIGNMENT.contains(peek().getValue())) {
			PythonToken op = next();
			PyExpression value = isName("yield") ? parseYieldExpr() : parseTestListStarExpr();
			String symbol = op.getValue().substring(0, op.getValue().length() - 1);
			return new PyAugAssign(span(start), first, PyBinOp.Operation.fromSymbol(symbol), op.getLocation(), value);
		}
		if (isOp("=")) {
			List<PyExpression> targets = new ArrayList<>();
			List<SourceLocation> equalsLocations = new ArrayList<>();
			PyExpression value = first;
			while (isOp("=")) {
				targets.add(value);
				equalsLocations.add(next().getLocation());
				value = isName("yield") ? parseYieldExpr() : parseTestListStarExpr();
			}
			return new PyAssign(span(start), targets, equalsLocations, value);
		}
		return new PyExpressionStatement(span(start), first);
	}

	// expressions

	private PyExpression parseYieldExpr() {
		PythonToken keyword = expectName("yield");
		if (isName("from")) {
			next();
			PyExpression value = parseTest();
			return new PyYield(span(keyword), true, value);
		}
		PyExpression value = startsExpression() ? parseTestListStarExpr() : null;
		return new PyYield(span(keyword), false, value);
	}

	private PyExpression parseTestListStarExpr() {
		PythonToken start = peek();
		PyExpression first = parseTestOrStar();
		if (!isOp(",")) {
			return first;
		}
		List<PyExpression> elements = new ArrayList<>();
		elements.add(first);
		boolean trailingComma = false;
		while (isOp(",")) {
			next();
			trailingComma = true;
			if (!startsExpression()) {
				break;
			}
			elements.add(parseTestOrStar());
			trailingComma = false;
		}
		return new PyTuple(span(start), elements, false, null, trailingComma);
	}

	private PyExpression parseExprList() {
		PythonToken start = peek();
		PyExpression first = parseExprOrStar();
		if (!isOp(",")) {
			return first;
		}
		List<PyExpression> elements = new ArrayList<>();
		elements.add(first);
		boolean trailingComma = false;
		while (isOp(",")) {
			next();
			trailingComma = true;
			if (!startsExpression()) {
				break;
			}
			elements.add(parseExprOrStar());
			trailingComma = false;
		}
		return new PyTuple(span(start), elements, false, null, trailingComma);
	}

	private PyExpression parseTestOrStar() {
		if (isOp("*")) {
			PythonToken star = next();
			PyExpression value = parseExpr();
			return new PyStarred(span(star), value);
		}
		return parseTest();
	}

	private PyExpression parseExprOrStar() {
		if (isOp("*")) {
			PythonToken star = next();
			PyExpression value = parseExpr();
			return new PyStarred(span(star), value);
		}
		return parseExpr();
	}

	private PyExpression parseTest() {
		if (isName("lambda")) {
			return parseLambda(true);
		}
		PythonToken start = peek();
		PyExpression body = parseOrTest();
		if (isName("if")) {
			SourceLocation ifLocation = next().getLocation();
			PyExpression test = parseOrTest();
			SourceLocation elseLocation = expectName("else").getLocation();
			PyExpression orelse = parseTest();
			return new PyIfExp(span(start), body, ifLocation, test, elseLocation, orelse);
		}
		return body;
	}

	private PyExpression parseTestNoCond() {
		if (isName("lambda")) {
			return parseLambda(false);
		}
		return parseOrTest();
	}

	private PyExpression parseLambda(boolean allowConditional) {
		PythonToken keyword = next();
		PyArguments arguments = parseArguments(false, ":");
		expectOp(":");
		PyExpression body = allowConditional ? parseTest() : parseTestNoCond();
		return new PyLambda(span(keyword), arguments, body);
	}

	private PyExpression parseOrTest() {
		PythonToken start = peek();
		PyExpression first = parseAndTest();
		if (!isName("or")) {
			return first;
		}
		List<PyExpression> values = new ArrayList<>();
		List<SourceLocation> operatorLocations = new ArrayList<>();
		values.add(first);
		while (isName("or")) {
			operatorLocations.add(next().getLocation());
			values.add(parseAndTest());
		}
		return new PyBoolOp(span(start), PyBoolOp.Operation.OR, values, operatorLocations);
	}

	private PyExpression parseAndTest() {
		PythonToken start = peek();
		PyExpression first = parseNotTest();
		if (!isName("and")) {
			return first;
		}
		List<PyExpression> values = new ArrayList<>();
		List<SourceLocation> operatorLocations = new ArrayList<>();
		values.add(first);
		while (isName("and")) {
			operatorLocations.add(next().getLocation());
			values.add(parseNotTest());
		}
		return new PyBoolOp(span(start), PyBoolOp.Operation.AND, values, operatorLocations);
	}

	private PyExpression parseNotTest() {
		if (isName("not")) {
			PythonToken not = next();
			PyExpression operand = parseNotTest();
			return new PyUnaryOp(span(not), PyUnaryOp.Operation.NOT, operand);
		}
		return parseComparison();
	}

	private PyCompare.Operation parseComparisonOperator() {
		PythonToken token = peek();
		if (token.getType() == PythonTokenType.OP) {
			switch (token.getValue()) {
				case "<":
					next();
					return PyCompare.Operation.LT;
				case ">":
					next();
					return PyCompare.Operation.GT;
				case "==":
					next();
					return PyCompare.Operation.EQ;
				case ">=":
					next();
					return PyCompare.Operation.GT_E;
				case "<=":
					next();
					return PyCompare.Operation.LT_E;
				case "!=":
					next();
					return PyCompare.Operation.NOT_EQ;
			}
			return null;
		}
		if (token.isName("in")) {
			next();
			return PyCompare.Operation.IN;
		}
		if (token.isName("not") && peek(1).isName("in")) {
			next();
			next();
			return PyCompare.Operation.NOT_IN;
		}
		if (token.isName("is")) {
			next();
			if (isName("not")) {
				next();
				return PyCompare.Operation.IS_NOT;
			}
			return PyCompare.Operation.IS;
		}
		return null;
	}

	private PyExpression parseComparison() {
		PythonToken start = peek();
		PyExpression left = parseExpr();
		List<PyCompare.Operation> ops = new ArrayList<>();
		List<SourceLocation> operatorLocations = new ArrayList<>();
		List<PyExpression> comparators = new ArrayList<>();
		while (true) {
			SourceLocation operatorLocation = peek().getLocation();
			PyCompare.Operation op = parseComparisonOperator();
			if (op == null) {
				break;
			}
			ops.add(op);
			operatorLocations.add(operatorLocation);
			comparators.add(parseExpr());
		}
		if (ops.isEmpty()) {
			return left;
		}
		return new PyCompare(span(start), left, ops, operatorLocations, comparators);
	}

	private PyExpression parseExpr() {
		return parseBinary(0);
	}

	private boolean atBinaryOperator(int level) {
		if (peek().getType() != PythonTokenType.OP) {
			return false;
		}
		for (String op : BINARY_LEVELS[level]) {
			if (peek().getValue().equals(op)) {
				return true;
			}
		}
		return false;
	}

	private PyExpression parseBinary(int level) {
		if (level == BINARY_LEVELS.length) {
			return parseFactor();
		}
		PythonToken start = peek();
		PyExpression lhs = parseBinary(level + 1);
		while (atBinaryOperator(level)) {
			PythonToken op = next();
			PyExpression rhs = parseBinary(level + 1);
			lhs = new PyBinOp(span(start), PyBinOp.Operation.fromSymbol(op.getValue()), op.getLocation(), lhs, rhs);
		}
		return lhs;
	}

	private PyExpression parseFactor() {
		PythonToken token = peek();
		PyUnaryOp.Operation op = null;
		if (token.isOp("+")) {
			op = PyUnaryOp.Operation.UADD;
		} else if (token.isOp("-")) {
			op = PyUnaryOp.Operation.USUB;
		} else if (token.isOp("~")) {
			op = PyUnaryOp.Operation.INVERT;
		}
		if (op != null) {
			next();
			PyExpression operand = parseFactor();
			return new PyUnaryOp(span(token), op, operand);
		}
		return parsePower();
	}

	private PyExpression parsePower() {
		PythonToken start = peek();
		PyExpression base = parseAtomExpr();
		if (isOp("**")) {
			PythonToken op = next();
			PyExpression exponent = parseFactor();
			return new PyBinOp(span(start), PyBinOp.Operation.POW, op.getLocation(), base, exponent);
		}
		return base;
	}

	private PyExpression parseAtomExpr() {
		if (isName("await")) {
			PythonToken await = next();
			PyExpression value = parseTrailers(peek(), parseAtom());
			return new PyAwait(span(await), value);
		}
		return parseTrailers(peek(), parseAtom());
	}

	private PyExpression parseTrailers(PythonToken start, PyExpression atom) {
		PyExpression expression = atom;
		while (true) {
			if (isOp("(")) {
				PythonToken open = next();
				CallArguments arguments = parseCallArguments();
				PythonToken close = expectOp(")");
				expression = new PyCall(span(start), expression, open.getLocation(), arguments.arguments,
						arguments.keywords, close.getLocation(), arguments.trailingComma);
			} else if (isOp("[")) {
				next();
				PyExpression slice = parseSubscriptList();
				PythonToken close = expectOp("]");
				expression = new PySubscript(span(start), expression, slice, close.getLocation());
			} else if (isOp(".")) {
				next();
				PythonToken name = expectIdentifier();
				expression = new PyAttribute(span(start), expression, name.getValue(), name.getLocation());
			} else {
				return expression;
			}
		}
	}

	private CallArguments parseCallArguments() {
		CallArguments result = new CallArguments();
		while (!isOp(")")) {
			PythonToken start = peek();
			if (isOp("*")) {
				next();
				PyExpression value = parseTest();
				result.arguments.add(new PyStarred(span(start), value));
			} else if (isOp("**")) {
				next();
				PyExpression value = parseTest();
				result.keywords.add(new PyKeyword(span(start), null, value));
			} else if (start.getType() == PythonTokenType.NAME && !KEYWORDS.contains(start.getValue())
					&& peek(1).isOp("=")) {
				next();
				next();
				PyExpression value = parseTest();
				result.keywords.add(new PyKeyword(span(start), start.getValue(), value));
			} else {
				PyExpression value = parseTest();
				if (isName("for")) {
					List<PyComprehensionClause> clauses = parseComprehensionClauses();
					value = new PyComprehension(span(start), PyComprehension.Kind.GENERATOR, value, null, clauses);
				}
				result.arguments.add(value);
			}
			result.trailingComma = false;
			if (!isOp(",")) {
				break;
			}
			next();
			result.trailingComma = true;
		}
		return result;
	}

	private PyExpression parseSubscriptList() {
		PythonToken start = peek();
		PyExpression first = parseSubscript();
		if (!isOp(",")) {
			return first;
		}
		List<PyExpression> elements = new ArrayList<>();
		elements.add(first);
		boolean trailingComma = false;
		while (isOp(",")) {
			next();
			trailingComma = true;
			if (isOp("]")) {
				break;
			}
			elements.add(parseSubscript());
			trailingComma = false;
		}
		return new PyTuple(span(start), elements, false, null, trailingComma);
	}

	private boolean endsSlicePart() {
		return isOp(":") || isOp("]") || isOp(",");
	}

	private PyExpression parseSubscript() {
		PythonToken start = peek();
		PyExpression lower = null;
		if (!isOp(":")) {
			lower = parseTestOrStar();
			if (!isOp(":")) {
				return lower;
			}
		}
		next();
		PyExpression upper = endsSlicePart() ? null : parseTest();
		boolean stepColon = false;
		PyExpression step = null;
		if (isOp(":")) {
			next();
			stepColon = true;
			if (!endsSlicePart()) {
				step = parseTest();
			}
		}
		return new PySlice(span(start), lower, upper, stepColon, step);
	}

	private List<PyComprehensionClause> parseComprehensionClauses() {
		List<PyComprehensionClause> clauses = new ArrayList<>();
		while (isName("for") || isName("async")) {
			if (isName("async")) {
				throw error(peek(), "async constructs are not supported");
			}
			PythonToken keyword = next();
			PyExpression target = parseExprList();
			expectName("in");
			PyExpression iter = parseOrTest();
			List<PyExpression> ifs = new ArrayList<>();
			while (isName("if")) {
				next();
				ifs.add(parseTestNoCond());
			}
			clauses.add(new PyComprehensionClause(span(keyword), target, iter, ifs));
		}
		return clauses;
	}

	private PyExpression parseAtom() {
		PythonToken token = peek();
		switch (token.getType()) {
			case NUMBER:
				next();
				return new PyNum(token.getLocation(), token.getValue());
			case STRING:
				return parseStrings();
			case NAME:
				switch (token.getValue()) {
					case "True":
						next();
						return new PyNameConstant(token.getLocation(), PyNameConstant.Value.TRUE);
					case "False":
						next();
						return new PyNameConstant(token.getLocation(), PyNameConstant.Value.FALSE);
					case "None":
						next();
						return new PyNameConstant(token.getLocation(), PyNameConstant.Value.NONE);
				}
				next();
				if (KEYWORDS.contains(token.getValue())) {
					throw unexpected(token);
				}
				return new PyName(token.getLocation(), token.getValue());
			case OP:
				switch (token.getValue()) {
					case "(":
						return parseParenthesized();
					case "[":
						return parseListDisplay();
					case "{":
						return parseBraceDisplay();
					case "...":
						next();
						return new PyEllipsis(token.getLocation());
				}
				break;
		}
		throw unexpected(token);
	}

	private PyExpression parseParenthesized() {
		PythonToken open = next();
		if (isOp(")")) {
			PythonToken close = next();
			return new PyTuple(between(open, close), new ArrayList<>(), true, close.getLocation(), false);
		}
		if (isName("yield")) {
			PyExpression yield = parseYieldExpr();
			return group(open, expectOp(")"), yield);
		}
		PythonToken start = peek();
		PyExpression first = parseTestOrStar();
		if (isName("for")) {
			List<PyComprehensionClause> clauses = parseComprehensionClauses();
			PythonToken close = expectOp(")");
			return new PyComprehension(between(open, close), PyComprehension.Kind.GENERATOR, first, null, clauses);
		}
		if (isOp(")")) {
			return group(open, next(), first);
		}
		List<PyExpression> elements = new ArrayList<>();
		elements.add(first);
		boolean trailingComma = false;
		while (isOp(",")) {
			next();
			trailingComma = true;
			if (isOp(")")) {
				break;
			}
			elements.add(parseTestOrStar());
			trailingComma = false;
		}
		PythonToken close = expectOp(")");
		return new PyTuple(between(open, close), elements, true, close.getLocation(), trailingComma);
	}

	private PyExpression parseListDisplay() {
		PythonToken open = next();
		List<PyExpression> elements = new ArrayList<>();
		boolean trailingComma = false;
		if (!isOp("]")) {
			PyExpression first = parseTestOrStar();
			if (isName("for")) {
				List<PyComprehensionClause> clauses = parseComprehensionClauses();
				PythonToken close = expectOp("]");
				return new PyComprehension(between(open, close), PyComprehension.Kind.LIST, first, null, clauses);
			}
			elements.add(first);
			while (isOp(",")) {
				next();
				trailingComma = true;
				if (isOp("]")) {
					break;
				}
				elements.add(parseTestOrStar());
				trailingComma = false;
			}
		}
		PythonToken close = expectOp("]");
		return new PyList(between(open, close), elements, close.getLocation(), trailingComma);
	}

	private PyExpression parseBraceDisplay() {
		PythonToken open = next();
		if (isOp("}")) {
			PythonToken close = next();
			return new PyDict(between(open, close), new ArrayList<>(), new ArrayList<>(), new ArrayList<>(),
					close.getLocation(), false);
		}
		if (isOp("**")) {
			return parseDictEntries(open);
		}
		PythonToken start = peek();
		PyExpression first = parseTestOrStar();
		if (isOp(":")) {
			next();
			PyExpression value = parseTest();
			if (isName("for")) {
				List<PyComprehensionClause> clauses = parseComprehensionClauses();
				PythonToken close = expectOp("}");
				return new PyComprehension(between(open, close), PyComprehension.Kind.DICT, first, value, clauses);
			}
			return parseDictEntriesAfter(open, start, first, value);
		}
		if (isName("for")) {
			List<PyComprehensionClause> clauses = parseComprehensionClauses();
			PythonToken close = expectOp("}");
			return new PyComprehension(between(open, close), PyComprehension.Kind.SET, first, null, clauses);
		}
		List<PyExpression> elements = new ArrayList<>();
		elements.add(first);
		boolean trailingComma = false;
		while (isOp(",")) {
			next();
			trailingComma = true;
			if (isOp("}")) {
				break;
			}
			elements.add(parseTestOrStar());
			trailingComma = false;
		}
		PythonToken close = expectOp("}");
		return new PySet(between(open, close), elements, close.getLocation(), trailingComma);
	}

	private PyExpression parseDictEntries(PythonToken open) {
		return parseDictEntriesAfter(open, null, null, null);
	}

	private PyExpression parseDictEntriesAfter(PythonToken open, PythonToken firstStart, PyExpression firstKey,
	                                           PyExpression firstValue) {
		List<PyExpression> keys = new ArrayList<>();
		List<PyExpression> values = new ArrayList<>();
		List<SourceLocation> entryLocations = new ArrayList<>();
		boolean trailingComma = false;
		if (firstKey != null) {
			keys.add(firstKey);
			values.add(firstValue);
			entryLocations.add(firstStart.getLocation());
			if (isOp(",")) {
				next();
				trailingComma = true;
			} else {
				PythonToken close = expectOp("}");
				return new PyDict(between(open, close), keys, values, entryLocations, close.getLocation(), false);
			}
		}
		while (!isOp("}")) {
			PythonToken start = peek();
			if (isOp("**")) {
				next();
				keys.add(null);
				values.add(parseExpr());
			} else {
				keys.add(parseTest());
				expectOp(":");
				values.add(parseTest());
			}
			entryLocations.add(start.getLocation());
			trailingComma = false;
			if (!isOp(",")) {
				break;
			}
			next();
			trailingComma = true;
		}
		PythonToken close = expectOp("}");
		return new PyDict(between(open, close), keys, values, entryLocations, close.getLocation(), trailingComma);
	}

	private PyExpression parseStrings() {
		PythonToken first = peek();
		List<PyStringPart> parts = new ArrayList<>();
		boolean formatted = false;
		boolean bytes = false;
		boolean text = false;
		while (isType(PythonTokenType.STRING)) {
			PythonToken token = next();
			String prefix = PyStrings.prefix(token.getValue());
			if (prefix.contains("b")) {
				bytes = true;
			} else {
				text = true;
			}
			if (prefix.contains("f")) {
				formatted = true;
			}
			parts.add(new PyStringPart(token.getLocation(), token.getValue()));
		}
		if (bytes && text) {
			throw error(first, "cannot mix bytes and nonbytes literals");
		}
		SourceLocation location = span(first);
		if (bytes) {
			return new PyBytes(location, parts);
		}
		if (formatted) {
			return new PyJoinedStr(location, parts);
		}
		StringBuilder value = new StringBuilder();
		for (PyStringPart part : parts) {
			try {
				value.append(PyStrings.decode(part.getText()));
			} catch (IllegalArgumentException e) {
				throw new PythonParseException(part.getLocation(), e.getMessage());
			}
		}
		return new PyStr(location, value.toString(), parts);
	}

}
