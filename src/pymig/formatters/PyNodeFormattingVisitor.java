package pymig.formatters;

import pymig.model.python.*;
import pymig.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Renders a tree through a {@link LayoutWriter}, placing every token at its recorded position. Every child goes
 * through {@link #render(PyNode)}, which records the chain of nodes being rendered when something fails.
 */
public class PyNodeFormattingVisitor extends PyNodeVisitor<Void, IOException> {

	private final LayoutWriter out;
	private final RenderState state;
	private final PyStatementFormattingVisitor statements;
	private final PyExpressionFormattingVisitor expressions;
	private final FStringRewriter rewriter;

	// conditionals that continue an "if" chain and are written as "elif"
	private final Set<PyIf> elifs = Collections.newSetFromMap(new IdentityHashMap<>());

	public PyNodeFormattingVisitor(LayoutWriter out, RenderState state) {
		this.out = out;
		this.state = state;
		this.statements = new PyStatementFormattingVisitor(this);
		this.expressions = new PyExpressionFormattingVisitor(this);
		this.rewriter = new FStringRewriter(this);
	}

	/**
	 * Renders node on a single line, for messages.
	 */
	public static String format(PyNode node) {
		LayoutWriter out = new LayoutWriter(new StringWriter());
		try (LayoutWriter.Capture capture = out.capture()) {
			new PyNodeFormattingVisitor(out, new RenderState()).render(node);
			return capture.getText();
		} catch (IOException | RenderException e) {
			return node.describe();
		}
	}

	LayoutWriter getWriter() {
		return out;
	}

	RenderState getState() {
		return state;
	}

	FStringRewriter getRewriter() {
		return rewriter;
	}

	void markElif(PyIf pyIf) {
		elifs.add(pyIf);
	}

	boolean isElif(PyIf pyIf) {
		return pyIf.isElif() || elifs.contains(pyIf);
	}

	public void render(PyNode node) throws IOException {
		if (node == null) {
			throw new RenderException("missing child node");
		}
		try {
			node.accept(this);
		} catch (RenderException e) {
			throw e.within(node);
		} catch (IOException | RuntimeException e) {
			throw new RenderException(e).within(node);
		}
	}

	/**
	 * Renders node in a context that binds at level.
	 */
	public void render(PyNode node, int level) throws IOException {
		try (RenderState.Scope ignored = state.level(level)) {
			render(node);
		}
	}

	void renderAll(List<? extends PyNode> nodes) throws IOException {
		for (PyNode node : nodes) {
			render(node);
		}
	}

	void renderCommaSeparated(List<? extends PyNode> nodes) throws IOException {
		FormattingTools.writeCommaSeparated(out, nodes, this::render);
	}

	/**
	 * Writes an infix operator, spaced out when it has no recorded position.
	 */
	void operator(String symbol, SourceLocation location) throws IOException {
		if (location == null || location.isUnknown()) {
			out.emit(" " + symbol + " ");
		} else {
			out.place(symbol, location);
		}
	}

	/**
	 * Writes a keyword at its recorded position, or wherever the source continues with it.
	 */
	void word(String keyword, SourceLocation location) throws IOException {
		if (location == null || location.isUnknown()) {
			out.keyword(keyword);
		} else {
			out.place(keyword, location);
		}
	}

	/**
	 * The generic fallback: the node's source text as it is, or a description of the node when it has none.
	 */
	void verbatim(PyNode node) throws IOException {
		String text = out.sourceSlice(node.getLocation());
		if (text == null) {
			out.emit("<" + node.describe() + ">");
			return;
		}
		out.placeVerbatim(text, node.getLocation());
	}

	@Override
	public Void visit(PyModule module) throws IOException {
		renderAll(module.getBody());
		return null;
	}

	@Override
	public Void visit(PyStatement statement) throws IOException {
		SourceLocation location = statement.getLocation();
		if ((location == null || location.isUnknown()) && !out.isCapturing() && out.getColumn() > 0) {
			// a built statement without a position starts a line of its own
			out.emit("\n");
		}
		statement.accept(statements);
		return null;
	}

	@Override
	public Void visit(PyExpression expression) throws IOException {
		expression.accept(expressions);
		return null;
	}

	private boolean comma(boolean first) throws IOException {
		if (!first) {
			out.token(",", ", ");
		}
		return false;
	}

	@Override
	public Void visit(PyArguments arguments) throws IOException {
		boolean first = true;
		for (PyArgument argument : arguments.getPositional()) {
			first = comma(first);
			render(argument);
		}
		if (arguments.getVararg() != null) {
			first = comma(first);
			out.place("*", arguments.getVararg().getLocation());
			render(arguments.getVararg());
		} else if (arguments.hasBareStar()) {
			first = comma(first);
			out.place("*", arguments.getBareStarLocation());
		}
		for (PyArgument argument : arguments.getKeywordOnly()) {
			first = comma(first);
			render(argument);
		}
		if (arguments.getKwarg() != null) {
			comma(first);
			out.place("**", arguments.getKwarg().getLocation());
			render(arguments.getKwarg());
		}
		if (arguments.isTrailingComma()) {
			out.token(",");
		}
		return null;
	}

	@Override
	public Void visit(PyArgument argument) throws IOException {
		out.place(argument.getName(), argument.getNameLocation());
		if (argument.getAnnotation() != null) {
			out.token(":", ": ");
			render(argument.getAnnotation());
		}
		if (argument.getDefaultValue() != null) {
			out.place("=", argument.getEqualsLocation());
			render(argument.getDefaultValue());
		}
		return null;
	}

	@Override
	public Void visit(PyKeyword keyword) throws IOException {
		if (keyword.getName() == null) {
			out.place("**", keyword.getLocation());
			render(keyword.getValue(), PyPrecedence.BIT_OR);
			return null;
		}
		out.place(keyword.getName(), keyword.getLocation());
		out.token("=");
		render(keyword.getValue());
		return null;
	}

	@Override
	public Void visit(PyAlias alias) throws IOException {
		out.place(alias.getName(), alias.getLocation());
		if (alias.getAsName() != null) {
			out.keyword("as");
			out.place(alias.getAsName(), alias.getAsNameLocation());
		}
		return null;
	}

	@Override
	public Void visit(PyWithItem withItem) throws IOException {
		render(withItem.getContext());
		if (withItem.getOptionalVars() != null) {
			out.keyword("as");
			render(withItem.getOptionalVars());
		}
		return null;
	}

	@Override
	public Void visit(PyExceptHandler exceptHandler) throws IOException {
		out.place("except", exceptHandler.getLocation());
		if (exceptHandler.getType() != null) {
			render(exceptHandler.getType());
			if (exceptHandler.getName() != null) {
				out.keyword("as");
				out.place(exceptHandler.getName(), exceptHandler.getNameLocation());
			}
		}
		statements.block(exceptHandler.getBody());
		return null;
	}

	@Override
	public Void visit(PyComprehensionClause comprehensionClause) throws IOException {
		verbatim(comprehensionClause);
		return null;
	}

	@Override
	public Void visit(PyDecorator decorator) throws IOException {
		out.place("@", decorator.getLocation());
		render(decorator.getExpression());
		return null;
	}

}
