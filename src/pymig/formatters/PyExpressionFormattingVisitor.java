package pymig.formatters;

import pymig.model.python.*;
import pymig.util.PyStrings;
import pymig.util.SourceLocation;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class PyExpressionFormattingVisitor extends PyExpressionVisitor<Void, IOException> {

	private final PyNodeFormattingVisitor nodes;
	private final LayoutWriter out;
	private final RenderState state;

	public PyExpressionFormattingVisitor(PyNodeFormattingVisitor nodes) {
		this.nodes = nodes;
		this.out = nodes.getWriter();
		this.state = nodes.getState();
	}

	static SourceLocation locationAt(List<SourceLocation> locations, int index) {
		return index < locations.size() ? locations.get(index) : null;
	}

	/**
	 * Positional and keyword arguments may interleave in the source; when every one has a position they are
	 * written in source order.
	 */
	static <T extends PyNode> List<T> inSourceOrder(List<T> nodes) {
		List<T> ordered = new ArrayList<>(nodes);
		for (T node : ordered) {
			if (node.getLocation() == null || node.getLocation().isUnknown()) {
				return ordered;
			}
		}
		ordered.sort((a, b) -> a.getLocation().compareTo(b.getLocation()));
		return ordered;
	}

	private static boolean spansLines(PyNode first, PyNode last) {
		SourceLocation a = first.getLocation();
		SourceLocation b = last.getLocation();
		return a != null && b != null && !a.isUnknown() && !b.isUnknown() && a.getStartLine() != b.getStartLine();
	}

	private void elements(List<PyExpression> elements, boolean trailingComma) throws IOException {
		nodes.renderCommaSeparated(elements);
		if (trailingComma) {
			out.token(",");
		}
	}

	@Override
	public Void visit(PyBoolOp boolOp) throws IOException {
		int prec = PyPrecedence.of(boolOp.getOperation());
		List<PyExpression> values = boolOp.getValues();
		boolean spansLines = spansLines(values.get(0), values.get(values.size() - 1));
		try (AutoParens ignored = AutoParens.open(out, state, boolOp, prec, spansLines)) {
			for (int i = 0; i < values.size(); i++) {
				if (i > 0) {
					nodes.operator(boolOp.getOperation().getSymbol(), locationAt(boolOp.getOperatorLocations(), i - 1));
				}
				nodes.render(values.get(i), prec);
			}
		}
		return null;
	}

	@Override
	public Void visit(PyBinOp binOp) throws IOException {
		if (nodes.getRewriter().rewrite(binOp)) {
			return null;
		}
		PyBinOp.Operation op = binOp.getOperation();
		boolean spansLines = spansLines(binOp.getLHS(), binOp.getRHS());
		try (AutoParens ignored = AutoParens.open(out, state, binOp, PyPrecedence.of(op), spansLines)) {
			nodes.render(binOp.getLHS(), PyPrecedence.leftOperand(op));
			nodes.operator(op.getSymbol(), binOp.getOperatorLocation());
			nodes.render(binOp.getRHS(), PyPrecedence.rightOperand(op));
		}
		return null;
	}

	@Override
	public Void visit(PyUnaryOp unaryOp) throws IOException {
		PyUnaryOp.Operation op = unaryOp.getOperation();
		try (AutoParens ignored = AutoParens.open(out, state, unaryOp, PyPrecedence.of(op))) {
			out.place(op.getSymbol(), unaryOp.getLocation());
			nodes.render(unaryOp.getOperand(), PyPrecedence.operand(op));
		}
		return null;
	}

	@Override
	public Void visit(PyLambda lambda) throws IOException {
		try (AutoParens ignored = AutoParens.open(out, state, lambda, PyPrecedence.LAMBDA)) {
			out.place("lambda", lambda.getLocation());
			if (!lambda.getArguments().isEmpty()) {
				nodes.render(lambda.getArguments(), PyPrecedence.LAMBDA);
			}
			out.token(":", ": ");
			nodes.render(lambda.getBody(), PyPrecedence.LAMBDA);
		}
		return null;
	}

	@Override
	public Void visit(PyIfExp ifExp) throws IOException {
		boolean spansLines = spansLines(ifExp.getBody(), ifExp.getOrelse());
		try (AutoParens ignored = AutoParens.open(out, state, ifExp, PyPrecedence.CONDITIONAL, spansLines)) {
			nodes.render(ifExp.getBody(), PyPrecedence.OR);
			nodes.word("if", ifExp.getIfLocation());
			nodes.render(ifExp.getTest(), PyPrecedence.OR);
			nodes.word("else", ifExp.getElseLocation());
			nodes.render(ifExp.getOrelse(), PyPrecedence.LAMBDA);
		}
		return null;
	}

	@Override
	public Void visit(PyDict dict) throws IOException {
		out.place("{", dict.getLocation());
		try (RenderState.Scope ignored = state.bracket()) {
			for (int i = 0; i < dict.getValues().size(); i++) {
				if (i > 0) {
					out.token(",", ", ");
				}
				PyExpression key = dict.getKeys().get(i);
				if (key == null) {
					out.place("**", locationAt(dict.getEntryLocations(), i));
					nodes.render(dict.getValues().get(i), PyPrecedence.BIT_OR);
				} else {
					nodes.render(key);
					out.token(":", ": ");
					nodes.render(dict.getValues().get(i));
				}
			}
			if (dict.isTrailingComma()) {
				out.token(",");
			}
		}
		out.place("}", dict.getCloseLocation());
		return null;
	}

	@Override
	public Void visit(PySet set) throws IOException {
		out.place("{", set.getLocation());
		try (RenderState.Scope ignored = state.bracket()) {
			elements(set.getElements(), set.isTrailingComma());
		}
		out.place("}", set.getCloseLocation());
		return null;
	}

	@Override
	public Void visit(PyComprehension comprehension) throws IOException {
		nodes.verbatim(comprehension);
		return null;
	}

	@Override
	public Void visit(PyAwait await) throws IOException {
		nodes.verbatim(await);
		return null;
	}

	@Override
	public Void visit(PyYield yield) throws IOException {
		try (AutoParens ignored = AutoParens.open(out, state, yield, PyPrecedence.LAMBDA)) {
			out.place("yield", yield.getLocation());
			if (yield.isFrom()) {
				out.keyword("from");
			}
			if (yield.getValue() != null) {
				nodes.render(yield.getValue(), RenderState.SENTINEL);
			}
		}
		return null;
	}

	@Override
	public Void visit(PyCompare compare) throws IOException {
		List<PyExpression> comparators = compare.getComparators();
		boolean spansLines = spansLines(compare.getLeft(), comparators.get(comparators.size() - 1));
		int operand = PyPrecedence.COMPARISON + 1;
		try (AutoParens ignored = AutoParens.open(out, state, compare, PyPrecedence.COMPARISON, spansLines)) {
			nodes.render(compare.getLeft(), operand);
			for (int i = 0; i < comparators.size(); i++) {
				nodes.operator(compare.getOperations().get(i).getSymbol(),
						locationAt(compare.getOperatorLocations(), i));
				nodes.render(comparators.get(i), operand);
			}
		}
		return null;
	}

	@Override
	public Void visit(PyCall call) throws IOException {
		nodes.render(call.getFunction(), PyPrecedence.POSTFIX);
		out.place("(", call.getOpenLocation());
		try (RenderState.Scope ignored = state.bracket()) {
			List<PyNode> arguments = new ArrayList<>(call.getArguments());
			arguments.addAll(call.getKeywords());
			nodes.renderCommaSeparated(inSourceOrder(arguments));
			if (call.isTrailingComma()) {
				out.token(",");
			}
		}
		out.place(")", call.getCloseLocation());
		return null;
	}

	@Override
	public Void visit(PyNum num) throws IOException {
		out.place(num.getText(), num.getLocation());
		return null;
	}

	@Override
	public Void visit(PyStr str) throws IOException {
		if (out.isCapturing() || str.getParts().isEmpty()) {
			out.placeVerbatim(PyStrings.quote(str.getValue(), state.quote()), str.getLocation());
			return null;
		}
		parts(str, str.getParts());
		return null;
	}

	private void parts(PyExpression literal, List<PyStringPart> parts) throws IOException {
		boolean spansLines = parts.size() > 1 && parts.get(0).getLocation().getStartLine()
				!= parts.get(parts.size() - 1).getLocation().getStartLine();
		try (AutoParens ignored = AutoParens.open(out, state, literal, PyPrecedence.DISPLAY, spansLines)) {
			for (PyStringPart part : parts) {
				out.place(part.getText(), part.getLocation());
			}
		}
	}

	@Override
	public Void visit(PyBytes bytes) throws IOException {
		parts(bytes, bytes.getParts());
		return null;
	}

	@Override
	public Void visit(PyJoinedStr joinedStr) throws IOException {
		parts(joinedStr, joinedStr.getParts());
		return null;
	}

	@Override
	public Void visit(PyNameConstant nameConstant) throws IOException {
		out.place(nameConstant.getValue().getKeyword(), nameConstant.getLocation());
		return null;
	}

	@Override
	public Void visit(PyEllipsis ellipsis) throws IOException {
		out.place("...", ellipsis.getLocation());
		return null;
	}

	@Override
	public Void visit(PyAttribute attribute) throws IOException {
		nodes.render(attribute.getValue(), PyPrecedence.POSTFIX);
		out.token(".");
		out.place(attribute.getAttribute(), attribute.getAttributeLocation());
		return null;
	}

	@Override
	public Void visit(PySubscript subscript) throws IOException {
		nodes.render(subscript.getValue(), PyPrecedence.POSTFIX);
		out.token("[");
		try (RenderState.Scope ignored = state.bracket()) {
			PyExpression slice = subscript.getSlice();
			if (slice instanceof PyTuple && !((PyTuple) slice).isParenthesized()) {
				// x[a:b, c] indexes with a tuple written without parentheses
				PyTuple index = (PyTuple) slice;
				elements(index.getElements(), index.isTrailingComma() || index.getElements().size() == 1);
			} else {
				nodes.render(slice);
			}
		}
		out.place("]", subscript.getCloseLocation());
		return null;
	}

	@Override
	public Void visit(PySlice slice) throws IOException {
		if (slice.getLower() != null) {
			nodes.render(slice.getLower());
		}
		out.token(":");
		if (slice.getUpper() != null) {
			nodes.render(slice.getUpper());
		}
		if (slice.isStepColon()) {
			out.token(":");
			if (slice.getStep() != null) {
				nodes.render(slice.getStep());
			}
		}
		return null;
	}

	@Override
	public Void visit(PyStarred starred) throws IOException {
		out.place("*", starred.getLocation());
		nodes.render(starred.getValue(), PyPrecedence.BIT_OR);
		return null;
	}

	@Override
	public Void visit(PyName name) throws IOException {
		out.place(name.getId(), name.getLocation());
		return null;
	}

	@Override
	public Void visit(PyList list) throws IOException {
		out.place("[", list.getLocation());
		try (RenderState.Scope ignored = state.bracket()) {
			elements(list.getElements(), list.isTrailingComma());
		}
		out.place("]", list.getCloseLocation());
		return null;
	}

	@Override
	public Void visit(PyTuple tuple) throws IOException {
		boolean trailingComma = tuple.isTrailingComma() || tuple.getElements().size() == 1;
		if (tuple.isParenthesized()) {
			out.place("(", tuple.getLocation());
			try (RenderState.Scope ignored = state.bracket()) {
				elements(tuple.getElements(), trailingComma);
			}
			out.place(")", tuple.getCloseLocation());
			return null;
		}
		try (AutoParens ignored = AutoParens.open(out, state, tuple, RenderState.SENTINEL)) {
			elements(tuple.getElements(), trailingComma);
		}
		return null;
	}

}
