package pymig.formatters;

import pymig.model.python.*;
import pymig.util.SourceLocation;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class PyStatementFormattingVisitor extends PyStatementVisitor<Void, IOException> {

	private final PyNodeFormattingVisitor nodes;
	private final LayoutWriter out;

	public PyStatementFormattingVisitor(PyNodeFormattingVisitor nodes) {
		this.nodes = nodes;
		this.out = nodes.getWriter();
	}

	/**
	 * The colon and the statements of a block; each statement lands on its own line and indentation.
	 */
	void block(List<PyStatement> body) throws IOException {
		out.token(":");
		nodes.renderAll(body);
	}

	private void orelse(List<PyStatement> orelse, SourceLocation elseLocation) throws IOException {
		if (orelse.isEmpty()) {
			return;
		}
		nodes.word("else", elseLocation);
		block(orelse);
	}

	@Override
	public Void visit(PyFunctionDef functionDef) throws IOException {
		nodes.renderAll(functionDef.getDecorators());
		out.place("def", functionDef.getLocation());
		out.place(functionDef.getName(), functionDef.getNameLocation());
		out.token("(");
		try (RenderState.Scope ignored = nodes.getState().bracket()) {
			nodes.render(functionDef.getArguments());
		}
		out.place(")", functionDef.getArguments().getCloseLocation());
		if (functionDef.getReturns() != null) {
			nodes.operator("->", functionDef.getArrowLocation());
			nodes.render(functionDef.getReturns());
		}
		block(functionDef.getBody());
		return null;
	}

	@Override
	public Void visit(PyClassDef classDef) throws IOException {
		nodes.renderAll(classDef.getDecorators());
		out.place("class", classDef.getLocation());
		out.place(classDef.getName(), classDef.getNameLocation());
		if (classDef.isParenthesized()) {
			out.token("(");
			try (RenderState.Scope ignored = nodes.getState().bracket()) {
				List<PyNode> bases = new ArrayList<>(classDef.getBases());
				bases.addAll(classDef.getKeywords());
				nodes.renderCommaSeparated(PyExpressionFormattingVisitor.inSourceOrder(bases));
				if (classDef.isTrailingComma()) {
					out.token(",");
				}
			}
			out.place(")", classDef.getCloseLocation());
		}
		block(classDef.getBody());
		return null;
	}

	@Override
	public Void visit(PyReturn pyReturn) throws IOException {
		out.place("return", pyReturn.getLocation());
		if (pyReturn.getValue() != null) {
			nodes.render(pyReturn.getValue());
		}
		return null;
	}

	@Override
	public Void visit(PyDelete delete) throws IOException {
		out.place("del", delete.getLocation());
		nodes.renderCommaSeparated(delete.getTargets());
		return null;
	}

	@Override
	public Void visit(PyAssign assign) throws IOException {
		List<PyExpression> targets = assign.getTargets();
		for (int i = 0; i < targets.size(); i++) {
			nodes.render(targets.get(i));
			nodes.operator("=", PyExpressionFormattingVisitor.locationAt(assign.getEqualsLocations(), i));
		}
		nodes.render(assign.getValue());
		return null;
	}

	@Override
	public Void visit(PyAugAssign augAssign) throws IOException {
		nodes.render(augAssign.getTarget());
		nodes.operator(augAssign.getOperation().getSymbol() + "=", augAssign.getOperatorLocation());
		nodes.render(augAssign.getValue());
		return null;
	}

	@Override
	public Void visit(PyAnnAssign annAssign) throws IOException {
		nodes.verbatim(annAssign);
		return null;
	}

	@Override
	public Void visit(PyFor pyFor) throws IOException {
		out.place("for", pyFor.getLocation());
		nodes.render(pyFor.getTarget());
		nodes.word("in", pyFor.getInLocation());
		nodes.render(pyFor.getIter());
		block(pyFor.getBody());
		orelse(pyFor.getOrelse(), pyFor.getElseLocation());
		return null;
	}

	@Override
	public Void visit(PyWhile pyWhile) throws IOException {
		out.place("while", pyWhile.getLocation());
		nodes.render(pyWhile.getTest());
		block(pyWhile.getBody());
		orelse(pyWhile.getOrelse(), pyWhile.getElseLocation());
		return null;
	}

	@Override
	public Void visit(PyIf pyIf) throws IOException {
		out.place(nodes.isElif(pyIf) ? "elif" : "if", pyIf.getLocation());
		nodes.render(pyIf.getTest());
		block(pyIf.getBody());
		List<PyStatement> orelse = pyIf.getOrelse();
		if (orelse.size() == 1 && orelse.get(0) instanceof PyIf) {
			PyIf nested = (PyIf) orelse.get(0);
			// a lone conditional in the else branch continues the chain
			if (nested.isElif() || pyIf.getElseLocation() == null) {
				nodes.markElif(nested);
				nodes.render(nested);
				return null;
			}
		}
		orelse(orelse, pyIf.getElseLocation());
		return null;
	}

	@Override
	public Void visit(PyWith with) throws IOException {
		out.place("with", with.getLocation());
		nodes.renderCommaSeparated(with.getItems());
		block(with.getBody());
		return null;
	}

	@Override
	public Void visit(PyRaise raise) throws IOException {
		out.place("raise", raise.getLocation());
		if (raise.getException() != null) {
			nodes.render(raise.getException());
			if (raise.getCause() != null) {
				out.keyword("from");
				nodes.render(raise.getCause());
			}
		}
		return null;
	}

	@Override
	public Void visit(PyTry pyTry) throws IOException {
		out.place("try", pyTry.getLocation());
		block(pyTry.getBody());
		nodes.renderAll(pyTry.getHandlers());
		orelse(pyTry.getOrelse(), pyTry.getElseLocation());
		if (!pyTry.getFinalBody().isEmpty()) {
			nodes.word("finally", pyTry.getFinallyLocation());
			block(pyTry.getFinalBody());
		}
		return null;
	}

	@Override
	public Void visit(PyAssert pyAssert) throws IOException {
		out.place("assert", pyAssert.getLocation());
		nodes.render(pyAssert.getTest());
		if (pyAssert.getMessage() != null) {
			out.token(",", ", ");
			nodes.render(pyAssert.getMessage());
		}
		return null;
	}

	@Override
	public Void visit(PyImport pyImport) throws IOException {
		out.place("import", pyImport.getLocation());
		nodes.renderCommaSeparated(pyImport.getNames());
		return null;
	}

	@Override
	public Void visit(PyImportFrom importFrom) throws IOException {
		out.place("from", importFrom.getLocation());
		out.place(importFrom.getModule(), importFrom.getModuleLocation());
		nodes.word("import", importFrom.getImportLocation());
		if (importFrom.isParenthesized()) {
			out.token("(");
		}
		nodes.renderCommaSeparated(importFrom.getNames());
		if (importFrom.isTrailingComma()) {
			out.token(",");
		}
		if (importFrom.isParenthesized()) {
			out.place(")", importFrom.getCloseLocation());
		}
		return null;
	}

	@Override
	public Void visit(PyGlobal global) throws IOException {
		out.place(global.isNonlocal() ? "nonlocal" : "global", global.getLocation());
		nodes.renderCommaSeparated(global.getNames());
		return null;
	}

	@Override
	public Void visit(PyExpressionStatement expressionStatement) throws IOException {
		nodes.render(expressionStatement.getValue());
		return null;
	}

	@Override
	public Void visit(PyPass pass) throws IOException {
		out.place("pass", pass.getLocation());
		return null;
	}

	@Override
	public Void visit(PyBreak pyBreak) throws IOException {
		out.place("break", pyBreak.getLocation());
		return null;
	}

	@Override
	public Void visit(PyContinue pyContinue) throws IOException {
		out.place("continue", pyContinue.getLocation());
		return null;
	}

}
