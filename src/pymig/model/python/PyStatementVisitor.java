package pymig.model.python;

public abstract class PyStatementVisitor<T, E extends Throwable> {
	public abstract T visit(PyFunctionDef functionDef) throws E;
	public abstract T visit(PyClassDef classDef) throws E;
	public abstract T visit(PyReturn pyReturn) throws E;
	public abstract T visit(PyDelete delete) throws E;
	public abstract T visit(PyAssign assign) throws E;
	public abstract T visit(PyAugAssign augAssign) throws E;
	public abstract T visit(PyAnnAssign annAssign) throws E;
	public abstract T visit(PyFor pyFor) throws E;
	public abstract T visit(PyWhile pyWhile) throws E;
	public abstract T visit(PyIf pyIf) throws E;
	public abstract T visit(PyWith with) throws E;
	public abstract T visit(PyRaise raise) throws E;
	public abstract T visit(PyTry pyTry) throws E;
	public abstract T visit(PyAssert pyAssert) throws E;
	public abstract T visit(PyImport pyImport) throws E;
	public abstract T visit(PyImportFrom importFrom) throws E;
	public abstract T visit(PyGlobal global) throws E;
	public abstract T visit(PyExpressionStatement expressionStatement) throws E;
	public abstract T visit(PyPass pass) throws E;
	public abstract T visit(PyBreak pyBreak) throws E;
	public abstract T visit(PyContinue pyContinue) throws E;
}
