package pymig.model.python;

public abstract class PyNodeVisitor<T, E extends Throwable> {
	public abstract T visit(PyModule module) throws E;
	public abstract T visit(PyStatement statement) throws E;
	public abstract T visit(PyExpression expression) throws E;
	public abstract T visit(PyArguments arguments) throws E;
	public abstract T visit(PyArgument argument) throws E;
	public abstract T visit(PyKeyword keyword) throws E;
	public abstract T visit(PyAlias alias) throws E;
	public abstract T visit(PyWithItem withItem) throws E;
	public abstract T visit(PyExceptHandler exceptHandler) throws E;
	public abstract T visit(PyComprehensionClause comprehensionClause) throws E;
	public abstract T visit(PyDecorator decorator) throws E;
}
