package pymig.model.python;

public abstract class PyExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(PyBoolOp boolOp) throws E;
	public abstract T visit(PyBinOp binOp) throws E;
	public abstract T visit(PyUnaryOp unaryOp) throws E;
	public abstract T visit(PyLambda lambda) throws E;
	public abstract T visit(PyIfExp ifExp) throws E;
	public abstract T visit(PyDict dict) throws E;
	public abstract T visit(PySet set) throws E;
	public abstract T visit(PyComprehension comprehension) throws E;
	public abstract T visit(PyAwait await) throws E;
	public abstract T visit(PyYield yield) throws E;
	public abstract T visit(PyCompare compare) throws E;
	public abstract T visit(PyCall call) throws E;
	public abstract T visit(PyNum num) throws E;
	public abstract T visit(PyStr str) throws E;
	public abstract T visit(PyBytes bytes) throws E;
	public abstract T visit(PyJoinedStr joinedStr) throws E;
	public abstract T visit(PyNameConstant nameConstant) throws E;
	public abstract T visit(PyEllipsis ellipsis) throws E;
	public abstract T visit(PyAttribute attribute) throws E;
	public abstract T visit(PySubscript subscript) throws E;
	public abstract T visit(PySlice slice) throws E;
	public abstract T visit(PyStarred starred) throws E;
	public abstract T visit(PyName name) throws E;
	public abstract T visit(PyList list) throws E;
	public abstract T visit(PyTuple tuple) throws E;
}
