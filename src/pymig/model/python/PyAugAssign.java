package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.Objects;

/**
 * AST node:
 *
 * target op= value
 */
public class PyAugAssign extends PyStatement {

	private final PyExpression target;
	private final PyBinOp.Operation operation;
	private final SourceLocation operatorLocation;
	private final PyExpression value;

	public PyAugAssign(SourceLocation location, PyExpression target, PyBinOp.Operation operation, SourceLocation operatorLocation, PyExpression value) {
		super(location);
		this.target = target;
		this.operation = operation;
		this.operatorLocation = operatorLocation;
		this.value = value;
	}

	public PyExpression getTarget() {
		return target;
	}

	public PyBinOp.Operation getOperation() {
		return operation;
	}

	public SourceLocation getOperatorLocation() {
		return operatorLocation;
	}

	public PyExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyAugAssign that = (PyAugAssign) o;
		return Objects.equals(target, that.target) &&
				operation == that.operation &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, operation, value);
	}
}
