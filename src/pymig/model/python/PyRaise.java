package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.Objects;

public class PyRaise extends PyStatement {

	private final PyExpression exception;
	private final PyExpression cause;

	public PyRaise(SourceLocation location, PyExpression exception, PyExpression cause) {
		super(location);
		this.exception = exception;
		this.cause = cause;
	}

	public PyExpression getException() {
		return exception;
	}

	public PyExpression getCause() {
		return cause;
	}

	@Override
	public <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyRaise that = (PyRaise) o;
		return Objects.equals(exception, that.exception) &&
				Objects.equals(cause, that.cause);
	}

	@Override
	public int hashCode() {
		return Objects.hash(exception, cause);
	}
}
