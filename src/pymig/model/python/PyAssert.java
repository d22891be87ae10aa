package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.Objects;

public class PyAssert extends PyStatement {

	private final PyExpression test;
	private final PyExpression message;

	public PyAssert(SourceLocation location, PyExpression test, PyExpression message) {
		super(location);
		this.test = test;
		this.message = message;
	}

	public PyExpression getTest() {
		return test;
	}

	public PyExpression getMessage() {
		return message;
	}

	@Override
	public <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyAssert that = (PyAssert) o;
		return Objects.equals(test, that.test) &&
				Objects.equals(message, that.message);
	}

	@Override
	public int hashCode() {
		return Objects.hash(test, message);
	}
}
