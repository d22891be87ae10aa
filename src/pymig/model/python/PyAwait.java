package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.Objects;

public class PyAwait extends PyExpression {

	private final PyExpression value;

	public PyAwait(SourceLocation location, PyExpression value) {
		super(location);
		this.value = value;
	}

	public PyExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyAwait that = (PyAwait) o;
		return Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
