package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.Objects;

public class PyYield extends PyExpression {

	private final boolean from;
	private final PyExpression value;

	public PyYield(SourceLocation location, boolean from, PyExpression value) {
		super(location);
		this.from = from;
		this.value = value;
	}

	public boolean isFrom() {
		return from;
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
		PyYield that = (PyYield) o;
		return from == that.from &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(from, value);
	}
}
