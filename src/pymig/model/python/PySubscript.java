package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.Objects;

public class PySubscript extends PyExpression {

	private final PyExpression value;
	private final PyExpression slice;
	private final SourceLocation closeLocation;

	public PySubscript(SourceLocation location, PyExpression value, PyExpression slice, SourceLocation closeLocation) {
		super(location);
		this.value = value;
		this.slice = slice;
		this.closeLocation = closeLocation;
	}

	public PyExpression getValue() {
		return value;
	}

	public PyExpression getSlice() {
		return slice;
	}

	public SourceLocation getCloseLocation() {
		return closeLocation;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PySubscript that = (PySubscript) o;
		return Objects.equals(value, that.value) &&
				Objects.equals(slice, that.slice);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, slice);
	}
}
