package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.Objects;

public class PyName extends PyExpression {

	private final String id;

	public PyName(SourceLocation location, String id) {
		super(location);
		this.id = id;
	}

	public String getId() {
		return id;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyName that = (PyName) o;
		return Objects.equals(id, that.id);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id);
	}
}
