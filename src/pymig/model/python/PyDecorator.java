package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.Objects;

public class PyDecorator extends PyNode {

	private final PyExpression expression;

	public PyDecorator(SourceLocation location, PyExpression expression) {
		super(location);
		this.expression = expression;
	}

	public PyExpression getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(PyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyDecorator that = (PyDecorator) o;
		return Objects.equals(expression, that.expression);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression);
	}
}
