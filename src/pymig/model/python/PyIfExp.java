package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.Objects;

/**
 * AST node:
 *
 * body if test else orelse
 */
public class PyIfExp extends PyExpression {

	private final PyExpression body;
	private final SourceLocation ifLocation;
	private final PyExpression test;
	private final SourceLocation elseLocation;
	private final PyExpression orelse;

	public PyIfExp(SourceLocation location, PyExpression body, SourceLocation ifLocation, PyExpression test, SourceLocation elseLocation, PyExpression orelse) {
		super(location);
		this.body = body;
		this.ifLocation = ifLocation;
		this.test = test;
		this.elseLocation = elseLocation;
		this.orelse = orelse;
	}

	public PyExpression getBody() {
		return body;
	}

	public SourceLocation getIfLocation() {
		return ifLocation;
	}

	public PyExpression getTest() {
		return test;
	}

	public SourceLocation getElseLocation() {
		return elseLocation;
	}

	public PyExpression getOrelse() {
		return orelse;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyIfExp that = (PyIfExp) o;
		return Objects.equals(body, that.body) &&
				Objects.equals(test, that.test) &&
				Objects.equals(orelse, that.orelse);
	}

	@Override
	public int hashCode() {
		return Objects.hash(body, test, orelse);
	}
}
