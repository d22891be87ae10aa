package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.Objects;

public class PyLambda extends PyExpression {

	private final PyArguments arguments;
	private final PyExpression body;

	public PyLambda(SourceLocation location, PyArguments arguments, PyExpression body) {
		super(location);
		this.arguments = arguments;
		this.body = body;
	}

	public PyArguments getArguments() {
		return arguments;
	}

	public PyExpression getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyLambda that = (PyLambda) o;
		return Objects.equals(arguments, that.arguments) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(arguments, body);
	}
}
