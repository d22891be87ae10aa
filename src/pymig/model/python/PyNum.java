package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.Objects;

/**
 * A number literal, kept in its source spelling.
 */
public class PyNum extends PyExpression {

	private final String text;

	public PyNum(SourceLocation location, String text) {
		super(location);
		this.text = text;
	}

	public String getText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyNum that = (PyNum) o;
		return Objects.equals(text, that.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text);
	}
}
