package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A (possibly implicitly concatenated) string literal. Keeps both the decoded value and the
 * source spelling of every part.
 */
public class PyStr extends PyExpression {

	private final String value;
	private final List<PyStringPart> parts;

	public PyStr(SourceLocation location, String value, List<PyStringPart> parts) {
		super(location);
		this.value = value;
		this.parts = parts;
	}

	public String getValue() {
		return value;
	}

	public List<PyStringPart> getParts() {
		return parts;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyStr str = (PyStr) o;
		return Objects.equals(value, str.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
