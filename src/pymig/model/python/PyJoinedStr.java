package pymig.model.python;

import pymig.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * An f-string, possibly implicitly concatenated with plain strings.
 */
public class PyJoinedStr extends PyExpression {

	private final List<PyStringPart> parts;

	public PyJoinedStr(SourceLocation location, List<PyStringPart> parts) {
		super(location);
		this.parts = parts;
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
		PyJoinedStr that = (PyJoinedStr) o;
		return Objects.equals(parts, that.parts);
	}

	@Override
	public int hashCode() {
		return Objects.hash(parts);
	}
}
